package com.depforge.git;

import java.nio.file.Path;

/**
 * One queued {@code git submodule add}.
 *
 * @param url       remote url of the submodule
 * @param root      repository the submodule is added to
 * @param branch    branch to track
 * @param submodule submodule name, also used as its path
 */
public record SubmoduleRequest(String url, Path root, String branch, String submodule) {
}
