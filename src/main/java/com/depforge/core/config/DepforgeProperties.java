package com.depforge.core.config;

import com.depforge.core.task.CleanFlag;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "depforge")
public class DepforgeProperties {

    private Git git = new Git();
    private Global global = new Global();
    private Set<CleanFlag> clean = EnumSet.noneOf(CleanFlag.class);
    private List<Source> sources = new ArrayList<>();

    // -- Shortcuts used by the git layer --
    public String getGitBinary() { return git.binary; }
    public String getUrlPattern() { return git.urlPattern; }
    public String getTsExtension() { return git.tsExtension; }

    /**
     * Returns true when deleting a git checkout should skip the uncommitted and
     * stashed change checks.
     */
    public boolean isIgnoreUncommitted() { return global.ignoreUncommitted; }

    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Global getGlobal() { return global; }
    public void setGlobal(Global global) { this.global = global; }
    public Set<CleanFlag> getClean() { return clean; }
    public void setClean(Set<CleanFlag> clean) { this.clean = clean; }
    public List<Source> getSources() { return sources; }
    public void setSources(List<Source> sources) { this.sources = sources; }

    public static class Git {
        private String binary = "git";
        private String urlPattern = "git@github.com:%s/%s";
        private String urlPrefix = "https://github.com/";
        private String tsExtension = ".ts";
        private boolean shallow = false;
        private boolean ignoreTs = false;
        private boolean revertTs = false;
        private String username = "";
        private String email = "";
        private String remoteOrg = "";
        private String remoteKey = "";
        private boolean remoteNoPushUpstream = false;
        private boolean remotePushDefaultOrigin = false;

        public String getBinary() { return binary; }
        public void setBinary(String binary) { this.binary = binary; }
        public String getUrlPattern() { return urlPattern; }
        public void setUrlPattern(String urlPattern) { this.urlPattern = urlPattern; }
        public String getUrlPrefix() { return urlPrefix; }
        public void setUrlPrefix(String urlPrefix) { this.urlPrefix = urlPrefix; }
        public String getTsExtension() { return tsExtension; }
        public void setTsExtension(String tsExtension) { this.tsExtension = tsExtension; }
        public boolean isShallow() { return shallow; }
        public void setShallow(boolean shallow) { this.shallow = shallow; }
        public boolean isIgnoreTs() { return ignoreTs; }
        public void setIgnoreTs(boolean ignoreTs) { this.ignoreTs = ignoreTs; }
        public boolean isRevertTs() { return revertTs; }
        public void setRevertTs(boolean revertTs) { this.revertTs = revertTs; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getEmail() { return email; }
        public void setEmail(String email) { this.email = email; }
        public String getRemoteOrg() { return remoteOrg; }
        public void setRemoteOrg(String remoteOrg) { this.remoteOrg = remoteOrg; }
        public String getRemoteKey() { return remoteKey; }
        public void setRemoteKey(String remoteKey) { this.remoteKey = remoteKey; }
        public boolean isRemoteNoPushUpstream() { return remoteNoPushUpstream; }
        public void setRemoteNoPushUpstream(boolean remoteNoPushUpstream) { this.remoteNoPushUpstream = remoteNoPushUpstream; }
        public boolean isRemotePushDefaultOrigin() { return remotePushDefaultOrigin; }
        public void setRemotePushDefaultOrigin(boolean remotePushDefaultOrigin) { this.remotePushDefaultOrigin = remotePushDefaultOrigin; }
    }

    public static class Global {
        private boolean ignoreUncommitted = false;

        public boolean isIgnoreUncommitted() { return ignoreUncommitted; }
        public void setIgnoreUncommitted(boolean ignoreUncommitted) { this.ignoreUncommitted = ignoreUncommitted; }
    }

    /**
     * A repository checked out by a source task. Either {@code url} or both
     * {@code org} and {@code repo} must be set.
     */
    public static class Source {
        private String name;
        private String org = "";
        private String repo = "";
        private String url = "";
        private String branch = "master";
        private String path;
        private String buildPath = "";
        private boolean prebuilt = false;
        private List<Submodule> submodules = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getOrg() { return org; }
        public void setOrg(String org) { this.org = org; }
        public String getRepo() { return repo; }
        public void setRepo(String repo) { this.repo = repo; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getBranch() { return branch; }
        public void setBranch(String branch) { this.branch = branch; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public String getBuildPath() { return buildPath; }
        public void setBuildPath(String buildPath) { this.buildPath = buildPath; }
        public boolean isPrebuilt() { return prebuilt; }
        public void setPrebuilt(boolean prebuilt) { this.prebuilt = prebuilt; }
        public List<Submodule> getSubmodules() { return submodules; }
        public void setSubmodules(List<Submodule> submodules) { this.submodules = submodules; }
    }

    public static class Submodule {
        private String name;
        private String org = "";
        private String repo = "";
        private String url = "";
        private String branch = "master";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getOrg() { return org; }
        public void setOrg(String org) { this.org = org; }
        public String getRepo() { return repo; }
        public void setRepo(String repo) { this.repo = repo; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getBranch() { return branch; }
        public void setBranch(String branch) { this.branch = branch; }
    }
}
