package com.depforge.core.task;

/**
 * What a task should delete before it runs again.
 */
public enum CleanFlag {
    /** Delete the source checkout so it is cloned again. */
    RECLONE,
    /** Delete build output so it is built again. */
    REBUILD
}
