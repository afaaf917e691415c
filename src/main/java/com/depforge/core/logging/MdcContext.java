package com.depforge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Depforge-specific MDC keys so that log lines are attributed to
 * the task and tool that produced them.
 */
public final class MdcContext {

    public static final String TASK = "task";
    public static final String TOOL = "tool";

    private MdcContext() {}

    /**
     * Restores the previous value of an MDC key when closed.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    public static Scope withTask(String taskName) {
        return with(TASK, taskName);
    }

    public static Scope withTool(String toolName) {
        return with(TOOL, toolName);
    }

    public static void setTask(String taskName) {
        MDC.put(TASK, taskName);
    }

    public static void clear() {
        MDC.remove(TASK);
        MDC.remove(TOOL);
    }

    private static Scope with(String key, String value) {
        String previous = MDC.get(key);
        MDC.put(key, value);
        return () -> {
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        };
    }
}
