package com.example.contextrag.controller.exception;

public final class ExceptionHelper {

    private ExceptionHelper() {
    }

    /**
     * Innermost frame of the root cause as {@code class:line}.
     */
    public static String getTrace(Throwable ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        StackTraceElement[] st = root.getStackTrace();
        if (st != null && st.length > 0) {
            StackTraceElement e = st[0];
            return e.getClassName() + ":" + e.getLineNumber();
        }
        return null;
    }
}
