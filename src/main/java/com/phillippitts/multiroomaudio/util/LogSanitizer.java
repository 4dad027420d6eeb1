package com.phillippitts.multiroomaudio.util;

import java.util.List;

/** Helpers for keeping process output and command lines readable in logs and messages. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Keeps the last {@code max} characters of the input, collapsed to a single line;
     * returns "" for null. Process failures usually explain themselves at the end of their output.
     */
    public static String tail(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String oneLine = s.strip().replaceAll("\\s*\\R\\s*", " | ");
        return oneLine.length() <= max ? oneLine : oneLine.substring(oneLine.length() - max);
    }

    /** Joins a command line for logging. */
    public static String command(List<String> argv) {
        return argv == null ? "" : String.join(" ", argv);
    }
}
