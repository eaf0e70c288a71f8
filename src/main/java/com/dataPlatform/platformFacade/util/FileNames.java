package com.dataPlatform.platformFacade.util;

/**
 * Utility class for turning caller-supplied names into safe local file names.
 */
public class FileNames {

    private static final String UNSAFE_CHARS = "<>:\"/\\|?*";
    private static final String FALLBACK_NAME = "unnamed_file";

    /**
     * Replaces path and shell-unsafe characters with '_' and trims leading/trailing
     * spaces and dots.
     *
     * @param fileName Original file name
     * @return Sanitized name, "unnamed_file" if nothing is left
     */
    public static String sanitize(String fileName) {
        if (fileName == null) {
            return FALLBACK_NAME;
        }

        StringBuilder sanitized = new StringBuilder(fileName.length());
        for (char c : fileName.toCharArray()) {
            sanitized.append(UNSAFE_CHARS.indexOf(c) >= 0 ? '_' : c);
        }

        String trimmed = stripEdges(sanitized.toString());
        return trimmed.isEmpty() ? FALLBACK_NAME : trimmed;
    }

    private static String stripEdges(String name) {
        int start = 0;
        int end = name.length();
        while (start < end && isEdgeChar(name.charAt(start))) {
            start++;
        }
        while (end > start && isEdgeChar(name.charAt(end - 1))) {
            end--;
        }
        return name.substring(start, end);
    }

    private static boolean isEdgeChar(char c) {
        return c == ' ' || c == '.';
    }
}
