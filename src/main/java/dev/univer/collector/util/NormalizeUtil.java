package dev.univer.collector.util;

public final class NormalizeUtil {

    public static final char USERNAME_MARKER = '@';

    private NormalizeUtil() {
    }

    /** "durov" and "@durov" both become "@durov"; blank becomes {@code null}. */
    public static String normalizeUsername(String username) {
        if (username == null) return null;
        String trimmed = username.trim();
        if (trimmed.isEmpty() || trimmed.equals(String.valueOf(USERNAME_MARKER))) return null;
        return trimmed.charAt(0) == USERNAME_MARKER ? trimmed : USERNAME_MARKER + trimmed;
    }

    public static String chatLabel(String title, long chatId) {
        return (title == null || title.isBlank()) ? String.valueOf(chatId) : title.trim() + " (" + chatId + ")";
    }

    /** Message of the innermost cause, or the exception type when it has none. */
    public static String describe(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) root = root.getCause();
        String message = root.getMessage();
        return (message == null || message.isBlank()) ? root.getClass().getSimpleName() : message;
    }
}
