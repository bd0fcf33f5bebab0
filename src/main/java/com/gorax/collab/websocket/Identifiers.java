package com.gorax.collab.websocket;

/**
 * Allow-list checks for identifiers that arrive from clients.
 */
final class Identifiers {

    static final int MAX_ID_LENGTH = 256;

    private Identifiers() {}

    /**
     * Accepts 1 to 256 characters from {@code [A-Za-z0-9_-]}.
     */
    static boolean isValidId(String id) {
        if (id == null || id.isEmpty() || id.length() > MAX_ID_LENGTH) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            char ch = id.charAt(i);
            boolean allowed = (ch >= 'a' && ch <= 'z')
                || (ch >= 'A' && ch <= 'Z')
                || (ch >= '0' && ch <= '9')
                || ch == '-' || ch == '_';
            if (!allowed) {
                return false;
            }
        }
        return true;
    }
}
