package com.flowo.live.core.upstream;

/**
 * Masks upstream identifiers before they reach the logs. Passwords and tokens are never logged at all.
 */
public final class CredentialMask {

    private CredentialMask() {
    }

    /**
     * Example: "admin" becomes "a***n".
     */
    public static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
