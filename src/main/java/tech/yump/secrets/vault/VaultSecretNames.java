package tech.yump.secrets.vault;

import java.util.regex.Pattern;

/**
 * Turns arbitrary secret names into safe Vault path segments.
 */
public final class VaultSecretNames {

    static final int MAX_LENGTH = 64;
    static final String DEFAULT_NAME = "secret";

    private static final Pattern INVALID_CHARS = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern VALID_START = Pattern.compile("^[A-Za-z_]");

    private VaultSecretNames() {
    }

    /**
     * Result matches {@code ^[A-Za-z_][A-Za-z0-9_]*$} and is 1 to 64 characters long.
     */
    public static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return DEFAULT_NAME;
        }
        String sanitized = INVALID_CHARS.matcher(name).replaceAll("_");
        if (!VALID_START.matcher(sanitized).find()) {
            sanitized = "_" + sanitized;
        }
        if (sanitized.length() > MAX_LENGTH) {
            sanitized = sanitized.substring(0, MAX_LENGTH);
        }
        return sanitized;
    }
}
