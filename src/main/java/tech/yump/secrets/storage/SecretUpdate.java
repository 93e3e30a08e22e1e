package tech.yump.secrets.storage;

import java.util.Map;

/**
 * Partial update applied to a metadata row.
 *
 * @param secret     The new {@code secret} column content.
 * @param byosVault  New value for the readonly vault flag, or {@code null} to leave it unchanged.
 */
public record SecretUpdate(Map<String, Object> secret, Boolean byosVault) {

    public SecretUpdate {
        if (secret == null) {
            throw new IllegalArgumentException("secret must not be null");
        }
    }

    public static SecretUpdate value(Map<String, Object> secret) {
        return new SecretUpdate(secret, null);
    }

    public static SecretUpdate byosReferences(Map<String, Object> references) {
        return new SecretUpdate(references, Boolean.TRUE);
    }
}
