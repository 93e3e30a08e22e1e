package tech.yump.secrets.vault;

/**
 * A pointer to one key of a secret in a customer-owned Vault folder, written as {@code path#key}.
 */
public record VaultReference(String path, String key) {

    private static final char SEPARATOR = '#';

    /**
     * Splits on the first {@code #}. Any further {@code #} characters belong to the key.
     *
     * @throws VaultReferenceException if the separator is missing or either half is blank.
     */
    public static VaultReference parse(String reference) {
        if (reference == null) {
            throw new VaultReferenceException("Vault reference must not be null");
        }
        int idx = reference.indexOf(SEPARATOR);
        if (idx < 0) {
            throw new VaultReferenceException("Invalid vault reference format. Expected 'path#key'.");
        }
        String path = reference.substring(0, idx).trim();
        String key = reference.substring(idx + 1).trim();
        if (path.isEmpty() || key.isEmpty()) {
            throw new VaultReferenceException("Invalid vault reference format. Both path and key are required.");
        }
        return new VaultReference(path, key);
    }

    @Override
    public String toString() {
        return path + SEPARATOR + key;
    }
}
