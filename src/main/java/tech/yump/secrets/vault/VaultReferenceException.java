package tech.yump.secrets.vault;

/**
 * A {@code path#key} reference that cannot be parsed.
 */
public class VaultReferenceException extends RuntimeException {

    public VaultReferenceException(String message) {
        super(message);
    }
}
