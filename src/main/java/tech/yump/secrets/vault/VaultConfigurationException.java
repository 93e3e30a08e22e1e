package tech.yump.secrets.vault;

/**
 * Missing or invalid Vault configuration, detected while the client is being wired.
 */
public class VaultConfigurationException extends RuntimeException {

    public VaultConfigurationException(String message) {
        super(message);
    }

    public VaultConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
