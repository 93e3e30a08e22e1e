package tech.yump.secrets.vault.auth;

import tech.yump.secrets.secrets.SecretsManagerException;

/**
 * Login to Vault failed. Carries only the generic user-safe message; the cause holds the details.
 */
public class VaultAuthenticationException extends SecretsManagerException {

    public VaultAuthenticationException(Throwable cause) {
        super(500, GENERIC_MESSAGE, cause);
    }
}
