package tech.yump.secrets.vault.auth;

import tech.yump.secrets.vault.VaultConfigurationException;
import tech.yump.secrets.vault.VaultHttpClient;

/**
 * Static token supplied by configuration. No handshake is performed.
 */
public record TokenLogin(String token) implements VaultLoginStrategy {

    public TokenLogin {
        if (token == null || token.isBlank()) {
            throw new VaultConfigurationException("Vault token is required for token authentication.");
        }
    }

    @Override
    public VaultAuthMethod method() {
        return VaultAuthMethod.TOKEN;
    }

    @Override
    public String login(VaultHttpClient httpClient) {
        return token;
    }

    @Override
    public String toString() {
        return "TokenLogin[token=******]";
    }
}
