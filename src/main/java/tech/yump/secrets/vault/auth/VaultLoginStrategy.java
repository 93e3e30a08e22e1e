package tech.yump.secrets.vault.auth;

import tech.yump.secrets.vault.VaultHttpClient;

/**
 * One of the supported ways of obtaining a Vault token.
 */
public sealed interface VaultLoginStrategy permits TokenLogin, KubernetesLogin, AwsIamLogin {

    VaultAuthMethod method();

    /**
     * Performs the login handshake.
     *
     * @return the client token issued by Vault.
     */
    String login(VaultHttpClient httpClient);

    /**
     * Whether a 4xx from Vault should trigger a fresh login and one retry.
     * Only service-account tokens expire under us; static tokens and AWS logins do not refresh.
     */
    default boolean supportsTokenRefresh() {
        return false;
    }
}
