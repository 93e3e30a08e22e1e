package tech.yump.secrets.secrets;

/**
 * Discriminator for the configured {@link SecretManager} implementation.
 */
public enum SecretsManagerType {
    DB,
    VAULT,
    READONLY_VAULT
}
