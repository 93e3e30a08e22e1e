package tech.yump.secrets.vault;

/**
 * A Vault call parameterized by the token to send.
 */
@FunctionalInterface
public interface VaultOperation<T> {

    T execute(String token);
}
