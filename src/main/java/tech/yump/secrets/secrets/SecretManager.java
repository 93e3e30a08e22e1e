package tech.yump.secrets.secrets;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Contract shared by every secrets backend.
 * Callers treat implementations polymorphically; which one is active is decided by configuration.
 */
public interface SecretManager {

    SecretsManagerType type();

    /**
     * Creates a secret.
     *
     * @param value   The secret value. For the readonly vault manager these are {@code path#key} references.
     * @param name    Human-readable name.
     * @param forceDb Store the value directly in the metadata store, bypassing Vault.
     * @return The created record, carrying the caller's value.
     * @throws SecretsManagerException If the backend write fails.
     */
    SecretRecord createSecret(Map<String, Object> value, String name, boolean forceDb) throws SecretsManagerException;

    default SecretRecord createSecret(Map<String, Object> value, String name) throws SecretsManagerException {
        return createSecret(value, name, false);
    }

    /**
     * Reads a secret, resolving its value from the backend when needed.
     *
     * @return The record merged with its value, or empty if no metadata row exists.
     * @throws SecretsManagerException If the backend read fails.
     */
    Optional<SecretRecord> getSecret(UUID id) throws SecretsManagerException;

    /**
     * Replaces a secret's value, keeping its storage mode.
     *
     * @return The updated record, or empty if no metadata row exists.
     */
    Optional<SecretRecord> updateSecret(UUID id, Map<String, Object> value) throws SecretsManagerException;

    /**
     * Deletes a secret.
     *
     * @return {@code true} if a metadata row was deleted, {@code false} if none existed.
     */
    boolean deleteSecret(UUID id) throws SecretsManagerException;

    default boolean removeSecret(UUID id) throws SecretsManagerException {
        return deleteSecret(id);
    }

    SecretsConnectivityResult checkConnectivity() throws SecretsManagerException;

    SecretsManagerDebugInfo getUserVisibleDebugInfo();
}
