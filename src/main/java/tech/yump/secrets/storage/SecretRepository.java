package tech.yump.secrets.storage;

import tech.yump.secrets.secrets.SecretRecord;

import java.util.Optional;
import java.util.UUID;

/**
 * Metadata store for secret rows. Implementations carry no business rules.
 */
public interface SecretRepository {

    /**
     * Inserts a new row. The {@code id} and timestamps of the draft are ignored and assigned by the store.
     *
     * @param draft name, secret and mode flags of the new row.
     * @return the stored row.
     * @throws StorageException if the insert fails.
     */
    SecretRecord create(SecretRecord draft) throws StorageException;

    Optional<SecretRecord> findById(UUID id) throws StorageException;

    /**
     * Applies an update to an existing row.
     *
     * @return the updated row, or empty if no row with that id exists.
     */
    Optional<SecretRecord> update(UUID id, SecretUpdate update) throws StorageException;

    /**
     * @return {@code true} if a row was deleted.
     */
    boolean delete(UUID id) throws StorageException;
}
