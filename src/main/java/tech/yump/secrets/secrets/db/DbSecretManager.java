package tech.yump.secrets.secrets.db;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.secrets.secrets.SecretManager;
import tech.yump.secrets.secrets.SecretRecord;
import tech.yump.secrets.secrets.SecretsConnectivityResult;
import tech.yump.secrets.secrets.SecretsManagerDebugInfo;
import tech.yump.secrets.secrets.SecretsManagerException;
import tech.yump.secrets.secrets.SecretsManagerType;
import tech.yump.secrets.storage.SecretRepository;
import tech.yump.secrets.storage.SecretUpdate;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Default manager: values are stored directly in the metadata row.
 */
@Slf4j
@RequiredArgsConstructor
public class DbSecretManager implements SecretManager {

    private final SecretRepository repository;

    @Override
    public SecretsManagerType type() {
        return SecretsManagerType.DB;
    }

    @Override
    public SecretRecord createSecret(Map<String, Object> value, String name, boolean forceDb) {
        SecretRecord created = repository.create(SecretRecord.builder().name(name).secret(value).build());
        log.debug("Created database secret {}", created.id());
        return created;
    }

    @Override
    public Optional<SecretRecord> getSecret(UUID id) {
        return repository.findById(id);
    }

    @Override
    public Optional<SecretRecord> updateSecret(UUID id, Map<String, Object> value) {
        return repository.update(id, SecretUpdate.value(value));
    }

    @Override
    public boolean deleteSecret(UUID id) {
        return repository.delete(id);
    }

    @Override
    public SecretsConnectivityResult checkConnectivity() {
        throw new SecretsManagerException(501, "Connectivity check is only available for Vault-backed secrets managers.");
    }

    @Override
    public SecretsManagerDebugInfo getUserVisibleDebugInfo() {
        return new SecretsManagerDebugInfo(type(), Map.of());
    }
}
