package tech.yump.secrets.vault;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.secrets.config.SecretsManagerProperties.VaultProperties;
import tech.yump.secrets.secrets.SecretManager;
import tech.yump.secrets.secrets.SecretRecord;
import tech.yump.secrets.secrets.SecretsConnectivityResult;
import tech.yump.secrets.secrets.SecretsManagerDebugInfo;
import tech.yump.secrets.secrets.SecretsManagerException;
import tech.yump.secrets.secrets.SecretsManagerType;
import tech.yump.secrets.storage.SecretRepository;
import tech.yump.secrets.storage.SecretUpdate;
import tech.yump.secrets.vault.auth.VaultAuthMethod;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Secret manager that writes secret values into Vault and keeps only a metadata row in the database.
 * The value of a record named {@code n} with id {@code i} lives at {@code {secretPath}/n-i},
 * stored as a JSON string under the {@code value} key.
 */
@Slf4j
@RequiredArgsConstructor
public class VaultSecretManager implements SecretManager {

    private static final TypeReference<Map<String, Object>> SECRET_TYPE = new TypeReference<>() {};

    private final SecretRepository repository;
    private final VaultClient vaultClient;
    private final VaultProperties vaultProperties;
    private final ObjectMapper objectMapper;

    @Override
    public SecretsManagerType type() {
        return SecretsManagerType.VAULT;
    }

    @Override
    public SecretRecord createSecret(Map<String, Object> value, String name, boolean forceDb) {
        if (forceDb) {
            log.info("forceDb requested, storing secret '{}' in the database", name);
            return repository.create(SecretRecord.builder().name(name).secret(value).build());
        }

        ensureInitialized("createSecret");

        String sanitizedName = VaultSecretNames.sanitize(name);
        SecretRecord row = repository.create(SecretRecord.builder()
                .name(sanitizedName)
                .secret(Map.of())
                .isVault(true)
                .build());

        String vaultPath = kv().secretPath(row.name(), row.id());
        try {
            String serialized = serialize(value);
            vaultClient.write(vaultPath, kv().buildWritePayload(serialized), "createSecret");
            log.info("Secret created in Vault at {} (kvVersion={})", vaultPath, kv().kvVersion().value());
        } catch (RuntimeException e) {
            try {
                repository.delete(row.id());
                log.warn("Rolled back metadata row {} after failed Vault write", row.id());
            } catch (RuntimeException rollbackError) {
                log.error("Failed to roll back metadata row {} after failed Vault write", row.id(), rollbackError);
                e.addSuppressed(rollbackError);
            }
            throw vaultClient.handleVaultError(e, "createSecret", vaultPath);
        }
        return row.withSecret(value);
    }

    @Override
    public Optional<SecretRecord> getSecret(UUID id) {
        ensureInitialized("getSecret");

        Optional<SecretRecord> found = repository.findById(id);
        if (found.isEmpty() || !found.get().isVault()) {
            return found;
        }
        SecretRecord row = found.get();

        String vaultPath = kv().secretPath(row.name(), id);
        try {
            String stored = kv().extractSecretValue(vaultClient.read(vaultPath, "getSecret"));
            Map<String, Object> value = objectMapper.readValue(stored, SECRET_TYPE);
            log.info("Secret retrieved from Vault at {} (kvVersion={})", vaultPath, kv().kvVersion().value());
            return Optional.of(row.withSecret(value));
        } catch (JsonProcessingException e) {
            throw vaultClient.handleVaultError(new IllegalStateException("Stored secret value is not valid JSON", e),
                    "getSecret", vaultPath);
        } catch (RuntimeException e) {
            throw vaultClient.handleVaultError(e, "getSecret", vaultPath);
        }
    }

    /**
     * Vault is written first and the row is touched afterwards. If the row update fails the new value
     * is already durable in Vault; nothing is compensated.
     */
    @Override
    public Optional<SecretRecord> updateSecret(UUID id, Map<String, Object> value) {
        ensureInitialized("updateSecret");

        Optional<SecretRecord> found = repository.findById(id);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        SecretRecord row = found.get();
        if (!row.isVault()) {
            return repository.update(id, SecretUpdate.value(value));
        }

        String vaultPath = kv().secretPath(row.name(), id);
        try {
            vaultClient.write(vaultPath, kv().buildWritePayload(serialize(value)), "updateSecret");
            log.info("Secret updated in Vault at {} (kvVersion={})", vaultPath, kv().kvVersion().value());
        } catch (RuntimeException e) {
            throw vaultClient.handleVaultError(e, "updateSecret", vaultPath);
        }

        Optional<SecretRecord> updated;
        try {
            updated = repository.update(id, SecretUpdate.value(Map.of()));
        } catch (RuntimeException e) {
            log.error("Vault value at {} was updated but the metadata row {} could not be touched", vaultPath, id, e);
            throw SecretsManagerException.generic(e);
        }
        return updated.map(r -> r.withSecret(value));
    }

    @Override
    public boolean deleteSecret(UUID id) {
        ensureInitialized("deleteSecret");

        Optional<SecretRecord> found = repository.findById(id);
        if (found.isEmpty()) {
            return false;
        }
        SecretRecord row = found.get();

        if (row.isVault()) {
            // v2 deletes the metadata path, which removes every version
            String deletePath = kv().metadataPath(row.name(), id);
            try {
                vaultClient.delete(deletePath, "deleteSecret");
                log.info("Secret {} in Vault at {} (kvVersion={})",
                        kv().kvVersion() == KvVersion.V1 ? "deleted" : "permanently deleted",
                        deletePath, kv().kvVersion().value());
            } catch (RuntimeException e) {
                throw vaultClient.handleVaultError(e, "deleteSecret", deletePath);
            }
        }
        return repository.delete(id);
    }

    @Override
    public SecretsConnectivityResult checkConnectivity() {
        ensureInitialized("checkConnectivity");

        String listBasePath = kv().listBasePath();
        try {
            List<String> keys = vaultClient.list(listBasePath, "checkConnectivity");
            return new SecretsConnectivityResult(keys.size());
        } catch (VaultResponseException e) {
            if (e.isNotFound()) {
                log.info("Vault path {} not found, no secrets exist yet (kvVersion={})",
                        listBasePath, kv().kvVersion().value());
                return new SecretsConnectivityResult(0);
            }
            throw vaultClient.handleVaultError(e, "checkConnectivity", listBasePath);
        } catch (RuntimeException e) {
            throw vaultClient.handleVaultError(e, "checkConnectivity", listBasePath);
        }
    }

    @Override
    public SecretsManagerDebugInfo getUserVisibleDebugInfo() {
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put("KV Version", kv().kvVersion().value());
        meta.put("Secret Path", kv().basePath());
        if (vaultProperties.authMethod() == VaultAuthMethod.KUBERNETES) {
            meta.put("Kubernetes Token Path", vaultProperties.kubernetes().tokenPath());
            meta.put("Kubernetes Mount Point", vaultProperties.kubernetes().mountPoint());
        }
        if (kv().kvVersion() == KvVersion.V2) {
            meta.put("Metadata Path", kv().listBasePath());
        }
        return new SecretsManagerDebugInfo(type(), meta);
    }

    private void ensureInitialized(String operationName) {
        try {
            vaultClient.authenticator().ensureInitialized();
        } catch (RuntimeException e) {
            throw vaultClient.handleVaultError(e, operationName, kv().basePath());
        }
    }

    private String serialize(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Secret value cannot be serialized to JSON", e);
        }
    }

    private KvAdapter kv() {
        return vaultClient.kvAdapter();
    }
}
