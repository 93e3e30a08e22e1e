package tech.yump.secrets.vault;

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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Secret manager for customer-owned Vault folders ("bring your own secrets").
 * <p>
 * Rows store {@code path#key} references instead of values. References are resolved against Vault on every
 * read. This manager never writes to or deletes from Vault.
 */
@Slf4j
@RequiredArgsConstructor
public class ReadonlyVaultSecretManager implements SecretManager {

    static final String RESOLUTION_FAILED_MESSAGE =
            "Failed to resolve vault secret references. Please verify the paths exist and the service has read access.";
    static final String CONNECTIVITY_NOT_SUPPORTED_MESSAGE =
            "Connectivity check for readonly vault secrets requires team/folder context. "
                    + "Use the vault folder connectivity check instead.";

    private final SecretRepository repository;
    private final VaultClient vaultClient;

    @Override
    public SecretsManagerType type() {
        return SecretsManagerType.READONLY_VAULT;
    }

    /**
     * Stores the references as given. Nothing is written to Vault.
     *
     * @param value   field name to {@code path#key} reference, or literal values when {@code forceDb} is set.
     */
    @Override
    public SecretRecord createSecret(Map<String, Object> value, String name, boolean forceDb) {
        if (forceDb) {
            log.info("forceDb requested, storing {} literal values for '{}' in the database", value.size(), name);
            return repository.create(SecretRecord.builder().name(name).secret(value).build());
        }

        SecretRecord created = repository.create(SecretRecord.builder()
                .name(name)
                .secret(value)
                .isByosVault(true)
                .build());
        log.info("Created readonly vault secret {} with {} references", created.id(), value.size());
        return created;
    }

    @Override
    public Optional<SecretRecord> getSecret(UUID id) {
        Optional<SecretRecord> found = repository.findById(id);
        if (found.isEmpty() || !found.get().isByosVault() || found.get().secret().isEmpty()) {
            return found;
        }
        SecretRecord row = found.get();
        log.debug("Resolving {} vault references for secret {}", row.secret().size(), id);

        try {
            vaultClient.authenticator().ensureInitialized();
        } catch (RuntimeException e) {
            throw vaultClient.handleVaultError(e, "getSecret", null);
        }

        try {
            Map<String, Object> resolved = resolveReferences(row.secret());
            log.info("Resolved {} vault references for secret {}", resolved.size(), id);
            return Optional.of(row.withSecret(resolved));
        } catch (SecretsManagerException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to resolve vault references for secret {}: {}", id, e.getMessage(), e);
            throw new SecretsManagerException(500, RESOLUTION_FAILED_MESSAGE, e);
        }
    }

    /**
     * Replaces the stored references. The row stays a readonly vault row.
     */
    @Override
    public Optional<SecretRecord> updateSecret(UUID id, Map<String, Object> value) {
        if (repository.findById(id).isEmpty()) {
            return Optional.empty();
        }
        return repository.update(id, SecretUpdate.byosReferences(value));
    }

    /**
     * Deletes the reference row only. The external Vault data is not ours to delete.
     */
    @Override
    public boolean deleteSecret(UUID id) {
        log.info("Deleting readonly vault secret reference {}", id);
        return repository.delete(id);
    }

    @Override
    public SecretsConnectivityResult checkConnectivity() {
        throw new SecretsManagerException(501, CONNECTIVITY_NOT_SUPPORTED_MESSAGE);
    }

    @Override
    public SecretsManagerDebugInfo getUserVisibleDebugInfo() {
        return new SecretsManagerDebugInfo(type(),
                Map.of("description", "External Vault (BYOS - Bring Your Own Secrets)"));
    }

    public List<VaultSecretListItem> listSecretsInFolder(String folderPath) {
        return vaultClient.listSecretsInFolder(folderPath);
    }

    public Map<String, String> getSecretFromPath(String vaultPath) {
        return vaultClient.getSecretFromPath(vaultPath);
    }

    public VaultFolderConnectivityResult checkFolderConnectivity(String folderPath) {
        return vaultClient.checkFolderConnectivity(folderPath);
    }

    // One Vault read per distinct path.
    private Map<String, Object> resolveReferences(Map<String, Object> references) {
        Map<String, List<Map.Entry<String, String>>> keysByPath = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : references.entrySet()) {
            VaultReference ref = VaultReference.parse(entry.getValue() == null ? null : entry.getValue().toString());
            keysByPath.computeIfAbsent(ref.path(), p -> new ArrayList<>())
                    .add(Map.entry(entry.getKey(), ref.key()));
        }

        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, List<Map.Entry<String, String>>> group : keysByPath.entrySet()) {
            String path = group.getKey();
            Map<String, String> data = vaultClient.getSecretFromPath(path);
            for (Map.Entry<String, String> wanted : group.getValue()) {
                String fieldKey = wanted.getKey();
                String vaultKey = wanted.getValue();
                if (data.containsKey(vaultKey)) {
                    resolved.put(fieldKey, data.get(vaultKey));
                } else {
                    log.warn("Vault key '{}' not found at path {} (field '{}')", vaultKey, path, fieldKey);
                }
            }
        }
        return resolved;
    }
}
