package tech.yump.secrets.vault;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import tech.yump.secrets.secrets.SecretsManagerException;
import tech.yump.secrets.vault.auth.VaultAuthenticationException;
import tech.yump.secrets.vault.auth.VaultAuthenticator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared Vault capability used by both Vault-backed secret managers.
 * Combines the HTTP client, the authenticator and the KV adapter, and runs every call through
 * {@link #executeWithReauth(VaultOperation, String)}.
 */
@Slf4j
public class VaultClient {

    private final VaultHttpClient httpClient;
    private final VaultAuthenticator authenticator;
    private final KvAdapter kvAdapter;

    public VaultClient(VaultHttpClient httpClient, VaultAuthenticator authenticator, KvAdapter kvAdapter) {
        this.httpClient = httpClient;
        this.authenticator = authenticator;
        this.kvAdapter = kvAdapter;
    }

    public KvAdapter kvAdapter() {
        return kvAdapter;
    }

    public VaultAuthenticator authenticator() {
        return authenticator;
    }

    /**
     * Runs {@code operation} with the current token, logging in first if necessary.
     * When the login strategy supports token refresh and Vault answers with a 4xx (408 timeouts included),
     * the token is refreshed and the operation is retried exactly once. A second failure propagates.
     *
     * @throws VaultAuthenticationException if a login fails.
     * @throws VaultResponseException if the operation fails and is not retried, or fails again.
     */
    public <T> T executeWithReauth(VaultOperation<T> operation, String operationName) {
        String token = authenticator.ensureInitialized();
        try {
            return operation.execute(token);
        } catch (VaultResponseException e) {
            if (!authenticator.supportsTokenRefresh() || !e.isClientError()) {
                throw e;
            }
            log.info("Vault returned {} during '{}' with {} auth, re-authenticating",
                    e.getStatusCode(), operationName, authenticator.method());
            String refreshed;
            try {
                refreshed = authenticator.reauthenticate(token);
            } catch (VaultAuthenticationException authError) {
                log.error("Re-authentication failed after {} during '{}'", e.getStatusCode(), operationName);
                throw authError;
            }
            return operation.execute(refreshed);
        }
    }

    public JsonNode read(String path, String operationName) {
        return executeWithReauth(token -> httpClient.read(path, token), operationName);
    }

    public JsonNode write(String path, JsonNode body, String operationName) {
        return executeWithReauth(token -> httpClient.write(path, body, token), operationName);
    }

    public void delete(String path, String operationName) {
        executeWithReauth(token -> {
            httpClient.delete(path, token);
            return null;
        }, operationName);
    }

    /**
     * @return the keys under {@code path}, including folder entries ending in {@code /}.
     */
    public List<String> list(String path, String operationName) {
        JsonNode response = executeWithReauth(token -> httpClient.list(path, token), operationName);
        List<String> keys = new ArrayList<>();
        response.path("data").path("keys").forEach(key -> keys.add(key.asText()));
        return keys;
    }

    /**
     * Reads every key stored at a Vault path.
     *
     * @throws SecretsManagerException if the read fails.
     */
    public Map<String, String> getSecretFromPath(String vaultPath) {
        log.debug("Fetching secret from Vault path {}", vaultPath);
        try {
            Map<String, String> data = kvAdapter.extractSecretData(read(vaultPath, "getSecretFromPath"));
            log.info("Secret retrieved from Vault path {} (kvVersion={})", vaultPath, kvAdapter.kvVersion().value());
            return data;
        } catch (RuntimeException e) {
            throw handleVaultError(e, "getSecretFromPath", vaultPath);
        }
    }

    /**
     * Lists the secrets directly under a folder. Sub-folders are skipped; a missing folder is empty.
     *
     * @throws SecretsManagerException if the listing fails for any other reason.
     */
    public List<VaultSecretListItem> listSecretsInFolder(String folderPath) {
        log.debug("Listing secrets in Vault folder {}", folderPath);
        List<String> keys;
        try {
            keys = list(kvAdapter.listPath(folderPath), "listSecretsInFolder");
        } catch (VaultResponseException e) {
            if (e.isNotFound()) {
                log.debug("Vault folder {} is empty or does not exist", folderPath);
                return List.of();
            }
            throw handleVaultError(e, "listSecretsInFolder", folderPath);
        } catch (RuntimeException e) {
            throw handleVaultError(e, "listSecretsInFolder", folderPath);
        }

        String normalizedFolder = folderPath.replaceAll("/+$", "");
        List<VaultSecretListItem> items = keys.stream()
                .filter(key -> !key.endsWith("/"))
                .map(key -> new VaultSecretListItem(key, normalizedFolder + "/" + key))
                .toList();
        log.info("Listed {} secrets in Vault folder {}", items.size(), folderPath);
        return items;
    }

    /**
     * Probes a folder. Failures are reported in the result rather than thrown.
     */
    public VaultFolderConnectivityResult checkFolderConnectivity(String folderPath) {
        try {
            authenticator.ensureInitialized();
        } catch (VaultAuthenticationException e) {
            return VaultFolderConnectivityResult.failed("Authentication failed: " + describe(e.getCause()));
        }

        try {
            long count = list(kvAdapter.listPath(folderPath), "checkFolderConnectivity").stream()
                    .filter(key -> !key.endsWith("/"))
                    .count();
            log.info("Vault folder {} reachable, {} secrets", folderPath, count);
            return VaultFolderConnectivityResult.connected((int) count);
        } catch (VaultResponseException e) {
            if (e.isNotFound()) {
                log.info("Vault folder {} reachable (empty)", folderPath);
                return VaultFolderConnectivityResult.connected(0);
            }
            log.warn("Vault folder {} connectivity check failed: {} {}", folderPath, e.getStatusCode(), e.getVaultErrors());
            return VaultFolderConnectivityResult.failed(describe(e));
        } catch (VaultAuthenticationException e) {
            log.warn("Vault folder {} connectivity check failed during re-authentication", folderPath);
            return VaultFolderConnectivityResult.failed("Authentication failed: " + describe(e.getCause()));
        } catch (RuntimeException e) {
            log.error("Vault folder {} connectivity check failed unexpectedly", folderPath, e);
            return VaultFolderConnectivityResult.failed("Unable to reach Vault");
        }
    }

    /**
     * Logs a failed call with its context and converts it into the user-safe error.
     * Errors that already are {@link SecretsManagerException} pass through unchanged.
     */
    public SecretsManagerException handleVaultError(RuntimeException error, String operationName, String path) {
        if (error instanceof VaultResponseException vaultError) {
            log.error("Vault operation '{}' failed (path={}, kvVersion={}, status={}, errors={})",
                    operationName, path, kvAdapter.kvVersion().value(), vaultError.getStatusCode(),
                    vaultError.getVaultErrors(), vaultError);
        } else {
            log.error("Vault operation '{}' failed (path={}, kvVersion={}): {}",
                    operationName, path, kvAdapter.kvVersion().value(), error.getMessage(), error);
        }
        if (error instanceof SecretsManagerException secretsError) {
            return secretsError;
        }
        return SecretsManagerException.generic(error);
    }

    // Status-level description only; Vault's error body stays in the logs.
    private static String describe(Throwable error) {
        if (error instanceof VaultResponseException vaultError) {
            return switch (vaultError.getStatusCode()) {
                case 403 -> "Permission denied";
                case 408 -> "Request to Vault timed out";
                case 503 -> "Vault is unavailable";
                default -> "Vault returned status " + vaultError.getStatusCode();
            };
        }
        return "Unable to authenticate with Vault";
    }
}
