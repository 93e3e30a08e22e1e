package tech.yump.secrets.vault;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Typed access to the Vault HTTP API. Every call is bounded by the configured request timeout.
 * Failures surface as {@link VaultResponseException}.
 */
public interface VaultHttpClient {

    JsonNode read(String path, String token) throws VaultResponseException;

    JsonNode write(String path, JsonNode body, String token) throws VaultResponseException;

    void delete(String path, String token) throws VaultResponseException;

    /**
     * Vault's LIST verb, sent as {@code GET {path}?list=true}.
     */
    JsonNode list(String path, String token) throws VaultResponseException;

    /**
     * Unauthenticated {@code POST auth/{mountPoint}/login}.
     */
    JsonNode login(String mountPoint, JsonNode body) throws VaultResponseException;
}
