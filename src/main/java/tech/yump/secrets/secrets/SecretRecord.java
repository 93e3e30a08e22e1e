package tech.yump.secrets.secrets;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A secret metadata row, optionally merged with the secret value resolved from Vault.
 *
 * @param id          Unique identifier assigned by the metadata store.
 * @param name        Human-readable label. For Vault-owned secrets this is the sanitized name used in the Vault path.
 * @param secret      Literal values (plain mode), an empty placeholder (Vault-owned mode, as stored),
 *                    or {@code path#key} references (readonly vault mode, as stored).
 * @param isVault     The value lives in Vault at {@code {secretPath}/{name}-{id}}.
 * @param isByosVault The value is a set of references into a customer-owned Vault folder.
 * @param createdAt   Creation timestamp.
 * @param updatedAt   Last modification timestamp.
 */
@Builder(toBuilder = true)
public record SecretRecord(
        UUID id,
        String name,
        Map<String, Object> secret,
        @JsonProperty("isVault") boolean isVault,
        @JsonProperty("isByosVault") boolean isByosVault,
        Instant createdAt,
        Instant updatedAt
) {

    public SecretRecord {
        if (secret == null) {
            secret = Map.of();
        }
        if (isVault && isByosVault) {
            throw new IllegalArgumentException("A secret cannot be both Vault-owned and a readonly vault reference.");
        }
    }

    public SecretRecord withSecret(Map<String, Object> value) {
        return toBuilder().secret(value).build();
    }
}
