package tech.yump.secrets.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

@Schema(description = "Request body for creating a secret")
public record CreateSecretRequest(
        @Schema(description = "Human-readable name. Sanitized before use as a Vault path segment.", example = "github-token")
        String name,

        @Schema(description = "Secret values, or 'path#key' references in readonly vault mode.",
                example = "{\"access_token\": \"secret/data/api-keys#github\"}", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "secret must be provided")
        Map<String, Object> secret,

        @Schema(description = "Store the values in the database even when a Vault manager is active.", defaultValue = "false")
        boolean forceDb
) {
}
