package tech.yump.secrets.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

@Schema(description = "Request body for replacing a secret's value")
public record UpdateSecretRequest(
        @Schema(description = "New secret values.", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "secret must be provided")
        Map<String, Object> secret
) {
}
