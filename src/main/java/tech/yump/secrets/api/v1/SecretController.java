package tech.yump.secrets.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.secrets.api.dto.CreateSecretRequest;
import tech.yump.secrets.api.dto.UpdateSecretRequest;
import tech.yump.secrets.secrets.SecretManager;
import tech.yump.secrets.secrets.SecretRecord;
import tech.yump.secrets.secrets.SecretsConnectivityResult;
import tech.yump.secrets.secrets.SecretsManagerDebugInfo;

import java.util.UUID;

@RestController
@RequestMapping("/api/secrets")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Secrets", description = "Create, read, update and delete secrets through the configured secrets manager")
public class SecretController {

    private final SecretManager secretManager;

    @PostMapping
    @Operation(summary = "Create secret")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Secret created."),
            @ApiResponse(responseCode = "400", description = "Invalid request body.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Secrets backend error.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SecretRecord> createSecret(@Valid @RequestBody CreateSecretRequest request) {
        log.info("Received request to create secret '{}' (forceDb={})", request.name(), request.forceDb());
        SecretRecord created = secretManager.createSecret(request.secret(), request.name(), request.forceDb());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Read secret", description = "Returns the secret with its value resolved from the backend.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Secret found."),
            @ApiResponse(responseCode = "404", description = "No secret with this id."),
            @ApiResponse(responseCode = "500", description = "Secrets backend error.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SecretRecord> getSecret(
            @Parameter(description = "Secret id", required = true) @PathVariable UUID id) {
        return secretManager.getSecret(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> {
                    log.info("No secret found with id {}", id);
                    return ResponseEntity.notFound().build();
                });
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update secret", description = "Replaces the secret's value. The storage mode is kept.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Secret updated."),
            @ApiResponse(responseCode = "404", description = "No secret with this id."),
            @ApiResponse(responseCode = "500", description = "Secrets backend error.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SecretRecord> updateSecret(
            @Parameter(description = "Secret id", required = true) @PathVariable UUID id,
            @Valid @RequestBody UpdateSecretRequest request) {
        return secretManager.updateSecret(id, request.secret())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete secret")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Secret deleted."),
            @ApiResponse(responseCode = "404", description = "No secret with this id."),
            @ApiResponse(responseCode = "500", description = "Secrets backend error.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<Void> deleteSecret(
            @Parameter(description = "Secret id", required = true) @PathVariable UUID id) {
        if (secretManager.deleteSecret(id)) {
            log.info("Deleted secret {}", id);
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }

    @GetMapping("/connectivity")
    @Operation(summary = "Check secrets backend connectivity")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Backend reachable."),
            @ApiResponse(responseCode = "501", description = "Not supported by the configured secrets manager.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public SecretsConnectivityResult checkConnectivity() {
        return secretManager.checkConnectivity();
    }

    @GetMapping("/debug-info")
    @Operation(summary = "Show secrets manager configuration", description = "Redacted; never contains tokens or credentials.")
    public SecretsManagerDebugInfo debugInfo() {
        return secretManager.getUserVisibleDebugInfo();
    }
}
