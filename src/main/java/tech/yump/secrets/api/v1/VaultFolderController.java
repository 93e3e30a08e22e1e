package tech.yump.secrets.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.secrets.secrets.SecretManager;
import tech.yump.secrets.secrets.SecretsManagerException;
import tech.yump.secrets.vault.ReadonlyVaultSecretManager;
import tech.yump.secrets.vault.VaultFolderConnectivityResult;
import tech.yump.secrets.vault.VaultSecretListItem;

import java.util.List;

@RestController
@RequestMapping("/api/vault-folders")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Vault Folders", description = "Browse customer-owned Vault folders (readonly vault mode only)")
public class VaultFolderController {

    private final SecretManager secretManager;

    @GetMapping("/secrets")
    @Operation(summary = "List secrets in a Vault folder", description = "Sub-folders are not included.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Secrets listed."),
            @ApiResponse(responseCode = "403", description = "Readonly vault mode is not enabled.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Vault error.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public List<VaultSecretListItem> listSecrets(
            @Parameter(description = "Vault folder path", required = true, example = "secret/data/team-a")
            @RequestParam String path) {
        return readonlyManager().listSecretsInFolder(path);
    }

    @GetMapping("/connectivity")
    @Operation(summary = "Check access to a Vault folder", description = "Failures are reported in the body, not as errors.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Connectivity result."),
            @ApiResponse(responseCode = "403", description = "Readonly vault mode is not enabled.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public VaultFolderConnectivityResult checkConnectivity(
            @Parameter(description = "Vault folder path", required = true, example = "secret/data/team-a")
            @RequestParam String path) {
        return readonlyManager().checkFolderConnectivity(path);
    }

    private ReadonlyVaultSecretManager readonlyManager() {
        if (secretManager instanceof ReadonlyVaultSecretManager readonly) {
            return readonly;
        }
        log.warn("Vault folder browsing requested but the active secrets manager is {}", secretManager.type());
        throw new SecretsManagerException(403, "Vault folder browsing is only available in readonly vault mode.");
    }
}
