package tech.yump.secrets.vault.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import tech.yump.secrets.vault.VaultConfigurationException;
import tech.yump.secrets.vault.VaultHttpClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Logs in with the pod's service-account JWT through Vault's Kubernetes auth method.
 */
@Slf4j
public final class KubernetesLogin implements VaultLoginStrategy {

    private final String role;
    private final String mountPoint;
    private final Path tokenPath;
    private final ObjectMapper objectMapper;

    public KubernetesLogin(String role, String mountPoint, Path tokenPath, ObjectMapper objectMapper) {
        if (role == null || role.isBlank()) {
            throw new VaultConfigurationException("Kubernetes role is required for Kubernetes authentication.");
        }
        this.role = role;
        this.mountPoint = mountPoint;
        this.tokenPath = tokenPath;
        this.objectMapper = objectMapper;
    }

    @Override
    public VaultAuthMethod method() {
        return VaultAuthMethod.KUBERNETES;
    }

    @Override
    public boolean supportsTokenRefresh() {
        return true;
    }

    @Override
    public String login(VaultHttpClient httpClient) {
        String jwt;
        try {
            jwt = Files.readString(tokenPath, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read Kubernetes service account token from " + tokenPath, e);
        }

        ObjectNode body = objectMapper.createObjectNode()
                .put("role", role)
                .put("jwt", jwt);
        JsonNode response = httpClient.login(mountPoint, body);
        String clientToken = LoginResponses.clientToken(response);
        log.info("Authenticated to Vault via Kubernetes auth (role={}, mountPoint={})", role, mountPoint);
        return clientToken;
    }

    public String role() {
        return role;
    }

    public String mountPoint() {
        return mountPoint;
    }

    public Path tokenPath() {
        return tokenPath;
    }
}
