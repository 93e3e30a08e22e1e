package tech.yump.secrets.vault.auth;

import com.fasterxml.jackson.databind.JsonNode;

final class LoginResponses {

    private LoginResponses() {
    }

    static String clientToken(JsonNode response) {
        JsonNode token = response.path("auth").path("client_token");
        if (!token.isTextual() || token.asText().isBlank()) {
            throw new IllegalStateException("Vault login response did not contain auth.client_token");
        }
        return token.asText();
    }
}
