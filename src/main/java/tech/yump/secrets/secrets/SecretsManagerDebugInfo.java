package tech.yump.secrets.secrets;

import java.util.Map;

/**
 * Redacted configuration summary shown to administrators. Never carries tokens or credentials.
 */
public record SecretsManagerDebugInfo(SecretsManagerType type, Map<String, String> meta) {
}
