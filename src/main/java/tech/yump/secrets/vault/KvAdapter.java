package tech.yump.secrets.vault;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Translates between logical secret values and the KV v1/v2 wire formats, and computes Vault paths.
 * Performs no I/O.
 */
public class KvAdapter {

    static final String VALUE_FIELD = "value";
    private static final String DATA_SEGMENT = "/data/";
    private static final String METADATA_SEGMENT = "/metadata/";

    private final KvVersion kvVersion;
    private final String secretPath;
    private final String secretMetadataPath;
    private final ObjectMapper objectMapper;

    public KvAdapter(KvVersion kvVersion, String secretPath, String secretMetadataPath, ObjectMapper objectMapper) {
        this.kvVersion = kvVersion;
        this.secretPath = stripTrailingSlashes(secretPath);
        this.secretMetadataPath = secretMetadataPath == null || secretMetadataPath.isBlank()
                ? null : stripTrailingSlashes(secretMetadataPath);
        this.objectMapper = objectMapper;
    }

    public KvVersion kvVersion() {
        return kvVersion;
    }

    /**
     * v1: {@code {"value": ...}}. v2: {@code {"data": {"value": ...}}}.
     */
    public ObjectNode buildWritePayload(String value) {
        ObjectNode inner = objectMapper.createObjectNode().put(VALUE_FIELD, value);
        if (kvVersion == KvVersion.V1) {
            return inner;
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("data", inner);
        return payload;
    }

    /**
     * Reads the stored {@code value} field from a read response.
     *
     * @throws IllegalStateException if the response does not carry a textual value.
     */
    public String extractSecretValue(JsonNode response) {
        JsonNode value = dataNode(response).path(VALUE_FIELD);
        if (!value.isTextual()) {
            throw new IllegalStateException("Vault response does not contain a secret value");
        }
        return value.asText();
    }

    /**
     * Returns every key of the KV data as a string map. Non-textual values are rendered as JSON.
     */
    public Map<String, String> extractSecretData(JsonNode response) {
        JsonNode data = dataNode(response);
        Map<String, String> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            result.put(field.getKey(), node.isTextual() ? node.asText() : node.toString());
        }
        return result;
    }

    public String secretPath(String name, UUID id) {
        return secretPath + "/" + name + "-" + id;
    }

    /**
     * Path whose deletion removes the secret. For v2 this is the metadata path, which drops all versions.
     */
    public String metadataPath(String name, UUID id) {
        if (kvVersion == KvVersion.V1) {
            return secretPath(name, id);
        }
        return metadataBase() + "/" + name + "-" + id;
    }

    public String listBasePath() {
        if (kvVersion == KvVersion.V1) {
            return secretPath;
        }
        return metadataBase();
    }

    /**
     * List path for an arbitrary folder. v2 lists go through the metadata endpoint.
     */
    public String listPath(String folderPath) {
        if (kvVersion == KvVersion.V1) {
            return folderPath;
        }
        return toMetadata(folderPath);
    }

    public String basePath() {
        return secretPath;
    }

    public String metadataBase() {
        return secretMetadataPath != null ? secretMetadataPath : toMetadata(secretPath);
    }

    private JsonNode dataNode(JsonNode response) {
        JsonNode data = response == null ? null : response.path("data");
        if (kvVersion == KvVersion.V2 && data != null) {
            data = data.path("data");
        }
        if (data == null || !data.isObject()) {
            throw new IllegalStateException("Vault response does not contain KV data");
        }
        return data;
    }

    // Only the first /data/ segment is rewritten; paths without one are returned unchanged.
    private static String toMetadata(String path) {
        int idx = path.indexOf(DATA_SEGMENT);
        if (idx < 0) {
            return path;
        }
        return path.substring(0, idx) + METADATA_SEGMENT + path.substring(idx + DATA_SEGMENT.length());
    }

    private static String stripTrailingSlashes(String path) {
        String result = path;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
