package tech.yump.secrets.vault;

import java.util.Arrays;

/**
 * Vault KV secrets engine version.
 */
public enum KvVersion {
    V1("1"),
    V2("2");

    private final String value;

    KvVersion(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static KvVersion fromValue(String value) {
        return Arrays.stream(values())
                .filter(v -> v.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new VaultConfigurationException("Unsupported KV version: " + value + ". Expected 1 or 2."));
    }
}
