package tech.yump.secrets.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import tech.yump.secrets.secrets.SecretsManagerType;
import tech.yump.secrets.vault.KvVersion;
import tech.yump.secrets.vault.auth.VaultAuthMethod;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Configuration properties under the 'secrets-manager' prefix.
 */
@ConfigurationProperties(prefix = "secrets-manager")
@Validated
public record SecretsManagerProperties(

        SecretsManagerType type,

        @Valid
        VaultProperties vault,

        @Valid
        DataSourceProperties datasource
) {

    public SecretsManagerProperties {
        if (type == null) {
            type = SecretsManagerType.DB;
        }
    }

    @AssertTrue(message = "Vault configuration (secrets-manager.vault) is required when secrets-manager.type is VAULT or READONLY_VAULT.")
    public boolean isVaultConfiguredWhenRequired() {
        return type == SecretsManagerType.DB || vault != null;
    }

    // --- DataSourceProperties ---
    @Validated
    public record DataSourceProperties(
            @NotBlank(message = "Metadata store JDBC URL (secrets-manager.datasource.url) must be provided.")
            String url,

            @NotBlank(message = "Metadata store username (secrets-manager.datasource.username) must be provided.")
            String username,

            @NotNull(message = "Metadata store password (secrets-manager.datasource.password) must be provided.")
            char[] password
    ) {

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            DataSourceProperties that = (DataSourceProperties) o;
            return Objects.equals(url, that.url) &&
                    Objects.equals(username, that.username) &&
                    Arrays.equals(password, that.password);
        }

        @Override
        public int hashCode() {
            int result = Objects.hash(url, username);
            result = 31 * result + Arrays.hashCode(password);
            return result;
        }

        @Override
        public String toString() {
            return "DataSourceProperties[" +
                    "url='" + url + '\'' +
                    ", username='" + username + '\'' +
                    ", password=******" +
                    ']';
        }
    }

    // --- VaultProperties ---
    @Validated
    public record VaultProperties(
            @NotBlank(message = "Vault address (secrets-manager.vault.address) must be provided.")
            String address,

            VaultAuthMethod authMethod,

            @Pattern(regexp = "[12]", message = "Vault KV version (secrets-manager.vault.kv-version) must be \"1\" or \"2\".")
            String kvVersion,

            String token,

            String namespace,

            String secretPath,

            String secretMetadataPath,

            Duration requestTimeout,

            @Valid
            KubernetesProperties kubernetes,

            @Valid
            AwsProperties aws
    ) {

        public static final String DEFAULT_SECRET_PATH_V1 = "secret/secrets-manager";
        public static final String DEFAULT_SECRET_PATH_V2 = "secret/data/secrets-manager";
        public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

        public VaultProperties {
            if (authMethod == null) {
                authMethod = VaultAuthMethod.TOKEN;
            }
            if (!StringUtils.hasText(kvVersion)) {
                kvVersion = KvVersion.V2.value();
            }
            if (!StringUtils.hasText(secretPath)) {
                secretPath = KvVersion.V1.value().equals(kvVersion) ? DEFAULT_SECRET_PATH_V1 : DEFAULT_SECRET_PATH_V2;
            }
            if (requestTimeout == null) {
                requestTimeout = DEFAULT_REQUEST_TIMEOUT;
            }
            if (kubernetes == null) {
                kubernetes = new KubernetesProperties(null, null, null);
            }
            if (aws == null) {
                aws = new AwsProperties(null, null, null, null, null);
            }
        }

        public KvVersion kvVersionEnum() {
            return KvVersion.fromValue(kvVersion);
        }

        @AssertTrue(message = "Vault token (secrets-manager.vault.token) must be provided when auth-method is TOKEN.")
        public boolean isTokenValid() {
            return authMethod != VaultAuthMethod.TOKEN || StringUtils.hasText(token);
        }

        @AssertTrue(message = "Kubernetes role (secrets-manager.vault.kubernetes.role) must be provided when auth-method is KUBERNETES.")
        public boolean isKubernetesRoleValid() {
            return authMethod != VaultAuthMethod.KUBERNETES || StringUtils.hasText(kubernetes.role());
        }

        @AssertTrue(message = "AWS role (secrets-manager.vault.aws.role) must be provided when auth-method is AWS.")
        public boolean isAwsRoleValid() {
            return authMethod != VaultAuthMethod.AWS || StringUtils.hasText(aws.role());
        }

        @AssertTrue(message = "Vault request timeout (secrets-manager.vault.request-timeout) must be positive.")
        public boolean isRequestTimeoutValid() {
            return !requestTimeout.isNegative() && !requestTimeout.isZero();
        }

        @Override
        public String toString() {
            return "VaultProperties[" +
                    "address='" + address + '\'' +
                    ", authMethod=" + authMethod +
                    ", kvVersion=" + kvVersion +
                    ", token=" + (token == null ? "null" : "******") +
                    ", namespace='" + namespace + '\'' +
                    ", secretPath='" + secretPath + '\'' +
                    ", secretMetadataPath='" + secretMetadataPath + '\'' +
                    ", requestTimeout=" + requestTimeout +
                    ", kubernetes=" + kubernetes +
                    ", aws=" + aws +
                    ']';
        }
    }

    @Validated
    public record KubernetesProperties(
            String role,
            String mountPoint,
            String tokenPath
    ) {
        public static final String DEFAULT_MOUNT_POINT = "kubernetes";
        public static final String DEFAULT_TOKEN_PATH = "/var/run/secrets/kubernetes.io/serviceaccount/token";

        public KubernetesProperties {
            if (!StringUtils.hasText(mountPoint)) {
                mountPoint = DEFAULT_MOUNT_POINT;
            }
            if (!StringUtils.hasText(tokenPath)) {
                tokenPath = DEFAULT_TOKEN_PATH;
            }
        }
    }

    /**
     * AWS IAM auth settings. Credentials come from the AWS default provider chain, never from here.
     */
    @Validated
    public record AwsProperties(
            String role,
            String mountPoint,
            String region,
            String stsEndpoint,
            String iamServerId
    ) {
        public static final String DEFAULT_MOUNT_POINT = "aws";
        public static final String DEFAULT_REGION = "us-east-1";
        public static final String DEFAULT_STS_ENDPOINT = "https://sts.amazonaws.com";

        public AwsProperties {
            if (!StringUtils.hasText(mountPoint)) {
                mountPoint = DEFAULT_MOUNT_POINT;
            }
            if (!StringUtils.hasText(region)) {
                region = DEFAULT_REGION;
            }
            if (!StringUtils.hasText(stsEndpoint)) {
                stsEndpoint = DEFAULT_STS_ENDPOINT;
            }
        }
    }
}
