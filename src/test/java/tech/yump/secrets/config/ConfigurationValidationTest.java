package tech.yump.secrets.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import tech.yump.secrets.secrets.SecretsManagerType;
import tech.yump.secrets.vault.auth.VaultAuthMethod;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfigurationValidationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TestConfig.class));

    @EnableConfigurationProperties(SecretsManagerProperties.class)
    static class TestConfig {}

    @Test
    @DisplayName("Config Validation: defaults to DB with no Vault section")
    void defaultsToDb() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            SecretsManagerProperties props = context.getBean(SecretsManagerProperties.class);
            assertThat(props.type()).isEqualTo(SecretsManagerType.DB);
            assertThat(props.vault()).isNull();
        });
    }

    @Test
    @DisplayName("Config Validation: Vault defaults depend on KV version")
    void vaultDefaults() {
        contextRunner
                .withPropertyValues(
                        "secrets-manager.type=vault",
                        "secrets-manager.vault.address=http://vault:8200",
                        "secrets-manager.vault.token=s.root"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    SecretsManagerProperties.VaultProperties vault = context.getBean(SecretsManagerProperties.class).vault();
                    assertThat(vault.authMethod()).isEqualTo(VaultAuthMethod.TOKEN);
                    assertThat(vault.kvVersion()).isEqualTo("2");
                    assertThat(vault.secretPath()).isEqualTo("secret/data/secrets-manager");
                    assertThat(vault.requestTimeout()).isEqualTo(Duration.ofSeconds(10));
                    assertThat(vault.kubernetes().mountPoint()).isEqualTo("kubernetes");
                    assertThat(vault.aws().stsEndpoint()).isEqualTo("https://sts.amazonaws.com");
                    assertThat(vault.aws().region()).isEqualTo("us-east-1");
                    assertThat(vault.toString()).doesNotContain("s.root");
                });
    }

    @Test
    @DisplayName("Config Validation: KV v1 default secret path")
    void kvV1DefaultPath() {
        contextRunner
                .withPropertyValues(
                        "secrets-manager.vault.address=http://vault:8200",
                        "secrets-manager.vault.token=s.root",
                        "secrets-manager.vault.kv-version=1"
                )
                .run(context -> assertThat(context.getBean(SecretsManagerProperties.class).vault().secretPath())
                        .isEqualTo("secret/secrets-manager"));
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when KV version is not 1 or 2")
    void invalidKvVersion() {
        contextRunner
                .withPropertyValues(
                        "secrets-manager.vault.address=http://vault:8200",
                        "secrets-manager.vault.token=s.root",
                        "secrets-manager.vault.kv-version=3"
                )
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("must be \"1\" or \"2\"");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when token auth has no token")
    void tokenAuthWithoutToken() {
        contextRunner
                .withPropertyValues(
                        "secrets-manager.vault.address=http://vault:8200"
                )
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Vault token (secrets-manager.vault.token) must be provided when auth-method is TOKEN.");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when Kubernetes auth has no role")
    void kubernetesWithoutRole() {
        contextRunner
                .withPropertyValues(
                        "secrets-manager.vault.address=http://vault:8200",
                        "secrets-manager.vault.auth-method=kubernetes"
                )
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .hasMessageContaining("Kubernetes role (secrets-manager.vault.kubernetes.role)");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when AWS auth has no role")
    void awsWithoutRole() {
        contextRunner
                .withPropertyValues(
                        "secrets-manager.vault.address=http://vault:8200",
                        "secrets-manager.vault.auth-method=aws",
                        "secrets-manager.vault.aws.region=eu-central-1"
                )
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .hasMessageContaining("AWS role (secrets-manager.vault.aws.role)");
                });
    }

    @Test
    @DisplayName("Config Validation: Should PASS with Kubernetes auth and a role")
    void kubernetesWithRole() {
        contextRunner
                .withPropertyValues(
                        "secrets-manager.type=readonly_vault",
                        "secrets-manager.vault.address=http://vault:8200",
                        "secrets-manager.vault.auth-method=kubernetes",
                        "secrets-manager.vault.kubernetes.role=app"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    SecretsManagerProperties props = context.getBean(SecretsManagerProperties.class);
                    assertThat(props.type()).isEqualTo(SecretsManagerType.READONLY_VAULT);
                    assertThat(props.vault().kubernetes().tokenPath())
                            .isEqualTo("/var/run/secrets/kubernetes.io/serviceaccount/token");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when a Vault type has no Vault section")
    void vaultTypeWithoutVault() {
        contextRunner
                .withPropertyValues("secrets-manager.type=vault")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .hasMessageContaining("Vault configuration (secrets-manager.vault) is required");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when the datasource password is missing")
    void datasourceWithoutPassword() {
        contextRunner
                .withPropertyValues(
                        "secrets-manager.datasource.url=jdbc:postgresql://db/secrets",
                        "secrets-manager.datasource.username=app"
                )
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Metadata store password (secrets-manager.datasource.password) must be provided.");
                });
    }

    @Test
    @DisplayName("Config Validation: datasource password is masked")
    void datasourcePasswordMasked() {
        contextRunner
                .withPropertyValues(
                        "secrets-manager.datasource.url=jdbc:postgresql://db/secrets",
                        "secrets-manager.datasource.username=app",
                        "secrets-manager.datasource.password=hunter2"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    SecretsManagerProperties.DataSourceProperties ds = context.getBean(SecretsManagerProperties.class).datasource();
                    assertThat(ds.password()).containsExactly("hunter2".toCharArray());
                    assertThat(ds.toString()).doesNotContain("hunter2");
                });
    }
}
