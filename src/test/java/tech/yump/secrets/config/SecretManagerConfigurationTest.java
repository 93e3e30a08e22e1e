package tech.yump.secrets.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import tech.yump.secrets.secrets.SecretManager;
import tech.yump.secrets.secrets.db.DbSecretManager;
import tech.yump.secrets.storage.InMemorySecretRepository;
import tech.yump.secrets.storage.SecretRepository;
import tech.yump.secrets.vault.ReadonlyVaultSecretManager;
import tech.yump.secrets.vault.VaultClient;
import tech.yump.secrets.vault.VaultSecretManager;
import tech.yump.secrets.vault.auth.AwsIamLogin;
import tech.yump.secrets.vault.auth.KubernetesLogin;
import tech.yump.secrets.vault.auth.TokenLogin;
import tech.yump.secrets.vault.auth.VaultAuthenticator;
import tech.yump.secrets.vault.auth.VaultLoginStrategy;

import static org.assertj.core.api.Assertions.assertThat;

class SecretManagerConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TestConfig.class));

    @Configuration
    @EnableConfigurationProperties(SecretsManagerProperties.class)
    @Import({SecretManagerConfiguration.class, VaultClientConfiguration.class})
    static class TestConfig {

        @Bean
        SecretRepository secretRepository() {
            return new InMemorySecretRepository();
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }

    @Test
    void selectsDatabaseManagerByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(SecretManager.class);
            assertThat(context.getBean(SecretManager.class)).isInstanceOf(DbSecretManager.class);
            assertThat(context).doesNotHaveBean(VaultClient.class);
        });
    }

    @Test
    void selectsVaultManagerWithTokenLogin() {
        contextRunner
                .withPropertyValues(
                        "secrets-manager.type=vault",
                        "secrets-manager.vault.address=http://vault:8200",
                        "secrets-manager.vault.token=s.root")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(SecretManager.class)).isInstanceOf(VaultSecretManager.class);
                    assertThat(context.getBean(VaultLoginStrategy.class)).isInstanceOf(TokenLogin.class);
                    // a static token needs no login round trip
                    assertThat(context.getBean(VaultAuthenticator.class).isInitialized()).isTrue();
                });
    }

    @Test
    void selectsReadonlyManagerWithKubernetesLogin() {
        contextRunner
                .withPropertyValues(
                        "secrets-manager.type=readonly_vault",
                        "secrets-manager.vault.address=http://vault:8200",
                        "secrets-manager.vault.auth-method=kubernetes",
                        "secrets-manager.vault.kubernetes.role=app")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(SecretManager.class)).isInstanceOf(ReadonlyVaultSecretManager.class);
                    assertThat(context.getBean(VaultLoginStrategy.class)).isInstanceOf(KubernetesLogin.class);
                    assertThat(context.getBean(VaultAuthenticator.class).isInitialized()).isFalse();
                });
    }

    @Test
    void buildsAwsLoginStrategy() {
        contextRunner
                .withPropertyValues(
                        "secrets-manager.type=vault",
                        "secrets-manager.vault.address=http://vault:8200",
                        "secrets-manager.vault.auth-method=aws",
                        "secrets-manager.vault.aws.role=app")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(VaultLoginStrategy.class)).isInstanceOf(AwsIamLogin.class);
                });
    }
}
