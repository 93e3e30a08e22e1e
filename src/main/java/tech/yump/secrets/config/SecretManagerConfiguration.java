package tech.yump.secrets.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.secrets.secrets.SecretManager;
import tech.yump.secrets.secrets.db.DbSecretManager;
import tech.yump.secrets.storage.SecretRepository;
import tech.yump.secrets.vault.ReadonlyVaultSecretManager;
import tech.yump.secrets.vault.VaultClient;
import tech.yump.secrets.vault.VaultSecretManager;

import java.time.Clock;

/**
 * Selects the active {@link SecretManager} from {@code secrets-manager.type}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class SecretManagerConfiguration {

    static final String TYPE_PROPERTY = "secrets-manager.type";

    private final SecretsManagerProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = TYPE_PROPERTY, havingValue = "db", matchIfMissing = true)
    public SecretManager dbSecretManager(SecretRepository repository) {
        log.info("Configuring database secrets manager");
        return new DbSecretManager(repository);
    }

    @Bean
    @ConditionalOnProperty(name = TYPE_PROPERTY, havingValue = "vault")
    public SecretManager vaultSecretManager(SecretRepository repository, VaultClient vaultClient, ObjectMapper objectMapper) {
        log.info("Configuring Vault secrets manager (kvVersion={})", properties.vault().kvVersion());
        return new VaultSecretManager(repository, vaultClient, properties.vault(), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = TYPE_PROPERTY, havingValue = "readonly_vault")
    public SecretManager readonlyVaultSecretManager(SecretRepository repository, VaultClient vaultClient) {
        log.info("Configuring readonly Vault secrets manager (kvVersion={})", properties.vault().kvVersion());
        return new ReadonlyVaultSecretManager(repository, vaultClient);
    }
}
