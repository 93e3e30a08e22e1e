package tech.yump.secrets.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;
import tech.yump.secrets.config.SecretsManagerProperties.VaultProperties;
import tech.yump.secrets.vault.KvAdapter;
import tech.yump.secrets.vault.RestTemplateVaultHttpClient;
import tech.yump.secrets.vault.VaultClient;
import tech.yump.secrets.vault.VaultHttpClient;
import tech.yump.secrets.vault.auth.AwsIamLogin;
import tech.yump.secrets.vault.auth.KubernetesLogin;
import tech.yump.secrets.vault.auth.TokenLogin;
import tech.yump.secrets.vault.auth.VaultAuthenticator;
import tech.yump.secrets.vault.auth.VaultLoginStrategy;

import java.nio.file.Path;

/**
 * Wires the shared Vault client. Active whenever a Vault address is configured.
 */
@Configuration
@ConditionalOnProperty(prefix = "secrets-manager.vault", name = "address")
@RequiredArgsConstructor
@Slf4j
public class VaultClientConfiguration {

    private final SecretsManagerProperties properties;
    private final ObjectMapper objectMapper;

    @Bean
    public RestTemplate vaultRestTemplate() {
        VaultProperties vault = properties.vault();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) vault.requestTimeout().toMillis());
        requestFactory.setReadTimeout((int) vault.requestTimeout().toMillis());
        return new RestTemplate(requestFactory);
    }

    @Bean
    public VaultHttpClient vaultHttpClient(RestTemplate vaultRestTemplate) {
        VaultProperties vault = properties.vault();
        return new RestTemplateVaultHttpClient(vaultRestTemplate, objectMapper, vault.address(), vault.namespace());
    }

    @Bean
    public VaultLoginStrategy vaultLoginStrategy() {
        return loginStrategy(properties.vault(), objectMapper);
    }

    @Bean
    public VaultAuthenticator vaultAuthenticator(VaultLoginStrategy vaultLoginStrategy, VaultHttpClient vaultHttpClient) {
        return new VaultAuthenticator(vaultLoginStrategy, vaultHttpClient);
    }

    @Bean
    public KvAdapter kvAdapter() {
        VaultProperties vault = properties.vault();
        return new KvAdapter(vault.kvVersionEnum(), vault.secretPath(), vault.secretMetadataPath(), objectMapper);
    }

    @Bean
    public VaultClient vaultClient(VaultHttpClient vaultHttpClient, VaultAuthenticator vaultAuthenticator, KvAdapter kvAdapter) {
        VaultProperties vault = properties.vault();
        log.info("Configuring Vault client: address={}, authMethod={}, kvVersion={}, secretPath={}",
                vault.address(), vault.authMethod(), vault.kvVersion(), vault.secretPath());
        return new VaultClient(vaultHttpClient, vaultAuthenticator, kvAdapter);
    }

    static VaultLoginStrategy loginStrategy(VaultProperties vault, ObjectMapper objectMapper) {
        return switch (vault.authMethod()) {
            case TOKEN -> new TokenLogin(vault.token());
            case KUBERNETES -> new KubernetesLogin(
                    vault.kubernetes().role(),
                    vault.kubernetes().mountPoint(),
                    Path.of(vault.kubernetes().tokenPath()),
                    objectMapper);
            case AWS -> new AwsIamLogin(
                    vault.aws().role(),
                    vault.aws().mountPoint(),
                    vault.aws().region(),
                    vault.aws().stsEndpoint(),
                    vault.aws().iamServerId(),
                    objectMapper);
        };
    }
}
