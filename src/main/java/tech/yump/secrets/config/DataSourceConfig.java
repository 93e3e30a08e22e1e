package tech.yump.secrets.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.util.Arrays;

/**
 * Builds the pool for the secret metadata store from {@code secrets-manager.datasource}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataSourceConfig {

    private final SecretsManagerProperties properties;

    @Bean
    @Primary
    public DataSource dataSource() {
        log.info("Configuring Hikari DataSource for the secret metadata store...");

        SecretsManagerProperties.DataSourceProperties dsProps = properties.datasource();
        if (dsProps == null) {
            log.error("Metadata store configuration (secrets-manager.datasource) is missing. Cannot configure DataSource.");
            throw new IllegalStateException("Missing metadata store configuration for DataSource.");
        }

        char[] passwordChars = dsProps.password();
        try {
            if (passwordChars == null || passwordChars.length == 0) {
                log.error("Metadata store password is empty or null in configuration.");
                throw new IllegalStateException("Metadata store password cannot be empty.");
            }

            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(dsProps.url());
            config.setUsername(dsProps.username());
            // HikariConfig has no char[] setter
            config.setPassword(new String(passwordChars));
            config.setPoolName("SecretsManagerMetadataPool");
            config.setMaximumPoolSize(10);
            config.setMinimumIdle(2);

            log.info("Creating HikariDataSource for URL: {}, User: {}", config.getJdbcUrl(), config.getUsername());
            HikariDataSource dataSource = new HikariDataSource(config);
            log.info("HikariDataSource configured successfully.");
            return dataSource;
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to configure metadata store DataSource: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to configure metadata store DataSource", e);
        } finally {
            if (passwordChars != null) {
                Arrays.fill(passwordChars, '\0');
                log.debug("Password char array cleared after DataSource configuration.");
            }
        }
    }
}
