package tech.yump.secrets;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.secrets.config.SecretsManagerProperties;

@Slf4j
@SpringBootApplication(
        exclude = { DataSourceAutoConfiguration.class }
)
@EnableConfigurationProperties(SecretsManagerProperties.class)
public class SecretsManagerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SecretsManagerApplication.class, args);
    log.info(">>> Secrets Manager Application Started <<<");
  }
}
