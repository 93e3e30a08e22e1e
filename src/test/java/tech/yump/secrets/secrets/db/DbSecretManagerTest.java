package tech.yump.secrets.secrets.db;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.secrets.secrets.SecretRecord;
import tech.yump.secrets.secrets.SecretsManagerException;
import tech.yump.secrets.secrets.SecretsManagerType;
import tech.yump.secrets.storage.InMemorySecretRepository;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DbSecretManagerTest {

    private final InMemorySecretRepository repository = new InMemorySecretRepository();
    private final DbSecretManager manager = new DbSecretManager(repository);

    @Test
    @DisplayName("values are stored directly in the row")
    void createGetUpdateDelete() {
        SecretRecord created = manager.createSecret(Map.of("password", "pw"), "db");

        assertThat(created.isVault()).isFalse();
        assertThat(created.isByosVault()).isFalse();
        assertThat(manager.getSecret(created.id())).hasValueSatisfying(r ->
                assertThat(r.secret()).containsEntry("password", "pw"));

        assertThat(manager.updateSecret(created.id(), Map.of("password", "new"))).hasValueSatisfying(r ->
                assertThat(r.secret()).containsEntry("password", "new"));

        assertThat(manager.deleteSecret(created.id())).isTrue();
        assertThat(manager.deleteSecret(created.id())).isFalse();
        assertThat(manager.getSecret(created.id())).isEmpty();
    }

    @Test
    void missingRowsAreEmpty() {
        assertThat(manager.updateSecret(UUID.randomUUID(), Map.of())).isEmpty();
    }

    @Test
    void connectivityIsNotSupported() {
        assertThatThrownBy(manager::checkConnectivity)
                .isInstanceOfSatisfying(SecretsManagerException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(501));
        assertThat(manager.getUserVisibleDebugInfo().type()).isEqualTo(SecretsManagerType.DB);
    }
}
