package tech.yump.secrets.vault.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.yump.secrets.secrets.SecretsManagerException;
import tech.yump.secrets.vault.FakeVaultHttpClient;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VaultAuthenticatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FakeVaultHttpClient vault;
    private KubernetesLogin kubernetesLogin;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws Exception {
        vault = new FakeVaultHttpClient();
        Path tokenFile = Files.writeString(tempDir.resolve("token"), "jwt");
        kubernetesLogin = new KubernetesLogin("role", "kubernetes", tokenFile, objectMapper);
    }

    @Test
    @DisplayName("token auth is initialized at construction and never logs in")
    void tokenAuthIsImmediatelyInitialized() {
        VaultAuthenticator authenticator = new VaultAuthenticator(new TokenLogin("s.static"), vault);

        assertThat(authenticator.isInitialized()).isTrue();
        assertThat(authenticator.ensureInitialized()).isEqualTo("s.static");
        assertThat(authenticator.supportsTokenRefresh()).isFalse();
        assertThat(vault.loginCount()).isZero();
    }

    @Test
    @DisplayName("ensureInitialized logs in once and then reuses the token")
    void ensureInitializedIsIdempotent() {
        VaultAuthenticator authenticator = new VaultAuthenticator(kubernetesLogin, vault);
        assertThat(authenticator.isInitialized()).isFalse();

        assertThat(authenticator.ensureInitialized()).isEqualTo("token-1");
        assertThat(authenticator.ensureInitialized()).isEqualTo("token-1");

        assertThat(vault.loginCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("concurrent callers share a single login")
    void concurrentCallersShareOneLogin() throws Exception {
        vault.loginDelay(100);
        VaultAuthenticator authenticator = new VaultAuthenticator(kubernetesLogin, vault);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return authenticator.ensureInitialized();
                }));
            }
            start.countDown();
            for (Future<String> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("token-1");
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(vault.loginCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("reauthenticate replaces a stale token but not a fresh one")
    void reauthenticateSkipsWhenAlreadyRefreshed() {
        VaultAuthenticator authenticator = new VaultAuthenticator(kubernetesLogin, vault);
        String first = authenticator.ensureInitialized();

        String second = authenticator.reauthenticate(first);
        String third = authenticator.reauthenticate(first);

        assertThat(second).isEqualTo("token-2");
        assertThat(third).isEqualTo("token-2");
        assertThat(vault.loginCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("login failure is generic and leaves the authenticator uninitialized")
    void loginFailureIsGeneric() {
        vault.failNextLogin(403);
        VaultAuthenticator authenticator = new VaultAuthenticator(kubernetesLogin, vault);

        assertThatThrownBy(authenticator::ensureInitialized)
                .isInstanceOf(VaultAuthenticationException.class)
                .hasMessage(SecretsManagerException.GENERIC_MESSAGE)
                .satisfies(e -> assertThat(((SecretsManagerException) e).getStatusCode()).isEqualTo(500));
        assertThat(authenticator.isInitialized()).isFalse();

        assertThat(authenticator.ensureInitialized()).isEqualTo("token-1");
    }
}
