package tech.yump.secrets.vault.auth;

import lombok.extern.slf4j.Slf4j;
import tech.yump.secrets.vault.VaultHttpClient;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the Vault client token.
 * Logins run under a lock so concurrent callers wait for and share a single in-flight login.
 */
@Slf4j
public class VaultAuthenticator {

    private final VaultLoginStrategy strategy;
    private final VaultHttpClient httpClient;
    private final ReentrantLock lock = new ReentrantLock();

    // null until the first successful login
    private volatile String token;

    public VaultAuthenticator(VaultLoginStrategy strategy, VaultHttpClient httpClient) {
        this.strategy = strategy;
        this.httpClient = httpClient;
        if (strategy instanceof TokenLogin tokenLogin) {
            this.token = tokenLogin.token();
        }
    }

    public VaultAuthMethod method() {
        return strategy.method();
    }

    public boolean supportsTokenRefresh() {
        return strategy.supportsTokenRefresh();
    }

    public boolean isInitialized() {
        return token != null;
    }

    /**
     * Returns the current token, logging in first if there is none.
     *
     * @throws VaultAuthenticationException if the login fails.
     */
    public String ensureInitialized() {
        String current = token;
        if (current != null) {
            return current;
        }
        lock.lock();
        try {
            if (token == null) {
                token = login();
            }
            return token;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discards {@code staleToken} and logs in again, unless another caller has already replaced it.
     *
     * @return the token to retry with.
     * @throws VaultAuthenticationException if the login fails.
     */
    public String reauthenticate(String staleToken) {
        lock.lock();
        try {
            String current = token;
            if (current != null && !current.equals(staleToken)) {
                log.debug("Vault token already refreshed by a concurrent caller");
                return current;
            }
            token = null;
            token = login();
            return token;
        } finally {
            lock.unlock();
        }
    }

    private String login() {
        log.debug("Logging in to Vault using {} auth", strategy.method());
        try {
            return strategy.login(httpClient);
        } catch (RuntimeException e) {
            log.error("Vault {} authentication failed: {}", strategy.method(), e.getMessage(), e);
            throw new VaultAuthenticationException(e);
        }
    }
}
