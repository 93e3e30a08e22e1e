package tech.yump.secrets.vault;

import lombok.Getter;

import java.util.List;

/**
 * A non-2xx Vault response or a transport failure.
 * Timeouts are reported as 408 and an unreachable server as 503.
 * {@link #getVaultErrors()} holds Vault's own error text and is meant for logs only.
 */
@Getter
public class VaultResponseException extends RuntimeException {

    public static final int REQUEST_TIMEOUT = 408;
    public static final int SERVICE_UNAVAILABLE = 503;

    private final int statusCode;
    private final List<String> vaultErrors;

    public VaultResponseException(int statusCode, String message, List<String> vaultErrors) {
        super(message);
        this.statusCode = statusCode;
        this.vaultErrors = vaultErrors == null ? List.of() : List.copyOf(vaultErrors);
    }

    public VaultResponseException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.vaultErrors = List.of();
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
