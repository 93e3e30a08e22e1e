package tech.yump.secrets.secrets;

import lombok.Getter;

/**
 * User-safe error raised at the boundary of every {@link SecretManager}.
 * The message is meant to be shown to API consumers; backend details are only logged.
 */
@Getter
public class SecretsManagerException extends RuntimeException {

    public static final String GENERIC_MESSAGE =
            "An error occurred while accessing secrets. Please try again later or contact your administrator.";

    private final int statusCode;

    public SecretsManagerException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public SecretsManagerException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public static SecretsManagerException generic(Throwable cause) {
        return new SecretsManagerException(500, GENERIC_MESSAGE, cause);
    }
}
