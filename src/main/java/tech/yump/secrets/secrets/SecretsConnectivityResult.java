package tech.yump.secrets.secrets;

public record SecretsConnectivityResult(int secretCount) {
}
