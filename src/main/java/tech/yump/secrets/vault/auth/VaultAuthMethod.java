package tech.yump.secrets.vault.auth;

public enum VaultAuthMethod {
    TOKEN,
    KUBERNETES,
    AWS
}
