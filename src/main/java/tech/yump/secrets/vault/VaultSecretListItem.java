package tech.yump.secrets.vault;

/**
 * A secret found by listing a Vault folder.
 *
 * @param name Key name within the folder.
 * @param path Full path of the secret: the folder path joined with the name.
 */
public record VaultSecretListItem(String name, String path) {
}
