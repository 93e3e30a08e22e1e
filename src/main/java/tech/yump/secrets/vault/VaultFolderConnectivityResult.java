package tech.yump.secrets.vault;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VaultFolderConnectivityResult(boolean connected, int secretCount, String error) {

    public static VaultFolderConnectivityResult connected(int secretCount) {
        return new VaultFolderConnectivityResult(true, secretCount, null);
    }

    public static VaultFolderConnectivityResult failed(String error) {
        return new VaultFolderConnectivityResult(false, 0, error);
    }
}
