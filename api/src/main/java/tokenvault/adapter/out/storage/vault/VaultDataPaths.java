package tokenvault.adapter.out.storage.vault;

import tokenvault.core.model.TokenOwner;

/**
 * Builds the KV version 2 data path of a token owner.
 *
 * <p>Format: {@code <prefix>/data/<namespace>/<name>}. Owner values are not escaped.
 */
public final class VaultDataPaths {

    static final String DATA_PATH_FORMAT = "%s/data/%s/%s";

    private final String prefix;

    public VaultDataPaths(String prefix) {
        this.prefix = trim(prefix);
    }

    /**
     * Returns the data path for an owner.
     *
     * @param owner the token owner
     * @return the path, relative to the Vault API root
     */
    public String dataPath(TokenOwner owner) {
        return String.format(DATA_PATH_FORMAT, prefix, owner.namespace(), owner.name());
    }

    static String trim(String value) {
        if (value == null) {
            return "";
        }
        var start = 0;
        var end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
