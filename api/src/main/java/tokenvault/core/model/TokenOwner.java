package tokenvault.core.model;

/**
 * Identity of the subject that owns a stored token.
 *
 * <p>The pair is only used to build the storage location of the token. Values are
 * not checked for characters that are meaningful to the storage backend, so a
 * namespace or name containing {@code /} addresses a different location.
 *
 * @param namespace the namespace of the owner
 * @param name      the name of the owner within its namespace
 */
public record TokenOwner(String namespace, String name) {

    public TokenOwner {
        if (namespace == null) {
            throw new IllegalArgumentException("Owner namespace cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("Owner name cannot be null");
        }
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
