package tokenvault.core.model;

/**
 * OAuth credentials persisted for a single {@link TokenOwner}.
 *
 * <p>The record is always stored and read as a whole. String fields are never null;
 * a missing value is represented by an empty string.
 *
 * @param username     the user the token was issued to
 * @param accessToken  the access token
 * @param tokenType    the token type (e.g., "Bearer")
 * @param refreshToken the refresh token
 * @param expiry       expiry in seconds since the epoch, read as an unsigned 64-bit value; 0 means unset
 */
public record StoredToken(String username, String accessToken, String tokenType, String refreshToken, long expiry) {

    public StoredToken {
        username = username == null ? "" : username;
        accessToken = accessToken == null ? "" : accessToken;
        tokenType = tokenType == null ? "" : tokenType;
        refreshToken = refreshToken == null ? "" : refreshToken;
    }

    /**
     * Returns the expiry as an unsigned decimal string.
     */
    public String expiryAsString() {
        return Long.toUnsignedString(expiry);
    }

    @Override
    public String toString() {
        // Never print credentials
        return "StoredToken[username=" + username + ", tokenType=" + tokenType + ", expiry=" + expiryAsString() + "]";
    }
}
