package cloud.recordstore.sdk;

import java.util.Objects;

/**
 * OAuth client credentials plus the long-lived refresh token and the instance they belong to. Immutable for the lifetime
 * of the process.
 *
 * <p>
 * {@link #toString()} masks the client secret and the refresh token so instances are safe to log.
 * </p>
 */
public record Credentials(
    String clientId,
    String clientSecret,
    String refreshToken,
    String instanceUrl,
    String apiVersion
) {

    public Credentials {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(clientSecret, "clientSecret");
        Objects.requireNonNull(refreshToken, "refreshToken");
        Objects.requireNonNull(instanceUrl, "instanceUrl");
        Objects.requireNonNull(apiVersion, "apiVersion");
    }

    @Override
    public String toString() {
        return "Credentials[clientId=" + clientId
            + ", clientSecret=****"
            + ", refreshToken=" + mask(refreshToken)
            + ", instanceUrl=" + instanceUrl
            + ", apiVersion=" + apiVersion + "]";
    }

    static String mask(String value) {
        if (value == null || value.length() <= 8) {
            return "****";
        }
        return value.substring(0, 4) + "****";
    }
}
