package cloud.recordstore.sdk.auth;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Represents an issued access token. The record API does not reliably advertise expiry, so none is tracked: a token
 * is considered usable until the API rejects it.
 *
 * <p>
 * Instances are immutable; a refresh produces a new instance. Identity matters: the token manager compares the
 * instance a caller saw rejected with the cached one to decide whether a refresh already happened.
 * </p>
 */
public final class AccessToken {

    private final String value;
    private final Instant acquiredAt;
    private final String instanceUrl;
    private final String tokenType;

    public AccessToken(String value, Instant acquiredAt, String instanceUrl, String tokenType) {
        this.value = Objects.requireNonNull(value, "value");
        this.acquiredAt = Objects.requireNonNull(acquiredAt, "acquiredAt");
        this.instanceUrl = instanceUrl;
        this.tokenType = tokenType;
    }

    public String getValue() {
        return value;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    /**
     * @return instance URL echoed by the token endpoint, when it returned one.
     */
    public Optional<String> getInstanceUrl() {
        return Optional.ofNullable(instanceUrl);
    }

    public String getTokenType() {
        return tokenType;
    }

    @Override
    public String toString() {
        return "AccessToken[acquiredAt=" + acquiredAt + ", instanceUrl=" + instanceUrl + ", tokenType=" + tokenType + "]";
    }
}
