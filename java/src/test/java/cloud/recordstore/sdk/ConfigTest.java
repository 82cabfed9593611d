package cloud.recordstore.sdk;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void appliesDefaultsForOptionalFields() {
        Config config = requiredOnly().build();

        assertEquals(Config.DEFAULT_TOKEN_URL, config.getTokenUrl());
        assertEquals(Config.DEFAULT_API_VERSION, config.getApiVersion());
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
        assertEquals("https://example.my.salesforce.com", config.getInstanceUrl());
        assertNotNull(config.getHttpClient());
    }

    @Test
    void rejectsMissingRequiredFields() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> requiredOnly().refreshToken("  ").build());
        assertEquals("RefreshToken is required", ex.getMessage());

        assertThrows(IllegalArgumentException.class, () -> requiredOnly().clientId(null).build());
        assertThrows(IllegalArgumentException.class, () -> requiredOnly().clientSecret("").build());
        assertThrows(IllegalArgumentException.class, () -> requiredOnly().instanceUrl(null).build());
    }

    @Test
    void rejectsInvalidUrls() {
        assertThrows(IllegalArgumentException.class, () -> requiredOnly().instanceUrl("invalid").build());
        assertThrows(IllegalArgumentException.class, () -> requiredOnly().tokenUrl("not a url").build());
    }

    @Test
    void honoursCustomValues() {
        Config config = requiredOnly()
            .apiVersion("v59.0")
            .tokenUrl("https://test.salesforce.com/services/oauth2/token")
            .httpTimeout(Duration.ofSeconds(5))
            .build();

        assertEquals("v59.0", config.getApiVersion());
        assertEquals("https://test.salesforce.com/services/oauth2/token", config.getTokenUrl());
        assertEquals(Duration.ofSeconds(5), config.getHttpTimeout());
    }

    @Test
    void nonPositiveTimeoutFallsBackToDefault() {
        Config config = requiredOnly().httpTimeout(Duration.ZERO).build();
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
    }

    @Test
    void readsSalesforceEnvironmentVariables() {
        Map<String, String> env = new HashMap<>();
        env.put(Config.ENV_CLIENT_ID, "env-client");
        env.put(Config.ENV_CLIENT_SECRET, "env-secret");
        env.put(Config.ENV_REFRESH_TOKEN, "env-refresh-token");
        env.put(Config.ENV_INSTANCE_URL, "https://acme.my.salesforce.com");

        Config config = Config.fromEnvironment(env);

        assertEquals("env-client", config.getClientId());
        assertEquals("env-refresh-token", config.getRefreshToken());
        assertEquals("v60.0", config.getApiVersion());

        env.remove(Config.ENV_CLIENT_SECRET);
        assertThrows(IllegalArgumentException.class, () -> Config.fromEnvironment(env));
    }

    @Test
    void credentialsMaskSecrets() {
        Credentials credentials = requiredOnly().build().credentials();

        assertEquals("client-id", credentials.clientId());
        assertEquals("v60.0", credentials.apiVersion());
        String printed = credentials.toString();
        assertTrue(printed.contains("client-id"));
        assertFalse(printed.contains("client-secret"));
        assertFalse(printed.contains("5Aep861-refresh"));
    }

    private static Config.Builder requiredOnly() {
        return Config.builder()
            .clientId("client-id")
            .clientSecret("client-secret")
            .refreshToken("5Aep861-refresh")
            .instanceUrl("https://example.my.salesforce.com/");
    }
}
