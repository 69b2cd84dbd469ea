package agents.gateway.config;

/**
 * Turns a server's credential reference into the bearer token sent upstream.
 * {@code env:NAME} reads NAME from system properties (where dotenv puts .env.local) and then
 * from the process environment; any other value is the token itself.
 */
public final class CredentialResolver {

    private static final String ENV_PREFIX = "env:";

    private CredentialResolver() {
    }

    public static String resolve(String credentialRef) {
        if (credentialRef == null || credentialRef.isEmpty()) {
            return null;
        }
        if (credentialRef.startsWith(ENV_PREFIX)) {
            return getConfigValue(credentialRef.substring(ENV_PREFIX.length()));
        }
        return credentialRef;
    }

    /**
     * Checks both System.getProperty() (from dotenv) and System.getenv() (from OS)
     */
    public static String getConfigValue(String key) {
        String value = System.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            value = System.getenv(key);
        }
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }
}
