package in.warmguard.domain.session;

/**
 * Network proxy an automation context routes through. Credentials are optional.
 */
public record ProxyConfig(String server, String username, String password) {

    public ProxyConfig {
        if (server == null || server.isBlank()) {
            throw new IllegalArgumentException("proxy server is required");
        }
    }

    public static ProxyConfig of(String server) {
        return new ProxyConfig(server, null, null);
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    @Override
    public String toString() {
        return "ProxyConfig[server=" + server + ", username=" + username + "]";
    }
}
