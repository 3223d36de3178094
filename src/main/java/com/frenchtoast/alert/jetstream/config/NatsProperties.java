package com.frenchtoast.alert.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * NATS connection settings used by the queue trigger.
 *
 * <h2>Binding</h2>
 * Properties are bound from the prefix {@code frenchtoast.nats}, e.g.:
 * <pre>
 * frenchtoast:
 *   nats:
 *     url: nats://localhost:4222
 *     user: ...
 *     password: ...
 *     token: ...
 *     creds: /path/to/user.creds
 *     tls: false
 * </pre>
 *
 * Secrets (password/token) should come from environment variables rather than committed config.
 */
@ConfigurationProperties(prefix = "frenchtoast.nats")
public class NatsProperties {

    private String url = "nats://localhost:4222";

    private String user;

    private String password;

    private String token;

    /** Path to a NATS credentials (JWT + nkey seed) file. */
    private String creds;

    private boolean tls = false;

    /** Connection name reported to the server; helps telling workers apart. */
    private String connectionName = "french-toast-alerter";

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public String getCreds() { return creds; }
    public void setCreds(String creds) { this.creds = creds; }

    public boolean isTls() { return tls; }
    public void setTls(boolean tls) { this.tls = tls; }

    public String getConnectionName() { return connectionName; }
    public void setConnectionName(String connectionName) { this.connectionName = connectionName; }
}
