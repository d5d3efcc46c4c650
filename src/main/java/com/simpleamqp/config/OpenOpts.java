package com.simpleamqp.config;

import com.simpleamqp.amqp.AmqpConstants;
import com.simpleamqp.exception.BadUriException;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection options for opening a session.
 * Supports configuration from an AMQP URI, properties, environment variables, and programmatic settings.
 */
public class OpenOpts {

    private String host = "localhost";
    private int port = AmqpConstants.DEFAULT_PORT;
    private String vhost = "/";
    private Auth auth = new BasicAuth("guest", "guest");
    private int frameMax = AmqpConstants.DEFAULT_FRAME_MAX;
    private int connectTimeoutMillis = 10000;
    private TlsConfig tls = new TlsConfig();

    public OpenOpts() {
    }

    /**
     * Parse {@code amqp://[user[:pass]@]host[:port][/vhost]} or the {@code amqps://} form.
     * Missing parts take the defaults: guest/guest, port 5672 (5671 for amqps), vhost "/".
     *
     * @throws BadUriException if the string is not an AMQP URI
     */
    public static OpenOpts fromUri(String uri) {
        URI parsed;
        try {
            parsed = new URI(uri);
        } catch (URISyntaxException e) {
            throw new BadUriException(uri, e);
        }

        String scheme = parsed.getScheme();
        boolean secure;
        if ("amqp".equalsIgnoreCase(scheme)) {
            secure = false;
        } else if ("amqps".equalsIgnoreCase(scheme)) {
            secure = true;
        } else {
            throw new BadUriException(uri);
        }
        if (parsed.getHost() == null || parsed.getHost().isEmpty()) {
            throw new BadUriException(uri);
        }

        OpenOpts opts = new OpenOpts();
        opts.host = parsed.getHost();
        if (secure) {
            opts.tls.setEnabled(true);
        }
        if (parsed.getPort() != -1) {
            opts.port = parsed.getPort();
        } else {
            opts.port = secure ? AmqpConstants.DEFAULT_TLS_PORT : AmqpConstants.DEFAULT_PORT;
        }

        String userInfo = parsed.getRawUserInfo();
        if (userInfo != null) {
            int colon = userInfo.indexOf(':');
            String user = colon >= 0 ? userInfo.substring(0, colon) : userInfo;
            String password = colon >= 0 ? userInfo.substring(colon + 1) : "guest";
            opts.auth = new BasicAuth(percentDecode(user), percentDecode(password));
        }

        String path = parsed.getRawPath();
        if (path != null && path.length() > 1) {
            opts.vhost = percentDecode(path.substring(1));
        }
        return opts;
    }

    private static String percentDecode(String value) {
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    /**
     * Load configuration from environment variables.
     */
    public OpenOpts loadFromEnvironment() {
        return loadFromEnvironment(System.getenv());
    }

    OpenOpts loadFromEnvironment(Map<String, String> env) {
        if (env.containsKey("AMQP_HOST")) {
            host = env.get("AMQP_HOST");
        }
        if (env.containsKey("AMQP_PORT")) {
            port = Integer.parseInt(env.get("AMQP_PORT"));
        }
        if (env.containsKey("AMQP_VHOST")) {
            vhost = env.get("AMQP_VHOST");
        }
        if (env.containsKey("AMQP_USER")) {
            auth = new BasicAuth(env.get("AMQP_USER"), env.getOrDefault("AMQP_PASSWORD", ""));
        }
        if (env.containsKey("AMQP_FRAME_MAX")) {
            frameMax = Integer.parseInt(env.get("AMQP_FRAME_MAX"));
        }
        return this;
    }

    /**
     * Load configuration from Properties object.
     */
    public OpenOpts loadFromProperties(Properties properties) {
        if (properties.containsKey("host")) {
            host = properties.getProperty("host");
        }
        if (properties.containsKey("port")) {
            port = Integer.parseInt(properties.getProperty("port"));
        }
        if (properties.containsKey("vhost")) {
            vhost = properties.getProperty("vhost");
        }
        if (properties.containsKey("user")) {
            auth = new BasicAuth(properties.getProperty("user"), properties.getProperty("password", ""));
        }
        if (properties.containsKey("frame.max")) {
            frameMax = Integer.parseInt(properties.getProperty("frame.max"));
        }
        if (properties.containsKey("tls.enabled")) {
            tls.setEnabled(Boolean.parseBoolean(properties.getProperty("tls.enabled")));
        }
        return this;
    }

    /**
     * Export configuration as a map. Credentials are left out.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("host", host);
        map.put("port", port);
        map.put("vhost", vhost);
        map.put("mechanism", auth.getMechanism());
        map.put("frameMax", frameMax);
        map.put("connectTimeoutMillis", connectTimeoutMillis);
        map.put("tlsEnabled", tls.isEnabled());
        return map;
    }

    // Getters and setters

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getVhost() {
        return vhost;
    }

    public void setVhost(String vhost) {
        this.vhost = vhost;
    }

    public Auth getAuth() {
        return auth;
    }

    public void setAuth(Auth auth) {
        this.auth = auth;
    }

    public int getFrameMax() {
        return frameMax;
    }

    public void setFrameMax(int frameMax) {
        this.frameMax = frameMax;
    }

    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public void setConnectTimeoutMillis(int connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public TlsConfig getTls() {
        return tls;
    }

    public void setTls(TlsConfig tls) {
        this.tls = tls;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OpenOpts)) return false;
        OpenOpts other = (OpenOpts) o;
        return port == other.port
                && frameMax == other.frameMax
                && host.equals(other.host)
                && vhost.equals(other.vhost)
                && auth.equals(other.auth)
                && tls.isEnabled() == other.tls.isEnabled();
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, vhost, auth, frameMax, tls.isEnabled());
    }

    @Override
    public String toString() {
        return String.format("OpenOpts{host='%s', port=%d, vhost='%s', mechanism=%s, frameMax=%d, tls=%s}",
                host, port, vhost, auth.getMechanism(), frameMax, tls.isEnabled());
    }

    /**
     * SASL credentials presented in connection.start-ok.
     */
    public interface Auth {
        String getMechanism();

        byte[] getResponse();
    }

    public static final class BasicAuth implements Auth {
        private final String username;
        private final String password;

        public BasicAuth(String username, String password) {
            this.username = Objects.requireNonNull(username, "username");
            this.password = Objects.requireNonNull(password, "password");
        }

        public String getUsername() {
            return username;
        }

        public String getPassword() {
            return password;
        }

        @Override
        public String getMechanism() {
            return AmqpConstants.MECHANISM_PLAIN;
        }

        @Override
        public byte[] getResponse() {
            return ("\0" + username + "\0" + password).getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BasicAuth)) return false;
            BasicAuth other = (BasicAuth) o;
            return username.equals(other.username) && password.equals(other.password);
        }

        @Override
        public int hashCode() {
            return Objects.hash(username, password);
        }

        @Override
        public String toString() {
            return "BasicAuth{username='" + username + "'}";
        }
    }

    /**
     * SASL EXTERNAL, identity taken from the TLS client certificate.
     */
    public static final class ExternalSaslAuth implements Auth {
        private final String identity;

        public ExternalSaslAuth(String identity) {
            this.identity = Objects.requireNonNull(identity, "identity");
        }

        public String getIdentity() {
            return identity;
        }

        @Override
        public String getMechanism() {
            return AmqpConstants.MECHANISM_EXTERNAL;
        }

        @Override
        public byte[] getResponse() {
            return identity.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ExternalSaslAuth && identity.equals(((ExternalSaslAuth) o).identity);
        }

        @Override
        public int hashCode() {
            return identity.hashCode();
        }

        @Override
        public String toString() {
            return "ExternalSaslAuth{identity='" + identity + "'}";
        }
    }
}
