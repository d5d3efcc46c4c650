package com.simpleamqp.config;

import java.util.Arrays;
import java.util.List;

/**
 * Client-side TLS settings for the broker connection.
 */
public class TlsConfig {

    // Default TLS protocols
    public static final List<String> DEFAULT_PROTOCOLS = Arrays.asList("TLSv1.2", "TLSv1.3");

    private boolean enabled = false;
    private List<String> protocols = DEFAULT_PROTOCOLS;
    private boolean verifyPeer = true;
    private boolean verifyHostname = true;

    // Truststore used to verify the broker certificate
    private String truststorePath;
    private String truststorePassword;
    private String truststoreType = "PKCS12";

    // Client certificate, only needed for mutual TLS / SASL EXTERNAL
    private String keystorePath;
    private String keystorePassword;
    private String keystoreType = "PKCS12";
    private String keyPassword;

    public TlsConfig() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getProtocols() {
        return protocols;
    }

    public String[] getProtocolsArray() {
        return protocols.toArray(new String[0]);
    }

    public void setProtocols(List<String> protocols) {
        this.protocols = protocols;
    }

    public boolean isVerifyPeer() {
        return verifyPeer;
    }

    public void setVerifyPeer(boolean verifyPeer) {
        this.verifyPeer = verifyPeer;
    }

    public boolean isVerifyHostname() {
        return verifyHostname;
    }

    public void setVerifyHostname(boolean verifyHostname) {
        this.verifyHostname = verifyHostname;
    }

    public String getTruststorePath() {
        return truststorePath;
    }

    public void setTruststorePath(String truststorePath) {
        this.truststorePath = truststorePath;
    }

    public String getTruststorePassword() {
        return truststorePassword;
    }

    public void setTruststorePassword(String truststorePassword) {
        this.truststorePassword = truststorePassword;
    }

    public String getTruststoreType() {
        return truststoreType;
    }

    public void setTruststoreType(String truststoreType) {
        this.truststoreType = truststoreType;
    }

    public String getKeystorePath() {
        return keystorePath;
    }

    public void setKeystorePath(String keystorePath) {
        this.keystorePath = keystorePath;
    }

    public String getKeystorePassword() {
        return keystorePassword;
    }

    public void setKeystorePassword(String keystorePassword) {
        this.keystorePassword = keystorePassword;
    }

    public String getKeystoreType() {
        return keystoreType;
    }

    public void setKeystoreType(String keystoreType) {
        this.keystoreType = keystoreType;
    }

    public String getKeyPassword() {
        return keyPassword;
    }

    public void setKeyPassword(String keyPassword) {
        this.keyPassword = keyPassword;
    }

    @Override
    public String toString() {
        return String.format("TlsConfig{enabled=%s, protocols=%s, verifyPeer=%s, verifyHostname=%s}",
                enabled, protocols, verifyPeer, verifyHostname);
    }

    public static class Builder {
        private final TlsConfig config = new TlsConfig();

        public Builder enabled(boolean enabled) {
            config.enabled = enabled;
            return this;
        }

        public Builder protocols(List<String> protocols) {
            config.protocols = protocols;
            return this;
        }

        public Builder verifyPeer(boolean verifyPeer) {
            config.verifyPeer = verifyPeer;
            return this;
        }

        public Builder verifyHostname(boolean verifyHostname) {
            config.verifyHostname = verifyHostname;
            return this;
        }

        public Builder truststore(String path, String password, String type) {
            config.truststorePath = path;
            config.truststorePassword = password;
            config.truststoreType = type;
            return this;
        }

        public Builder keystore(String path, String password, String type, String keyPassword) {
            config.keystorePath = path;
            config.keystorePassword = password;
            config.keystoreType = type;
            config.keyPassword = keyPassword;
            return this;
        }

        public TlsConfig build() {
            return config;
        }
    }
}
