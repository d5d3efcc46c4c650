package com.simpleamqp.transport;

import com.simpleamqp.config.TlsConfig;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.TrustManagerFactory;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.KeyStore;

/**
 * Builder for the client-side Netty SslContext from TlsConfig.
 */
public class TlsContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(TlsContextBuilder.class);

    private final TlsConfig config;

    public TlsContextBuilder(TlsConfig config) {
        this.config = config;
    }

    public SslContext buildClientContext() throws IOException, GeneralSecurityException {
        if (!config.isEnabled()) {
            throw new IllegalStateException("TLS is not enabled");
        }

        SslContextBuilder builder = SslContextBuilder.forClient();
        builder.protocols(config.getProtocolsArray());

        if (!config.isVerifyPeer()) {
            log.warn("Broker certificate verification is disabled");
            builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
        } else if (config.getTruststorePath() != null) {
            builder.trustManager(loadTrustManagerFactory());
        }

        // Client certificate for mutual TLS
        if (config.getKeystorePath() != null) {
            builder.keyManager(loadKeyManagerFactory());
        }

        log.debug("Built client SSL context with protocols={}", config.getProtocols());
        return builder.build();
    }

    private KeyManagerFactory loadKeyManagerFactory() throws IOException, GeneralSecurityException {
        String keystorePassword = config.getKeystorePassword();
        String keyPassword = config.getKeyPassword();

        KeyStore keyStore = KeyStore.getInstance(config.getKeystoreType());
        try (InputStream is = new FileInputStream(config.getKeystorePath())) {
            keyStore.load(is, keystorePassword != null ? keystorePassword.toCharArray() : null);
        }

        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(keyStore, keyPassword != null ? keyPassword.toCharArray() : null);

        log.debug("Loaded keystore from {}", config.getKeystorePath());
        return kmf;
    }

    private TrustManagerFactory loadTrustManagerFactory() throws IOException, GeneralSecurityException {
        String truststorePassword = config.getTruststorePassword();

        KeyStore trustStore = KeyStore.getInstance(config.getTruststoreType());
        try (InputStream is = new FileInputStream(config.getTruststorePath())) {
            trustStore.load(is, truststorePassword != null ? truststorePassword.toCharArray() : null);
        }

        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);

        log.debug("Loaded truststore from {}", config.getTruststorePath());
        return tmf;
    }
}
