package org.gc.relaymonitor.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.elasticsearch.client.ClientConfiguration;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchConfiguration;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.time.Duration;

/**
 * Store for sites, categories and the global schedule record.
 */
@Configuration
public class ElasticsearchConfig extends ElasticsearchConfiguration {

    @Value("${es.cluster-nodes:localhost:9200}")
    private String cluster;

    @Value("${es.trust-store:}")
    private String trustStore;

    @Value("${es.username:}")
    private String username;

    @Value("${es.password:}")
    private String password;

    @Value("${es.socket-timeout-seconds:30}")
    private int socketTimeoutSeconds;

    @Override
    public ClientConfiguration clientConfiguration() {
        var builder = ClientConfiguration.builder()
                .connectedTo(cluster);

        // TLS only when a CA certificate is configured
        if (hasText(trustStore)) {
            builder.usingSsl(sslContext(trustStore));
        }

        if (hasText(username) && hasText(password)) {
            builder.withBasicAuth(username, password);
        }

        return builder
                .withSocketTimeout(Duration.ofSeconds(socketTimeoutSeconds))
                .build();
    }

    private static SSLContext sslContext(String certificatePath) {
        try (InputStream in = Files.newInputStream(Path.of(certificatePath))) {
            Certificate ca = CertificateFactory.getInstance("X.509").generateCertificate(in);

            KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
            keyStore.load(null, null);
            keyStore.setCertificateEntry("ca", ca);

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(keyStore);

            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, tmf.getTrustManagers(), null);
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Cannot load Elasticsearch trust store " + certificatePath, e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
