package io.kubeplane.core.cluster;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.VersionInfo;
import io.kubeplane.core.error.AuthenticationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class KubernetesCredentialSource implements CredentialSource {
    private static final Logger LOG = LoggerFactory.getLogger(KubernetesCredentialSource.class);

    private final Duration requestTimeout;
    private final Duration connectTimeout;
    private final boolean validateOnConnect;

    public KubernetesCredentialSource(Duration requestTimeout, boolean validateOnConnect) {
        this(requestTimeout, Duration.ofSeconds(10), validateOnConnect);
    }

    public KubernetesCredentialSource(Duration requestTimeout, Duration connectTimeout, boolean validateOnConnect) {
        this.requestTimeout = requestTimeout;
        this.connectTimeout = connectTimeout;
        this.validateOnConnect = validateOnConnect;
    }

    @Override
    public ClusterCapability connect(ClusterContext context) {
        Config config;
        try {
            config = buildConfig(context);
        } catch (IOException | RuntimeException e) {
            throw new AuthenticationException(
                "Cannot load credentials for cluster " + context.name() + ": " + e.getMessage(),
                e
            );
        }

        KubernetesClient client = new KubernetesClientBuilder().withConfig(config).build();
        if (validateOnConnect) {
            try {
                VersionInfo version = client.getKubernetesVersion();
                LOG.debug("Cluster {} reachable at {} (version {})", context.name(), client.getMasterUrl(), version.getGitVersion());
            } catch (KubernetesClientException e) {
                client.close();
                throw new AuthenticationException(
                    "Credential validation failed for cluster " + context.name() + ": " + describe(e),
                    e
                );
            }
        }
        return new ClusterCapability(context.name(), client);
    }

    Config buildConfig(ClusterContext context) throws IOException {
        CredentialReference credentials = context.credentials();
        ConfigBuilder builder;
        if (credentials.usesKubeconfig()) {
            builder = new ConfigBuilder(Config.autoConfigure(credentials.kubeconfigContext()));
            if (context.hasEndpoint()) {
                builder.withMasterUrl(context.endpoint());
            }
        } else {
            if (!context.hasEndpoint()) {
                throw new IllegalArgumentException("no endpoint and no kubeconfig context configured");
            }
            builder = new ConfigBuilder(Config.empty()).withMasterUrl(context.endpoint());
        }

        String token = resolveToken(credentials);
        if (token != null) {
            builder.withOauthToken(token);
        }
        if (notBlank(credentials.caCertFile())) {
            builder.withCaCertFile(credentials.caCertFile());
        }
        if (notBlank(credentials.clientCertFile())) {
            builder.withClientCertFile(credentials.clientCertFile());
            builder.withClientKeyFile(credentials.clientKeyFile());
        }
        if (credentials.insecureSkipTlsVerify()) {
            builder.withTrustCerts(true);
            builder.withDisableHostnameVerification(true);
        }
        if (context.hasEndpoint() && context.endpoint().toLowerCase(Locale.ROOT).startsWith("http://")) {
            builder.withHttp2Disable(true);
        }

        return builder
            .withNamespace(context.defaultNamespace())
            .withRequestRetryBackoffLimit(0)
            .withRequestTimeout((int) requestTimeout.toMillis())
            .withConnectionTimeout((int) connectTimeout.toMillis())
            .build();
    }

    private String resolveToken(CredentialReference credentials) throws IOException {
        if (notBlank(credentials.token())) {
            return credentials.token().trim();
        }
        if (notBlank(credentials.tokenFile())) {
            return Files.readString(Path.of(credentials.tokenFile()), StandardCharsets.UTF_8).trim();
        }
        return null;
    }

    private static String describe(KubernetesClientException e) {
        if (e.getCode() > 0) {
            return "HTTP " + e.getCode() + " " + e.getMessage();
        }
        Throwable cause = e.getCause() == null ? e : e.getCause();
        return cause.getMessage();
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
