package io.kubeplane.core.cluster;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Connection material for one cluster. Either a bearer token (inline or from a file), a client
 * certificate pair, or the name of a kubeconfig context that the client library resolves itself.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CredentialReference(
    String token,
    @JsonAlias({"token_file"}) String tokenFile,
    @JsonAlias({"ca_cert_file"}) String caCertFile,
    @JsonAlias({"client_cert_file"}) String clientCertFile,
    @JsonAlias({"client_key_file"}) String clientKeyFile,
    @JsonAlias({"insecure_skip_tls_verify"}) boolean insecureSkipTlsVerify,
    @JsonAlias({"kubeconfig_context"}) String kubeconfigContext
) {

    public static CredentialReference none() {
        return new CredentialReference(null, null, null, null, null, false, null);
    }

    public static CredentialReference bearer(String token) {
        return new CredentialReference(token, null, null, null, null, false, null);
    }

    public static CredentialReference kubeconfig(String contextName) {
        return new CredentialReference(null, null, null, null, null, false, contextName);
    }

    public boolean usesKubeconfig() {
        return kubeconfigContext != null && !kubeconfigContext.isBlank();
    }

    @Override
    public String toString() {
        return "CredentialReference[token=" + (token == null || token.isBlank() ? "<none>" : "<redacted>")
            + ", tokenFile=" + tokenFile
            + ", caCertFile=" + caCertFile
            + ", clientCertFile=" + clientCertFile
            + ", insecureSkipTlsVerify=" + insecureSkipTlsVerify
            + ", kubeconfigContext=" + kubeconfigContext + "]";
    }
}
