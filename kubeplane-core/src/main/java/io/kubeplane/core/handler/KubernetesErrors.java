package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.Status;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.kubeplane.core.error.AuthenticationException;
import io.kubeplane.core.error.ErrorKind;
import io.kubeplane.core.error.KubeplaneException;
import io.kubeplane.core.error.NotFoundException;
import io.kubeplane.core.error.TransientException;
import io.kubeplane.core.error.ValidationException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

final class KubernetesErrors {

    private KubernetesErrors() {
    }

    static <V> V translate(String kind, Verb verb, Supplier<V> call) {
        try {
            return call.get();
        } catch (KubeplaneException e) {
            throw e;
        } catch (KubernetesClientException e) {
            throw classify(kind, verb, e);
        }
    }

    static KubeplaneException classify(String kind, Verb verb, KubernetesClientException e) {
        int code = e.getCode();
        String message = kind + " " + verb.label() + " failed: " + reason(e);
        if (code == 404) {
            return new NotFoundException(message, e);
        }
        if (code == 400 || code == 409 || code == 422) {
            return new ValidationException(message, e);
        }
        if (code == 401 || code == 403) {
            return new AuthenticationException(message, e);
        }
        if (code == 408 || code == 429 || code >= 500) {
            return new TransientException(message, e);
        }
        if (hasCause(e, InterruptedException.class)) {
            return new KubeplaneException(ErrorKind.TIMEOUT, kind + " " + verb.label() + " interrupted", e);
        }
        if (code <= 0 && (hasCause(e, IOException.class) || hasCause(e, TimeoutException.class))) {
            return new TransientException(message, e);
        }
        return new KubeplaneException(ErrorKind.INTERNAL, message, e);
    }

    private static String reason(KubernetesClientException e) {
        Status status = e.getStatus();
        if (status != null && status.getMessage() != null && !status.getMessage().isBlank()) {
            return status.getMessage();
        }
        Throwable cause = e.getCause();
        if (e.getCode() <= 0 && cause != null && cause.getMessage() != null) {
            return cause.getMessage();
        }
        return e.getMessage();
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
