package io.kubeplane.core.handler;

import java.util.Locale;

/**
 * Operations a resource handler may support. A verb is idempotent when repeating it after an
 * ambiguous failure cannot change the outcome, which is what makes it safe to retry.
 */
public enum Verb {
    LIST(false, true),
    GET(false, true),
    CREATE(true, false),
    UPDATE(true, true),
    DELETE(true, false),
    SCALE(true, true),
    LOGS(false, true),
    EVENTS(false, true);

    private final boolean mutating;
    private final boolean idempotent;

    Verb(boolean mutating, boolean idempotent) {
        this.mutating = mutating;
        this.idempotent = idempotent;
    }

    public boolean mutating() {
        return mutating;
    }

    public boolean idempotent() {
        return idempotent;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
