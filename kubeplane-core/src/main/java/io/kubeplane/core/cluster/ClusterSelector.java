package io.kubeplane.core.cluster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record ClusterSelector(boolean all, List<String> names) {
    public static final String ALL = "all";

    public ClusterSelector {
        names = names == null ? List.of() : List.copyOf(names);
    }

    public static ClusterSelector allClusters() {
        return new ClusterSelector(true, List.of());
    }

    public static ClusterSelector single(String name) {
        return of(List.of(name));
    }

    public static ClusterSelector of(String... names) {
        return of(Arrays.asList(names));
    }

    public static ClusterSelector of(Collection<String> names) {
        Set<String> unique = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("cluster names must not be blank");
            }
            unique.add(name.trim());
        }
        if (unique.isEmpty()) {
            throw new IllegalArgumentException("an explicit cluster selector needs at least one name");
        }
        return new ClusterSelector(false, new ArrayList<>(unique));
    }

    /**
     * Reads a selector from a decoded JSON value: {@code "all"}, a single name, a comma separated
     * list of names, or an array of names. {@code null} and blank strings yield {@code fallback}.
     */
    public static ClusterSelector parse(Object raw, ClusterSelector fallback) {
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.isEmpty()) {
                return fallback;
            }
            if (ALL.equalsIgnoreCase(trimmed)) {
                return allClusters();
            }
            return of(Arrays.asList(trimmed.split(",")));
        }
        if (raw instanceof Collection<?> items) {
            List<String> names = new ArrayList<>(items.size());
            for (Object item : items) {
                if (!(item instanceof String name)) {
                    throw new IllegalArgumentException("cluster names must be strings");
                }
                names.add(name);
            }
            return of(names);
        }
        throw new IllegalArgumentException("clusters must be \"all\", a cluster name or a list of cluster names");
    }

    @Override
    public String toString() {
        return all ? ALL : String.join(",", names);
    }
}
