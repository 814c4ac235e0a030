package com.dtech.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips credentials from data before it reaches a log line.
 * <p>
 * Field names are matched case-insensitively against a set of fragments ({@code password},
 * {@code token}, {@code secret}, {@code authorization} by default). Links carrying a
 * {@code token} query parameter keep their path but lose the token value.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_FRAGMENTS = Set.of(
            "password", "token", "secret", "authorization", "credential");

    private static final Pattern TOKEN_PARAMETER = Pattern.compile("([?&]token=)[^&#]*", Pattern.CASE_INSENSITIVE);

    private final Set<String> fragments;
    private final Pattern fieldPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_FRAGMENTS);
    }

    public SensitiveDataRedactor(Set<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("fragments must not be empty");
        }
        this.fragments = Set.copyOf(fragments);
        this.fieldPattern = Pattern.compile(
                String.join("|", this.fragments.stream().map(Pattern::quote).toList()),
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * Copy of {@code data} with the values of sensitive keys replaced by {@value #REDACTED}.
     * Iteration order is preserved; {@code null} yields an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : value));
        return result;
    }

    /**
     * Replaces every {@code token} query parameter value in {@code link}.
     */
    public String redactLink(String link) {
        if (link == null) {
            return null;
        }
        return TOKEN_PARAMETER.matcher(link).replaceAll("$1" + Matcher.quoteReplacement(REDACTED));
    }

    public boolean isSensitive(String fieldName) {
        return fieldName != null && fieldPattern.matcher(fieldName).find();
    }

    public Set<String> fragments() {
        return fragments;
    }
}
