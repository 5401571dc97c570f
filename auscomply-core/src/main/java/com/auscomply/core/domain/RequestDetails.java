package com.auscomply.core.domain;

import jakarta.persistence.*;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Typed details of a data-subject request: a known shape plus a small bounded
 * extension map for host-specific attributes.
 */
@Embeddable
public class RequestDetails {

    public static final int MAX_EXTENSIONS = 16;
    public static final int MAX_KEY_LENGTH = 64;
    public static final int MAX_VALUE_LENGTH = 512;

    @Enumerated(EnumType.STRING)
    @Column(name = "details_kind", nullable = false, updatable = false)
    private Kind kind;

    @Column(name = "details_description", columnDefinition = "TEXT", updatable = false)
    private String description;

    @Convert(converter = StringMapJsonConverter.class)
    @Column(name = "details_corrections", columnDefinition = "TEXT", updatable = false)
    private Map<String, String> corrections = new TreeMap<>();

    @Convert(converter = StringMapJsonConverter.class)
    @Column(name = "details_extensions", columnDefinition = "TEXT", updatable = false)
    private Map<String, String> extensions = new TreeMap<>();

    protected RequestDetails() {}

    public static RequestDetails of(Kind kind, String description,
                                    Map<String, String> corrections,
                                    Map<String, String> extensions) {
        if (kind == null) {
            throw new IllegalArgumentException("Request details kind is required");
        }
        var details = new RequestDetails();
        details.kind = kind;
        details.description = description;
        details.corrections = corrections == null ? new TreeMap<>() : new TreeMap<>(corrections);
        details.extensions = boundedCopy(extensions);
        return details;
    }

    /**
     * Default details for a request type when the caller supplies none.
     */
    public static RequestDetails defaultFor(DataSubjectRequest.RequestType type) {
        return of(Kind.forRequestType(type), null, null, null);
    }

    private static Map<String, String> boundedCopy(Map<String, String> extensions) {
        if (extensions == null) {
            return new TreeMap<>();
        }
        if (extensions.size() > MAX_EXTENSIONS) {
            throw new IllegalArgumentException(
                    "At most " + MAX_EXTENSIONS + " extension entries are allowed, got " + extensions.size());
        }
        Map<String, String> copy = new TreeMap<>();
        extensions.forEach((key, value) -> {
            if (key == null || key.isBlank() || key.length() > MAX_KEY_LENGTH) {
                throw new IllegalArgumentException("Extension keys must be 1-" + MAX_KEY_LENGTH + " characters");
            }
            if (value != null && value.length() > MAX_VALUE_LENGTH) {
                throw new IllegalArgumentException(
                        "Extension value for '" + key + "' exceeds " + MAX_VALUE_LENGTH + " characters");
            }
            copy.put(key, value);
        });
        return copy;
    }

    public Kind getKind() { return kind; }
    public String getDescription() { return description; }
    public Map<String, String> getCorrections() { return Collections.unmodifiableMap(corrections); }
    public Map<String, String> getExtensions() { return Collections.unmodifiableMap(extensions); }

    public enum Kind {
        ACCESS_SCOPE,
        DELETION_SCOPE,
        PORTABILITY_FORMAT,
        CORRECTION;

        public static Kind forRequestType(DataSubjectRequest.RequestType type) {
            return switch (type) {
                case ACCESS -> ACCESS_SCOPE;
                case DELETION -> DELETION_SCOPE;
                case PORTABILITY -> PORTABILITY_FORMAT;
                case CORRECTION -> CORRECTION;
            };
        }
    }
}
