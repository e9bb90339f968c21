package org.janelia.dwiproc.bids;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, ordered set of acquisition identifiers (subject, session, run, ...)
 * that identifies one acquisition or output group.
 *
 * Keys are always reported in BIDS order regardless of the order they were added.
 */
public class BidsEntities
        implements Serializable {

    public static final String SUBJECT = "sub";
    public static final String SESSION = "ses";
    public static final String ACQUISITION = "acq";
    public static final String DIRECTION = "dir";
    public static final String RUN = "run";

    /** Recognized entity keys in the order they appear in names. */
    public static final List<String> KEY_ORDER =
            Collections.unmodifiableList(Arrays.asList(SUBJECT, SESSION, ACQUISITION, DIRECTION, RUN));

    private final Map<String, String> keyToValue;

    private BidsEntities(final Map<String, String> keyToValue) {
        final Map<String, String> ordered = new LinkedHashMap<>();
        for (final String key : KEY_ORDER) {
            final String value = keyToValue.get(key);
            if (value != null) {
                ordered.put(key, value);
            }
        }
        this.keyToValue = Collections.unmodifiableMap(ordered);
    }

    public static BidsEntities forSubject(final String subject) {
        return new Builder().subject(subject).build();
    }

    public String getSubject() {
        return keyToValue.get(SUBJECT);
    }

    public String getSession() {
        return keyToValue.get(SESSION);
    }

    public String getRun() {
        return keyToValue.get(RUN);
    }

    public String get(final String key) {
        return keyToValue.get(key);
    }

    /**
     * @return ordered, unmodifiable view of the populated entities.
     */
    public Map<String, String> asMap() {
        return keyToValue;
    }

    /**
     * @return copy of these entities with the specified value (null removes the key).
     */
    public BidsEntities with(final String key,
                             final Object value) {
        final Builder builder = toBuilder();
        builder.put(key, value);
        return builder.build();
    }

    public Builder toBuilder() {
        final Builder builder = new Builder();
        builder.keyToValue.putAll(keyToValue);
        return builder;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        return keyToValue.equals(((BidsEntities) o).keyToValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyToValue);
    }

    @Override
    public String toString() {
        return keyToValue.toString();
    }

    public static class Builder {

        private final Map<String, String> keyToValue = new LinkedHashMap<>();

        public Builder subject(final String subject) {
            return put(SUBJECT, subject);
        }

        public Builder session(final String session) {
            return put(SESSION, session);
        }

        public Builder run(final Object run) {
            return put(RUN, run);
        }

        public Builder put(final String key,
                           final Object value) {
            if (! KEY_ORDER.contains(key)) {
                throw new IllegalArgumentException("unsupported entity '" + key + "', must be one of " + KEY_ORDER);
            }
            if (value == null) {
                keyToValue.remove(key);
            } else {
                final String stringValue = String.valueOf(value);
                if (stringValue.isEmpty() || stringValue.contains("_") || stringValue.contains("-") ||
                    stringValue.contains("/")) {
                    throw new IllegalArgumentException("invalid value '" + stringValue + "' for entity '" + key + "'");
                }
                keyToValue.put(key, stringValue);
            }
            return this;
        }

        public BidsEntities build() {
            if (! keyToValue.containsKey(SUBJECT)) {
                throw new IllegalArgumentException("subject entity must be specified");
            }
            return new BidsEntities(keyToValue);
        }
    }

}
