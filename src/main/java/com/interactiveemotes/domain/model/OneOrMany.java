package com.interactiveemotes.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A rule-file value that may be absent, a single value, or a list of alternatives.
 *
 * <p>Rule authors write {@code "Emote": "happy"} or {@code "Emote": ["happy", "heart"]}
 * interchangeably; the parser turns both forms into this type so call sites never
 * inspect raw JSON. Use {@code ChoiceResolver} to pick one value.
 */
public final class OneOrMany<T> {

    private static final OneOrMany<?> NONE = new OneOrMany<>(List.of());

    private final List<T> values;

    private OneOrMany(List<T> values) {
        this.values = values;
    }

    @SuppressWarnings("unchecked")
    public static <T> OneOrMany<T> none() {
        return (OneOrMany<T>) NONE;
    }

    public static <T> OneOrMany<T> one(T value) {
        Objects.requireNonNull(value, "value");
        return new OneOrMany<>(List.of(value));
    }

    public static <T> OneOrMany<T> many(List<T> values) {
        if (values == null || values.isEmpty()) {
            return none();
        }
        return new OneOrMany<>(List.copyOf(values));
    }

    public List<T> values() {
        return Collections.unmodifiableList(values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public boolean contains(T value) {
        return values.contains(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OneOrMany<?> other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        if (values.isEmpty()) {
            return "none";
        }
        return values.size() == 1 ? String.valueOf(values.get(0)) : values.toString();
    }
}
