package com.vidnyan.linthub.domain.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable option set for one lint unit.
 * Built once upstream and passed by reference through the whole pipeline.
 */
public final class LintConfig {

    private static final LintConfig EMPTY = new LintConfig(new EnumMap<>(Option.class));

    private final Map<Option, Object> values;

    private LintConfig(EnumMap<Option, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static LintConfig empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Raw value of an option, falling back to the option's default.
     */
    public Object get(Option option) {
        return values.getOrDefault(option, option.defaultValue());
    }

    public boolean getBoolean(Option option) {
        return (Boolean) get(option);
    }

    @SuppressWarnings("unchecked")
    public List<String> getArgs(Option option) {
        return (List<String>) get(option);
    }

    @SuppressWarnings("unchecked")
    public Set<String> getSet(Option option) {
        return (Set<String>) get(option);
    }

    /**
     * Config restricted to the given options; unset options keep reading as defaults.
     */
    public LintConfig relevant(Set<Option> options) {
        EnumMap<Option, Object> subset = new EnumMap<>(Option.class);
        values.forEach((option, value) -> {
            if (options.contains(option)) {
                subset.put(option, value);
            }
        });
        return new LintConfig(subset);
    }

    public Set<Option> options() {
        return values.keySet();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LintConfig other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "LintConfig" + values;
    }

    public static class Builder {
        private final EnumMap<Option, Object> values = new EnumMap<>(Option.class);

        public Builder set(Option option, boolean value) {
            requireType(option, Option.Type.BOOL);
            values.put(option, value);
            return this;
        }

        public Builder set(Option option, List<String> args) {
            requireType(option, Option.Type.ARGS);
            values.put(option, List.copyOf(args));
            return this;
        }

        public Builder set(Option option, Set<String> items) {
            requireType(option, Option.Type.SET);
            values.put(option, Set.copyOf(items));
            return this;
        }

        /**
         * Set an option from its textual form.
         */
        public Builder parse(Option option, String raw) {
            values.put(option, option.parse(raw));
            return this;
        }

        public LintConfig build() {
            return new LintConfig(new EnumMap<>(values));
        }

        private static void requireType(Option option, Option.Type expected) {
            if (option.type() != expected) {
                throw new IllegalArgumentException(
                        "Option " + option.id() + " is " + option.type() + ", not " + expected);
            }
        }
    }
}
