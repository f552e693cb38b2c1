package com.vidnyan.linthub.domain.config;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Options the aggregation pipeline and the tweak rules read from a {@link LintConfig}.
 */
public enum Option {
    IGNORE_INFILE_CONFIG_FOR("ignore-infile-config-for", Type.SET),
    FLAKE8("flake8", Type.ARGS),
    PYLINT("pylint", Type.ARGS),
    NO_FLAKE8("no-flake8", Type.BOOL),
    ALLOWED_ONECHAR_NAMES("allowed-onechar-names", Type.SET);

    /**
     * Value shape of an option and how it is read from text.
     */
    public enum Type {
        /** {@code true}/{@code false}, absent means false. */
        BOOL,
        /** Whitespace separated command line arguments, kept in order. */
        ARGS,
        /** Comma separated values, unordered. */
        SET
    }

    private final String id;
    private final Type type;

    Option(String id, Type type) {
        this.id = id;
        this.type = type;
    }

    public String id() {
        return id;
    }

    public Type type() {
        return type;
    }

    /**
     * Default value used when a config does not set this option.
     */
    public Object defaultValue() {
        return switch (type) {
            case BOOL -> Boolean.FALSE;
            case ARGS -> List.of();
            case SET -> Set.of();
        };
    }

    /**
     * Convert a textual value (as found in properties) into this option's value type.
     */
    public Object parse(String raw) {
        String text = raw == null ? "" : raw.trim();
        return switch (type) {
            case BOOL -> Boolean.parseBoolean(text);
            case ARGS -> text.isEmpty() ? List.of() : List.of(text.split("\\s+"));
            case SET -> Arrays.stream(text.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toUnmodifiableSet());
        };
    }

    public static Optional<Option> fromId(String id) {
        return Arrays.stream(values())
                .filter(o -> o.id.equals(id))
                .findFirst();
    }
}
