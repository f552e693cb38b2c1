package com.vidnyan.linthub.domain.rule;

import com.vidnyan.linthub.domain.model.Linter;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only tweak table keyed by (source, code).
 */
public record Tweaks(Map<TweakKey, Tweaker> rules) {

    public Tweaks {
        rules = Map.copyOf(rules);
    }

    public static Tweaks none() {
        return new Tweaks(Map.of());
    }

    public Optional<Tweaker> find(Linter source, String code) {
        return Optional.ofNullable(rules.get(TweakKey.of(source, code)));
    }
}
