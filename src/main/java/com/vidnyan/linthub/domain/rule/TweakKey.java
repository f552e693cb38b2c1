package com.vidnyan.linthub.domain.rule;

import com.vidnyan.linthub.domain.model.Linter;

/**
 * Lookup key of a tweak rule.
 */
public record TweakKey(Linter source, String code) {

    public static TweakKey of(Linter source, String code) {
        return new TweakKey(source, code);
    }
}
