package com.vidnyan.linthub.domain.rule;

import com.vidnyan.linthub.domain.config.LintConfig;
import com.vidnyan.linthub.domain.config.Option;
import com.vidnyan.linthub.domain.model.Diagnostic;

import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Rule that decides whether a diagnostic is kept and what its message becomes.
 *
 * @param usedOptions options the rule may read; {@code shouldKeep} only ever sees these
 * @param shouldKeep  keep/drop decision given the diagnostic and the relevant config
 * @param reword      replacement message for kept diagnostics
 */
public record Tweaker(
    Set<Option> usedOptions,
    BiPredicate<Diagnostic, LintConfig> shouldKeep,
    Function<Diagnostic, String> reword
) {

    public Tweaker {
        usedOptions = Set.copyOf(usedOptions);
    }

    /**
     * Rule that keeps everything and only changes the message.
     */
    public static Tweaker rewording(Function<Diagnostic, String> reword) {
        return new Tweaker(Set.of(), (d, config) -> true, reword);
    }
}
