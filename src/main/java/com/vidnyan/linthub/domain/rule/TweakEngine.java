package com.vidnyan.linthub.domain.rule;

import com.vidnyan.linthub.domain.config.LintConfig;
import com.vidnyan.linthub.domain.model.Diagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies tweak rules to a diagnostic list, keeping the relative order of kept diagnostics.
 */
public final class TweakEngine {

    private TweakEngine() {
    }

    public static List<Diagnostic> apply(List<Diagnostic> diagnostics, Tweaks tweaks, LintConfig config) {
        List<Diagnostic> result = new ArrayList<>(diagnostics.size());
        for (Diagnostic diagnostic : diagnostics) {
            Optional<Tweaker> tweaker = tweaks.find(diagnostic.source(), diagnostic.code());
            if (tweaker.isEmpty()) {
                result.add(diagnostic);
                continue;
            }
            Tweaker rule = tweaker.get();
            if (rule.shouldKeep().test(diagnostic, config.relevant(rule.usedOptions()))) {
                result.add(diagnostic.withMessage(rule.reword().apply(diagnostic)));
            }
        }
        return result;
    }
}
