package com.vidnyan.linthub.adapter.out.catalog;

import com.vidnyan.linthub.application.port.out.TweakCatalog;
import com.vidnyan.linthub.domain.config.LintConfig;
import com.vidnyan.linthub.domain.config.Option;
import com.vidnyan.linthub.domain.model.Diagnostic;
import com.vidnyan.linthub.domain.model.Linter;
import com.vidnyan.linthub.domain.rule.TweakKey;
import com.vidnyan.linthub.domain.rule.Tweaker;
import com.vidnyan.linthub.domain.rule.Tweaks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tweak rules shipped with linthub.
 */
@Slf4j
@Component
public class BuiltinTweakCatalog implements TweakCatalog {

    private static final Pattern INVALID_NAME =
            Pattern.compile("^(\\w[\\w ]*) name \"([^\"]+)\" doesn't conform to (.+?)\\.?$");
    private static final Pattern CONSIDER_USING_IN = Pattern.compile("by using '([^']+)'");
    private static final Pattern LINE_TOO_LONG = Pattern.compile("\\((\\d+) > (\\d+) characters\\)");

    private final Tweaks tweaks;

    public BuiltinTweakCatalog() {
        Map<TweakKey, Tweaker> rules = new HashMap<>();
        rules.put(TweakKey.of(Linter.PYLINT, "C0103"), invalidName());
        rules.put(TweakKey.of(Linter.PYLINT, "R1714"), Tweaker.rewording(BuiltinTweakCatalog::considerUsingIn));
        rules.put(TweakKey.of(Linter.FLAKE8, "E501"), Tweaker.rewording(BuiltinTweakCatalog::lineTooLong));
        this.tweaks = new Tweaks(rules);
        log.info("Registered {} tweak rules", rules.size());
    }

    @Override
    public Tweaks get() {
        return tweaks;
    }

    /**
     * invalid-name: single letter names the config allows are dropped, the rest reworded.
     */
    static Tweaker invalidName() {
        return new Tweaker(
                Set.of(Option.ALLOWED_ONECHAR_NAMES),
                BuiltinTweakCatalog::keepInvalidName,
                BuiltinTweakCatalog::rewordInvalidName);
    }

    private static boolean keepInvalidName(Diagnostic diagnostic, LintConfig config) {
        Matcher matcher = INVALID_NAME.matcher(diagnostic.message());
        if (!matcher.matches()) {
            return true;
        }
        String name = matcher.group(2);
        return name.length() != 1 || !config.getSet(Option.ALLOWED_ONECHAR_NAMES).contains(name);
    }

    private static String rewordInvalidName(Diagnostic diagnostic) {
        Matcher matcher = INVALID_NAME.matcher(diagnostic.message());
        if (!matcher.matches()) {
            return diagnostic.message();
        }
        String kind = matcher.group(1).toLowerCase();
        String name = matcher.group(2);
        if (name.length() == 1) {
            return "Single letter " + kind + " name \"" + name + "\" is not descriptive, use a longer name.";
        }
        return "The " + kind + " name \"" + name + "\" should follow the " + matcher.group(3) + ".";
    }

    private static String considerUsingIn(Diagnostic diagnostic) {
        Matcher matcher = CONSIDER_USING_IN.matcher(diagnostic.message());
        if (!matcher.find()) {
            return diagnostic.message();
        }
        return "Use '" + matcher.group(1) + "' instead of comparing the same value repeatedly.";
    }

    private static String lineTooLong(Diagnostic diagnostic) {
        Matcher matcher = LINE_TOO_LONG.matcher(diagnostic.message());
        if (!matcher.find()) {
            return diagnostic.message();
        }
        return "Line is too long (" + matcher.group(1) + " characters, at most " + matcher.group(2) + " allowed).";
    }
}
