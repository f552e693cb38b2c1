package com.vidnyan.linthub.adapter.out.catalog;

import com.vidnyan.linthub.domain.config.LintConfig;
import com.vidnyan.linthub.domain.config.Option;
import com.vidnyan.linthub.domain.model.Diagnostic;
import com.vidnyan.linthub.domain.model.Linter;
import com.vidnyan.linthub.domain.rule.TweakEngine;
import com.vidnyan.linthub.domain.rule.Tweaks;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinTweakCatalogTest {

    private final Tweaks tweaks = new BuiltinTweakCatalog().get();

    private static Diagnostic invalidName(String name) {
        return Diagnostic.at(Linter.PYLINT, "a.py", 3, 0, "C0103",
                "Variable name \"" + name + "\" doesn't conform to snake_case naming style");
    }

    @Test
    void invalidName_ShouldDropAllowedSingleLetterNames() {
        LintConfig config = LintConfig.builder()
                .set(Option.ALLOWED_ONECHAR_NAMES, Set.of("i", "x"))
                .build();

        List<Diagnostic> result = TweakEngine.apply(List.of(invalidName("x"), invalidName("q")), tweaks, config);

        assertEquals(1, result.size());
        assertEquals("Single letter variable name \"q\" is not descriptive, use a longer name.",
                result.get(0).message());
    }

    @Test
    void invalidName_ShouldRewordLongerNames() {
        List<Diagnostic> result = TweakEngine.apply(List.of(invalidName("myVar")), tweaks, LintConfig.empty());

        assertEquals("The variable name \"myVar\" should follow the snake_case naming style.",
                result.get(0).message());
    }

    @Test
    void invalidName_ShouldKeepUnrecognizedMessage() {
        Diagnostic odd = Diagnostic.at(Linter.PYLINT, "a.py", 3, 0, "C0103", "something else");

        assertEquals(List.of(odd), TweakEngine.apply(List.of(odd), tweaks, LintConfig.empty()));
    }

    @Test
    void lineTooLong_ShouldBeReworded() {
        Diagnostic longLine = Diagnostic.at(Linter.FLAKE8, "a.py", 9, 80, "E501", "line too long (88 > 79 characters)");

        Diagnostic result = TweakEngine.apply(List.of(longLine), tweaks, LintConfig.empty()).get(0);

        assertEquals("Line is too long (88 characters, at most 79 allowed).", result.message());
        assertEquals(9, result.line());
        assertEquals(80, result.column());
    }

    @Test
    void considerUsingIn_ShouldBeReworded() {
        Diagnostic diagnostic = Diagnostic.at(Linter.PYLINT, "a.py", 2, 7, "R1714",
                "Consider merging these comparisons with 'in' by using 'x in (1, 2)'. "
                        + "Use a set instead if elements are hashable.");

        Diagnostic result = TweakEngine.apply(List.of(diagnostic), tweaks, LintConfig.empty()).get(0);

        assertEquals("Use 'x in (1, 2)' instead of comparing the same value repeatedly.", result.message());
    }
}
