package com.vidnyan.linthub.adapter.out.infile;

import com.vidnyan.linthub.application.port.out.InfileConfigChecker;
import com.vidnyan.linthub.domain.model.Diagnostic;
import com.vidnyan.linthub.domain.model.Linter;
import com.vidnyan.linthub.domain.model.ProperPath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reports {@code # linthub: ...} directives that configure options the caller disallowed.
 * <p>
 * A directive is a comment such as {@code # linthub: pylint=--disable=C0114 no-flake8}.
 * Each whitespace separated token names an option, optionally followed by {@code =value}.
 */
@Slf4j
@Component
public class DirectiveInfileConfigChecker implements InfileConfigChecker {

    static final String CODE = "E1001";
    static final String SYMBOL = "disallowed-infile-config";

    private static final Pattern DIRECTIVE = Pattern.compile("#\\s*linthub:\\s*(.*)$");

    @Override
    public List<Diagnostic> check(List<String> filenames, Set<String> ignored) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (String filename : filenames) {
            List<String> lines = readLines(filename);
            for (int i = 0; i < lines.size(); i++) {
                Matcher matcher = DIRECTIVE.matcher(lines.get(i));
                if (!matcher.find()) {
                    continue;
                }
                Set<String> disallowed = disallowedOptions(matcher.group(1), ignored);
                if (disallowed.isEmpty()) {
                    continue;
                }
                diagnostics.add(new Diagnostic(
                        Linter.LINTHUB,
                        ProperPath.of(filename),
                        i + 1,
                        matcher.start() + 1,
                        CODE,
                        "In-file configuration of " + String.join(", ", disallowed) + " is not allowed",
                        null,
                        null,
                        SYMBOL));
            }
        }
        log.debug("In-file config check found {} disallowed directive(s)", diagnostics.size());
        return diagnostics;
    }

    private static Set<String> disallowedOptions(String directive, Set<String> ignored) {
        Set<String> result = new LinkedHashSet<>();
        for (String token : directive.trim().split("\\s+")) {
            int eq = token.indexOf('=');
            String name = (eq < 0 ? token : token.substring(0, eq)).replaceFirst("^-+", "");
            if (ignored.contains(name)) {
                result.add(name);
            }
        }
        return result;
    }

    private static List<String> readLines(String filename) {
        try {
            return Files.readAllLines(Path.of(filename), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + filename, e);
        }
    }
}
