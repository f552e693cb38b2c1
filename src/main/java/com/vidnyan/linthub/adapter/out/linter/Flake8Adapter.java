package com.vidnyan.linthub.adapter.out.linter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.linthub.application.port.out.LinterAdapter;
import com.vidnyan.linthub.domain.config.LintConfig;
import com.vidnyan.linthub.domain.config.Option;
import com.vidnyan.linthub.domain.model.Diagnostic;
import com.vidnyan.linthub.domain.model.Linter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * flake8 with {@code --format=json}: an object mapping each filename to its list of records.
 * Exit code 0 means clean, 1 means issues were found; anything else is a crash.
 */
@Component
@RequiredArgsConstructor
public class Flake8Adapter implements LinterAdapter {

    private static final Set<Integer> ACCEPTED_EXIT_CODES = Set.of(0, 1);

    private final ObjectMapper objectMapper;

    @Override
    public Linter linter() {
        return Linter.FLAKE8;
    }

    @Override
    public List<String> arguments(LintConfig config) {
        List<String> args = new ArrayList<>();
        args.add("--format=json");
        args.addAll(config.getArgs(Option.FLAKE8));
        return args;
    }

    @Override
    public boolean isFatalExitCode(int exitCode) {
        return !ACCEPTED_EXIT_CODES.contains(exitCode);
    }

    @Override
    public List<Diagnostic> parse(List<String> filenames, String output) {
        JsonNode root;
        try {
            root = objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            throw new MalformedToolOutputException(Linter.FLAKE8, "not JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedToolOutputException(Linter.FLAKE8, "expected an object of files");
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> files = root.fields();
        while (files.hasNext()) {
            Map.Entry<String, JsonNode> file = files.next();
            if (!file.getValue().isArray()) {
                throw new MalformedToolOutputException(Linter.FLAKE8, "expected a list for " + file.getKey());
            }
            for (JsonNode node : file.getValue()) {
                diagnostics.add(toDiagnostic(filenames, new RawRecord(Linter.FLAKE8, node)));
            }
        }
        return diagnostics;
    }

    private Diagnostic toDiagnostic(List<String> filenames, RawRecord raw) {
        String filename = raw.requireString("filename");
        int line = raw.requireInt("line_number");
        int column = raw.requireInt("column_number");
        String code = raw.requireString("code");
        String text = raw.requireString("text");

        return Diagnostic.at(
                Linter.FLAKE8,
                ReportedPaths.toSubmitted(filenames, filename),
                line,
                column,
                code,
                text);
    }
}
