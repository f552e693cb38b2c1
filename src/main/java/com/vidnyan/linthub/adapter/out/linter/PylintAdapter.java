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
import java.util.List;

/**
 * pylint with {@code --output-format=json}: a flat list of records.
 * pylint encodes message categories in its exit code bits; only 32 (usage error) is a crash.
 */
@Component
@RequiredArgsConstructor
public class PylintAdapter implements LinterAdapter {

    static final int USAGE_ERROR = 32;

    private final ObjectMapper objectMapper;

    @Override
    public Linter linter() {
        return Linter.PYLINT;
    }

    @Override
    public List<String> arguments(LintConfig config) {
        List<String> args = new ArrayList<>();
        args.add("--output-format=json");
        args.addAll(config.getArgs(Option.PYLINT));
        return args;
    }

    @Override
    public boolean isFatalExitCode(int exitCode) {
        return exitCode == USAGE_ERROR;
    }

    @Override
    public List<Diagnostic> parse(List<String> filenames, String output) {
        JsonNode root;
        try {
            root = objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            throw new MalformedToolOutputException(Linter.PYLINT, "not JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new MalformedToolOutputException(Linter.PYLINT, "expected a list of messages");
        }

        List<Diagnostic> diagnostics = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            diagnostics.add(toDiagnostic(filenames, new RawRecord(Linter.PYLINT, node)));
        }
        return diagnostics;
    }

    private Diagnostic toDiagnostic(List<String> filenames, RawRecord raw) {
        String path = raw.requireString("path");
        int line = raw.requireInt("line");
        int column = raw.requireInt("column");
        String messageId = raw.requireString("message-id");
        String message = raw.requireString("message");
        Integer endLine = raw.optionalInt("endLine");
        Integer endColumn = raw.optionalInt("endColumn");
        String symbol = raw.requireString("symbol");

        return new Diagnostic(
                Linter.PYLINT,
                ReportedPaths.toSubmitted(filenames, path),
                line,
                column,
                messageId,
                message,
                endLine,
                endColumn,
                symbol);
    }
}
