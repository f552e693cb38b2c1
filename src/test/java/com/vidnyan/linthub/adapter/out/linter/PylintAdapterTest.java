package com.vidnyan.linthub.adapter.out.linter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.linthub.domain.config.LintConfig;
import com.vidnyan.linthub.domain.config.Option;
import com.vidnyan.linthub.domain.model.Diagnostic;
import com.vidnyan.linthub.domain.model.Linter;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PylintAdapterTest {

    private final PylintAdapter adapter = new PylintAdapter(new ObjectMapper());

    private static String message(String path, String line, String endLine) {
        return """
                {"type": "convention", "module": "b", "obj": "", "line": %s, "column": 0,
                 "endLine": %s, "endColumn": null, "path": "%s", "symbol": "missing-module-docstring",
                 "message": "Missing module docstring", "message-id": "C0114"}
                """.formatted(line, endLine, path);
    }

    @Test
    void arguments_ShouldPutJsonFormatBeforeConfiguredArgs() {
        LintConfig config = LintConfig.builder()
                .set(Option.PYLINT, List.of("--disable=C0114", "--jobs=1"))
                .build();

        assertEquals(List.of("--output-format=json", "--disable=C0114", "--jobs=1"), adapter.arguments(config));
    }

    @Test
    void isFatalExitCode_ShouldOnlyRejectUsageError() {
        assertFalse(adapter.isFatalExitCode(0));
        assertFalse(adapter.isFatalExitCode(16));
        assertFalse(adapter.isFatalExitCode(30));
        assertTrue(adapter.isFatalExitCode(32));
    }

    @Test
    void parse_ShouldKeepRangeAndSymbol() {
        String output = "[" + message("b.py", "2", "4") + "]";

        List<Diagnostic> result = adapter.parse(List.of("a.py", "b.py"), output);

        assertEquals(List.of(new Diagnostic(Linter.PYLINT, "b.py", 2, 0, "C0114",
                "Missing module docstring", 4, null, "missing-module-docstring")), result);
    }

    @Test
    void parse_ShouldTreatMissingRangeAsAbsent() {
        String output = """
                [{"line": 1, "column": 0, "path": "a.py", "symbol": "unused-import",
                  "message": "Unused import os", "message-id": "W0611"}]
                """;

        Diagnostic diagnostic = adapter.parse(List.of("a.py"), output).get(0);

        assertNull(diagnostic.endLine());
        assertNull(diagnostic.endColumn());
    }

    @Test
    void parse_ShouldReturnSubmittedFilenameForResolvedPath() {
        String resolved = Path.of("b.py").toAbsolutePath().toString().replace("\\", "\\\\");
        String output = "[" + message(resolved, "2", "null") + "]";

        Diagnostic diagnostic = adapter.parse(List.of("./b.py"), output).get(0);

        assertEquals("b.py", diagnostic.path());
    }

    @Test
    void parse_ShouldRejectRecordWithWrongFieldType() {
        String output = "[" + message("b.py", "\"2\"", "null") + "]";

        MalformedToolOutputException e = assertThrows(MalformedToolOutputException.class,
                () -> adapter.parse(List.of("b.py"), output));
        assertTrue(e.getMessage().contains("for line"));
    }

    @Test
    void parse_ShouldRejectNonIntegerRangeEnd() {
        String output = "[" + message("b.py", "2", "\"4\"") + "]";

        assertThrows(MalformedToolOutputException.class, () -> adapter.parse(List.of("b.py"), output));
    }

    @Test
    void parse_ShouldRejectInvalidJson() {
        assertThrows(MalformedToolOutputException.class, () -> adapter.parse(List.of("b.py"), "not json"));
    }

    @Test
    void parse_ShouldFailWhenReportedFileWasNotSubmitted() {
        String output = "[" + message("other.py", "2", "null") + "]";

        assertThrows(IllegalStateException.class, () -> adapter.parse(List.of("b.py"), output));
    }
}
