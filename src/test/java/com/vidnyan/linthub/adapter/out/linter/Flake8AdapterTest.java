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

class Flake8AdapterTest {

    private final Flake8Adapter adapter = new Flake8Adapter(new ObjectMapper());

    @Test
    void arguments_ShouldPutJsonFormatBeforeConfiguredArgs() {
        LintConfig config = LintConfig.builder()
                .set(Option.FLAKE8, List.of("--max-line-length=100"))
                .build();

        assertEquals(List.of("--format=json", "--max-line-length=100"), adapter.arguments(config));
        assertEquals(List.of("--format=json"), adapter.arguments(LintConfig.empty()));
    }

    @Test
    void isFatalExitCode_ShouldAcceptOnlyCleanAndIssuesFound() {
        assertFalse(adapter.isFatalExitCode(0));
        assertFalse(adapter.isFatalExitCode(1));
        assertTrue(adapter.isFatalExitCode(2));
        assertTrue(adapter.isFatalExitCode(-9));
    }

    @Test
    void parse_ShouldFlattenRecordsOfAllFiles() {
        String output = """
                {
                  "a.py": [
                    {"code": "E501", "filename": "a.py", "line_number": 5, "column_number": 80,
                     "text": "line too long (88 > 79 characters)", "physical_line": "x = 1\\n"}
                  ],
                  "b.py": [
                    {"code": "F401", "filename": "./b.py", "line_number": 1, "column_number": 1,
                     "text": "'os' imported but unused", "physical_line": "import os\\n"}
                  ]
                }
                """;

        List<Diagnostic> result = adapter.parse(List.of("a.py", "b.py"), output);

        assertEquals(List.of(
                Diagnostic.at(Linter.FLAKE8, "a.py", 5, 80, "E501", "line too long (88 > 79 characters)"),
                Diagnostic.at(Linter.FLAKE8, "b.py", 1, 1, "F401", "'os' imported but unused")), result);
    }

    @Test
    void parse_ShouldMapAbsoluteReportedPathToSubmittedFilename() {
        String reported = Path.of("pkg", "mod.py").toAbsolutePath().toString().replace("\\", "\\\\");
        String output = "{\"" + reported + "\": [{\"code\": \"W291\", \"filename\": \"" + reported
                + "\", \"line_number\": 3, \"column_number\": 7, \"text\": \"trailing whitespace\"}]}";

        List<Diagnostic> result = adapter.parse(List.of("pkg/mod.py"), output);

        assertEquals(Path.of("pkg", "mod.py").toString(), result.get(0).path());
    }

    @Test
    void parse_ShouldRejectRecordWithWrongFieldType() {
        String output = """
                {"a.py": [{"code": "E501", "filename": "a.py", "line_number": "5", "column_number": 1, "text": "t"}]}
                """;

        MalformedToolOutputException e = assertThrows(MalformedToolOutputException.class,
                () -> adapter.parse(List.of("a.py"), output));
        assertTrue(e.getMessage().contains("line_number"));
    }

    @Test
    void parse_ShouldRejectListOutput() {
        assertThrows(MalformedToolOutputException.class, () -> adapter.parse(List.of("a.py"), "[]"));
    }

    @Test
    void parse_ShouldFailWhenReportedFileWasNotSubmitted() {
        String output = """
                {"c.py": [{"code": "E501", "filename": "c.py", "line_number": 5, "column_number": 1, "text": "t"}]}
                """;

        assertThrows(IllegalStateException.class, () -> adapter.parse(List.of("a.py"), output));
    }
}
