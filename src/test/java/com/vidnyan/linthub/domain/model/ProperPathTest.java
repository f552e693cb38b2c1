package com.vidnyan.linthub.domain.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ProperPathTest {

    @Test
    void of_ShouldKeepRelativePathsRelative() {
        assertEquals("a.py", ProperPath.of("a.py"));
        assertEquals("a.py", ProperPath.of("./a.py"));
        assertEquals(Path.of("pkg", "b.py").toString(), ProperPath.of("pkg/sub/../b.py"));
    }

    @Test
    void of_ShouldNormalizeAbsolutePaths() {
        String absolute = Path.of("x", "..", "a.py").toAbsolutePath().toString();

        String proper = ProperPath.of(absolute);

        assertTrue(Path.of(proper).isAbsolute());
        assertEquals(Path.of("a.py").toAbsolutePath().toString(), proper);
    }

    @Test
    void sameFile_ShouldMatchAbsoluteAndRelativeForms() {
        String absolute = Path.of("src", "a.py").toAbsolutePath().toString();

        assertTrue(ProperPath.sameFile("src/a.py", absolute));
        assertTrue(ProperPath.sameFile("./src/a.py", "src/a.py"));
        assertFalse(ProperPath.sameFile("src/a.py", "src/b.py"));
    }
}
