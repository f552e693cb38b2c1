package com.vidnyan.linthub.domain.model;

import java.nio.file.Path;

/**
 * Path canonicalization shared by the linter adapters and the final sort.
 * Absolute paths stay absolute, everything else becomes relative to the working directory.
 */
public final class ProperPath {

    private ProperPath() {
    }

    public static String of(String path) {
        Path given = Path.of(path);
        Path absolute = given.toAbsolutePath().normalize();
        if (given.isAbsolute()) {
            return absolute.toString();
        }
        Path cwd = Path.of("").toAbsolutePath().normalize();
        String relative = cwd.relativize(absolute).toString();
        return relative.isEmpty() ? "." : relative;
    }

    /**
     * Whether two paths point at the same file once both are made absolute.
     */
    public static boolean sameFile(String first, String second) {
        return Path.of(first).toAbsolutePath().normalize()
                .equals(Path.of(second).toAbsolutePath().normalize());
    }
}
