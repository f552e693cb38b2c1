package com.vidnyan.linthub.adapter.out.linter;

import com.vidnyan.linthub.domain.model.ProperPath;

import java.util.List;

/**
 * Maps a path echoed by a linter back to the filename it was given.
 */
final class ReportedPaths {

    private ReportedPaths() {
    }

    /**
     * Canonical form of the submitted filename that {@code reported} refers to.
     *
     * @throws IllegalStateException when no submitted filename matches; linters only report files they were given
     */
    static String toSubmitted(List<String> filenames, String reported) {
        for (String filename : filenames) {
            if (ProperPath.sameFile(filename, reported)) {
                return ProperPath.of(filename);
            }
        }
        throw new IllegalStateException("unreachable: reported path " + reported + " matches no linted file");
    }
}
