package com.vidnyan.doclinks.application.port.out;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Port for discovering files in the analyzed repository.
 */
public interface SourceTree {

    /**
     * Find regular files below the given directories of {@code root}.
     * Hidden and skipped directories are not descended into; missing directories are ignored.
     *
     * @param root       repository root
     * @param dirs       directories relative to root
     * @param extensions file extensions without the dot; empty means any file
     * @return matching files, sorted by path
     */
    List<Path> scan(Path root, List<String> dirs, Set<String> extensions);

    /**
     * Path of {@code file} relative to {@code root}, always with {@code /} separators.
     */
    static String relativize(Path root, Path file) {
        return root.toAbsolutePath().normalize()
                .relativize(file.toAbsolutePath().normalize())
                .toString()
                .replace('\\', '/');
    }
}
