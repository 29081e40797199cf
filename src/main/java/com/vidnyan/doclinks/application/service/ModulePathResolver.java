package com.vidnyan.doclinks.application.service;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Maps a dotted Java name ({@code com.acme.auth.AuthService}) to the source file defining it.
 */
@Slf4j
public final class ModulePathResolver {

    private ModulePathResolver() {
    }

    /**
     * Resolve a module to a root-relative file path.
     * <p>
     * Every source root is tried for {@code a/b/C.java} before any root is tried for the
     * package's {@code a/b/C/package-info.java}. A package without that file resolves to the
     * first source file directly inside its directory, in name order. When nothing exists and
     * the name ends in two type-like segments ({@code Outer.Inner}), the enclosing name is
     * tried instead.
     *
     * @param module      dotted name, no wildcard
     * @param root        repository root
     * @param sourceRoots root-relative source directories; the empty string is the root itself
     * @return the defining file, or empty when the module is not part of the tree
     */
    public static Optional<String> resolve(String module, Path root, List<String> sourceRoots) {
        if (module == null || module.isBlank()) {
            return Optional.empty();
        }
        String path = module.replace('.', '/');
        Optional<String> found = firstExisting(root, sourceRoots, path + ".java")
                .or(() -> firstExisting(root, sourceRoots, path + "/package-info.java"))
                .or(() -> firstSourceInPackage(root, sourceRoots, path));
        if (found.isPresent()) {
            return found;
        }

        String[] parts = module.split("\\.");
        if (parts.length >= 2 && isTypeName(parts[parts.length - 1]) && isTypeName(parts[parts.length - 2])) {
            return resolve(module.substring(0, module.lastIndexOf('.')), root, sourceRoots);
        }
        return Optional.empty();
    }

    private static Optional<String> firstExisting(Path root, List<String> sourceRoots, String relative) {
        for (String sourceRoot : sourceRoots) {
            String candidate = sourceRoot.isEmpty() ? relative : stripSlash(sourceRoot) + "/" + relative;
            if (Files.isRegularFile(root.resolve(candidate))) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstSourceInPackage(Path root, List<String> sourceRoots, String packagePath) {
        for (String sourceRoot : sourceRoots) {
            String dir = sourceRoot.isEmpty() ? packagePath : stripSlash(sourceRoot) + "/" + packagePath;
            Path packageDir = root.resolve(dir);
            if (!Files.isDirectory(packageDir)) {
                continue;
            }
            try (Stream<Path> files = Files.list(packageDir)) {
                Optional<String> first = files
                        .filter(Files::isRegularFile)
                        .map(f -> f.getFileName().toString())
                        .filter(name -> name.endsWith(".java"))
                        .sorted()
                        .findFirst();
                if (first.isPresent()) {
                    return Optional.of(dir + "/" + first.get());
                }
            } catch (IOException e) {
                log.warn("Cannot list package directory {}: {}", packageDir, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private static String stripSlash(String dir) {
        return dir.endsWith("/") ? dir.substring(0, dir.length() - 1) : dir;
    }

    private static boolean isTypeName(String segment) {
        return !segment.isEmpty() && Character.isUpperCase(segment.charAt(0));
    }
}
