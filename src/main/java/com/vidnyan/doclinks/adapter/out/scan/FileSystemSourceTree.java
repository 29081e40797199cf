package com.vidnyan.doclinks.adapter.out.scan;

import com.vidnyan.doclinks.DocLinksProperties;
import com.vidnyan.doclinks.application.port.out.SourceTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scans the repository for files below the configured directories.
 * Hidden directories and configured build/vendor directories are pruned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemSourceTree implements SourceTree {

    private final DocLinksProperties properties;

    @Override
    public List<Path> scan(Path root, List<String> dirs, Set<String> extensions) {
        Set<Path> files = new TreeSet<>();
        Set<String> skipDirs = Set.copyOf(properties.getSkipDirs());

        for (String dir : dirs) {
            Path start = dir.isEmpty() ? root : root.resolve(dir);
            if (!Files.isDirectory(start)) {
                log.debug("Skipping missing directory {}", start);
                continue;
            }
            try {
                Files.walkFileTree(start, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                        if (!d.equals(start) && isSkipped(d, skipDirs)) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && hasExtension(file, extensions)) {
                            files.add(file);
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException e) {
                        log.warn("Cannot read {}: {}", file, e.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (IOException e) {
                log.warn("Failed to walk directory {}: {}", start, e.getMessage());
            }
        }
        return new ArrayList<>(files);
    }

    private static boolean isSkipped(Path dir, Set<String> skipDirs) {
        Path name = dir.getFileName();
        if (name == null) {
            return false;
        }
        String n = name.toString();
        return n.startsWith(".") || skipDirs.contains(n);
    }

    private static boolean hasExtension(Path file, Set<String> extensions) {
        if (extensions.isEmpty()) {
            return true;
        }
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
