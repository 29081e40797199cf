package com.vidnyan.doclinks.adapter.out.parser;

import com.github.javaparser.ast.PackageDeclaration;
import com.vidnyan.doclinks.application.port.out.SourceTree;
import com.vidnyan.doclinks.application.port.out.SymbolIndexer;
import com.vidnyan.doclinks.domain.model.SymbolEntry;
import com.vidnyan.doclinks.domain.model.SymbolIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * JavaParser-based implementation of SymbolIndexer.
 * Files are parsed in parallel; results are merged in path order so the index
 * never depends on which file finished first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JavaParserSymbolIndexer implements SymbolIndexer {

    private final SourceTree sourceTree;
    private final JavaSourceParser parser;
    private final Clock clock;

    @Override
    public SymbolIndex index(Path root, List<String> indexDirs) {
        long startTime = System.currentTimeMillis();

        List<Path> javaFiles = sourceTree.scan(root, indexDirs, Set.of("java"));
        log.info("Found {} Java files under {}", javaFiles.size(), indexDirs);

        // toList() keeps encounter order, which is the sorted scan order
        List<FileSymbols> perFile = javaFiles.parallelStream()
                .map(file -> indexFile(root, file))
                .toList();

        Map<String, List<SymbolEntry>> symbols = new HashMap<>();
        Set<String> packages = new TreeSet<>();
        for (FileSymbols fileSymbols : perFile) {
            fileSymbols.packageName().ifPresent(packages::add);
            for (SymbolEntryWithName s : fileSymbols.symbols()) {
                symbols.computeIfAbsent(s.name(), k -> new ArrayList<>()).add(s.entry());
            }
        }

        SymbolIndex index = SymbolIndex.of(Instant.now(clock).toString(), javaFiles.size(), symbols, packages);
        log.info("Indexed {} symbols from {} files in {}ms",
                index.symbolCount(), index.fileCount(), System.currentTimeMillis() - startTime);
        return index;
    }

    private FileSymbols indexFile(Path root, Path file) {
        String relPath = SourceTree.relativize(root, file);
        return parser.parse(file)
                .map(source -> new FileSymbols(
                        source.unit().getPackageDeclaration().map(PackageDeclaration::getNameAsString),
                        DeclaredSymbols.of(source.unit()).stream()
                                .map(s -> new SymbolEntryWithName(s.name(),
                                        new SymbolEntry(relPath, s.line(), s.kind(), s.signature())))
                                .toList()))
                .orElse(new FileSymbols(Optional.empty(), List.of()));
    }

    private record FileSymbols(Optional<String> packageName, List<SymbolEntryWithName> symbols) {
    }

    private record SymbolEntryWithName(String name, SymbolEntry entry) {
    }
}
