package com.vidnyan.doclinks.adapter.out.parser;

import com.vidnyan.doclinks.application.port.out.SourceInspector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * JavaParser-based implementation of SourceInspector.
 * Symbols are located with the same rules the indexer uses to find them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JavaParserSourceInspector implements SourceInspector {

    private final JavaSourceParser parser;

    @Override
    public Optional<String> hashFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(StructuralFingerprint.sha256(Files.readAllBytes(file)));
        } catch (IOException e) {
            log.warn("Cannot hash {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> hashSymbol(Path file, String symbolName) {
        return locate(file, symbolName).flatMap(located -> {
            try {
                return Optional.of(StructuralFingerprint.of(located.symbol().shape()));
            } catch (RuntimeException e) {
                log.warn("Cannot fingerprint {} in {}: {}", symbolName, file, e.getMessage());
                return Optional.empty();
            }
        });
    }

    @Override
    public Optional<String> symbolSource(Path file, String symbolName) {
        return locate(file, symbolName)
                .map(located -> located.source().slice(located.symbol().extent()));
    }

    private Optional<Located> locate(Path file, String symbolName) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return parser.parse(file).flatMap(source ->
                DeclaredSymbols.find(source.unit(), symbolName)
                        .map(symbol -> new Located(source, symbol)));
    }

    private record Located(ParsedSource source, DeclaredSymbol symbol) {
    }
}
