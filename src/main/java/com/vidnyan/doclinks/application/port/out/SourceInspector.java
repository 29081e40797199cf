package com.vidnyan.doclinks.application.port.out;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Port for fingerprinting files and symbols and reading symbol source.
 * Resolution and staleness checks must go through the same implementation
 * so that stored and recomputed hashes are comparable.
 */
public interface SourceInspector {

    /**
     * SHA-256 of the file's bytes; empty when the file is missing or unreadable.
     */
    Optional<String> hashFile(Path file);

    /**
     * Structural fingerprint of a named symbol ({@code Foo}, {@code Foo.bar}, {@code Foo.CONST}).
     * Empty when the file cannot be parsed or the symbol is not defined in it.
     */
    Optional<String> hashSymbol(Path file, String symbolName);

    /**
     * Current source text of a named symbol, sliced from the file by line range.
     */
    Optional<String> symbolSource(Path file, String symbolName);
}
