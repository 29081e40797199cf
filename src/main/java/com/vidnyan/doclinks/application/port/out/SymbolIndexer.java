package com.vidnyan.doclinks.application.port.out;

import com.vidnyan.doclinks.domain.model.SymbolIndex;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for building the symbol index of a source tree.
 * Implemented by parser adapters (e.g., JavaParser adapter).
 */
public interface SymbolIndexer {

    /**
     * Index every source file below the given directories.
     * Files that cannot be parsed or decoded are skipped, never fatal.
     */
    SymbolIndex index(Path root, List<String> indexDirs);
}
