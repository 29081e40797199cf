package com.vidnyan.doclinks.application.port.out;

import com.vidnyan.doclinks.domain.model.ExtractedRef;
import com.vidnyan.doclinks.domain.model.ExtractedRefs;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Port for pulling code references out of documentation.
 */
public interface ReferenceExtractor {

    /**
     * References in one document, ordered by line.
     *
     * @param knownSymbols     names from the symbol index; may be empty
     * @param internalPackages package prefixes declared by the indexed sources, added to the
     *                         configured ones
     */
    List<ExtractedRef> extract(Path docFile, Set<String> knownSymbols, Set<String> internalPackages);

    default List<ExtractedRef> extract(Path docFile, Set<String> knownSymbols) {
        return extract(docFile, knownSymbols, Set.of());
    }

    /**
     * References in every document below the given directories.
     */
    ExtractedRefs extractAll(Path root, List<String> docDirs, Set<String> knownSymbols,
                             Set<String> internalPackages);

    default ExtractedRefs extractAll(Path root, List<String> docDirs, Set<String> knownSymbols) {
        return extractAll(root, docDirs, knownSymbols, Set.of());
    }
}
