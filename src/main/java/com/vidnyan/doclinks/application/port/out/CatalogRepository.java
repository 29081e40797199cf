package com.vidnyan.doclinks.application.port.out;

import com.vidnyan.doclinks.domain.fix.FixReport;
import com.vidnyan.doclinks.domain.model.ExtractedRefs;
import com.vidnyan.doclinks.domain.model.LinksIndex;
import com.vidnyan.doclinks.domain.model.SymbolIndex;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Port for persisting catalog artifacts.
 * Writes replace the whole artifact atomically; loads return empty when the artifact does not exist.
 */
public interface CatalogRepository {

    String SYMBOLS_FILE = "symbols.json";
    String REFS_FILE = "extracted_refs.json";
    String LINKS_FILE = "links.json";
    String FIX_REPORT_FILE = "fix_report.json";

    /**
     * Directory holding the artifacts of the repository at {@code root}.
     */
    Path indexDir(Path root);

    void saveSymbols(Path root, SymbolIndex index);

    Optional<SymbolIndex> loadSymbols(Path root);

    void saveRefs(Path root, ExtractedRefs refs);

    Optional<ExtractedRefs> loadRefs(Path root);

    void saveLinks(Path root, LinksIndex links);

    Optional<LinksIndex> loadLinks(Path root);

    void saveFixReport(Path root, FixReport report);
}
