package com.vidnyan.doclinks.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable snapshot of every symbol defined in the indexed tree.
 * A name maps to all of its definition sites; entries from different files are never merged.
 */
public record SymbolIndex(
    String schema,
    String generated,
    @JsonProperty("symbol_count") int symbolCount,
    @JsonProperty("file_count") int fileCount,
    Map<String, List<SymbolEntry>> symbols,
    List<String> packages
) {

    public SymbolIndex {
        packages = packages == null ? List.of() : packages;
    }

    /**
     * Build an index with names sorted and each name's entries sorted by location.
     */
    public static SymbolIndex of(String generated, int fileCount, Map<String, List<SymbolEntry>> symbols) {
        return of(generated, fileCount, symbols, Set.of());
    }

    /**
     * Build an index that also records the packages declared by the indexed files.
     */
    public static SymbolIndex of(String generated, int fileCount, Map<String, List<SymbolEntry>> symbols,
                                 Set<String> packages) {
        Map<String, List<SymbolEntry>> sorted = new TreeMap<>();
        int count = 0;
        for (Map.Entry<String, List<SymbolEntry>> e : symbols.entrySet()) {
            List<SymbolEntry> entries = new ArrayList<>(e.getValue());
            entries.sort(SymbolEntry.BY_LOCATION);
            sorted.put(e.getKey(), List.copyOf(entries));
            count += entries.size();
        }
        return new SymbolIndex(ArtifactSchema.VERSION, generated, count, fileCount,
                Collections.unmodifiableMap(sorted), List.copyOf(new TreeSet<>(packages)));
    }

    /**
     * All definitions of a name; empty when unknown.
     */
    public List<SymbolEntry> lookup(String name) {
        return symbols.getOrDefault(name, List.of());
    }

    public boolean defines(String name) {
        return symbols.containsKey(name);
    }

    /**
     * Names known to the index, used by the extractor to filter inline tokens.
     */
    public Set<String> knownSymbols() {
        return Collections.unmodifiableSet(symbols.keySet());
    }

    /**
     * Top-level prefixes of the declared packages: the first two segments, e.g.
     * {@code com.acme} for {@code com.acme.auth}. Single-segment packages are kept whole.
     */
    public Set<String> packageRoots() {
        Set<String> roots = new TreeSet<>();
        for (String pkg : packages) {
            String[] parts = pkg.split("\\.");
            roots.add(parts.length <= 2 ? pkg : parts[0] + "." + parts[1]);
        }
        return Collections.unmodifiableSet(roots);
    }
}
