package com.vidnyan.doclinks.application.service;

import com.vidnyan.doclinks.DocLinksProperties;
import com.vidnyan.doclinks.application.port.out.SectionLocator;
import com.vidnyan.doclinks.application.port.out.SourceInspector;
import com.vidnyan.doclinks.application.port.out.SourceTree;
import com.vidnyan.doclinks.domain.fix.FixContext;
import com.vidnyan.doclinks.domain.fix.FixReport;
import com.vidnyan.doclinks.domain.fix.IssueType;
import com.vidnyan.doclinks.domain.model.AmbiguousRef;
import com.vidnyan.doclinks.domain.model.BrokenRef;
import com.vidnyan.doclinks.domain.model.DocLinks;
import com.vidnyan.doclinks.domain.model.ImportStatement;
import com.vidnyan.doclinks.domain.model.LinksIndex;
import com.vidnyan.doclinks.domain.model.ResolvedLink;
import com.vidnyan.doclinks.domain.model.SymbolEntry;
import com.vidnyan.doclinks.domain.model.SymbolIndex;
import com.vidnyan.doclinks.domain.model.SymbolTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Collects the context needed to repair each stale, broken or ambiguous reference.
 * Issues are listed stale first, then broken, then ambiguous; documents in path order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FixContextGatherer {

    private final SourceInspector inspector;
    private final SectionLocator sectionLocator;
    private final SourceTree sourceTree;
    private final DocLinksProperties properties;

    /**
     * @param checked links after a check pass
     * @param symbols symbol index used for broken-reference candidates; may be null
     */
    public FixReport gather(LinksIndex checked, Path root, SymbolIndex symbols) {
        List<FixContext> issues = new ArrayList<>();

        for (Map.Entry<String, DocLinks> doc : checked.docs().entrySet()) {
            for (ResolvedLink link : doc.getValue().links()) {
                if (link.stale()) {
                    issues.add(staleContext(doc.getKey(), link, root));
                }
            }
        }

        List<String> searchableFiles = null;
        for (Map.Entry<String, DocLinks> doc : checked.docs().entrySet()) {
            for (BrokenRef broken : doc.getValue().broken()) {
                if (searchableFiles == null) {
                    searchableFiles = searchableFiles(root);
                }
                List<String> candidates = candidates(stemOf(broken.ref()), searchableFiles, symbols);
                issues.add(new FixContext(doc.getKey(), broken.ref(), broken.line(), IssueType.BROKEN,
                        broken.reason(), section(root, doc.getKey(), broken.line()), null, candidates));
            }
        }

        for (Map.Entry<String, DocLinks> doc : checked.docs().entrySet()) {
            for (AmbiguousRef ambiguous : doc.getValue().ambiguous()) {
                issues.add(new FixContext(doc.getKey(), ambiguous.ref(), ambiguous.line(), IssueType.AMBIGUOUS,
                        ambiguous.reason(), section(root, doc.getKey(), ambiguous.line()), null,
                        ambiguous.candidates()));
            }
        }

        FixReport report = FixReport.of(issues);
        log.info("Found {} issues: {} stale, {} broken, {} ambiguous",
                report.totalIssues(), report.stale(), report.broken(), report.errors());
        return report;
    }

    private FixContext staleContext(String doc, ResolvedLink link, Path root) {
        String currentCode = link.symbolTarget()
                .flatMap(t -> inspector.symbolSource(root.resolve(t.file()), t.symbol()))
                .orElse(null);
        String reason = link.kind().symbolic()
                ? "referenced " + link.kind().wireName() + " changed since the link was resolved"
                : "referenced file changed since the link was resolved";
        return new FixContext(doc, link.ref(), link.line(), IssueType.STALE, reason,
                section(root, doc, link.line()), currentCode, null);
    }

    private String section(Path root, String doc, int line) {
        return sectionLocator.sectionFor(root.resolve(doc), line).orElse(null);
    }

    private List<String> searchableFiles(Path root) {
        List<String> dirs = new ArrayList<>(properties.getIndexDirs());
        dirs.addAll(properties.getDocDirs());
        return sourceTree.scan(root, dirs, Set.of("java", "md")).stream()
                .map(p -> SourceTree.relativize(root, p))
                .distinct()
                .toList();
    }

    /**
     * Files whose name, then symbols whose name, contain the stem, ignoring case.
     */
    List<String> candidates(String stem, List<String> files, SymbolIndex symbols) {
        if (stem.isEmpty()) {
            return List.of();
        }
        String needle = stem.toLowerCase(Locale.ROOT);
        int max = properties.getMaxCandidates();
        Set<String> found = new LinkedHashSet<>();

        for (String file : files) {
            if (found.size() >= max) {
                return List.copyOf(found);
            }
            String name = file.substring(file.lastIndexOf('/') + 1);
            if (name.toLowerCase(Locale.ROOT).contains(needle)) {
                found.add(file);
            }
        }
        if (symbols != null) {
            for (Map.Entry<String, List<SymbolEntry>> e : symbols.symbols().entrySet()) {
                if (!e.getKey().toLowerCase(Locale.ROOT).contains(needle)) {
                    continue;
                }
                for (SymbolEntry entry : e.getValue()) {
                    if (found.size() >= max) {
                        return List.copyOf(found);
                    }
                    found.add(new SymbolTarget(entry.file(), e.getKey()).format());
                }
            }
        }
        return List.copyOf(found);
    }

    /**
     * The part of a reference worth searching for: a file name without extension,
     * the last segment of an imported name, or the last segment of a dotted symbol.
     */
    static String stemOf(String ref) {
        if (ref.startsWith("import ")) {
            return ImportStatement.parse(ref).map(ImportStatement::finalComponent).orElse("");
        }
        if (ref.contains("/")) {
            String name = ref.substring(ref.lastIndexOf('/') + 1);
            int dot = name.lastIndexOf('.');
            return dot > 0 ? name.substring(0, dot) : name;
        }
        String symbol = ref.endsWith("()") ? ref.substring(0, ref.length() - 2) : ref;
        return symbol.substring(symbol.lastIndexOf('.') + 1);
    }
}
