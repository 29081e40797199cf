package com.vidnyan.doclinks.adapter.out.markdown;

import com.vidnyan.doclinks.DocLinksProperties;
import com.vidnyan.doclinks.application.port.out.ReferenceExtractor;
import com.vidnyan.doclinks.application.port.out.SourceTree;
import com.vidnyan.doclinks.domain.model.ExtractedRef;
import com.vidnyan.doclinks.domain.model.ExtractedRefs;
import com.vidnyan.doclinks.domain.model.ImportStatement;
import com.vidnyan.doclinks.domain.model.RefKind;
import com.vladsch.flexmark.ast.Code;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.sequence.BasedSequence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Extracts code references from Markdown.
 * <p>
 * Recognized shapes: inline code spans naming an internal file or a symbol, and import
 * lines inside {@code java} (or untagged) fenced blocks, both read from the flexmark
 * document tree. Indented code, raw HTML and free text are never mined, and a span is only
 * kept when it can be tied to this codebase; missing a reference is safe, inventing one is not.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarkdownReferenceExtractor implements ReferenceExtractor {

    private static final Pattern FILE_PATH = Pattern.compile(
            "^[\\w./-]+\\.(java|md|json|yaml|yml|properties|xml|sh|sql|kt|gradle)$");
    private static final Pattern SYMBOL = Pattern.compile(
            "^[A-Za-z_$][\\w$]*(?:\\.[A-Za-z_$][\\w$]*)*(?:\\(\\))?$");

    private final SourceTree sourceTree;
    private final DocLinksProperties properties;
    private final Clock clock;

    @Override
    public List<ExtractedRef> extract(Path docFile, Set<String> knownSymbols, Set<String> internalPackages) {
        Document document;
        try {
            document = MarkdownDocuments.parse(docFile);
        } catch (IOException e) {
            log.warn("Skipping {}: {}", docFile, e.getMessage());
            return List.of();
        }

        List<ExtractedRef> refs = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (Node node : document.getDescendants()) {
            if (node instanceof Code code) {
                String text = code.getText().toString().strip();
                int line = MarkdownDocuments.lineOf(code);
                classify(text, knownSymbols, internalPackages).ifPresent(kind -> add(refs, seen, text, kind, line));
            } else if (node instanceof FencedCodeBlock block && isJavaBlock(block)) {
                for (BasedSequence codeLine : block.getContentLines()) {
                    String text = codeLine.toString().strip();
                    ImportStatement.parse(text)
                            .filter(imp -> isInternalImport(imp, knownSymbols, internalPackages))
                            .ifPresent(imp -> add(refs, seen, text, RefKind.IMPORT,
                                    MarkdownDocuments.lineOf(block, codeLine)));
                }
            }
        }

        refs.sort(Comparator.comparingInt(ExtractedRef::line));
        return refs;
    }

    @Override
    public ExtractedRefs extractAll(Path root, List<String> docDirs, Set<String> knownSymbols,
                                    Set<String> internalPackages) {
        Path indexDir = root.resolve(properties.getOutputDir()).toAbsolutePath().normalize();
        List<Path> docs = sourceTree.scan(root, docDirs, Set.of("md")).stream()
                .filter(p -> !p.toAbsolutePath().normalize().startsWith(indexDir))
                .toList();
        log.info("Scanning {} documentation files", docs.size());

        List<Map.Entry<String, List<ExtractedRef>>> perDoc = docs.parallelStream()
                .map(doc -> Map.entry(SourceTree.relativize(root, doc), extract(doc, knownSymbols, internalPackages)))
                .toList();

        Map<String, List<ExtractedRef>> byDoc = new TreeMap<>();
        perDoc.forEach(e -> byDoc.put(e.getKey(), e.getValue()));

        ExtractedRefs refs = ExtractedRefs.of(Instant.now(clock).toString(), byDoc);
        log.info("Extracted {} references from {} docs", refs.refCount(), refs.docCount());
        return refs;
    }

    /**
     * Classify an inline code span, or empty when it is not an internal reference.
     */
    Optional<RefKind> classify(String text, Set<String> knownSymbols) {
        return classify(text, knownSymbols, Set.of());
    }

    Optional<RefKind> classify(String text, Set<String> knownSymbols, Set<String> internalPackages) {
        if (FILE_PATH.matcher(text).matches()) {
            return isInternalPath(text) ? Optional.of(RefKind.FILE) : Optional.empty();
        }
        if (!SYMBOL.matcher(text).matches()) {
            return Optional.empty();
        }
        String symbol = text.endsWith("()") ? text.substring(0, text.length() - 2) : text;
        if (knownSymbols.contains(symbol)) {
            return Optional.of(RefKind.SYMBOL);
        }
        if (symbol.contains(".")) {
            boolean knownPart = Arrays.stream(symbol.split("\\.")).anyMatch(knownSymbols::contains);
            if (knownPart || isInternalPackage(symbol, internalPackages)) {
                return Optional.of(RefKind.SYMBOL);
            }
        }
        return Optional.empty();
    }

    private static boolean isJavaBlock(FencedCodeBlock block) {
        String language = MarkdownDocuments.language(block);
        return language.isEmpty() || language.equals("java");
    }

    private boolean isInternalImport(ImportStatement imp, Set<String> knownSymbols, Set<String> internalPackages) {
        return isInternalPackage(imp.module(), internalPackages) || knownSymbols.contains(imp.finalComponent());
    }

    private boolean isInternalPath(String path) {
        return properties.getInternalPathRoots().stream().anyMatch(path::startsWith);
    }

    private boolean isInternalPackage(String dotted, Set<String> internalPackages) {
        return Stream.concat(properties.getInternalPackages().stream(), internalPackages.stream())
                .anyMatch(pkg -> dotted.equals(pkg) || dotted.startsWith(pkg + "."));
    }

    private static void add(List<ExtractedRef> refs, Set<String> seen, String text, RefKind kind, int line) {
        if (seen.add(line + "\u0000" + text)) {
            refs.add(new ExtractedRef(text, kind, line));
        }
    }
}
