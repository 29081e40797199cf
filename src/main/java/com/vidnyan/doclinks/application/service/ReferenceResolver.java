package com.vidnyan.doclinks.application.service;

import com.vidnyan.doclinks.DocLinksProperties;
import com.vidnyan.doclinks.application.port.out.SourceInspector;
import com.vidnyan.doclinks.application.port.out.SourceTree;
import com.vidnyan.doclinks.domain.model.AmbiguousRef;
import com.vidnyan.doclinks.domain.model.BrokenRef;
import com.vidnyan.doclinks.domain.model.DocLinks;
import com.vidnyan.doclinks.domain.model.ExtractedRef;
import com.vidnyan.doclinks.domain.model.ExtractedRefs;
import com.vidnyan.doclinks.domain.model.ImportStatement;
import com.vidnyan.doclinks.domain.model.LinksIndex;
import com.vidnyan.doclinks.domain.model.Resolution;
import com.vidnyan.doclinks.domain.model.ResolvedLink;
import com.vidnyan.doclinks.domain.model.SymbolEntry;
import com.vidnyan.doclinks.domain.model.SymbolIndex;
import com.vidnyan.doclinks.domain.model.SymbolTarget;
import com.vidnyan.doclinks.domain.model.TargetKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns extracted references into resolved links, broken references or ambiguity errors.
 * A reference with several plausible targets is never resolved to one of them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceResolver {

    static final String NOT_FOUND = "symbol not found";
    static final String STILL_AMBIGUOUS = "still ambiguous after qualification";

    private final SourceInspector inspector;
    private final DocLinksProperties properties;
    private final Clock clock;

    public LinksIndex resolveAll(ExtractedRefs refs, Path root, SymbolIndex index) {
        Map<String, DocLinks> docs = new HashMap<>();
        refs.docs().forEach((doc, docRefs) -> {
            List<Resolution> resolutions = docRefs.stream()
                    .map(ref -> resolve(ref, root, index))
                    .toList();
            docs.put(doc, DocLinks.of(resolutions));
        });

        LinksIndex links = LinksIndex.of(Instant.now(clock).toString(), docs);
        log.info("Resolved {} links, {} broken, {} ambiguous",
                links.totalLinks(), links.totalBroken(), links.totalErrors());
        return links;
    }

    public Resolution resolve(ExtractedRef ref, Path root, SymbolIndex index) {
        return switch (ref.kind()) {
            case FILE -> resolveFile(ref, root);
            case IMPORT -> resolveImport(ref, root);
            case SYMBOL -> resolveSymbol(ref, root, index);
        };
    }

    private Resolution resolveFile(ExtractedRef ref, Path root) {
        Path base = root.toAbsolutePath().normalize();
        Path target = base.resolve(ref.text()).normalize();
        if (!target.startsWith(base)) {
            return new BrokenRef(ref.text(), ref.line(), "path escapes repository root");
        }
        if (!Files.isRegularFile(target)) {
            return new BrokenRef(ref.text(), ref.line(), "file not found");
        }
        return fileLink(ref, root, SourceTree.relativize(root, target));
    }

    private Resolution resolveImport(ExtractedRef ref, Path root) {
        Optional<ImportStatement> parsed = ImportStatement.parse(ref.text());
        if (parsed.isEmpty()) {
            return new BrokenRef(ref.text(), ref.line(), "unparseable import");
        }
        String module = parsed.get().module();
        return ModulePathResolver.resolve(module, root, properties.getSourceRoots())
                .map(file -> fileLink(ref, root, file))
                .orElseGet(() -> new BrokenRef(ref.text(), ref.line(), "module not found: " + module));
    }

    private Resolution fileLink(ExtractedRef ref, Path root, String file) {
        return inspector.hashFile(root.resolve(file))
                .<Resolution>map(hash -> ResolvedLink.unchecked(ref.text(), file, TargetKind.FILE, hash, ref.line()))
                .orElseGet(() -> new BrokenRef(ref.text(), ref.line(), "could not hash file"));
    }

    private Resolution resolveSymbol(ExtractedRef ref, Path root, SymbolIndex index) {
        String name = ref.text().endsWith("()")
                ? ref.text().substring(0, ref.text().length() - 2)
                : ref.text();

        List<SymbolEntry> direct = index.lookup(name);
        if (direct.size() == 1) {
            return symbolLink(ref, root, name, direct.get(0));
        }
        if (direct.size() > 1) {
            return new AmbiguousRef(ref.text(), ref.line(),
                    "ambiguous: found in " + direct.size() + " locations", locations(direct));
        }

        // Qualified name: the longest trailing part that is indexed, narrowed by the leading part.
        String[] parts = name.split("\\.");
        for (int i = 1; i < parts.length; i++) {
            String key = String.join(".", Arrays.copyOfRange(parts, i, parts.length));
            if (!index.defines(key)) {
                continue;
            }
            String modulePath = String.join("/", Arrays.copyOfRange(parts, 0, i));
            List<SymbolEntry> matching = index.lookup(key).stream()
                    .filter(e -> e.file().contains(modulePath))
                    .toList();
            if (matching.isEmpty()) {
                return new BrokenRef(ref.text(), ref.line(), NOT_FOUND + " in module " + modulePath);
            }
            if (matching.size() > 1) {
                return new AmbiguousRef(ref.text(), ref.line(), STILL_AMBIGUOUS, locations(matching));
            }
            return symbolLink(ref, root, key, matching.get(0));
        }
        return new BrokenRef(ref.text(), ref.line(), NOT_FOUND);
    }

    private Resolution symbolLink(ExtractedRef ref, Path root, String name, SymbolEntry entry) {
        Path file = root.resolve(entry.file());
        Optional<String> hash = inspector.hashSymbol(file, name).or(() -> {
            log.debug("No fingerprint for {} in {}, hashing the whole file", name, entry.file());
            return inspector.hashFile(file);
        });
        if (hash.isEmpty()) {
            return new BrokenRef(ref.text(), ref.line(), "could not hash symbol");
        }
        String target = new SymbolTarget(entry.file(), name).format();
        return ResolvedLink.unchecked(ref.text(), target, entry.kind().toTargetKind(), hash.get(), ref.line());
    }

    private static List<String> locations(List<SymbolEntry> entries) {
        return entries.stream().map(SymbolEntry::location).toList();
    }
}
