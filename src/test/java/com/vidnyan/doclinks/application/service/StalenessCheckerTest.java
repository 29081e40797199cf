package com.vidnyan.doclinks.application.service;

import com.vidnyan.doclinks.SourceFixtures;
import com.vidnyan.doclinks.adapter.out.parser.JavaParserSourceInspector;
import com.vidnyan.doclinks.adapter.out.parser.JavaParserSymbolIndexer;
import com.vidnyan.doclinks.adapter.out.parser.JavaSourceParser;
import com.vidnyan.doclinks.adapter.out.scan.FileSystemSourceTree;
import com.vidnyan.doclinks.domain.check.CheckOutcome;
import com.vidnyan.doclinks.domain.check.CheckResult;
import com.vidnyan.doclinks.domain.model.DocLinks;
import com.vidnyan.doclinks.domain.model.ExtractedRef;
import com.vidnyan.doclinks.domain.model.ExtractedRefs;
import com.vidnyan.doclinks.domain.model.LinkStatus;
import com.vidnyan.doclinks.domain.model.LinksIndex;
import com.vidnyan.doclinks.domain.model.RefKind;
import com.vidnyan.doclinks.domain.model.ResolvedLink;
import com.vidnyan.doclinks.domain.model.SymbolIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.vidnyan.doclinks.SourceFixtures.AUTH_SERVICE;
import static com.vidnyan.doclinks.SourceFixtures.AUTH_SERVICE_PATH;
import static com.vidnyan.doclinks.SourceFixtures.write;
import static org.junit.jupiter.api.Assertions.*;

class StalenessCheckerTest {

    private static final String DOC = "docs/guide.md";

    @TempDir
    Path root;

    private StalenessChecker checker;
    private LinksIndex links;

    @BeforeEach
    void setUp() {
        write(root, AUTH_SERVICE_PATH, AUTH_SERVICE);
        JavaSourceParser parser = new JavaSourceParser();
        JavaParserSourceInspector inspector = new JavaParserSourceInspector(parser);
        SymbolIndex index = new JavaParserSymbolIndexer(new FileSystemSourceTree(SourceFixtures.properties()),
                parser, SourceFixtures.CLOCK).index(root, List.of("src"));
        ReferenceResolver resolver = new ReferenceResolver(inspector, SourceFixtures.properties(), SourceFixtures.CLOCK);

        links = resolver.resolveAll(ExtractedRefs.of("t", Map.of(DOC, List.of(
                new ExtractedRef("AuthService.authenticate", RefKind.SYMBOL, 3),
                new ExtractedRef(AUTH_SERVICE_PATH, RefKind.FILE, 4),
                new ExtractedRef("Missing", RefKind.SYMBOL, 5)))), root, index);
        checker = new StalenessChecker(inspector, SourceFixtures.CLOCK);
    }

    @Test
    void check_UnchangedTreeIsCurrent() {
        CheckOutcome outcome = checker.check(links, root);

        assertEquals(2, outcome.report().totalChecked());
        assertEquals(2, outcome.report().current());
        assertEquals(0, outcome.report().stale());
        assertEquals("2026-01-15T10:00:00Z", outcome.links().checked());
        assertEquals(0, outcome.links().staleCount());
        for (CheckResult result : outcome.report().docs().get(DOC)) {
            assertEquals(result.storedHash(), result.currentHash());
        }
    }

    @Test
    void check_ParameterChangeMakesSymbolAndFileStale() {
        write(root, AUTH_SERVICE_PATH, AUTH_SERVICE.replace("String token", "String token, boolean remember"));

        CheckOutcome outcome = checker.check(links, root);

        assertEquals(LinkStatus.STALE, statusOf(outcome, "AuthService.authenticate"));
        assertEquals(LinkStatus.STALE, statusOf(outcome, AUTH_SERVICE_PATH));
        assertEquals(2, outcome.report().stale());
    }

    @Test
    void check_JavadocOnlyChangeKeepsSymbolCurrent() {
        write(root, AUTH_SERVICE_PATH, AUTH_SERVICE.replace(
                "    public boolean authenticate(String token) {",
                "    /** Token based login. */\n    public boolean authenticate(String token) {"));

        CheckOutcome outcome = checker.check(links, root);

        assertEquals(LinkStatus.CURRENT, statusOf(outcome, "AuthService.authenticate"));
        assertEquals(LinkStatus.STALE, statusOf(outcome, AUTH_SERVICE_PATH));
    }

    @Test
    void check_DeletedFileIsStaleWithoutCurrentHash() throws IOException {
        Files.delete(root.resolve(AUTH_SERVICE_PATH));

        CheckOutcome outcome = checker.check(links, root);

        assertEquals(2, outcome.report().stale());
        outcome.report().docs().get(DOC).forEach(r -> assertNull(r.currentHash()));
    }

    @Test
    void check_CarriesBrokenAndAmbiguousReferencesOver() {
        CheckOutcome outcome = checker.check(links, root);

        DocLinks doc = outcome.links().docs().get(DOC);
        assertEquals(links.docs().get(DOC).broken(), doc.broken());
        assertEquals(1, outcome.links().totalBroken());
        assertEquals(links.generated(), outcome.links().generated());
    }

    private static LinkStatus statusOf(CheckOutcome outcome, String ref) {
        return outcome.links().docs().get(DOC).links().stream()
                .filter(l -> l.ref().equals(ref))
                .map(ResolvedLink::status)
                .findFirst()
                .orElseThrow();
    }
}
