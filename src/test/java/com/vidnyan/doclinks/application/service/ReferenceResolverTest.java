package com.vidnyan.doclinks.application.service;

import com.vidnyan.doclinks.SourceFixtures;
import com.vidnyan.doclinks.adapter.out.parser.JavaParserSourceInspector;
import com.vidnyan.doclinks.adapter.out.parser.JavaParserSymbolIndexer;
import com.vidnyan.doclinks.adapter.out.parser.JavaSourceParser;
import com.vidnyan.doclinks.adapter.out.parser.StructuralFingerprint;
import com.vidnyan.doclinks.adapter.out.scan.FileSystemSourceTree;
import com.vidnyan.doclinks.application.port.out.SourceInspector;
import com.vidnyan.doclinks.domain.model.AmbiguousRef;
import com.vidnyan.doclinks.domain.model.BrokenRef;
import com.vidnyan.doclinks.domain.model.ExtractedRef;
import com.vidnyan.doclinks.domain.model.ExtractedRefs;
import com.vidnyan.doclinks.domain.model.LinksIndex;
import com.vidnyan.doclinks.domain.model.RefKind;
import com.vidnyan.doclinks.domain.model.Resolution;
import com.vidnyan.doclinks.domain.model.ResolvedLink;
import com.vidnyan.doclinks.domain.model.SymbolEntry;
import com.vidnyan.doclinks.domain.model.SymbolIndex;
import com.vidnyan.doclinks.domain.model.SymbolKind;
import com.vidnyan.doclinks.domain.model.TargetKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.vidnyan.doclinks.SourceFixtures.AUTH_SERVICE;
import static com.vidnyan.doclinks.SourceFixtures.AUTH_SERVICE_PATH;
import static com.vidnyan.doclinks.SourceFixtures.write;
import static org.junit.jupiter.api.Assertions.*;

class ReferenceResolverTest {

    private static final String HELPER_A = "src/main/java/com/acme/a/Helper.java";
    private static final String HELPER_B = "src/main/java/com/acme/b/Helper.java";

    @TempDir
    Path root;

    private JavaParserSourceInspector inspector;
    private ReferenceResolver resolver;
    private SymbolIndex index;

    @BeforeEach
    void setUp() {
        write(root, AUTH_SERVICE_PATH, AUTH_SERVICE);
        write(root, HELPER_A, SourceFixtures.emptyClass("com.acme.a", "Helper"));
        write(root, HELPER_B, SourceFixtures.emptyClass("com.acme.b", "Helper"));
        write(root, "docs/guide.md", "# Guide\n");

        JavaSourceParser parser = new JavaSourceParser();
        inspector = new JavaParserSourceInspector(parser);
        resolver = new ReferenceResolver(inspector, SourceFixtures.properties(), SourceFixtures.CLOCK);
        index = new JavaParserSymbolIndexer(new FileSystemSourceTree(SourceFixtures.properties()), parser,
                SourceFixtures.CLOCK).index(root, List.of("src"));
    }

    @Test
    void resolve_FileReferenceHashesContent() throws IOException {
        ResolvedLink link = resolved(new ExtractedRef(AUTH_SERVICE_PATH, RefKind.FILE, 4));

        assertEquals(AUTH_SERVICE_PATH, link.target());
        assertEquals(TargetKind.FILE, link.kind());
        assertEquals(StructuralFingerprint.sha256(Files.readAllBytes(root.resolve(AUTH_SERVICE_PATH))), link.hash());
        assertEquals(4, link.line());
        assertNull(link.status());
    }

    @Test
    void resolve_MissingOrEscapingFileIsBroken() {
        assertEquals("file not found", broken(new ExtractedRef("docs/missing.md", RefKind.FILE, 1)).reason());
        assertEquals("path escapes repository root",
                broken(new ExtractedRef("docs/../../outside.md", RefKind.FILE, 1)).reason());
    }

    @Test
    void resolve_UniqueSymbolResolvesToFileAndName() {
        ResolvedLink link = resolved(new ExtractedRef("AuthService.authenticate()", RefKind.SYMBOL, 7));

        assertEquals(AUTH_SERVICE_PATH + "::AuthService.authenticate", link.target());
        assertEquals(TargetKind.METHOD, link.kind());
        assertEquals(inspector.hashSymbol(root.resolve(AUTH_SERVICE_PATH), "AuthService.authenticate").orElseThrow(),
                link.hash());
        assertEquals("AuthService.authenticate()", link.ref());
    }

    @Test
    void resolve_SymbolKindsMapToTargetKinds() {
        assertEquals(TargetKind.CLASS, resolved(new ExtractedRef("AuthService", RefKind.SYMBOL, 1)).kind());
        assertEquals(TargetKind.FUNCTION, resolved(new ExtractedRef("AuthService.create", RefKind.SYMBOL, 1)).kind());
        assertEquals(TargetKind.CONSTANT,
                resolved(new ExtractedRef("AuthService.MAX_RETRIES", RefKind.SYMBOL, 1)).kind());
    }

    @Test
    void resolve_DuplicatedSymbolIsAmbiguousWithEveryCandidate() {
        Resolution resolution = resolver.resolve(new ExtractedRef("Helper", RefKind.SYMBOL, 2), root, index);

        AmbiguousRef ambiguous = assertInstanceOf(AmbiguousRef.class, resolution);
        assertEquals("ambiguous: found in 2 locations", ambiguous.reason());
        assertEquals(List.of(HELPER_A + ":3", HELPER_B + ":3"), ambiguous.candidates());
    }

    @Test
    void resolve_PackageQualificationNarrowsToOneDefinition() {
        ResolvedLink link = resolved(new ExtractedRef("com.acme.b.Helper", RefKind.SYMBOL, 2));

        assertEquals(HELPER_B + "::Helper", link.target());
        assertEquals(TargetKind.CLASS, link.kind());
    }

    @Test
    void resolve_QualifiedMemberUsesLongestIndexedSuffix() {
        ResolvedLink link = resolved(new ExtractedRef("com.acme.auth.AuthService.create()", RefKind.SYMBOL, 2));

        assertEquals(AUTH_SERVICE_PATH + "::AuthService.create", link.target());
    }

    @Test
    void resolve_InsufficientQualificationStaysAmbiguous() {
        Resolution resolution = resolver.resolve(new ExtractedRef("com.acme.Helper", RefKind.SYMBOL, 2), root, index);

        AmbiguousRef ambiguous = assertInstanceOf(AmbiguousRef.class, resolution);
        assertEquals("still ambiguous after qualification", ambiguous.reason());
        assertEquals(2, ambiguous.candidates().size());
    }

    @Test
    void resolve_UnknownSymbolsAreBroken() {
        assertEquals("symbol not found in module com/acme/zzz",
                broken(new ExtractedRef("com.acme.zzz.Helper", RefKind.SYMBOL, 1)).reason());
        assertEquals("symbol not found", broken(new ExtractedRef("AuthService.logout", RefKind.SYMBOL, 1)).reason());
        assertEquals("symbol not found", broken(new ExtractedRef("Nope", RefKind.SYMBOL, 1)).reason());
    }

    @Test
    void resolve_ImportsResolveToTheirSourceFile() {
        ResolvedLink single = resolved(new ExtractedRef("import com.acme.auth.AuthService;", RefKind.IMPORT, 9));
        ResolvedLink member = resolved(
                new ExtractedRef("import static com.acme.auth.AuthService.MAX_RETRIES;", RefKind.IMPORT, 10));

        assertEquals(AUTH_SERVICE_PATH, single.target());
        assertEquals(TargetKind.FILE, single.kind());
        assertEquals(AUTH_SERVICE_PATH, member.target());
        assertEquals(single.hash(), member.hash());
    }

    @Test
    void resolve_UnknownImportIsBroken() {
        BrokenRef broken = broken(new ExtractedRef("import com.acme.missing.Thing;", RefKind.IMPORT, 3));

        assertEquals("module not found: com.acme.missing.Thing", broken.reason());
    }

    @Test
    void resolve_FallsBackToFileHashWhenSymbolCannotBeFingerprinted() {
        SymbolIndex stubIndex = SymbolIndex.of("t", 1, Map.of("Widget",
                List.of(new SymbolEntry("src/Widget.java", 1, SymbolKind.CLASS, "class Widget"))));
        ExtractedRef ref = new ExtractedRef("Widget", RefKind.SYMBOL, 5);

        Resolution withFileHash = new ReferenceResolver(new StubInspector(Optional.of("file-hash")),
                SourceFixtures.properties(), SourceFixtures.CLOCK).resolve(ref, root, stubIndex);
        Resolution withNothing = new ReferenceResolver(new StubInspector(Optional.empty()),
                SourceFixtures.properties(), SourceFixtures.CLOCK).resolve(ref, root, stubIndex);

        assertEquals("file-hash", assertInstanceOf(ResolvedLink.class, withFileHash).hash());
        assertEquals("could not hash symbol", assertInstanceOf(BrokenRef.class, withNothing).reason());
    }

    @Test
    void resolveAll_ShouldPartitionOutcomesPerDocument() {
        ExtractedRefs refs = ExtractedRefs.of("t", Map.of(
                "docs/guide.md", List.of(
                        new ExtractedRef("AuthService", RefKind.SYMBOL, 1),
                        new ExtractedRef("Helper", RefKind.SYMBOL, 2),
                        new ExtractedRef("Nope", RefKind.SYMBOL, 3)),
                "docs/other.md", List.of(
                        new ExtractedRef("docs/guide.md", RefKind.FILE, 1))));

        LinksIndex links = resolver.resolveAll(refs, root, index);

        assertEquals(2, links.totalLinks());
        assertEquals(1, links.totalBroken());
        assertEquals(1, links.totalErrors());
        assertEquals(1, links.docs().get("docs/guide.md").ambiguous().size());
        assertEquals("2026-01-15T10:00:00Z", links.generated());
        assertNull(links.checked());
    }

    private ResolvedLink resolved(ExtractedRef ref) {
        return assertInstanceOf(ResolvedLink.class, resolver.resolve(ref, root, index));
    }

    private BrokenRef broken(ExtractedRef ref) {
        return assertInstanceOf(BrokenRef.class, resolver.resolve(ref, root, index));
    }

    private record StubInspector(Optional<String> fileHash) implements SourceInspector {

        @Override
        public Optional<String> hashFile(Path file) {
            return fileHash;
        }

        @Override
        public Optional<String> hashSymbol(Path file, String symbolName) {
            return Optional.empty();
        }

        @Override
        public Optional<String> symbolSource(Path file, String symbolName) {
            return Optional.empty();
        }
    }
}
