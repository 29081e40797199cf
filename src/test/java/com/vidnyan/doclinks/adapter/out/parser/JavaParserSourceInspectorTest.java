package com.vidnyan.doclinks.adapter.out.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static com.vidnyan.doclinks.SourceFixtures.AUTH_SERVICE;
import static com.vidnyan.doclinks.SourceFixtures.AUTH_SERVICE_PATH;
import static com.vidnyan.doclinks.SourceFixtures.write;
import static org.junit.jupiter.api.Assertions.*;

class JavaParserSourceInspectorTest {

    @TempDir
    Path root;

    private final JavaParserSourceInspector inspector = new JavaParserSourceInspector(new JavaSourceParser());

    @Test
    void hashFile_ShouldHashRawBytes() throws IOException {
        Path file = write(root, "docs/guide.md", "# Guide\n");

        Optional<String> hash = inspector.hashFile(file);

        assertEquals(Optional.of(StructuralFingerprint.sha256(Files.readAllBytes(file))), hash);
    }

    @Test
    void hashFile_MissingFileOrDirectoryGivesEmpty() throws IOException {
        Files.createDirectories(root.resolve("src"));

        assertTrue(inspector.hashFile(root.resolve("nope.md")).isEmpty());
        assertTrue(inspector.hashFile(root.resolve("src")).isEmpty());
    }

    @Test
    void hashSymbol_ShouldFindEveryIndexedSymbolKind() {
        Path file = write(root, AUTH_SERVICE_PATH, AUTH_SERVICE);

        assertTrue(inspector.hashSymbol(file, "AuthService").isPresent());
        assertTrue(inspector.hashSymbol(file, "AuthService.authenticate").isPresent());
        assertTrue(inspector.hashSymbol(file, "AuthService.create").isPresent());
        assertTrue(inspector.hashSymbol(file, "AuthService.MAX_RETRIES").isPresent());
        assertTrue(inspector.hashSymbol(file, "AuthService.logout").isEmpty());
    }

    @Test
    void hashSymbol_UnparseableFileGivesEmpty() {
        Path file = write(root, "src/Broken.java", "public class Broken { void x( }");

        assertTrue(inspector.hashSymbol(file, "Broken").isEmpty());
    }

    @Test
    void hashSymbol_ConstantValueChangeIsDetected() {
        Path file = write(root, AUTH_SERVICE_PATH, AUTH_SERVICE);
        String before = inspector.hashSymbol(file, "AuthService.MAX_RETRIES").orElseThrow();

        write(root, AUTH_SERVICE_PATH, AUTH_SERVICE.replace("MAX_RETRIES = 3", "MAX_RETRIES = 4"));

        assertNotEquals(before, inspector.hashSymbol(file, "AuthService.MAX_RETRIES").orElseThrow());
    }

    @Test
    void symbolSource_ShouldSliceEveryOverload() {
        Path file = write(root, AUTH_SERVICE_PATH, AUTH_SERVICE);

        String source = inspector.symbolSource(file, "AuthService.authenticate").orElseThrow();

        assertEquals(String.join("\n",
                "    public boolean authenticate(String user, String password) {",
                "        return user != null && password != null;",
                "    }",
                "",
                "    public boolean authenticate(String token) {",
                "        return token != null;",
                "    }"), source);
    }

    @Test
    void symbolSource_ConstantIsItsDeclarationLine() {
        Path file = write(root, AUTH_SERVICE_PATH, AUTH_SERVICE);

        assertEquals("    public static final int MAX_RETRIES = 3;",
                inspector.symbolSource(file, "AuthService.MAX_RETRIES").orElseThrow());
    }
}
