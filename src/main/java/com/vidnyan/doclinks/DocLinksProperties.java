package com.vidnyan.doclinks;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the catalog pipeline.
 * Can be configured via application.yml or {@code --doclinks.*} command line arguments.
 */
@Data
@Component
@ConfigurationProperties(prefix = "doclinks")
public class DocLinksProperties {

    /**
     * Root of the analyzed repository. Every other path is relative to it.
     */
    private String root = ".";

    /**
     * Directories scanned for Java sources.
     */
    private List<String> indexDirs = new ArrayList<>(List.of("src"));

    /**
     * Directories scanned for Markdown documentation.
     */
    private List<String> docDirs = new ArrayList<>(List.of("docs"));

    /**
     * Where the catalog artifacts are written.
     */
    private String outputDir = "docs/indexes";

    /**
     * Directory names never descended into. Hidden directories are always skipped.
     */
    private List<String> skipDirs = new ArrayList<>(List.of(
            "target", "build", "out", "node_modules", "vendor", "indexes"));

    /**
     * Source roots tried, in order, when turning an import into a file path.
     * The empty string stands for the repository root itself.
     */
    private List<String> sourceRoots = new ArrayList<>(List.of("src/main/java", "src/test/java", ""));

    /**
     * Path prefixes that mark an inline file reference as internal.
     */
    private List<String> internalPathRoots = new ArrayList<>(List.of("src/", "docs/", "scripts/"));

    /**
     * Package prefixes that mark a dotted name or an import as internal, e.g. {@code com.acme}.
     * Roots of the packages declared by indexed sources are always internal as well.
     */
    private List<String> internalPackages = new ArrayList<>();

    /**
     * Upper bound on candidates suggested for a broken reference.
     */
    private int maxCandidates = 5;
}
