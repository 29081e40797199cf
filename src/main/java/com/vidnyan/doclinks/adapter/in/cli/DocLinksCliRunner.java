package com.vidnyan.doclinks.adapter.in.cli;

import com.vidnyan.doclinks.DocLinksProperties;
import com.vidnyan.doclinks.application.CatalogArtifactMissingException;
import com.vidnyan.doclinks.application.CatalogStorageException;
import com.vidnyan.doclinks.application.port.in.BuildCatalogUseCase;
import com.vidnyan.doclinks.application.port.in.BuildCatalogUseCase.BuildResult;
import com.vidnyan.doclinks.application.port.in.CatalogStatusUseCase;
import com.vidnyan.doclinks.application.port.in.CatalogStatusUseCase.CatalogStatus;
import com.vidnyan.doclinks.application.port.in.CheckCatalogUseCase;
import com.vidnyan.doclinks.application.port.in.CheckIndexHealthUseCase;
import com.vidnyan.doclinks.application.port.in.FixCatalogUseCase;
import com.vidnyan.doclinks.application.service.FixPromptRenderer;
import com.vidnyan.doclinks.domain.check.CheckOutcome;
import com.vidnyan.doclinks.domain.check.CheckResult;
import com.vidnyan.doclinks.domain.fix.FixContext;
import com.vidnyan.doclinks.domain.fix.FixReport;
import com.vidnyan.doclinks.domain.health.HealthReport;
import com.vidnyan.doclinks.domain.health.IndexHealth;
import com.vidnyan.doclinks.domain.model.LinkStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point.
 * <pre>
 *   doclinks &lt;build|rebuild|check|status|fix|health&gt; [--doclinks.root=&lt;dir&gt;]
 * </pre>
 * Exit code 0 means clean, 1 means issues were found or a prerequisite is missing,
 * 2 means the artifacts could not be read or written or the command is unknown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocLinksCliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int OK = 0;
    static final int ISSUES = 1;
    static final int FAILURE = 2;

    private final BuildCatalogUseCase buildCatalogUseCase;
    private final CheckCatalogUseCase checkCatalogUseCase;
    private final FixCatalogUseCase fixCatalogUseCase;
    private final CatalogStatusUseCase catalogStatusUseCase;
    private final CheckIndexHealthUseCase checkIndexHealthUseCase;
    private final FixPromptRenderer promptRenderer;
    private final DocLinksProperties properties;

    private int exitCode = OK;

    @Override
    public void run(String... args) {
        List<String> commands = Arrays.stream(args)
                .filter(a -> !a.startsWith("--"))
                .toList();
        if (commands.isEmpty()) {
            printUsage();
            exitCode = FAILURE;
            return;
        }

        Path root = Path.of(properties.getRoot());
        String command = commands.get(0);
        try {
            exitCode = switch (command) {
                case "build", "rebuild" -> build(root);
                case "check" -> check(root);
                case "status" -> status(root);
                case "fix" -> fix(root);
                case "health" -> health(root);
                default -> {
                    log.error("Unknown command: {}", command);
                    printUsage();
                    yield FAILURE;
                }
            };
        } catch (CatalogArtifactMissingException e) {
            log.error(e.getMessage());
            exitCode = ISSUES;
        } catch (CatalogStorageException e) {
            log.error(e.getMessage());
            exitCode = FAILURE;
        } catch (RuntimeException e) {
            log.error("Command '{}' failed: {}", command, e.getMessage(), e);
            exitCode = FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int build(Path root) {
        BuildResult result = buildCatalogUseCase.build(root);
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" CATALOG BUILT");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Symbols:     {} in {} files", result.symbols().symbolCount(), result.symbols().fileCount());
        log.info(" References:  {} in {} docs", result.refs().refCount(), result.refs().docCount());
        log.info(" Links:       {}", result.links().totalLinks());
        log.info(" Broken:      {}", result.links().totalBroken());
        log.info(" Ambiguous:   {}", result.links().totalErrors());
        log.info(" Stale:       {}", result.check().stale());
        log.info("═══════════════════════════════════════════════════════════════");
        return OK;
    }

    private int check(Path root) {
        CheckOutcome outcome = checkCatalogUseCase.check(root);
        log.info("Checked {} links: {} current, {} stale",
                outcome.report().totalChecked(), outcome.report().current(), outcome.report().stale());
        if (outcome.report().stale() == 0) {
            log.info("✅ All links are current.");
            return OK;
        }
        for (Map.Entry<String, List<CheckResult>> doc : outcome.report().docs().entrySet()) {
            for (CheckResult r : doc.getValue()) {
                if (r.status() == LinkStatus.STALE) {
                    log.info("  STALE {}: `{}` -> {}", doc.getKey(), r.ref(), r.target());
                }
            }
        }
        return ISSUES;
    }

    private int status(Path root) {
        CatalogStatus status = catalogStatusUseCase.status(root);
        log.info("Index directory: {}", status.indexDir());
        if (status.symbols() != null) {
            log.info(" Symbols:   {} in {} files (generated {})",
                    status.symbols().symbolCount(), status.symbols().fileCount(), status.symbols().generated());
        } else {
            log.info(" Symbols:   not built");
        }
        if (status.links() != null) {
            log.info(" Links:     {} (generated {})", status.links().total(), status.links().generated());
            log.info(" Broken:    {}", status.links().broken());
            log.info(" Ambiguous: {}", status.links().ambiguous());
            log.info(" Stale:     {}", status.links().stale());
            log.info(" Checked:   {}", status.links().checked() != null ? status.links().checked() : "never");
        } else {
            log.info(" Links:     not built");
        }
        if (!status.built()) {
            log.info("Catalog not built. Run 'build' first.");
            return ISSUES;
        }
        return OK;
    }

    private int fix(Path root) {
        FixReport report = fixCatalogUseCase.fix(root);
        if (report.issues().isEmpty()) {
            log.info("✅ No issues found.");
            return OK;
        }
        log.info("Found {} issues: {} stale, {} broken, {} ambiguous",
                report.totalIssues(), report.stale(), report.broken(), report.errors());
        for (FixContext issue : report.issues()) {
            log.info("");
            log.info("{}", promptRenderer.render(issue));
        }
        return ISSUES;
    }

    private int health(Path root) {
        HealthReport report = checkIndexHealthUseCase.health(root);
        log.info("Overall status: {}", report.overall().name());
        for (IndexHealth index : report.indexes()) {
            if (index.metrics() != null) {
                log.info(" {}: {} ({} bytes, {} entries, {} ms)", index.file(), index.status().wireName(),
                        index.metrics().sizeBytes(), index.metrics().entryCount(), index.metrics().loadTimeMs());
            } else {
                log.info(" {}: {}", index.file(), index.status().wireName());
            }
            index.warnings().forEach(w -> log.info("   {}", w));
        }
        return switch (report.overall()) {
            case OK, WARNING, MISSING -> OK;
            case ERROR -> ISSUES;
            case CRITICAL -> FAILURE;
        };
    }

    private void printUsage() {
        log.info("Usage: doclinks <build|rebuild|check|status|fix|health> [--doclinks.root=<dir>]");
    }
}
