package com.vidnyan.doclinks.adapter.in.cli;

import com.vidnyan.doclinks.DocLinksProperties;
import com.vidnyan.doclinks.application.CatalogArtifactMissingException;
import com.vidnyan.doclinks.application.CatalogStorageException;
import com.vidnyan.doclinks.application.port.in.BuildCatalogUseCase;
import com.vidnyan.doclinks.application.port.in.CatalogStatusUseCase;
import com.vidnyan.doclinks.application.port.in.CatalogStatusUseCase.CatalogStatus;
import com.vidnyan.doclinks.application.port.in.CatalogStatusUseCase.LinkSummary;
import com.vidnyan.doclinks.application.port.in.CatalogStatusUseCase.SymbolSummary;
import com.vidnyan.doclinks.application.port.in.CheckCatalogUseCase;
import com.vidnyan.doclinks.application.port.in.CheckIndexHealthUseCase;
import com.vidnyan.doclinks.application.port.in.FixCatalogUseCase;
import com.vidnyan.doclinks.application.service.FixPromptRenderer;
import com.vidnyan.doclinks.domain.check.CheckOutcome;
import com.vidnyan.doclinks.domain.check.CheckReport;
import com.vidnyan.doclinks.domain.check.CheckResult;
import com.vidnyan.doclinks.domain.fix.FixContext;
import com.vidnyan.doclinks.domain.fix.FixReport;
import com.vidnyan.doclinks.domain.fix.IssueType;
import com.vidnyan.doclinks.domain.health.HealthReport;
import com.vidnyan.doclinks.domain.health.HealthStatus;
import com.vidnyan.doclinks.domain.health.IndexHealth;
import com.vidnyan.doclinks.domain.model.ExtractedRefs;
import com.vidnyan.doclinks.domain.model.LinkStatus;
import com.vidnyan.doclinks.domain.model.LinksIndex;
import com.vidnyan.doclinks.domain.model.SymbolIndex;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocLinksCliRunnerTest {

    private static final CheckOutcome CLEAN = outcome(LinkStatus.CURRENT);
    private static final CheckOutcome STALE = outcome(LinkStatus.STALE);

    private BuildCatalogUseCase build = root -> {
        throw new AssertionError("build not expected");
    };
    private CheckCatalogUseCase check = root -> CLEAN;
    private FixCatalogUseCase fix = root -> FixReport.of(List.of());
    private CatalogStatusUseCase status = root -> new CatalogStatus(root.resolve("docs/indexes"),
            new SymbolSummary("t", 3, 1), new LinkSummary("t", 2, 0, 0, 0, "t"));
    private CheckIndexHealthUseCase health = root -> HealthReport.of(List.of());

    @Test
    void noCommand_PrintsUsageAndFails() {
        assertEquals(2, run());
        assertEquals(2, run("--doclinks.root=."));
    }

    @Test
    void unknownCommand_Fails() {
        assertEquals(2, run("publish"));
    }

    @Test
    void check_ExitCodeReflectsStaleness() {
        assertEquals(0, run("check"));

        check = root -> STALE;
        assertEquals(1, run("check"));
    }

    @Test
    void optionsAreNotMistakenForCommands() {
        check = root -> STALE;

        assertEquals(1, run("--doclinks.root=/tmp/repo", "check"));
    }

    @Test
    void missingArtifact_ExitsWithOne() {
        check = root -> {
            throw new CatalogArtifactMissingException(root.resolve("docs/indexes/links.json"), "build");
        };

        assertEquals(1, run("check"));
    }

    @Test
    void storageFailure_ExitsWithTwo() {
        status = root -> {
            throw new CatalogStorageException(root, "read", new IOException("disk gone"));
        };

        assertEquals(2, run("status"));
    }

    @Test
    void unexpectedFailure_ExitsWithTwoInsteadOfPropagating() {
        fix = root -> {
            throw new IllegalStateException("symbol index corrupted");
        };

        assertEquals(2, run("fix"));
    }

    @Test
    void status_NotBuiltExitsWithOne() {
        assertEquals(0, run("status"));

        status = root -> new CatalogStatus(root, null, null);
        assertEquals(1, run("status"));
    }

    @Test
    void build_AndRebuildAlwaysSucceed() {
        build = root -> new BuildCatalogUseCase.BuildResult(
                SymbolIndex.of("t", 0, Map.of()),
                ExtractedRefs.of("t", Map.of()),
                STALE.links(),
                STALE.report());

        assertEquals(0, run("build"));
        assertEquals(0, run("rebuild"));
    }

    @Test
    void fix_ExitsWithOneWhenIssuesExist() {
        assertEquals(0, run("fix"));

        fix = root -> FixReport.of(List.of(new FixContext("docs/a.md", "Nope", 1, IssueType.BROKEN,
                "symbol not found", null, null, List.of())));
        assertEquals(1, run("fix"));
    }

    @Test
    void health_ExitCodeFollowsOverallStatus() {
        assertEquals(0, run("health"));

        health = root -> HealthReport.of(List.of(healthOf(HealthStatus.WARNING)));
        assertEquals(0, run("health"));

        health = root -> HealthReport.of(List.of(healthOf(HealthStatus.ERROR)));
        assertEquals(1, run("health"));

        health = root -> HealthReport.of(List.of(healthOf(HealthStatus.CRITICAL), healthOf(HealthStatus.MISSING)));
        assertEquals(2, run("health"));
    }

    private int run(String... args) {
        DocLinksCliRunner runner = new DocLinksCliRunner(build, check, fix, status, health,
                new FixPromptRenderer(), new DocLinksProperties());
        runner.run(args);
        return runner.getExitCode();
    }

    private static IndexHealth healthOf(HealthStatus status) {
        return new IndexHealth("links.json", status, List.of(), null);
    }

    private static CheckOutcome outcome(LinkStatus status) {
        CheckReport report = CheckReport.of("t", Map.of("docs/a.md",
                List.of(new CheckResult("Foo", "src/Foo.java::Foo", status, "a", "b"))));
        return new CheckOutcome(LinksIndex.of("t", Map.of()), report);
    }
}
