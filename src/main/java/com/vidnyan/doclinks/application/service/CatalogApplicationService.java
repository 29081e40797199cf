package com.vidnyan.doclinks.application.service;

import com.vidnyan.doclinks.DocLinksProperties;
import com.vidnyan.doclinks.application.CatalogArtifactMissingException;
import com.vidnyan.doclinks.application.port.in.BuildCatalogUseCase;
import com.vidnyan.doclinks.application.port.in.CatalogStatusUseCase;
import com.vidnyan.doclinks.application.port.in.CheckCatalogUseCase;
import com.vidnyan.doclinks.application.port.in.CheckIndexHealthUseCase;
import com.vidnyan.doclinks.application.port.in.FixCatalogUseCase;
import com.vidnyan.doclinks.application.port.out.CatalogRepository;
import com.vidnyan.doclinks.application.port.out.IndexHealthProbe;
import com.vidnyan.doclinks.application.port.out.ReferenceExtractor;
import com.vidnyan.doclinks.application.port.out.SymbolIndexer;
import com.vidnyan.doclinks.domain.check.CheckOutcome;
import com.vidnyan.doclinks.domain.fix.FixReport;
import com.vidnyan.doclinks.domain.health.HealthReport;
import com.vidnyan.doclinks.domain.model.ExtractedRefs;
import com.vidnyan.doclinks.domain.model.LinksIndex;
import com.vidnyan.doclinks.domain.model.SymbolIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Orchestrates the catalog pipeline: index, extract, resolve, check, fix.
 * Each stage reads the previous stage's artifact and persists its own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogApplicationService implements BuildCatalogUseCase, CheckCatalogUseCase,
        FixCatalogUseCase, CatalogStatusUseCase, CheckIndexHealthUseCase {

    private final SymbolIndexer symbolIndexer;
    private final ReferenceExtractor referenceExtractor;
    private final ReferenceResolver referenceResolver;
    private final StalenessChecker stalenessChecker;
    private final FixContextGatherer fixContextGatherer;
    private final CatalogRepository repository;
    private final IndexHealthProbe healthProbe;
    private final DocLinksProperties properties;

    @Override
    public BuildResult build(Path root) {
        Instant start = Instant.now();
        log.info("Building catalog for: {}", root.toAbsolutePath().normalize());

        log.info("Step 1: Indexing symbols...");
        SymbolIndex symbols = symbolIndexer.index(root, properties.getIndexDirs());
        repository.saveSymbols(root, symbols);

        log.info("Step 2: Extracting references...");
        ExtractedRefs refs = referenceExtractor.extractAll(root, properties.getDocDirs(),
                symbols.knownSymbols(), symbols.packageRoots());
        repository.saveRefs(root, refs);

        log.info("Step 3: Resolving references...");
        LinksIndex links = referenceResolver.resolveAll(refs, root, symbols);
        repository.saveLinks(root, links);

        log.info("Step 4: Checking staleness...");
        CheckOutcome outcome = stalenessChecker.check(links, root);
        repository.saveLinks(root, outcome.links());

        log.info("Catalog built in {} ms", Duration.between(start, Instant.now()).toMillis());
        return new BuildResult(symbols, refs, outcome.links(), outcome.report());
    }

    @Override
    public CheckOutcome check(Path root) {
        LinksIndex links = requireLinks(root);
        CheckOutcome outcome = stalenessChecker.check(links, root);
        repository.saveLinks(root, outcome.links());
        return outcome;
    }

    @Override
    public FixReport fix(Path root) {
        CheckOutcome outcome = check(root);
        SymbolIndex symbols = repository.loadSymbols(root).orElse(null);
        FixReport report = fixContextGatherer.gather(outcome.links(), root, symbols);
        repository.saveFixReport(root, report);
        return report;
    }

    @Override
    public CatalogStatus status(Path root) {
        SymbolSummary symbols = repository.loadSymbols(root)
                .map(s -> new SymbolSummary(s.generated(), s.symbolCount(), s.fileCount()))
                .orElse(null);
        LinkSummary links = repository.loadLinks(root)
                .map(l -> new LinkSummary(l.generated(), l.totalLinks(), l.totalBroken(), l.totalErrors(),
                        l.staleCount(), l.checked()))
                .orElse(null);
        return new CatalogStatus(repository.indexDir(root), symbols, links);
    }

    @Override
    public HealthReport health(Path root) {
        return healthProbe.probe(repository.indexDir(root));
    }

    private LinksIndex requireLinks(Path root) {
        return repository.loadLinks(root).orElseThrow(() -> new CatalogArtifactMissingException(
                repository.indexDir(root).resolve(CatalogRepository.LINKS_FILE), "build"));
    }
}
