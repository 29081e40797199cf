package com.vidnyan.doclinks.application.service;

import com.vidnyan.doclinks.application.port.out.SourceInspector;
import com.vidnyan.doclinks.domain.check.CheckOutcome;
import com.vidnyan.doclinks.domain.check.CheckReport;
import com.vidnyan.doclinks.domain.check.CheckResult;
import com.vidnyan.doclinks.domain.model.DocLinks;
import com.vidnyan.doclinks.domain.model.LinkStatus;
import com.vidnyan.doclinks.domain.model.LinksIndex;
import com.vidnyan.doclinks.domain.model.ResolvedLink;
import com.vidnyan.doclinks.domain.model.SymbolTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Re-fingerprints every resolved link and marks it current or stale.
 * Broken and ambiguous references are carried over untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StalenessChecker {

    private final SourceInspector inspector;
    private final Clock clock;

    public CheckOutcome check(LinksIndex links, Path root) {
        String checkedAt = Instant.now(clock).toString();
        Map<String, DocLinks> checkedDocs = new HashMap<>();
        Map<String, List<CheckResult>> results = new HashMap<>();

        links.docs().forEach((doc, docLinks) -> {
            List<ResolvedLink> updated = new ArrayList<>();
            List<CheckResult> docResults = new ArrayList<>();
            for (ResolvedLink link : docLinks.links()) {
                Optional<String> current = currentHash(link, root);
                LinkStatus status = current.filter(link.hash()::equals).isPresent()
                        ? LinkStatus.CURRENT
                        : LinkStatus.STALE;
                if (status == LinkStatus.STALE) {
                    log.debug("Stale: {} -> {} in {}", link.ref(), link.target(), doc);
                }
                updated.add(link.withStatus(status));
                docResults.add(new CheckResult(link.ref(), link.target(), status, link.hash(), current.orElse(null)));
            }
            checkedDocs.put(doc, docLinks.withLinks(updated));
            results.put(doc, docResults);
        });

        CheckReport report = CheckReport.of(checkedAt, results);
        log.info("Checked {} links: {} current, {} stale", report.totalChecked(), report.current(), report.stale());
        return new CheckOutcome(links.withCheck(checkedAt, checkedDocs), report);
    }

    /**
     * Hash of the link's target as it is now, computed the way the resolver computed the stored one.
     */
    Optional<String> currentHash(ResolvedLink link, Path root) {
        Optional<SymbolTarget> symbol = link.symbolTarget();
        if (symbol.isEmpty()) {
            return inspector.hashFile(root.resolve(link.target()));
        }
        Path file = root.resolve(symbol.get().file());
        return inspector.hashSymbol(file, symbol.get().symbol())
                .or(() -> inspector.hashFile(file));
    }
}
