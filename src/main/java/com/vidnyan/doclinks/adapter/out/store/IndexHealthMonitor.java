package com.vidnyan.doclinks.adapter.out.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.doclinks.application.port.out.CatalogRepository;
import com.vidnyan.doclinks.application.port.out.IndexHealthProbe;
import com.vidnyan.doclinks.domain.health.HealthReport;
import com.vidnyan.doclinks.domain.health.HealthStatus;
import com.vidnyan.doclinks.domain.health.IndexHealth;
import com.vidnyan.doclinks.domain.health.IndexMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Grades each catalog artifact by file size, parse time and approximate token footprint.
 * Large artifacts slow down every tool that loads them whole.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexHealthMonitor implements IndexHealthProbe {

    static final List<String> ARTIFACTS = List.of(
            CatalogRepository.SYMBOLS_FILE,
            CatalogRepository.REFS_FILE,
            CatalogRepository.LINKS_FILE,
            CatalogRepository.FIX_REPORT_FILE);

    static final double WARNING_SIZE_MB = 10;
    static final double ERROR_SIZE_MB = 50;
    static final double CRITICAL_SIZE_MB = 100;

    static final long WARNING_LOAD_MS = 500;
    static final long CRITICAL_LOAD_MS = 2000;

    static final long WARNING_TOKENS = 50_000;
    static final long ERROR_TOKENS = 200_000;

    private final ObjectMapper objectMapper;

    @Override
    public HealthReport probe(Path indexDir) {
        List<IndexHealth> results = new ArrayList<>();
        for (String name : ARTIFACTS) {
            Path file = indexDir.resolve(name);
            if (!Files.exists(file)) {
                results.add(new IndexHealth(name, HealthStatus.MISSING, List.of(), null));
                continue;
            }
            try {
                results.add(grade(name, measure(file)));
            } catch (IOException e) {
                log.warn("Cannot measure {}: {}", file, e.getMessage());
                results.add(new IndexHealth(name, HealthStatus.ERROR,
                        List.of("Failed to read index: " + e.getMessage()), null));
            }
        }
        return HealthReport.of(results);
    }

    IndexMetrics measure(Path file) throws IOException {
        long size = Files.size(file);
        long start = System.nanoTime();
        JsonNode data = objectMapper.readTree(file.toFile());
        long loadMs = (System.nanoTime() - start) / 1_000_000;
        int entries = countEntries(data);
        long avg = entries > 0 ? size / entries : 0;
        return new IndexMetrics(file.toString(), size, entries, avg, loadMs);
    }

    IndexHealth grade(String name, IndexMetrics metrics) {
        HealthStatus status = HealthStatus.OK;
        List<String> warnings = new ArrayList<>();
        String sizeMb = String.format(Locale.ROOT, "%.2f", metrics.sizeMb());

        if (metrics.sizeMb() >= CRITICAL_SIZE_MB) {
            status = HealthStatus.CRITICAL;
            warnings.add("CRITICAL: index size " + sizeMb + "MB exceeds " + (int) CRITICAL_SIZE_MB + "MB");
        } else if (metrics.sizeMb() >= ERROR_SIZE_MB) {
            status = HealthStatus.ERROR;
            warnings.add("ERROR: index size " + sizeMb + "MB exceeds " + (int) ERROR_SIZE_MB + "MB");
        } else if (metrics.sizeMb() >= WARNING_SIZE_MB) {
            status = HealthStatus.WARNING;
            warnings.add("WARNING: index size " + sizeMb + "MB is approaching the limit");
        }

        if (metrics.loadTimeMs() >= CRITICAL_LOAD_MS) {
            status = status.worst(HealthStatus.CRITICAL);
            warnings.add("CRITICAL: load time " + metrics.loadTimeMs() + "ms");
        } else if (metrics.loadTimeMs() >= WARNING_LOAD_MS) {
            status = status.worst(HealthStatus.WARNING);
            warnings.add("WARNING: load time " + metrics.loadTimeMs() + "ms is slow");
        }

        long tokens = metrics.approxTokens();
        if (tokens >= ERROR_TOKENS) {
            status = status.worst(HealthStatus.ERROR);
            warnings.add("ERROR: loading the whole index costs about " + tokens + " tokens");
        } else if (tokens >= WARNING_TOKENS) {
            status = status.worst(HealthStatus.WARNING);
            warnings.add("WARNING: loading the whole index costs about " + tokens + " tokens");
        }

        return new IndexHealth(name, status, warnings, metrics);
    }

    /**
     * Symbol definitions, references, links or issues, depending on the artifact.
     */
    static int countEntries(JsonNode data) {
        if (data.has("symbols")) {
            return sumArrays(data.get("symbols"));
        }
        if (data.has("issues")) {
            return data.get("issues").size();
        }
        if (data.has("docs")) {
            int count = 0;
            for (JsonNode doc : data.get("docs")) {
                count += doc.isArray() ? doc.size() : sumArrays(doc);
            }
            return count;
        }
        return data.size();
    }

    private static int sumArrays(JsonNode node) {
        int count = 0;
        Iterator<JsonNode> values = node.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            count += value.isArray() ? value.size() : 1;
        }
        return count;
    }
}
