package com.vidnyan.doclinks.adapter.out.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.doclinks.DocLinksProperties;
import com.vidnyan.doclinks.application.CatalogStorageException;
import com.vidnyan.doclinks.application.port.out.CatalogRepository;
import com.vidnyan.doclinks.domain.fix.FixReport;
import com.vidnyan.doclinks.domain.model.ExtractedRefs;
import com.vidnyan.doclinks.domain.model.LinksIndex;
import com.vidnyan.doclinks.domain.model.SymbolIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores catalog artifacts as JSON files in the configured output directory.
 * Every write goes to a temporary file first and is then moved over the artifact,
 * so readers never see a half-written file.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonCatalogRepository implements CatalogRepository {

    private final ObjectMapper objectMapper;
    private final DocLinksProperties properties;

    @Override
    public Path indexDir(Path root) {
        return root.resolve(properties.getOutputDir());
    }

    @Override
    public void saveSymbols(Path root, SymbolIndex index) {
        write(root, SYMBOLS_FILE, index);
    }

    @Override
    public Optional<SymbolIndex> loadSymbols(Path root) {
        return read(root, SYMBOLS_FILE, SymbolIndex.class);
    }

    @Override
    public void saveRefs(Path root, ExtractedRefs refs) {
        write(root, REFS_FILE, refs);
    }

    @Override
    public Optional<ExtractedRefs> loadRefs(Path root) {
        return read(root, REFS_FILE, ExtractedRefs.class);
    }

    @Override
    public void saveLinks(Path root, LinksIndex links) {
        write(root, LINKS_FILE, links);
    }

    @Override
    public Optional<LinksIndex> loadLinks(Path root) {
        return read(root, LINKS_FILE, LinksIndex.class);
    }

    @Override
    public void saveFixReport(Path root, FixReport report) {
        write(root, FIX_REPORT_FILE, report);
    }

    private void write(Path root, String fileName, Object artifact) {
        Path dir = indexDir(root);
        Path target = dir.resolve(fileName);
        try {
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, "." + fileName, ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), artifact);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new CatalogStorageException(target, "write", e);
        }
        log.debug("Wrote {}", target);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private <T> Optional<T> read(Path root, String fileName, Class<T> type) {
        Path source = indexDir(root).resolve(fileName);
        if (!Files.exists(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(source.toFile(), type));
        } catch (IOException e) {
            throw new CatalogStorageException(source, "read", e);
        }
    }
}
