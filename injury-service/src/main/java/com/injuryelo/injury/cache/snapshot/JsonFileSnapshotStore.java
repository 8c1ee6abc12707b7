package com.injuryelo.injury.cache.snapshot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.injuryelo.common.model.TeamInjuryReport;
import com.injuryelo.injury.cache.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Writes the cache to a single JSON file. Each save goes to a sibling temp file that is
 * then moved over the target, so a crash mid-write leaves the previous snapshot intact.
 */
public class JsonFileSnapshotStore implements InjuryCacheSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSnapshotStore.class);

    private final Path path;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JsonFileSnapshotStore(Path path, ObjectMapper objectMapper, Clock clock) {
        this.path   = path;
        this.clock  = clock;
        this.mapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public List<TeamInjuryReport> load() {
        if (!Files.isRegularFile(path)) {
            log.info("No cache snapshot found. path={}", path);
            return List.of();
        }
        try {
            CacheSnapshotDocument document = mapper.readValue(path.toFile(), CacheSnapshotDocument.class);
            List<TeamInjuryReport> reports = document.getEntries() == null ? List.of()
                : document.getEntries().stream()
                    .map(CacheSnapshotDocument.Entry::getReport)
                    .filter(Objects::nonNull)
                    .toList();
            log.info("Cache snapshot read. path={} entries={} savedAt={}", path, reports.size(), document.getSavedAt());
            return reports;
        } catch (IOException | RuntimeException e) {
            log.warn("Cache snapshot unreadable, starting empty. path={} reason={}", path, e.getMessage());
            return List.of();
        }
    }

    @Override
    public synchronized void save(Collection<CacheEntry> entries) {
        List<CacheSnapshotDocument.Entry> rows = new ArrayList<>();
        entries.stream()
            .sorted(Comparator.comparingInt(CacheEntry::teamId))
            .forEach(e -> rows.add(new CacheSnapshotDocument.Entry(e.teamId(), e.expiresAt(), e.report())));
        CacheSnapshotDocument document = new CacheSnapshotDocument(1, clock.instant(), rows);

        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Cache snapshot written. path={} entries={}", path, rows.size());
        } catch (IOException e) {
            log.warn("Cache snapshot write failed. path={} reason={}", path, e.getMessage());
        }
    }

    public Path path() {
        return path;
    }
}
