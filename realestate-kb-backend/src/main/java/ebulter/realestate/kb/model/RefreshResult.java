package ebulter.realestate.kb.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a successful refresh
 */
public class RefreshResult {
    private final long previousGeneration;
    private final long generation;
    private final Instant loadedAt;
    private final Map<EntityType, Integer> recordCounts;
    private final List<LoadDiagnostic> diagnostics;
    private final long durationMillis;

    public RefreshResult(long previousGeneration, Snapshot snapshot, long durationMillis) {
        this.previousGeneration = previousGeneration;
        this.generation = snapshot.getGeneration();
        this.loadedAt = snapshot.getLoadedAt();
        this.recordCounts = Collections.unmodifiableMap(new EnumMap<>(snapshot.counts()));
        this.diagnostics = snapshot.getDiagnostics();
        this.durationMillis = durationMillis;
    }

    public long getPreviousGeneration() { return previousGeneration; }

    public long getGeneration() { return generation; }

    public Instant getLoadedAt() { return loadedAt; }

    public Map<EntityType, Integer> getRecordCounts() { return recordCounts; }

    public List<LoadDiagnostic> getDiagnostics() { return diagnostics; }

    public long getDurationMillis() { return durationMillis; }
}
