package ebulter.realestate.kb.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import ebulter.realestate.kb.exception.LoadFailureException;
import ebulter.realestate.kb.model.CityOverview;
import ebulter.realestate.kb.model.EntityType;
import ebulter.realestate.kb.model.KnowledgeRecord;
import ebulter.realestate.kb.model.LoadDiagnostic;
import ebulter.realestate.kb.model.Snapshot;
import ebulter.realestate.kb.repository.RecordRepository;
import ebulter.realestate.kb.util.SystemTimeProvider;
import ebulter.realestate.kb.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds a complete {@link Snapshot} from a {@link RecordRepository}.
 * Categories degrade independently: a missing or unreadable category becomes an empty collection
 * and a malformed record is skipped, each with a diagnostic. Only a source that is unavailable,
 * too slow, or unreadable in every category fails the load.
 */
public class SnapshotLoader {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotLoader.class);
    public static final long DEFAULT_TIMEOUT_MS = 30000;

    private final RecordRepository repository;
    private final ObjectMapper objectMapper;
    private final TimeProvider timeProvider;
    private final long timeoutMillis;

    public SnapshotLoader(RecordRepository repository, ObjectMapper objectMapper) {
        this(repository, objectMapper, new SystemTimeProvider(), DEFAULT_TIMEOUT_MS);
    }

    public SnapshotLoader(RecordRepository repository, ObjectMapper objectMapper, TimeProvider timeProvider,
                          long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("Load timeout must be positive: " + timeoutMillis);
        }
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.timeProvider = timeProvider;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Load every category and assemble them into a snapshot of the given generation
     * @throws LoadFailureException if the load fails as a whole or exceeds the timeout
     */
    public Snapshot load(long generation) {
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        long startTime = timeProvider.currentTimeMillis();
        logger.info("[{}] Loading snapshot generation {} from {}", requestId, generation, repository.describe());

        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "snapshot-loader-" + generation);
            thread.setDaemon(true);
            return thread;
        });
        Future<Snapshot> future = executor.submit(() -> readAll(requestId, generation));
        try {
            Snapshot snapshot = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            long loadTime = timeProvider.currentTimeMillis() - startTime;
            logger.info("[{}] Loaded snapshot generation {} in {}ms: {} ({} diagnostics)",
                    requestId, generation, loadTime, snapshot.counts(), snapshot.getDiagnostics().size());
            return snapshot;
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.error("[{}] Loading from {} exceeded {}ms", requestId, repository.describe(), timeoutMillis);
            throw new LoadFailureException("Loading from " + repository.describe() + " exceeded "
                    + timeoutMillis + "ms", failureContext(generation), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LoadFailureException) {
                throw (LoadFailureException) cause;
            }
            logger.error("[{}] Unexpected error while loading from {}", requestId, repository.describe(), cause);
            throw new LoadFailureException("Loading from " + repository.describe() + " failed: "
                    + cause.getMessage(), failureContext(generation), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new LoadFailureException("Loading from " + repository.describe() + " was interrupted",
                    failureContext(generation), e);
        } finally {
            executor.shutdownNow();
        }
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    private Snapshot readAll(String requestId, long generation) {
        try {
            repository.checkAvailable();
        } catch (IOException e) {
            logger.error("[{}] Record source {} is unavailable: {}", requestId, repository.describe(), e.getMessage());
            throw new LoadFailureException("Record source " + repository.describe() + " is unavailable: "
                    + e.getMessage(), failureContext(generation), e);
        }

        Snapshot.Builder builder = Snapshot.builder()
                .generation(generation)
                .loadedAt(timeProvider.now());
        List<LoadDiagnostic> diagnostics = new ArrayList<>();
        int loadedCategories = 0;
        int failedCategories = 0;

        for (EntityType type : EntityType.values()) {
            Optional<JsonNode> document;
            try {
                document = repository.readCategory(type);
            } catch (IOException e) {
                failedCategories++;
                logger.warn("[{}] {} document unreadable, continuing with an empty collection: {}",
                        requestId, type, e.getMessage());
                diagnostics.add(LoadDiagnostic.category(type, "unreadable: " + e.getMessage()));
                continue;
            }

            if (document.isEmpty()) {
                logger.warn("[{}] {} document missing, continuing with an empty collection", requestId, type);
                diagnostics.add(LoadDiagnostic.category(type, "missing, loaded as empty"));
                continue;
            }

            JsonNode records = recordArray(type, document.get());
            if (records == null) {
                failedCategories++;
                logger.warn("[{}] {} document has no '{}' array, continuing with an empty collection",
                        requestId, type, type.getRootKey());
                diagnostics.add(LoadDiagnostic.category(type, "no '" + type.getRootKey() + "' array"));
                continue;
            }

            if (type == EntityType.AREA && document.get().isObject()) {
                builder.cityOverview(parseCityOverview(document.get(), diagnostics));
            }

            List<KnowledgeRecord> parsed = parseRecords(type, records, diagnostics);
            builder.records(type, parsed);
            loadedCategories++;
            logger.debug("[{}] {}: {} of {} records accepted", requestId, type, parsed.size(), records.size());
        }

        if (loadedCategories == 0 && failedCategories > 0) {
            throw new LoadFailureException("No category could be read from " + repository.describe(),
                    failureContext(generation));
        }
        return builder.diagnostics(diagnostics).build();
    }

    // Accepts either {"<rootKey>": [...]} or a bare array
    private static JsonNode recordArray(EntityType type, JsonNode document) {
        if (document.isArray()) {
            return document;
        }
        JsonNode records = document.get(type.getRootKey());
        return records != null && records.isArray() ? records : null;
    }

    private CityOverview parseCityOverview(JsonNode document, List<LoadDiagnostic> diagnostics) {
        try {
            return objectMapper.treeToValue(document, CityOverview.class);
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring malformed city overview: {}", e.getOriginalMessage());
            diagnostics.add(LoadDiagnostic.category(EntityType.AREA, "city overview malformed: " + e.getOriginalMessage()));
            return CityOverview.empty();
        }
    }

    private List<KnowledgeRecord> parseRecords(EntityType type, JsonNode records, List<LoadDiagnostic> diagnostics) {
        List<KnowledgeRecord> parsed = new ArrayList<>(records.size());
        String idField = type == EntityType.AREA ? "name" : "id";
        for (int i = 0; i < records.size(); i++) {
            JsonNode node = records.get(i);
            if (node == null || !node.isObject()) {
                diagnostics.add(LoadDiagnostic.record(type, i, null, "not a JSON object"));
                continue;
            }
            String id = node.path(idField).asText(null);
            try {
                KnowledgeRecord record = objectMapper.treeToValue(node, type.getRecordClass());
                List<String> problems = record.validate();
                if (problems.isEmpty()) {
                    parsed.add(record);
                } else {
                    logger.warn("Skipping {} record {} at position {}: {}", type, id, i, problems);
                    diagnostics.add(LoadDiagnostic.record(type, i, id, String.join("; ", problems)));
                }
            } catch (JsonProcessingException e) {
                logger.warn("Skipping malformed {} record {} at position {}: {}", type, id, i, e.getOriginalMessage());
                diagnostics.add(LoadDiagnostic.record(type, i, id, "malformed: " + e.getOriginalMessage()));
            }
        }
        return parsed;
    }

    private Map<String, Object> failureContext(long generation) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("source", repository.describe());
        context.put("generation", generation);
        context.put("timeoutMillis", timeoutMillis);
        return context;
    }
}
