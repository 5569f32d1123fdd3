package ebulter.realestate.kb.service;

import ebulter.realestate.kb.exception.LoadFailureException;
import ebulter.realestate.kb.exception.NotFoundException;
import ebulter.realestate.kb.model.EntityType;
import ebulter.realestate.kb.model.KnowledgeRecord;
import ebulter.realestate.kb.model.RefreshResult;
import ebulter.realestate.kb.model.Snapshot;
import ebulter.realestate.kb.util.SystemTimeProvider;
import ebulter.realestate.kb.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Holds the current {@link Snapshot} and replaces it as a whole on refresh.
 * Readers call {@link #current()} once per query and work against that snapshot only,
 * so a concurrent refresh is never observed half-applied.
 */
public class RecordStore {
    private static final Logger logger = LoggerFactory.getLogger(RecordStore.class);

    private final SnapshotLoader loader;
    private final TimeProvider timeProvider;
    private final Object refreshLock = new Object();

    private volatile Snapshot snapshot = Snapshot.empty();

    public RecordStore(SnapshotLoader loader) {
        this(loader, new SystemTimeProvider());
    }

    public RecordStore(SnapshotLoader loader, TimeProvider timeProvider) {
        this.loader = loader;
        this.timeProvider = timeProvider;
    }

    /**
     * Create a store and perform the initial load
     * @throws LoadFailureException if the initial load fails
     */
    public static RecordStore open(SnapshotLoader loader) {
        RecordStore store = new RecordStore(loader);
        store.refresh();
        return store;
    }

    /**
     * Read the source into a new snapshot without installing it
     */
    public Snapshot load() {
        return loader.load(snapshot.getGeneration() + 1);
    }

    public Snapshot current() {
        return snapshot;
    }

    public KnowledgeRecord get(EntityType type, String id) {
        return snapshot.find(type, id).orElseThrow(() -> new NotFoundException(type, id));
    }

    public List<? extends KnowledgeRecord> all(EntityType type) {
        return snapshot.all(type);
    }

    /**
     * Load a new snapshot and swap it in. On failure the previous snapshot stays current.
     * Refreshes are serialized; readers are never blocked.
     */
    public RefreshResult refresh() {
        synchronized (refreshLock) {
            Snapshot previous = snapshot;
            long startTime = timeProvider.currentTimeMillis();
            Snapshot next;
            try {
                next = loader.load(previous.getGeneration() + 1);
            } catch (LoadFailureException e) {
                logger.error("Refresh failed, keeping generation {}: {}", previous.getGeneration(), e.getMessage());
                throw e;
            }
            snapshot = next;
            long duration = timeProvider.currentTimeMillis() - startTime;
            logger.info("Snapshot generation {} replaced generation {} in {}ms",
                    next.getGeneration(), previous.getGeneration(), duration);
            return new RefreshResult(previous.getGeneration(), next, duration);
        }
    }
}
