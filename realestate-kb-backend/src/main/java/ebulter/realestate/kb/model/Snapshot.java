package ebulter.realestate.kb.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * One complete, immutable set of all six record collections plus the index derived from it.
 * A refresh never changes a snapshot; it replaces it.
 */
public class Snapshot {
    private final long generation;
    private final Instant loadedAt;
    private final List<Listing> listings;
    private final List<Agent> agents;
    private final List<Client> clients;
    private final List<Transaction> transactions;
    private final List<Area> areas;
    private final List<Amenity> amenities;
    private final Map<String, Listing> listingMap;
    private final Map<String, Agent> agentMap;
    private final Map<String, Client> clientMap;
    private final Map<String, Transaction> transactionMap;
    private final Map<String, Area> areaMap;
    private final Map<String, Amenity> amenityMap;
    private final CityOverview cityOverview;
    private final List<LoadDiagnostic> diagnostics;
    private final CrossReferenceIndex index;

    private Snapshot(Builder builder) {
        List<LoadDiagnostic> issues = new ArrayList<>(builder.diagnostics);
        this.generation = builder.generation;
        this.loadedAt = builder.loadedAt;
        this.cityOverview = builder.cityOverview;
        this.listingMap = byId(EntityType.LISTING, builder.listings, Function.identity(), issues);
        this.agentMap = byId(EntityType.AGENT, builder.agents, Function.identity(), issues);
        this.clientMap = byId(EntityType.CLIENT, builder.clients, Function.identity(), issues);
        this.transactionMap = byId(EntityType.TRANSACTION, builder.transactions, Function.identity(), issues);
        this.areaMap = byId(EntityType.AREA, builder.areas, CrossReferenceIndex::areaKey, issues);
        this.amenityMap = byId(EntityType.AMENITY, builder.amenities, Function.identity(), issues);
        this.listings = List.copyOf(listingMap.values());
        this.agents = List.copyOf(agentMap.values());
        this.clients = List.copyOf(clientMap.values());
        this.transactions = List.copyOf(transactionMap.values());
        this.areas = List.copyOf(areaMap.values());
        this.amenities = List.copyOf(amenityMap.values());

        this.index = CrossReferenceIndex.build(this);
        if (index.getGeneration() != generation) {
            throw new IllegalStateException("Index generation " + index.getGeneration()
                    + " does not match snapshot generation " + generation);
        }
        issues.addAll(index.getIntegrityIssues());
        this.diagnostics = Collections.unmodifiableList(issues);
    }

    /**
     * The snapshot a store holds before its first successful load
     */
    public static Snapshot empty() {
        return builder().generation(0).loadedAt(Instant.EPOCH).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getGeneration() { return generation; }

    public Instant getLoadedAt() { return loadedAt; }

    public CrossReferenceIndex getIndex() { return index; }

    public CityOverview getCityOverview() { return cityOverview; }

    /** Loader, duplicate-id and referential-integrity diagnostics for this snapshot */
    public List<LoadDiagnostic> getDiagnostics() { return diagnostics; }

    public List<Listing> getListings() { return listings; }

    public List<Agent> getAgents() { return agents; }

    public List<Client> getClients() { return clients; }

    public List<Transaction> getTransactions() { return transactions; }

    public List<Area> getAreas() { return areas; }

    public List<Amenity> getAmenities() { return amenities; }

    public Optional<Listing> findListing(String id) { return find(listingMap, id); }

    public Optional<Agent> findAgent(String id) { return find(agentMap, id); }

    public Optional<Client> findClient(String id) { return find(clientMap, id); }

    public Optional<Transaction> findTransaction(String id) { return find(transactionMap, id); }

    public Optional<Area> findArea(String name) { return find(areaMap, CrossReferenceIndex.areaKey(name)); }

    public Optional<Amenity> findAmenity(String id) { return find(amenityMap, id); }

    public List<? extends KnowledgeRecord> all(EntityType type) {
        return switch (type) {
            case LISTING -> listings;
            case AGENT -> agents;
            case CLIENT -> clients;
            case TRANSACTION -> transactions;
            case AREA -> areas;
            case AMENITY -> amenities;
        };
    }

    public Optional<? extends KnowledgeRecord> find(EntityType type, String id) {
        return switch (type) {
            case LISTING -> findListing(id);
            case AGENT -> findAgent(id);
            case CLIENT -> findClient(id);
            case TRANSACTION -> findTransaction(id);
            case AREA -> findArea(id);
            case AMENITY -> findAmenity(id);
        };
    }

    /**
     * Resolve ids against an id lookup, silently dropping the ones that do not resolve
     */
    public List<Listing> listings(List<String> ids) { return resolve(listingMap, ids); }

    public List<Client> clients(List<String> ids) { return resolve(clientMap, ids); }

    public List<Transaction> transactions(List<String> ids) { return resolve(transactionMap, ids); }

    public List<Amenity> amenities(List<String> ids) { return resolve(amenityMap, ids); }

    public Map<EntityType, Integer> counts() {
        Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            counts.put(type, all(type).size());
        }
        return counts;
    }

    private static <T> Optional<T> find(Map<String, T> map, String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(map.get(key));
    }

    private static <T> List<T> resolve(Map<String, T> map, List<String> ids) {
        List<T> resolved = new ArrayList<>(ids.size());
        for (String id : ids) {
            T record = map.get(id);
            if (record != null) {
                resolved.add(record);
            }
        }
        return resolved;
    }

    // First record wins on duplicate ids
    private static <T extends KnowledgeRecord> Map<String, T> byId(EntityType type, List<T> records,
                                                                   Function<String, String> keyOf,
                                                                   List<LoadDiagnostic> issues) {
        Map<String, T> map = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            T record = records.get(i);
            String key = keyOf.apply(record.getId());
            if (key == null) {
                issues.add(LoadDiagnostic.record(type, i, null, "record without id dropped"));
            } else if (map.putIfAbsent(key, record) != null) {
                issues.add(LoadDiagnostic.record(type, i, record.getId(), "duplicate id, first occurrence kept"));
            }
        }
        return Collections.unmodifiableMap(map);
    }

    public static class Builder {
        private long generation;
        private Instant loadedAt = Instant.EPOCH;
        private List<Listing> listings = List.of();
        private List<Agent> agents = List.of();
        private List<Client> clients = List.of();
        private List<Transaction> transactions = List.of();
        private List<Area> areas = List.of();
        private List<Amenity> amenities = List.of();
        private CityOverview cityOverview = CityOverview.empty();
        private final List<LoadDiagnostic> diagnostics = new ArrayList<>();

        private Builder() {}

        public Builder generation(long generation) {
            this.generation = generation;
            return this;
        }

        public Builder loadedAt(Instant loadedAt) {
            this.loadedAt = loadedAt;
            return this;
        }

        public Builder listings(List<Listing> listings) {
            this.listings = List.copyOf(listings);
            return this;
        }

        public Builder agents(List<Agent> agents) {
            this.agents = List.copyOf(agents);
            return this;
        }

        public Builder clients(List<Client> clients) {
            this.clients = List.copyOf(clients);
            return this;
        }

        public Builder transactions(List<Transaction> transactions) {
            this.transactions = List.copyOf(transactions);
            return this;
        }

        public Builder areas(List<Area> areas) {
            this.areas = List.copyOf(areas);
            return this;
        }

        public Builder amenities(List<Amenity> amenities) {
            this.amenities = List.copyOf(amenities);
            return this;
        }

        /**
         * Set one category from records whose class is known to match the type
         * @throws ClassCastException if a record is not of the type's record class
         */
        public Builder records(EntityType type, List<? extends KnowledgeRecord> records) {
            switch (type) {
                case LISTING -> listings(cast(records, Listing.class));
                case AGENT -> agents(cast(records, Agent.class));
                case CLIENT -> clients(cast(records, Client.class));
                case TRANSACTION -> transactions(cast(records, Transaction.class));
                case AREA -> areas(cast(records, Area.class));
                case AMENITY -> amenities(cast(records, Amenity.class));
            }
            return this;
        }

        private static <T extends KnowledgeRecord> List<T> cast(List<? extends KnowledgeRecord> records,
                                                                Class<T> recordClass) {
            List<T> typed = new ArrayList<>(records.size());
            for (KnowledgeRecord record : records) {
                typed.add(recordClass.cast(record));
            }
            return typed;
        }

        public Builder cityOverview(CityOverview cityOverview) {
            this.cityOverview = cityOverview == null ? CityOverview.empty() : cityOverview;
            return this;
        }

        public Builder diagnostics(List<LoadDiagnostic> diagnostics) {
            this.diagnostics.addAll(diagnostics);
            return this;
        }

        public Snapshot build() {
            return new Snapshot(this);
        }
    }
}
