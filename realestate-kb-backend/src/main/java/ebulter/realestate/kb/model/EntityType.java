package ebulter.realestate.kb.model;

import java.util.Locale;

/**
 * The six record categories and where each one is persisted.
 * Paths are relative to the record source root.
 */
public enum EntityType {
    LISTING("properties/active_listings.json", "active_listings", Listing.class),
    AGENT("agents/agent_profiles.json", "agents", Agent.class),
    CLIENT("clients/client_database.json", "clients", Client.class),
    TRANSACTION("transactions/recent_sales.json", "recent_sales", Transaction.class),
    AREA("areas/city_overview.json", "areas", Area.class),
    AMENITY("amenities/local_amenities.json", "amenities", Amenity.class);

    private final String path;
    private final String rootKey;
    private final Class<? extends KnowledgeRecord> recordClass;

    EntityType(String path, String rootKey, Class<? extends KnowledgeRecord> recordClass) {
        this.path = path;
        this.rootKey = rootKey;
        this.recordClass = recordClass;
    }

    public String getPath() { return path; }

    public String getRootKey() { return rootKey; }

    public Class<? extends KnowledgeRecord> getRecordClass() { return recordClass; }

    /**
     * Resolve a category name as callers spell it ("listing", "properties", "agents", ...)
     */
    public static EntityType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Entity type is required");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "listing", "listings", "property", "properties" -> LISTING;
            case "agent", "agents" -> AGENT;
            case "client", "clients" -> CLIENT;
            case "transaction", "transactions", "sale", "sales" -> TRANSACTION;
            case "area", "areas" -> AREA;
            case "amenity", "amenities" -> AMENITY;
            default -> throw new IllegalArgumentException("Unknown entity type: " + name);
        };
    }
}
