package ebulter.realestate.kb.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reverse lookups derived from exactly one {@link Snapshot}. Built once, never mutated.
 * Values are record ids in the owning collection's insertion order; area keys are case-insensitive.
 */
public class CrossReferenceIndex {
    private final long generation;
    private final Map<String, List<String>> listingsByAgent;
    private final Map<String, List<String>> listingsByArea;
    private final Map<String, List<String>> amenitiesByArea;
    private final Map<String, List<String>> priorMatchesByClient;
    private final Map<String, List<String>> clientsByAgent;
    private final Map<String, List<String>> transactionsByAgent;
    private final Map<String, List<String>> transactionsByArea;
    private final List<LoadDiagnostic> integrityIssues;

    private CrossReferenceIndex(long generation,
                                Map<String, Set<String>> listingsByAgent,
                                Map<String, Set<String>> listingsByArea,
                                Map<String, Set<String>> amenitiesByArea,
                                Map<String, Set<String>> priorMatchesByClient,
                                Map<String, Set<String>> clientsByAgent,
                                Map<String, Set<String>> transactionsByAgent,
                                Map<String, Set<String>> transactionsByArea,
                                List<LoadDiagnostic> integrityIssues) {
        this.generation = generation;
        this.listingsByAgent = freeze(listingsByAgent);
        this.listingsByArea = freeze(listingsByArea);
        this.amenitiesByArea = freeze(amenitiesByArea);
        this.priorMatchesByClient = freeze(priorMatchesByClient);
        this.clientsByAgent = freeze(clientsByAgent);
        this.transactionsByAgent = freeze(transactionsByAgent);
        this.transactionsByArea = freeze(transactionsByArea);
        this.integrityIssues = Collections.unmodifiableList(integrityIssues);
    }

    /**
     * Build every lookup in one pass per collection and check referential integrity.
     * Dangling references are reported, not rejected.
     */
    public static CrossReferenceIndex build(Snapshot snapshot) {
        List<LoadDiagnostic> issues = new ArrayList<>();
        Map<String, Set<String>> listingsByAgent = new LinkedHashMap<>();
        Map<String, Set<String>> listingsByArea = new LinkedHashMap<>();
        Map<String, Set<String>> amenitiesByArea = new LinkedHashMap<>();
        Map<String, Set<String>> priorMatchesByClient = new LinkedHashMap<>();
        Map<String, Set<String>> clientsByAgent = new LinkedHashMap<>();
        Map<String, Set<String>> transactionsByAgent = new LinkedHashMap<>();
        Map<String, Set<String>> transactionsByArea = new LinkedHashMap<>();

        // Declared portfolios may name listings that are no longer in the collection
        Map<String, Set<String>> declaredOwners = new LinkedHashMap<>();
        for (Agent agent : snapshot.getAgents()) {
            for (String listingId : agent.getListingIds()) {
                add(declaredOwners, listingId, agent.getId());
            }
        }

        for (Listing listing : snapshot.getListings()) {
            if (listing.getAgentId() != null) {
                add(listingsByAgent, listing.getAgentId(), listing.getId());
                if (snapshot.findAgent(listing.getAgentId()).isEmpty()) {
                    issues.add(LoadDiagnostic.reference(EntityType.LISTING, listing.getId(),
                            "unknown agent " + listing.getAgentId()));
                }
            }
            for (String owner : declaredOwners.getOrDefault(listing.getId(), Set.of())) {
                add(listingsByAgent, owner, listing.getId());
            }
            add(listingsByArea, areaKey(listing.getArea()), listing.getId());
            if (snapshot.findArea(listing.getArea()).isEmpty()) {
                issues.add(LoadDiagnostic.reference(EntityType.LISTING, listing.getId(),
                        "unknown area " + listing.getArea()));
            }
        }

        for (Area area : snapshot.getAreas()) {
            for (String amenityId : area.getAmenityIds()) {
                if (snapshot.findAmenity(amenityId).isPresent()) {
                    add(amenitiesByArea, areaKey(area.getName()), amenityId);
                } else {
                    issues.add(LoadDiagnostic.reference(EntityType.AREA, area.getName(),
                            "unknown amenity " + amenityId));
                }
            }
        }
        for (Amenity amenity : snapshot.getAmenities()) {
            if (amenity.getArea() != null) {
                add(amenitiesByArea, areaKey(amenity.getArea()), amenity.getId());
            }
        }

        for (Client client : snapshot.getClients()) {
            for (MatchHistoryEntry entry : client.getMatchHistory()) {
                if (entry.getListingId() != null) {
                    add(priorMatchesByClient, client.getId(), entry.getListingId());
                }
            }
            if (client.getAgentId() != null) {
                add(clientsByAgent, client.getAgentId(), client.getId());
            }
        }

        for (Transaction transaction : snapshot.getTransactions()) {
            if (transaction.getAgentId() != null) {
                add(transactionsByAgent, transaction.getAgentId(), transaction.getId());
            }
            String area = transaction.getArea();
            if (area == null && transaction.getListingId() != null) {
                area = snapshot.findListing(transaction.getListingId()).map(Listing::getArea).orElse(null);
            }
            if (area != null) {
                add(transactionsByArea, areaKey(area), transaction.getId());
            }
        }

        return new CrossReferenceIndex(snapshot.getGeneration(), listingsByAgent, listingsByArea, amenitiesByArea,
                priorMatchesByClient, clientsByAgent, transactionsByAgent, transactionsByArea, issues);
    }

    public long getGeneration() { return generation; }

    public List<String> listingsForAgent(String agentId) {
        return lookup(listingsByAgent, agentId);
    }

    public List<String> listingsForArea(String areaName) {
        return lookup(listingsByArea, areaKey(areaName));
    }

    public List<String> amenitiesForArea(String areaName) {
        return lookup(amenitiesByArea, areaKey(areaName));
    }

    public List<String> priorMatchesForClient(String clientId) {
        return lookup(priorMatchesByClient, clientId);
    }

    public List<String> clientsForAgent(String agentId) {
        return lookup(clientsByAgent, agentId);
    }

    public List<String> transactionsForAgent(String agentId) {
        return lookup(transactionsByAgent, agentId);
    }

    public List<String> transactionsForArea(String areaName) {
        return lookup(transactionsByArea, areaKey(areaName));
    }

    /** Dangling references found while building */
    public List<LoadDiagnostic> getIntegrityIssues() { return integrityIssues; }

    public static String areaKey(String areaName) {
        return areaName == null ? null : areaName.trim().toLowerCase(Locale.ROOT);
    }

    private static List<String> lookup(Map<String, List<String>> map, String key) {
        if (key == null) {
            return List.of();
        }
        return map.getOrDefault(key, List.of());
    }

    private static void add(Map<String, Set<String>> map, String key, String value) {
        if (key == null || value == null) {
            return;
        }
        map.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(value);
    }

    private static Map<String, List<String>> freeze(Map<String, Set<String>> source) {
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        source.forEach((key, values) -> frozen.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(frozen);
    }
}
