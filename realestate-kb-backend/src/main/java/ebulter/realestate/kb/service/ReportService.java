package ebulter.realestate.kb.service;

import ebulter.realestate.kb.exception.NotFoundException;
import ebulter.realestate.kb.model.Agent;
import ebulter.realestate.kb.model.AgentDashboard;
import ebulter.realestate.kb.model.Amenity;
import ebulter.realestate.kb.model.AmenityCategory;
import ebulter.realestate.kb.model.Area;
import ebulter.realestate.kb.model.AreaReport;
import ebulter.realestate.kb.model.Client;
import ebulter.realestate.kb.model.CrossReferenceIndex;
import ebulter.realestate.kb.model.EntityType;
import ebulter.realestate.kb.model.Listing;
import ebulter.realestate.kb.model.ListingInsights;
import ebulter.realestate.kb.model.Snapshot;
import ebulter.realestate.kb.model.Transaction;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Combines records, index lookups and aggregates into per-listing, per-agent and per-area views.
 */
public class ReportService {

    private final AggregationService aggregationService;

    public ReportService(AggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    /**
     * A listing with its agent, its area and the area's sales and amenities.
     * Agent and area are null when the listing refers to records that are not loaded.
     */
    public ListingInsights listingInsights(Snapshot snapshot, String listingId) {
        Listing listing = snapshot.findListing(listingId)
                .orElseThrow(() -> new NotFoundException(EntityType.LISTING, listingId));
        CrossReferenceIndex index = snapshot.getIndex();

        Agent agent = snapshot.findAgent(listing.getAgentId()).orElse(null);
        Area area = snapshot.findArea(listing.getArea()).orElse(null);
        List<Transaction> comparableSales = snapshot.transactions(index.transactionsForArea(listing.getArea()));
        List<Amenity> amenities = snapshot.amenities(index.amenitiesForArea(listing.getArea()));

        return new ListingInsights(listing, agent, area,
                area == null ? null : aggregationService.summarize(snapshot, area),
                comparableSales, amenities);
    }

    public AgentDashboard agentDashboard(Snapshot snapshot, String agentId) {
        Agent agent = snapshot.findAgent(agentId)
                .orElseThrow(() -> new NotFoundException(EntityType.AGENT, agentId));
        CrossReferenceIndex index = snapshot.getIndex();

        List<Listing> activeListings = snapshot.listings(index.listingsForAgent(agent.getId())).stream()
                .filter(Listing::isActive)
                .collect(Collectors.toList());
        return new AgentDashboard(agent,
                aggregationService.agentStats(snapshot, agent.getId()),
                activeListings,
                snapshot.clients(index.clientsForAgent(agent.getId())),
                snapshot.transactions(index.transactionsForAgent(agent.getId())));
    }

    public AreaReport areaReport(Snapshot snapshot, String areaName) {
        Area area = snapshot.findArea(areaName)
                .orElseThrow(() -> new NotFoundException(EntityType.AREA, areaName));
        CrossReferenceIndex index = snapshot.getIndex();

        return new AreaReport(area,
                aggregationService.summarize(snapshot, area),
                snapshot.listings(index.listingsForArea(area.getName())),
                snapshot.transactions(index.transactionsForArea(area.getName())),
                snapshot.amenities(index.amenitiesForArea(area.getName())),
                aggregationService.marketTrends(snapshot, area.getName()));
    }

    /**
     * Amenities of an area; a null category returns all of them
     */
    public List<Amenity> amenitiesForArea(Snapshot snapshot, String areaName, AmenityCategory category) {
        Area area = snapshot.findArea(areaName)
                .orElseThrow(() -> new NotFoundException(EntityType.AREA, areaName));
        List<Amenity> amenities = snapshot.amenities(snapshot.getIndex().amenitiesForArea(area.getName()));
        if (category == null) {
            return amenities;
        }
        return amenities.stream()
                .filter(amenity -> amenity.getCategory() == category)
                .collect(Collectors.toList());
    }

    public List<Client> clientsForAgent(Snapshot snapshot, String agentId) {
        Agent agent = snapshot.findAgent(agentId)
                .orElseThrow(() -> new NotFoundException(EntityType.AGENT, agentId));
        return snapshot.clients(snapshot.getIndex().clientsForAgent(agent.getId()));
    }
}
