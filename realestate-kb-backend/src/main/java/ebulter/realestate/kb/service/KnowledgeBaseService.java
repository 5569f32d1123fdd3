package ebulter.realestate.kb.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.gson.Gson;
import ebulter.realestate.kb.config.KnowledgeBaseConfig;
import ebulter.realestate.kb.exception.ErrorCode;
import ebulter.realestate.kb.exception.KnowledgeBaseException;
import ebulter.realestate.kb.exception.NotFoundException;
import ebulter.realestate.kb.model.Agent;
import ebulter.realestate.kb.model.AgentDashboard;
import ebulter.realestate.kb.model.AgentPerformance;
import ebulter.realestate.kb.model.Amenity;
import ebulter.realestate.kb.model.AmenityCategory;
import ebulter.realestate.kb.model.AreaMarketSummary;
import ebulter.realestate.kb.model.AreaReport;
import ebulter.realestate.kb.model.CityOverview;
import ebulter.realestate.kb.model.Client;
import ebulter.realestate.kb.model.EntityType;
import ebulter.realestate.kb.model.KnowledgeRecord;
import ebulter.realestate.kb.model.Listing;
import ebulter.realestate.kb.model.ListingCriteria;
import ebulter.realestate.kb.model.ListingInsights;
import ebulter.realestate.kb.model.ListingMatch;
import ebulter.realestate.kb.model.ListingPage;
import ebulter.realestate.kb.model.MarketTrends;
import ebulter.realestate.kb.model.PriceDistribution;
import ebulter.realestate.kb.model.RefreshResult;
import ebulter.realestate.kb.model.Snapshot;
import ebulter.realestate.kb.repository.RecordRepository;
import ebulter.realestate.kb.util.ObjectMapperFactory;
import ebulter.realestate.kb.util.SystemTimeProvider;
import ebulter.realestate.kb.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Entry point for every knowledge base query.
 * <p>
 * Each call reads the current snapshot exactly once and answers from it, so a refresh running
 * at the same time never mixes two generations into one answer. Every call emits one JSON audit line.
 */
public class KnowledgeBaseService {
    private static final Logger logger = LoggerFactory.getLogger(KnowledgeBaseService.class);
    private static final Gson GSON = new Gson();

    private final RecordStore store;
    private final ListingFilterService filterService;
    private final MatchingService matchingService;
    private final AggregationService aggregationService;
    private final ReportService reportService;
    private final TimeProvider timeProvider;

    public KnowledgeBaseService(RecordStore store) {
        this(store, new ListingFilterService(), new MatchingService(), new AggregationService(),
                new SystemTimeProvider());
    }

    public KnowledgeBaseService(RecordStore store, ListingFilterService filterService, MatchingService matchingService,
                                AggregationService aggregationService, TimeProvider timeProvider) {
        this.store = store;
        this.filterService = filterService;
        this.matchingService = matchingService;
        this.aggregationService = aggregationService;
        this.reportService = new ReportService(aggregationService);
        this.timeProvider = timeProvider;
    }

    /**
     * Wire a service from configuration and perform the initial load
     * @throws ebulter.realestate.kb.exception.LoadFailureException if the initial load fails
     */
    public static KnowledgeBaseService create(KnowledgeBaseConfig config) {
        ObjectMapper objectMapper = ObjectMapperFactory.create();
        RecordRepository repository = config.createRepository(objectMapper);
        SnapshotLoader loader = new SnapshotLoader(repository, objectMapper, new SystemTimeProvider(),
                config.getLoadTimeoutMillis());
        return new KnowledgeBaseService(RecordStore.open(loader));
    }

    public Snapshot snapshot() {
        return store.current();
    }

    // Record store

    public KnowledgeRecord get(EntityType type, String id) {
        return audited("record_get", "get", fields("entityType", type.name(), "id", id),
                snapshot -> snapshot.find(type, id).orElseThrow(() -> new NotFoundException(type, id)),
                record -> 1);
    }

    public List<? extends KnowledgeRecord> all(EntityType type) {
        return audited("record_list", "list", fields("entityType", type.name()),
                snapshot -> snapshot.all(type), List::size);
    }

    public RefreshResult refresh() {
        long startTime = timeProvider.currentTimeMillis();
        try {
            RefreshResult result = store.refresh();
            logJsonAudit("INFO", "snapshot_refresh", "refresh", "success",
                    result.getRecordCounts().values().stream().mapToInt(Integer::intValue).sum(), null, null,
                    fields("generation", result.getGeneration(),
                            "previousGeneration", result.getPreviousGeneration(),
                            "diagnostics", result.getDiagnostics().size(),
                            "durationMs", result.getDurationMillis()));
            return result;
        } catch (KnowledgeBaseException e) {
            logJsonAudit("ERROR", "snapshot_refresh", "refresh", "failure", 0, e.getMessage(), e.getCode().name(),
                    fields("generation", store.current().getGeneration(),
                            "durationMs", timeProvider.currentTimeMillis() - startTime));
            throw e;
        }
    }

    // Filter engine

    public List<Listing> filter(ListingCriteria criteria) {
        return audited("listings_filter", "filter", fields("criteria", criteria.toString()),
                snapshot -> filterService.filter(snapshot, criteria), List::size);
    }

    public ListingPage filterPage(ListingCriteria criteria, int page, int pageSize) {
        return audited("listings_filter", "page", fields("criteria", criteria.toString(), "page", page,
                        "pageSize", pageSize),
                snapshot -> filterService.filterPage(snapshot, criteria, page, pageSize),
                ListingPage::getTotalCount);
    }

    public List<Listing> search(String text) {
        return audited("listings_search", "search", fields("text", text),
                snapshot -> filterService.search(snapshot, text), List::size);
    }

    public List<Agent> searchAgents(String text) {
        return audited("agents_search", "search", fields("text", text),
                snapshot -> filterService.searchAgents(snapshot, text), List::size);
    }

    // Matching engine

    public List<ListingMatch> match(String clientId) {
        return match(clientId, 0);
    }

    public List<ListingMatch> match(String clientId, int limit) {
        return audited("client_match", "match", fields("clientId", clientId, "limit", limit),
                snapshot -> matchingService.match(snapshot, clientId, limit), List::size);
    }

    // Aggregation engine

    public AreaMarketSummary areaStats(String areaName) {
        return audited("area_stats", "aggregate", fields("area", areaName),
                snapshot -> aggregationService.areaStats(snapshot, areaName),
                AreaMarketSummary::getTotalListingCount);
    }

    public AgentPerformance agentStats(String agentId) {
        return audited("agent_stats", "aggregate", fields("agentId", agentId),
                snapshot -> aggregationService.agentStats(snapshot, agentId),
                AgentPerformance::getClosedTransactionCount);
    }

    public PriceDistribution priceDistribution() {
        return audited("price_distribution", "aggregate", fields(),
                aggregationService::priceDistribution, PriceDistribution::getCount);
    }

    public MarketTrends marketTrends() {
        return marketTrends(null);
    }

    public MarketTrends marketTrends(String areaName) {
        return audited("market_trends", "aggregate", fields("area", areaName),
                snapshot -> aggregationService.marketTrends(snapshot, areaName), MarketTrends::getTotalSales);
    }

    public List<AreaMarketSummary> compareAreas(Collection<String> areaNames) {
        return audited("area_compare", "aggregate", fields("areas", String.join(",", areaNames)),
                snapshot -> aggregationService.compareAreas(snapshot, areaNames), List::size);
    }

    // Reports

    public ListingInsights listingInsights(String listingId) {
        return audited("listing_insights", "report", fields("listingId", listingId),
                snapshot -> reportService.listingInsights(snapshot, listingId),
                insights -> insights.getComparableSales().size());
    }

    public AgentDashboard agentDashboard(String agentId) {
        return audited("agent_dashboard", "report", fields("agentId", agentId),
                snapshot -> reportService.agentDashboard(snapshot, agentId),
                dashboard -> dashboard.getActiveListings().size());
    }

    public AreaReport areaReport(String areaName) {
        return audited("area_report", "report", fields("area", areaName),
                snapshot -> reportService.areaReport(snapshot, areaName),
                report -> report.getListings().size());
    }

    public List<Amenity> amenitiesForArea(String areaName) {
        return amenitiesForArea(areaName, null);
    }

    public List<Amenity> amenitiesForArea(String areaName, AmenityCategory category) {
        return audited("area_amenities", "list",
                fields("area", areaName, "category", category == null ? null : category.toValue()),
                snapshot -> reportService.amenitiesForArea(snapshot, areaName, category), List::size);
    }

    public CityOverview cityOverview() {
        return audited("city_overview", "get", fields(), Snapshot::getCityOverview,
                overview -> overview.getCityName() == null ? 0 : 1);
    }

    public List<Client> clientsForAgent(String agentId) {
        return audited("agent_clients", "list", fields("agentId", agentId),
                snapshot -> reportService.clientsForAgent(snapshot, agentId), List::size);
    }

    private <T> T audited(String event, String action, Map<String, Object> extraFields,
                          Function<Snapshot, T> operation, ToIntFunction<T> counter) {
        Snapshot snapshot = store.current();
        extraFields.put("generation", snapshot.getGeneration());
        try {
            T result = operation.apply(snapshot);
            logJsonAudit("INFO", event, action, "success", counter.applyAsInt(result), null, null, extraFields);
            return result;
        } catch (KnowledgeBaseException e) {
            String level = e.getCode() == ErrorCode.LOAD_FAILURE ? "ERROR" : "WARN";
            logJsonAudit(level, event, action, "failure", 0, e.getMessage(), e.getCode().name(), extraFields);
            throw e;
        }
    }

    private static Map<String, Object> fields(Object... keysAndValues) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                fields.put((String) keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return fields;
    }

    private void logJsonAudit(String level, String event, String action, String result, int count,
                              String errorMessage, String errorCode, Map<String, Object> extraFields) {
        Map<String, Object> auditLog = new LinkedHashMap<>();
        auditLog.put("timestamp", timeProvider.now().toString());
        auditLog.put("level", level);
        auditLog.put("event", event);
        auditLog.put("action", action);
        auditLog.put("result", result);
        auditLog.put("count", count);
        auditLog.putAll(extraFields);

        if (errorMessage != null) {
            auditLog.put("errorMessage", errorMessage);
        }
        if (errorCode != null) {
            auditLog.put("errorCode", errorCode);
        }

        String jsonLog = GSON.toJson(auditLog);
        switch (level) {
            case "ERROR":
                logger.error("AUDIT: {}", jsonLog);
                break;
            case "WARN":
                logger.warn("AUDIT: {}", jsonLog);
                break;
            default:
                logger.info("AUDIT: {}", jsonLog);
        }
    }
}
