package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Client implements KnowledgeRecord {
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private ClientRole role;

    @JsonProperty("agent_id")
    private String agentId;

    @JsonProperty("preferences")
    private ClientPreferences preferences;

    @JsonProperty("match_history")
    private List<MatchHistoryEntry> matchHistory;

    private Client() {}

    public Client(String id, String name, ClientRole role, String agentId, ClientPreferences preferences) {
        this(id, name, role, agentId, preferences, null);
    }

    public Client(String id, String name, ClientRole role, String agentId, ClientPreferences preferences,
                  List<MatchHistoryEntry> matchHistory) {
        this.id = id;
        this.name = name;
        this.role = role;
        this.agentId = agentId;
        this.preferences = preferences;
        this.matchHistory = matchHistory == null ? null : new ArrayList<>(matchHistory);
    }

    @Override
    public String getId() { return id; }

    public String getName() { return name; }

    public ClientRole getRole() { return role == null ? ClientRole.BUYER : role; }

    public String getAgentId() { return agentId; }

    public ClientPreferences getPreferences() {
        return preferences == null ? ClientPreferences.none() : preferences;
    }

    public List<MatchHistoryEntry> getMatchHistory() {
        return matchHistory == null ? List.of() : Collections.unmodifiableList(matchHistory);
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (id == null || id.isBlank()) {
            problems.add("missing id");
        }
        BudgetRange budget = getPreferences().getBudgetRange();
        if (budget != null && budget.getMin() != null && budget.getMax() != null
                && budget.getMin() > budget.getMax()) {
            problems.add("budget min " + budget.getMin() + " exceeds max " + budget.getMax());
        }
        return problems;
    }
}
