package ebulter.realestate.kb.model;

import java.util.List;

public class AgentDashboard {
    private final Agent agent;
    private final AgentPerformance performance;
    private final List<Listing> activeListings;
    private final List<Client> clients;
    private final List<Transaction> transactions;

    public AgentDashboard(Agent agent, AgentPerformance performance, List<Listing> activeListings,
                          List<Client> clients, List<Transaction> transactions) {
        this.agent = agent;
        this.performance = performance;
        this.activeListings = List.copyOf(activeListings);
        this.clients = List.copyOf(clients);
        this.transactions = List.copyOf(transactions);
    }

    public Agent getAgent() { return agent; }

    public AgentPerformance getPerformance() { return performance; }

    public List<Listing> getActiveListings() { return activeListings; }

    public List<Client> getClients() { return clients; }

    public List<Transaction> getTransactions() { return transactions; }
}
