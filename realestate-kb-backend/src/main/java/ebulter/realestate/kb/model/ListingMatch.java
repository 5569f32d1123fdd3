package ebulter.realestate.kb.model;

/**
 * One ranked recommendation: the listing, its 0-100 score and how the score was made up
 */
public class ListingMatch {
    private final Listing listing;
    private final double score;
    private final ScoreBreakdown breakdown;
    private final boolean previouslyMatched;

    public ListingMatch(Listing listing, double score, ScoreBreakdown breakdown, boolean previouslyMatched) {
        this.listing = listing;
        this.score = score;
        this.breakdown = breakdown;
        this.previouslyMatched = previouslyMatched;
    }

    public Listing getListing() { return listing; }

    public double getScore() { return score; }

    public ScoreBreakdown getBreakdown() { return breakdown; }

    /** True when the listing already appears in the client's match history */
    public boolean isPreviouslyMatched() { return previouslyMatched; }

    @Override
    public String toString() {
        return "ListingMatch{listing=" + listing.getId() + ", score=" + score + "}";
    }
}
