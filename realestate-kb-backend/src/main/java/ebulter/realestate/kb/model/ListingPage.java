package ebulter.realestate.kb.model;

import java.util.List;

public class ListingPage {
    private final List<Listing> listings;
    private final int totalCount;
    private final int page;
    private final int pageSize;
    private final int totalPages;

    public ListingPage(List<Listing> listings, int totalCount, int page, int pageSize, int totalPages) {
        this.listings = List.copyOf(listings);
        this.totalCount = totalCount;
        this.page = page;
        this.pageSize = pageSize;
        this.totalPages = totalPages;
    }

    public List<Listing> getListings() {
        return listings;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public int getPage() {
        return page;
    }

    public int getPageSize() {
        return pageSize;
    }

    public int getTotalPages() {
        return totalPages;
    }
}
