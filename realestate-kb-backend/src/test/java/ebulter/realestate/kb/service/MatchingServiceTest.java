package ebulter.realestate.kb.service;

import ebulter.realestate.kb.exception.NotFoundException;
import ebulter.realestate.kb.model.BudgetRange;
import ebulter.realestate.kb.model.ClientPreferences;
import ebulter.realestate.kb.model.Listing;
import ebulter.realestate.kb.model.ListingMatch;
import ebulter.realestate.kb.model.ListingStatus;
import ebulter.realestate.kb.model.Snapshot;
import ebulter.realestate.kb.util.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MatchingServiceTest {

    private MatchingService matchingService;

    @BeforeEach
    void setUp() {
        matchingService = new MatchingService();
    }

    private static List<String> ids(List<ListingMatch> matches) {
        return matches.stream().map(m -> m.getListing().getId()).collect(Collectors.toList());
    }

    @Nested
    class Scoring {

        @Test
        public void testFewerBedroomsInDesiredAreaScoresReducedButNonzero() {
            // Arrange
            Listing listing = TestRecords.listing("1", 450000, "Woodcrest", 2, ListingStatus.ACTIVE);
            ClientPreferences preferences = new ClientPreferences(null, 3, List.of("Woodcrest"), null);

            // Act
            ListingMatch match = matchingService.score(listing, preferences, false);

            // Assert
            assertEquals(85.19, match.getScore(), 0.001);
            assertTrue(match.getScore() < 100);
            assertEquals(2.0 / 3.0, match.getBreakdown().getBedroomFit(), 1e-9);
            assertEquals(1.0, match.getBreakdown().getAreaMatch());
            assertNull(match.getBreakdown().getPriceFit());
            assertNull(match.getBreakdown().getTypeMatch());
        }

        @Test
        public void testStudioElsewhereIsExcluded() {
            // Arrange
            Listing studio = TestRecords.listing("2", 300000, "Downtown Riverside", 0, ListingStatus.ACTIVE);
            ClientPreferences preferences = new ClientPreferences(null, 3, List.of("Woodcrest"), null);

            // Act
            List<ListingMatch> ranking = matchingService.rank(List.of(studio), preferences, Set.of());

            // Assert
            assertEquals(0.0, matchingService.score(studio, preferences, false).getScore());
            assertTrue(ranking.isEmpty());
        }

        @Test
        public void testPerfectMatchScoresHundred() {
            Listing listing = TestRecords.listing("1", 500000, "Woodcrest", 3, ListingStatus.ACTIVE);
            ClientPreferences preferences = new ClientPreferences(new BudgetRange(400000L, 600000L), 3,
                    List.of("woodcrest"), List.of("Single_Family"));

            assertEquals(100.0, matchingService.score(listing, preferences, false).getScore());
        }

        @Test
        public void testNoStatedPreferencesScoresZero() {
            Listing listing = TestRecords.listing("1", 500000, "Woodcrest");

            assertEquals(0.0, matchingService.score(listing, ClientPreferences.none(), false).getScore());
        }

        @Test
        public void testScoreStaysWithinBounds() {
            ClientPreferences preferences = new ClientPreferences(new BudgetRange(100000L, 200000L), 5,
                    List.of("Elsewhere"), List.of("condo"));

            for (long price : new long[]{0, 150000, 10_000_000}) {
                double score = matchingService.score(TestRecords.listing("x", price, "Woodcrest", 1,
                        ListingStatus.ACTIVE), preferences, false).getScore();
                assertTrue(score >= 0 && score <= 100, "score " + score);
            }
        }
    }

    @Nested
    class PriceFit {

        @Test
        public void testInsideBudgetIsFullCredit() {
            assertEquals(1.0, MatchingService.priceFit(500000, new BudgetRange(400000L, 600000L)));
            assertEquals(1.0, MatchingService.priceFit(400000, new BudgetRange(400000L, null)));
        }

        @Test
        public void testDecaysTwoPointsPerPercentOutside() {
            assertEquals(0.8, MatchingService.priceFit(660000, new BudgetRange(null, 600000L)), 1e-9);
            assertEquals(0.9, MatchingService.priceFit(380000, new BudgetRange(400000L, 600000L)), 1e-9);
        }

        @Test
        public void testFloorsAtZero() {
            assertEquals(0.0, MatchingService.priceFit(900000, new BudgetRange(null, 600000L)), 1e-9);
            assertEquals(0.0, MatchingService.priceFit(2000000, new BudgetRange(null, 600000L)));
        }

        @Test
        public void testUnstatedBudgetIsNotScored() {
            assertNull(MatchingService.priceFit(500000, null));
            assertNull(MatchingService.priceFit(500000, new BudgetRange(null, null)));
        }
    }

    @Nested
    class Weighting {

        @Test
        public void testHintsScaleBaseWeights() {
            // Arrange
            Listing listing = TestRecords.listing("1", 450000, "Woodcrest", 2, ListingStatus.ACTIVE);
            ClientPreferences preferences = new ClientPreferences(null, 3, List.of("Woodcrest"), null,
                    Map.of("bedrooms", 0.0));

            // Act & Assert
            assertEquals(100.0, matchingService.score(listing, preferences, false).getScore());
        }

        @Test
        public void testAllZeroHintsFallBackToBaseWeights() {
            Listing listing = TestRecords.listing("1", 450000, "Woodcrest", 2, ListingStatus.ACTIVE);
            ClientPreferences preferences = new ClientPreferences(null, 3, List.of("Woodcrest"), null,
                    Map.of("bedrooms", 0.0, "area", -2.0));

            assertEquals(85.19, matchingService.score(listing, preferences, false).getScore(), 0.001);
        }
    }

    @Nested
    class ClientRanking {

        private Snapshot snapshot;

        @BeforeEach
        void loadFixtures() {
            snapshot = TestRecords.fixtureLoader().load(1);
        }

        @Test
        public void testRanksActiveListingsBestFirst() {
            // Act
            List<ListingMatch> matches = matchingService.match(snapshot, "C001", 0);

            // Assert
            assertEquals(List.of("L001", "L004", "L002"), ids(matches));
            assertEquals(100.0, matches.get(0).getScore());
            assertEquals(49.33, matches.get(1).getScore(), 0.001);
            assertEquals(22.56, matches.get(2).getScore(), 0.001);
        }

        @Test
        public void testFlagsPreviouslyMatchedListings() {
            List<ListingMatch> matches = matchingService.match(snapshot, "C001", 0);

            assertTrue(matches.get(0).isPreviouslyMatched());
            assertFalse(matches.get(1).isPreviouslyMatched());
        }

        @Test
        public void testTiesKeepInsertionOrder() {
            List<ListingMatch> matches = matchingService.match(snapshot, "C002", 0);

            assertEquals(List.of("L002", "L001", "L004"), ids(matches));
            assertEquals(matches.get(1).getScore(), matches.get(2).getScore());
        }

        @Test
        public void testLimitTruncates() {
            assertEquals(List.of("L001"), ids(matchingService.match(snapshot, "C001", 1)));
        }

        @Test
        public void testIsDeterministic() {
            assertEquals(ids(matchingService.match(snapshot, "C002", 0)),
                    ids(matchingService.match(snapshot, "C002", 0)));
        }

        @Test
        public void testUnknownClientIsNotFound() {
            assertThrows(NotFoundException.class, () -> matchingService.match(snapshot, "C404", 0));
        }
    }
}
