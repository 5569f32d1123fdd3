package ebulter.realestate.kb.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import ebulter.realestate.kb.exception.ErrorCode;
import ebulter.realestate.kb.exception.LoadFailureException;
import ebulter.realestate.kb.model.CityOverview;
import ebulter.realestate.kb.model.ClientRole;
import ebulter.realestate.kb.model.EntityType;
import ebulter.realestate.kb.model.ListingStatus;
import ebulter.realestate.kb.model.LoadDiagnostic;
import ebulter.realestate.kb.model.Snapshot;
import ebulter.realestate.kb.model.Transaction;
import ebulter.realestate.kb.repository.RecordRepository;
import ebulter.realestate.kb.util.MockTimeProvider;
import ebulter.realestate.kb.util.ObjectMapperFactory;
import ebulter.realestate.kb.util.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class SnapshotLoaderTest {

    @Mock
    private RecordRepository repository;

    private ObjectMapper objectMapper;
    private MockTimeProvider mockTimeProvider;
    private SnapshotLoader loader;

    @BeforeEach
    void setUp() {
        objectMapper = ObjectMapperFactory.create();
        mockTimeProvider = new MockTimeProvider(1_700_000_000_000L);
        loader = new SnapshotLoader(repository, objectMapper, mockTimeProvider, 2000);
        lenient().when(repository.describe()).thenReturn("mock-source");
    }

    private JsonNode json(String text) throws IOException {
        return objectMapper.readTree(text);
    }

    @Nested
    class FixtureDataSet {

        @Test
        public void testLoadsEveryCategory() {
            // Act
            Snapshot snapshot = TestRecords.fixtureLoader().load(1);

            // Assert
            assertEquals(1, snapshot.getGeneration());
            assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), snapshot.getLoadedAt());
            assertEquals(List.of("L001", "L002", "L003", "L004", "L005"),
                    snapshot.getListings().stream().map(l -> l.getId()).collect(Collectors.toList()));
            assertEquals(2, snapshot.getAgents().size());
            assertEquals(2, snapshot.getClients().size());
            assertEquals(3, snapshot.getTransactions().size());
            assertEquals(3, snapshot.getAreas().size());
            assertEquals(4, snapshot.getAmenities().size());
        }

        @Test
        public void testMapsSnakeCaseFields() {
            Snapshot snapshot = TestRecords.fixtureLoader().load(1);

            assertEquals(1800, snapshot.findListing("L001").orElseThrow().getSquareFeet());
            assertEquals(ListingStatus.ACTIVE, snapshot.findListing("L004").orElseThrow().getStatus());
            assertEquals(ClientRole.INVESTOR, snapshot.findClient("C002").orElseThrow().getRole());
            assertEquals(Long.valueOf(650000), snapshot.findClient("C001").orElseThrow()
                    .getPreferences().getBudgetRange().getMax());
            assertEquals(2, snapshot.findAgent("A001").orElseThrow().getTestimonials().size());
        }

        @Test
        public void testFirstDuplicateWinsAndBadRecordsAreReported() {
            // Act
            Snapshot snapshot = TestRecords.fixtureLoader().load(1);
            List<LoadDiagnostic> diagnostics = snapshot.getDiagnostics();

            // Assert
            assertEquals(450000, snapshot.findListing("L001").orElseThrow().getPrice());
            assertTrue(diagnostics.stream().anyMatch(d -> "L006".equals(d.getRecordId())
                    && d.getMessage().contains("missing area")));
            assertTrue(diagnostics.stream().anyMatch(d -> "L001".equals(d.getRecordId())
                    && d.getMessage().contains("duplicate")));
            assertTrue(diagnostics.stream().anyMatch(d -> "C003".equals(d.getRecordId())
                    && d.getMessage().startsWith("malformed")));
        }

        @Test
        public void testReadsCityOverviewNextToAreas() {
            // Act
            CityOverview overview = TestRecords.fixtureLoader().load(1).getCityOverview();

            // Assert
            assertEquals("Riverside", overview.getCityName());
            assertEquals("CA", overview.getState());
            assertEquals(Long.valueOf(314998), overview.getPopulation());
            assertEquals(Long.valueOf(73011), overview.getMedianIncome());
            assertEquals(List.of("Riverside Unified", "Alvord Unified"), overview.getSchoolDistricts());
            assertEquals(2.4, overview.getMarketTrends().get("inventory_months"));
        }
    }

    @Nested
    class AlternateSpellings {

        @Test
        public void testSalePriceAndSingleCategoryPreference() throws IOException {
            // Arrange
            when(repository.readCategory(any(EntityType.class))).thenReturn(Optional.empty());
            when(repository.readCategory(EntityType.TRANSACTION)).thenReturn(Optional.of(json(
                    "{\"recent_sales\": [{\"id\": \"T1\", \"agent_id\": \"A001\", \"area\": \"Woodcrest\","
                            + " \"sale_price\": 500000, \"sale_date\": \"2024-03-01\", \"days_on_market\": 12}]}")));
            when(repository.readCategory(EntityType.CLIENT)).thenReturn(Optional.of(json(
                    "{\"clients\": [{\"id\": \"C1\", \"type\": \"Buyer\","
                            + " \"preferences\": {\"property_type\": \"Condo\", \"desired_areas\": [\"Woodcrest\"]}}]}")));

            // Act
            Snapshot snapshot = loader.load(1);

            // Assert
            Transaction sale = snapshot.findTransaction("T1").orElseThrow();
            assertEquals(500000, sale.getClosingPrice());
            assertEquals(LocalDate.of(2024, 3, 1), sale.getClosingDate());
            assertEquals(List.of("Condo"),
                    snapshot.findClient("C1").orElseThrow().getPreferences().getPropertyTypes());
            assertTrue(snapshot.getDiagnostics().stream().noneMatch(d -> d.getMessage().contains("closing price")));
        }

        @Test
        public void testSingleAndListPreferencesAreMerged() throws IOException {
            // Arrange
            when(repository.readCategory(any(EntityType.class))).thenReturn(Optional.empty());
            when(repository.readCategory(EntityType.CLIENT)).thenReturn(Optional.of(json(
                    "[{\"id\": \"C1\", \"preferences\": {\"property_types\": [\"condo\"],"
                            + " \"property_type\": \"townhouse\"}}]")));

            // Act
            List<String> types = loader.load(1).findClient("C1").orElseThrow().getPreferences().getPropertyTypes();

            // Assert
            assertEquals(2, types.size());
            assertTrue(types.containsAll(List.of("condo", "townhouse")));
        }

        @Test
        public void testBareAreaArrayHasEmptyCityOverview() throws IOException {
            when(repository.readCategory(any(EntityType.class))).thenReturn(Optional.empty());
            when(repository.readCategory(EntityType.AREA)).thenReturn(Optional.of(json("[{\"name\": \"Woodcrest\"}]")));

            Snapshot snapshot = loader.load(1);

            assertEquals(1, snapshot.getAreas().size());
            assertNull(snapshot.getCityOverview().getCityName());
            assertTrue(snapshot.getCityOverview().getSchoolDistricts().isEmpty());
        }

        @Test
        public void testMalformedCityOverviewKeepsAreas() throws IOException {
            // Arrange
            when(repository.readCategory(any(EntityType.class))).thenReturn(Optional.empty());
            when(repository.readCategory(EntityType.AREA)).thenReturn(Optional.of(json(
                    "{\"population\": \"lots\", \"areas\": [{\"name\": \"Woodcrest\"}]}")));

            // Act
            Snapshot snapshot = loader.load(1);

            // Assert
            assertEquals(1, snapshot.getAreas().size());
            assertNull(snapshot.getCityOverview().getPopulation());
            assertTrue(snapshot.getDiagnostics().stream()
                    .anyMatch(d -> d.getCategory() == EntityType.AREA && d.getMessage().startsWith("city overview")));
        }
    }

    @Nested
    class PartialAvailability {

        @Test
        public void testMissingCategoryLoadsAsEmpty() throws IOException {
            // Arrange
            when(repository.readCategory(any(EntityType.class))).thenReturn(Optional.empty());
            when(repository.readCategory(EntityType.AGENT))
                .thenReturn(Optional.of(json("{\"agents\": [{\"id\": \"A001\", \"name\": \"Sarah\"}]}")));

            // Act
            Snapshot snapshot = loader.load(3);

            // Assert
            assertEquals(1, snapshot.getAgents().size());
            assertTrue(snapshot.getListings().isEmpty());
            assertTrue(snapshot.getDiagnostics().stream()
                    .anyMatch(d -> d.getCategory() == EntityType.LISTING && d.getMessage().contains("missing")));
        }

        @Test
        public void testUnreadableCategoryIsEmptyWithDiagnostic() throws IOException {
            // Arrange
            when(repository.readCategory(any(EntityType.class))).thenReturn(Optional.empty());
            when(repository.readCategory(EntityType.AREA))
                .thenReturn(Optional.of(json("[{\"name\": \"Woodcrest\"}]")));
            when(repository.readCategory(EntityType.CLIENT)).thenThrow(new IOException("permission denied"));

            // Act
            Snapshot snapshot = loader.load(1);

            // Assert
            assertEquals(1, snapshot.getAreas().size());
            assertTrue(snapshot.getClients().isEmpty());
            assertTrue(snapshot.getDiagnostics().stream()
                    .anyMatch(d -> d.getCategory() == EntityType.CLIENT && d.getMessage().contains("permission denied")));
        }

        @Test
        public void testDocumentWithoutRootArrayIsEmptyWithDiagnostic() throws IOException {
            // Arrange
            when(repository.readCategory(any(EntityType.class))).thenReturn(Optional.empty());
            when(repository.readCategory(EntityType.AREA)).thenReturn(Optional.of(json("[]")));
            when(repository.readCategory(EntityType.LISTING))
                .thenReturn(Optional.of(json("{\"listings\": [{\"id\": \"L1\"}]}")));

            // Act
            Snapshot snapshot = loader.load(1);

            // Assert
            assertTrue(snapshot.getListings().isEmpty());
            assertTrue(snapshot.getDiagnostics().stream()
                    .anyMatch(d -> d.getCategory() == EntityType.LISTING && d.getMessage().contains("active_listings")));
        }

        @Test
        public void testNonObjectRecordIsSkipped() throws IOException {
            // Arrange
            when(repository.readCategory(any(EntityType.class))).thenReturn(Optional.empty());
            when(repository.readCategory(EntityType.AMENITY))
                .thenReturn(Optional.of(json("{\"amenities\": [\"oops\", {\"id\": \"AM1\", \"category\": \"gym\"}]}")));

            // Act
            Snapshot snapshot = loader.load(1);

            // Assert
            assertEquals(1, snapshot.getAmenities().size());
            assertTrue(snapshot.getDiagnostics().stream()
                    .anyMatch(d -> d.getPosition() == 0 && d.getMessage().contains("not a JSON object")));
        }
    }

    @Nested
    class WholeLoadFailure {

        @Test
        public void testUnavailableSourceFails() throws IOException {
            // Arrange
            doThrow(new IOException("bucket gone")).when(repository).checkAvailable();

            // Act
            LoadFailureException e = assertThrows(LoadFailureException.class, () -> loader.load(1));

            // Assert
            assertEquals(ErrorCode.LOAD_FAILURE, e.getCode());
            assertEquals("mock-source", e.getContext().get("source"));
            verify(repository, never()).readCategory(any(EntityType.class));
        }

        @Test
        public void testEveryCategoryFailingFails() throws IOException {
            when(repository.readCategory(any(EntityType.class))).thenThrow(new IOException("disk error"));

            assertThrows(LoadFailureException.class, () -> loader.load(1));
        }

        @Test
        public void testEveryCategoryMissingIsAnEmptySnapshot() throws IOException {
            when(repository.readCategory(any(EntityType.class))).thenReturn(Optional.empty());

            Snapshot snapshot = loader.load(1);

            assertEquals(6, snapshot.getDiagnostics().size());
            assertTrue(snapshot.counts().values().stream().allMatch(count -> count == 0));
        }

        @Test
        public void testSlowSourceTimesOut() throws Exception {
            // Arrange
            CountDownLatch release = new CountDownLatch(1);
            SnapshotLoader impatient = new SnapshotLoader(repository, objectMapper, mockTimeProvider, 100);
            doAnswer(invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return null;
            }).when(repository).checkAvailable();

            // Act
            LoadFailureException e = assertThrows(LoadFailureException.class, () -> impatient.load(1));
            release.countDown();

            // Assert
            assertTrue(e.getMessage().contains("exceeded 100ms"));
            assertEquals(100L, e.getContext().get("timeoutMillis"));
        }
    }

    @Test
    public void testRejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> new SnapshotLoader(repository, objectMapper, mockTimeProvider, 0));
    }

    @Test
    public void testDefaultTimeout() {
        assertEquals(SnapshotLoader.DEFAULT_TIMEOUT_MS, new SnapshotLoader(repository, objectMapper).getTimeoutMillis());
        assertEquals(2000, loader.getTimeoutMillis());
    }
}
