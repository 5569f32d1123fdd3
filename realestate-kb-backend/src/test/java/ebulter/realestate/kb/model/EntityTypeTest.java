package ebulter.realestate.kb.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EntityTypeTest {

    @Test
    public void testResolvesSingularPluralAndCategoryNames() {
        assertEquals(EntityType.LISTING, EntityType.fromName("properties"));
        assertEquals(EntityType.LISTING, EntityType.fromName(" Listing "));
        assertEquals(EntityType.AGENT, EntityType.fromName("AGENTS"));
        assertEquals(EntityType.CLIENT, EntityType.fromName("client"));
        assertEquals(EntityType.TRANSACTION, EntityType.fromName("sales"));
        assertEquals(EntityType.AREA, EntityType.fromName("areas"));
        assertEquals(EntityType.AMENITY, EntityType.fromName("amenity"));
    }

    @Test
    public void testRejectsUnknownAndMissingNames() {
        assertThrows(IllegalArgumentException.class, () -> EntityType.fromName("brokers"));
        assertThrows(IllegalArgumentException.class, () -> EntityType.fromName(null));
    }

    @Test
    public void testEachTypeKnowsWhereItIsStored() {
        assertEquals("transactions/recent_sales.json", EntityType.TRANSACTION.getPath());
        assertEquals("recent_sales", EntityType.TRANSACTION.getRootKey());
        assertEquals(Area.class, EntityType.AREA.getRecordClass());
    }
}
