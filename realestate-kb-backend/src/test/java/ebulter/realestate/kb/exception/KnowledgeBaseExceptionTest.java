package ebulter.realestate.kb.exception;

import ebulter.realestate.kb.model.EntityType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class KnowledgeBaseExceptionTest {

    @Test
    public void testNotFoundCarriesTypeAndId() {
        NotFoundException e = new NotFoundException(EntityType.LISTING, "L404");

        assertEquals(ErrorCode.NOT_FOUND, e.getCode());
        assertEquals("listing not found: L404", e.getMessage());
        assertEquals(Map.of("entityType", "LISTING", "id", "L404"), e.getContext());
    }

    @Test
    public void testContextIsCopiedAndKeepsNullValues() {
        // Arrange
        Map<String, Object> context = new HashMap<>();
        context.put("source", "data");
        context.put("generation", null);

        // Act
        LoadFailureException e = new LoadFailureException("unavailable", context, new IOException("gone"));
        context.put("source", "changed");

        // Assert
        assertEquals("data", e.getContext().get("source"));
        assertTrue(e.getContext().containsKey("generation"));
        assertThrows(UnsupportedOperationException.class, () -> e.getContext().put("x", 1));
        assertTrue(e.toString().contains("cause=IOException"));
    }

    @Test
    public void testMissingContextIsEmpty() {
        KnowledgeBaseException e = new KnowledgeBaseException(ErrorCode.LOAD_FAILURE, "failed", null);

        assertTrue(e.getContext().isEmpty());
        assertEquals("KnowledgeBaseException{code=LOAD_FAILURE, message=failed}", e.toString());
    }
}
