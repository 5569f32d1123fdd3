package ebulter.realestate.kb.repository;

import com.fasterxml.jackson.databind.JsonNode;
import ebulter.realestate.kb.model.EntityType;

import java.io.IOException;
import java.util.Optional;

/**
 * Persisted storage holding one JSON document per record category
 */
public interface RecordRepository {

    /**
     * Fails when the storage as a whole cannot be reached (missing directory, unreachable bucket)
     * @throws IOException if the source is unavailable
     */
    void checkAvailable() throws IOException;

    /**
     * Read the raw document of one category
     * @return empty when the category document does not exist
     * @throws IOException if the document exists but cannot be read or is not valid JSON
     */
    Optional<JsonNode> readCategory(EntityType type) throws IOException;

    /**
     * Human-readable location, used in logs and error context
     */
    String describe();
}
