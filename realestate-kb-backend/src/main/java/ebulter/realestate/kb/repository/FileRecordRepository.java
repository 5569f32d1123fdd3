package ebulter.realestate.kb.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import ebulter.realestate.kb.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads category documents from a local data directory laid out as {@code <root>/<category path>}
 */
public class FileRecordRepository implements RecordRepository {
    private static final Logger logger = LoggerFactory.getLogger(FileRecordRepository.class);

    private final Path root;
    private final ObjectMapper objectMapper;

    public FileRecordRepository(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper;
    }

    @Override
    public void checkAvailable() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NoSuchFileException(root.toString(), null, "data directory does not exist");
        }
    }

    @Override
    public Optional<JsonNode> readCategory(EntityType type) throws IOException {
        Path file = root.resolve(type.getPath());
        if (!Files.exists(file)) {
            logger.debug("No {} document at {}", type, file);
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(file)) {
            JsonNode document = objectMapper.readTree(in);
            logger.debug("Read {} document from {} ({} bytes)", type, file, Files.size(file));
            return Optional.ofNullable(document);
        }
    }

    @Override
    public String describe() {
        return "file:" + root.toAbsolutePath();
    }
}
