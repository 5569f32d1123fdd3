package ebulter.realestate.kb.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import ebulter.realestate.kb.repository.FileRecordRepository;
import ebulter.realestate.kb.repository.RecordRepository;
import ebulter.realestate.kb.repository.S3RecordRepository;
import ebulter.realestate.kb.service.SnapshotLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Where the records live and how long a load may take, read from environment variables.
 * A bucket takes precedence over a directory; with neither set the records are read from ./data.
 */
public class KnowledgeBaseConfig {
    private static final Logger logger = LoggerFactory.getLogger(KnowledgeBaseConfig.class);

    public static final String DATA_DIR = "KB_DATA_DIR";
    public static final String DATA_BUCKET = "KB_DATA_BUCKET";
    public static final String DATA_PREFIX = "KB_DATA_PREFIX";
    public static final String LOAD_TIMEOUT_MS = "KB_LOAD_TIMEOUT_MS";
    public static final String DEFAULT_DATA_DIR = "data";

    private final Path dataDirectory;
    private final String bucketName;
    private final String keyPrefix;
    private final long loadTimeoutMillis;

    public KnowledgeBaseConfig(Path dataDirectory, String bucketName, String keyPrefix, long loadTimeoutMillis) {
        this.dataDirectory = dataDirectory;
        this.bucketName = bucketName;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.loadTimeoutMillis = loadTimeoutMillis;
    }

    public static KnowledgeBaseConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    public static KnowledgeBaseConfig fromMap(Map<String, String> env) {
        String dir = trimToNull(env.get(DATA_DIR));
        String bucket = trimToNull(env.get(DATA_BUCKET));
        String prefix = trimToNull(env.get(DATA_PREFIX));
        return new KnowledgeBaseConfig(
                Paths.get(dir == null ? DEFAULT_DATA_DIR : dir),
                bucket,
                prefix,
                parseTimeout(env.get(LOAD_TIMEOUT_MS)));
    }

    public boolean usesS3() {
        return bucketName != null;
    }

    public RecordRepository createRepository(ObjectMapper objectMapper) {
        return createRepository(objectMapper, S3Client::create);
    }

    public RecordRepository createRepository(ObjectMapper objectMapper, Supplier<S3Client> s3ClientSupplier) {
        if (usesS3()) {
            logger.info("Reading records from S3 bucket {} with prefix '{}'", bucketName, keyPrefix);
            return new S3RecordRepository(s3ClientSupplier.get(), bucketName, keyPrefix, objectMapper);
        }
        logger.info("Reading records from directory {}", dataDirectory.toAbsolutePath());
        return new FileRecordRepository(dataDirectory, objectMapper);
    }

    public Path getDataDirectory() { return dataDirectory; }

    public String getBucketName() { return bucketName; }

    public String getKeyPrefix() { return keyPrefix; }

    public long getLoadTimeoutMillis() { return loadTimeoutMillis; }

    private static long parseTimeout(String value) {
        if (value == null || value.isBlank()) {
            return SnapshotLoader.DEFAULT_TIMEOUT_MS;
        }
        try {
            long timeout = Long.parseLong(value.trim());
            if (timeout > 0) {
                return timeout;
            }
            logger.warn("Invalid {} value {}, using default {}ms", LOAD_TIMEOUT_MS, value, SnapshotLoader.DEFAULT_TIMEOUT_MS);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value {}, using default {}ms", LOAD_TIMEOUT_MS, value, SnapshotLoader.DEFAULT_TIMEOUT_MS);
        }
        return SnapshotLoader.DEFAULT_TIMEOUT_MS;
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
