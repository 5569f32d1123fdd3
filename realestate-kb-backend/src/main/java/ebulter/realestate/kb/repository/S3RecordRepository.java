package ebulter.realestate.kb.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import ebulter.realestate.kb.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.util.Optional;

/**
 * Reads category documents from an S3 bucket, one object per category under an optional key prefix
 */
public class S3RecordRepository implements RecordRepository {
    private static final Logger logger = LoggerFactory.getLogger(S3RecordRepository.class);

    private final S3Client s3Client;
    private final String bucketName;
    private final String keyPrefix;
    private final ObjectMapper objectMapper;

    public S3RecordRepository(S3Client s3Client, String bucketName, String keyPrefix, ObjectMapper objectMapper) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.keyPrefix = normalizePrefix(keyPrefix);
        this.objectMapper = objectMapper;
    }

    @Override
    public void checkAvailable() throws IOException {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
        } catch (SdkException e) {
            throw new IOException("S3 bucket " + bucketName + " is not reachable: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<JsonNode> readCategory(EntityType type) throws IOException {
        String key = keyFor(type);
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();

        try (ResponseInputStream<GetObjectResponse> response = s3Client.getObject(request)) {
            JsonNode document = objectMapper.readTree(response);
            logger.debug("Read {} document from s3://{}/{}", type, bucketName, key);
            return Optional.ofNullable(document);
        } catch (NoSuchKeyException e) {
            logger.debug("No {} document at s3://{}/{}", type, bucketName, key);
            return Optional.empty();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return Optional.empty();
            }
            throw new IOException("Failed to read s3://" + bucketName + "/" + key
                    + " (status " + e.statusCode() + ")", e);
        } catch (SdkException e) {
            throw new IOException("Failed to read s3://" + bucketName + "/" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "s3://" + bucketName + "/" + keyPrefix;
    }

    String keyFor(EntityType type) {
        return keyPrefix + type.getPath();
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return "";
        }
        String trimmed = prefix.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.isEmpty() || trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }
}
