package ebulter.realestate.kb.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base exception for data-layer failures, carrying an {@link ErrorCode} and key/value context
 * (entity type, id, field, bounds) so callers can tell what to correct.
 */
public class KnowledgeBaseException extends RuntimeException {
    private final ErrorCode code;
    private final Map<String, Object> context;

    public KnowledgeBaseException(ErrorCode code, String message, Map<String, ?> context) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public KnowledgeBaseException(ErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public ErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Collections.emptyMap();
        }
        // values may be null, e.g. an unset bound
        Map<String, Object> m = new LinkedHashMap<>(input);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code=" + code + ", message=" + getMessage()
                + (context.isEmpty() ? "" : ", context=" + context)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + "}";
    }
}
