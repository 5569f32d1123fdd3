package ebulter.realestate.kb.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/** Caller-supplied criteria contradict themselves. */
public class InvalidCriteriaException extends KnowledgeBaseException {

    public InvalidCriteriaException(String field, String message, Object min, Object max) {
        super(ErrorCode.INVALID_CRITERIA, message, context(field, min, max));
    }

    public InvalidCriteriaException(String field, String message) {
        super(ErrorCode.INVALID_CRITERIA, message, Map.of("field", field));
    }

    public String getField() {
        return (String) getContext().get("field");
    }

    private static Map<String, Object> context(String field, Object min, Object max) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("field", field);
        context.put("min", min);
        context.put("max", max);
        return context;
    }
}
