package ebulter.realestate.kb.exception;

import ebulter.realestate.kb.model.EntityType;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** The requested id or key is not in the current snapshot. */
public class NotFoundException extends KnowledgeBaseException {

    public NotFoundException(EntityType type, String id) {
        super(ErrorCode.NOT_FOUND, type.name().toLowerCase(Locale.ROOT) + " not found: " + id, context(type, id));
    }

    private static Map<String, Object> context(EntityType type, String id) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("entityType", type.name());
        context.put("id", id);
        return context;
    }
}
