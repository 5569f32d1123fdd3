package ebulter.realestate.kb.exception;

import java.util.Map;

/**
 * Loading the record source failed as a whole. The store keeps serving its previous snapshot.
 */
public class LoadFailureException extends KnowledgeBaseException {

    public LoadFailureException(String message, Map<String, ?> context) {
        super(ErrorCode.LOAD_FAILURE, message, context);
    }

    public LoadFailureException(String message, Map<String, ?> context, Throwable cause) {
        super(ErrorCode.LOAD_FAILURE, message, context, cause);
    }
}
