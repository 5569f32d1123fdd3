package ebulter.realestate.kb.exception;

/**
 * Stable error codes the dispatch layer can map onto its own status values
 */
public enum ErrorCode {
    NOT_FOUND,
    INVALID_CRITERIA,
    LOAD_FAILURE
}
