package ebulter.realestate.kb.model;

/**
 * Something that went wrong, but not fatally, while loading or indexing a snapshot.
 * Position is the record's index inside its category document, or -1 for category-wide issues.
 */
public class LoadDiagnostic {
    private final EntityType category;
    private final int position;
    private final String recordId;
    private final String message;

    public LoadDiagnostic(EntityType category, int position, String recordId, String message) {
        this.category = category;
        this.position = position;
        this.recordId = recordId;
        this.message = message;
    }

    public static LoadDiagnostic category(EntityType category, String message) {
        return new LoadDiagnostic(category, -1, null, message);
    }

    public static LoadDiagnostic record(EntityType category, int position, String recordId, String message) {
        return new LoadDiagnostic(category, position, recordId, message);
    }

    public static LoadDiagnostic reference(EntityType category, String recordId, String message) {
        return new LoadDiagnostic(category, -1, recordId, message);
    }

    public EntityType getCategory() { return category; }

    public int getPosition() { return position; }

    public String getRecordId() { return recordId; }

    public String getMessage() { return message; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(category.name());
        if (position >= 0) {
            sb.append('[').append(position).append(']');
        }
        if (recordId != null) {
            sb.append(" id=").append(recordId);
        }
        return sb.append(": ").append(message).toString();
    }
}
