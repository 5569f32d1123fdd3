package ebulter.realestate.kb.model;

import java.util.List;

/**
 * Common contract of every record held in a {@link Snapshot}
 */
public interface KnowledgeRecord {

    /**
     * Stable identifier of the record within its category
     */
    String getId();

    /**
     * Checks the record's own invariants after deserialization.
     * @return problems found, empty when the record is usable
     */
    List<String> validate();
}
