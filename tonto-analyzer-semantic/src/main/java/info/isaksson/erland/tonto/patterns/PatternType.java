package info.isaksson.erland.tonto.patterns;

import com.fasterxml.jackson.annotation.JsonValue;

/** The six ontology pattern families, in detection order. */
public enum PatternType {
    SUBKIND("Subkind_Pattern"),
    ROLE("Role_Pattern"),
    PHASE("Phase_Pattern"),
    RELATOR("Relator_Pattern"),
    MODE("Mode_Pattern"),
    ROLE_MIXIN("RoleMixin_Pattern");

    private final String label;

    PatternType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
