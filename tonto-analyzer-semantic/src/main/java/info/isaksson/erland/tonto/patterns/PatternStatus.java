package info.isaksson.erland.tonto.patterns;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PatternStatus {
    COMPLETE("complete"),
    INCOMPLETE("incomplete");

    private final String label;

    PatternStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
