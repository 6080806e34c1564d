package info.isaksson.erland.tonto.checks;

import com.fasterxml.jackson.annotation.JsonValue;

/** What applying a {@link Suggestion} does to the source. */
public enum SuggestionAction {
    INSERT_CODE("insert_code"),
    MODIFY_CODE("modify_code"),
    ADD_KEYWORD("add_keyword"),
    REMOVE_KEYWORD("remove_keyword");

    private final String label;

    SuggestionAction(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
