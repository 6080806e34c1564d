package info.isaksson.erland.tonto.checks;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A proposed fix. {@code codeSuggestion} is a single line of Tonto ready to paste. */
@JsonPropertyOrder({"action", "message", "code_suggestion"})
public final class Suggestion {
    public final SuggestionAction action;
    public final String message;

    @JsonProperty("code_suggestion")
    public final String codeSuggestion;

    public Suggestion(SuggestionAction action, String message, String codeSuggestion) {
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.codeSuggestion = codeSuggestion == null ? "" : codeSuggestion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Suggestion)) return false;
        Suggestion s = (Suggestion) o;
        return action == s.action && message.equals(s.message) && codeSuggestion.equals(s.codeSuggestion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, message, codeSuggestion);
    }

    @Override
    public String toString() {
        return action.label() + ": " + codeSuggestion;
    }
}
