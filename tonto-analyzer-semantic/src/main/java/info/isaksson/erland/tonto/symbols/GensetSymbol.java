package info.isaksson.erland.tonto.symbols;

import com.fasterxml.jackson.annotation.JsonValue;
import info.isaksson.erland.tonto.ast.GensetDef;

import java.util.List;

/** A declared generalization set. Serializes as its declaration. */
public final class GensetSymbol {
    public final GensetDef definition;

    public GensetSymbol(GensetDef definition) {
        if (definition == null) throw new IllegalArgumentException("definition must not be null");
        this.definition = definition;
    }

    public String name() {
        return definition.name;
    }

    public String general() {
        return definition.general;
    }

    public List<String> specifics() {
        return definition.specifics;
    }

    public boolean disjoint() {
        return definition.disjoint;
    }

    public boolean complete() {
        return definition.complete;
    }

    @JsonValue
    public GensetDef json() {
        return definition;
    }

    @Override
    public String toString() {
        return "genset " + definition.name;
    }
}
