package info.isaksson.erland.tonto.symbols;

import com.fasterxml.jackson.annotation.JsonValue;
import info.isaksson.erland.tonto.ast.ClassDef;

import java.util.List;

/** A declared class. Serializes as its declaration. */
public final class ClassSymbol implements TypeSymbol {
    public final ClassDef definition;

    public ClassSymbol(ClassDef definition) {
        if (definition == null) throw new IllegalArgumentException("definition must not be null");
        this.definition = definition;
    }

    @Override
    public String name() {
        return definition.name;
    }

    public String stereotype() {
        return definition.stereotype;
    }

    public boolean hasStereotype(String s) {
        return definition.stereotype.equals(s);
    }

    public List<String> parents() {
        return definition.parents();
    }

    @JsonValue
    public ClassDef json() {
        return definition;
    }

    @Override
    public String toString() {
        return definition.stereotype + " " + definition.name;
    }
}
