package info.isaksson.erland.tonto.symbols;

import com.fasterxml.jackson.annotation.JsonValue;
import info.isaksson.erland.tonto.ast.DatatypeDef;

public final class DatatypeSymbol implements TypeSymbol {
    public final DatatypeDef definition;

    public DatatypeSymbol(DatatypeDef definition) {
        if (definition == null) throw new IllegalArgumentException("definition must not be null");
        this.definition = definition;
    }

    @Override
    public String name() {
        return definition.name;
    }

    @JsonValue
    public DatatypeDef json() {
        return definition;
    }
}
