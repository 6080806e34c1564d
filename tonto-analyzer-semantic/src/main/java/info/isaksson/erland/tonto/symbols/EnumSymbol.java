package info.isaksson.erland.tonto.symbols;

import com.fasterxml.jackson.annotation.JsonValue;
import info.isaksson.erland.tonto.ast.EnumDef;

public final class EnumSymbol implements TypeSymbol {
    public final EnumDef definition;

    public EnumSymbol(EnumDef definition) {
        if (definition == null) throw new IllegalArgumentException("definition must not be null");
        this.definition = definition;
    }

    @Override
    public String name() {
        return definition.name;
    }

    @JsonValue
    public EnumDef json() {
        return definition;
    }
}
