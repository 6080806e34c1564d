package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"node_type", "enum_name", "specialization", "values", "line", "column"})
public final class EnumDef extends AstNode implements Declaration {
    @JsonProperty("enum_name")
    public final String name;

    public final Specialization specialization;

    public final List<String> values;

    public EnumDef(String name, Specialization specialization, List<String> values, int line, int column) {
        super(line, column);
        this.name = name;
        this.specialization = specialization;
        this.values = values == null ? List.of() : List.copyOf(values);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.ENUM_DEFINITION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitEnum(this);
    }
}
