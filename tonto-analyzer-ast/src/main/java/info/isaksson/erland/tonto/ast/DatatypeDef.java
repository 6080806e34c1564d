package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"node_type", "datatype_name", "specialization", "body", "line", "column"})
public final class DatatypeDef extends AstNode implements Declaration {
    @JsonProperty("datatype_name")
    public final String name;

    public final Specialization specialization;

    public final List<Attribute> body;

    public DatatypeDef(String name, Specialization specialization, List<Attribute> body, int line, int column) {
        super(line, column);
        this.name = name;
        this.specialization = specialization;
        this.body = body == null ? List.of() : List.copyOf(body);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.DATATYPE_DEFINITION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDatatype(this);
    }
}
