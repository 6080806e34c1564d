package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** {@code name : Type [card] { meta, ... }} */
@JsonPropertyOrder({"node_type", "attribute_name", "attribute_type", "cardinality", "meta_attributes", "line", "column"})
public final class Attribute extends AstNode implements ClassBodyItem {
    @JsonProperty("attribute_name")
    public final String name;

    @JsonProperty("attribute_type")
    public final String typeRef;

    public final Cardinality cardinality;

    @JsonProperty("meta_attributes")
    public final List<MetaAttribute> metaAttributes;

    public Attribute(String name, String typeRef, Cardinality cardinality, List<MetaAttribute> metaAttributes, int line, int column) {
        super(line, column);
        this.name = name;
        this.typeRef = typeRef;
        this.cardinality = cardinality;
        this.metaAttributes = metaAttributes == null ? List.of() : List.copyOf(metaAttributes);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.ATTRIBUTE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }
}
