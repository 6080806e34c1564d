package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Top-level {@code @stereotype relation A [card] -- name -- [card] B}. */
@JsonPropertyOrder({"node_type", "relation_stereotype", "first_end", "first_cardinality", "op_left", "relation_name",
        "op_right", "second_cardinality", "second_end", "line", "column"})
public final class ExternalRelation extends RelationDef implements Declaration {
    @JsonProperty("first_end")
    public final String firstEnd;

    public ExternalRelation(
            String stereotype,
            String firstEnd,
            Cardinality firstCardinality,
            String opLeft,
            String relationName,
            String opRight,
            Cardinality secondCardinality,
            String secondEnd,
            int line,
            int column
    ) {
        super(stereotype, firstCardinality, opLeft, relationName, opRight, secondCardinality, secondEnd, line, column);
        this.firstEnd = firstEnd;
    }

    @Override
    public String firstEnd() {
        return firstEnd;
    }

    /** True when {@code a} and {@code b} are the two ends, in either direction. */
    public boolean connects(String a, String b) {
        return (a.equals(firstEnd) && b.equals(secondEnd)) || (b.equals(firstEnd) && a.equals(secondEnd));
    }

    @Override
    public NodeType nodeType() {
        return NodeType.EXTERNAL_RELATION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitExternalRelation(this);
    }
}
