package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Relation declared inside a class body; the enclosing class is its implicit first end. */
@JsonPropertyOrder({"node_type", "relation_stereotype", "first_cardinality", "op_left", "relation_name", "op_right",
        "second_cardinality", "second_end", "line", "column"})
public final class InternalRelation extends RelationDef implements ClassBodyItem {

    public InternalRelation(
            String stereotype,
            Cardinality firstCardinality,
            String opLeft,
            String relationName,
            String opRight,
            Cardinality secondCardinality,
            String target,
            int line,
            int column
    ) {
        super(stereotype, firstCardinality, opLeft, relationName, opRight, secondCardinality, target, line, column);
    }

    @Override
    public String firstEnd() {
        return null;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.INTERNAL_RELATION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitInternalRelation(this);
    }
}
