package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fields shared by internal and external relations.
 *
 * <p>Operators are kept as their source spelling ({@code --}, {@code <>--}, ...). When the relation
 * has a name, {@code opRight} is the operator after it; otherwise it is {@code null}.</p>
 */
public abstract class RelationDef extends AstNode {
    @JsonProperty("relation_stereotype")
    public final String stereotype;

    @JsonProperty("first_cardinality")
    public final Cardinality firstCardinality;

    @JsonProperty("op_left")
    public final String opLeft;

    @JsonProperty("relation_name")
    public final String relationName;

    @JsonProperty("op_right")
    public final String opRight;

    @JsonProperty("second_cardinality")
    public final Cardinality secondCardinality;

    @JsonProperty("second_end")
    public final String secondEnd;

    protected RelationDef(
            String stereotype,
            Cardinality firstCardinality,
            String opLeft,
            String relationName,
            String opRight,
            Cardinality secondCardinality,
            String secondEnd,
            int line,
            int column
    ) {
        super(line, column);
        this.stereotype = stereotype;
        this.firstCardinality = firstCardinality;
        this.opLeft = opLeft;
        this.relationName = relationName;
        this.opRight = opRight;
        this.secondCardinality = secondCardinality;
        this.secondEnd = secondEnd;
    }

    /** First end class, or {@code null} for internal relations (their owner is the first end). */
    public abstract String firstEnd();

    public boolean hasStereotype(String s) {
        return stereotype != null && stereotype.equals(s);
    }
}
