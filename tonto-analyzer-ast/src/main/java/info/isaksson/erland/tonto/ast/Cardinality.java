package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** {@code [min..max]}; a single bound {@code [n]} has {@code min == max}. */
@JsonPropertyOrder({"node_type", "min", "max", "line", "column"})
public final class Cardinality extends AstNode {
    public final CardinalityBound min;
    public final CardinalityBound max;

    public Cardinality(CardinalityBound min, CardinalityBound max, int line, int column) {
        super(line, column);
        this.min = min;
        this.max = max == null ? min : max;
    }

    /** A range is well formed unless min is {@code *} with a numeric max, or min exceeds max. */
    @JsonIgnore
    public boolean isWellFormed() {
        if (min.isMany()) return max.isMany();
        if (max.isMany()) return true;
        return min.value() <= max.value();
    }

    @Override
    public NodeType nodeType() {
        return NodeType.CARDINALITY;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCardinality(this);
    }

    @Override
    public String toString() {
        if (min.equals(max)) return "[" + min + "]";
        return "[" + min + ".." + max + "]";
    }
}
