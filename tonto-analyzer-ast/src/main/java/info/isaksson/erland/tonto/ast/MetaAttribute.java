package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** {@code ordered}, {@code const}, {@code derived}, or {@code subsets}/{@code redefines} with an optional target. */
@JsonPropertyOrder({"node_type", "name", "target", "line", "column"})
public final class MetaAttribute extends AstNode {
    public final String name;
    public final String target;

    public MetaAttribute(String name, String target, int line, int column) {
        super(line, column);
        this.name = name;
        this.target = target;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.META_ATTRIBUTE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitMetaAttribute(this);
    }
}
