package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Base class of all Tonto syntax tree nodes.
 *
 * <p>Nodes are immutable. {@code line} and {@code column} are the 1-based position of the node's
 * first token.</p>
 */
public abstract class AstNode {
    public final int line;
    public final int column;

    protected AstNode(int line, int column) {
        this.line = line;
        this.column = column;
    }

    @JsonProperty("node_type")
    public abstract NodeType nodeType();

    public abstract <R> R accept(AstVisitor<R> visitor);
}
