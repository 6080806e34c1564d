package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** {@code specializes A, B} clause. */
@JsonPropertyOrder({"node_type", "parents", "line", "column"})
public final class Specialization extends AstNode {
    public final List<String> parents;

    public Specialization(List<String> parents, int line, int column) {
        super(line, column);
        this.parents = parents == null ? List.of() : List.copyOf(parents);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.SPECIALIZATION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSpecialization(this);
    }
}
