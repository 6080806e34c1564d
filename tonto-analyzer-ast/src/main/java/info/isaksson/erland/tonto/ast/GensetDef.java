package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Generalization set, in block form ({@code genset G { general A specifics B, C }}) or short form
 * ({@code genset G where B, C specializes A}).
 */
@JsonPropertyOrder({"node_type", "genset_name", "disjoint", "complete", "general", "categorizer", "specifics", "line", "column"})
public final class GensetDef extends AstNode implements Declaration {
    @JsonProperty("genset_name")
    public final String name;

    public final boolean disjoint;
    public final boolean complete;
    public final String general;
    public final String categorizer;
    public final List<String> specifics;

    public GensetDef(
            String name,
            boolean disjoint,
            boolean complete,
            String general,
            String categorizer,
            List<String> specifics,
            int line,
            int column
    ) {
        super(line, column);
        this.name = name;
        this.disjoint = disjoint;
        this.complete = complete;
        this.general = general;
        this.categorizer = categorizer;
        this.specifics = specifics == null ? List.of() : List.copyOf(specifics);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.GENSET_DEFINITION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGenset(this);
    }
}
