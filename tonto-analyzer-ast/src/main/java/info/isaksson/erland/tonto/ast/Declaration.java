package info.isaksson.erland.tonto.ast;

/** Top-level content of a Tonto file (everything after the package declaration). */
public interface Declaration {
    NodeType nodeType();

    <R> R accept(AstVisitor<R> visitor);
}
