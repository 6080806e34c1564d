package info.isaksson.erland.tonto.ast;

/** Item allowed inside a class body: an attribute or an internal relation. */
public interface ClassBodyItem {
    NodeType nodeType();

    <R> R accept(AstVisitor<R> visitor);
}
