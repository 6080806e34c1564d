package info.isaksson.erland.tonto.symbols;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import info.isaksson.erland.tonto.ast.ExternalRelation;
import info.isaksson.erland.tonto.ast.InternalRelation;
import info.isaksson.erland.tonto.ast.RelationDef;

/**
 * A relation in the symbol table.
 *
 * <p>Internal relations are tagged with the class whose body declares them ({@code sourceClass});
 * external relations carry both ends themselves and have no source class.</p>
 */
@JsonPropertyOrder({"source_class"})
public final class RelationSymbol {

    public enum Kind { INTERNAL, EXTERNAL }

    @JsonProperty("source_class")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String sourceClass;

    @JsonUnwrapped
    public final RelationDef node;

    private RelationSymbol(String sourceClass, RelationDef node) {
        this.sourceClass = sourceClass;
        this.node = node;
    }

    public static RelationSymbol internal(InternalRelation node, String sourceClass) {
        if (node == null) throw new IllegalArgumentException("node must not be null");
        if (sourceClass == null) throw new IllegalArgumentException("sourceClass must not be null");
        return new RelationSymbol(sourceClass, node);
    }

    public static RelationSymbol external(ExternalRelation node) {
        if (node == null) throw new IllegalArgumentException("node must not be null");
        return new RelationSymbol(null, node);
    }

    public Kind kind() {
        return node instanceof InternalRelation ? Kind.INTERNAL : Kind.EXTERNAL;
    }

    @JsonIgnore
    public boolean isInternal() {
        return kind() == Kind.INTERNAL;
    }

    public String stereotype() {
        return node.stereotype;
    }

    public boolean hasStereotype(String s) {
        return node.hasStereotype(s);
    }

    /** Source class for internal relations, declared first end for external ones. */
    public String firstEnd() {
        return isInternal() ? sourceClass : node.firstEnd();
    }

    public String secondEnd() {
        return node.secondEnd;
    }

    public boolean involves(String className) {
        return className.equals(firstEnd()) || className.equals(secondEnd());
    }

    /** The end opposite to {@code className}, or {@code null} when the relation does not involve it. */
    public String otherEnd(String className) {
        if (className.equals(firstEnd())) return secondEnd();
        if (className.equals(secondEnd())) return firstEnd();
        return null;
    }

    /** True when the relation links {@code a} and {@code b}, in either direction. */
    public boolean connects(String a, String b) {
        return (a.equals(firstEnd()) && b.equals(secondEnd())) || (b.equals(firstEnd()) && a.equals(secondEnd()));
    }

    @Override
    public String toString() {
        String st = node.stereotype == null ? "" : "@" + node.stereotype + " ";
        return st + firstEnd() + " " + node.opLeft + " " + secondEnd();
    }
}
