package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Class declaration, e.g. {@code subkind Student of functional-complexes specializes Person { ... }}.
 *
 * <p>{@code stereotype} is the class stereotype spelling ({@code relator} included).
 * {@code body} is {@code null} when the declaration has no braces.</p>
 */
@JsonPropertyOrder({"node_type", "class_stereotype", "class_name", "natures", "specialization", "body", "line", "column"})
public final class ClassDef extends AstNode implements Declaration {
    @JsonProperty("class_stereotype")
    public final String stereotype;

    @JsonProperty("class_name")
    public final String name;

    public final List<String> natures;

    public final Specialization specialization;

    public final List<ClassBodyItem> body;

    public ClassDef(
            String stereotype,
            String name,
            List<String> natures,
            Specialization specialization,
            List<ClassBodyItem> body,
            int line,
            int column
    ) {
        super(line, column);
        this.stereotype = stereotype;
        this.name = name;
        this.natures = natures == null ? List.of() : List.copyOf(natures);
        this.specialization = specialization;
        this.body = body == null ? null : List.copyOf(body);
    }

    /** Parent names, empty when there is no specialization clause. */
    public List<String> parents() {
        return specialization == null ? List.of() : specialization.parents;
    }

    public List<Attribute> attributes() {
        List<Attribute> out = new ArrayList<>();
        if (body == null) return out;
        for (ClassBodyItem item : body) {
            if (item instanceof Attribute) out.add((Attribute) item);
        }
        return out;
    }

    public List<InternalRelation> internalRelations() {
        List<InternalRelation> out = new ArrayList<>();
        if (body == null) return out;
        for (ClassBodyItem item : body) {
            if (item instanceof InternalRelation) out.add((InternalRelation) item);
        }
        return out;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.CLASS_DEFINITION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitClass(this);
    }
}
