package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"node_type", "package_name", "line", "column"})
public final class PackageDecl extends AstNode {
    @JsonProperty("package_name")
    public final String packageName;

    public PackageDecl(String packageName, int line, int column) {
        super(line, column);
        this.packageName = packageName;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.PACKAGE_DECLARATION;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPackage(this);
    }
}
