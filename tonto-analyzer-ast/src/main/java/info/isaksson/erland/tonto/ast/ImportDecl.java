package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"node_type", "module_name", "line", "column"})
public final class ImportDecl extends AstNode {
    @JsonProperty("module_name")
    public final String moduleName;

    public ImportDecl(String moduleName, int line, int column) {
        super(line, column);
        this.moduleName = moduleName;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.IMPORT_STATEMENT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitImport(this);
    }
}
