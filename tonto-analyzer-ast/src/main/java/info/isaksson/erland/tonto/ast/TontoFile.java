package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Root node: imports, the package declaration and the package content. */
@JsonPropertyOrder({"node_type", "imports", "package", "content", "line", "column"})
public final class TontoFile extends AstNode {
    public final List<ImportDecl> imports;

    /** Null when the source has no (parsable) package declaration. */
    @JsonProperty("package")
    public final PackageDecl packageDecl;

    public final List<Declaration> content;

    public TontoFile(List<ImportDecl> imports, PackageDecl packageDecl, List<Declaration> content, int line, int column) {
        super(line, column);
        this.imports = imports == null ? List.of() : List.copyOf(imports);
        this.packageDecl = packageDecl;
        this.content = content == null ? List.of() : List.copyOf(content);
    }

    /** Package name, or {@code null} when absent. */
    public String packageName() {
        return packageDecl == null ? null : packageDecl.packageName;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.TONTO_FILE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFile(this);
    }
}
