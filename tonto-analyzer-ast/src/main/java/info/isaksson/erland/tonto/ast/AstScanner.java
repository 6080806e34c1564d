package info.isaksson.erland.tonto.ast;

/**
 * Visitor that walks the whole tree depth-first in source order.
 *
 * <p>Subclasses override the callbacks they care about and call {@code super} to keep descending.</p>
 */
public class AstScanner implements AstVisitor<Void> {

    public void scan(AstNode node) {
        if (node == null) return;
        node.accept(this);
    }

    @Override
    public Void visitFile(TontoFile node) {
        for (ImportDecl i : node.imports) scan(i);
        scan(node.packageDecl);
        for (Declaration d : node.content) d.accept(this);
        return null;
    }

    @Override
    public Void visitImport(ImportDecl node) {
        return null;
    }

    @Override
    public Void visitPackage(PackageDecl node) {
        return null;
    }

    @Override
    public Void visitClass(ClassDef node) {
        scan(node.specialization);
        if (node.body != null) {
            for (ClassBodyItem item : node.body) item.accept(this);
        }
        return null;
    }

    @Override
    public Void visitSpecialization(Specialization node) {
        return null;
    }

    @Override
    public Void visitAttribute(Attribute node) {
        scan(node.cardinality);
        for (MetaAttribute m : node.metaAttributes) scan(m);
        return null;
    }

    @Override
    public Void visitMetaAttribute(MetaAttribute node) {
        return null;
    }

    @Override
    public Void visitCardinality(Cardinality node) {
        return null;
    }

    @Override
    public Void visitInternalRelation(InternalRelation node) {
        scan(node.firstCardinality);
        scan(node.secondCardinality);
        return null;
    }

    @Override
    public Void visitExternalRelation(ExternalRelation node) {
        scan(node.firstCardinality);
        scan(node.secondCardinality);
        return null;
    }

    @Override
    public Void visitGenset(GensetDef node) {
        return null;
    }

    @Override
    public Void visitDatatype(DatatypeDef node) {
        scan(node.specialization);
        for (Attribute a : node.body) scan(a);
        return null;
    }

    @Override
    public Void visitEnum(EnumDef node) {
        scan(node.specialization);
        return null;
    }
}
