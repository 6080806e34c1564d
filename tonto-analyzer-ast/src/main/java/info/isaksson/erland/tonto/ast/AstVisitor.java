package info.isaksson.erland.tonto.ast;

/**
 * Visitor over the closed set of node classes.
 *
 * <p>Adding a node class adds a method here, so every visitor must handle it.</p>
 */
public interface AstVisitor<R> {
    R visitFile(TontoFile node);

    R visitImport(ImportDecl node);

    R visitPackage(PackageDecl node);

    R visitClass(ClassDef node);

    R visitSpecialization(Specialization node);

    R visitAttribute(Attribute node);

    R visitMetaAttribute(MetaAttribute node);

    R visitCardinality(Cardinality node);

    R visitInternalRelation(InternalRelation node);

    R visitExternalRelation(ExternalRelation node);

    R visitGenset(GensetDef node);

    R visitDatatype(DatatypeDef node);

    R visitEnum(EnumDef node);
}
