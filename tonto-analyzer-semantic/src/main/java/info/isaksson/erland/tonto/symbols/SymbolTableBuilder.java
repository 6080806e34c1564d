package info.isaksson.erland.tonto.symbols;

import info.isaksson.erland.tonto.ast.AstScanner;
import info.isaksson.erland.tonto.ast.ClassDef;
import info.isaksson.erland.tonto.ast.DatatypeDef;
import info.isaksson.erland.tonto.ast.Declaration;
import info.isaksson.erland.tonto.ast.EnumDef;
import info.isaksson.erland.tonto.ast.ExternalRelation;
import info.isaksson.erland.tonto.ast.GensetDef;
import info.isaksson.erland.tonto.ast.InternalRelation;
import info.isaksson.erland.tonto.ast.TontoFile;

/**
 * Registers the top-level declarations of a file in a {@link SymbolTable}.
 *
 * <p>One pass over {@code file.content}. Internal relations are registered together with the
 * class whose body holds them.</p>
 */
public final class SymbolTableBuilder extends AstScanner {

    private final SymbolTable table;

    private SymbolTableBuilder(SymbolTable table) {
        this.table = table;
    }

    public static SymbolTable build(TontoFile file) {
        SymbolTable table = new SymbolTable();
        populate(table, file);
        return table;
    }

    public static void populate(SymbolTable table, TontoFile file) {
        if (table == null) throw new IllegalArgumentException("table must not be null");
        if (file == null) throw new IllegalArgumentException("file must not be null");
        SymbolTableBuilder b = new SymbolTableBuilder(table);
        for (Declaration d : file.content) {
            d.accept(b);
        }
    }

    @Override
    public Void visitClass(ClassDef node) {
        table.addClass(node);
        for (InternalRelation r : node.internalRelations()) {
            table.addRelation(r, node.name);
        }
        return null;
    }

    @Override
    public Void visitExternalRelation(ExternalRelation node) {
        table.addRelation(node);
        return null;
    }

    @Override
    public Void visitGenset(GensetDef node) {
        table.addGenset(node);
        return null;
    }

    @Override
    public Void visitDatatype(DatatypeDef node) {
        table.addDatatype(node);
        return null;
    }

    @Override
    public Void visitEnum(EnumDef node) {
        table.addEnum(node);
        return null;
    }
}
