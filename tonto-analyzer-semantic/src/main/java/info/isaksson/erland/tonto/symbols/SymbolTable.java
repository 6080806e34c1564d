package info.isaksson.erland.tonto.symbols;

import info.isaksson.erland.tonto.ast.AstNode;
import info.isaksson.erland.tonto.ast.ClassDef;
import info.isaksson.erland.tonto.ast.DatatypeDef;
import info.isaksson.erland.tonto.ast.EnumDef;
import info.isaksson.erland.tonto.ast.ExternalRelation;
import info.isaksson.erland.tonto.ast.GensetDef;
import info.isaksson.erland.tonto.ast.InternalRelation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declarations of one Tonto file, keyed by name in declaration order.
 *
 * <p>Entries refer to each other by name only. A second declaration with a name already taken in
 * the same namespace replaces the first and is recorded in {@link #conflicts()}.</p>
 */
public final class SymbolTable {

    public static final String CLASS = "class";
    public static final String GENSET = "genset";
    public static final String DATATYPE = "datatype";
    public static final String ENUM = "enum";

    private final Map<String, ClassSymbol> classes = new LinkedHashMap<>();
    private final Map<String, GensetSymbol> gensets = new LinkedHashMap<>();
    private final Map<String, DatatypeSymbol> datatypes = new LinkedHashMap<>();
    private final Map<String, EnumSymbol> enums = new LinkedHashMap<>();
    private final List<RelationSymbol> relations = new ArrayList<>();
    private final List<DeclarationConflict> conflicts = new ArrayList<>();

    public SymbolTable() {}

    // ------------------------------------------------------------------ registration

    public ClassSymbol addClass(ClassDef def) {
        ClassSymbol sym = new ClassSymbol(def);
        ClassSymbol prev = classes.remove(def.name);
        if (prev != null) conflict(CLASS, def.name, prev.definition, def);
        classes.put(def.name, sym);
        return sym;
    }

    public RelationSymbol addRelation(InternalRelation def, String sourceClass) {
        RelationSymbol sym = RelationSymbol.internal(def, sourceClass);
        relations.add(sym);
        return sym;
    }

    public RelationSymbol addRelation(ExternalRelation def) {
        RelationSymbol sym = RelationSymbol.external(def);
        relations.add(sym);
        return sym;
    }

    public GensetSymbol addGenset(GensetDef def) {
        GensetSymbol sym = new GensetSymbol(def);
        GensetSymbol prev = gensets.remove(def.name);
        if (prev != null) conflict(GENSET, def.name, prev.definition, def);
        gensets.put(def.name, sym);
        return sym;
    }

    public DatatypeSymbol addDatatype(DatatypeDef def) {
        DatatypeSymbol sym = new DatatypeSymbol(def);
        DatatypeSymbol prev = datatypes.remove(def.name);
        if (prev != null) conflict(DATATYPE, def.name, prev.definition, def);
        datatypes.put(def.name, sym);
        return sym;
    }

    public EnumSymbol addEnum(EnumDef def) {
        EnumSymbol sym = new EnumSymbol(def);
        EnumSymbol prev = enums.remove(def.name);
        if (prev != null) conflict(ENUM, def.name, prev.definition, def);
        enums.put(def.name, sym);
        return sym;
    }

    private void conflict(String namespace, String name, AstNode first, AstNode later) {
        conflicts.add(new DeclarationConflict(namespace, name, first.line, later.line, later.column));
    }

    // ------------------------------------------------------------------ views

    public Map<String, ClassSymbol> classes() {
        return Collections.unmodifiableMap(classes);
    }

    public Map<String, GensetSymbol> gensets() {
        return Collections.unmodifiableMap(gensets);
    }

    public Map<String, DatatypeSymbol> datatypes() {
        return Collections.unmodifiableMap(datatypes);
    }

    public Map<String, EnumSymbol> enums() {
        return Collections.unmodifiableMap(enums);
    }

    public List<RelationSymbol> relations() {
        return Collections.unmodifiableList(relations);
    }

    public List<DeclarationConflict> conflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    public static Map<String, PrimitiveType> primitives() {
        return PrimitiveType.all();
    }

    // ------------------------------------------------------------------ queries

    public Optional<ClassSymbol> findClass(String name) {
        return Optional.ofNullable(classes.get(name));
    }

    public boolean isClass(String name) {
        return classes.containsKey(name);
    }

    public List<ClassSymbol> classesByStereotype(String stereotype) {
        List<ClassSymbol> out = new ArrayList<>();
        for (ClassSymbol c : classes.values()) {
            if (c.hasStereotype(stereotype)) out.add(c);
        }
        return out;
    }

    /** Classes that list {@code name} among their parents, in declaration order. */
    public List<ClassSymbol> childrenOf(String name) {
        return childrenOf(name, null);
    }

    /** Like {@link #childrenOf(String)}, restricted to one stereotype when {@code stereotype} is non-null. */
    public List<ClassSymbol> childrenOf(String name, String stereotype) {
        List<ClassSymbol> out = new ArrayList<>();
        for (ClassSymbol c : classes.values()) {
            if (!c.parents().contains(name)) continue;
            if (stereotype != null && !c.hasStereotype(stereotype)) continue;
            out.add(c);
        }
        return out;
    }

    /** Declared parents of {@code name}. Parents that are not declared here are skipped. */
    public List<ClassSymbol> parentsOf(String name) {
        ClassSymbol c = classes.get(name);
        if (c == null) return List.of();
        List<ClassSymbol> out = new ArrayList<>();
        for (String p : c.parents()) {
            ClassSymbol parent = classes.get(p);
            if (parent != null) out.add(parent);
        }
        return out;
    }

    public List<GensetSymbol> gensetsWithGeneral(String name) {
        List<GensetSymbol> out = new ArrayList<>();
        for (GensetSymbol g : gensets.values()) {
            if (name.equals(g.general())) out.add(g);
        }
        return out;
    }

    public List<GensetSymbol> gensetsWithSpecific(String name) {
        List<GensetSymbol> out = new ArrayList<>();
        for (GensetSymbol g : gensets.values()) {
            if (g.specifics().contains(name)) out.add(g);
        }
        return out;
    }

    /** Relations whose source class, first end or second end is {@code name}. */
    public List<RelationSymbol> relationsInvolving(String name) {
        List<RelationSymbol> out = new ArrayList<>();
        for (RelationSymbol r : relations) {
            if (r.involves(name)) out.add(r);
        }
        return out;
    }

    public List<RelationSymbol> internalRelationsOf(String name) {
        List<RelationSymbol> out = new ArrayList<>();
        for (RelationSymbol r : relations) {
            if (r.isInternal() && name.equals(r.sourceClass)) out.add(r);
        }
        return out;
    }

    public List<RelationSymbol> relationsByStereotype(String stereotype) {
        List<RelationSymbol> out = new ArrayList<>();
        for (RelationSymbol r : relations) {
            if (r.hasStereotype(stereotype)) out.add(r);
        }
        return out;
    }

    /** Resolves a type name: primitives first, then classes, datatypes and enums. */
    public Optional<TypeSymbol> resolveType(String name) {
        if (name == null) return Optional.empty();
        TypeSymbol t = PrimitiveType.all().get(name);
        if (t == null) t = classes.get(name);
        if (t == null) t = datatypes.get(name);
        if (t == null) t = enums.get(name);
        return Optional.ofNullable(t);
    }

    @Override
    public String toString() {
        return "SymbolTable{classes=" + classes.size() + ", relations=" + relations.size()
                + ", gensets=" + gensets.size() + ", datatypes=" + datatypes.size() + ", enums=" + enums.size() + "}";
    }
}
