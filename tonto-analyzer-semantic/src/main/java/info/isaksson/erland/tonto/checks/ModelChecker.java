package info.isaksson.erland.tonto.checks;

import info.isaksson.erland.tonto.ast.AstScanner;
import info.isaksson.erland.tonto.ast.Cardinality;
import info.isaksson.erland.tonto.ast.DatatypeDef;
import info.isaksson.erland.tonto.ast.TontoFile;
import info.isaksson.erland.tonto.symbols.ClassSymbol;
import info.isaksson.erland.tonto.symbols.DatatypeSymbol;
import info.isaksson.erland.tonto.symbols.DeclarationConflict;
import info.isaksson.erland.tonto.symbols.GensetSymbol;
import info.isaksson.erland.tonto.symbols.SymbolTable;

import java.util.List;

/**
 * Model-level checks that do not belong to a single pattern.
 *
 * <p>Codes:</p>
 * <ul>
 *   <li>{@code DUPLICATE_DECLARATION} (error)</li>
 *   <li>{@code INVALID_CARDINALITY} (error)</li>
 *   <li>{@code UNDEFINED_GENSET_CLASS} (error)</li>
 *   <li>{@code SPECIFIC_NOT_SPECIALIZING_GENERAL} (warning)</li>
 *   <li>{@code SINGLE_SPECIFIC_GENSET} (warning)</li>
 *   <li>{@code UNRESOLVED_TYPE} (error)</li>
 *   <li>{@code INVALID_SPECIALIZATION} (error)</li>
 *   <li>{@code UNDEFINED_PARENT} (warning)</li>
 * </ul>
 */
public final class ModelChecker {

    public static final String DUPLICATE_DECLARATION = "DUPLICATE_DECLARATION";
    public static final String INVALID_CARDINALITY = "INVALID_CARDINALITY";
    public static final String UNDEFINED_GENSET_CLASS = "UNDEFINED_GENSET_CLASS";
    public static final String SPECIFIC_NOT_SPECIALIZING_GENERAL = "SPECIFIC_NOT_SPECIALIZING_GENERAL";
    public static final String SINGLE_SPECIFIC_GENSET = "SINGLE_SPECIFIC_GENSET";
    public static final String UNDEFINED_PARENT = "UNDEFINED_PARENT";

    public ModelChecker() {}

    public List<Violation> check(SymbolTable table, TontoFile file) {
        if (table == null) throw new IllegalArgumentException("table must not be null");
        ModelIssues issues = new ModelIssues();

        for (DeclarationConflict c : table.conflicts()) {
            issues.add(new Violation(DUPLICATE_DECLARATION, Severity.ERROR,
                    "Duplicate " + c.namespace + " '" + c.name + "' (first declared at line " + c.firstLine + ")",
                    c.line, c.column, null));
        }

        if (file != null) {
            new AstScanner() {
                @Override
                public Void visitCardinality(Cardinality node) {
                    if (!node.isWellFormed()) {
                        String why = node.min.isMany()
                                ? "lower bound '*' requires upper bound '*'"
                                : "lower bound exceeds upper bound";
                        issues.error(node, INVALID_CARDINALITY, "Invalid cardinality " + node + ": " + why);
                    }
                    return null;
                }
            }.scan(file);
        }

        for (GensetSymbol g : table.gensets().values()) {
            checkGenset(g, table, issues);
        }

        for (ClassSymbol c : table.classes().values()) {
            for (String parent : c.parents()) {
                if (!table.isClass(parent)) {
                    issues.warn(c.definition, UNDEFINED_PARENT,
                            "Class '" + c.name() + "' specializes '" + parent + "', which is not declared in this file");
                }
            }
            SpecializationRules.check(c, table).forEach(issues::add);
            TypeReferences.check(c.name(), c.definition.attributes(), table).forEach(issues::add);
        }

        for (DatatypeSymbol d : table.datatypes().values()) {
            DatatypeDef def = d.definition;
            if (def.specialization != null) {
                for (String parent : def.specialization.parents) {
                    if (table.resolveType(parent).isEmpty()) {
                        issues.warn(def, UNDEFINED_PARENT,
                                "Datatype '" + def.name + "' specializes '" + parent + "', which is not declared in this file");
                    }
                }
            }
            TypeReferences.check(def.name, def.body, table).forEach(issues::add);
        }

        return issues.toDeterministicList();
    }

    private static void checkGenset(GensetSymbol g, SymbolTable table, ModelIssues issues) {
        if (!table.isClass(g.general())) {
            issues.error(g.definition, UNDEFINED_GENSET_CLASS,
                    "Genset '" + g.name() + "' refers to undeclared general class '" + g.general() + "'");
        }
        for (String specific : g.specifics()) {
            ClassSymbol c = table.findClass(specific).orElse(null);
            if (c == null) {
                issues.error(g.definition, UNDEFINED_GENSET_CLASS,
                        "Genset '" + g.name() + "' refers to undeclared specific class '" + specific + "'");
            } else if (!c.parents().contains(g.general())) {
                issues.warn(g.definition, SPECIFIC_NOT_SPECIALIZING_GENERAL,
                        "Class '" + specific + "' is a specific of genset '" + g.name()
                                + "' but does not specialize '" + g.general() + "'");
            }
        }
        if (g.specifics().size() == 1) {
            issues.warn(g.definition, SINGLE_SPECIFIC_GENSET,
                    "Genset '" + g.name() + "' has a single specific; a generalization set needs at least two");
        }
    }
}
