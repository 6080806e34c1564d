package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.Suggestion;
import info.isaksson.erland.tonto.checks.SuggestionAction;
import info.isaksson.erland.tonto.lang.Stereotypes;
import info.isaksson.erland.tonto.symbols.ClassSymbol;
import info.isaksson.erland.tonto.symbols.GensetSymbol;
import info.isaksson.erland.tonto.symbols.RelationSymbol;
import info.isaksson.erland.tonto.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/** A mode characterizing its bearer and externally depending on another class. */
public final class ModePatternDetector implements PatternDetector {

    public static final String MODE_WITHOUT_CHARACTERIZATION = "MODE_WITHOUT_CHARACTERIZATION";
    public static final String MODE_WITHOUT_EXTERNAL_DEPENDENCE = "MODE_WITHOUT_EXTERNAL_DEPENDENCE";
    public static final String RELATION_TARGET_NOT_FOUND = RelatorPatternDetector.RELATION_TARGET_NOT_FOUND;
    public static final String MODE_IN_GENSET = "MODE_IN_GENSET";

    @Override
    public PatternType type() {
        return PatternType.MODE;
    }

    @Override
    public DetectorOutput detect(SymbolTable table) {
        List<Pattern> out = new ArrayList<>();
        for (ClassSymbol mode : table.classesByStereotype(Stereotypes.MODE)) {
            out.add(detectOne(table, mode));
        }
        return new DetectorOutput(out, List.of());
    }

    private Pattern detectOne(SymbolTable table, ClassSymbol mode) {
        PatternBuilder p = new PatternBuilder(type(), mode);
        String name = mode.name();

        List<String> bearers = targets(table, mode, Stereotypes.CHARACTERIZATION, p);
        List<String> dependees = targets(table, mode, Stereotypes.EXTERNAL_DEPENDENCE, p);

        if (!hasRelation(table, name, Stereotypes.CHARACTERIZATION)) {
            p.violation(mode.definition, MODE_WITHOUT_CHARACTERIZATION, Severity.ERROR,
                    "Mode '" + name + "' must characterize its bearer through a @characterization relation",
                    new Suggestion(SuggestionAction.INSERT_CODE,
                            "Add a @characterization relation to the body of '" + name + "'",
                            CodeSuggestions.internalRelation(Stereotypes.CHARACTERIZATION, "Bearer")));
        }
        if (!hasRelation(table, name, Stereotypes.EXTERNAL_DEPENDENCE)) {
            p.violation(mode.definition, MODE_WITHOUT_EXTERNAL_DEPENDENCE, Severity.ERROR,
                    "Mode '" + name + "' must depend on another class through an @externalDependence relation",
                    new Suggestion(SuggestionAction.INSERT_CODE,
                            "Add an @externalDependence relation to the body of '" + name + "'",
                            CodeSuggestions.internalRelation(Stereotypes.EXTERNAL_DEPENDENCE, "Dependee")));
        }

        for (GensetSymbol g : table.gensetsWithGeneral(name)) {
            p.violation(g.definition, MODE_IN_GENSET, Severity.ERROR,
                    "Mode '" + name + "' cannot be the general of genset '" + g.name() + "'");
        }
        for (GensetSymbol g : table.gensetsWithSpecific(name)) {
            p.violation(g.definition, MODE_IN_GENSET, Severity.ERROR,
                    "Mode '" + name + "' cannot be a specific of genset '" + g.name() + "'");
        }

        p.element("mode", name)
                .element("characterizes", bearers)
                .element("depends_on", dependees)
                .constraint("has_characterization", !bearers.isEmpty())
                .constraint("has_external_dependence", !dependees.isEmpty());
        return p.build();
    }

    private static boolean hasRelation(SymbolTable table, String mode, String stereotype) {
        for (RelationSymbol r : table.relationsInvolving(mode)) {
            if (r.hasStereotype(stereotype)) return true;
        }
        return false;
    }

    /** Declared classes at the other end of {@code stereotype} relations; undeclared ones are reported. */
    private static List<String> targets(SymbolTable table, ClassSymbol mode, String stereotype, PatternBuilder p) {
        List<String> out = new ArrayList<>();
        for (RelationSymbol r : table.relationsInvolving(mode.name())) {
            if (!r.hasStereotype(stereotype)) continue;
            String target = r.otherEnd(mode.name());
            if (target == null) continue;
            if (!table.isClass(target)) {
                p.violation(r.node, RELATION_TARGET_NOT_FOUND, Severity.ERROR,
                        "@" + stereotype + " of mode '" + mode.name() + "' targets undeclared class '" + target + "'");
            } else if (!out.contains(target)) {
                out.add(target);
            }
        }
        return out;
    }
}
