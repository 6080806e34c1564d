package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.Suggestion;
import info.isaksson.erland.tonto.checks.SuggestionAction;
import info.isaksson.erland.tonto.lang.Stereotypes;
import info.isaksson.erland.tonto.symbols.ClassSymbol;
import info.isaksson.erland.tonto.symbols.RelationSymbol;
import info.isaksson.erland.tonto.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/**
 * A relator mediating at least two classes, with a material relation between each pair of them.
 *
 * <p>Mediations are {@code @mediation} relations declared in the relator body, plus external
 * {@code @mediation} relations with the relator at either end.</p>
 */
public final class RelatorPatternDetector implements PatternDetector {

    public static final String RELATION_TARGET_NOT_FOUND = "RELATION_TARGET_NOT_FOUND";
    public static final String INSUFFICIENT_MEDIATIONS = "INSUFFICIENT_MEDIATIONS";
    public static final String MISSING_MATERIAL_RELATION = "MISSING_MATERIAL_RELATION";

    static final int MIN_MEDIATIONS = 2;

    @Override
    public PatternType type() {
        return PatternType.RELATOR;
    }

    @Override
    public DetectorOutput detect(SymbolTable table) {
        List<Pattern> out = new ArrayList<>();
        for (ClassSymbol relator : table.classesByStereotype(Stereotypes.RELATOR)) {
            out.add(detectOne(table, relator));
        }
        return new DetectorOutput(out, List.of());
    }

    private Pattern detectOne(SymbolTable table, ClassSymbol relator) {
        PatternBuilder p = new PatternBuilder(type(), relator);
        String name = relator.name();

        List<String> mediated = new ArrayList<>();
        for (RelationSymbol r : table.relationsInvolving(name)) {
            if (!r.hasStereotype(Stereotypes.MEDIATION)) continue;
            String target = r.otherEnd(name);
            if (target == null || target.equals(name)) continue;
            if (!table.isClass(target)) {
                p.violation(r.node, RELATION_TARGET_NOT_FOUND, Severity.ERROR,
                        "Mediation of relator '" + name + "' targets undeclared class '" + target + "'");
                continue;
            }
            if (!mediated.contains(target)) mediated.add(target);
        }

        if (mediated.size() < MIN_MEDIATIONS) {
            p.violation(relator.definition, INSUFFICIENT_MEDIATIONS, Severity.ERROR,
                    "Relator '" + name + "' must mediate at least " + MIN_MEDIATIONS
                            + " distinct classes (found " + mediated.size() + ")",
                    new Suggestion(SuggestionAction.INSERT_CODE,
                            "Add a @mediation relation to the body of '" + name + "'",
                            CodeSuggestions.internalRelation(Stereotypes.MEDIATION, "Participant")));
        }

        List<String> materials = new ArrayList<>();
        for (int i = 0; i < mediated.size(); i++) {
            for (int j = i + 1; j < mediated.size(); j++) {
                String a = mediated.get(i);
                String b = mediated.get(j);
                if (hasMaterialRelation(table, a, b)) {
                    materials.add(a + " -- " + b);
                    continue;
                }
                p.violation(relator.definition, MISSING_MATERIAL_RELATION, Severity.WARNING,
                        "Relator '" + name + "' mediates '" + a + "' and '" + b
                                + "' but no @material relation connects them",
                        new Suggestion(SuggestionAction.INSERT_CODE,
                                "Add a material relation derived from '" + name + "'",
                                CodeSuggestions.materialRelation(a, CodeSuggestions.lowerFirst(name), b)));
            }
        }

        p.element("relator", name)
                .element("mediated", mediated)
                .element("material_relations", materials)
                .constraint("has_min_mediations", mediated.size() >= MIN_MEDIATIONS)
                .constraint("has_material_relations", mediated.size() >= MIN_MEDIATIONS
                        && materials.size() == mediated.size() * (mediated.size() - 1) / 2);
        return p.build();
    }

    private static boolean hasMaterialRelation(SymbolTable table, String a, String b) {
        for (RelationSymbol r : table.relationsByStereotype(Stereotypes.MATERIAL)) {
            if (!r.isInternal() && r.connects(a, b)) return true;
        }
        return false;
    }
}
