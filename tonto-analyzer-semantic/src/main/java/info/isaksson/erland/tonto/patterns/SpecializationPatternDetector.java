package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.SpecializationRules;
import info.isaksson.erland.tonto.checks.Suggestion;
import info.isaksson.erland.tonto.checks.SuggestionAction;
import info.isaksson.erland.tonto.checks.TypeReferences;
import info.isaksson.erland.tonto.checks.Violation;
import info.isaksson.erland.tonto.symbols.ClassSymbol;
import info.isaksson.erland.tonto.symbols.GensetSymbol;
import info.isaksson.erland.tonto.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Shared detection for patterns made of an anchor class and two or more children of one stereotype
 * (subkinds, roles, phases).
 *
 * <p>A single child yields a standalone {@code SINGLE_SPECIALIZATION} warning and no pattern,
 * unless the child itself breaks an error-level rule (genset membership, specialization table);
 * then it forms an incomplete pattern that carries those errors. Otherwise the children are
 * matched against the gensets of the anchor and the subclass hooks decide how strict the genset
 * rules are.</p>
 */
abstract class SpecializationPatternDetector implements PatternDetector {

    static final String SINGLE_SPECIALIZATION = "SINGLE_SPECIALIZATION";
    static final String MISSING_GENSET = "MISSING_GENSET";
    static final String INCOMPLETE_GENSET_SPECIFICS = "INCOMPLETE_GENSET_SPECIFICS";

    /** Stereotypes that may anchor the pattern. */
    protected abstract Set<String> anchorStereotypes();

    /** Stereotype of the children that make up the pattern. */
    protected abstract String childStereotype();

    /** Plural noun for children in messages ("subkinds"). */
    protected abstract String childrenNoun();

    /** Whether a missing genset leaves the pattern incomplete. */
    protected abstract boolean gensetRequired();

    protected abstract Severity missingGensetSeverity();

    /** Keywords of the genset offered when none exists. */
    protected abstract boolean suggestDisjoint();

    protected abstract boolean suggestComplete();

    protected abstract String multipleGensetsCode();

    protected abstract Severity multipleGensetsSeverity();

    /** Checks {@code disjoint} (and any other keyword) on the matched genset. */
    protected abstract void checkGensetKeywords(GensetSymbol genset, List<String> specifics, PatternBuilder pattern);

    @Override
    public DetectorOutput detect(SymbolTable table) {
        List<Pattern> patterns = new ArrayList<>();
        List<PatternFinding> standalone = new ArrayList<>();
        for (ClassSymbol anchor : table.classes().values()) {
            if (!anchorStereotypes().contains(anchor.stereotype())) continue;
            List<ClassSymbol> children = table.childrenOf(anchor.name(), childStereotype());
            if (children.isEmpty()) continue;
            if (children.size() == 1) {
                ClassSymbol child = children.get(0);
                List<Violation> own = childViolations(child, table);
                if (own.stream().noneMatch(Violation::isError)) {
                    standalone.add(new PatternFinding(type(), anchor.name(), single(anchor, child)));
                    for (Violation v : own) standalone.add(new PatternFinding(type(), anchor.name(), v));
                    continue;
                }
            }
            patterns.add(buildPattern(table, anchor, children));
        }
        return new DetectorOutput(patterns, standalone);
    }

    private Violation single(ClassSymbol anchor, ClassSymbol child) {
        return Violation.at(child.definition, SINGLE_SPECIALIZATION, Severity.WARNING,
                type().label() + " for '" + anchor.name() + "' has a single " + childStereotype() + " '" + child.name()
                        + "'; a generalization needs at least two " + childrenNoun());
    }

    private Pattern buildPattern(SymbolTable table, ClassSymbol anchor, List<ClassSymbol> children) {
        List<String> names = new ArrayList<>();
        for (ClassSymbol c : children) names.add(c.name());

        PatternBuilder p = new PatternBuilder(type(), anchor);
        if (children.size() == 1) p.add(single(anchor, children.get(0)));
        GensetSymbol genset = GensetMatcher.find(table, anchor.name(), names);

        if (genset == null) {
            p.violation(anchor.definition, MISSING_GENSET, missingGensetSeverity(),
                    type().label() + " for '" + anchor.name() + "' should have a genset to formalize the generalization",
                    new Suggestion(SuggestionAction.INSERT_CODE,
                            "Add a genset to formalize the " + childStereotype() + " pattern",
                            CodeSuggestions.genset(anchor.name(), names, suggestDisjoint(), suggestComplete())));
            p.formalizationMissing(gensetRequired());
        } else {
            List<String> missing = new ArrayList<>();
            for (String n : names) {
                if (!genset.specifics().contains(n)) missing.add(n);
            }
            if (!missing.isEmpty()) {
                List<String> all = new ArrayList<>(genset.specifics());
                all.addAll(missing);
                p.violation(genset.definition, INCOMPLETE_GENSET_SPECIFICS, Severity.WARNING,
                        "Genset '" + genset.name() + "' is missing " + childrenNoun() + ": " + String.join(", ", missing),
                        new Suggestion(SuggestionAction.MODIFY_CODE,
                                "Update genset to include all " + childrenNoun(),
                                CodeSuggestions.genset(genset.name(), anchor.name(), all, genset.disjoint(), genset.complete())));
            }
            checkGensetKeywords(genset, names, p);
        }

        for (ClassSymbol child : children) {
            p.addAll(childViolations(child, table));
        }

        p.addAll(TypeReferences.check(anchor.name(), anchor.definition.attributes(), table));
        for (ClassSymbol child : children) {
            p.addAll(TypeReferences.check(child.name(), child.definition.attributes(), table));
        }

        p.element("general", anchor.name())
                .element("specifics", names)
                .element("genset", genset == null ? null : genset.name())
                .constraint("disjoint", genset != null && genset.disjoint())
                .constraint("complete", genset != null && genset.complete());
        return p.build();
    }

    /** Violations that belong to one child regardless of its siblings. */
    private List<Violation> childViolations(ClassSymbol child, SymbolTable table) {
        List<Violation> out = new ArrayList<>();
        List<GensetSymbol> memberships = table.gensetsWithSpecific(child.name());
        if (memberships.size() > 1) {
            List<String> gensetNames = new ArrayList<>();
            for (GensetSymbol g : memberships) gensetNames.add(g.name());
            out.add(Violation.at(child.definition, multipleGensetsCode(), multipleGensetsSeverity(),
                    capitalized(childStereotype()) + " '" + child.name() + "' appears in " + memberships.size()
                            + " gensets: " + String.join(", ", gensetNames)));
        }
        out.addAll(SpecializationRules.check(child, table));
        return out;
    }

    /** Genset suggestion that keeps everything of {@code genset} but the given keywords. */
    static String regenerate(GensetSymbol genset, List<String> specifics, boolean disjoint, boolean complete) {
        List<String> all = new ArrayList<>(genset.specifics());
        for (String s : specifics) {
            if (!all.contains(s)) all.add(s);
        }
        return CodeSuggestions.genset(genset.name(), genset.general(), all, disjoint, complete);
    }

    private static String capitalized(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
