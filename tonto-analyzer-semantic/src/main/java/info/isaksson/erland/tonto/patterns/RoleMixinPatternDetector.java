package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.SpecializationRules;
import info.isaksson.erland.tonto.checks.Suggestion;
import info.isaksson.erland.tonto.checks.SuggestionAction;
import info.isaksson.erland.tonto.lang.Stereotypes;
import info.isaksson.erland.tonto.symbols.ClassSymbol;
import info.isaksson.erland.tonto.symbols.GensetSymbol;
import info.isaksson.erland.tonto.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/**
 * A roleMixin generalizing roles of different kinds through a genset.
 *
 * <p>The genset is mandatory, its specifics must be roles or roleMixins, and it should not be
 * disjoint. A roleMixin may only specialize roleMixins, and only roles and roleMixins may
 * specialize it.</p>
 */
public final class RoleMixinPatternDetector implements PatternDetector {

    public static final String MISSING_GENSET = SpecializationPatternDetector.MISSING_GENSET;
    public static final String INVALID_GENSET_SPECIFIC = "INVALID_GENSET_SPECIFIC";
    public static final String DISJOINT_ROLEMIXIN_GENSET = "DISJOINT_ROLEMIXIN_GENSET";

    @Override
    public PatternType type() {
        return PatternType.ROLE_MIXIN;
    }

    @Override
    public DetectorOutput detect(SymbolTable table) {
        List<Pattern> out = new ArrayList<>();
        for (ClassSymbol mixin : table.classesByStereotype(Stereotypes.ROLE_MIXIN)) {
            out.add(detectOne(table, mixin));
        }
        return new DetectorOutput(out, List.of());
    }

    private Pattern detectOne(SymbolTable table, ClassSymbol mixin) {
        PatternBuilder p = new PatternBuilder(type(), mixin);
        String name = mixin.name();

        for (ClassSymbol parent : table.parentsOf(name)) {
            if (!parent.hasStereotype(Stereotypes.ROLE_MIXIN)) {
                p.add(SpecializationRules.violation(mixin, parent));
            }
        }

        List<String> roles = new ArrayList<>();
        for (ClassSymbol child : table.childrenOf(name)) {
            if (isRoleLike(child)) {
                roles.add(child.name());
            } else {
                p.add(SpecializationRules.violation(child, mixin));
            }
        }

        GensetSymbol genset = roles.isEmpty() ? null : GensetMatcher.find(table, name, roles);
        if (genset == null) {
            List<GensetSymbol> own = table.gensetsWithGeneral(name);
            if (!own.isEmpty()) genset = own.get(0);
        }

        if (genset == null) {
            List<String> specifics = roles.isEmpty() ? List.of("RoleA", "RoleB") : roles;
            p.violation(mixin.definition, MISSING_GENSET, Severity.ERROR,
                    type().label() + " for '" + name + "' requires a genset with '" + name + "' as general",
                    new Suggestion(SuggestionAction.INSERT_CODE,
                            "Add a genset to formalize the roleMixin pattern",
                            CodeSuggestions.genset(name, specifics, false, false)));
            p.formalizationMissing(true);
        } else {
            for (String specific : genset.specifics()) {
                ClassSymbol c = table.findClass(specific).orElse(null);
                if (c != null && !isRoleLike(c)) {
                    p.violation(genset.definition, INVALID_GENSET_SPECIFIC, Severity.ERROR,
                            "Genset '" + genset.name() + "' of roleMixin '" + name + "' has specific " + c.stereotype()
                                    + " '" + specific + "'; only roles and roleMixins are allowed");
                }
            }
            if (genset.disjoint()) {
                p.violation(genset.definition, DISJOINT_ROLEMIXIN_GENSET, Severity.WARNING,
                        type().label() + " genset '" + genset.name() + "' should not be 'disjoint'",
                        new Suggestion(SuggestionAction.REMOVE_KEYWORD, "Remove 'disjoint' keyword from genset",
                                CodeSuggestions.genset(genset.name(), name, genset.specifics(), false, genset.complete())));
            }
        }

        p.element("general", name)
                .element("specifics", roles)
                .element("genset", genset == null ? null : genset.name())
                .constraint("disjoint", genset != null && genset.disjoint())
                .constraint("complete", genset != null && genset.complete());
        return p.build();
    }

    private static boolean isRoleLike(ClassSymbol c) {
        return c.hasStereotype(Stereotypes.ROLE) || c.hasStereotype(Stereotypes.ROLE_MIXIN);
    }
}
