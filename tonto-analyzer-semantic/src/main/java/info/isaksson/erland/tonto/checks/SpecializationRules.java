package info.isaksson.erland.tonto.checks;

import info.isaksson.erland.tonto.lang.Stereotypes;
import info.isaksson.erland.tonto.symbols.ClassSymbol;
import info.isaksson.erland.tonto.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which stereotypes a class may not specialize, by the stereotype of the class itself.
 *
 * <p>Stereotypes without an entry are unrestricted. Parents that are not declared in the table
 * are not checked here.</p>
 */
public final class SpecializationRules {

    public static final String CODE = "INVALID_SPECIALIZATION";

    private static final Map<String, Set<String>> FORBIDDEN_PARENTS = buildTable();

    private SpecializationRules() {}

    public static Set<String> forbiddenParents(String childStereotype) {
        Set<String> out = FORBIDDEN_PARENTS.get(childStereotype);
        return out == null ? Set.of() : out;
    }

    public static boolean allows(String childStereotype, String parentStereotype) {
        return !forbiddenParents(childStereotype).contains(parentStereotype);
    }

    /** One ERROR per declared parent that {@code child} may not specialize. */
    public static List<Violation> check(ClassSymbol child, SymbolTable table) {
        List<Violation> out = new ArrayList<>();
        for (ClassSymbol parent : table.parentsOf(child.name())) {
            if (!allows(child.stereotype(), parent.stereotype())) {
                out.add(violation(child, parent));
            }
        }
        return out;
    }

    public static Violation violation(ClassSymbol child, ClassSymbol parent) {
        String msg = "Invalid specialization: " + child.stereotype() + " '" + child.name()
                + "' cannot specialize " + parent.stereotype() + " '" + parent.name() + "'";
        return Violation.at(child.definition, CODE, Severity.ERROR, msg);
    }

    private static Map<String, Set<String>> buildTable() {
        Map<String, Set<String>> m = new LinkedHashMap<>();
        m.put(Stereotypes.ROLE, Set.of(Stereotypes.PHASE, Stereotypes.MODE, Stereotypes.RELATOR));
        m.put(Stereotypes.PHASE, Set.of(Stereotypes.ROLE, Stereotypes.ROLE_MIXIN, Stereotypes.MODE, Stereotypes.RELATOR));
        m.put(Stereotypes.SUBKIND, Set.of(Stereotypes.ROLE, Stereotypes.PHASE, Stereotypes.ROLE_MIXIN,
                Stereotypes.PHASE_MIXIN, Stereotypes.HISTORICAL_ROLE));
        m.put(Stereotypes.KIND, Set.of(Stereotypes.KIND, Stereotypes.SUBKIND, Stereotypes.ROLE, Stereotypes.PHASE,
                Stereotypes.RELATOR, Stereotypes.MODE, Stereotypes.COLLECTIVE, Stereotypes.QUANTITY));
        m.put(Stereotypes.CATEGORY, Set.of(Stereotypes.KIND, Stereotypes.SUBKIND, Stereotypes.ROLE, Stereotypes.PHASE,
                Stereotypes.RELATOR, Stereotypes.MODE, Stereotypes.ROLE_MIXIN, Stereotypes.PHASE_MIXIN));
        return Collections.unmodifiableMap(m);
    }
}
