package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.symbols.GensetSymbol;
import info.isaksson.erland.tonto.symbols.SymbolTable;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Picks the genset that formalizes a specialization: among gensets with the given general, the
 * first whose specifics equal the detected children, else the first that shares at least one.
 */
final class GensetMatcher {

    private GensetMatcher() {}

    static GensetSymbol find(SymbolTable table, String general, Collection<String> children) {
        Set<String> wanted = new HashSet<>(children);
        GensetSymbol overlap = null;
        for (GensetSymbol g : table.gensetsWithGeneral(general)) {
            Set<String> specifics = new HashSet<>(g.specifics());
            if (specifics.equals(wanted)) return g;
            if (overlap == null) {
                for (String s : specifics) {
                    if (wanted.contains(s)) {
                        overlap = g;
                        break;
                    }
                }
            }
        }
        return overlap;
    }
}
