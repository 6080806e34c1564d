package info.isaksson.erland.tonto.checks;

import info.isaksson.erland.tonto.ast.Attribute;
import info.isaksson.erland.tonto.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/** Attribute type resolution. */
public final class TypeReferences {

    public static final String CODE = "UNRESOLVED_TYPE";

    private TypeReferences() {}

    public static List<Violation> check(String owner, List<Attribute> attributes, SymbolTable table) {
        List<Violation> out = new ArrayList<>();
        for (Attribute a : attributes) {
            if (table.resolveType(a.typeRef).isEmpty()) {
                out.add(Violation.at(a, CODE, Severity.ERROR,
                        "Type '" + a.typeRef + "' of attribute '" + a.name + "' in '" + owner + "' could not be resolved"));
            }
        }
        return out;
    }
}
