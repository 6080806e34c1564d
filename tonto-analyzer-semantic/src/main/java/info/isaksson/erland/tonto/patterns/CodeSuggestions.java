package info.isaksson.erland.tonto.patterns;

import java.util.List;

/** Single-line Tonto snippets offered as fixes. */
final class CodeSuggestions {

    private CodeSuggestions() {}

    static String gensetName(String general) {
        return general + "_Genset";
    }

    static String genset(String general, List<String> specifics, boolean disjoint, boolean complete) {
        return genset(gensetName(general), general, specifics, disjoint, complete);
    }

    /** e.g. {@code disjoint genset Person_Genset { general Person specifics Student, Employee }} */
    static String genset(String name, String general, List<String> specifics, boolean disjoint, boolean complete) {
        StringBuilder sb = new StringBuilder();
        if (disjoint) sb.append("disjoint ");
        if (complete) sb.append("complete ");
        sb.append("genset ").append(name)
                .append(" { general ").append(general)
                .append(" specifics ").append(String.join(", ", specifics))
                .append(" }");
        return sb.toString();
    }

    /** e.g. {@code @material relation Student [1..*] -- enrollment -- [1..*] University} */
    static String materialRelation(String from, String relationName, String to) {
        return "@material relation " + from + " [1..*] -- " + relationName + " -- [1..*] " + to;
    }

    /** A body item for the class that owns it, e.g. {@code @mediation [1..*] -- [1] Student}. */
    static String internalRelation(String stereotype, String target) {
        return "@" + stereotype + " [1..*] -- [1] " + target;
    }

    static String lowerFirst(String name) {
        if (name == null || name.isEmpty()) return name;
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }
}
