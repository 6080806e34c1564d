package info.isaksson.erland.tonto.lang;

/** Stereotype spellings referenced by the semantic analysis. */
public final class Stereotypes {
    private Stereotypes() {}

    public static final String KIND = "kind";
    public static final String SUBKIND = "subkind";
    public static final String ROLE = "role";
    public static final String PHASE = "phase";
    public static final String CATEGORY = "category";
    public static final String ROLE_MIXIN = "roleMixin";
    public static final String PHASE_MIXIN = "phaseMixin";
    public static final String HISTORICAL_ROLE = "historicalRole";
    public static final String RELATOR = "relator";
    public static final String MODE = "mode";
    public static final String COLLECTIVE = "collective";
    public static final String QUANTITY = "quantity";

    public static final String MEDIATION = "mediation";
    public static final String MATERIAL = "material";
    public static final String CHARACTERIZATION = "characterization";
    public static final String EXTERNAL_DEPENDENCE = "externalDependence";
}
