package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonValue;

/** Tag of every AST node kind, serialized as its snake_case label. */
public enum NodeType {
    TONTO_FILE("tonto_file"),
    IMPORT_STATEMENT("import_statement"),
    PACKAGE_DECLARATION("package_declaration"),
    CLASS_DEFINITION("class_definition"),
    SPECIALIZATION("specialization"),
    ATTRIBUTE("attribute"),
    META_ATTRIBUTE("meta_attribute"),
    CARDINALITY("cardinality"),
    INTERNAL_RELATION("internal_relation"),
    EXTERNAL_RELATION("external_relation"),
    GENSET_DEFINITION("genset_definition"),
    DATATYPE_DEFINITION("datatype_definition"),
    ENUM_DEFINITION("enum_definition");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
