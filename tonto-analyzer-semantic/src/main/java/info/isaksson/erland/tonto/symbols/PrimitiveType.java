package info.isaksson.erland.tonto.symbols;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.tonto.lang.Vocabulary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Built-in type ({@code Number}, {@code String}, ...). One instance per primitive. */
@JsonPropertyOrder({"node_type", "name"})
public final class PrimitiveType implements TypeSymbol {
    private static final Map<String, PrimitiveType> ALL = buildAll();

    @JsonProperty("name")
    private final String name;

    private PrimitiveType(String name) {
        this.name = name;
    }

    @JsonProperty("node_type")
    public String nodeType() {
        return "primitive_type";
    }

    @Override
    public String name() {
        return name;
    }

    public static Map<String, PrimitiveType> all() {
        return ALL;
    }

    private static Map<String, PrimitiveType> buildAll() {
        Map<String, PrimitiveType> out = new LinkedHashMap<>();
        for (String n : Vocabulary.primitiveTypes()) {
            out.put(n, new PrimitiveType(n));
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public String toString() {
        return name;
    }
}
