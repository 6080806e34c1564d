package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonShapeTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void classDefinitionUsesSnakeCaseKeys() {
        Attribute name = new Attribute("name", "String", null, List.of(new MetaAttribute("const", null, 3, 20)), 3, 5);
        InternalRelation rel = new InternalRelation("mediation", null, "--", null, null,
                new Cardinality(CardinalityBound.of(1), null, 4, 20), "Person", 4, 5);
        ClassDef def = new ClassDef("relator", "Employment", List.of(), null, List.of(name, rel), 2, 1);

        JsonNode json = om.valueToTree(def);

        assertEquals("class_definition", json.get("node_type").asText());
        assertEquals("relator", json.get("class_stereotype").asText());
        assertEquals("Employment", json.get("class_name").asText());
        assertEquals("attribute", json.get("body").get(0).get("node_type").asText());
        assertEquals("String", json.get("body").get(0).get("attribute_type").asText());
        assertEquals("internal_relation", json.get("body").get(1).get("node_type").asText());
        assertEquals("Person", json.get("body").get(1).get("second_end").asText());
        assertEquals(1, json.get("body").get(1).get("second_cardinality").get("max").asInt());
    }

    @Test
    void manyBoundSerializesAsStar() {
        Cardinality c = new Cardinality(CardinalityBound.of(1), CardinalityBound.MANY, 1, 1);
        JsonNode json = om.valueToTree(c);
        assertEquals(1, json.get("min").asInt());
        assertEquals("*", json.get("max").asText());
        assertFalse(json.has("wellFormed"));
        assertEquals("[1..*]", c.toString());
    }

    @Test
    void singleBoundMeansExactlyN() {
        Cardinality c = new Cardinality(CardinalityBound.of(2), null, 1, 1);
        assertEquals(c.min, c.max);
        assertEquals("[2]", c.toString());
    }

    @Test
    void wellFormedRanges() {
        assertTrue(new Cardinality(CardinalityBound.of(0), CardinalityBound.MANY, 1, 1).isWellFormed());
        assertTrue(new Cardinality(CardinalityBound.MANY, null, 1, 1).isWellFormed());
        assertFalse(new Cardinality(CardinalityBound.of(3), CardinalityBound.of(1), 1, 1).isWellFormed());
        assertFalse(new Cardinality(CardinalityBound.MANY, CardinalityBound.of(1), 1, 1).isWellFormed());
    }

    @Test
    void scannerVisitsEveryCardinalityInSourceOrder() {
        Cardinality a = new Cardinality(CardinalityBound.of(0), CardinalityBound.MANY, 3, 10);
        Cardinality b = new Cardinality(CardinalityBound.of(1), null, 5, 10);
        Cardinality c = new Cardinality(CardinalityBound.of(2), null, 7, 10);
        ClassDef person = new ClassDef("kind", "Person", null, null,
                List.of(new Attribute("nick", "String", a, null, 3, 5)), 2, 1);
        ExternalRelation ext = new ExternalRelation("material", "Person", b, "--", null, null, c, "Person", 5, 1);
        TontoFile file = new TontoFile(List.of(), new PackageDecl("P", 1, 1), List.of(person, ext), 1, 1);

        List<Cardinality> seen = new ArrayList<>();
        new AstScanner() {
            @Override
            public Void visitCardinality(Cardinality node) {
                seen.add(node);
                return null;
            }
        }.scan(file);

        assertEquals(List.of(a, b, c), seen);
    }

    @Test
    void fileSerializesPackageUnderPackageKey() {
        TontoFile file = new TontoFile(List.of(new ImportDecl("Base", 1, 1)), new PackageDecl("Hospital", 2, 1), List.of(), 1, 1);
        JsonNode json = om.valueToTree(file);
        assertEquals("tonto_file", json.get("node_type").asText());
        assertEquals("Hospital", json.get("package").get("package_name").asText());
        assertEquals("Base", json.get("imports").get(0).get("module_name").asText());
        assertEquals("Hospital", file.packageName());
    }
}
