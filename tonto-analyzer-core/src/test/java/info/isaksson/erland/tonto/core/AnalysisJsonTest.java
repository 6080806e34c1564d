package info.isaksson.erland.tonto.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.tonto.testutil.TestPaths;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class AnalysisJsonTest {

    private final AnalysisService service = new AnalysisService();

    @Test
    void resultHasTheDocumentedShape() throws Exception {
        AnalysisResult r = service.analyzeFile(TestPaths.sample("clinic/clinic.tonto"), null);
        JsonNode root = new ObjectMapper().readTree(AnalysisJson.toJsonString(r));

        for (String key : new String[]{"filename", "package", "imports", "symbols", "patterns", "incomplete_patterns",
                "errors", "warnings", "diagnostics", "summary"}) {
            assertTrue(root.has(key), key);
        }
        assertFalse(root.has("tokens"));
        assertFalse(root.has("ast"));
        assertFalse(root.has("symbolTable"));

        JsonNode pattern = root.get("incomplete_patterns").get(0);
        assertEquals("Subkind_Pattern", pattern.get("pattern_type").asText());
        assertEquals("incomplete", pattern.get("status").asText());
        assertEquals("Person", pattern.get("anchor_class").asText());
        assertEquals("kind", pattern.get("anchor_stereotype").asText());
        assertTrue(pattern.get("elements").get("genset").isNull());
        assertFalse(pattern.get("constraints").get("disjoint").asBoolean());
        assertEquals("warning", pattern.get("violations").get(0).get("severity").asText());
        assertEquals("insert_code", pattern.get("suggestions").get(0).get("action").asText());
        assertTrue(pattern.get("suggestions").get(0).has("code_suggestion"));

        JsonNode warning = root.get("warnings").get(0);
        assertEquals("Subkind_Pattern", warning.get("pattern_type").asText());
        assertEquals("Person", warning.get("anchor_class").asText());
        assertTrue(warning.has("suggestion"));

        JsonNode error = root.get("errors").get(0);
        assertEquals("DUPLICATE_DECLARATION", error.get("code").asText());
        assertEquals("error", error.get("severity").asText());
        assertEquals(13, error.get("line").asInt());

        JsonNode counts = root.get("summary").get("pattern_counts");
        assertEquals(6, counts.size());
        assertEquals(0, counts.get("Phase_Pattern").asInt());
        assertEquals(3, root.get("summary").get("incomplete_patterns").asInt());
    }

    @Test
    void symbolsSerializeAsTheirDeclarations() throws Exception {
        AnalysisResult r = service.analyzeFile(TestPaths.sample("university.tonto"), null);
        JsonNode symbols = AnalysisJson.toTree(r).get("symbols");

        JsonNode person = symbols.get("classes").get(0);
        assertEquals("class_definition", person.get("node_type").asText());
        assertEquals("kind", person.get("class_stereotype").asText());
        assertEquals("Person", person.get("class_name").asText());

        JsonNode mediation = symbols.get("relations").get(0);
        assertEquals("Enrollment", mediation.get("source_class").asText());
        assertEquals("internal_relation", mediation.get("node_type").asText());
        assertEquals("mediation", mediation.get("relation_stereotype").asText());
        assertEquals("Student", mediation.get("second_end").asText());

        JsonNode material = symbols.get("relations").get(2);
        assertFalse(material.has("source_class"));
        assertEquals("Student", material.get("first_end").asText());

        assertEquals("Person_Sex", symbols.get("gensets").get(0).get("genset_name").asText());
        assertEquals("AddressDataType", symbols.get("datatypes").get(0).get("datatype_name").asText());
    }

    @Test
    void symbolListsKeepDeclarationOrder() throws Exception {
        AnalysisResult r = service.analyze("package P\nkind Zeta\nkind Alpha\nenum Mood { Calm }\nenum Color { Red }\n",
                "order.tonto", null);
        JsonNode symbols = AnalysisJson.toTree(r).get("symbols");

        for (String key : new String[]{"classes", "relations", "gensets", "datatypes", "enums"}) {
            assertTrue(symbols.get(key).isArray(), key);
        }
        JsonNode classes = symbols.get("classes");
        assertEquals(2, classes.size());
        assertEquals("Zeta", classes.get(0).get("class_name").asText());
        assertEquals("Alpha", classes.get(1).get("class_name").asText());
        assertEquals("Mood", symbols.get("enums").get(0).get("enum_name").asText());
        assertEquals("Color", symbols.get("enums").get(1).get("enum_name").asText());
    }

    @Test
    void diagnosticsCarrySourceContext() throws Exception {
        AnalysisResult r = service.analyzeFile(TestPaths.sample("clinic/broken.tonto"), null);
        JsonNode d = AnalysisJson.toTree(r).get("diagnostics").get(0);
        assertEquals("IllegalCharacter", d.get("type").asText());
        assertEquals("kind Person$", d.get("line_text").asText());
        assertEquals("           ^", d.get("pointer").asText());
    }

    @Test
    void serializationIsDeterministic() throws Exception {
        Path file = TestPaths.sample("university.tonto");
        String a = AnalysisJson.toJsonString(service.analyzeFile(file, null));
        String b = AnalysisJson.toJsonString(new AnalysisService().analyzeFile(file, null));
        assertEquals(a, b);
        assertTrue(a.endsWith("}\n"));
        assertTrue(a.contains("\n  \"filename\""));
    }

    @Test
    void writesToFile() throws Exception {
        Path out = Files.createTempDirectory("tonto-json-").resolve("nested/result.json");
        AnalysisResult r = service.analyze("package P\nkind Person\n", "p.tonto", null);
        AnalysisJson.write(r, out);
        String written = Files.readString(out, StandardCharsets.UTF_8);
        assertEquals(AnalysisJson.toJsonString(r), written);
    }
}
