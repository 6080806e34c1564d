package info.isaksson.erland.tonto.core;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON form of analysis results.
 *
 * <p>Output is stable: field order is fixed by annotations, map keys are sorted, two-space
 * indentation and a trailing newline.</p>
 */
public final class AnalysisJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private AnalysisJson() {}

    public static String toJsonString(AnalysisResult result) throws IOException {
        if (result == null) throw new IllegalArgumentException("result is null");
        return MAPPER.writer(PRETTY).writeValueAsString(result) + "\n";
    }

    public static String toJsonString(WorkspaceAnalysis workspace) throws IOException {
        if (workspace == null) throw new IllegalArgumentException("workspace is null");
        return MAPPER.writer(PRETTY).writeValueAsString(workspace) + "\n";
    }

    public static void write(AnalysisResult result, Path path) throws IOException {
        if (result == null) throw new IllegalArgumentException("result is null");
        writeValue(result, path);
    }

    public static void write(WorkspaceAnalysis workspace, Path path) throws IOException {
        if (workspace == null) throw new IllegalArgumentException("workspace is null");
        writeValue(workspace, path);
    }

    /** Generic tree view of a result, for callers that post-process the JSON. */
    public static JsonNode toTree(AnalysisResult result) {
        if (result == null) throw new IllegalArgumentException("result is null");
        return MAPPER.valueToTree(result);
    }

    private static void writeValue(Object value, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, value);
            out.write('\n');
        }
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // the caller owns the stream
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
