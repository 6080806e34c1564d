package info.isaksson.erland.tonto.core;

import info.isaksson.erland.tonto.testutil.TestPaths;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class WorkspaceAnalysisTest {

    private final AnalysisService service = new AnalysisService();

    @Test
    void analyzesEverySampleInPathOrder() throws Exception {
        WorkspaceAnalysis w = service.analyzeDirectory(TestPaths.resolveInRepo("samples/tonto"), null, null);

        assertEquals(List.of("clinic/broken.tonto", "clinic/clinic.tonto", "university.tonto"), filenames(w));
        assertEquals(3, w.fileCount());
        assertEquals(2, w.filesWithErrors());
        assertEquals(10, w.summary.totalPatterns);
        assertEquals(7, w.summary.completePatterns);
        assertEquals(3, w.summary.incompletePatterns);
        assertEquals(6, w.summary.patternCounts.size());
        assertEquals(1, w.file("university.tonto").imports.size());
        assertNull(w.file("missing.tonto"));
    }

    @Test
    void excludeGlobsApply() throws Exception {
        WorkspaceAnalysis w = service.analyzeDirectory(TestPaths.resolveInRepo("samples/tonto"), List.of("clinic"), null);
        assertEquals(List.of("university.tonto"), filenames(w));
    }

    @Test
    void parallelAndSequentialRunsAgree() throws Exception {
        Path root = TestPaths.resolveInRepo("samples/tonto");
        AnalysisOptions sequential = new AnalysisOptions();
        sequential.parallel = false;
        String a = AnalysisJson.toJsonString(service.analyzeDirectory(root, null, sequential));
        String b = AnalysisJson.toJsonString(service.analyzeDirectory(root, null, new AnalysisOptions()));
        assertEquals(a, b);
    }

    @Test
    void namesAreNotResolvedAcrossFiles() throws Exception {
        Path root = Files.createTempDirectory("tonto-ws-");
        Files.writeString(root.resolve("a.tonto"), "package A\nkind Person\n");
        Files.writeString(root.resolve("b.tonto"), "import A\npackage B\nrole Student specializes Person\n");

        WorkspaceAnalysis w = service.analyzeDirectory(root, null, null);
        AnalysisResult b = w.file("b.tonto");
        assertTrue(b.warnings.stream().anyMatch(x -> x.code.equals("UNDEFINED_PARENT")));
    }

    @Test
    void emptyDirectory() throws Exception {
        WorkspaceAnalysis w = service.analyzeDirectory(Files.createTempDirectory("tonto-empty-"), null, null);
        assertEquals(0, w.fileCount());
        assertEquals(0, w.summary.totalPatterns);
    }

    private static List<String> filenames(WorkspaceAnalysis w) {
        return w.files.stream().map(r -> r.filename).collect(Collectors.toList());
    }
}
