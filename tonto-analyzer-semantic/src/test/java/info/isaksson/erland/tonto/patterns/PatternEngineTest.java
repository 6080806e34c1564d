package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.ModelFixtures;
import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.Violation;
import info.isaksson.erland.tonto.symbols.SymbolTable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PatternEngineTest {

    private static final String[] UNIVERSITY = {
            "kind Person",
            "subkind Man specializes Person",
            "subkind Woman specializes Person",
            "disjoint complete genset Person_Sex { general Person specifics Man, Woman }",
            "role Student specializes Person",
            "role Teacher specializes Person",
            "phase Child specializes Person",
            "kind University",
            "relator Enrollment {",
            "  @mediation [1..*] -- [1] Student",
            "}",
            "mode Skill"
    };

    private final PatternEngine engine = new PatternEngine();

    @Test
    void detectorsRunInFixedOrder() {
        List<PatternType> order = new ArrayList<>();
        for (PatternDetector d : engine.detectors()) order.add(d.type());
        assertEquals(List.of(PatternType.values()), order);
    }

    @Test
    void patternsAreSplitByStatus() {
        PatternAnalysis a = engine.analyze(ModelFixtures.table(UNIVERSITY));
        assertEquals(2, a.complete.size());
        assertEquals(PatternType.SUBKIND, a.complete.get(0).patternType);
        assertEquals(PatternType.ROLE, a.complete.get(1).patternType);
        assertEquals(2, a.incomplete.size());
        assertEquals(PatternType.RELATOR, a.incomplete.get(0).patternType);
        assertEquals(PatternType.MODE, a.incomplete.get(1).patternType);
        assertEquals(4, a.total());
    }

    @Test
    void countsListEveryPatternType() {
        Map<PatternType, Integer> counts = engine.analyze(ModelFixtures.table(UNIVERSITY)).counts();
        assertEquals(6, counts.size());
        assertEquals(1, counts.get(PatternType.SUBKIND));
        assertEquals(0, counts.get(PatternType.PHASE));
        assertEquals(0, counts.get(PatternType.ROLE_MIXIN));
    }

    @Test
    void standaloneFindingsFollowPatternViolations() {
        PatternAnalysis a = engine.analyze(ModelFixtures.table(UNIVERSITY));
        assertEquals(1, a.standalone.size());
        assertEquals(PatternType.PHASE, a.standalone.get(0).patternType);
        List<PatternFinding> findings = a.findings();
        assertSame(a.standalone.get(0), findings.get(findings.size() - 1));
        assertEquals(PatternType.ROLE, findings.get(0).patternType);
    }

    @Test
    void completenessRule() {
        Violation warning = new Violation("W", Severity.WARNING, "w", null, null, null);
        Violation info = new Violation("I", Severity.INFO, "i", null, null, null);
        Violation error = new Violation("E", Severity.ERROR, "e", 1, 1, null);
        assertEquals(PatternStatus.COMPLETE, Pattern.statusFor(List.of(), false));
        assertEquals(PatternStatus.COMPLETE, Pattern.statusFor(List.of(warning, info), false));
        assertEquals(PatternStatus.INCOMPLETE, Pattern.statusFor(List.of(warning, error), false));
        assertEquals(PatternStatus.INCOMPLETE, Pattern.statusFor(List.of(), true));
    }

    @Test
    void analysisIsDeterministic() {
        SymbolTable t = ModelFixtures.table(UNIVERSITY);
        assertEquals(engine.analyze(t).findings().toString(), engine.analyze(t).findings().toString());
        assertEquals(engine.analyze(t).all().toString(),
                new PatternEngine().analyze(ModelFixtures.table(UNIVERSITY)).all().toString());
    }

    @Test
    void emptyModelHasNoPatterns() {
        PatternAnalysis a = engine.analyze(new SymbolTable());
        assertEquals(0, a.total());
        assertTrue(a.findings().isEmpty());
        assertEquals(0, PatternAnalysis.empty().total());
    }
}
