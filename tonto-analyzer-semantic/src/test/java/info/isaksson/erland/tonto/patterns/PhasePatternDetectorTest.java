package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.ModelFixtures;
import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.Violation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PhasePatternDetectorTest {

    private final PhasePatternDetector detector = new PhasePatternDetector();

    private Pattern detectOne(String... lines) {
        DetectorOutput out = detector.detect(ModelFixtures.table(lines));
        assertEquals(1, out.patterns.size());
        return out.patterns.get(0);
    }

    @Test
    void disjointCompleteGensetIsClean() {
        Pattern p = detectOne(
                "kind Person",
                "phase Child specializes Person",
                "phase Adult specializes Person",
                "disjoint complete genset Age { general Person specifics Child, Adult }");
        assertEquals(PatternStatus.COMPLETE, p.status);
        assertTrue(p.violations.isEmpty());
    }

    @Test
    void missingGensetSuggestsADisjointCompleteOne() {
        Pattern p = detectOne(
                "kind Person",
                "phase Child specializes Person",
                "phase Adult specializes Person");
        assertEquals(PatternStatus.INCOMPLETE, p.status);
        assertEquals(Severity.WARNING, p.violations.get(0).severity);
        assertEquals("disjoint complete genset Person_Genset { general Person specifics Child, Adult }",
                p.suggestions.get(0).codeSuggestion);
    }

    @Test
    void overlappingPhasesAreAnError() {
        Pattern p = detectOne(
                "kind Person",
                "phase Child specializes Person",
                "phase Adult specializes Person",
                "complete genset Age { general Person specifics Child, Adult }");
        Violation v = p.violations.get(0);
        assertEquals(PhasePatternDetector.MISSING_DISJOINT, v.code);
        assertEquals(Severity.ERROR, v.severity);
        assertEquals(PatternStatus.INCOMPLETE, p.status);
    }

    @Test
    void missingCompleteIsInfo() {
        Pattern p = detectOne(
                "kind Person",
                "phase Child specializes Person",
                "phase Adult specializes Person",
                "disjoint genset Age { general Person specifics Child, Adult }");
        assertEquals(1, p.violations.size());
        assertEquals(PhasePatternDetector.MISSING_COMPLETE, p.violations.get(0).code);
        assertEquals(Severity.INFO, p.violations.get(0).severity);
        assertEquals("disjoint complete genset Age { general Person specifics Child, Adult }",
                p.suggestions.get(0).codeSuggestion);
        assertEquals(PatternStatus.COMPLETE, p.status);
    }

    @Test
    void phaseInTwoGensetsIsAnErrorUnlikeRoles() {
        String[] model = {
                "kind Person",
                "phase Child specializes Person",
                "phase Adult specializes Person",
                "disjoint complete genset A { general Person specifics Child, Adult }",
                "disjoint complete genset B { general Person specifics Child, Adult }"
        };
        Pattern p = detectOne(model);
        assertTrue(p.hasViolation(PhasePatternDetector.PHASE_IN_MULTIPLE_GENSETS));
        assertEquals(PatternStatus.INCOMPLETE, p.status);
        Violation v = p.violations.stream()
                .filter(x -> x.code.equals(PhasePatternDetector.PHASE_IN_MULTIPLE_GENSETS))
                .findFirst().orElseThrow();
        assertEquals(Severity.ERROR, v.severity);
        assertEquals("Phase 'Child' appears in 2 gensets: A, B", v.message);
    }

    @Test
    void singlePhaseInTwoGensetsFormsAnIncompletePattern() {
        DetectorOutput out = detector.detect(ModelFixtures.table(
                "kind Person",
                "phase Child specializes Person",
                "disjoint complete genset A { general Person specifics Child }",
                "disjoint complete genset B { general Person specifics Child }"));

        assertTrue(out.standalone.isEmpty());
        assertEquals(1, out.patterns.size());
        Pattern p = out.patterns.get(0);
        assertEquals("Person", p.anchorClass);
        assertEquals(PatternStatus.INCOMPLETE, p.status);
        assertTrue(p.hasViolation(SpecializationPatternDetector.SINGLE_SPECIALIZATION));
        Violation v = p.violations.stream()
                .filter(x -> x.code.equals(PhasePatternDetector.PHASE_IN_MULTIPLE_GENSETS))
                .findFirst().orElseThrow();
        assertEquals(Severity.ERROR, v.severity);
        assertEquals("Phase 'Child' appears in 2 gensets: A, B", v.message);
    }

    @Test
    void singlePhaseWithoutErrorsStaysStandalone() {
        DetectorOutput out = detector.detect(ModelFixtures.table(
                "kind Person",
                "phase Child specializes Person"));
        assertTrue(out.patterns.isEmpty());
        assertEquals(1, out.standalone.size());
        assertEquals(SpecializationPatternDetector.SINGLE_SPECIALIZATION, out.standalone.get(0).violation.code);
    }

    @Test
    void phaseSpecializingRoleIsInvalid() {
        Pattern p = detectOne(
                "kind Person",
                "role Student specializes Person",
                "phase Freshman specializes Person, Student",
                "phase Senior specializes Person",
                "disjoint complete genset Year { general Person specifics Freshman, Senior }");
        assertTrue(p.hasViolation("INVALID_SPECIALIZATION"));
        assertEquals(PatternStatus.INCOMPLETE, p.status);
    }
}
