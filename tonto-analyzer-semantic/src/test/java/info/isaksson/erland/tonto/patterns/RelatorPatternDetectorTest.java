package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.ModelFixtures;
import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.Violation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RelatorPatternDetectorTest {

    private final RelatorPatternDetector detector = new RelatorPatternDetector();

    private Pattern detectOne(String... lines) {
        DetectorOutput out = detector.detect(ModelFixtures.table(lines));
        assertEquals(1, out.patterns.size());
        return out.patterns.get(0);
    }

    @Test
    void relatorWithTwoMediationsAndMaterialRelationIsComplete() {
        Pattern p = detectOne(
                "role Student",
                "kind University",
                "relator Enrollment {",
                "  @mediation [1..*] -- [1] Student",
                "  @mediation [1..*] -- [1] University",
                "}",
                "@material relation Student [1..*] -- enrolledIn -- [1..*] University");
        assertEquals(PatternStatus.COMPLETE, p.status);
        assertTrue(p.violations.isEmpty(), p.violations::toString);
        assertEquals(List.of("Student", "University"), p.elements.get("mediated"));
        assertEquals(Boolean.TRUE, p.constraints.get("has_material_relations"));
    }

    @Test
    void singleMediationIsInsufficient() {
        Pattern p = detectOne(
                "role Student",
                "relator Enrollment {",
                "  @mediation [1..*] -- [1] Student",
                "}");
        assertEquals(PatternStatus.INCOMPLETE, p.status);
        Violation v = p.violations.get(0);
        assertEquals(RelatorPatternDetector.INSUFFICIENT_MEDIATIONS, v.code);
        assertEquals(Severity.ERROR, v.severity);
        assertEquals("Relator 'Enrollment' must mediate at least 2 distinct classes (found 1)", v.message);
        assertEquals(Boolean.FALSE, p.constraints.get("has_min_mediations"));
    }

    @Test
    void mediationsToTheSameClassCountOnce() {
        Pattern p = detectOne(
                "kind Person",
                "relator Marriage {",
                "  @mediation [1] -- husband -- [1] Person",
                "  @mediation [1] -- wife -- [1] Person",
                "}");
        assertTrue(p.hasViolation(RelatorPatternDetector.INSUFFICIENT_MEDIATIONS));
    }

    @Test
    void undeclaredTargetIsReported() {
        Pattern p = detectOne(
                "role Student",
                "kind University",
                "relator Enrollment {",
                "  @mediation [1..*] -- [1] Student",
                "  @mediation [1..*] -- [1] University",
                "  @mediation [1..*] -- [1] Ghost",
                "}",
                "@material relation Student [1..*] -- enrolledIn -- [1..*] University");
        assertTrue(p.hasViolation(RelatorPatternDetector.RELATION_TARGET_NOT_FOUND));
        assertEquals(PatternStatus.INCOMPLETE, p.status);
        assertEquals(List.of("Student", "University"), p.elements.get("mediated"));
    }

    @Test
    void missingMaterialRelationIsAWarningWithSuggestion() {
        Pattern p = detectOne(
                "role Student",
                "kind University",
                "relator Enrollment {",
                "  @mediation [1..*] -- [1] Student",
                "}",
                "@mediation relation University [1] -- [1..*] Enrollment");
        assertEquals(PatternStatus.COMPLETE, p.status);
        assertEquals(1, p.violations.size());
        Violation v = p.violations.get(0);
        assertEquals(RelatorPatternDetector.MISSING_MATERIAL_RELATION, v.code);
        assertEquals(Severity.WARNING, v.severity);
        assertEquals("@material relation Student [1..*] -- enrollment -- [1..*] University",
                v.suggestion.codeSuggestion);
    }

    @Test
    void materialRelationMatchesInEitherDirection() {
        Pattern p = detectOne(
                "role Student",
                "kind University",
                "relator Enrollment {",
                "  @mediation [1..*] -- [1] Student",
                "  @mediation [1..*] -- [1] University",
                "}",
                "@material relation University [1..*] -- enrolls -- [1..*] Student");
        assertFalse(p.hasViolation(RelatorPatternDetector.MISSING_MATERIAL_RELATION));
    }
}
