package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.ModelFixtures;
import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.Suggestion;
import info.isaksson.erland.tonto.checks.SuggestionAction;
import info.isaksson.erland.tonto.checks.Violation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SubkindPatternDetectorTest {

    private final SubkindPatternDetector detector = new SubkindPatternDetector();

    private DetectorOutput detect(String... lines) {
        return detector.detect(ModelFixtures.table(lines));
    }

    @Test
    void disjointGensetMakesACompletePattern() {
        DetectorOutput out = detect(
                "kind Person",
                "subkind Man specializes Person",
                "subkind Woman specializes Person",
                "disjoint complete genset Person_Sex { general Person specifics Man, Woman }");
        assertEquals(1, out.patterns.size());
        Pattern p = out.patterns.get(0);
        assertEquals(PatternType.SUBKIND, p.patternType);
        assertEquals(PatternStatus.COMPLETE, p.status);
        assertEquals("Person", p.anchorClass);
        assertEquals("kind", p.anchorStereotype);
        assertEquals("Person", p.elements.get("general"));
        assertEquals(List.of("Man", "Woman"), p.elements.get("specifics"));
        assertEquals("Person_Sex", p.elements.get("genset"));
        assertEquals(Boolean.TRUE, p.constraints.get("disjoint"));
        assertEquals(Boolean.TRUE, p.constraints.get("complete"));
        assertTrue(p.violations.isEmpty());
        assertTrue(p.suggestions.isEmpty());
    }

    @Test
    void missingGensetLeavesThePatternIncompleteWithASuggestion() {
        DetectorOutput out = detect(
                "kind Person",
                "subkind Man specializes Person",
                "subkind Woman specializes Person");
        Pattern p = out.patterns.get(0);
        assertEquals(PatternStatus.INCOMPLETE, p.status);
        assertNull(p.elements.get("genset"));
        assertEquals(Boolean.FALSE, p.constraints.get("disjoint"));

        Violation v = p.violations.get(0);
        assertEquals(SpecializationPatternDetector.MISSING_GENSET, v.code);
        assertEquals(Severity.WARNING, v.severity);
        assertEquals("Subkind_Pattern for 'Person' should have a genset to formalize the generalization", v.message);
        assertEquals(2, v.line);

        Suggestion s = p.suggestions.get(0);
        assertEquals(SuggestionAction.INSERT_CODE, s.action);
        assertEquals("disjoint genset Person_Genset { general Person specifics Man, Woman }", s.codeSuggestion);
        assertSame(s, v.suggestion);
    }

    @Test
    void nonDisjointGensetIsOnlyAWarning() {
        Pattern p = detect(
                "kind Person",
                "subkind Man specializes Person",
                "subkind Woman specializes Person",
                "genset Person_Sex { general Person specifics Man, Woman }").patterns.get(0);
        assertEquals(PatternStatus.COMPLETE, p.status);
        assertEquals(1, p.violations.size());
        Violation v = p.violations.get(0);
        assertEquals(SubkindPatternDetector.MISSING_DISJOINT, v.code);
        assertEquals("Subkind_Pattern genset 'Person_Sex' should have 'disjoint' keyword", v.message);
        assertEquals(SuggestionAction.ADD_KEYWORD, v.suggestion.action);
        assertEquals("disjoint genset Person_Sex { general Person specifics Man, Woman }", v.suggestion.codeSuggestion);
    }

    @Test
    void gensetMissingASubkind() {
        Pattern p = detect(
                "kind Person",
                "subkind Man specializes Person",
                "subkind Woman specializes Person",
                "subkind Other specializes Person",
                "disjoint genset Person_Sex { general Person specifics Man, Woman }").patterns.get(0);
        assertTrue(p.hasViolation(SpecializationPatternDetector.INCOMPLETE_GENSET_SPECIFICS));
        Violation v = p.violations.get(0);
        assertEquals("Genset 'Person_Sex' is missing subkinds: Other", v.message);
        assertEquals(SuggestionAction.MODIFY_CODE, v.suggestion.action);
        assertEquals("disjoint genset Person_Sex { general Person specifics Man, Woman, Other }",
                v.suggestion.codeSuggestion);
        assertEquals(PatternStatus.COMPLETE, p.status);
    }

    @Test
    void exactGensetIsPreferredOverAnOverlappingOne() {
        Pattern p = detect(
                "kind Person",
                "subkind Man specializes Person",
                "subkind Woman specializes Person",
                "disjoint genset Partial { general Person specifics Man }",
                "disjoint genset Exact { general Person specifics Woman, Man }").patterns.get(0);
        assertEquals("Exact", p.elements.get("genset"));
    }

    @Test
    void subkindInTwoGensetsIsInfo() {
        Pattern p = detect(
                "kind Person",
                "subkind Man specializes Person",
                "subkind Woman specializes Person",
                "disjoint genset A { general Person specifics Man, Woman }",
                "disjoint genset B { general Person specifics Man, Woman }").patterns.get(0);
        assertTrue(p.hasViolation(SubkindPatternDetector.SUBKIND_IN_MULTIPLE_GENSETS));
        assertTrue(p.violations.stream().allMatch(v -> v.severity == Severity.INFO));
        assertEquals(PatternStatus.COMPLETE, p.status);
    }

    @Test
    void singleSubkindIsAStandaloneWarning() {
        DetectorOutput out = detect(
                "kind Person",
                "subkind Man specializes Person");
        assertTrue(out.patterns.isEmpty());
        assertEquals(1, out.standalone.size());
        PatternFinding f = out.standalone.get(0);
        assertEquals(PatternType.SUBKIND, f.patternType);
        assertEquals("Person", f.anchorClass);
        assertEquals(SpecializationPatternDetector.SINGLE_SPECIALIZATION, f.violation.code);
        assertEquals(Severity.WARNING, f.violation.severity);
    }

    @Test
    void subkindCanAnchorFurtherSubkinds() {
        DetectorOutput out = detect(
                "kind Vehicle",
                "subkind Car specializes Vehicle",
                "subkind Bike specializes Vehicle",
                "subkind Sedan specializes Car",
                "subkind Coupe specializes Car",
                "disjoint genset V { general Vehicle specifics Car, Bike }",
                "disjoint genset C { general Car specifics Sedan, Coupe }");
        assertEquals(2, out.patterns.size());
        assertEquals("Car", out.patterns.get(1).anchorClass);
        assertEquals("subkind", out.patterns.get(1).anchorStereotype);
    }

    @Test
    void unresolvedAttributeTypeIsAnError() {
        Pattern p = detect(
                "kind Person { home : Address }",
                "subkind Man specializes Person",
                "subkind Woman specializes Person",
                "disjoint genset Person_Sex { general Person specifics Man, Woman }").patterns.get(0);
        assertTrue(p.hasViolation("UNRESOLVED_TYPE"));
        assertEquals(PatternStatus.INCOMPLETE, p.status);
    }
}
