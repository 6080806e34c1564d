package info.isaksson.erland.tonto.checks;

import info.isaksson.erland.tonto.ModelFixtures;
import info.isaksson.erland.tonto.ast.TontoFile;
import info.isaksson.erland.tonto.symbols.SymbolTable;
import info.isaksson.erland.tonto.symbols.SymbolTableBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ModelCheckerTest {

    private final ModelChecker checker = new ModelChecker();

    private List<Violation> check(String... lines) {
        TontoFile file = ModelFixtures.parse(lines);
        SymbolTable table = SymbolTableBuilder.build(file);
        return checker.check(table, file);
    }

    private static List<Violation> withCode(List<Violation> vs, String code) {
        return vs.stream().filter(v -> v.code.equals(code)).collect(Collectors.toList());
    }

    @Test
    void cleanModelHasNoIssues() {
        List<Violation> vs = check(
                "kind Person { name : String [1] }",
                "subkind Man specializes Person",
                "subkind Woman specializes Person",
                "disjoint complete genset Person_Sex { general Person specifics Man, Woman }");
        assertTrue(vs.isEmpty(), vs::toString);
    }

    @Test
    void duplicateDeclarationIsAnError() {
        List<Violation> vs = withCode(check("kind Person", "kind Person"), ModelChecker.DUPLICATE_DECLARATION);
        assertEquals(1, vs.size());
        Violation v = vs.get(0);
        assertEquals(Severity.ERROR, v.severity);
        assertEquals("Duplicate class 'Person' (first declared at line 2)", v.message);
        assertEquals(3, v.line);
    }

    @Test
    void invalidCardinalities() {
        List<Violation> vs = withCode(check(
                "kind Person {",
                "  a : String [3..1]",
                "  b : String [*..2]",
                "  c : String [0..*]",
                "  d : String [2]",
                "}"), ModelChecker.INVALID_CARDINALITY);
        assertEquals(2, vs.size());
        assertEquals("Invalid cardinality [3..1]: lower bound exceeds upper bound", vs.get(0).message);
        assertEquals(3, vs.get(0).line);
        assertTrue(vs.get(1).message.contains("'*'"));
    }

    @Test
    void gensetHygiene() {
        List<Violation> vs = check(
                "kind Person",
                "subkind Man specializes Person",
                "subkind Stray",
                "genset Bad { general Person specifics Man, Stray, Ghost }",
                "genset Lonely { general Person specifics Man }");

        List<Violation> undefined = withCode(vs, ModelChecker.UNDEFINED_GENSET_CLASS);
        assertEquals(1, undefined.size());
        assertTrue(undefined.get(0).message.contains("'Ghost'"));

        List<Violation> notSpecializing = withCode(vs, ModelChecker.SPECIFIC_NOT_SPECIALIZING_GENERAL);
        assertEquals(1, notSpecializing.size());
        assertEquals(Severity.WARNING, notSpecializing.get(0).severity);
        assertTrue(notSpecializing.get(0).message.startsWith("Class 'Stray'"));

        List<Violation> single = withCode(vs, ModelChecker.SINGLE_SPECIFIC_GENSET);
        assertEquals(1, single.size());
        assertTrue(single.get(0).message.contains("'Lonely'"));
    }

    @Test
    void unresolvedAttributeTypes() {
        List<Violation> vs = withCode(check(
                "kind Person { home : Address  age : Number  car : Car }",
                "kind Car",
                "datatype Point { x : Number  unit : UnitDataType }"), TypeReferences.CODE);
        assertEquals(2, vs.size());
        assertEquals("Type 'Address' of attribute 'home' in 'Person' could not be resolved", vs.get(0).message);
        assertTrue(vs.get(1).message.contains("'UnitDataType'"));
        assertTrue(vs.stream().allMatch(Violation::isError));
    }

    @Test
    void specializationRuleTable() {
        List<Violation> vs = withCode(check(
                "kind Person",
                "phase Child specializes Person",
                "role Student specializes Child",
                "kind Robot specializes Person"), SpecializationRules.CODE);
        assertEquals(2, vs.size());
        assertEquals("Invalid specialization: role 'Student' cannot specialize phase 'Child'", vs.get(0).message);
        assertEquals("Invalid specialization: kind 'Robot' cannot specialize kind 'Person'", vs.get(1).message);
    }

    @Test
    void undeclaredParentIsAWarning() {
        List<Violation> vs = withCode(check("role Student specializes Person"), ModelChecker.UNDEFINED_PARENT);
        assertEquals(1, vs.size());
        assertEquals(Severity.WARNING, vs.get(0).severity);
    }

    @Test
    void outputIsSortedByPosition() {
        List<Violation> vs = check(
                "kind B { x : Nope }",
                "kind A { y : Nope }",
                "kind B");
        for (int i = 1; i < vs.size(); i++) {
            assertTrue(ModelIssues.ORDER.compare(vs.get(i - 1), vs.get(i)) <= 0);
        }
    }

    @Test
    void ruleTableLookup() {
        assertFalse(SpecializationRules.allows("phase", "roleMixin"));
        assertTrue(SpecializationRules.allows("role", "kind"));
        assertTrue(SpecializationRules.forbiddenParents("event").isEmpty());
    }
}
