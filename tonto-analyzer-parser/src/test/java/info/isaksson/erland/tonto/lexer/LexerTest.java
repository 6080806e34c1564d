package info.isaksson.erland.tonto.lexer;

import info.isaksson.erland.tonto.diagnostics.LexicalError;
import info.isaksson.erland.tonto.lang.TokenCategory;
import info.isaksson.erland.tonto.lang.TokenType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private final Lexer lexer = new Lexer();

    @Test
    void illegalCharacterIsReportedAndSkipped() {
        LexResult r = lexer.tokenize("kind Person$", "model.tonto");

        assertEquals(List.of(TokenType.CLASS_KIND, TokenType.CLASS_NAME), types(r));
        assertEquals(1, r.errors.size());

        LexicalError e = r.errors.get(0);
        assertEquals("IllegalCharacter", e.type);
        assertEquals("$", e.character);
        assertEquals(1, e.line);
        assertEquals(12, e.column);
        assertEquals("kind Person$", e.lineText);
        assertEquals(" ".repeat(11) + "^", e.pointer);
        assertEquals("model.tonto", e.filename);
        assertEquals("Illegal character '$' at line 1, column 12", e.message);
    }

    @Test
    void supplementaryCharacterIsOneLexicalError() {
        LexResult r = lexer.tokenize("kind Person😀 role Child", null);

        assertEquals(1, r.errors.size());
        assertEquals("😀", r.errors.get(0).character);
        assertEquals(12, r.errors.get(0).column);
        assertEquals(List.of(TokenType.CLASS_KIND, TokenType.CLASS_NAME, TokenType.CLASS_ROLE, TokenType.CLASS_NAME), types(r));
    }

    @Test
    void lexingContinuesAfterIllegalCharacters() {
        LexResult r = lexer.tokenize("kind A\n#\nkind B ~ role C", null);
        assertEquals(2, r.errors.size());
        assertEquals(2, r.errors.get(0).line);
        assertEquals(1, r.errors.get(0).column);
        assertEquals(3, r.errors.get(1).line);
        assertEquals(8, r.errors.get(1).column);
        assertEquals(6, r.tokens.size());
    }

    @Test
    void identifierFamiliesFollowNamingConventions() {
        LexResult r = lexer.tokenize("Person hasParent planeta1 CPFDataType abc1x _tmp SubclassName1 Second_Baptist_Church", null);
        assertEquals(List.of(
                TokenType.CLASS_NAME,
                TokenType.RELATION_NAME,
                TokenType.INSTANCE_NAME,
                TokenType.NEW_DATATYPE,
                TokenType.IDENTIFIER,
                TokenType.IDENTIFIER,
                TokenType.CLASS_NAME,
                TokenType.CLASS_NAME), types(r));
        assertFalse(r.hasErrors());
    }

    @Test
    void reservedWordsWinOverNameFamilies() {
        LexResult r = lexer.tokenize("kind relator relators Number inverseOf functional-complexes intrinsic-modes ordered", null);
        assertEquals(List.of(
                TokenType.CLASS_KIND,
                TokenType.KEYWORD_RELATOR,
                TokenType.KEYWORD_RELATORS,
                TokenType.TYPE_NUMBER,
                TokenType.KEYWORD_INVERSEOF,
                TokenType.KEYWORD_FUNCTIONAL_COMPLEXES,
                TokenType.KEYWORD_INTRINSIC_MODES,
                TokenType.META_ORDERED), types(r));
    }

    @Test
    void operatorsMatchLongestFirst() {
        LexResult r = lexer.tokenize("<o>-- --<o> <--> <>-- --<> <-- --> -- ..", null);
        assertEquals(List.of(
                TokenType.COMPOSITIONL,
                TokenType.COMPOSITIONR,
                TokenType.ASSOCIATIONLR,
                TokenType.AGGREGATIONL,
                TokenType.AGGREGATIONR,
                TokenType.ASSOCIATIONL,
                TokenType.ASSOCIATIONR,
                TokenType.ASSOCIATION,
                TokenType.CARDINALITY), types(r));
    }

    @Test
    void cardinalityAndPunctuation() {
        LexResult r = lexer.tokenize("@mediation [1..*] -- [1] Person { } ( ) : , < >", null);
        assertEquals(List.of(
                TokenType.AT, TokenType.RELATION_MEDIATION,
                TokenType.LBRACKET, TokenType.NUMBER, TokenType.CARDINALITY, TokenType.ASTERISK, TokenType.RBRACKET,
                TokenType.ASSOCIATION,
                TokenType.LBRACKET, TokenType.NUMBER, TokenType.RBRACKET,
                TokenType.CLASS_NAME,
                TokenType.LBRACE, TokenType.RBRACE, TokenType.LPAREN, TokenType.RPAREN,
                TokenType.COLON, TokenType.COMMA, TokenType.LT, TokenType.GT), types(r));
        assertEquals(1, r.tokens.get(3).value);
    }

    @Test
    void literalsCarryParsedValues() {
        LexResult r = lexer.tokenize("\"hello \\\"world\\\"\" 42", null);
        assertEquals(TokenType.STRING, r.tokens.get(0).type);
        assertEquals("hello \\\"world\\\"", r.tokens.get(0).value);
        assertEquals(TokenType.NUMBER, r.tokens.get(1).type);
        assertEquals(42, r.tokens.get(1).value);
    }

    @Test
    void commentsAndWhitespaceProduceNoTokensButLinesAdvance() {
        LexResult r = lexer.tokenize("// header\r\npackage P // trailing\n\n\tkind A\n", null);
        assertEquals(List.of(TokenType.KEYWORD_PACKAGE, TokenType.CLASS_NAME, TokenType.CLASS_KIND, TokenType.CLASS_NAME), types(r));
        assertEquals(2, r.tokens.get(0).line);
        assertEquals(1, r.tokens.get(0).column);
        assertEquals(4, r.tokens.get(2).line);
        assertEquals(2, r.tokens.get(2).column);
    }

    @Test
    void eachCallStartsFromFreshState() {
        lexer.tokenize("a\nb\nc $", null);
        LexResult second = lexer.tokenize("kind A", null);
        assertEquals(1, second.tokens.get(0).line);
        assertTrue(second.errors.isEmpty());
    }

    @Test
    void matcherTableIsOrderedNamesBeforeOperators() {
        List<String> names = new ArrayList<>();
        for (TokenMatcher m : TokenMatchers.ordered()) names.add(m.name);
        assertEquals(List.of("STRING", "NUMBER", "NEW_DATATYPE", "COMPOUND_KEYWORD", "INSTANCE_NAME", "CLASS_NAME",
                "RELATION_NAME", "IDENTIFIER", "COMMENT"), names.subList(0, 9));
        assertEquals("COMPOSITIONL", names.get(9));
        assertEquals("CARDINALITY", names.get(17));
    }

    @Test
    void categoryCountsGroupTokens() {
        LexResult r = lexer.tokenize("kind Person { name : String }", null);
        assertEquals(1, r.categoryCounts().get(TokenCategory.CLASS_STEREOTYPE));
        assertEquals(2, r.categoryCounts().get(TokenCategory.IDENTIFIER));
        assertEquals(2, r.categoryCounts().get(TokenCategory.DELIMITER));
    }

    private static List<TokenType> types(LexResult r) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : r.tokens) out.add(t.type);
        return out;
    }
}
