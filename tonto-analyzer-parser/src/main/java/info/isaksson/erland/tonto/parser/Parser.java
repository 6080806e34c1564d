package info.isaksson.erland.tonto.parser;

import info.isaksson.erland.tonto.ast.Attribute;
import info.isaksson.erland.tonto.ast.Cardinality;
import info.isaksson.erland.tonto.ast.CardinalityBound;
import info.isaksson.erland.tonto.ast.ClassBodyItem;
import info.isaksson.erland.tonto.ast.ClassDef;
import info.isaksson.erland.tonto.ast.DatatypeDef;
import info.isaksson.erland.tonto.ast.Declaration;
import info.isaksson.erland.tonto.ast.EnumDef;
import info.isaksson.erland.tonto.ast.ExternalRelation;
import info.isaksson.erland.tonto.ast.GensetDef;
import info.isaksson.erland.tonto.ast.ImportDecl;
import info.isaksson.erland.tonto.ast.InternalRelation;
import info.isaksson.erland.tonto.ast.MetaAttribute;
import info.isaksson.erland.tonto.ast.PackageDecl;
import info.isaksson.erland.tonto.ast.Specialization;
import info.isaksson.erland.tonto.ast.TontoFile;
import info.isaksson.erland.tonto.diagnostics.SourceText;
import info.isaksson.erland.tonto.diagnostics.SyntaxError;
import info.isaksson.erland.tonto.lang.TokenCategory;
import info.isaksson.erland.tonto.lang.TokenType;
import info.isaksson.erland.tonto.lexer.LexResult;
import info.isaksson.erland.tonto.lexer.Lexer;
import info.isaksson.erland.tonto.lexer.Token;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for Tonto.
 *
 * <p>The parser never gives up on a file. An unexpected token is reported once and the parser
 * recovers in panic mode: a broken class body item is dropped and parsing resumes at the next item
 * (on a later line) or at the closing brace; a broken top-level declaration is dropped and parsing
 * resumes at the next declaration keyword outside any brace block.</p>
 *
 * <p>Like {@link Lexer}, all state lives in a per-call session.</p>
 */
public final class Parser {

    private static final Set<TokenType> NAMES = EnumSet.of(
            TokenType.CLASS_NAME, TokenType.RELATION_NAME, TokenType.INSTANCE_NAME,
            TokenType.NEW_DATATYPE, TokenType.IDENTIFIER);

    private static final Set<TokenType> RELATION_NAMES = EnumSet.of(
            TokenType.RELATION_NAME, TokenType.INSTANCE_NAME, TokenType.IDENTIFIER);

    private static final Set<TokenType> TYPE_NAMES = EnumSet.of(
            TokenType.CLASS_NAME, TokenType.NEW_DATATYPE, TokenType.IDENTIFIER);

    private static final Set<TokenType> CLASS_STEREOTYPES = byCategory(TokenCategory.CLASS_STEREOTYPE, TokenType.KEYWORD_RELATOR);
    private static final Set<TokenType> RELATION_STEREOTYPES = byCategory(TokenCategory.RELATION_STEREOTYPE);
    private static final Set<TokenType> META_ATTRIBUTES = byCategory(TokenCategory.META_ATTRIBUTE);
    private static final Set<TokenType> TYPE_REFS = union(byCategory(TokenCategory.DATA_TYPE), TYPE_NAMES);

    private static final Set<TokenType> OPERATORS = EnumSet.of(
            TokenType.ASSOCIATION, TokenType.ASSOCIATIONL, TokenType.ASSOCIATIONR, TokenType.ASSOCIATIONLR,
            TokenType.AGGREGATIONL, TokenType.AGGREGATIONR, TokenType.COMPOSITIONL, TokenType.COMPOSITIONR);

    private static final Set<TokenType> NATURES = EnumSet.of(
            TokenType.KEYWORD_FUNCTIONAL_COMPLEXES, TokenType.KEYWORD_INTRINSIC_MODES,
            TokenType.KEYWORD_EXTRINSIC_MODES, TokenType.KEYWORD_ABSTRACT_INDIVIDUALS, TokenType.KEYWORD_RELATORS);

    /** Tokens that can start a package-level declaration. */
    static final Set<TokenType> DECLARATION_START = union(CLASS_STEREOTYPES, EnumSet.of(
            TokenType.KEYWORD_DATATYPE, TokenType.KEYWORD_ENUM, TokenType.KEYWORD_GENSET,
            TokenType.KEYWORD_DISJOINT, TokenType.KEYWORD_COMPLETE, TokenType.AT, TokenType.KEYWORD_RELATION));

    /** Recovery points at file level. */
    private static final Set<TokenType> TOP_LEVEL_SYNC = union(DECLARATION_START,
            EnumSet.of(TokenType.KEYWORD_IMPORT, TokenType.KEYWORD_PACKAGE));

    private static final Set<TokenType> BODY_ITEM_START = union(union(NAMES, OPERATORS),
            EnumSet.of(TokenType.AT, TokenType.LBRACKET));

    private final Lexer lexer;
    private final SyntaxHints hints;

    public Parser() {
        this(new Lexer(), new SyntaxHints());
    }

    public Parser(Lexer lexer, SyntaxHints hints) {
        if (lexer == null) throw new IllegalArgumentException("lexer must not be null");
        if (hints == null) throw new IllegalArgumentException("hints must not be null");
        this.lexer = lexer;
        this.hints = hints;
    }

    /** Lex and parse {@code text}; the result carries both lexical and syntax errors. */
    public ParseResult parse(String text, String filename) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        LexResult lex = lexer.tokenize(text, filename);
        Session session = new Session(lex.tokens, text, filename);
        TontoFile file = session.parseFile();
        return new ParseResult(file, lex.tokens, lex.errors, session.errors);
    }

    /** Parse an already tokenized source. {@code source} is used for error context only. */
    public ParseResult parse(List<Token> tokens, String source, String filename) {
        if (tokens == null) throw new IllegalArgumentException("tokens must not be null");
        Session session = new Session(tokens, source == null ? "" : source, filename);
        TontoFile file = session.parseFile();
        return new ParseResult(file, tokens, List.of(), session.errors);
    }

    /** Thrown to unwind to the nearest recovery point; the error itself is already recorded. */
    private static final class ParseException extends RuntimeException {
        ParseException() {
            super(null, null, false, false);
        }
    }

    private final class Session {
        private final List<Token> tokens;
        private final String source;
        private final String filename;
        private final List<SyntaxError> errors = new ArrayList<>();
        private int pos = 0;
        private int braceDepth = 0;
        private int lastErrorIndex = -1;

        Session(List<Token> tokens, String source, String filename) {
            this.tokens = tokens;
            this.source = source;
            this.filename = filename;
        }

        // ---- file level ----

        TontoFile parseFile() {
            List<ImportDecl> imports = new ArrayList<>();
            PackageDecl pkg = null;
            List<Declaration> content = new ArrayList<>();

            while (at(TokenType.KEYWORD_IMPORT)) {
                int start = pos;
                try {
                    imports.add(parseImport());
                } catch (ParseException e) {
                    syncTopLevel(start);
                }
            }

            if (at(TokenType.KEYWORD_PACKAGE)) {
                int start = pos;
                try {
                    pkg = parsePackage();
                } catch (ParseException e) {
                    syncTopLevel(start);
                }
            } else {
                report(List.of(TokenType.KEYWORD_PACKAGE));
            }

            while (!eof()) {
                int start = pos;
                braceDepth = 0;
                try {
                    content.add(parseDeclaration());
                } catch (ParseException e) {
                    syncTopLevel(start);
                }
            }
            return new TontoFile(imports, pkg, content, 1, 1);
        }

        private ImportDecl parseImport() {
            Token kw = expect(TokenType.KEYWORD_IMPORT);
            Token name = expectOneOf(NAMES);
            return new ImportDecl(name.lexeme, kw.line, kw.column);
        }

        private PackageDecl parsePackage() {
            Token kw = expect(TokenType.KEYWORD_PACKAGE);
            Token name = expectOneOf(NAMES);
            return new PackageDecl(name.lexeme, kw.line, kw.column);
        }

        private Declaration parseDeclaration() {
            Token t = peek();
            if (CLASS_STEREOTYPES.contains(t.type)) return parseClass();
            switch (t.type) {
                case KEYWORD_DATATYPE:
                    return parseDatatype();
                case KEYWORD_ENUM:
                    return parseEnum();
                case KEYWORD_DISJOINT:
                case KEYWORD_COMPLETE:
                case KEYWORD_GENSET:
                    return parseGenset();
                case AT:
                case KEYWORD_RELATION:
                    return parseExternalRelation();
                default:
                    throw fail(DECLARATION_START);
            }
        }

        /** Reports a stray token after a complete declaration; the declaration itself is kept. */
        private void checkDeclarationEnd(Collection<TokenType> alsoExpected) {
            if (eof() || TOP_LEVEL_SYNC.contains(peek().type)) return;
            Set<TokenType> expected = new LinkedHashSet<>(alsoExpected);
            expected.addAll(DECLARATION_START);
            report(expected);
        }

        // ---- classes ----

        private ClassDef parseClass() {
            Token stereotype = advance();
            Token name = expect(TokenType.CLASS_NAME);

            List<String> natures = new ArrayList<>();
            if (atWord("of")) {
                advance();
                natures.add(expectOneOf(NATURES).lexeme);
                while (at(TokenType.COMMA)) {
                    advance();
                    natures.add(expectOneOf(NATURES).lexeme);
                }
            }

            Specialization specialization = at(TokenType.KEYWORD_SPECIALIZES) ? parseSpecialization() : null;
            List<ClassBodyItem> body = at(TokenType.LBRACE) ? parseClassBody() : null;

            List<TokenType> alsoExpected = new ArrayList<>();
            if (specialization == null) alsoExpected.add(TokenType.KEYWORD_SPECIALIZES);
            if (body == null) alsoExpected.add(TokenType.LBRACE);
            checkDeclarationEnd(alsoExpected);

            return new ClassDef(stereotype.lexeme, name.lexeme, natures, specialization, body,
                    stereotype.line, stereotype.column);
        }

        private Specialization parseSpecialization() {
            Token kw = expect(TokenType.KEYWORD_SPECIALIZES);
            return new Specialization(classNameList(), kw.line, kw.column);
        }

        private List<ClassBodyItem> parseClassBody() {
            expect(TokenType.LBRACE);
            final int bodyDepth = braceDepth;
            List<ClassBodyItem> items = new ArrayList<>();
            while (true) {
                if (eof()) {
                    report(List.of(TokenType.RBRACE));
                    return items;
                }
                Token t = peek();
                if (t.is(TokenType.RBRACE)) {
                    advance();
                    return items;
                }
                if (!BODY_ITEM_START.contains(t.type) && DECLARATION_START.contains(t.type)) {
                    // unterminated body: let the enclosing loop pick up the next declaration
                    report(List.of(TokenType.RBRACE));
                    return items;
                }
                int start = pos;
                try {
                    if (!BODY_ITEM_START.contains(t.type)) throw fail(union(BODY_ITEM_START, EnumSet.of(TokenType.RBRACE)));
                    items.add(parseBodyItem());
                } catch (ParseException e) {
                    syncBody(start, bodyDepth);
                }
            }
        }

        private ClassBodyItem parseBodyItem() {
            if (NAMES.contains(peek().type)) return parseAttribute();
            return parseInternalRelation();
        }

        private Attribute parseAttribute() {
            Token name = expectOneOf(NAMES);
            expect(TokenType.COLON);
            Token type = expectOneOf(TYPE_REFS);
            Cardinality cardinality = at(TokenType.LBRACKET) ? parseCardinality() : null;

            List<MetaAttribute> metas = new ArrayList<>();
            if (at(TokenType.LBRACE)) {
                advance();
                metas.add(parseMetaAttribute());
                while (at(TokenType.COMMA)) {
                    advance();
                    metas.add(parseMetaAttribute());
                }
                expect(TokenType.RBRACE);
            }
            return new Attribute(name.lexeme, type.lexeme, cardinality, metas, name.line, name.column);
        }

        private MetaAttribute parseMetaAttribute() {
            Token meta = expectOneOf(META_ATTRIBUTES);
            String target = null;
            boolean takesTarget = meta.is(TokenType.META_SUBSETS) || meta.is(TokenType.META_REDEFINES);
            if (takesTarget && !eof() && NAMES.contains(peek().type)) {
                target = advance().lexeme;
            }
            return new MetaAttribute(meta.lexeme, target, meta.line, meta.column);
        }

        private Cardinality parseCardinality() {
            Token open = expect(TokenType.LBRACKET);
            CardinalityBound min = parseBound();
            CardinalityBound max = null;
            if (at(TokenType.CARDINALITY)) {
                advance();
                max = parseBound();
            }
            expect(TokenType.RBRACKET);
            return new Cardinality(min, max, open.line, open.column);
        }

        private CardinalityBound parseBound() {
            if (at(TokenType.ASTERISK)) {
                advance();
                return CardinalityBound.MANY;
            }
            if (at(TokenType.NUMBER)) {
                Integer bound = boundValue(peek());
                if (bound == null) throw failWith("cardinality bound out of range");
                advance();
                return CardinalityBound.of(bound);
            }
            throw fail(List.of(TokenType.NUMBER, TokenType.ASTERISK));
        }

        private Integer boundValue(Token n) {
            if (n.value instanceof Integer) return (Integer) n.value;
            if (n.value instanceof BigInteger) return null;
            try {
                return Integer.valueOf(n.lexeme);
            } catch (NumberFormatException e) {
                return null;
            }
        }

        // ---- relations ----

        private InternalRelation parseInternalRelation() {
            Token first = peek();
            String stereotype = parseRelationStereotype();
            Cardinality firstCardinality = at(TokenType.LBRACKET) ? parseCardinality() : null;
            RelationTail tail = parseRelationTail();
            return new InternalRelation(stereotype, firstCardinality, tail.opLeft, tail.name, tail.opRight,
                    tail.secondCardinality, tail.target, first.line, first.column);
        }

        private ExternalRelation parseExternalRelation() {
            Token first = peek();
            String stereotype = parseRelationStereotype();
            expect(TokenType.KEYWORD_RELATION);
            Token firstEnd = expect(TokenType.CLASS_NAME);
            Cardinality firstCardinality = at(TokenType.LBRACKET) ? parseCardinality() : null;
            RelationTail tail = parseRelationTail();
            checkDeclarationEnd(List.of());
            return new ExternalRelation(stereotype, firstEnd.lexeme, firstCardinality, tail.opLeft, tail.name,
                    tail.opRight, tail.secondCardinality, tail.target, first.line, first.column);
        }

        private String parseRelationStereotype() {
            if (!at(TokenType.AT)) return null;
            advance();
            return expectOneOf(RELATION_STEREOTYPES).lexeme;
        }

        private RelationTail parseRelationTail() {
            RelationTail tail = new RelationTail();
            tail.opLeft = expectOneOf(OPERATORS).lexeme;
            if (!eof() && RELATION_NAMES.contains(peek().type)) {
                tail.name = advance().lexeme;
                tail.opRight = expectOneOf(OPERATORS).lexeme;
            }
            tail.secondCardinality = parseCardinality();
            tail.target = expect(TokenType.CLASS_NAME).lexeme;
            return tail;
        }

        // ---- gensets, datatypes, enums ----

        private GensetDef parseGenset() {
            Token first = peek();
            boolean disjoint = false;
            boolean complete = false;
            while (at(TokenType.KEYWORD_DISJOINT) || at(TokenType.KEYWORD_COMPLETE)) {
                if (advance().is(TokenType.KEYWORD_DISJOINT)) disjoint = true;
                else complete = true;
            }
            expect(TokenType.KEYWORD_GENSET);
            Token name = expectOneOf(NAMES);

            String general;
            String categorizer = null;
            List<String> specifics;
            if (at(TokenType.LBRACE)) {
                advance();
                expect(TokenType.KEYWORD_GENERAL);
                general = expect(TokenType.CLASS_NAME).lexeme;
                if (at(TokenType.KEYWORD_CATEGORIZER)) {
                    advance();
                    categorizer = expect(TokenType.CLASS_NAME).lexeme;
                }
                expect(TokenType.KEYWORD_SPECIFICS);
                specifics = classNameList();
                expect(TokenType.RBRACE);
            } else if (at(TokenType.KEYWORD_WHERE)) {
                advance();
                specifics = classNameList();
                expect(TokenType.KEYWORD_SPECIALIZES);
                general = expect(TokenType.CLASS_NAME).lexeme;
            } else {
                throw fail(List.of(TokenType.LBRACE, TokenType.KEYWORD_WHERE));
            }
            checkDeclarationEnd(List.of());
            return new GensetDef(name.lexeme, disjoint, complete, general, categorizer, specifics, first.line, first.column);
        }

        private DatatypeDef parseDatatype() {
            Token kw = expect(TokenType.KEYWORD_DATATYPE);
            Token name = expectOneOf(TYPE_NAMES);
            Specialization specialization = at(TokenType.KEYWORD_SPECIALIZES) ? parseSpecialization() : null;
            List<Attribute> body = new ArrayList<>();
            if (at(TokenType.LBRACE)) {
                advance();
                while (!at(TokenType.RBRACE)) {
                    if (eof() || !NAMES.contains(peek().type)) throw fail(union(NAMES, EnumSet.of(TokenType.RBRACE)));
                    body.add(parseAttribute());
                }
                advance();
            }
            checkDeclarationEnd(List.of());
            return new DatatypeDef(name.lexeme, specialization, body, kw.line, kw.column);
        }

        private EnumDef parseEnum() {
            Token kw = expect(TokenType.KEYWORD_ENUM);
            Token name = expectOneOf(TYPE_NAMES);
            Specialization specialization = at(TokenType.KEYWORD_SPECIALIZES) ? parseSpecialization() : null;
            expect(TokenType.LBRACE);
            List<String> values = new ArrayList<>();
            if (!at(TokenType.RBRACE)) {
                values.add(expectOneOf(NAMES).lexeme);
                while (at(TokenType.COMMA)) {
                    advance();
                    values.add(expectOneOf(NAMES).lexeme);
                }
            }
            expect(TokenType.RBRACE);
            checkDeclarationEnd(List.of());
            return new EnumDef(name.lexeme, specialization, values, kw.line, kw.column);
        }

        private List<String> classNameList() {
            List<String> out = new ArrayList<>();
            out.add(expect(TokenType.CLASS_NAME).lexeme);
            while (at(TokenType.COMMA)) {
                advance();
                out.add(expect(TokenType.CLASS_NAME).lexeme);
            }
            return out;
        }

        // ---- recovery ----

        private void syncTopLevel(int start) {
            if (pos == start && !eof()) advance();
            int depth = braceDepth;
            while (!eof()) {
                Token t = peek();
                if (depth == 0 && TOP_LEVEL_SYNC.contains(t.type)) break;
                if (t.is(TokenType.LBRACE)) depth++;
                else if (t.is(TokenType.RBRACE) && depth > 0) depth--;
                pos++;
            }
            braceDepth = 0;
        }

        private void syncBody(int start, int bodyDepth) {
            int itemLine = tokens.get(start).line;
            if (pos == start && !eof()) advance();
            int depth = braceDepth - bodyDepth;
            while (!eof()) {
                Token t = peek();
                if (depth <= 0) {
                    if (t.is(TokenType.RBRACE)) break;
                    if (t.line > itemLine && (BODY_ITEM_START.contains(t.type) || DECLARATION_START.contains(t.type))) break;
                }
                if (t.is(TokenType.LBRACE)) depth++;
                else if (t.is(TokenType.RBRACE)) depth--;
                pos++;
            }
            braceDepth = bodyDepth;
        }

        // ---- token access ----

        private boolean eof() {
            return pos >= tokens.size();
        }

        private Token peek() {
            return eof() ? null : tokens.get(pos);
        }

        private boolean at(TokenType type) {
            return !eof() && tokens.get(pos).is(type);
        }

        private boolean atWord(String lexeme) {
            return !eof() && lexeme.equals(tokens.get(pos).lexeme);
        }

        private Token advance() {
            Token t = tokens.get(pos++);
            if (t.is(TokenType.LBRACE)) braceDepth++;
            else if (t.is(TokenType.RBRACE) && braceDepth > 0) braceDepth--;
            return t;
        }

        private Token expect(TokenType type) {
            if (at(type)) return advance();
            throw fail(List.of(type));
        }

        private Token expectOneOf(Set<TokenType> types) {
            if (!eof() && types.contains(peek().type)) return advance();
            throw fail(types);
        }

        private ParseException fail(Collection<TokenType> expected) {
            report(expected);
            return new ParseException();
        }

        /** Records an error at the current token that is explained by {@code detail} rather than an expected set. */
        private ParseException failWith(String detail) {
            if (pos != lastErrorIndex) {
                lastErrorIndex = pos;
                Token t = peek();
                errors.add(new SyntaxError(t.lexeme, t.type.name(), t.line, t.column,
                        SourceText.lineText(source, t.offset), List.of(), null, filename, detail));
            }
            return new ParseException();
        }

        /** Records a syntax error at the current token unless one was already recorded there. */
        private void report(Collection<TokenType> expected) {
            if (pos == lastErrorIndex) return;
            lastErrorIndex = pos;

            List<String> described = describe(expected);
            Token t = peek();
            if (t == null) {
                int offset = source.length();
                errors.add(new SyntaxError(null, SyntaxError.EOF, endLine(), SourceText.column(source, offset),
                        SourceText.lineText(source, offset), described, null, filename));
                return;
            }
            String recommendation = hints.recommend(t, expected).orElse(null);
            errors.add(new SyntaxError(t.lexeme, t.type.name(), t.line, t.column,
                    SourceText.lineText(source, t.offset), described, recommendation, filename));
        }

        private int endLine() {
            if (!tokens.isEmpty() && source.isEmpty()) return tokens.get(tokens.size() - 1).line;
            int line = 1;
            for (int i = 0; i < source.length(); i++) {
                if (source.charAt(i) == '\n') line++;
            }
            return line;
        }
    }

    private static final class RelationTail {
        String opLeft;
        String name;
        String opRight;
        Cardinality secondCardinality;
        String target;
    }

    /**
     * Human-readable expected list. Large groups of reserved words collapse into their category
     * ("class stereotype" instead of nineteen stereotypes).
     */
    static List<String> describe(Collection<TokenType> expected) {
        Set<String> out = new LinkedHashSet<>();
        for (TokenType t : expected) {
            TokenCategory c = t.category();
            if (isCollapsible(c) && countInCategory(expected, c) >= 3) {
                out.add(categoryLabel(c));
            } else {
                out.add(t.displayName());
            }
        }
        return List.copyOf(out);
    }

    private static boolean isCollapsible(TokenCategory c) {
        return c == TokenCategory.CLASS_STEREOTYPE
                || c == TokenCategory.RELATION_STEREOTYPE
                || c == TokenCategory.DATA_TYPE
                || c == TokenCategory.META_ATTRIBUTE;
    }

    private static int countInCategory(Collection<TokenType> types, TokenCategory c) {
        int n = 0;
        for (TokenType t : types) {
            if (t.category() == c) n++;
        }
        return n;
    }

    private static String categoryLabel(TokenCategory c) {
        switch (c) {
            case CLASS_STEREOTYPE: return "class stereotype";
            case RELATION_STEREOTYPE: return "relation stereotype";
            case DATA_TYPE: return "primitive type";
            case META_ATTRIBUTE: return "meta attribute";
            default: return c.name().toLowerCase();
        }
    }

    private static Set<TokenType> byCategory(TokenCategory category, TokenType... extra) {
        Set<TokenType> out = EnumSet.noneOf(TokenType.class);
        for (TokenType t : TokenType.values()) {
            if (t.category() == category) out.add(t);
        }
        Collections.addAll(out, extra);
        return Collections.unmodifiableSet(out);
    }

    private static Set<TokenType> union(Set<TokenType> a, Set<TokenType> b) {
        Set<TokenType> out = EnumSet.noneOf(TokenType.class);
        out.addAll(a);
        out.addAll(b);
        return Collections.unmodifiableSet(out);
    }
}
