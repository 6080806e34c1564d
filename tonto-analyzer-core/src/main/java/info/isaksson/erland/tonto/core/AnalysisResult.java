package info.isaksson.erland.tonto.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.tonto.ast.TontoFile;
import info.isaksson.erland.tonto.diagnostics.SourceDiagnostic;
import info.isaksson.erland.tonto.lexer.Token;
import info.isaksson.erland.tonto.patterns.Pattern;
import info.isaksson.erland.tonto.symbols.SymbolTable;

import java.util.List;

/**
 * Everything known about one analyzed source: diagnostics, symbols, patterns and their summary.
 *
 * <p>Tokens, the AST and the live symbol table are kept for programmatic callers but are not part
 * of the JSON form.</p>
 */
@JsonPropertyOrder({"filename", "package", "imports", "symbols", "patterns", "incomplete_patterns", "errors",
        "warnings", "diagnostics", "summary"})
public final class AnalysisResult {
    public final String filename;

    /** Declared package; {@code null} when the package declaration is missing. */
    @JsonProperty("package")
    public final String packageName;

    public final List<String> imports;
    public final SymbolsView symbols;

    /** Complete patterns. */
    public final List<Pattern> patterns;

    @JsonProperty("incomplete_patterns")
    public final List<Pattern> incompletePatterns;

    public final List<AnalysisError> errors;
    public final List<AnalysisWarning> warnings;

    /** Lexical and syntax errors with their source context. */
    public final List<SourceDiagnostic> diagnostics;

    public final AnalysisSummary summary;

    @JsonIgnore
    public final List<Token> tokens;

    @JsonIgnore
    public final TontoFile ast;

    @JsonIgnore
    public final SymbolTable symbolTable;

    AnalysisResult(
            String filename,
            String packageName,
            List<String> imports,
            SymbolsView symbols,
            List<Pattern> patterns,
            List<Pattern> incompletePatterns,
            List<AnalysisError> errors,
            List<AnalysisWarning> warnings,
            List<SourceDiagnostic> diagnostics,
            AnalysisSummary summary,
            List<Token> tokens,
            TontoFile ast,
            SymbolTable symbolTable
    ) {
        this.filename = filename;
        this.packageName = packageName;
        this.imports = imports == null ? List.of() : List.copyOf(imports);
        this.symbols = symbols;
        this.patterns = patterns == null ? List.of() : List.copyOf(patterns);
        this.incompletePatterns = incompletePatterns == null ? List.of() : List.copyOf(incompletePatterns);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        this.summary = summary;
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
        this.ast = ast;
        this.symbolTable = symbolTable;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** True when lexing or parsing failed somewhere, regardless of model errors. */
    public boolean hasSyntaxErrors() {
        return !diagnostics.isEmpty();
    }

    @Override
    public String toString() {
        return "AnalysisResult{" + filename + ", patterns=" + summary.totalPatterns + ", errors=" + errors.size()
                + ", warnings=" + warnings.size() + "}";
    }
}
