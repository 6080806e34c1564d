package info.isaksson.erland.tonto.core;

import info.isaksson.erland.tonto.ast.ImportDecl;
import info.isaksson.erland.tonto.checks.ModelChecker;
import info.isaksson.erland.tonto.checks.Violation;
import info.isaksson.erland.tonto.diagnostics.SourceDiagnostic;
import info.isaksson.erland.tonto.io.SourceScanner;
import info.isaksson.erland.tonto.parser.ParseResult;
import info.isaksson.erland.tonto.parser.Parser;
import info.isaksson.erland.tonto.patterns.PatternAnalysis;
import info.isaksson.erland.tonto.patterns.PatternEngine;
import info.isaksson.erland.tonto.patterns.PatternFinding;
import info.isaksson.erland.tonto.symbols.SymbolTable;
import info.isaksson.erland.tonto.symbols.SymbolTableBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Entry point for analyzing Tonto sources: lexing, parsing, symbol table, model checks and pattern
 * detection, assembled into one {@link AnalysisResult}.
 *
 * <p>Malformed source never makes this class throw; problems are reported in the result. The
 * service holds no per-call state and may be shared between threads.</p>
 */
public final class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final PatternEngine engine;
    private final ModelChecker checker;

    public AnalysisService() {
        this(new PatternEngine(), new ModelChecker());
    }

    public AnalysisService(PatternEngine engine, ModelChecker checker) {
        if (engine == null) throw new IllegalArgumentException("engine must not be null");
        if (checker == null) throw new IllegalArgumentException("checker must not be null");
        this.engine = engine;
        this.checker = checker;
    }

    /** Analyze source text. {@code filename} is only used as a label and may be null. */
    public AnalysisResult analyze(String text, String filename, AnalysisOptions options) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        if (options == null) options = new AnalysisOptions();
        String name = filename == null || filename.isBlank() ? options.filename : filename;

        ParseResult parsed = new Parser().parse(text, name);
        List<SourceDiagnostic> diagnostics = new ArrayList<>();
        diagnostics.addAll(parsed.lexicalErrors);
        diagnostics.addAll(parsed.syntaxErrors);
        log.debug("{}: {} tokens, {} declarations, {} diagnostics",
                name, parsed.tokens.size(), parsed.file.content.size(), diagnostics.size());

        SymbolTable table = new SymbolTable();
        PatternAnalysis patterns = PatternAnalysis.empty();
        List<Violation> modelIssues = List.of();
        if (diagnostics.isEmpty() || options.analyzeOnSyntaxErrors) {
            SymbolTableBuilder.populate(table, parsed.file);
            if (options.includeModelChecks) modelIssues = checker.check(table, parsed.file);
            patterns = engine.analyze(table);
            log.debug("{}: {} complete, {} incomplete patterns, {} model issues",
                    name, patterns.complete.size(), patterns.incomplete.size(), modelIssues.size());
        } else {
            log.debug("{}: semantic analysis skipped after syntax errors", name);
        }

        Set<AnalysisError> errors = new LinkedHashSet<>();
        for (SourceDiagnostic d : diagnostics) errors.add(AnalysisError.of(d));
        for (Violation v : modelIssues) {
            if (v.isError()) errors.add(AnalysisError.of(v));
        }
        List<PatternFinding> findings = patterns.findings();
        for (PatternFinding f : findings) {
            if (f.violation.isError()) errors.add(AnalysisError.of(f.violation));
        }

        List<AnalysisWarning> warnings = new ArrayList<>();
        for (PatternFinding f : findings) warnings.add(AnalysisWarning.of(f));
        for (Violation v : modelIssues) {
            if (!v.isError()) warnings.add(AnalysisWarning.of(v));
        }

        List<String> imports = new ArrayList<>();
        for (ImportDecl i : parsed.file.imports) imports.add(i.moduleName);

        return new AnalysisResult(
                name,
                parsed.file.packageName(),
                imports,
                SymbolsView.of(table),
                patterns.complete,
                patterns.incomplete,
                new ArrayList<>(errors),
                warnings,
                diagnostics,
                AnalysisSummary.of(patterns),
                parsed.tokens,
                parsed.file,
                table);
    }

    /** Analyze one file (UTF-8). The result is labeled with the file name as given. */
    public AnalysisResult analyzeFile(Path file, AnalysisOptions options) throws IOException {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        String text = Files.readString(file, StandardCharsets.UTF_8);
        return analyze(text, file.toString(), options);
    }

    /**
     * Analyze every {@code .tonto} file under {@code root}. Results are labeled with paths relative
     * to {@code root} and listed in that order.
     */
    public WorkspaceAnalysis analyzeDirectory(Path root, List<String> excludeGlobs, AnalysisOptions options) throws IOException {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        if (options == null) options = new AnalysisOptions();
        final AnalysisOptions opts = options;

        List<Path> files = SourceScanner.scan(root, excludeGlobs == null ? List.of() : excludeGlobs);
        log.debug("{}: {} source file(s)", root, files.size());

        Stream<Path> stream = opts.parallel ? files.parallelStream() : files.stream();
        List<AnalysisResult> results;
        try {
            results = stream
                    .map(p -> analyzeRelative(root, p, opts))
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return new WorkspaceAnalysis(root.toString().replace("\\", "/"), results);
    }

    private AnalysisResult analyzeRelative(Path root, Path file, AnalysisOptions options) {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            return analyze(text, SourceScanner.relativeName(root, file), options);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
