package info.isaksson.erland.tonto.core;

/**
 * Options for {@link AnalysisService}.
 *
 * <p>Plain mutable fields with defaults; a {@code null} options argument means "all defaults".</p>
 */
public final class AnalysisOptions {

    /** Label used in diagnostics when the caller passes no filename. */
    public String filename = "<input>";

    /**
     * Whether to build the symbol table and detect patterns when lexical or syntax errors were found.
     *
     * <p>The parser drops declarations it cannot read, so analysis of the remainder is usually
     * still meaningful. When {@code false}, such results carry empty symbols and patterns.</p>
     */
    public boolean analyzeOnSyntaxErrors = true;

    /** Whether to run the model-level checks (duplicates, cardinalities, genset hygiene, ...). */
    public boolean includeModelChecks = true;

    /** Directory mode: analyze files in parallel. Output order does not depend on this. */
    public boolean parallel = true;
}
