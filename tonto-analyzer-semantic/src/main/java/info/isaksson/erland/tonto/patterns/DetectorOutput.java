package info.isaksson.erland.tonto.patterns;

import java.util.List;

/**
 * What one detector found: patterns, plus standalone findings about specializations too small to
 * form a pattern.
 */
public final class DetectorOutput {
    public final List<Pattern> patterns;
    public final List<PatternFinding> standalone;

    public DetectorOutput(List<Pattern> patterns, List<PatternFinding> standalone) {
        this.patterns = patterns == null ? List.of() : List.copyOf(patterns);
        this.standalone = standalone == null ? List.of() : List.copyOf(standalone);
    }
}
