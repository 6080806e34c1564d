package info.isaksson.erland.tonto.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.tonto.patterns.PatternAnalysis;
import info.isaksson.erland.tonto.patterns.PatternType;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Pattern totals. {@code patternCounts} always has an entry for each of the six pattern types. */
@JsonPropertyOrder({"total_patterns", "complete_patterns", "incomplete_patterns", "pattern_counts"})
public final class AnalysisSummary {

    @JsonProperty("total_patterns")
    public final int totalPatterns;

    @JsonProperty("complete_patterns")
    public final int completePatterns;

    @JsonProperty("incomplete_patterns")
    public final int incompletePatterns;

    @JsonProperty("pattern_counts")
    public final Map<String, Integer> patternCounts;

    AnalysisSummary(int completePatterns, int incompletePatterns, Map<String, Integer> patternCounts) {
        this.totalPatterns = completePatterns + incompletePatterns;
        this.completePatterns = completePatterns;
        this.incompletePatterns = incompletePatterns;
        this.patternCounts = Collections.unmodifiableMap(new LinkedHashMap<>(patternCounts));
    }

    static AnalysisSummary of(PatternAnalysis analysis) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        analysis.counts().forEach((type, n) -> counts.put(type.label(), n));
        return new AnalysisSummary(analysis.complete.size(), analysis.incomplete.size(), counts);
    }

    /** Sums per-file summaries. */
    static AnalysisSummary combine(Collection<AnalysisSummary> summaries) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (PatternType t : PatternType.values()) counts.put(t.label(), 0);
        int complete = 0;
        int incomplete = 0;
        for (AnalysisSummary s : summaries) {
            complete += s.completePatterns;
            incomplete += s.incompletePatterns;
            s.patternCounts.forEach((k, v) -> counts.merge(k, v, Integer::sum));
        }
        return new AnalysisSummary(complete, incomplete, counts);
    }
}
