package info.isaksson.erland.tonto.patterns;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Patterns of one model split by status, plus the findings that belong to no pattern. */
public final class PatternAnalysis {
    public final List<Pattern> complete;
    public final List<Pattern> incomplete;
    public final List<PatternFinding> standalone;

    public PatternAnalysis(List<Pattern> complete, List<Pattern> incomplete, List<PatternFinding> standalone) {
        this.complete = complete == null ? List.of() : List.copyOf(complete);
        this.incomplete = incomplete == null ? List.of() : List.copyOf(incomplete);
        this.standalone = standalone == null ? List.of() : List.copyOf(standalone);
    }

    public static PatternAnalysis empty() {
        return new PatternAnalysis(List.of(), List.of(), List.of());
    }

    /** All patterns, complete first, each group in detection order. */
    public List<Pattern> all() {
        List<Pattern> out = new ArrayList<>(complete);
        out.addAll(incomplete);
        return out;
    }

    public int total() {
        return complete.size() + incomplete.size();
    }

    /** Number of patterns per type; every type is present, with zero when none was found. */
    public Map<PatternType, Integer> counts() {
        Map<PatternType, Integer> out = new EnumMap<>(PatternType.class);
        for (PatternType t : PatternType.values()) out.put(t, 0);
        for (Pattern p : complete) out.merge(p.patternType, 1, Integer::sum);
        for (Pattern p : incomplete) out.merge(p.patternType, 1, Integer::sum);
        return Collections.unmodifiableMap(out);
    }

    /** Every pattern violation tagged with its pattern, followed by the standalone findings. */
    public List<PatternFinding> findings() {
        List<PatternFinding> out = new ArrayList<>();
        for (Pattern p : all()) {
            p.violations.forEach(v -> out.add(new PatternFinding(p.patternType, p.anchorClass, v)));
        }
        out.addAll(standalone);
        return out;
    }
}
