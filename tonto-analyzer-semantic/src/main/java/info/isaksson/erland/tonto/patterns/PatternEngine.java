package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.symbols.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the pattern detectors over a symbol table in a fixed order: Subkind, Role, Phase, Relator,
 * Mode, RoleMixin.
 */
public final class PatternEngine {

    private static final Logger log = LoggerFactory.getLogger(PatternEngine.class);

    private final List<PatternDetector> detectors;

    public PatternEngine() {
        this(defaultDetectors());
    }

    public PatternEngine(List<PatternDetector> detectors) {
        if (detectors == null) throw new IllegalArgumentException("detectors must not be null");
        this.detectors = List.copyOf(detectors);
    }

    public static List<PatternDetector> defaultDetectors() {
        return List.of(
                new SubkindPatternDetector(),
                new RolePatternDetector(),
                new PhasePatternDetector(),
                new RelatorPatternDetector(),
                new ModePatternDetector(),
                new RoleMixinPatternDetector());
    }

    public List<PatternDetector> detectors() {
        return detectors;
    }

    public PatternAnalysis analyze(SymbolTable table) {
        if (table == null) throw new IllegalArgumentException("table must not be null");
        List<Pattern> complete = new ArrayList<>();
        List<Pattern> incomplete = new ArrayList<>();
        List<PatternFinding> standalone = new ArrayList<>();

        for (PatternDetector d : detectors) {
            DetectorOutput out = d.detect(table);
            for (Pattern p : out.patterns) {
                if (p.isComplete()) {
                    complete.add(p);
                } else {
                    incomplete.add(p);
                }
            }
            standalone.addAll(out.standalone);
            log.debug("{}: {} pattern(s), {} standalone finding(s)", d.type(), out.patterns.size(), out.standalone.size());
        }
        return new PatternAnalysis(complete, incomplete, standalone);
    }
}
