package info.isaksson.erland.tonto.text;

import java.util.Collection;
import java.util.Optional;

/** Levenshtein distance with an upper bound, used for "did you mean" hints. */
public final class EditDistance {
    private EditDistance() {}

    /** Plain Levenshtein distance (insert, delete, substitute; all cost 1). */
    public static int distance(String a, String b) {
        if (a == null) a = "";
        if (b == null) b = "";
        int[] prev = new int[b.length() + 1];
        int[] cur = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            cur[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        return prev[b.length()];
    }

    /**
     * Closest candidate within {@code maxDistance}, excluding exact matches.
     *
     * <p>Ties go to the candidate that comes first in iteration order.</p>
     */
    public static Optional<String> closest(String word, Collection<String> candidates, int maxDistance) {
        if (word == null || candidates == null) return Optional.empty();
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String c : candidates) {
            if (c == null || c.equals(word)) continue;
            if (Math.abs(c.length() - word.length()) > maxDistance) continue;
            int d = distance(word, c);
            if (d <= maxDistance && d < bestDistance) {
                best = c;
                bestDistance = d;
            }
        }
        return Optional.ofNullable(best);
    }
}
