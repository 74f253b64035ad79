package org.smileyface.botview.compare;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Line-level diff counts based on the longest common subsequence.
 */
final class LineDiff {

    private LineDiff() {
        // No instanciation
    }

    /**
     * Number of lines of {@code a} and of {@code b} that are not part of a longest common
     * subsequence of the two.
     *
     * @return {@code [onlyInA, onlyInB]}
     */
    static int[] uniqueCounts(List<String> a, List<String> b) {
        int lcs = lcsLength(a, b);
        return new int[]{a.size() - lcs, b.size() - lcs};
    }

    static int lcsLength(List<String> a, List<String> b) {
        // map lines to ints so the inner loop compares primitives
        Map<String, Integer> ids = new HashMap<>();
        int[] x = toIds(a, ids);
        int[] y = toIds(b, ids);

        int start = 0;
        int endX = x.length;
        int endY = y.length;
        while (start < endX && start < endY && x[start] == y[start]) start++;
        while (endX > start && endY > start && x[endX - 1] == y[endY - 1]) {
            endX--;
            endY--;
        }
        int common = start + (x.length - endX);

        int n = endX - start;
        int m = endY - start;
        if (n == 0 || m == 0) return common;

        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        for (int i = 1; i <= n; i++) {
            int xi = x[start + i - 1];
            for (int j = 1; j <= m; j++) {
                if (xi == y[start + j - 1]) {
                    curr[j] = prev[j - 1] + 1;
                } else {
                    curr[j] = Math.max(prev[j], curr[j - 1]);
                }
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return common + prev[m];
    }

    private static int[] toIds(List<String> lines, Map<String, Integer> ids) {
        int[] out = new int[lines.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = ids.computeIfAbsent(lines.get(i), k -> ids.size());
        }
        return out;
    }
}
