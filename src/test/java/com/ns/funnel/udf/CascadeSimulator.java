package com.ns.funnel.udf;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates the sequential cascade of window levels row by row, with the same frames and
 * NULL comparison rules the generated query relies on. Events must be sorted by
 * timestamp with no two sharing one.
 */
final class CascadeSimulator {
    private final List<String> series;
    private final long windowSeconds;

    CascadeSimulator(List<String> series, long windowSeconds) {
        this.series = series;
        this.windowSeconds = windowSeconds;
    }

    /** Steps reached by the actor, 0 when it never did step 0. */
    int stepsReached(List<Long> timestamps, List<String> names) {
        int n = series.size();
        int rows = timestamps.size();
        Long[][] latest = new Long[rows][n];
        for (int r = 0; r < rows; r++) {
            for (int i = 0; i < n; i++) {
                latest[r][i] = series.get(i).equals(names.get(r)) ? timestamps.get(r) : null;
            }
        }

        latest = partition(latest, 1);
        for (int level = n - 1; level >= 2; level--) {
            latest = compare(latest, level);
            latest = partition(latest, level);
        }

        int best = 0;
        for (int r = 0; r < rows; r++) {
            if (series.get(0).equals(names.get(r))) {
                best = Math.max(best, sortingCondition(latest[r]));
            }
        }
        return best;
    }

    private boolean repeatsPrevious(int i) {
        return i > 0 && series.get(i).equals(series.get(i - 1));
    }

    /** Steps from {@code level} on take the minimum over the current and later rows. */
    private Long[][] partition(Long[][] input, int level) {
        int rows = input.length;
        int n = series.size();
        Long[][] output = new Long[rows][n];
        for (int r = 0; r < rows; r++) {
            for (int i = 0; i < n; i++) {
                if (i < level) {
                    output[r][i] = input[r][i];
                    continue;
                }
                int first = repeatsPrevious(i) ? r + 1 : r;
                Long min = null;
                for (int j = first; j < rows; j++) {
                    if (input[j][i] != null && (min == null || input[j][i] < min)) {
                        min = input[j][i];
                    }
                }
                output[r][i] = min;
            }
        }
        return output;
    }

    private Long[][] compare(Long[][] input, int level) {
        int rows = input.length;
        int n = series.size();
        Long[][] output = new Long[rows][n];
        for (int r = 0; r < rows; r++) {
            Long previous = input[r][level - 1];
            for (int i = 0; i < n; i++) {
                output[r][i] = input[r][i];
                if (i < level) {
                    continue;
                }
                for (int j = level; j <= i; j++) {
                    if (previous != null && input[r][j] != null && input[r][j] < previous) {
                        output[r][i] = null;
                        break;
                    }
                }
            }
        }
        return output;
    }

    private int sortingCondition(Long[] row) {
        for (int current = series.size(); current >= 2; current--) {
            boolean ordered = true;
            for (int i = 1; i < current && ordered; i++) {
                Long previous = row[i - 1];
                Long latest = row[i];
                ordered = previous != null && latest != null
                    && (repeatsPrevious(i) ? previous < latest : previous <= latest)
                    && latest <= row[0] + windowSeconds;
            }
            if (ordered) {
                return current;
            }
        }
        return 1;
    }

    List<Integer> codes(String name) {
        List<Integer> codes = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            if (series.get(i).equals(name)) {
                codes.add(i + 1);
            }
        }
        return codes;
    }
}
