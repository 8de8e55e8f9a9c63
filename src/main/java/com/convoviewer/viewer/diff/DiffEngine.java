package com.convoviewer.viewer.diff;

import com.convoviewer.viewer.model.DiffLine;
import com.convoviewer.viewer.model.DiffResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Line-based diff for edit tool calls.
 *
 * Uses Myers' O(ND) shortest edit script on the region left after trimming the
 * common prefix and suffix, so the output is minimal and deterministic. Changed
 * regions above {@code maxLines} get a coarse block diff instead, and output
 * above {@code maxOutputLines} is cut and flagged.
 */
@Slf4j
public class DiffEngine {

    private final int maxLines;
    private final int maxOutputLines;

    public DiffEngine(int maxLines, int maxOutputLines) {
        this.maxLines = maxLines;
        this.maxOutputLines = maxOutputLines;
    }

    public DiffResult diff(String before, String after) {
        List<String> a = splitLines(before);
        List<String> b = splitLines(after);

        int prefix = 0;
        while (prefix < a.size() && prefix < b.size() && a.get(prefix).equals(b.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < a.size() - prefix && suffix < b.size() - prefix
                && a.get(a.size() - 1 - suffix).equals(b.get(b.size() - 1 - suffix))) {
            suffix++;
        }

        List<String> midA = a.subList(prefix, a.size() - suffix);
        List<String> midB = b.subList(prefix, b.size() - suffix);

        List<Op> ops = new ArrayList<>(a.size() + b.size());
        for (int i = 0; i < prefix; i++) {
            ops.add(new Op(DiffLine.Kind.CONTEXT, a.get(i)));
        }

        boolean coarse = midA.size() + midB.size() > maxLines;
        if (coarse) {
            log.debug("Changed region of {} lines exceeds {}, using block diff", midA.size() + midB.size(), maxLines);
            midA.forEach(line -> ops.add(new Op(DiffLine.Kind.REMOVED, line)));
            midB.forEach(line -> ops.add(new Op(DiffLine.Kind.ADDED, line)));
        } else {
            ops.addAll(myers(midA, midB));
        }

        for (int i = a.size() - suffix; i < a.size(); i++) {
            ops.add(new Op(DiffLine.Kind.CONTEXT, a.get(i)));
        }

        return number(ops, coarse);
    }

    /**
     * Split text into lines; a trailing newline does not start a new line and CRLF is treated as LF.
     */
    static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        String[] parts = text.split("\r?\n", -1);
        int count = parts.length;
        if (parts[count - 1].isEmpty()) {
            count--;
        }
        return Arrays.asList(parts).subList(0, count);
    }

    private List<Op> myers(List<String> a, List<String> b) {
        int n = a.size();
        int m = b.size();
        int max = n + m;
        if (max == 0) {
            return Collections.emptyList();
        }
        int offset = max;
        int[] v = new int[2 * max + 2];
        List<int[]> trace = new ArrayList<>();

        search:
        for (int d = 0; d <= max; d++) {
            trace.add(v.clone());
            for (int k = -d; k <= d; k += 2) {
                int x;
                if (k == -d || (k != d && v[offset + k - 1] < v[offset + k + 1])) {
                    x = v[offset + k + 1];
                } else {
                    x = v[offset + k - 1] + 1;
                }
                int y = x - k;
                while (x < n && y < m && a.get(x).equals(b.get(y))) {
                    x++;
                    y++;
                }
                v[offset + k] = x;
                if (x >= n && y >= m) {
                    break search;
                }
            }
        }

        List<Op> reversed = new ArrayList<>(n + m);
        int x = n;
        int y = m;
        for (int d = trace.size() - 1; d >= 0; d--) {
            int[] vd = trace.get(d);
            int k = x - y;
            int prevK;
            if (k == -d || (k != d && vd[offset + k - 1] < vd[offset + k + 1])) {
                prevK = k + 1;
            } else {
                prevK = k - 1;
            }
            int prevX = vd[offset + prevK];
            int prevY = prevX - prevK;

            while (x > prevX && y > prevY) {
                reversed.add(new Op(DiffLine.Kind.CONTEXT, a.get(x - 1)));
                x--;
                y--;
            }
            if (d > 0) {
                if (x == prevX) {
                    reversed.add(new Op(DiffLine.Kind.ADDED, b.get(y - 1)));
                } else {
                    reversed.add(new Op(DiffLine.Kind.REMOVED, a.get(x - 1)));
                }
            }
            x = prevX;
            y = prevY;
        }
        Collections.reverse(reversed);
        return reversed;
    }

    private DiffResult number(List<Op> ops, boolean coarse) {
        boolean truncated = ops.size() > maxOutputLines;
        int limit = truncated ? maxOutputLines : ops.size();
        List<DiffLine> lines = new ArrayList<>(limit);
        int oldNo = 1;
        int newNo = 1;
        for (int i = 0; i < limit; i++) {
            Op op = ops.get(i);
            switch (op.kind) {
                case CONTEXT:
                    lines.add(new DiffLine(op.kind, oldNo++, newNo++, op.text));
                    break;
                case REMOVED:
                    lines.add(new DiffLine(op.kind, oldNo++, null, op.text));
                    break;
                default:
                    lines.add(new DiffLine(op.kind, null, newNo++, op.text));
                    break;
            }
        }
        if (truncated) {
            log.debug("Diff output cut at {} of {} lines", maxOutputLines, ops.size());
        }
        return DiffResult.builder()
                .lines(Collections.unmodifiableList(lines))
                .truncated(truncated)
                .coarse(coarse)
                .build();
    }

    private static final class Op {
        final DiffLine.Kind kind;
        final String text;

        Op(DiffLine.Kind kind, String text) {
            this.kind = kind;
            this.text = text;
        }
    }
}
