package com.dbbaskette.codeguardian.service.fix;

import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Unified line diff between original and fixed code, using JGit's histogram diff.
 * Output lines carry no line terminators. As in git, a last line without a trailing
 * newline is followed by a "\ No newline at end of file" line. CRLF input is normalized to LF.
 */
@Component
public class DiffComputer {

    static final String ORIGINAL_LABEL = "original";
    static final String FIXED_LABEL = "fixed";
    static final int CONTEXT_LINES = 3;
    static final String NO_NEWLINE_MARKER = "\\ No newline at end of file";

    private final DiffAlgorithm algorithm = DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM);

    public record DiffStats(int additions, int deletions, int totalChanges) {}

    public record DiffResult(List<String> lines, DiffStats stats) {}

    public DiffResult compute(String original, String fixed) {
        List<String> lines = unifiedDiff(original, fixed);
        return new DiffResult(lines, stats(lines));
    }

    public List<String> unifiedDiff(String original, String fixed) {
        RawText a = toRawText(original);
        RawText b = toRawText(fixed);
        EditList edits = algorithm.diff(RawTextComparator.DEFAULT, a, b);
        if (edits.isEmpty()) {
            return List.of();
        }

        List<String> out = new ArrayList<>();
        out.add("--- " + ORIGINAL_LABEL);
        out.add("+++ " + FIXED_LABEL);

        int groupStart = 0;
        for (int i = 1; i <= edits.size(); i++) {
            boolean split = i == edits.size()
                    || edits.get(i).getBeginA() - edits.get(i - 1).getEndA() > 2 * CONTEXT_LINES;
            if (split) {
                writeHunk(out, a, b, edits.subList(groupStart, i));
                groupStart = i;
            }
        }
        return List.copyOf(out);
    }

    public DiffStats stats(List<String> diffLines) {
        int additions = 0;
        int deletions = 0;
        for (String line : diffLines) {
            if (line.startsWith("+") && !line.startsWith("+++")) {
                additions++;
            } else if (line.startsWith("-") && !line.startsWith("---")) {
                deletions++;
            }
        }
        return new DiffStats(additions, deletions, additions + deletions);
    }

    private void writeHunk(List<String> out, RawText a, RawText b, List<Edit> group) {
        Edit first = group.get(0);
        Edit last = group.get(group.size() - 1);

        int aStart = Math.max(0, first.getBeginA() - CONTEXT_LINES);
        int aEnd = Math.min(a.size(), last.getEndA() + CONTEXT_LINES);
        int bStart = first.getBeginB() - (first.getBeginA() - aStart);
        int bEnd = last.getEndB() + (aEnd - last.getEndA());

        out.add("@@ -" + range(aStart, aEnd) + " +" + range(bStart, bEnd) + " @@");

        int cursor = aStart;
        for (Edit edit : group) {
            for (; cursor < edit.getBeginA(); cursor++) {
                out.add(" " + a.getString(cursor));
                markMissingNewline(out, a, cursor);
            }
            for (int i = edit.getBeginA(); i < edit.getEndA(); i++) {
                out.add("-" + a.getString(i));
                markMissingNewline(out, a, i);
            }
            for (int i = edit.getBeginB(); i < edit.getEndB(); i++) {
                out.add("+" + b.getString(i));
                markMissingNewline(out, b, i);
            }
            cursor = edit.getEndA();
        }
        for (; cursor < aEnd; cursor++) {
            out.add(" " + a.getString(cursor));
            markMissingNewline(out, a, cursor);
        }
    }

    private static void markMissingNewline(List<String> out, RawText text, int index) {
        if (index == text.size() - 1 && text.isMissingNewlineAtEnd()) {
            out.add(NO_NEWLINE_MARKER);
        }
    }

    // Same range notation as GNU diff: "start,length", or just "start" for one line
    private static String range(int start, int end) {
        int length = end - start;
        if (length == 1) {
            return String.valueOf(start + 1);
        }
        if (length == 0) {
            return start + ",0";
        }
        return (start + 1) + "," + length;
    }

    private static RawText toRawText(String text) {
        String normalized = text == null ? "" : text.replace("\r\n", "\n");
        return new RawText(normalized.getBytes(StandardCharsets.UTF_8));
    }
}
