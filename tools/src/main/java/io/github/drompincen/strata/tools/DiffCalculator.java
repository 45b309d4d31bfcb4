package io.github.drompincen.strata.tools;

import io.github.drompincen.strata.protocol.api.DiffLine;

import java.util.ArrayList;
import java.util.List;

public final class DiffCalculator {

    private DiffCalculator() {}

    /**
     * Renders a string replacement as a diff: every line of {@code oldString} as a removal,
     * then every line of {@code newString} as an addition. Both sides are numbered from 1,
     * relative to the replaced fragment. An empty side contributes no lines.
     */
    public static List<DiffLine> fromEdit(String oldString, String newString) {
        List<DiffLine> lines = new ArrayList<>();
        appendLines(lines, oldString, DiffLine.Kind.REMOVAL);
        appendLines(lines, newString, DiffLine.Kind.ADDITION);
        return lines;
    }

    private static void appendLines(List<DiffLine> out, String text, DiffLine.Kind kind) {
        if (text == null || text.isEmpty()) return;
        String[] parts = text.split("\n", -1);
        for (int i = 0; i < parts.length; i++) {
            out.add(new DiffLine(kind, parts[i], i + 1));
        }
    }
}
