package io.github.drompincen.strata.tools;

import io.github.drompincen.strata.protocol.api.DiffLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts file change blocks from assistant text so they can be rendered separately.
 * <p>
 * A block is a header line {@code Action(path)}, an optional summary line containing
 * {@code ⎿}, then diff lines of the form {@code "   38 -  code"}, {@code "   38 +  code"}
 * or {@code "   38    code"}, with {@code ...} marking skipped lines. A blank line or the
 * next header ends the block.
 */
public final class FileChangeParser {

    public static final char PLACEHOLDER_MARK = '\uFFFC';

    private static final char SUMMARY_MARK = '\u23BF';

    private static final Map<String, FileChange.Action> ACTIONS = Map.of(
            "Update", FileChange.Action.UPDATE,
            "Write", FileChange.Action.WRITE,
            "Read", FileChange.Action.READ,
            "Create", FileChange.Action.CREATE,
            "Delete", FileChange.Action.DELETE);

    private static final Pattern HEADER = Pattern.compile("^(Update|Write|Read|Create|Delete)\\((.+)\\)$");
    private static final Pattern DIFF_LINE = Pattern.compile("^[ \\t]+(\\d+) (.*)$");

    /** Text with every block replaced by a placeholder, and the blocks in order. */
    public record StrippedText(String text, List<FileChange> changes) {}

    private FileChangeParser() {}

    public static List<FileChange> parse(String text) {
        return strip(text).changes();
    }

    /**
     * Replaces each block by {@code ￼FILECHANGE:n￼}, where n is the index of the
     * block in the returned change list.
     */
    public static StrippedText strip(String text) {
        String[] lines = text.split("\n", -1);
        List<FileChange> changes = new ArrayList<>();
        List<String> output = new ArrayList<>();

        int i = 0;
        while (i < lines.length) {
            int consumed = tryParseBlock(lines, i, changes);
            if (consumed > 0) {
                output.add(placeholder(changes.size() - 1));
                i += consumed;
            } else {
                output.add(lines[i]);
                i++;
            }
        }
        return new StrippedText(String.join("\n", output), changes);
    }

    public static String placeholder(int index) {
        return PLACEHOLDER_MARK + "FILECHANGE:" + index + PLACEHOLDER_MARK;
    }

    private static int tryParseBlock(String[] lines, int start, List<FileChange> changes) {
        Matcher header = HEADER.matcher(lines[start].strip());
        if (!header.matches()) return 0;

        int consumed = 1;
        String summary = "";
        if (start + consumed < lines.length) {
            String next = lines[start + consumed];
            int mark = next.indexOf(SUMMARY_MARK);
            if (mark >= 0) {
                summary = next.substring(mark + 1).strip();
                consumed++;
            }
        }

        List<DiffLine> diff = new ArrayList<>();
        while (start + consumed < lines.length) {
            String line = lines[start + consumed];
            String trimmed = line.strip();
            if (trimmed.isEmpty() || HEADER.matcher(trimmed).matches()) break;

            if (trimmed.equals("...")) {
                diff.add(DiffLine.ellipsis());
                consumed++;
                continue;
            }
            DiffLine parsed = parseDiffLine(line);
            if (parsed == null) break;
            diff.add(parsed);
            consumed++;
        }

        if (start + consumed < lines.length && lines[start + consumed].isBlank()) {
            consumed++;
        }

        changes.add(new FileChange(ACTIONS.get(header.group(1)), header.group(2), summary, diff));
        return consumed;
    }

    static DiffLine parseDiffLine(String line) {
        Matcher m = DIFF_LINE.matcher(line);
        if (!m.matches()) return null;

        int number;
        try {
            number = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
        String rest = m.group(2);
        if (rest.startsWith("-")) {
            return new DiffLine(DiffLine.Kind.REMOVAL, trimSpaces(rest.substring(1)), number);
        }
        if (rest.startsWith("+")) {
            return new DiffLine(DiffLine.Kind.ADDITION, trimSpaces(rest.substring(1)), number);
        }
        return new DiffLine(DiffLine.Kind.CONTEXT, rest, number);
    }

    private static String trimSpaces(String s) {
        int begin = 0;
        int end = s.length();
        while (begin < end && s.charAt(begin) == ' ') begin++;
        while (end > begin && s.charAt(end - 1) == ' ') end--;
        return s.substring(begin, end);
    }
}
