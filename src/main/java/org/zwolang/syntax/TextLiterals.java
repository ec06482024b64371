package org.zwolang.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversion of quoted string literals to their text.
 */
public final class TextLiterals {
    private TextLiterals() {}

    /**
     * Strip the surrounding quotes and the indentation shared by all non-blank continuation lines.
     * The first line is kept as written and line breaks are preserved.
     */
    public static String unquote(String literal) {
        var body = literal;
        if (body.length() >= 2 && body.startsWith("\"") && body.endsWith("\"")) {
            body = body.substring(1, body.length() - 1);
        }
        return dedent(body.replace("\r\n", "\n"));
    }

    static String dedent(String text) {
        var lines = text.split("\n", -1);
        if (lines.length == 1) {
            return text;
        }

        int common = Integer.MAX_VALUE;
        for (int i = 1; i < lines.length; i++) {
            if (!lines[i].isBlank()) {
                common = Math.min(common, indentation(lines[i]));
            }
        }

        List<String> result = new ArrayList<>(lines.length);
        result.add(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            var line = lines[i];
            result.add(line.isBlank() ? "" : line.substring(Math.min(common, line.length())));
        }
        return String.join("\n", result);
    }

    private static int indentation(String line) {
        int count = 0;
        while (count < line.length() && (line.charAt(count) == ' ' || line.charAt(count) == '\t')) {
            count++;
        }
        return count;
    }
}
