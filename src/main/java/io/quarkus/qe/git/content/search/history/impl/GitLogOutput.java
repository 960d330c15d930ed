package io.quarkus.qe.git.content.search.history.impl;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code git log --name-only} output produced with {@link #FORMAT}.
 * <p>
 * Each commit starts with a line holding {@link #COMMIT_MARKER} followed by the hash. Git quotes control
 * characters in paths, so no path line can start with the marker. Paths git still quotes (control
 * characters, double quotes, backslashes) are unquoted.
 */
public final class GitLogOutput {

    public static final String COMMIT_MARKER = "\u0001";
    public static final String FORMAT = "--format=%x01%H";

    private GitLogOutput() {
    }

    /**
     * A commit and the paths listed for it, in listing order.
     */
    public record Entry(String hash, List<String> paths) {
    }

    public static List<Entry> parse(String output) {
        List<Entry> entries = new ArrayList<>();
        String currentHash = null;
        List<String> currentPaths = new ArrayList<>();

        for (String line : output.split("\n")) {
            if (line.startsWith(COMMIT_MARKER)) {
                if (currentHash != null) {
                    entries.add(new Entry(currentHash, List.copyOf(currentPaths)));
                }
                currentHash = line.substring(COMMIT_MARKER.length()).trim();
                currentPaths = new ArrayList<>();
            } else if (!line.isEmpty() && currentHash != null) {
                currentPaths.add(unquote(line));
            }
        }
        if (currentHash != null) {
            entries.add(new Entry(currentHash, List.copyOf(currentPaths)));
        }
        return entries;
    }

    /**
     * Reverse git's C-style path quoting, e.g. {@code "tab\there"} or {@code "caf\303\251"}. Unquoted paths are
     * returned unchanged.
     */
    static String unquote(String path) {
        if (path.length() < 2 || path.charAt(0) != '"' || path.charAt(path.length() - 1) != '"') {
            return path;
        }

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        String quoted = path.substring(1, path.length() - 1);
        int i = 0;
        while (i < quoted.length()) {
            int codePoint = quoted.codePointAt(i);
            if (codePoint != '\\' || i + 1 == quoted.length()) {
                byte[] encoded = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
                bytes.write(encoded, 0, encoded.length);
                i += Character.charCount(codePoint);
                continue;
            }

            char escaped = quoted.charAt(i + 1);
            if (isOctalDigit(escaped) && i + 3 < quoted.length() && isOctalDigit(quoted.charAt(i + 2))
                    && isOctalDigit(quoted.charAt(i + 3))) {
                bytes.write(Integer.parseInt(quoted.substring(i + 1, i + 4), 8));
                i += 4;
                continue;
            }
            bytes.write(unescape(escaped));
            i += 2;
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private static int unescape(char escaped) {
        switch (escaped) {
            case 'a':
                return 0x07;
            case 'b':
                return '\b';
            case 't':
                return '\t';
            case 'n':
                return '\n';
            case 'v':
                return 0x0B;
            case 'f':
                return '\f';
            case 'r':
                return '\r';
            default:
                return escaped;
        }
    }

    private static boolean isOctalDigit(char c) {
        return c >= '0' && c <= '7';
    }
}
