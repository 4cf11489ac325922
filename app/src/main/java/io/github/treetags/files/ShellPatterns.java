package io.github.treetags.files;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Shell-style exclude patterns. A pattern excludes every path it matches anywhere, it is not anchored. */
public final class ShellPatterns {
    private ShellPatterns() {}

    /** {@code *} any run, {@code ?} one character, {@code [...]} a class, {@code \x} a literal x. */
    public static Pattern toRegex(String glob) {
        var sb = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                case '[' -> {
                    int close = glob.indexOf(']', i + 2);
                    if (close < 0) {
                        sb.append("\\[");
                    } else {
                        String body = glob.substring(i + 1, close);
                        if (body.startsWith("!")) {
                            body = "^" + body.substring(1);
                        }
                        sb.append('[').append(body.replace("\\", "\\\\").replace("[", "\\[")).append(']');
                        i = close;
                    }
                }
                case '\\' -> {
                    if (i + 1 < glob.length()) {
                        sb.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                    } else {
                        sb.append("\\\\");
                    }
                }
                default -> {
                    if ("().+^$|{}".indexOf(c) >= 0) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
            }
        }
        return Pattern.compile(sb.toString());
    }

    /**
     * Compiles exclude options. An entry {@code @file} stands for the patterns listed in that file, one per line;
     * blank lines and lines starting with {@code #} are ignored.
     */
    public static List<Pattern> compile(List<String> excludes, Path workingDir) throws IOException {
        var patterns = new ArrayList<Pattern>();
        for (String exclude : excludes) {
            if (exclude.startsWith("@") && exclude.length() > 1) {
                Path listFile = workingDir.resolve(exclude.substring(1));
                for (String line : Files.readAllLines(listFile, StandardCharsets.UTF_8)) {
                    String trimmed = line.strip();
                    if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                        patterns.add(toRegex(trimmed));
                    }
                }
            } else if (!exclude.isEmpty()) {
                patterns.add(toRegex(exclude));
            }
        }
        return patterns;
    }

    public static boolean matchesAny(List<Pattern> patterns, String path) {
        for (Pattern p : patterns) {
            if (p.matcher(path).find()) {
                return true;
            }
        }
        return false;
    }
}
