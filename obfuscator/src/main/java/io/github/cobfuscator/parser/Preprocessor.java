package io.github.cobfuscator.parser;

import io.github.cobfuscator.UnsupportedConstructException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal directive handling: includes of the built-in header set and object-like
 * {@code #define}s. Directive lines are blanked so token locations keep their original lines.
 */
public class Preprocessor {

    private static final Pattern INCLUDE = Pattern.compile("#\\s*include\\s*<([A-Za-z0-9_./]+)>\\s*");
    private static final Pattern DEFINE = Pattern.compile("#\\s*define\\s+([A-Za-z_][A-Za-z0-9_]*)(\\s+(.*))?");
    private static final Pattern FUNCTION_LIKE = Pattern.compile("#\\s*define\\s+[A-Za-z_][A-Za-z0-9_]*\\(.*");

    public static final class Result {
        private final String text;
        private final List<String> includes;
        private final Map<String, String> macros;

        Result(String text, List<String> includes, Map<String, String> macros) {
            this.text = text;
            this.includes = Collections.unmodifiableList(includes);
            this.macros = Collections.unmodifiableMap(macros);
        }

        public String getText() {
            return text;
        }

        /** Header names in the order they were included, without duplicates. */
        public List<String> getIncludes() {
            return includes;
        }

        public Map<String, String> getMacros() {
            return macros;
        }
    }

    public Result process(String source) {
        String[] lines = source.replace("\r\n", "\n").split("\n", -1);
        StringBuilder out = new StringBuilder(source.length());
        List<String> includes = new ArrayList<>();
        Map<String, String> macros = new LinkedHashMap<>();
        boolean inComment = false;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String trimmed = line.trim();
            if (!inComment && trimmed.startsWith("#")) {
                int lineNo = i + 1;
                StringBuilder directive = new StringBuilder(stripComments(trimmed));
                int consumed = 0;
                while (directive.length() > 0 && directive.charAt(directive.length() - 1) == '\\' && i + 1 < lines.length) {
                    directive.setLength(directive.length() - 1);
                    directive.append(' ').append(stripComments(lines[++i].trim()));
                    consumed++;
                }
                handleDirective(directive.toString().trim(), lineNo, includes, macros);
                for (int k = 0; k <= consumed; k++) {
                    out.append('\n');
                }
                continue;
            }
            inComment = updateCommentState(line, inComment);
            out.append(line);
            if (i < lines.length - 1) {
                out.append('\n');
            }
        }
        return new Result(out.toString(), includes, macros);
    }

    private void handleDirective(String directive, int line, List<String> includes, Map<String, String> macros) {
        SourceLocation location = new SourceLocation(line, 1);
        Matcher include = INCLUDE.matcher(directive);
        if (include.matches()) {
            String header = include.group(1);
            if (!BuiltinHeaders.isKnown(header)) {
                throw new UnsupportedConstructException("#include <" + header + ">", location);
            }
            if (!includes.contains(header)) {
                includes.add(header);
            }
            return;
        }
        if (FUNCTION_LIKE.matcher(directive).matches()) {
            throw new UnsupportedConstructException("function-like macro", location);
        }
        Matcher define = DEFINE.matcher(directive);
        if (define.matches()) {
            String body = define.group(3);
            macros.put(define.group(1), body == null ? "" : body.trim());
            return;
        }
        String name = directive.length() > 1 ? directive.substring(1).trim().split("\\s+")[0] : "";
        throw new UnsupportedConstructException("#" + name + " directive", location);
    }

    private static String stripComments(String line) {
        String result = line.replaceAll("/\\*.*?\\*/", " ");
        int lineComment = result.indexOf("//");
        if (lineComment >= 0) {
            result = result.substring(0, lineComment);
        }
        return result.trim();
    }

    private static boolean updateCommentState(String line, boolean inComment) {
        boolean inString = false;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            char next = i + 1 < line.length() ? line.charAt(i + 1) : 0;
            if (inComment) {
                if (c == '*' && next == '/') {
                    inComment = false;
                    i++;
                }
            } else if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    inString = false;
                }
            } else if (c == '"' || c == '\'') {
                inString = true;
                quote = c;
            } else if (c == '/' && next == '/') {
                return false;
            } else if (c == '/' && next == '*') {
                inComment = true;
                i++;
            }
        }
        return inComment;
    }
}
