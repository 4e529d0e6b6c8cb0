package io.github.cobfuscator;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides which function definitions are transformed. Entries are function names;
 * {@code *} matches any run of characters.
 */
public class FunctionFilter {

    private final List<Pattern> blackList;
    private final List<Pattern> whiteList;

    public FunctionFilter(List<String> blackList, List<String> whiteList) {
        this.blackList = compile(blackList);
        this.whiteList = compile(whiteList);
    }

    private static List<Pattern> compile(List<String> entries) {
        if (entries == null) {
            return null;
        }
        return entries.stream()
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .map(entry -> Pattern.compile(Pattern.quote(entry).replace("*", "\\E.*\\Q")))
                .toList();
    }

    private static boolean hasInList(List<Pattern> list, String name) {
        if (list == null) {
            return false;
        }
        return list.stream().anyMatch(pattern -> pattern.matcher(name).matches());
    }

    public boolean shouldProcess(String functionName) {
        if (hasInList(blackList, functionName)) {
            return false;
        }
        return whiteList == null || hasInList(whiteList, functionName);
    }
}
