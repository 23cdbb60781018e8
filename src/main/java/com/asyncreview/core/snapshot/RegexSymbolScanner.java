package com.asyncreview.core.snapshot;

import com.asyncreview.core.model.SymbolTag;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link SymbolScanner} driven by line-anchored regular expressions whose first
 * group captures the symbol name. Advisory tagging only, not parsing.
 */
public class RegexSymbolScanner implements SymbolScanner {

    /** A pattern and the symbol kind it produces. */
    public record Rule(String kind, Pattern pattern) {
        public static Rule of(String kind, String regex) {
            return new Rule(kind, Pattern.compile(regex, Pattern.MULTILINE));
        }
    }

    private static final Map<String, SymbolScanner> BY_LANGUAGE = Map.of(
            "python", new RegexSymbolScanner(List.of(
                    Rule.of("function", "^\\s*(?:async\\s+)?def\\s+(\\w+)\\s*\\("),
                    Rule.of("class", "^\\s*class\\s+(\\w+)\\s*[:(]"),
                    Rule.of("import", "^\\s*(?:from\\s+\\S+\\s+)?import\\s+(\\w+)"))),
            "javascript", new RegexSymbolScanner(List.of(
                    Rule.of("function", "^\\s*(?:async\\s+)?function\\s+(\\w+)\\s*\\("),
                    Rule.of("function", "^\\s*(?:const|let|var)\\s+(\\w+)\\s*=\\s*(?:async\\s+)?\\("),
                    Rule.of("class", "^\\s*class\\s+(\\w+)\\s*(?:extends|\\{)"),
                    Rule.of("export", "^\\s*export\\s+(?:default\\s+)?(?:const|let|var|function|class)\\s+(\\w+)"))),
            "typescript", new RegexSymbolScanner(List.of(
                    Rule.of("function", "^\\s*(?:async\\s+)?function\\s+(\\w+)\\s*[<(]"),
                    Rule.of("function", "^\\s*(?:const|let|var)\\s+(\\w+)\\s*(?::\\s*\\S+\\s*)?=\\s*(?:async\\s+)?\\("),
                    Rule.of("class", "^\\s*(?:export\\s+)?(?:abstract\\s+)?class\\s+(\\w+)"),
                    Rule.of("export", "^\\s*export\\s+(?:default\\s+)?(?:const|let|var|function|class|interface|type)\\s+(\\w+)"))),
            "java", new RegexSymbolScanner(List.of(
                    Rule.of("class", "^\\s*(?:(?:public|protected|private|abstract|final|static|sealed|non-sealed)\\s+)*(?:class|interface|enum|record)\\s+(\\w+)"),
                    Rule.of("method", "^\\s*(?:(?:public|protected|private|static|final|abstract|synchronized|default)\\s+)+[\\w<>\\[\\],.?\\s]+?\\s+(\\w+)\\s*\\("),
                    Rule.of("import", "^\\s*import\\s+(?:static\\s+)?([\\w.]+)\\s*;"))),
            "rust", new RegexSymbolScanner(List.of(
                    Rule.of("function", "^\\s*(?:pub\\s+)?(?:async\\s+)?fn\\s+(\\w+)"),
                    Rule.of("class", "^\\s*(?:pub\\s+)?struct\\s+(\\w+)"),
                    Rule.of("class", "^\\s*(?:pub\\s+)?enum\\s+(\\w+)"),
                    Rule.of("class", "^\\s*(?:pub\\s+)?trait\\s+(\\w+)"))),
            "go", new RegexSymbolScanner(List.of(
                    Rule.of("function", "^\\s*func\\s+(?:\\([^)]+\\)\\s+)?(\\w+)\\s*\\("),
                    Rule.of("class", "^\\s*type\\s+(\\w+)\\s+struct"),
                    Rule.of("class", "^\\s*type\\s+(\\w+)\\s+interface")))
    );

    private final List<Rule> rules;

    public RegexSymbolScanner(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    /** Scanner for a language tag; languages without rules produce no tags. */
    public static SymbolScanner forLanguage(String language) {
        return BY_LANGUAGE.getOrDefault(language, SymbolScanner.NONE);
    }

    @Override
    public List<SymbolTag> scan(String content) {
        int[] lineStarts = lineStarts(content);
        var found = new ArrayList<SymbolTag>();
        for (Rule rule : rules) {
            Matcher matcher = rule.pattern().matcher(content);
            while (matcher.find()) {
                found.add(new SymbolTag(matcher.group(1), rule.kind(), lineOf(lineStarts, matcher.start())));
            }
        }
        found.sort(Comparator.comparingInt(SymbolTag::line).thenComparing(SymbolTag::name));

        var seen = new HashSet<String>();
        var unique = new ArrayList<SymbolTag>();
        for (SymbolTag tag : found) {
            if (seen.add(tag.line() + ":" + tag.name())) {
                unique.add(tag);
            }
        }
        return unique;
    }

    private static int[] lineStarts(String content) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int lineOf(int[] lineStarts, int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return (idx >= 0 ? idx : -idx - 2) + 1;
    }
}
