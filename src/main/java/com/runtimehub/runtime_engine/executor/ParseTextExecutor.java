package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regex and line operations on text: match, replace, split, trim, lines, count, contains, extract.
 *
 * <p>{@code flags} accepts g (all matches), i, m and s. Without g, match returns the first
 * match followed by its groups and replace only replaces the first occurrence.
 */
@Component
public class ParseTextExecutor implements NodeExecutor {

    @Override
    public String supportedType() {
        return "Parse Text";
    }

    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) {
        String text = NodeConfig.string(node, inputs, "text", "");
        String pattern = NodeConfig.string(node, inputs, "pattern", "");
        String operation = NodeConfig.string(node, "operation", "match");
        String flags = NodeConfig.string(node, "flags", "g");

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("operation", operation);
        try {
            Object result = apply(operation, text, pattern, flags, node.config());
            outputs.put("success", true);
            outputs.put("result", result);
            outputs.put("matches", result);
            outputs.put("inputLength", text.length());
        } catch (PatternSyntaxException e) {
            outputs.put("success", false);
            outputs.put("error", e.getDescription() + " in pattern " + e.getPattern());
        }
        return NodeOutcome.next(outputs);
    }

    static Object apply(String operation, String text, String pattern, String flags, Map<String, Object> config) {
        boolean global = flags.contains("g");
        return switch (operation) {
            case "match" -> {
                Matcher matcher = compile(pattern, flags).matcher(text);
                List<String> matches = new ArrayList<>();
                if (global) {
                    while (matcher.find()) {
                        matches.add(matcher.group());
                    }
                } else if (matcher.find()) {
                    for (int g = 0; g <= matcher.groupCount(); g++) {
                        matches.add(matcher.group(g));
                    }
                }
                yield matches;
            }
            case "replace" -> {
                String replacement = Matcher.quoteReplacement(String.valueOf(config.getOrDefault("replacement", "")));
                Matcher matcher = compile(pattern, flags).matcher(text);
                yield global ? matcher.replaceAll(replacement) : matcher.replaceFirst(replacement);
            }
            case "split" -> {
                String delimiter = !pattern.isEmpty()
                        ? pattern
                        : String.valueOf(config.getOrDefault("delimiter", "\n"));
                yield Arrays.asList(Pattern.compile(delimiter).split(text, -1));
            }
            case "trim" -> text.trim();
            case "lines" -> text.lines().map(String::trim).filter(l -> !l.isEmpty()).toList();
            case "count" -> {
                Matcher matcher = compile(pattern, flags).matcher(text);
                int count = 0;
                while (matcher.find()) {
                    count++;
                }
                yield count;
            }
            case "contains" -> !pattern.isEmpty() && text.contains(pattern);
            case "extract" -> {
                Matcher matcher = compile(pattern, flags).matcher(text);
                List<String> extracted = new ArrayList<>();
                while (matcher.find()) {
                    extracted.add(matcher.groupCount() >= 1 && matcher.group(1) != null
                            ? matcher.group(1)
                            : matcher.group());
                }
                yield extracted;
            }
            default -> text;
        };
    }

    private static Pattern compile(String pattern, String flags) {
        int bits = 0;
        if (flags.contains("i")) {
            bits |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        if (flags.contains("m")) {
            bits |= Pattern.MULTILINE;
        }
        if (flags.contains("s")) {
            bits |= Pattern.DOTALL;
        }
        return Pattern.compile(pattern, bits);
    }
}
