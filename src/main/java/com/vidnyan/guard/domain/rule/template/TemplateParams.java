package com.vidnyan.guard.domain.rule.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parameters supplied to a rule template.
 */
public record TemplateParams(
    String path,
    List<String> paths,
    List<String> operations,    // read, write, delete
    List<String> commands,
    List<String> patterns,      // literal strings, escaped on expansion
    Map<String, String> extra
) {

    public TemplateParams {
        paths = paths == null ? List.of() : List.copyOf(paths);
        operations = operations == null ? List.of() : List.copyOf(operations);
        commands = commands == null ? List.of() : List.copyOf(commands);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public static TemplateParams empty() {
        return new TemplateParams(null, null, null, null, null, null);
    }

    public static TemplateParams ofPath(String path, String... operations) {
        return new TemplateParams(path, null, List.of(operations), null, null, null);
    }

    public static TemplateParams ofCommands(String... commands) {
        return new TemplateParams(null, null, null, List.of(commands), null, null);
    }

    /**
     * {@code paths} plus {@code path}, blanks dropped.
     */
    public List<String> allPaths() {
        List<String> all = new ArrayList<>(paths);
        if (path != null && !path.isBlank()) {
            all.add(path);
        }
        all.removeIf(p -> p == null || p.isBlank());
        return all;
    }

    /**
     * {@code commands}, or {@code patterns} when no commands are given.
     */
    public List<String> commandsOrPatterns() {
        return commands.isEmpty() ? patterns : commands;
    }
}
