package dev.hack.logs.select;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds LogQL stream selectors from a project name and a service list.
 */
public final class LogSelectors {
    private static final String REGEX_METACHARACTERS = ".*+?^${}()|[]\\";

    private LogSelectors() {}

    public static String buildSelector(String project, List<String> services) {
        List<String> parts = new ArrayList<>();
        if (project != null && !project.isEmpty()) {
            parts.add("project=" + quote(project));
        }
        if (services.size() == 1) {
            parts.add("service=" + quote(services.get(0)));
        } else if (services.size() > 1) {
            String pattern = services.stream()
                .map(LogSelectors::escapeRegex)
                .collect(Collectors.joining("|", "^(", ")$"));
            parts.add("service=~" + quote(pattern));
        }
        return "{" + String.join(",", parts) + "}";
    }

    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    static String escapeRegex(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (REGEX_METACHARACTERS.indexOf(ch) >= 0) {
                out.append('\\');
            }
            out.append(ch);
        }
        return out.toString();
    }
}
