package dev.hack.logs.parse;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The {@code <label> | <payload>} split of a multiplexed {@code docker compose logs} line.
 */
public record ComposePrefix(String label, String payload) {
    private static final Pattern INSTANCE_SUFFIX = Pattern.compile("^(.*?)-(\\d+)$");

    public static Optional<ComposePrefix> split(String line) {
        int idx = line.indexOf('|');
        if (idx == -1) {
            return Optional.empty();
        }
        String label = line.substring(0, idx).trim();
        if (label.isEmpty()) {
            return Optional.empty();
        }
        String after = line.substring(idx + 1);
        String payload = after.startsWith(" ") ? after.substring(1) : after;
        return Optional.of(new ComposePrefix(label, payload));
    }

    public ServiceInstance serviceInstance(String projectName) {
        return ServiceInstance.parse(label, projectName);
    }

    /**
     * Service name and replica number recovered from a container label such as {@code app-api-2}.
     */
    public record ServiceInstance(String service, String instance) {
        public static ServiceInstance parse(String label, String projectName) {
            String trimmed = label.trim();
            if (trimmed.isEmpty()) {
                return new ServiceInstance(null, null);
            }
            String withoutProject = trimmed;
            if (projectName != null && !projectName.isEmpty() && trimmed.startsWith(projectName + "-")) {
                withoutProject = trimmed.substring(projectName.length() + 1);
            }
            Matcher matcher = INSTANCE_SUFFIX.matcher(withoutProject);
            if (!matcher.matches()) {
                return new ServiceInstance(withoutProject, null);
            }
            String base = matcher.group(1);
            return new ServiceInstance(base.isEmpty() ? withoutProject : base, matcher.group(2));
        }

        /**
         * Display label {@code <project>/<service>[#<instance>]}.
         */
        public String displayLabel(String projectName) {
            String base = projectName != null && !projectName.isEmpty() ? projectName + "/" + service : service;
            return instance != null ? base + "#" + instance : base;
        }
    }
}
