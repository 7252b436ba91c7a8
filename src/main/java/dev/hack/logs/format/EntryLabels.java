package dev.hack.logs.format;

import dev.hack.logs.api.LogEntry;
import dev.hack.logs.parse.ComposePrefix.ServiceInstance;
import java.util.Optional;

/**
 * Display label {@code [project/]service[#instance]} for an entry.
 */
public final class EntryLabels {
    private EntryLabels() {}

    /**
     * Falls back to {@code service} when the entry names no service.
     */
    public static String of(LogEntry entry) {
        return find(entry).orElseGet(() -> entry.project() != null ? entry.project() + "/service" : "service");
    }

    public static Optional<String> find(LogEntry entry) {
        String service = entry.service();
        if (service == null && entry.labels() != null) {
            service = entry.labels().get("service");
        }
        if (service == null) {
            return Optional.empty();
        }
        return Optional.of(new ServiceInstance(service, entry.instance()).displayLabel(entry.project()));
    }
}
