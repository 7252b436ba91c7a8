package dev.hack.logs.api;

import dev.hack.logs.shared.TimeRange;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable request for one log stream, resolved from CLI options and project config.
 *
 * <p>{@code services}, {@code query}, {@code since} and {@code until} are optional because
 * merely passing them asks for Loki, even with an empty value.
 */
public record LogsConfiguration(
    Path composeFile,
    String projectName,
    Optional<String> branch,
    List<String> profiles,
    Optional<String> service,
    Optional<List<String>> services,
    Optional<String> query,
    boolean follow,
    int tail,
    Optional<String> since,
    Optional<String> until,
    TimeRange timeRange,
    boolean forceCompose,
    boolean forceLoki,
    LogBackend followBackend,
    LogBackend snapshotBackend
) {
    public static final int DEFAULT_TAIL = 200;

    public LogsConfiguration {
        Objects.requireNonNull(composeFile, "composeFile");
        Objects.requireNonNull(branch, "branch");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(services, "services");
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(since, "since");
        Objects.requireNonNull(until, "until");
        Objects.requireNonNull(timeRange, "timeRange");
        Objects.requireNonNull(followBackend, "followBackend");
        Objects.requireNonNull(snapshotBackend, "snapshotBackend");
        projectName = projectName == null ? "" : projectName;
        profiles = profiles == null ? List.of() : List.copyOf(profiles);
        services = services.map(List::copyOf);
        if (tail < 0) {
            throw new IllegalArgumentException("tail must not be negative");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Any Loki-only option counts as an explicit Loki request.
     */
    public boolean wantsLokiExplicit() {
        return forceLoki || services.isPresent() || query.isPresent() || since.isPresent() || until.isPresent();
    }

    /**
     * Positional service appended to {@code --services} unless already listed.
     */
    public List<String> allServices() {
        List<String> listed = services.orElse(List.of());
        if (service.isEmpty() || listed.contains(service.get())) {
            return listed;
        }
        var all = new ArrayList<>(listed);
        all.add(service.get());
        return List.copyOf(all);
    }

    /**
     * The {@code -p} value: only branch runs override compose's own project name.
     */
    public Optional<String> composeProject() {
        return branch.isPresent() && !projectName.isEmpty() ? Optional.of(projectName) : Optional.empty();
    }

    public static final class Builder {
        private Path composeFile;
        private String projectName = "";
        private Optional<String> branch = Optional.empty();
        private List<String> profiles = List.of();
        private Optional<String> service = Optional.empty();
        private Optional<List<String>> services = Optional.empty();
        private Optional<String> query = Optional.empty();
        private boolean follow = true;
        private int tail = DEFAULT_TAIL;
        private Optional<String> since = Optional.empty();
        private Optional<String> until = Optional.empty();
        private TimeRange timeRange = TimeRange.OPEN;
        private boolean forceCompose;
        private boolean forceLoki;
        private LogBackend followBackend = LogBackend.COMPOSE;
        private LogBackend snapshotBackend = LogBackend.LOKI;

        public Builder composeFile(Path composeFile) {
            this.composeFile = composeFile;
            return this;
        }

        public Builder projectName(String projectName) {
            this.projectName = projectName;
            return this;
        }

        public Builder branch(Optional<String> branch) {
            this.branch = branch;
            return this;
        }

        public Builder profiles(List<String> profiles) {
            this.profiles = profiles;
            return this;
        }

        public Builder service(String service) {
            this.service = Optional.ofNullable(service).map(String::trim).filter(value -> !value.isEmpty());
            return this;
        }

        public Builder services(List<String> services) {
            this.services = Optional.ofNullable(services);
            return this;
        }

        public Builder query(String query) {
            this.query = Optional.ofNullable(query);
            return this;
        }

        public Builder follow(boolean follow) {
            this.follow = follow;
            return this;
        }

        public Builder tail(int tail) {
            this.tail = tail;
            return this;
        }

        public Builder since(String since) {
            this.since = Optional.ofNullable(since);
            return this;
        }

        public Builder until(String until) {
            this.until = Optional.ofNullable(until);
            return this;
        }

        public Builder timeRange(TimeRange timeRange) {
            this.timeRange = timeRange;
            return this;
        }

        public Builder forceCompose(boolean forceCompose) {
            this.forceCompose = forceCompose;
            return this;
        }

        public Builder forceLoki(boolean forceLoki) {
            this.forceLoki = forceLoki;
            return this;
        }

        public Builder followBackend(LogBackend followBackend) {
            this.followBackend = followBackend;
            return this;
        }

        public Builder snapshotBackend(LogBackend snapshotBackend) {
            this.snapshotBackend = snapshotBackend;
            return this;
        }

        public LogsConfiguration build() {
            return new LogsConfiguration(
                composeFile,
                projectName,
                branch,
                profiles,
                service,
                services,
                query,
                follow,
                tail,
                since,
                until,
                timeRange,
                forceCompose,
                forceLoki,
                followBackend,
                snapshotBackend
            );
        }
    }
}
