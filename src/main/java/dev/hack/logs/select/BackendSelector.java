package dev.hack.logs.select;

import dev.hack.logs.api.LogBackend;

/**
 * Decides between the compose and Loki backends.
 *
 * <p>An explicit {@code --compose} always wins. An explicit Loki request is honored even when
 * Loki is unreachable, so it fails loudly instead of silently falling back.
 */
public final class BackendSelector {
    private BackendSelector() {}

    public static boolean resolveShouldTryLoki(
        boolean forceCompose,
        boolean wantsLokiExplicit,
        boolean follow,
        LogBackend followBackend,
        LogBackend snapshotBackend
    ) {
        if (forceCompose) {
            return false;
        }
        if (wantsLokiExplicit) {
            return true;
        }
        LogBackend configured = follow ? followBackend : snapshotBackend;
        return configured == LogBackend.LOKI;
    }

    public static boolean resolveUseLoki(
        boolean forceCompose,
        boolean wantsLokiExplicit,
        boolean shouldTryLoki,
        boolean lokiReachable
    ) {
        if (forceCompose) {
            return false;
        }
        if (wantsLokiExplicit) {
            return true;
        }
        return shouldTryLoki && lokiReachable;
    }
}
