package work.shellformats.toml.api;

/**
 * Cooperative cancellation flag shared between a running conversion and whoever may abort it.
 */
public final class CancellationToken {
    private volatile boolean cancelled = false;

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
