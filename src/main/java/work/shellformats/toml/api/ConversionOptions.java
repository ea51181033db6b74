package work.shellformats.toml.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings for a {@link ToTomlConverter}.
 *
 * @param strict fail on ranges, blocks, nothing and custom values instead of writing placeholders
 * @param maxDepth deepest container nesting accepted before the conversion is refused
 * @param rootArrayKey key under which a root array of tables is written; without one such roots are rejected
 * @param cancellationToken polled between the rows of a root table
 */
public record ConversionOptions(
    boolean strict,
    int maxDepth,
    Optional<String> rootArrayKey,
    CancellationToken cancellationToken
) {
    public static final int DEFAULT_MAX_DEPTH = 512;

    public ConversionOptions {
        Objects.requireNonNull(rootArrayKey, "rootArrayKey");
        Objects.requireNonNull(cancellationToken, "cancellationToken");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        if (rootArrayKey.isPresent() && rootArrayKey.get().isBlank()) {
            throw new IllegalArgumentException("rootArrayKey must not be blank");
        }
    }

    public static ConversionOptions defaults() {
        return builder().build();
    }

    public ConversionOptions withCancellationToken(CancellationToken token) {
        return new ConversionOptions(strict, maxDepth, rootArrayKey, token);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean strict;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private Optional<String> rootArrayKey = Optional.empty();
        private CancellationToken cancellationToken = new CancellationToken();

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder rootArrayKey(String rootArrayKey) {
            this.rootArrayKey = Optional.ofNullable(rootArrayKey);
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public ConversionOptions build() {
            return new ConversionOptions(strict, maxDepth, rootArrayKey, cancellationToken);
        }
    }
}
