package work.shellformats.toml.error;

import work.shellformats.toml.value.Span;

public final class NestingTooDeepException extends ShellException {
    private final int maxDepth;

    public NestingTooDeepException(int maxDepth, Span span) {
        super("nesting_too_deep", "Value nesting exceeds the maximum depth of " + maxDepth, span);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
