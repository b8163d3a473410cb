package edu.uw.cse.typegraph;

import java.util.Objects;

/**
 * Holds the flags that control engine behavior.
 * Passed to the Program and from there to every component it creates.
 */
public class EngineConfig {
    public static final int DEFAULT_MAX_VARIABLE_SIZE = 64;

    public final int maxVariableSize;
    public final boolean compress;
    public final boolean verifyCompression;
    public final CyclePolicy cyclePolicy;
    public final boolean debug;

    public EngineConfig(int maxVariableSize, boolean compress, boolean verifyCompression,
                        CyclePolicy cyclePolicy, boolean debug) {
        if (maxVariableSize < 2) {
            throw new IllegalArgumentException(
                "maxVariableSize must leave room for the overflow binding: " + maxVariableSize);
        }
        this.maxVariableSize = maxVariableSize;
        this.compress = compress;
        // verifying compression only makes sense when there is something to verify
        this.verifyCompression = verifyCompression && compress;
        this.cyclePolicy = Objects.requireNonNull(cyclePolicy);
        this.debug = debug;
    }

    public EngineConfig(boolean compress, boolean verifyCompression, boolean debug) {
        this(DEFAULT_MAX_VARIABLE_SIZE, compress, verifyCompression, CyclePolicy.ASSUME_SOLVABLE, debug);
    }

    public static EngineConfig defaults() {
        return new EngineConfig(true, false, false);
    }

    public EngineConfig withMaxVariableSize(int size) {
        return new EngineConfig(size, compress, verifyCompression, cyclePolicy, debug);
    }

    public EngineConfig withCyclePolicy(CyclePolicy policy) {
        return new EngineConfig(maxVariableSize, compress, verifyCompression, policy, debug);
    }

    public EngineConfig withDebug(boolean enabled) {
        return new EngineConfig(maxVariableSize, compress, verifyCompression, cyclePolicy, enabled);
    }
}
