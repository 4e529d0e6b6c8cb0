package io.github.cobfuscator;

/**
 * Which transformations are applied to function bodies and how.
 */
public class ProtectionConfig {

    public static final int DEFAULT_BOGUS_STATES = 3;

    private final boolean controlFlowFlatteningEnabled;
    private final boolean stringEncryptionEnabled;
    private final Long seed;
    private final int bogusStates;
    private final boolean renameLocals;

    public ProtectionConfig(boolean controlFlowFlatteningEnabled, boolean stringEncryptionEnabled, Long seed,
                            int bogusStates, boolean renameLocals) {
        if (bogusStates < 0) {
            throw new IllegalArgumentException("bogusStates must not be negative");
        }
        this.controlFlowFlatteningEnabled = controlFlowFlatteningEnabled;
        this.stringEncryptionEnabled = stringEncryptionEnabled;
        this.seed = seed;
        this.bogusStates = bogusStates;
        this.renameLocals = renameLocals;
    }

    public ProtectionConfig(boolean controlFlowFlatteningEnabled, boolean stringEncryptionEnabled, Long seed) {
        this(controlFlowFlatteningEnabled, stringEncryptionEnabled, seed, DEFAULT_BOGUS_STATES, false);
    }

    /**
     * @return true if function bodies are rewritten into a state-machine dispatcher
     */
    public boolean isControlFlowFlatteningEnabled() {
        return controlFlowFlatteningEnabled;
    }

    /**
     * @return true if string literals in function bodies are encrypted
     */
    public boolean isStringEncryptionEnabled() {
        return stringEncryptionEnabled;
    }

    /**
     * @return the generator seed, or null for a fresh random seed per run
     */
    public Long getSeed() {
        return seed;
    }

    /**
     * @return number of never-reached states added to every flattened function
     */
    public int getBogusStates() {
        return bogusStates;
    }

    public boolean isRenameLocals() {
        return renameLocals;
    }

    /**
     * Both transformations on, random seed.
     */
    public static ProtectionConfig createDefault() {
        return new ProtectionConfig(true, true, null);
    }

    /**
     * Validates the configuration and prints warnings for potentially problematic combinations.
     */
    public void validateAndWarn() {
        if (!controlFlowFlatteningEnabled && !stringEncryptionEnabled) {
            System.out.println("Warning: Both control flow flattening and string encryption are disabled.");
            System.out.println("The output will be a re-formatted copy of the input.");
        }

        if (!controlFlowFlatteningEnabled && (bogusStates != DEFAULT_BOGUS_STATES || renameLocals)) {
            System.out.println("Warning: Bogus states and local renaming only apply when control flow flattening is enabled.");
        }

        if (seed == null) {
            System.out.println("Info: No seed given. Keys and state encodings will differ on every run.");
        }
    }

    @Override
    public String toString() {
        return String.format("ProtectionConfig{controlFlowFlattening=%s, stringEncryption=%s, seed=%s, bogusStates=%d, renameLocals=%s}",
                controlFlowFlatteningEnabled, stringEncryptionEnabled, seed, bogusStates, renameLocals);
    }
}
