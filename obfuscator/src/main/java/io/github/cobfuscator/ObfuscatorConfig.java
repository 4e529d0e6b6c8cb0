package io.github.cobfuscator;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Everything one obfuscator run needs: inputs, output location, protection settings,
 * function filters and parallelism.
 */
public class ObfuscatorConfig {

    private final List<Path> inputs;
    private final Path output;
    private final List<String> blackList;
    private final List<String> whiteList;
    private final int threads;

    private final ProtectionConfig protectionConfig;

    public ObfuscatorConfig(List<Path> inputs, Path output, List<String> blackList, List<String> whiteList,
                            int threads, ProtectionConfig protectionConfig) {
        this.inputs = Collections.unmodifiableList(inputs);
        this.output = output;
        this.blackList = blackList;
        this.whiteList = whiteList;
        this.threads = threads;
        this.protectionConfig = protectionConfig;
    }

    public List<Path> getInputs() { return inputs; }
    public Path getOutput() { return output; }
    public List<String> getBlackList() { return blackList; }
    public List<String> getWhiteList() { return whiteList; }
    public int getThreads() { return threads; }

    public ProtectionConfig getProtectionConfig() { return protectionConfig; }

    public boolean isControlFlowFlatteningEnabled() { return protectionConfig.isControlFlowFlatteningEnabled(); }
    public boolean isStringEncryptionEnabled() { return protectionConfig.isStringEncryptionEnabled(); }

    /**
     * Validates the entire configuration and prints warnings for problematic combinations.
     */
    public void validateAndWarn() {
        protectionConfig.validateAndWarn();

        if (inputs.size() > 1 && output.toString().endsWith(".c")) {
            System.out.println("Warning: Several inputs with a .c output path. The path is treated as a directory.");
        }

        if (blackList != null && whiteList != null) {
            System.out.println("Info: Both black and white lists are set. Black-listed functions are skipped even when white-listed.");
        }
    }

    @Override
    public String toString() {
        return String.format("ObfuscatorConfig{\n" +
                "  inputs=%s,\n" +
                "  output=%s,\n" +
                "  threads=%d,\n" +
                "  protectionConfig=%s\n" +
                "}",
                inputs, output, threads, protectionConfig);
    }

    /**
     * Builder class for constructing ObfuscatorConfig instances.
     */
    public static class Builder {
        private List<Path> inputs;
        private Path output;
        private List<String> blackList;
        private List<String> whiteList;
        private int threads = Runtime.getRuntime().availableProcessors();
        private ProtectionConfig protectionConfig = ProtectionConfig.createDefault();

        public Builder setInputs(List<Path> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder setOutput(Path output) {
            this.output = output;
            return this;
        }

        public Builder setBlackList(List<String> blackList) {
            this.blackList = blackList;
            return this;
        }

        public Builder setWhiteList(List<String> whiteList) {
            this.whiteList = whiteList;
            return this;
        }

        public Builder setThreads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder setProtectionConfig(ProtectionConfig protectionConfig) {
            this.protectionConfig = protectionConfig;
            return this;
        }

        public ObfuscatorConfig build() {
            if (inputs == null || inputs.isEmpty() || output == null) {
                throw new IllegalArgumentException("At least one input and an output path are required");
            }
            if (threads < 1) {
                throw new IllegalArgumentException("Thread count must be positive");
            }
            return new ObfuscatorConfig(inputs, output, blackList, whiteList, threads, protectionConfig);
        }
    }
}
