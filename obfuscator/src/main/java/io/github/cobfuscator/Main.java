package io.github.cobfuscator;

import picocli.CommandLine;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

public class Main {

    private static final String VERSION = "1.0.0";

    @CommandLine.Command(name = "c-obfuscator", mixinStandardHelpOptions = true, version = "c-obfuscator " + VERSION,
            description = "Rewrites C translation units into semantically equivalent, obfuscated C")
    static class CObfuscatorRunner implements Callable<Integer> {

        @CommandLine.Parameters(arity = "1..*", description = "C source files to obfuscate")
        private List<File> inputs;

        @CommandLine.Option(names = {"-o", "--output"}, required = true,
                description = "Output directory, or output .c file when a single input is given")
        private File output;

        @CommandLine.Option(names = {"-b", "--black-list"}, description = "File with a list of functions to leave untouched")
        private File blackListFile;

        @CommandLine.Option(names = {"-w", "--white-list"}, description = "File with a list of the only functions to transform")
        private File whiteListFile;

        @CommandLine.Option(names = {"--no-flatten-control-flow"},
                description = "Keep function bodies structured instead of flattening them into a dispatcher")
        private boolean noFlattenControlFlow;

        @CommandLine.Option(names = {"--no-encrypt-strings"},
                description = "Keep string literals in plaintext")
        private boolean noEncryptStrings;

        @CommandLine.Option(names = {"--seed"}, description = "Seed for reproducible output")
        private Long seed;

        @CommandLine.Option(names = {"--bogus-states"}, defaultValue = "" + ProtectionConfig.DEFAULT_BOGUS_STATES,
                description = "Number of unreachable decoy states added to every flattened function")
        private int bogusStates;

        @CommandLine.Option(names = {"--rename-locals"}, description = "Give hoisted locals meaningless names")
        private boolean renameLocals;

        @CommandLine.Option(names = {"-t", "--threads"}, description = "Number of worker threads")
        private Integer threads;

        @Override
        public Integer call() throws Exception {
            List<String> blackList = new ArrayList<>();
            if (blackListFile != null) {
                blackList = Files.readAllLines(blackListFile.toPath(), StandardCharsets.UTF_8);
            }

            List<String> whiteList = null;
            if (whiteListFile != null) {
                whiteList = Files.readAllLines(whiteListFile.toPath(), StandardCharsets.UTF_8);
            }

            ProtectionConfig protectionConfig = new ProtectionConfig(!noFlattenControlFlow, !noEncryptStrings, seed,
                    bogusStates, renameLocals);

            List<Path> inputPaths = new ArrayList<>();
            for (File input : inputs) {
                inputPaths.add(input.toPath());
            }

            ObfuscatorConfig.Builder builder = new ObfuscatorConfig.Builder()
                    .setInputs(inputPaths)
                    .setOutput(output.toPath())
                    .setBlackList(blackList)
                    .setWhiteList(whiteList)
                    .setProtectionConfig(protectionConfig);
            if (threads != null) {
                builder.setThreads(threads);
            }
            ObfuscatorConfig config = builder.build();
            config.validateAndWarn();

            return CObfuscator.process(config) == 0 ? 0 : 1;
        }
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new CObfuscatorRunner()).execute(args));
    }
}
