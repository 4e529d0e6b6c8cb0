package io.github.cobfuscator.cfg;

import io.github.cobfuscator.InternalInvariantException;
import io.github.cobfuscator.ast.Decl;

import java.util.Collections;
import java.util.List;

/**
 * Control-flow graph of one function body. Block ids index {@link #getBlocks()}.
 */
public class FunctionCfg {

    private final Decl.Function function;
    private final int entry;
    private final int exit;
    private final List<BasicBlock> blocks;

    public FunctionCfg(Decl.Function function, int entry, int exit, List<BasicBlock> blocks) {
        this.function = function;
        this.entry = entry;
        this.exit = exit;
        this.blocks = Collections.unmodifiableList(blocks);
        validate();
    }

    private void validate() {
        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            if (block.getId() != i) {
                throw new InternalInvariantException("block " + block.getId() + " stored at index " + i);
            }
            if (block.getTerminator() == null) {
                throw new InternalInvariantException("block " + i + " of " + function.name + " has no terminator");
            }
            for (int successor : block.getTerminator().successors()) {
                if (successor < 0 || successor >= blocks.size()) {
                    throw new InternalInvariantException("block " + i + " of " + function.name
                            + " targets missing block " + successor);
                }
            }
        }
        if (!(blocks.get(exit).getTerminator() instanceof Terminator.Exit)) {
            throw new InternalInvariantException("exit block of " + function.name + " is not terminal");
        }
    }

    public Decl.Function getFunction() {
        return function;
    }

    public int getEntry() {
        return entry;
    }

    public int getExit() {
        return exit;
    }

    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public BasicBlock getBlock(int id) {
        return blocks.get(id);
    }

    public int size() {
        return blocks.size();
    }
}
