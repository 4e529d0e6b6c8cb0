package io.github.cobfuscator.cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Threads jumps through empty fall-through blocks, drops blocks unreachable from the
 * entry and renumbers the survivors densely: entry first, exit last.
 */
public final class CfgSimplifier {

    private CfgSimplifier() {
    }

    public static FunctionCfg simplify(FunctionCfg cfg) {
        int size = cfg.size();
        int[] forward = new int[size];
        for (int i = 0; i < size; i++) {
            forward[i] = threadTarget(cfg, i);
        }
        int entry = forward[cfg.getEntry()];

        boolean[] reachable = new boolean[size];
        Deque<Integer> work = new ArrayDeque<>();
        reachable[entry] = true;
        work.add(entry);
        while (!work.isEmpty()) {
            BasicBlock block = cfg.getBlock(work.poll());
            for (int successor : block.getTerminator().successors()) {
                int target = forward[successor];
                if (!reachable[target]) {
                    reachable[target] = true;
                    work.add(target);
                }
            }
        }
        reachable[cfg.getExit()] = true;

        int[] renumber = new int[size];
        Arrays.fill(renumber, -1);
        List<Integer> order = new ArrayList<>();
        order.add(entry);
        for (int i = 0; i < size; i++) {
            if (reachable[i] && i != entry && i != cfg.getExit()) {
                order.add(i);
            }
        }
        if (entry != cfg.getExit()) {
            order.add(cfg.getExit());
        }
        for (int i = 0; i < order.size(); i++) {
            renumber[order.get(i)] = i;
        }

        List<BasicBlock> blocks = new ArrayList<>(order.size());
        for (int i = 0; i < order.size(); i++) {
            BasicBlock old = cfg.getBlock(order.get(i));
            Terminator terminator = old.getTerminator().remap(target -> renumber[forward[target]]);
            blocks.add(new BasicBlock(i, new ArrayList<>(old.getStatements()), terminator));
        }
        return new FunctionCfg(cfg.getFunction(), renumber[entry], renumber[cfg.getExit()], blocks);
    }

    /** Follows empty fall-through blocks from {@code id}; a cycle of them stops at its first repeat. */
    private static int threadTarget(FunctionCfg cfg, int id) {
        Set<Integer> seen = new HashSet<>();
        int current = id;
        while (cfg.getBlock(current).isEmptyFallthrough() && seen.add(current)) {
            int next = ((Terminator.Fallthrough) cfg.getBlock(current).getTerminator()).target;
            if (next == current) {
                break;
            }
            current = next;
        }
        return current;
    }
}
