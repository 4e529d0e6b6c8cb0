package io.github.cobfuscator.symbols;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Caller to callee edges between functions of one translation unit. Builtin calls are
 * not recorded.
 */
public class CallGraph {

    private final Map<String, Set<String>> edges = new LinkedHashMap<>();
    private Set<String> recursive;

    void addFunction(String name) {
        edges.computeIfAbsent(name, k -> new LinkedHashSet<>());
    }

    void addCall(String caller, String callee) {
        addFunction(callee);
        edges.computeIfAbsent(caller, k -> new LinkedHashSet<>()).add(callee);
        recursive = null;
    }

    public Set<String> getCallees(String function) {
        return Collections.unmodifiableSet(edges.getOrDefault(function, Collections.emptySet()));
    }

    public boolean isRecursive(String function) {
        return getRecursiveFunctions().contains(function);
    }

    /**
     * Functions that can reach themselves: members of a strongly connected component with
     * more than one node, or with a self edge.
     */
    public synchronized Set<String> getRecursiveFunctions() {
        if (recursive == null) {
            recursive = Collections.unmodifiableSet(computeRecursive());
        }
        return recursive;
    }

    private static final class Frame {
        final String node;
        final Iterator<String> callees;

        Frame(String node, Iterator<String> callees) {
            this.node = node;
            this.callees = callees;
        }
    }

    // Tarjan's algorithm, iterative so deep call chains cannot overflow the stack.
    private Set<String> computeRecursive() {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new LinkedHashSet<>();
        Set<String> result = new LinkedHashSet<>();
        int[] counter = {0};

        for (String root : edges.keySet()) {
            if (index.containsKey(root)) {
                continue;
            }
            Deque<Frame> work = new ArrayDeque<>();
            work.push(new Frame(root, edges.get(root).iterator()));
            index.put(root, counter[0]);
            lowLink.put(root, counter[0]++);
            stack.push(root);
            onStack.add(root);

            while (!work.isEmpty()) {
                Frame frame = work.peek();
                String node = frame.node;
                Iterator<String> it = frame.callees;
                if (it.hasNext()) {
                    String next = it.next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter[0]);
                        lowLink.put(next, counter[0]++);
                        stack.push(next);
                        onStack.add(next);
                        work.push(new Frame(next, edges.getOrDefault(next, Collections.emptySet()).iterator()));
                    } else if (onStack.contains(next)) {
                        lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                    }
                    continue;
                }
                work.pop();
                if (!work.isEmpty()) {
                    String parent = work.peek().node;
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(node)));
                }
                if (lowLink.get(node).equals(index.get(node))) {
                    Set<String> component = new LinkedHashSet<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(node));
                    if (component.size() > 1 || edges.getOrDefault(node, Collections.emptySet()).contains(node)) {
                        result.addAll(component);
                    }
                }
            }
        }
        return result;
    }
}
