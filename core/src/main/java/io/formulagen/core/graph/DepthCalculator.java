package io.formulagen.core.graph;

import io.formulagen.core.error.CyclicDependencyException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes field depths over the hierarchical edges of a {@link DependencyGraph} with a memoized
 * depth-first search, O(V + E).
 *
 * <p>
 * The search keeps an explicit stack instead of recursing, so long dependency chains cannot
 * overflow the call stack. A dependency that is still in progress closes a cycle; the cycle and
 * everything depending on it is recorded as a {@link CyclicDependencyException} in the result
 * rather than thrown.
 */
public final class DepthCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(DepthCalculator.class);

    public ComputationGraph compute(DependencyGraph graph) {
        Map<String, Integer> depths = new HashMap<>();
        Map<String, List<String>> blockedBy = new HashMap<>();
        Set<String> inProgress = new HashSet<>();
        int cycles = 0;

        for (String start : graph.fieldIds()) {
            if (depths.containsKey(start) || blockedBy.containsKey(start)) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            stack.push(new Frame(start, graph.dependenciesOf(start)));
            path.add(start);
            inProgress.add(start);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.dependencies.hasNext()) {
                    String dependency = frame.dependencies.next();
                    if (inProgress.contains(dependency)) {
                        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                        cycle.add(dependency);
                        LOG.warn("Cyclic dependency detected: path={}", String.join(" -> ", cycle));
                        cycles++;
                        frame.block(cycle);
                    } else if (blockedBy.containsKey(dependency)) {
                        frame.block(blockedBy.get(dependency));
                    } else if (depths.containsKey(dependency)) {
                        frame.maxDependencyDepth = Math.max(frame.maxDependencyDepth, depths.get(dependency));
                    } else {
                        stack.push(new Frame(dependency, graph.dependenciesOf(dependency)));
                        path.add(dependency);
                        inProgress.add(dependency);
                    }
                    continue;
                }

                stack.pop();
                path.remove(path.size() - 1);
                inProgress.remove(frame.fieldId);
                if (frame.cycle != null) {
                    blockedBy.put(frame.fieldId, frame.cycle);
                } else {
                    depths.put(frame.fieldId, frame.hasDependencies ? frame.maxDependencyDepth + 1 : 0);
                }

                Frame parent = stack.peek();
                if (parent != null) {
                    if (frame.cycle != null) {
                        parent.block(frame.cycle);
                    } else {
                        parent.maxDependencyDepth = Math.max(parent.maxDependencyDepth, depths.get(frame.fieldId));
                    }
                }
            }
        }

        Map<String, CyclicDependencyException> failures = new HashMap<>();
        blockedBy.forEach((fieldId, cycle) -> failures.put(fieldId, new CyclicDependencyException(fieldId, cycle)));
        ComputationGraph result = new ComputationGraph(graph, depths, failures);
        LOG.info(
                "Computation order built: levels={}, max_depth={}, cycles={}, blocked_fields={}",
                result.levels().size(),
                result.maxDepth(),
                cycles,
                failures.size());
        return result;
    }

    private static final class Frame {

        private final String fieldId;
        private final Iterator<String> dependencies;
        private final boolean hasDependencies;
        private int maxDependencyDepth = -1;
        private List<String> cycle;

        Frame(String fieldId, List<String> dependencies) {
            this.fieldId = fieldId;
            this.dependencies = dependencies.iterator();
            this.hasDependencies = !dependencies.isEmpty();
        }

        void block(List<String> cyclePath) {
            if (cycle == null) {
                cycle = List.copyOf(cyclePath);
            }
        }
    }
}
