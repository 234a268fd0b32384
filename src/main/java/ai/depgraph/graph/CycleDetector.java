package ai.depgraph.graph;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Detects import cycles using Tarjan's SCC algorithm, O(V + E).
 * <p>
 * The traversal keeps its own stack of (node, next successor) frames instead of recursing, so
 * deep import chains cannot overflow the thread stack. Components of a single file are never
 * reported, which also hides files importing themselves.
 */
public final class CycleDetector {

    private final Map<Path, ? extends Set<Path>> adjacency;

    private final Map<Path, Integer> index = new HashMap<>();
    private final Map<Path, Integer> lowlink = new HashMap<>();
    private final Set<Path> onStack = new HashSet<>();
    private final Deque<Path> stack = new ArrayDeque<>();
    private final List<List<Path>> components = new ArrayList<>();
    private int currentIndex;

    /**
     * @param adjacency map from file to the files it imports
     */
    public CycleDetector(Map<Path, ? extends Set<Path>> adjacency) {
        this.adjacency = Objects.requireNonNull(adjacency, "adjacency");
    }

    /**
     * All strongly connected components, single files included.
     */
    public List<List<Path>> findComponents() {
        index.clear();
        lowlink.clear();
        onStack.clear();
        stack.clear();
        components.clear();
        currentIndex = 0;

        for (Path node : adjacency.keySet()) {
            if (!index.containsKey(node)) {
                strongConnect(node);
            }
        }
        return new ArrayList<>(components);
    }

    public List<Cycle> findCycles() {
        final List<Cycle> cycles = new ArrayList<>();
        for (List<Path> component : findComponents()) {
            if (component.size() > 1) {
                cycles.add(new Cycle(component));
            }
        }
        return cycles;
    }

    private void strongConnect(Path start) {
        final Deque<Frame> work = new ArrayDeque<>();
        work.push(enter(start));

        while (!work.isEmpty()) {
            final Frame frame = work.peek();
            if (frame.next < frame.successors.size()) {
                final Path w = frame.successors.get(frame.next++);
                if (!index.containsKey(w)) {
                    work.push(enter(w));
                } else if (onStack.contains(w)) {
                    lowlink.put(frame.node, Math.min(lowlink.get(frame.node), index.get(w)));
                }
                continue;
            }

            work.pop();
            final Path v = frame.node;
            if (lowlink.get(v).equals(index.get(v))) {
                final List<Path> component = new ArrayList<>();
                Path w;
                do {
                    w = stack.pop();
                    onStack.remove(w);
                    component.add(w);
                } while (!w.equals(v));
                Collections.reverse(component);
                components.add(component);
            }
            if (!work.isEmpty()) {
                final Path parent = work.peek().node;
                lowlink.put(parent, Math.min(lowlink.get(parent), lowlink.get(v)));
            }
        }
    }

    private Frame enter(Path v) {
        index.put(v, currentIndex);
        lowlink.put(v, currentIndex);
        currentIndex++;
        stack.push(v);
        onStack.add(v);
        final Set<Path> successors = adjacency.get(v);
        return new Frame(v, successors == null ? List.of() : new ArrayList<>(successors));
    }

    private static final class Frame {
        final Path node;
        final List<Path> successors;
        int next;

        private Frame(Path node, List<Path> successors) {
            this.node = node;
            this.successors = successors;
        }
    }
}
