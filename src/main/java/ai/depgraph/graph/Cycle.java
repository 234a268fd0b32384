package ai.depgraph.graph;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Files that import each other in a loop. Member order is discovery order, not canonical.
 */
public record Cycle(List<Path> members) {

    public Cycle {
        members = List.copyOf(members);
        if (members.size() < 2) {
            throw new IllegalArgumentException("a cycle needs at least two files: " + members);
        }
    }

    public int size() {
        return members.size();
    }

    public Set<Path> memberSet() {
        return Set.copyOf(members);
    }
}
