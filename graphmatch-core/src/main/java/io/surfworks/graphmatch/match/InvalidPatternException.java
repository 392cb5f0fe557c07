package io.surfworks.graphmatch.match;

import java.util.List;

/**
 * Thrown when a pattern graph does not satisfy the structural preconditions
 * for matching. This is a programming error in the pattern, not a data
 * condition of the target graph.
 */
public class InvalidPatternException extends RuntimeException {

    private final List<String> violations;

    public InvalidPatternException(List<String> violations) {
        super("Invalid pattern graph: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
