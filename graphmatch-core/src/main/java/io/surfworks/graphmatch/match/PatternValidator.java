package io.surfworks.graphmatch.match;

import java.util.ArrayList;
import java.util.List;

import io.surfworks.graphmatch.ir.Graph;
import io.surfworks.graphmatch.ir.Node;

/**
 * Checks that a pattern graph is well-formed for matching.
 *
 * <p>A valid pattern:
 * <ul>
 *   <li>is flat: no node of its root block owns a sub-block</li>
 *   <li>returns exactly one value: its exit node has a single input, whose
 *       defining node is where matching is rooted</li>
 * </ul>
 *
 * <p>Aliasing between pattern values is not checked.
 */
public final class PatternValidator {

    private PatternValidator() {}

    /**
     * Returns true if the pattern satisfies every structural precondition.
     */
    public static boolean isValidPattern(Graph pattern) {
        return validate(pattern).isEmpty();
    }

    /**
     * Lists the violated preconditions, in check order.
     *
     * @param pattern the pattern graph
     * @return human-readable violations, empty when the pattern is valid
     */
    public static List<String> validate(Graph pattern) {
        List<String> violations = new ArrayList<>();
        for (Node node : pattern.nodes()) {
            if (node.hasBlocks()) {
                violations.add("pattern must be flat, but " + node + " owns "
                        + node.blocks().size() + " sub-block(s)");
            }
        }

        int exitInputs = pattern.returnNode().inputs().size();
        if (exitInputs != 1) {
            violations.add("pattern must return exactly one value, but returns " + exitInputs);
        }
        return violations;
    }

    /**
     * @throws InvalidPatternException if the pattern is not valid
     */
    public static void requireValid(Graph pattern) {
        List<String> violations = validate(pattern);
        if (!violations.isEmpty()) {
            throw new InvalidPatternException(violations);
        }
    }
}
