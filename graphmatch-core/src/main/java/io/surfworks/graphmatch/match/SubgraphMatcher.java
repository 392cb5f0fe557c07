package io.surfworks.graphmatch.match;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import io.surfworks.graphmatch.ir.Graph;
import io.surfworks.graphmatch.ir.Node;
import io.surfworks.graphmatch.ir.Value;

/**
 * Compares a pattern graph against the part of a target graph rooted at one
 * anchor node.
 *
 * <p>The anchor is compared with the pattern's root: the node defining the
 * single value consumed by the pattern's exit node. Two nodes match if they
 * have the same kind, the same number of inputs and outputs, and all of their
 * output and input values match. Two values match if their defining nodes
 * match and they have the same number of uses, except for values leaving the
 * anchor and values entering the pattern through a {@code Param} node.
 *
 * <p>Pattern entities are recorded in the maps before their neighbours are
 * visited, so cyclic node/value references terminate and every later
 * reference must resolve to the same target entity.
 *
 * <p>Instances hold per-attempt scratch state and are not thread-safe.
 */
public final class SubgraphMatcher {

    private final Graph pattern;
    private final Map<Node, Node> nodeMap = new HashMap<>();
    private final Map<Value, Value> valueMap = new HashMap<>();
    private Node anchor;

    public SubgraphMatcher(Graph pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    /**
     * Attempts to match the pattern with its root at {@code anchor}.
     *
     * <p>Previous maps are discarded. On success {@link #nodeMap()} and
     * {@link #valueMap()} hold the correspondence for this anchor.
     *
     * @param anchor a node of the target graph
     * @return true if the pattern matches at the anchor
     */
    public boolean matchesFromAnchor(Node anchor) {
        nodeMap.clear();
        valueMap.clear();
        this.anchor = Objects.requireNonNull(anchor, "anchor");

        Node root = patternRoot(pattern);
        return matchNodes(root, anchor);
    }

    /**
     * Returns the node the pattern is rooted at.
     *
     * @throws InvalidPatternException if the exit node does not have exactly one input
     */
    static Node patternRoot(Graph pattern) {
        Node exit = pattern.returnNode();
        if (exit.inputs().size() != 1) {
            throw new InvalidPatternException(PatternValidator.validate(pattern));
        }
        return exit.input().node();
    }

    private boolean matchValues(Value pv, Value tv) {
        Value mapped = valueMap.get(pv);
        if (mapped != null) {
            return mapped == tv;
        }

        // Values leaving the anchor and values entering through Param may have
        // consumers outside the matched region.
        if (pv.useCount() != tv.useCount()
                && tv.node() != anchor
                && !pv.node().kind().isParam()) {
            return false;
        }

        valueMap.put(pv, tv);
        return matchNodes(pv.node(), tv.node());
    }

    private boolean matchNodes(Node pn, Node tn) {
        Node mapped = nodeMap.get(pn);
        if (mapped != null) {
            return mapped == tn;
        }

        if (pn.kind().isParam()) {
            return true;
        }

        // Matches never span blocks.
        if (tn.owningBlock() != anchor.owningBlock()) {
            return false;
        }

        if (!pn.kind().equals(tn.kind())
                || pn.outputs().size() != tn.outputs().size()
                || pn.inputs().size() != tn.inputs().size()) {
            return false;
        }

        nodeMap.put(pn, tn);
        for (int i = 0; i < pn.outputs().size(); i++) {
            if (!matchValues(pn.outputs().get(i), tn.outputs().get(i))) {
                return false;
            }
        }
        for (int i = 0; i < pn.inputs().size(); i++) {
            if (!matchValues(pn.inputs().get(i), tn.inputs().get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a snapshot of the node correspondence from the last attempt.
     */
    public Map<Node, Node> nodeMap() {
        return Map.copyOf(nodeMap);
    }

    /**
     * Returns a snapshot of the value correspondence from the last attempt.
     */
    public Map<Value, Value> valueMap() {
        return Map.copyOf(valueMap);
    }

    /**
     * Returns the anchor of the last attempt, or null before the first one.
     */
    public Node anchor() {
        return anchor;
    }

    public Graph pattern() {
        return pattern;
    }
}
