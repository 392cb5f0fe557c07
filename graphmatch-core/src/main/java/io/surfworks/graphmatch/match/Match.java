package io.surfworks.graphmatch.match;

import java.util.Map;
import java.util.Set;

import io.surfworks.graphmatch.ir.Node;
import io.surfworks.graphmatch.ir.Value;

/**
 * One occurrence of a pattern in a target graph.
 *
 * <p>Only pattern entities reached while matching are mapped. {@code Param}
 * nodes are never present in {@link #nodeMap()}; the values they define are
 * present in {@link #valueMap()} and name the target values feeding the match.
 *
 * <p>Example, rewriting the matched region:
 * <pre>{@code
 * for (Match match : SubgraphMatchFinder.findMatches(pattern, graph)) {
 *     Value in = match.targetValue(patternInput);
 *     Value out = match.targetValue(patternOutput);
 *     // replace uses of out with a fused op reading in
 * }
 * }</pre>
 *
 * @param anchor the target node the pattern root matched
 * @param nodeMap pattern node to target node
 * @param valueMap pattern value to target value
 */
public record Match(
        Node anchor,
        Map<Node, Node> nodeMap,
        Map<Value, Value> valueMap
) {

    public Match {
        nodeMap = Map.copyOf(nodeMap);
        valueMap = Map.copyOf(valueMap);
    }

    /**
     * Gets the target node a pattern node matched.
     *
     * @param patternNode a node of the pattern graph
     * @return the target node, or null if the pattern node was not reached
     */
    public Node targetNode(Node patternNode) {
        return nodeMap.get(patternNode);
    }

    /**
     * Gets the target value a pattern value matched.
     *
     * @param patternValue a value of the pattern graph
     * @return the target value, or null if the pattern value was not reached
     */
    public Value targetValue(Value patternValue) {
        return valueMap.get(patternValue);
    }

    /**
     * Returns the target nodes covered by this match.
     */
    public Set<Node> matchedNodes() {
        return Set.copyOf(nodeMap.values());
    }

    /**
     * Checks if a target node is part of this match.
     */
    public boolean contains(Node targetNode) {
        return nodeMap.containsValue(targetNode);
    }

    /**
     * Returns the number of matched pattern nodes.
     */
    public int size() {
        return nodeMap.size();
    }

    @Override
    public String toString() {
        return String.format("Match[anchor=%s, nodes=%d, values=%d]",
                anchor, nodeMap.size(), valueMap.size());
    }
}
