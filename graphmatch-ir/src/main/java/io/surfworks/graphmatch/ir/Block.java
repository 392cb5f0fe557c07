package io.surfworks.graphmatch.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered scope of nodes.
 *
 * <p>Each block owns two bookend nodes that are not part of {@link #nodes()}:
 * a {@code Param} node whose outputs are the block inputs, and a
 * {@code Return} node whose inputs are the block outputs. The return node is
 * the block's exit marker and conceptually its last node.
 */
public final class Block {

    private final Graph graph;
    private final Node owningNode;
    private final Node paramNode;
    private final Node returnNode;
    private final List<Node> nodes = new ArrayList<>();

    Block(Graph graph, Node owningNode) {
        this.graph = graph;
        this.owningNode = owningNode;
        this.paramNode = new Node(graph, this, Kind.PARAM);
        this.returnNode = new Node(graph, this, Kind.RETURN);
    }

    /**
     * Returns the nodes of this block in sequence order, without the
     * param and return nodes. Nested blocks are not flattened in.
     */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Value> inputs() {
        return paramNode.outputs();
    }

    public List<Value> outputs() {
        return returnNode.inputs();
    }

    public Node paramNode() {
        return paramNode;
    }

    public Node returnNode() {
        return returnNode;
    }

    /**
     * Returns the node owning this block, or null for a graph's root block.
     */
    public Node owningNode() {
        return owningNode;
    }

    public Graph owningGraph() {
        return graph;
    }

    Value addInput() {
        return paramNode.addOutput();
    }

    void registerOutput(Value value) {
        returnNode.addInput(value);
    }

    Node appendNode(Kind kind) {
        if (kind.equals(Kind.PARAM) || kind.equals(Kind.RETURN)) {
            throw new IllegalArgumentException(kind + " nodes are owned by the block and cannot be appended");
        }
        Node node = new Node(graph, this, kind);
        nodes.add(node);
        return node;
    }

    @Override
    public String toString() {
        return String.format("Block[nodes=%d, inputs=%d, outputs=%d]",
                nodes.size(), inputs().size(), outputs().size());
    }
}
