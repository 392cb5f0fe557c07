package io.surfworks.graphmatch.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single operation with ordered inputs and outputs.
 *
 * <p>Nodes are compared by identity. Every node belongs to exactly one
 * {@link Block}; a node may itself own child blocks (loop or conditional
 * bodies). Attributes carry non-value operands such as constant payloads.
 *
 * <p>Nodes are created through {@link GraphBuilder}; the read accessors
 * here are all the matcher relies on.
 */
public final class Node {

    private final Graph graph;
    private final Block owningBlock;
    private final Kind kind;
    private final int id;
    private final List<Value> inputs = new ArrayList<>();
    private final List<Value> outputs = new ArrayList<>();
    private final List<Block> blocks = new ArrayList<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    Node(Graph graph, Block owningBlock, Kind kind) {
        this.graph = graph;
        this.owningBlock = owningBlock;
        this.kind = kind;
        this.id = graph.nextNodeId();
    }

    public Kind kind() {
        return kind;
    }

    public int id() {
        return id;
    }

    public List<Value> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<Value> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    /**
     * Returns the single input of this node.
     *
     * @throws IllegalStateException if the node does not have exactly one input
     */
    public Value input() {
        if (inputs.size() != 1) {
            throw new IllegalStateException(kind + " has " + inputs.size() + " inputs, expected 1");
        }
        return inputs.get(0);
    }

    /**
     * Returns the single output of this node.
     *
     * @throws IllegalStateException if the node does not have exactly one output
     */
    public Value output() {
        if (outputs.size() != 1) {
            throw new IllegalStateException(kind + " has " + outputs.size() + " outputs, expected 1");
        }
        return outputs.get(0);
    }

    public Block owningBlock() {
        return owningBlock;
    }

    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    public boolean hasBlocks() {
        return !blocks.isEmpty();
    }

    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Gets an attribute value.
     *
     * @param name the attribute name
     * @return the attribute value, or null if not present
     */
    public Object attribute(String name) {
        return attributes.get(name);
    }

    Graph owningGraph() {
        return graph;
    }

    Value addOutput() {
        Value v = new Value(this, outputs.size(), graph.nextValueId());
        outputs.add(v);
        return v;
    }

    void addInput(Value value) {
        if (value.owningGraph() != graph) {
            throw new IllegalArgumentException("Value " + value + " belongs to a different graph");
        }
        value.addUse(this, inputs.size());
        inputs.add(value);
    }

    Block addBlock() {
        Block block = new Block(graph, this);
        blocks.add(block);
        return block;
    }

    void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }

    @Override
    public String toString() {
        return kind + "#" + id;
    }
}
