package io.surfworks.graphmatch.ir;

import java.util.Objects;

/**
 * Fluent construction of {@link Graph}s.
 *
 * <p>A builder appends to one block. The top-level builder appends to the
 * graph's root block; {@link #subBlock(Node)} returns a builder for a new
 * child block of a node, sharing the same graph.
 *
 * <p>Example, a loop whose body multiplies by two:
 * <pre>{@code
 * GraphBuilder b = new GraphBuilder();
 * Value x = b.input("x");
 * Node loop = b.node("prim::Loop", 1, x);
 * GraphBuilder body = b.subBlock(loop);
 * Value i = body.input("i");
 * body.output(body.op("aten::mul", i, body.constant(2)));
 * b.output(loop.output());
 * Graph graph = b.build();
 * }</pre>
 */
public final class GraphBuilder {

    private final Graph graph;
    private final Block block;

    public GraphBuilder() {
        this.graph = new Graph();
        this.block = graph.block();
    }

    private GraphBuilder(Graph graph, Block block) {
        this.graph = graph;
        this.block = block;
    }

    /**
     * Adds an input to the current block.
     *
     * @param name the debug name, or null
     * @return the new input value, defined by the block's param node
     */
    public Value input(String name) {
        return block.addInput().setDebugName(name);
    }

    /**
     * Appends a single-output node.
     *
     * @param kind the qualified operator kind, e.g. {@code aten::add}
     * @param inputs the ordered inputs
     * @return the node's output
     */
    public Value op(String kind, Value... inputs) {
        return op(Kind.of(kind), inputs);
    }

    public Value op(Kind kind, Value... inputs) {
        return node(kind, 1, inputs).output();
    }

    /**
     * Appends a node with any number of outputs.
     *
     * @param kind the qualified operator kind
     * @param outputCount the number of outputs, zero or more
     * @param inputs the ordered inputs
     * @return the appended node
     */
    public Node node(String kind, int outputCount, Value... inputs) {
        return node(Kind.of(kind), outputCount, inputs);
    }

    public Node node(Kind kind, int outputCount, Value... inputs) {
        Objects.requireNonNull(kind, "kind");
        if (outputCount < 0) {
            throw new IllegalArgumentException("outputCount must be >= 0, got " + outputCount);
        }
        for (Value input : inputs) {
            Objects.requireNonNull(input, "input");
            if (input.owningGraph() != graph) {
                throw new IllegalArgumentException("Value " + input + " belongs to a different graph");
            }
        }
        Node node = block.appendNode(kind);
        for (Value input : inputs) {
            node.addInput(input);
        }
        for (int i = 0; i < outputCount; i++) {
            node.addOutput();
        }
        return node;
    }

    /**
     * Appends a {@code prim::Constant} node carrying the payload in its
     * {@code value} attribute.
     *
     * @return the constant's output
     */
    public Value constant(Object payload) {
        Node node = node(Kind.CONSTANT, 1);
        node.setAttribute("value", payload);
        return node.output();
    }

    /**
     * Sets an attribute on a node of this graph.
     *
     * @return this builder for chaining
     */
    public GraphBuilder attribute(Node node, String name, Object value) {
        requireSameGraph(node);
        node.setAttribute(Objects.requireNonNull(name, "name"), value);
        return this;
    }

    /**
     * Registers a value as an output of the current block.
     *
     * @return this builder for chaining
     */
    public GraphBuilder output(Value value) {
        block.registerOutput(Objects.requireNonNull(value, "value"));
        return this;
    }

    /**
     * Creates a new child block owned by {@code owner} and returns a builder
     * appending to it.
     *
     * @param owner a node of this graph
     * @return a builder for the child block
     */
    public GraphBuilder subBlock(Node owner) {
        requireSameGraph(owner);
        return new GraphBuilder(graph, owner.addBlock());
    }

    /**
     * Returns the block this builder appends to.
     */
    public Block block() {
        return block;
    }

    /**
     * Returns the graph under construction.
     */
    public Graph build() {
        return graph;
    }

    private void requireSameGraph(Node node) {
        Objects.requireNonNull(node, "node");
        if (node.owningGraph() != graph) {
            throw new IllegalArgumentException("Node " + node + " belongs to a different graph");
        }
    }
}
