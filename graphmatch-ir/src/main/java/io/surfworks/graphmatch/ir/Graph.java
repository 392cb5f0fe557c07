package io.surfworks.graphmatch.ir;

import java.util.List;

/**
 * A dataflow graph owning a root {@link Block}.
 *
 * <p>{@link #nodes()} iterates the root block only; nodes in nested blocks
 * are reached through {@link Node#blocks()}.
 *
 * <p>Example:
 * <pre>{@code
 * GraphBuilder b = new GraphBuilder();
 * Value x = b.input("x");
 * Value y = b.input("y");
 * Value sum = b.op("aten::add", x, y);
 * b.output(sum);
 * Graph graph = b.build();
 * }</pre>
 */
public final class Graph {

    private int nextNodeId;
    private int nextValueId;
    private final Block block;

    Graph() {
        this.block = new Block(this, null);
    }

    public Block block() {
        return block;
    }

    public List<Node> nodes() {
        return block.nodes();
    }

    public List<Value> inputs() {
        return block.inputs();
    }

    public List<Value> outputs() {
        return block.outputs();
    }

    public Node paramNode() {
        return block.paramNode();
    }

    public Node returnNode() {
        return block.returnNode();
    }

    int nextNodeId() {
        return nextNodeId++;
    }

    int nextValueId() {
        return nextValueId++;
    }

    @Override
    public String toString() {
        return GraphPrinter.print(this);
    }
}
