package io.surfworks.graphmatch.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single result produced by exactly one {@link Node}.
 *
 * <p>Values are compared by identity. Uses are recorded by the graph as
 * consuming nodes are appended, so {@link #uses()} always reflects the whole
 * graph including nested blocks and {@code Return} nodes.
 */
public final class Value {

    /**
     * One consumption of a value.
     *
     * @param user the consuming node
     * @param offset the input position within the consumer
     */
    public record Use(Node user, int offset) {}

    private final Node node;
    private final int offset;
    private final int id;
    private final List<Use> uses = new ArrayList<>();
    private String debugName;

    Value(Node node, int offset, int id) {
        this.node = node;
        this.offset = offset;
        this.id = id;
    }

    /**
     * Returns the defining node.
     */
    public Node node() {
        return node;
    }

    /**
     * Returns the output position within the defining node.
     */
    public int offset() {
        return offset;
    }

    /**
     * Returns the graph-unique id.
     */
    public int id() {
        return id;
    }

    public List<Use> uses() {
        return Collections.unmodifiableList(uses);
    }

    public int useCount() {
        return uses.size();
    }

    public boolean hasSingleUse() {
        return uses.size() == 1;
    }

    public String debugName() {
        return debugName;
    }

    public boolean hasDebugName() {
        return debugName != null;
    }

    /**
     * Sets the name used when printing this value.
     *
     * @param name the debug name, without the {@code %} prefix
     * @return this value
     */
    public Value setDebugName(String name) {
        this.debugName = name;
        return this;
    }

    /**
     * Returns the printable name: the debug name when set, else the id.
     */
    public String displayName() {
        return debugName != null ? debugName : Integer.toString(id);
    }

    void addUse(Node user, int inputOffset) {
        uses.add(new Use(user, inputOffset));
    }

    Graph owningGraph() {
        return node.owningGraph();
    }

    @Override
    public String toString() {
        return "%" + displayName();
    }
}
