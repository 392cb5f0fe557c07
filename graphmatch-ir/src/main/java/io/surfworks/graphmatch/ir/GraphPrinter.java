package io.surfworks.graphmatch.ir;

import java.util.List;
import java.util.Map;

/**
 * Renders a {@link Graph} as IR-like text.
 *
 * <pre>
 * graph(%x, %y):
 *   %2 = aten::add(%x, %y)
 *   %3 = prim::Loop(%2)
 *     block0(%i):
 *       %5 = aten::mul(%i, %4)
 *       -&gt; (%5)
 *   return (%3)
 * </pre>
 */
public final class GraphPrinter {

    private static final String INDENT = "  ";

    private GraphPrinter() {}

    public static String print(Graph graph) {
        StringBuilder sb = new StringBuilder("graph(");
        appendValues(sb, graph.inputs());
        sb.append("):\n");
        appendBody(sb, graph.block(), 1);
        sb.append(INDENT).append("return (");
        appendValues(sb, graph.outputs());
        sb.append(")\n");
        return sb.toString();
    }

    /**
     * Renders a single node on one line, without nested blocks.
     */
    public static String print(Node node) {
        StringBuilder sb = new StringBuilder();
        if (!node.outputs().isEmpty()) {
            appendValues(sb, node.outputs());
            sb.append(" = ");
        }
        sb.append(node.kind());
        if (!node.attributes().isEmpty()) {
            sb.append('[');
            boolean first = true;
            for (Map.Entry<String, Object> attr : node.attributes().entrySet()) {
                if (!first) sb.append(", ");
                sb.append(attr.getKey()).append('=').append(attr.getValue());
                first = false;
            }
            sb.append(']');
        }
        sb.append('(');
        appendValues(sb, node.inputs());
        sb.append(')');
        return sb.toString();
    }

    private static void appendBody(StringBuilder sb, Block block, int depth) {
        for (Node node : block.nodes()) {
            sb.append(INDENT.repeat(depth)).append(print(node)).append('\n');
            for (int i = 0; i < node.blocks().size(); i++) {
                Block child = node.blocks().get(i);
                sb.append(INDENT.repeat(depth + 1)).append("block").append(i).append('(');
                appendValues(sb, child.inputs());
                sb.append("):\n");
                appendBody(sb, child, depth + 2);
                sb.append(INDENT.repeat(depth + 2)).append("-> (");
                appendValues(sb, child.outputs());
                sb.append(")\n");
            }
        }
    }

    private static void appendValues(StringBuilder sb, List<Value> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(values.get(i));
        }
    }
}
