package io.surfworks.graphmatch.match;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.graphmatch.ir.Block;
import io.surfworks.graphmatch.ir.Graph;
import io.surfworks.graphmatch.ir.GraphBuilder;
import io.surfworks.graphmatch.ir.Node;
import io.surfworks.graphmatch.ir.Value;

/**
 * Tests for whole-graph match search.
 */
@DisplayName("SubgraphMatchFinder")
class SubgraphMatchFinderTest {

    private static Graph placeholderPattern() {
        GraphBuilder pb = new GraphBuilder();
        pb.output(pb.input("a"));
        return pb.build();
    }

    /**
     * Builds a target with a loop whose body holds a conditional:
     * <pre>
     * %r = relu(%x)
     * %l = prim::Loop(%r)
     *   block0(%i): %m = mul(%i, %x); %c = prim::If(%m)
     *     block0(): %t = tanh(%m)
     *     block1(): %s = sigmoid(%m)
     * %n = neg(%l)
     * </pre>
     */
    private static Graph nestedTarget() {
        GraphBuilder b = new GraphBuilder();
        Value x = b.input("x");
        Value r = b.op("aten::relu", x);
        Node loop = b.node("prim::Loop", 1, r);
        GraphBuilder body = b.subBlock(loop);
        Value i = body.input("i");
        Value m = body.op("aten::mul", i, x);
        Node cond = body.node("prim::If", 1, m);
        GraphBuilder then = body.subBlock(cond);
        then.output(then.op("aten::tanh", m));
        GraphBuilder otherwise = body.subBlock(cond);
        otherwise.output(otherwise.op("aten::sigmoid", m));
        body.output(cond.output());
        Value n = b.op("aten::neg", loop.output());
        b.output(n);
        return b.build();
    }

    private static List<Node> allNodes(Block block) {
        List<Node> nodes = new ArrayList<>();
        for (Node node : block.nodes()) {
            nodes.add(node);
            for (Block sub : node.blocks()) {
                nodes.addAll(allNodes(sub));
            }
        }
        return nodes;
    }

    // ==================== End-to-End ====================

    @Nested
    @DisplayName("Search")
    class SearchTests {

        @Test
        @DisplayName("finds Add between a constant and a multiply")
        void findsAddInConstantChain() {
            // pattern: %s = add(%a, %c); return (%s)
            GraphBuilder pb = new GraphBuilder();
            Value a = pb.input("a");
            Value c = pb.input("c");
            Value s = pb.op("aten::add", a, c);
            pb.output(s);
            Graph pattern = pb.build();

            // target: %5 = Const(5); %add = add(%x, %5); %mul = mul(%add, Const(2))
            GraphBuilder tb = new GraphBuilder();
            Value x = tb.input("x");
            Value five = tb.constant(5);
            Value add = tb.op("aten::add", x, five);
            Value two = tb.constant(2);
            Value mul = tb.op("aten::mul", add, two);
            tb.output(mul);
            Graph graph = tb.build();

            List<Match> matches = SubgraphMatchFinder.findMatches(pattern, graph);

            assertEquals(1, matches.size());
            Match match = matches.get(0);
            assertSame(add.node(), match.anchor());
            assertSame(add.node(), match.targetNode(s.node()));
            assertEquals(Map.of(s, add, a, x, c, five), match.valueMap());
            assertEquals(Set.of(add.node()), match.matchedNodes());
            assertEquals(1, match.size());
        }

        @Test
        @DisplayName("a bare placeholder matches every node exactly once")
        void placeholderMatchesEveryNode() {
            Graph graph = nestedTarget();

            List<Match> matches = SubgraphMatchFinder.findMatches(placeholderPattern(), graph);

            List<Node> expected = allNodes(graph.block());
            assertEquals(expected.size(), matches.size());
            Set<Node> anchors = new HashSet<>();
            for (Match match : matches) {
                assertTrue(anchors.add(match.anchor()), "anchor reported twice: " + match.anchor());
                assertTrue(match.nodeMap().isEmpty());
            }
            assertEquals(new HashSet<>(expected), anchors);
        }

        @Test
        @DisplayName("visits the root block in sequence order first")
        void visitsRootBlockFirst() {
            Graph graph = nestedTarget();

            List<Match> matches = SubgraphMatchFinder.findMatches(placeholderPattern(), graph);

            List<Node> root = graph.nodes();
            for (int i = 0; i < root.size(); i++) {
                assertSame(root.get(i), matches.get(i).anchor());
            }
        }

        @Test
        @DisplayName("never matches a node with a different input count")
        void rejectsArityMismatchEverywhere() {
            GraphBuilder pb = new GraphBuilder();
            Value a = pb.input("a");
            Value c = pb.input("c");
            pb.output(pb.op("aten::cat", a, c));

            GraphBuilder tb = new GraphBuilder();
            Value x = tb.input("x");
            Value y = tb.input("y");
            Value z = tb.input("z");
            tb.output(tb.op("aten::cat", x, y, z));

            assertTrue(SubgraphMatchFinder.findMatches(pb.build(), tb.build()).isEmpty());
        }

        @Test
        @DisplayName("reports overlapping matches")
        void reportsOverlappingMatches() {
            // pattern: add(add(%a, %b), %c)
            GraphBuilder pb = new GraphBuilder();
            Value a = pb.input("a");
            Value b = pb.input("b");
            Value c = pb.input("c");
            pb.output(pb.op("aten::add", pb.op("aten::add", a, b), c));

            // target: ((x + y) + z) + w
            GraphBuilder tb = new GraphBuilder();
            Value x = tb.input("x");
            Value y = tb.input("y");
            Value z = tb.input("z");
            Value w = tb.input("w");
            Value s1 = tb.op("aten::add", x, y);
            Value s2 = tb.op("aten::add", s1, z);
            Value s3 = tb.op("aten::add", s2, w);
            tb.output(s3);

            List<Match> matches = SubgraphMatchFinder.findMatches(pb.build(), tb.build());

            assertEquals(2, matches.size());
            assertSame(s2.node(), matches.get(0).anchor());
            assertSame(s3.node(), matches.get(1).anchor());
            assertTrue(matches.get(0).contains(s2.node()));
            assertTrue(matches.get(1).contains(s2.node()));
        }

        @Test
        @DisplayName("leaves unreached pattern nodes unmapped")
        void leavesUnreachedNodesUnmapped() {
            GraphBuilder pb = new GraphBuilder();
            Value a = pb.input("a");
            Value dead = pb.op("aten::tanh", a);
            pb.output(pb.op("aten::relu", a));

            GraphBuilder tb = new GraphBuilder();
            Value x = tb.input("x");
            tb.output(tb.op("aten::relu", x));

            List<Match> matches = SubgraphMatchFinder.findMatches(pb.build(), tb.build());

            assertEquals(1, matches.size());
            assertNull(matches.get(0).targetNode(dead.node()));
            assertNull(matches.get(0).targetValue(dead));
        }
    }

    // ==================== Scoping ====================

    @Nested
    @DisplayName("Scoping")
    class ScopingTests {

        private Graph mulAddPattern() {
            GraphBuilder pb = new GraphBuilder();
            Value a = pb.input("a");
            Value b = pb.input("b");
            Value c = pb.input("c");
            pb.output(pb.op("aten::add", pb.op("aten::mul", a, b), c));
            return pb.build();
        }

        @Test
        @DisplayName("does not match across block boundaries")
        void doesNotMatchAcrossBlocks() {
            GraphBuilder tb = new GraphBuilder();
            Value x = tb.input("x");
            Value y = tb.input("y");
            Value m = tb.op("aten::mul", x, y);
            Node cond = tb.node("prim::If", 1, x);
            GraphBuilder then = tb.subBlock(cond);
            then.output(then.op("aten::add", m, y));
            tb.output(cond.output());

            assertEquals(1, m.useCount());
            assertTrue(SubgraphMatchFinder.findMatches(mulAddPattern(), tb.build()).isEmpty());
        }

        @Test
        @DisplayName("matches inside a nested block")
        void matchesInsideNestedBlock() {
            GraphBuilder tb = new GraphBuilder();
            Value x = tb.input("x");
            Value y = tb.input("y");
            Node cond = tb.node("prim::If", 1, x);
            GraphBuilder then = tb.subBlock(cond);
            Value m = then.op("aten::mul", x, y);
            Value s = then.op("aten::add", m, y);
            then.output(s);
            tb.output(cond.output());

            List<Match> matches = SubgraphMatchFinder.findMatches(mulAddPattern(), tb.build());

            assertEquals(1, matches.size());
            assertSame(s.node(), matches.get(0).anchor());
            assertEquals(Set.of(m.node(), s.node()), matches.get(0).matchedNodes());
        }
    }

    // ==================== Soundness ====================

    @Nested
    @DisplayName("Soundness")
    class SoundnessTests {

        @Test
        @DisplayName("every reported match replays to the same maps")
        void matchesReplay() {
            GraphBuilder pb = new GraphBuilder();
            Value a = pb.input("a");
            pb.output(pb.op("aten::mul", pb.op("aten::relu", a), a));
            Graph pattern = pb.build();

            GraphBuilder tb = new GraphBuilder();
            Value x = tb.input("x");
            Value first = tb.op("aten::mul", tb.op("aten::relu", x), x);
            Value second = tb.op("aten::mul", tb.op("aten::relu", first), first);
            tb.output(second);
            Graph graph = tb.build();

            List<Match> matches = SubgraphMatchFinder.findMatches(pattern, graph);
            assertEquals(2, matches.size());

            SubgraphMatcher replay = new SubgraphMatcher(pattern);
            for (Match match : matches) {
                assertTrue(replay.matchesFromAnchor(match.anchor()));
                assertEquals(match.nodeMap(), replay.nodeMap());
                assertEquals(match.valueMap(), replay.valueMap());
            }
        }

        @Test
        @DisplayName("does not modify the graphs")
        void leavesGraphsUntouched() {
            Graph pattern = placeholderPattern();
            Graph graph = nestedTarget();
            String before = graph.toString();

            SubgraphMatchFinder.findMatches(pattern, graph);

            assertEquals(before, graph.toString());
        }
    }

    // ==================== Preconditions and Configuration ====================

    @Nested
    @DisplayName("Preconditions")
    class PreconditionTests {

        @Test
        @DisplayName("rejects an invalid pattern on every call")
        void rejectsInvalidPatternRepeatedly() {
            GraphBuilder pb = new GraphBuilder();
            Value a = pb.input("a");
            pb.output(pb.op("aten::relu", a));
            pb.output(pb.op("aten::tanh", a));
            Graph pattern = pb.build();
            Graph graph = nestedTarget();

            InvalidPatternException first = assertThrows(InvalidPatternException.class,
                    () -> SubgraphMatchFinder.findMatches(pattern, graph));
            InvalidPatternException second = assertThrows(InvalidPatternException.class,
                    () -> SubgraphMatchFinder.findMatches(pattern, graph));

            assertEquals(first.getMessage(), second.getMessage());
            assertEquals(first.violations(), second.violations());
        }

        @Test
        @DisplayName("rejects a pattern with sub-blocks")
        void rejectsNestedPattern() {
            GraphBuilder pb = new GraphBuilder();
            Value a = pb.input("a");
            Node loop = pb.node("prim::Loop", 1, a);
            GraphBuilder body = pb.subBlock(loop);
            body.output(body.input("i"));
            pb.output(loop.output());

            assertThrows(InvalidPatternException.class,
                    () -> SubgraphMatchFinder.findMatches(pb.build(), nestedTarget()));
        }

        @Test
        @DisplayName("stops at the configured match limit")
        void stopsAtMatchLimit() {
            SubgraphMatchFinder finder = new SubgraphMatchFinder(
                    MatcherConfig.defaults().withMaxMatches(2).withTraceAttempts(true));

            List<Match> matches = finder.find(placeholderPattern(), nestedTarget());

            assertEquals(2, matches.size());
        }
    }
}
