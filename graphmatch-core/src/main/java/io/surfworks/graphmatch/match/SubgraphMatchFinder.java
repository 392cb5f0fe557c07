package io.surfworks.graphmatch.match;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.surfworks.graphmatch.ir.Block;
import io.surfworks.graphmatch.ir.Graph;
import io.surfworks.graphmatch.ir.Node;

/**
 * Finds every occurrence of a pattern graph in a target graph.
 *
 * <p>Every node of the target, including nodes in nested blocks, is tried as
 * an anchor. Blocks are visited from a worklist starting at the root block;
 * within a block anchors are tried in sequence order. Matches are reported in
 * visit order and are neither deduplicated nor checked for overlap.
 *
 * <p>Example usage:
 * <pre>{@code
 * List<Match> matches = SubgraphMatchFinder.findMatches(pattern, graph);
 *
 * // Or with configuration
 * SubgraphMatchFinder finder = new SubgraphMatchFinder(MatcherConfigLoader.load());
 * List<Match> first = finder.find(pattern, graph);
 * }</pre>
 *
 * <p>A finder holds no state between calls; each call builds its own
 * {@link SubgraphMatcher}.
 */
public final class SubgraphMatchFinder {

    private static final Logger LOG = Logger.getLogger(SubgraphMatchFinder.class.getName());

    private final MatcherConfig config;

    public SubgraphMatchFinder() {
        this(MatcherConfig.defaults());
    }

    public SubgraphMatchFinder(MatcherConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Finds all matches of {@code pattern} in {@code graph} with the default
     * configuration.
     *
     * @throws InvalidPatternException if the pattern is not valid
     */
    public static List<Match> findMatches(Graph pattern, Graph graph) {
        return new SubgraphMatchFinder().find(pattern, graph);
    }

    /**
     * Finds matches of {@code pattern} in {@code graph}.
     *
     * @param pattern a flat pattern graph returning a single value
     * @param graph the target graph, not modified
     * @return the matches in traversal order, at most {@link MatcherConfig#maxMatches()} if limited
     * @throws InvalidPatternException if the pattern is not valid
     */
    public List<Match> find(Graph pattern, Graph graph) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(graph, "graph");
        PatternValidator.requireValid(pattern);

        SubgraphMatcher matcher = new SubgraphMatcher(pattern);
        List<Match> matches = new ArrayList<>();
        Deque<Block> blocksToVisit = new ArrayDeque<>();
        int blocksVisited = 0;
        int anchorsTried = 0;

        blocksToVisit.push(graph.block());
        traversal:
        while (!blocksToVisit.isEmpty()) {
            Block block = blocksToVisit.pop();
            blocksVisited++;
            for (Node node : block.nodes()) {
                anchorsTried++;
                boolean matched = matcher.matchesFromAnchor(node);
                if (config.traceAttempts() && LOG.isLoggable(Level.FINEST)) {
                    LOG.finest("Anchor " + node + (matched ? " matched" : " rejected"));
                }
                if (matched) {
                    matches.add(new Match(node, matcher.nodeMap(), matcher.valueMap()));
                    if (config.isLimited() && matches.size() >= config.maxMatches()) {
                        LOG.fine("Stopping after " + matches.size() + " matches (maxMatches reached)");
                        break traversal;
                    }
                }
                for (Block sub : node.blocks()) {
                    blocksToVisit.push(sub);
                }
            }
        }

        LOG.fine("Found " + matches.size() + " matches of " + pattern.nodes().size()
                + "-node pattern; tried " + anchorsTried + " anchors in " + blocksVisited + " blocks");
        return matches;
    }

    public MatcherConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return String.format("SubgraphMatchFinder[maxMatches=%d, trace=%s]",
                config.maxMatches(), config.traceAttempts());
    }
}
