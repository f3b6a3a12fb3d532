package com.db.vf2pp.matching;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Depth-first VF2++ search over two indexed graphs, driven by an explicit frame stack.
 * <p>
 * Each complete mapping is handed out by {@link #next()} as an array {@code forward[n] = m} over the
 * first graph's nodes. The search pauses there and resumes from the same frame on the following
 * {@link #hasNext()}. Instances are single-threaded and own all of their state.
 */
public final class VF2ppSearch implements Iterator<int[]> {
    private static final Logger logger = LoggerFactory.getLogger(VF2ppSearch.class);

    private final MatchingState state;
    private final CandidateGenerator generator;
    private final FeasibilityChecker checker;
    private final int[] order;
    private final Deque<SearchFrame> stack = new ArrayDeque<>();
    private SearchStatus status;
    private int[] pending;

    public VF2ppSearch(GraphIndex<?> g1, GraphIndex<?> g2, MatchMode mode, int labelCount) {
        this.state = new MatchingState(g1, g2);
        this.generator = new CandidateGenerator(g1, g2, state, mode);
        this.checker = new FeasibilityChecker(g1, g2, state, mode, labelCount);
        this.order = NodeOrdering.matchingOrder(g1, LabelGroups.countByLabelId(labelsOf(g2), labelCount));
        logger.debug("Matching order computed for {} nodes", order.length);

        if (order.length == 0) {
            status = SearchStatus.EXHAUSTED;
        } else {
            stack.push(new SearchFrame(order[0], generator.candidates(order[0])));
            status = SearchStatus.SEARCHING;
        }
    }

    private static int[] labelsOf(GraphIndex<?> graph) {
        int[] labels = new int[graph.size()];
        for (int node = 0; node < labels.length; node++) {
            labels[node] = graph.label(node);
        }
        return labels;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (status == SearchStatus.EXHAUSTED || status == SearchStatus.DONE) {
            return false;
        }
        pending = advance();
        return pending != null;
    }

    @Override
    public int[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Search is " + status);
        }
        int[] result = pending;
        pending = null;
        return result;
    }

    /**
     * Abandons the search. No further mappings are produced.
     */
    public void halt() {
        stack.clear();
        pending = null;
        status = SearchStatus.DONE;
    }

    public SearchStatus getStatus() {
        return status;
    }

    public int[] getMatchingOrder() {
        return order.clone();
    }

    MatchingState state() {
        return state;
    }

    private int[] advance() {
        while (!stack.isEmpty()) {
            SearchFrame frame = stack.peek();
            if (frame.matched != MatchingState.UNMAPPED) {
                // back from a deeper frame or from a reported mapping
                state.rollback(frame.node, frame.matched);
                frame.matched = MatchingState.UNMAPPED;
            }
            status = SearchStatus.SEARCHING;

            boolean descended = false;
            while (frame.hasMoreCandidates()) {
                int candidate = frame.nextCandidate();
                if (!checker.isFeasible(frame.node, candidate)) {
                    continue;
                }
                state.commit(frame.node, candidate);
                frame.matched = candidate;
                if (state.size() == order.length) {
                    status = SearchStatus.MATCH_FOUND;
                    return state.forward();
                }
                int nextNode = order[stack.size()];
                stack.push(new SearchFrame(nextNode, generator.candidates(nextNode)));
                descended = true;
                break;
            }
            if (!descended) {
                stack.pop();
            }
        }
        status = SearchStatus.EXHAUSTED;
        return null;
    }

    /**
     * One level of the search: a first graph node and the candidates not yet tried for it.
     */
    private static final class SearchFrame {
        private final int node;
        private final int[] candidates;
        private int cursor;
        private int matched = MatchingState.UNMAPPED;

        private SearchFrame(int node, int[] candidates) {
            this.node = node;
            this.candidates = candidates;
        }

        private boolean hasMoreCandidates() {
            return cursor < candidates.length;
        }

        private int nextCandidate() {
            return candidates[cursor++];
        }
    }
}
