/* @LICENSE@
 */

package org.xtrms.fsm;

import static org.xtrms.fsm.Misc.checkState;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A deterministic finite automaton. States are non-negative integers, state 0
 * being the initial state. The filters of the edges leaving any one state are
 * pairwise disjoint, so at most one edge matches a given action.
 * <p>
 * A DFA is either {@linkplain #DFA(NFA) determinized} from an {@link NFA}
 * by subset construction, or built empty and populated with
 * {@link #addTransition(int, Filter, int)}.
 *
 * @param <A>
 *            the action type
 */
public final class DFA<A> extends AbstractTransitionGraph<A>
        implements Automaton<Integer, A> {

    private static final Logger logger = Logger.getLogger("org.xtrms.fsm");
    private static final Level level = Level.FINEST;

    /**
     * System property overriding {@link #DEFAULT_MAX_STATE_COUNT}.
     */
    public static final String MAX_STATES_PROPERTY = "org.xtrms.fsm.dfa.maxStates";

    public static final int DEFAULT_MAX_STATE_COUNT = 10 * 1000;

    /**
     * Thrown when subset construction discovers more DFA states than allowed.
     */
    public static final class ConstructionException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public ConstructionException(String msg) {
            super(msg);
        }
    }

    /*
     * NFA state subset of each state; empty for hand-built automata.
     */
    private final List<SortedSet<Integer>> subsets =
        new ArrayList<SortedSet<Integer>>();

    private int conflicts = 0;

    /**
     * Constructs an empty DFA: state 0, no edges, nothing accepting.
     */
    public DFA() {
    }

    /**
     * Construct a complete DFA from an NFA, bounded by the state ceiling of
     * the {@value #MAX_STATES_PROPERTY} system property (default
     * {@value #DEFAULT_MAX_STATE_COUNT}).
     */
    public DFA(NFA<A> nfa) {
        this(nfa, Integer.getInteger(MAX_STATES_PROPERTY,
            DEFAULT_MAX_STATE_COUNT));
    }

    /**
     * Construct a complete DFA from an NFA by subset construction. Each DFA
     * state stands for a reachable set of NFA states; sets are identified by
     * value. The edges leaving a state are derived from the
     * {@linkplain NFA#atomicFilters(java.util.Set) atomic filters} of its set,
     * so they are disjoint by construction.
     *
     * @throws ConstructionException
     *             if more than <code>maxStates</code> states are discovered
     */
    public DFA(final NFA<A> nfa, final int maxStates) {

        final class StateFactory {

            private final Map<SortedSet<Integer>, Integer> map =
                new LinkedHashMap<SortedSet<Integer>, Integer>();
            private final List<Integer> accepting = new ArrayList<Integer>();

            private int stateFrom(SortedSet<Integer> nfaStates) {
                Integer state = map.get(nfaStates);
                if (state == null) {
                    if (map.size() >= maxStates) {
                        throw new ConstructionException(
                            "DFA state count exceeded: " + maxStates);
                    }
                    state = map.size();
                    map.put(nfaStates, state);
                    subsets.add(nfaStates);
                    if (nfa.accepted(nfaStates)) {
                        accepting.add(state);
                    }
                }
                return state;
            }
        }
        final StateFactory factory = new StateFactory();

        if (logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, "nfa: " + nfa.toString());
        }

        /*
         * Subset construction as breadth first search: subsets holds the
         * discovered sets in id order, everything past current is gray.
         */
        factory.stateFrom(nfa.initial());
        for (int current = 0; current < subsets.size(); ++current) {
            SortedSet<Integer> set = subsets.get(current);
            for (Filter<A> f : nfa.atomicFilters(set)) {
                SortedSet<Integer> next = nfa.successor(set, f);
                if (next != null) {
                    merge(current, f, factory.stateFrom(next));
                }
            }
        }
        setAcceptingStates(factory.accepting);

        assert isDeterministic() : this;

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa: " + toString());
        }
    }

    /*
     * Adds f to the edge source -> destination, creating it if needed. No conflict
     * check: the caller guarantees f is disjoint from every other guard.
     */
    private Insertion merge(int source, Filter<A> f, int destination) {
        List<Transition<A>> ts = transitions(source);
        for (int i = 0; i < ts.size(); ++i) {
            Transition<A> t = ts.get(i);
            if (t.destination() == destination) {
                replace(source, i, Transition.guarded(destination,
                    t.filter().union(f)));
                return Insertion.EXTENDED;
            }
        }
        append(source, Transition.guarded(destination, f));
        return Insertion.ADDED;
    }

    /**
     * Adds a transition to a hand-built automaton. Wherever the filter
     * overlaps an existing edge from <code>source</code> to a different
     * destination, the existing edge wins and the overlap is dropped from
     * the new filter. Such conflicts are counted (see
     * {@link #conflictCount()}) and logged as warnings, since they change the
     * accepted language.
     *
     * @return {@link Insertion#EMPTY_FILTER} for an empty filter,
     *         {@link Insertion#SHADOWED} if nothing of the filter was left,
     *         {@link Insertion#NARROWED} if only part was left, otherwise
     *         {@link Insertion#ADDED} or {@link Insertion#EXTENDED}.
     */
    public Insertion addTransition(int source, Filter<A> filter,
            int destination) {
        checkState(source);
        checkState(destination);
        if (filter.isEmpty()) {
            logger.log(Level.FINE, "ignoring empty filter transition: "
                + source + " -> " + destination);
            return Insertion.EMPTY_FILTER;
        }
        Filter<A> remaining = filter;
        int overlaps = 0;
        for (Transition<A> t : transitions(source)) {
            if (t.destination() != destination
                    && t.filter().intersects(remaining)) {
                remaining = remaining.difference(t.filter());
                ++overlaps;
            }
        }
        if (overlaps > 0) {
            conflicts += overlaps;
            logger.warning("conflicting transition " + source + " -"
                + filter + "-> " + destination + " overlaps " + overlaps
                + " existing edge(s); keeping " + remaining);
        }
        if (remaining.isEmpty()) {
            return Insertion.SHADOWED;
        }
        Insertion ret = merge(source, remaining, destination);
        return overlaps > 0 ? Insertion.NARROWED : ret;
    }

    public Insertion addTransition(int source, Range<A> range,
            int destination) {
        return addTransition(source, Filter.of(range), destination);
    }

    /**
     * @return the number of overlaps resolved in favor of pre-existing edges
     *         by {@link #addTransition(int, Filter, int)}.
     */
    public int conflictCount() {
        return conflicts;
    }

    /**
     * @return the state reached on <code>action</code>, or <code>null</code>
     *         if no edge leaving <code>state</code> includes it.
     */
    public Integer successor(Integer state, A action) {
        for (Transition<A> t : transitions(state)) {
            if (t.filter().includes(action)) {
                return t.destination();
            }
        }
        return null;
    }

    public boolean accepted(Integer state) {
        return isAccepting(state);
    }

    public Integer initial() {
        return 0;
    }

    /**
     * @return the set of NFA states a determinized state stands for, or
     *         <code>null</code> for a state of a hand-built automaton.
     */
    public SortedSet<Integer> subset(int state) {
        return 0 <= state && state < subsets.size() ? subsets.get(state) : null;
    }

    /**
     * @return <code>true</code> if, for every state, no action is matched by
     *         more than one outgoing edge.
     */
    public boolean isDeterministic() {
        for (int state : states()) {
            List<Filter<A>> guards = new ArrayList<Filter<A>>();
            for (Transition<A> t : transitions(state)) {
                guards.add(t.filter());
            }
            if (!Filter.isDisjoint(guards)) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected String label(int state) {
        SortedSet<Integer> subset = subset(state);
        return subset == null ? super.label(state) : state + " " + subset;
    }
}
