/* @LICENSE@
 */

package org.xtrms.fsm;

import static org.xtrms.fsm.Misc.checkState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A nondeterministic finite automaton. States are non-negative integers,
 * state 0 being the initial state. Edges are either epsilon edges, taken
 * without consuming an action, or guarded by a non-empty {@link Filter}.
 * Between a given pair of states there is at most one guarded edge; adding
 * another unions its filter into the existing one.
 * <p>
 * The evaluation state of an NFA is the set of states it may be in. The sets
 * handed out are unmodifiable and sorted, so that they compare by value.
 *
 * @param <A>
 *            the action type
 */
public final class NFA<A> extends AbstractTransitionGraph<A>
        implements Automaton<Set<Integer>, A> {

    private static final Logger logger = Logger.getLogger("org.xtrms.fsm");
    private static final Level level = Level.FINE;

    /**
     * Adds or extends a guarded transition.
     *
     * @return {@link Insertion#EMPTY_FILTER} (and no change) if the filter is
     *         empty, {@link Insertion#EXTENDED} if a guarded edge
     *         <code>source -&gt; destination</code> existed, otherwise
     *         {@link Insertion#ADDED}.
     */
    public Insertion addTransition(int source, Filter<A> filter,
            int destination) {
        checkState(source);
        checkState(destination);
        if (filter.isEmpty()) {
            logger.log(level, "ignoring empty filter transition: "
                + source + " -> " + destination);
            return Insertion.EMPTY_FILTER;
        }
        List<Transition<A>> ts = transitions(source);
        for (int i = 0; i < ts.size(); ++i) {
            Transition<A> t = ts.get(i);
            if (t.destination() == destination && !t.isEpsilon()) {
                replace(source, i, Transition.guarded(destination,
                    t.filter().union(filter)));
                return Insertion.EXTENDED;
            }
        }
        append(source, Transition.guarded(destination, filter));
        return Insertion.ADDED;
    }

    public Insertion addTransition(int source, Range<A> range,
            int destination) {
        return addTransition(source, Filter.of(range), destination);
    }

    /**
     * Adds an epsilon transition, unless it already exists.
     */
    public Insertion addTransition(int source, int destination) {
        checkState(source);
        checkState(destination);
        for (Transition<A> t : transitions(source)) {
            if (t.destination() == destination && t.isEpsilon()) {
                return Insertion.DUPLICATE;
            }
        }
        append(source, Transition.<A>epsilon(destination));
        return Insertion.ADDED;
    }

    /**
     * @return the set of all states reachable from a state in
     *         <code>states</code> by epsilon transitions only, including the
     *         states themselves.
     */
    public SortedSet<Integer> epsilonClosure(Set<Integer> states) {
        SortedSet<Integer> ret = new TreeSet<Integer>(states);
        LinkedList<Integer> gray = new LinkedList<Integer>(ret);
        while (!gray.isEmpty()) {
            for (Transition<A> t : transitions(gray.removeFirst())) {
                if (t.isEpsilon() && ret.add(t.destination())) {
                    gray.addLast(t.destination());
                }
            }
        }
        return Collections.unmodifiableSortedSet(ret);
    }

    /**
     * Computes the set of states reachable on an action, closed under
     * epsilon transitions.
     *
     * @return the successor set, or <code>null</code> if no guarded edge
     *         leaving <code>states</code> includes <code>action</code>.
     */
    public SortedSet<Integer> successor(Set<Integer> states, A action) {
        SortedSet<Integer> ret = new TreeSet<Integer>();
        for (int s : states) {
            for (Transition<A> t : transitions(s)) {
                if (!t.isEpsilon() && t.filter().includes(action)) {
                    ret.add(t.destination());
                }
            }
        }
        return ret.isEmpty() ? null : epsilonClosure(ret);
    }

    /**
     * As {@link #successor(Set, Object)}, following the guarded edges whose
     * filter includes <i>all</i> of <code>filter</code>.
     */
    public SortedSet<Integer> successor(Set<Integer> states, Filter<A> filter) {
        SortedSet<Integer> ret = new TreeSet<Integer>();
        for (int s : states) {
            for (Transition<A> t : transitions(s)) {
                if (!t.isEpsilon() && t.filter().includes(filter)) {
                    ret.add(t.destination());
                }
            }
        }
        return ret.isEmpty() ? null : epsilonClosure(ret);
    }

    /**
     * @return the {@linkplain Filter#atomize(java.util.Collection) atomized}
     *         guards of every guarded edge leaving <code>states</code>: the
     *         partition of the alphabet relevant to that set of states.
     */
    public List<Filter<A>> atomicFilters(Set<Integer> states) {
        List<Filter<A>> filters = new ArrayList<Filter<A>>();
        for (int s : states) {
            for (Transition<A> t : transitions(s)) {
                if (!t.isEpsilon()) {
                    filters.add(t.filter());
                }
            }
        }
        return Filter.atomize(filters);
    }

    /**
     * @return <code>true</code> if any of <code>states</code> is accepting.
     */
    public boolean accepted(Set<Integer> states) {
        for (int s : states) {
            if (isAccepting(s)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the epsilon closure of <code>{0}</code>.
     */
    public SortedSet<Integer> initial() {
        return epsilonClosure(Collections.singleton(0));
    }
}
