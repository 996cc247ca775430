/* @LICENSE@
 */

package org.xtrms.fsm;

import static org.xtrms.fsm.Misc.LS;
import static org.xtrms.fsm.Misc.checkState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The transition table and accepting-state set shared by {@link NFA} and
 * {@link DFA}. Edge lists are replaced, never modified in place, so that a
 * list handed out by {@link #transitions(int)} stays valid.
 * <p>
 * Not thread safe for mutation. Once construction is complete, any number of
 * readers may share an instance.
 */
abstract class AbstractTransitionGraph<A> implements TransitionGraph<A> {

    private final Map<Integer, List<Transition<A>>> table =
        new TreeMap<Integer, List<Transition<A>>>();

    private SortedSet<Integer> accepting =
        Collections.unmodifiableSortedSet(new TreeSet<Integer>());

    public final List<Transition<A>> transitions(int state) {
        List<Transition<A>> ret = table.get(state);
        return ret != null ? ret : Collections.<Transition<A>>emptyList();
    }

    final void transitions(int state, List<Transition<A>> transitions) {
        table.put(state, Collections.unmodifiableList(
            new ArrayList<Transition<A>>(transitions)));
    }

    final void append(int state, Transition<A> t) {
        List<Transition<A>> ts = new ArrayList<Transition<A>>(transitions(state));
        ts.add(t);
        transitions(state, ts);
    }

    final void replace(int state, int index, Transition<A> t) {
        List<Transition<A>> ts = new ArrayList<Transition<A>>(transitions(state));
        ts.set(index, t);
        transitions(state, ts);
    }

    /**
     * Replaces the set of accepting states.
     */
    public final void setAcceptingStates(Collection<Integer> states) {
        SortedSet<Integer> temp = new TreeSet<Integer>();
        for (int s : states) {
            checkState(s);
            temp.add(s);
        }
        accepting = Collections.unmodifiableSortedSet(temp);
    }

    public final void setAcceptingStates(Integer... states) {
        setAcceptingStates(Arrays.asList(states));
    }

    public final SortedSet<Integer> acceptingStates() {
        return accepting;
    }

    public final boolean isAccepting(int state) {
        return accepting.contains(state);
    }

    public final SortedSet<Integer> states() {
        SortedSet<Integer> ret = new TreeSet<Integer>();
        ret.add(0);
        for (Map.Entry<Integer, List<Transition<A>>> e : table.entrySet()) {
            ret.add(e.getKey());
            for (Transition<A> t : e.getValue()) {
                ret.add(t.destination());
            }
        }
        ret.addAll(accepting);
        return Collections.unmodifiableSortedSet(ret);
    }

    /**
     * @return the number of edges, over all states.
     */
    public final int edgeCount() {
        int n = 0;
        for (List<Transition<A>> ts : table.values()) {
            n += ts.size();
        }
        return n;
    }

    private static final String INDENT = "    ";

    /**
     * Label used for a state in the dump produced by {@link #toString()}.
     */
    protected String label(int state) {
        return Integer.toString(state);
    }

    @Override
    public String toString() {
        SortedSet<Integer> states = states();
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName())
            .append(" total states: ").append(states.size())
            .append(" total arcs: ").append(edgeCount())
            .append(LS);
        for (int state : states) {
            sb.append("state: ").append(label(state));
            if (state == 0)             sb.append(" (init)");
            if (isAccepting(state))     sb.append(" (accept)");
            sb.append(LS);
            for (Transition<A> t : transitions(state)) {
                sb.append(INDENT).append(t).append(LS);
            }
        }
        return sb.toString();
    }
}
