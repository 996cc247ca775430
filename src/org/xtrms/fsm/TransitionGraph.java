/* @LICENSE@
 */

package org.xtrms.fsm;

import java.util.List;
import java.util.SortedSet;

/**
 * Read-only view of an automaton's states and edges, for reporting tools such
 * as {@link Graphviz}. State 0 is always the initial state.
 *
 * @param <A>
 *            the action type
 */
public interface TransitionGraph<A> {

    /**
     * @return every state mentioned by the automaton, including state 0.
     */
    SortedSet<Integer> states();

    /**
     * @return the edges leaving <code>state</code>, in insertion order; empty
     *         if there are none.
     */
    List<Transition<A>> transitions(int state);

    SortedSet<Integer> acceptingStates();

    boolean isAccepting(int state);
}
