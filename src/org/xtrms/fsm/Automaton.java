/* @LICENSE@
 */

package org.xtrms.fsm;

/**
 * The contract an automaton fulfils so that an {@link Evaluator} can step
 * through it. Evaluation states must be immutable values with meaningful
 * <code>equals()</code>.
 *
 * @param <S>
 *            the evaluation state
 * @param <A>
 *            the action type
 */
public interface Automaton<S, A> {

    S initial();

    /**
     * @return the state reached from <code>state</code> on
     *         <code>action</code>, or <code>null</code> if there is no such
     *         transition. A missing transition is a normal rejection, not a
     *         fault.
     */
    S successor(S state, A action);

    boolean accepted(S state);
}
