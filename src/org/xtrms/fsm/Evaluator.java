/* @LICENSE@
 */

package org.xtrms.fsm;

/**
 * A cursor stepping through an {@link Automaton} one action at a time. The
 * automaton is only read, so any number of evaluators may share one, provided
 * construction of the automaton is complete.
 *
 * @param <S>
 *            the evaluation state of the automaton
 * @param <A>
 *            the action type
 */
public final class Evaluator<S, A> {

    private final Automaton<S, A> automaton;
    private S state;

    public Evaluator(Automaton<S, A> automaton) {
        this.automaton = automaton;
        this.state = automaton.initial();
    }

    public static <S, A> Evaluator<S, A> of(Automaton<S, A> automaton) {
        return new Evaluator<S, A>(automaton);
    }

    /**
     * Performs an action on the automaton.
     *
     * @return <code>false</code> if the action is not accepted, in which case
     *         the state stays unchanged.
     */
    public boolean perform(A action) {
        S next = automaton.successor(state, action);
        if (next == null) {
            return false;
        }
        state = next;
        return true;
    }

    /**
     * Performs actions until one is rejected.
     *
     * @return the number of actions performed successfully.
     */
    public int performAll(Iterable<? extends A> actions) {
        int n = 0;
        for (A action : actions) {
            if (!perform(action)) {
                break;
            }
            ++n;
        }
        return n;
    }

    /**
     * @return <code>true</code> if the automaton is currently in an accepting
     *         state.
     */
    public boolean accepted() {
        return automaton.accepted(state);
    }

    /**
     * Resets the automaton to its initial state.
     */
    public void reset() {
        state = automaton.initial();
    }

    public S state() {
        return state;
    }

    @Override
    public String toString() {
        return "state: " + state + (accepted() ? " (accept)" : "");
    }
}
