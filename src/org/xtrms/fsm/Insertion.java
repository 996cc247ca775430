/* @LICENSE@
 */

package org.xtrms.fsm;

/**
 * The outcome of adding a transition to an automaton. None of these abort the
 * insertion with an exception: the automaton is always left consistent, and
 * batch construction code can inspect the outcome and report it.
 */
public enum Insertion {

    /**
     * A new edge was inserted.
     */
    ADDED,

    /**
     * The filter was unioned into the existing edge between the same pair of
     * states.
     */
    EXTENDED,

    /**
     * An equivalent epsilon edge already existed; nothing changed.
     */
    DUPLICATE,

    /**
     * The filter was empty; nothing changed.
     */
    EMPTY_FILTER,

    /**
     * DFA only: part of the filter overlapped edges to other destinations and
     * was dropped in their favor. The remainder was inserted or merged.
     */
    NARROWED,

    /**
     * DFA only: the whole filter overlapped edges to other destinations;
     * nothing was inserted.
     */
    SHADOWED;

    /**
     * @return <code>true</code> if the automaton accepts different input
     *         than it would had the transition been taken literally.
     */
    public boolean isConflict() {
        return this == NARROWED || this == SHADOWED;
    }
}
