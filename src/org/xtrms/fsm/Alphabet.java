/* @LICENSE@
 */

package org.xtrms.fsm;

import java.util.Comparator;

/**
 * The ordered domain of the actions an automaton consumes. An
 * <code>Alphabet</code> supplies the total order over actions and, for
 * <i>discrete</i> alphabets, the successor and predecessor of an action. The
 * latter are what allows two {@link Range}s to be recognized as adjacent
 * ("touching") and what allows a range to be cut when another range is
 * subtracted from it.
 * <p>
 * A non-discrete alphabet answers <code>null</code> for every successor and
 * predecessor. For such an alphabet touching degenerates to intersection, and
 * a {@link Filter#difference(Range) difference} which would have to split a
 * range fails with an {@link UnsupportedOperationException}.
 * <p>
 * The <code>Alphabet</code> is also the factory for its ranges and filters.
 * Ranges and filters remember the alphabet which created them, and filters
 * from different alphabets cannot be combined.
 *
 * @param <A>
 *            the action type
 * @see Alphabets
 */
public abstract class Alphabet<A> implements Comparator<A> {

    private final String name;

    protected Alphabet(String name) {
        this.name = name;
    }

    /**
     * @param action
     *            an action of this alphabet
     * @return the smallest action greater than <code>action</code>, or
     *         <code>null</code> if there is none (either <code>action</code>
     *         is the maximum, or the alphabet is not discrete).
     */
    public abstract A successor(A action);

    /**
     * @param action
     *            an action of this alphabet
     * @return the greatest action smaller than <code>action</code>, or
     *         <code>null</code> if there is none.
     */
    public abstract A predecessor(A action);

    /**
     * @return <code>true</code> if {@link #successor(Object)} and
     *         {@link #predecessor(Object)} are meaningful.
     */
    public abstract boolean isDiscrete();

    /**
     * @return <code>true</code> if <code>upper</code> immediately follows
     *         <code>lower</code>, with no action in between.
     */
    public boolean adjacent(A lower, A upper) {
        A next = successor(lower);
        return next != null && compare(next, upper) == 0;
    }

    /**
     * A printable form of an action, used by debug strings only.
     */
    public String label(A action) {
        return String.valueOf(action);
    }

    /**
     * @return the inclusive range [front, back]
     * @throws InvalidRangeException
     *             if <code>front</code> is greater than <code>back</code>
     */
    public final Range<A> range(A front, A back) {
        return new Range<A>(this, front, back);
    }

    /**
     * @return the range holding the single action.
     */
    public final Range<A> range(A action) {
        return new Range<A>(this, action, action);
    }

    /**
     * @return the filter including exactly the given actions.
     */
    @SafeVarargs
    public final Filter<A> filter(A... actions) {
        Filter<A> ret = empty();
        for (A action : actions) {
            ret = ret.union(range(action));
        }
        return ret;
    }

    /**
     * @return the filter including no action at all.
     */
    public final Filter<A> empty() {
        return Filter.empty(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
