/* @LICENSE@
 */

package org.xtrms.fsm;

/**
 * An immutable edge of a {@link TransitionGraph}: a destination state,
 * reached either without consuming an action (epsilon) or on any action
 * included in a {@link Filter}.
 *
 * @param <A>
 *            the action type
 */
public final class Transition<A> {

    private final int destination;
    private final Filter<A> filter;

    private Transition(int destination, Filter<A> filter) {
        this.destination = destination;
        this.filter = filter;
    }

    static <A> Transition<A> epsilon(int destination) {
        return new Transition<A>(destination, null);
    }

    static <A> Transition<A> guarded(int destination, Filter<A> filter) {
        assert filter != null && !filter.isEmpty();
        return new Transition<A>(destination, filter);
    }

    public int destination() {
        return destination;
    }

    public boolean isEpsilon() {
        return filter == null;
    }

    /**
     * @return the guard, or <code>null</code> for an epsilon transition.
     */
    public Filter<A> filter() {
        return filter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Transition<?>))
            return false;
        final Transition<?> t = (Transition<?>) o;
        return destination == t.destination
            && (filter == null ? t.filter == null : filter.equals(t.filter));
    }

    @Override
    public int hashCode() {
        return 31 * destination + (filter == null ? 0 : filter.hashCode());
    }

    @Override
    public String toString() {
        return "{" + (filter == null ? "epsilon" : filter.toString())
            + " ns:" + destination + '}';
    }
}
