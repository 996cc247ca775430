/* @LICENSE@
 */

package org.xtrms.fsm;

/**
 * An immutable, inclusive interval <code>[front, back]</code> of actions.
 * <p>
 * Invariant: front &lt;= back under the order of the {@link Alphabet} which
 * created the range. There is therefore no native representation of the empty
 * range; the empty set of actions is the {@link Filter} without ranges.
 *
 * @param <A>
 *            the action type
 */
public final class Range<A> implements Comparable<Range<A>> {

    private final Alphabet<A> alphabet;
    private final A front;
    private final A back;

    Range(Alphabet<A> alphabet, A front, A back) {
        if (front == null || back == null) {
            throw new NullPointerException("range bounds must not be null");
        }
        if (alphabet.compare(front, back) > 0) {
            throw new InvalidRangeException("range front "
                + alphabet.label(front) + " is greater than back "
                + alphabet.label(back));
        }
        this.alphabet = alphabet;
        this.front = front;
        this.back = back;
    }

    public A front() {
        return front;
    }

    public A back() {
        return back;
    }

    public Alphabet<A> alphabet() {
        return alphabet;
    }

    public boolean includes(A action) {
        return alphabet.compare(front, action) <= 0
            && alphabet.compare(action, back) <= 0;
    }

    /*
     * true if r lies wholly inside this range; no cut point needed.
     */
    boolean encloses(Range<A> r) {
        return alphabet.compare(front, r.front) <= 0
            && alphabet.compare(r.back, back) <= 0;
    }

    /**
     * @return <code>true</code> if the two closed intervals share at least one
     *         action.
     */
    public boolean intersects(Range<A> r) {
        return alphabet.compare(front, r.back) <= 0
            && alphabet.compare(r.front, back) <= 0;
    }

    /**
     * @return the overlapping sub-interval, or <code>null</code> if the
     *         ranges do not intersect.
     */
    public Range<A> intersection(Range<A> r) {
        if (!intersects(r)) {
            return null;
        }
        return new Range<A>(alphabet, max(front, r.front), min(back, r.back));
    }

    /**
     * Two ranges touch if they intersect, or if one ends immediately before
     * the other begins. Adjacency is decided by the alphabet; on a
     * non-discrete alphabet touching is the same as intersecting.
     */
    public boolean touching(Range<A> r) {
        if (intersects(r)) {
            return true;
        }
        if (alphabet.compare(back, r.front) < 0) {
            return alphabet.adjacent(back, r.front);
        } else {
            return alphabet.adjacent(r.back, front);
        }
    }

    /**
     * Attempt to merge a {@link Range} with the current instance.
     *
     * @return the spanning range <code>[min(fronts), max(backs)]</code> if
     *         the ranges touch, otherwise <code>null</code>.
     */
    public Range<A> merge(Range<A> r) {
        if (!touching(r)) {
            return null;
        }
        A f = min(front, r.front);
        A b = max(back, r.back);
        if (f == front && b == back) {
            return this;
        }
        return new Range<A>(alphabet, f, b);
    }

    /*
     * Pieces of this range left after cutting out r. Either piece may be
     * null. Only meaningful when the ranges intersect.
     */
    Range<A> before(Range<A> r) {
        assert intersects(r);
        if (alphabet.compare(r.front, front) <= 0) {
            return null;
        }
        A last = alphabet.predecessor(r.front);
        if (last == null) {
            throw new UnsupportedOperationException(
                "cannot split " + this + " at " + alphabet.label(r.front)
                + ": alphabet " + alphabet + " is not discrete");
        }
        return new Range<A>(alphabet, front, last);
    }

    Range<A> after(Range<A> r) {
        assert intersects(r);
        if (alphabet.compare(back, r.back) <= 0) {
            return null;
        }
        A first = alphabet.successor(r.back);
        if (first == null) {
            throw new UnsupportedOperationException(
                "cannot split " + this + " at " + alphabet.label(r.back)
                + ": alphabet " + alphabet + " is not discrete");
        }
        return new Range<A>(alphabet, first, back);
    }

    private A min(A a, A b) {
        return alphabet.compare(a, b) <= 0 ? a : b;
    }

    private A max(A a, A b) {
        return alphabet.compare(a, b) >= 0 ? a : b;
    }

    public int compareTo(Range<A> r) {
        int ret = alphabet.compare(front, r.front);
        if (ret == 0) {
            ret = alphabet.compare(back, r.back);
        }
        return ret;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Range<?>))
            return false;
        final Range<?> r = (Range<?>) o;
        return alphabet == r.alphabet && front.equals(r.front)
            && back.equals(r.back);
    }

    @Override
    public int hashCode() { // per Bloch
        int result = 17;
        result = 37 * result + alphabet.hashCode();
        result = 37 * result + front.hashCode();
        result = 37 * result + back.hashCode();
        return result;
    }

    /**
     * For debugging only.
     */
    @Override
    public String toString() {
        if (alphabet.compare(front, back) == 0) {
            return alphabet.label(front);
        }
        return alphabet.label(front) + '-' + alphabet.label(back);
    }
}
