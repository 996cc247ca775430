/* @LICENSE@
 */

package org.xtrms.fsm;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * An immutable value class representing an arbitrary set of actions as a
 * union of {@link Range}s. Filters guard automaton transitions.
 * <p>
 * Invariant: no two ranges of a filter intersect or touch, and the ranges are
 * held sorted. The representation of a given set of actions is therefore
 * unique, and two filters of the same alphabet are {@link #equals(Object)
 * equal} exactly when they include the same actions. Filters of different
 * alphabets are never equal. A filter without ranges is the empty set, the
 * identity for {@link #union(Filter) union}.
 * <p>
 * The "mutating" operations return new instances built from the receiver and
 * the argument; a filter is never modified after construction.
 *
 * @param <A>
 *            the action type
 */
public final class Filter<A> {

    private final Alphabet<A> alphabet;
    private final List<Range<A>> ranges;

    private transient String s;

    private Filter(Alphabet<A> alphabet, List<Range<A>> ranges) {
        this.alphabet = alphabet;
        this.ranges = ranges;
        assert isValid() : ranges;
    }

    static <A> Filter<A> empty(Alphabet<A> alphabet) {
        return new Filter<A>(alphabet, Collections.<Range<A>>emptyList());
    }

    /**
     * @return the filter including exactly the actions of the given ranges.
     */
    @SafeVarargs
    public static <A> Filter<A> of(Range<A> range, Range<A>... more) {
        Filter<A> ret = new Filter<A>(range.alphabet(),
            Collections.singletonList(range));
        for (Range<A> r : more) {
            ret = ret.union(r);
        }
        return ret;
    }

    private static <A> Filter<A> sorted(Alphabet<A> alphabet,
            List<Range<A>> ranges) {
        if (ranges.isEmpty()) {
            return empty(alphabet);
        }
        Collections.sort(ranges);
        return new Filter<A>(alphabet, Collections.unmodifiableList(ranges));
    }

    private boolean isValid() {
        Range<A> prev = null;
        for (Range<A> r : ranges) {
            if (prev != null) {
                if (prev.compareTo(r) >= 0 || prev.touching(r)) {
                    return false;
                }
            }
            prev = r;
        }
        return true;
    }

    private void checkAlphabet(Alphabet<?> other) {
        if (other != alphabet) {
            throw new IllegalArgumentException("alphabet mismatch: "
                + alphabet + " vs. " + other);
        }
    }

    public Alphabet<A> alphabet() {
        return alphabet;
    }

    /**
     * @return the sorted, pairwise disjoint and non-touching ranges.
     */
    public List<Range<A>> ranges() {
        return ranges;
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    /**
     * Adds a {@link Range}. Every existing range the incoming one touches is
     * merged into it, repeatedly, until the merged range touches nothing that
     * remains; the survivors plus the merged range form the result.
     */
    public Filter<A> union(Range<A> range) {
        checkAlphabet(range.alphabet());
        List<Range<A>> rest = ranges;
        Range<A> merged = range;
        boolean changed = true;
        while (changed) {
            changed = false;
            List<Range<A>> keep = new ArrayList<Range<A>>(rest.size() + 1);
            for (Range<A> r : rest) {
                Range<A> m = r.merge(merged);
                if (m != null) {
                    merged = m;
                    changed = true;
                } else {
                    keep.add(r);
                }
            }
            rest = keep;
        }
        List<Range<A>> ret = new ArrayList<Range<A>>(rest);
        ret.add(merged);
        return sorted(alphabet, ret);
    }

    public Filter<A> union(Filter<A> filter) {
        checkAlphabet(filter.alphabet);
        Filter<A> ret = this;
        for (Range<A> r : filter.ranges) {
            ret = ret.union(r);
        }
        return ret;
    }

    /**
     * Removes a {@link Range}. Each intersected range is replaced by the
     * pieces strictly before and strictly after the subtracted range, if any;
     * all other ranges pass through.
     *
     * @throws UnsupportedOperationException
     *             if a range must be split and the alphabet is not discrete
     */
    public Filter<A> difference(Range<A> range) {
        checkAlphabet(range.alphabet());
        List<Range<A>> ret = new ArrayList<Range<A>>(ranges.size() + 1);
        for (Range<A> r : ranges) {
            if (!r.intersects(range)) {
                ret.add(r);
                continue;
            }
            Range<A> left = r.before(range);
            if (left != null) {
                ret.add(left);
            }
            Range<A> right = r.after(range);
            if (right != null) {
                ret.add(right);
            }
        }
        return sorted(alphabet, ret);
    }

    public Filter<A> difference(Filter<A> filter) {
        checkAlphabet(filter.alphabet);
        Filter<A> ret = this;
        for (Range<A> r : filter.ranges) {
            if (ret.isEmpty()) {
                break;
            }
            ret = ret.difference(r);
        }
        return ret;
    }

    /**
     * @return the union of all pairwise intersections of the ranges of the
     *         two filters.
     */
    public Filter<A> intersection(Filter<A> filter) {
        checkAlphabet(filter.alphabet);
        Filter<A> ret = empty(alphabet);
        for (Range<A> r0 : ranges) {
            for (Range<A> r1 : filter.ranges) {
                Range<A> r = r0.intersection(r1);
                if (r != null) {
                    ret = ret.union(r);
                }
            }
        }
        return ret;
    }

    public boolean intersects(Filter<A> filter) {
        checkAlphabet(filter.alphabet);
        for (Range<A> r0 : ranges) {
            for (Range<A> r1 : filter.ranges) {
                if (r0.intersects(r1)) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean includes(A action) {
        int lo = 0;
        int hi = ranges.size();
        while (lo < hi) {
            int m = (lo + hi) >>> 1;
            Range<A> r = ranges.get(m);
            if (alphabet.compare(action, r.front()) < 0) {
                hi = m;
            } else if (alphabet.compare(r.back(), action) < 0) {
                lo = m + 1;
            } else {
                return true;
            }
        }
        return false;
    }

    /**
     * Since neither filter has touching ranges, each range of
     * <code>filter</code> has to lie within a single range of this one. Both
     * lists are sorted, so one pass over each suffices. Nothing is cut, which
     * keeps this usable on non-discrete alphabets.
     *
     * @return <code>true</code> if <code>filter</code> has no action outside
     *         this instance.
     */
    public boolean includes(Filter<A> filter) {
        checkAlphabet(filter.alphabet);
        int i = 0;
        for (Range<A> r : filter.ranges) {
            while (i < ranges.size()
                    && alphabet.compare(ranges.get(i).back(), r.front()) < 0) {
                ++i;
            }
            if (i == ranges.size() || !ranges.get(i).encloses(r)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Partitions a collection of (likely overlapping) filters into the
     * coarsest collection of pairwise disjoint, non-empty filters such that
     * every input filter is exactly the union of some of the pieces.
     * <p>
     * The inputs are folded one at a time into the result. Against each piece
     * <code>p</code> already in the result, the incoming filter
     * <code>f</code> contributes <code>p - f</code> and <code>p &#8745; f</code>
     * (whichever are non-empty) to the next result and is itself reduced to
     * <code>f - p</code>. Whatever remains of <code>f</code> after the last
     * piece is a piece of its own.
     *
     * @param filters
     *            the filters to partition
     * @return the disjoint partition
     */
    public static <A> List<Filter<A>> atomize(Collection<Filter<A>> filters) {
        List<Filter<A>> ret = new ArrayList<Filter<A>>();
        for (Filter<A> f : filters) {
            List<Filter<A>> temp = new ArrayList<Filter<A>>(ret.size() * 2 + 1);
            for (Filter<A> p : ret) {
                Filter<A> d = p.difference(f);
                if (!d.isEmpty()) {
                    temp.add(d);
                }
                d = p.intersection(f);
                if (!d.isEmpty()) {
                    temp.add(d);
                }
                f = f.difference(p);
            }
            if (!f.isEmpty()) {
                temp.add(f);
            }
            ret = temp;
        }
        assert isDisjoint(ret) : ret;
        return ret;
    }

    static <A> boolean isDisjoint(List<Filter<A>> filters) {
        for (int i = 0; i < filters.size(); ++i) {
            for (int j = i + 1; j < filters.size(); ++j) {
                if (filters.get(i).intersects(filters.get(j))) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Filter<?>))
            return false;
        final Filter<?> f = (Filter<?>) o;
        return alphabet == f.alphabet && ranges.equals(f.ranges);
    }

    @Override
    public int hashCode() {
        return 37 * alphabet.hashCode() + ranges.hashCode();
    }

    /**
     * For debugging only.
     */
    @Override
    public String toString() {
        if (s == null) {
            StringBuilder sb = new StringBuilder();
            sb.append('[');
            for (Range<A> r : ranges) {
                if (sb.length() > 1) {
                    sb.append(' ');
                }
                sb.append(r);
            }
            s = sb.append(']').toString();
        }
        return s;
    }
}
