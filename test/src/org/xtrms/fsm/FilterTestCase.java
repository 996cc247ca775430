/* @LICENSE@
 */

package org.xtrms.fsm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import junit.framework.TestCase;

public class FilterTestCase extends TestCase {

    private static final Alphabet<Character> CS = Alphabets.CHARACTERS;

    /*
     * Small alphabet window for exhaustive membership checks.
     */
    private static final char LO = 'a' - 4;
    private static final char HI = 'z' + 4;

    private Filter<Character> f0, f1, fx, f;

    private final Random random = new Random(0x5eedL);

    public static void main(String[] args) {
        junit.textui.TestRunner.run(FilterTestCase.class);
    }

    public FilterTestCase(String arg0) {
        super(arg0);
    }

    private Range<Character> randomRange() {
        char a = (char) ('a' + random.nextInt(26));
        char b = (char) ('a' + random.nextInt(26));
        return a <= b ? CS.range(a, b) : CS.range(b, a);
    }

    private Filter<Character> randomFilter() {
        Filter<Character> ret = CS.empty();
        int n = random.nextInt(4);
        for (int i = 0; i < n; ++i) {
            ret = ret.union(randomRange());
        }
        return ret;
    }

    private static void assertWellFormed(Filter<Character> f) {
        List<Range<Character>> rs = f.ranges();
        for (int i = 1; i < rs.size(); ++i) {
            assertTrue(f.toString(), rs.get(i - 1).compareTo(rs.get(i)) < 0);
            assertFalse(f.toString(), rs.get(i - 1).touching(rs.get(i)));
        }
    }

    public void testEmpty() {
        f = CS.empty();
        assertTrue(f.isEmpty());
        assertFalse(f.includes('a'));
        f0 = CS.filter('a', 'b');
        assertEquals(f0, f0.union(f));
        assertEquals(f0, f.union(f0));
        assertEquals(f0, f0.difference(f));
        assertTrue(f.difference(f0).isEmpty());
        assertTrue(f0.includes(f));
    }

    public void testAlphaNumeric() {
        f0 = Filter.of(CS.range('A', 'Z'), CS.range('a', 'z'));
        f1 = f0.union(CS.range('0', '9'));
        assertEquals(3, f1.ranges().size());
        assertEquals(Arrays.asList(CS.range('0', '9'), CS.range('A', 'Z'),
            CS.range('a', 'z')), f1.ranges());
        assertEquals(f0, f1.difference(CS.range('0', '9')));
    }

    public void testUnionMerges() {
        f0 = Filter.of(CS.range('a', 'c'), CS.range('g', 'i'));
        assertEquals(2, f0.ranges().size());
        f = f0.union(CS.range('d', 'f'));
        assertEquals(Filter.of(CS.range('a', 'i')), f);
        assertEquals(1, f.ranges().size());

        f = f0.union(CS.range('b', 'h'));
        assertEquals(Filter.of(CS.range('a', 'i')), f);

        f = CS.filter('e', 'a', 'c', 'b', 'd');
        assertEquals(Filter.of(CS.range('a', 'e')), f);
    }

    public void testUnionProperties() {
        for (int n = 0; n < 200; ++n) {
            List<Range<Character>> rs = new ArrayList<Range<Character>>();
            f = CS.empty();
            int k = 1 + random.nextInt(6);
            for (int i = 0; i < k; ++i) {
                Range<Character> r = randomRange();
                rs.add(r);
                f = f.union(r);
            }
            assertWellFormed(f);
            for (char c = LO; c <= HI; ++c) {
                boolean any = false;
                for (Range<Character> r : rs) any |= r.includes(c);
                assertEquals(rs + " " + c, any, f.includes(c));
            }
        }
    }

    public void testDifference() {
        f0 = CS.filter('a', 'b', 'c', 'd', 'e', 'f');
        f1 = CS.filter('a', 'c', 'e', 'f');
        fx = CS.filter('b', 'd');
        assertEquals(fx, f0.difference(f1));

        f0 = Filter.of(CS.range('a', 'z'));
        fx = Filter.of(CS.range('a', 'l'), CS.range('n', 'z'));
        assertEquals(fx, f0.difference(CS.range('m')));

        f1 = Filter.of(CS.range('0', 'z'));
        assertTrue(f0.difference(f1).isEmpty());

        assertEquals(f0, f0.difference(CS.range('0', '9')));
    }

    public void testDifferenceProperties() {
        for (int n = 0; n < 200; ++n) {
            f0 = randomFilter();
            f1 = randomFilter();
            f = f0.difference(f1);
            assertWellFormed(f);
            for (char c = LO; c <= HI; ++c) {
                assertEquals(f0 + " - " + f1 + " @" + c,
                    f0.includes(c) && !f1.includes(c), f.includes(c));
            }
        }
    }

    public void testDifferenceAtAlphabetBounds() {
        f0 = Filter.of(CS.range(Character.MIN_VALUE, Character.MAX_VALUE));
        f = f0.difference(CS.range(Character.MIN_VALUE, 'a'));
        assertEquals(Filter.of(CS.range('b', Character.MAX_VALUE)), f);
        f = f0.difference(CS.range('a', Character.MAX_VALUE));
        assertEquals(Filter.of(CS.range(Character.MIN_VALUE, '`')), f);
    }

    public void testIntersection() {
        f0 = CS.filter('a', 'b', 'c', 'd', 'e', 'f');
        f1 = CS.filter('a', 'c', 'e', 'f', 'x', 'y', 'z');
        fx = CS.filter('a', 'c', 'e', 'f');
        assertEquals(fx, f0.intersection(f1));
        assertEquals(fx, f1.intersection(f0));
        assertTrue(f0.intersects(f1));

        f1 = CS.filter('x', 'y');
        assertTrue(f0.intersection(f1).isEmpty());
        assertFalse(f0.intersects(f1));
    }

    public void testIntersectionProperties() {
        for (int n = 0; n < 200; ++n) {
            f0 = randomFilter();
            f1 = randomFilter();
            f = f0.intersection(f1);
            assertWellFormed(f);
            for (char c = LO; c <= HI; ++c) {
                assertEquals(f0.includes(c) && f1.includes(c), f.includes(c));
            }
        }
    }

    public void testIncludes() {
        f0 = Filter.of(CS.range('a', 'f'), CS.range('x', 'z'));
        assertTrue(f0.includes(CS.filter('a', 'f', 'y')));
        assertTrue(f0.includes(f0));
        assertFalse(f0.includes(CS.filter('a', 'g')));
        assertFalse(CS.filter('a').includes(f0));
    }

    public void testAlphabetMismatch() {
        Filter<Integer> ints = Alphabets.INTEGERS.filter(1);
        Alphabet<Integer> other = new Alphabet<Integer>("other") {
            public int compare(Integer a, Integer b) {
                return a.compareTo(b);
            }
            @Override
            public Integer successor(Integer i) {
                return i + 1;
            }
            @Override
            public Integer predecessor(Integer i) {
                return i - 1;
            }
            @Override
            public boolean isDiscrete() {
                return true;
            }
        };
        assertFalse(ints.equals(other.filter(1)));
        assertFalse(Alphabets.INTEGERS.range(1).equals(other.range(1)));
        assertEquals(ints, Alphabets.INTEGERS.filter(1));
        assertEquals(ints.hashCode(), Alphabets.INTEGERS.filter(1).hashCode());
        try {
            ints.includes(other.filter(1));
            fail("alphabets must not mix");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            ints.union(other.filter(2));
            fail("alphabets must not mix");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testContinuousAlphabet() {
        Alphabet<Double> reals = Alphabets.<Double>continuous();
        Filter<Double> d = Filter.of(reals.range(0.0, 1.0), reals.range(0.5, 2.0));
        assertEquals(Filter.of(reals.range(0.0, 2.0)), d);
        assertTrue(d.includes(1.75));
        assertFalse(d.includes(2.5));
        // cutting off whole ranges needs no successor
        assertTrue(d.difference(reals.range(-1.0, 3.0)).isEmpty());
        try {
            d.difference(reals.range(1.0, 3.0));
            fail("continuous ranges cannot be split");
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

    public void testIncludesContinuous() {
        Alphabet<Double> reals = Alphabets.<Double>continuous();
        Filter<Double> d = Filter.of(reals.range(1.0, 2.0), reals.range(4.0, 5.0));
        assertFalse(Filter.of(reals.range(1.0, 2.0))
            .includes(Filter.of(reals.range(0.0, 3.0))));
        assertTrue(d.includes(Filter.of(reals.range(1.25, 1.5),
            reals.range(4.0, 4.5))));
        assertTrue(d.includes(d));
        assertTrue(d.includes(reals.empty()));
        // spans the gap between the two ranges
        assertFalse(d.includes(Filter.of(reals.range(1.5, 4.5))));
        assertFalse(d.includes(Filter.of(reals.range(4.5, 6.0))));
        assertFalse(reals.empty().includes(d));
    }

    public void testIncludesAgreesWithDifference() {
        for (int n = 0; n < 500; ++n) {
            f0 = randomFilter();
            f1 = randomFilter();
            assertEquals(f0 + " " + f1, f1.difference(f0).isEmpty(),
                f0.includes(f1));
        }
    }

    public void testToString() {
        f = Filter.of(CS.range('0', '9'), CS.range('a'));
        assertEquals("['0'-'9' 'a']", f.toString());
        assertEquals("[]", CS.empty().toString());
    }
}
