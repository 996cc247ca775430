/* @LICENSE@
 */

package org.xtrms.fsm;

import junit.framework.TestCase;

public class RangeTestCase extends TestCase {

    private static final Alphabet<Character> CS = Alphabets.CHARACTERS;
    private static final Alphabet<Double> REALS = Alphabets.<Double>continuous();

    private Range<Character> r0, r1, rx;

    public static void main(String[] args) {
        junit.textui.TestRunner.run(RangeTestCase.class);
    }

    public RangeTestCase(String arg0) {
        super(arg0);
    }

    public void testCtor() {
        r0 = CS.range('a', 'z');
        assertEquals(Character.valueOf('a'), r0.front());
        assertEquals(Character.valueOf('z'), r0.back());
        assertEquals(CS.range('q'), CS.range('q', 'q'));
    }

    public void testInvalid() {
        try {
            CS.range('z', 'a');
            fail("front > back must not construct");
        } catch (InvalidRangeException e) {
            // expected
        }
        try {
            Alphabets.INTEGERS.range(1, 0);
            fail("front > back must not construct");
        } catch (IllegalArgumentException e) {
            assertTrue(e instanceof InvalidRangeException);
        }
    }

    public void testIncludes() {
        r0 = CS.range('c', 'f');
        for (char c = 'a'; c <= 'h'; ++c) {
            assertEquals("" + c, 'c' <= c && c <= 'f', r0.includes(c));
        }
        assertTrue(CS.range(Character.MAX_VALUE).includes(Character.MAX_VALUE));
    }

    public void testIntersection() {
        r0 = CS.range('a', 'f');
        r1 = CS.range('d', 'k');
        rx = CS.range('d', 'f');
        assertTrue(r0.intersects(r1));
        assertEquals(rx, r0.intersection(r1));
        assertEquals(rx, r1.intersection(r0));

        r1 = CS.range('c', 'd');
        assertEquals(r1, r0.intersection(r1));

        r1 = CS.range('f', 'g');
        assertEquals(CS.range('f'), r0.intersection(r1));

        r1 = CS.range('g', 'k');
        assertFalse(r0.intersects(r1));
        assertNull(r0.intersection(r1));
    }

    public void testTouching() {
        r0 = CS.range('a', 'f');
        assertTrue(r0.touching(CS.range('g', 'k')));
        assertTrue(CS.range('g', 'k').touching(r0));
        assertTrue(r0.touching(CS.range('c', 'k')));
        assertFalse(r0.touching(CS.range('h', 'k')));
        assertFalse(CS.range('h', 'k').touching(r0));
        assertTrue(CS.range(Character.MAX_VALUE).touching(
            CS.range((char) (Character.MAX_VALUE - 1))));
    }

    public void testMerge() {
        r0 = CS.range('a', 'f');
        assertEquals(CS.range('a', 'k'), r0.merge(CS.range('g', 'k')));
        assertEquals(CS.range('a', 'k'), CS.range('g', 'k').merge(r0));
        assertSame(r0, r0.merge(CS.range('b', 'c')));
        assertNull(r0.merge(CS.range('h', 'k')));
    }

    public void testContinuousTouchingIsIntersecting() {
        Range<Double> a = REALS.range(0.0, 1.0);
        Range<Double> b = REALS.range(1.0, 2.0);
        Range<Double> c = REALS.range(1.5, 2.0);
        assertTrue(a.touching(b));
        assertEquals(REALS.range(0.0, 2.0), a.merge(b));
        assertFalse(a.touching(c));
        assertNull(a.merge(c));
    }

    public void testOrder() {
        assertTrue(CS.range('a', 'c').compareTo(CS.range('b', 'c')) < 0);
        assertTrue(CS.range('a', 'c').compareTo(CS.range('a', 'd')) < 0);
        assertEquals(0, CS.range('a', 'c').compareTo(CS.range('a', 'c')));
    }

    public void testToString() {
        assertEquals("'a'-'z'", CS.range('a', 'z').toString());
        assertEquals("'\\n'", CS.range('\n').toString());
        assertEquals("3-7", Alphabets.INTEGERS.range(3, 7).toString());
    }
}
