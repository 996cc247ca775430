/* @LICENSE@
 */

package org.xtrms.fsm;

/**
 * Stock {@link Alphabet} instances.
 */
public final class Alphabets {

    private Alphabets() {
    } // never instantiated

    /**
     * The UTF-16 code units, U+0000 through U+FFFF.
     */
    public static final Alphabet<Character> CHARACTERS =
            new Alphabet<Character>("characters") {

        public int compare(Character a, Character b) {
            return a.compareTo(b);
        }

        @Override
        public Character successor(Character c) {
            return c == Character.MAX_VALUE ? null : (char) (c + 1);
        }

        @Override
        public Character predecessor(Character c) {
            return c == Character.MIN_VALUE ? null : (char) (c - 1);
        }

        @Override
        public boolean isDiscrete() {
            return true;
        }

        @Override
        public String label(Character c) {
            return "'" + Misc.Esc.CHAR.esc(c) + "'";
        }
    };

    public static final Alphabet<Integer> INTEGERS =
            new Alphabet<Integer>("integers") {

        public int compare(Integer a, Integer b) {
            return a.compareTo(b);
        }

        @Override
        public Integer successor(Integer i) {
            return i == Integer.MAX_VALUE ? null : i + 1;
        }

        @Override
        public Integer predecessor(Integer i) {
            return i == Integer.MIN_VALUE ? null : i - 1;
        }

        @Override
        public boolean isDiscrete() {
            return true;
        }
    };

    public static final Alphabet<Long> LONGS = new Alphabet<Long>("longs") {

        public int compare(Long a, Long b) {
            return a.compareTo(b);
        }

        @Override
        public Long successor(Long l) {
            return l == Long.MAX_VALUE ? null : l + 1;
        }

        @Override
        public Long predecessor(Long l) {
            return l == Long.MIN_VALUE ? null : l - 1;
        }

        @Override
        public boolean isDiscrete() {
            return true;
        }
    };

    /**
     * A non-discrete alphabet ordered by the natural order of its actions,
     * e.g. for <code>Double</code> or <code>String</code> actions. Ranges over
     * it merge only when they overlap.
     */
    public static <T extends Comparable<? super T>> Alphabet<T> continuous() {
        return new Alphabet<T>("continuous") {

            public int compare(T a, T b) {
                return a.compareTo(b);
            }

            @Override
            public T successor(T action) {
                return null;
            }

            @Override
            public T predecessor(T action) {
                return null;
            }

            @Override
            public boolean isDiscrete() {
                return false;
            }
        };
    }
}
