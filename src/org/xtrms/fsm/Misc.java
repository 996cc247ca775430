/* @LICENSE@
 */

package org.xtrms.fsm;

import java.util.HashMap;
import java.util.Map;

/**
 * This class implements a handful of reusable, miscellaneous static objects
 * and methods shared by the automata and their debug strings.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    static void checkState(int state) {
        if (state < 0) {
            throw new IllegalArgumentException("negative state: " + state);
        }
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        public boolean esc(StringBuilder sb, int c) {
            boolean ret = (c == (char) c) ? map.containsKey((char) c) : false;
            if (ret)
                sb.append(map.get((char) c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }
    }

    private static final MapEscaper ctlEscaper =
            new MapEscaper().map('\r', "\\r").map('\n', "\\n").map('\t', "\\t")
                .map('\b', "\\b").map('\f', "\\f").map('\\', "\\\\")
                .map('\'', "\\'");

    private static final MapEscaper dotEscaper =
            new MapEscaper().map('"', "\\\"").map('\\', "\\\\");

    private static final Escaper unicodeEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = false;
            if (c < 32 || 126 < c) {
                int mark = sb.length();
                sb.append(Integer.toHexString(c));
                while (sb.length() - mark < 4) {
                    sb.insert(mark, "0");
                }
                sb.insert(mark, "\\u");
                ret = true;
            }
            return ret;
        }
    };

    /**
     * Singleton escapers used to build printable labels.
     */
    enum Esc {

        /**
         * Character label escaper - escapes quote, backslash and ASCII control
         * chars, non-printable-ASCII and beyond -> \\u codes
         */
        CHAR(ctlEscaper, unicodeEscaper),
        /**
         * Graphviz quoted string escaper - only escapes " and \
         */
        DOT(dotEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append((char) c);
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < cs.length(); ++i) {
                esc(sb, cs.charAt(i));
            }
            return sb.toString();
        }
    }
}
