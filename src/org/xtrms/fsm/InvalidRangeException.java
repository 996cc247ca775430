/* @LICENSE@
 */

package org.xtrms.fsm;

/**
 * Thrown when a {@link Range} is constructed with a front greater than its
 * back.
 */
public final class InvalidRangeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidRangeException(String msg) {
        super(msg);
    }
}
