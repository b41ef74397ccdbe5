package com.flakeid;

/**
 * Unchecked failure raised by any component of the library.
 *
 * <p>The message is always prefixed with the code's description, followed by
 * call-specific detail, e.g. {@code "invalid batch size: batch size must be
 * positive, got 0"}.</p>
 */
public class IdGeneratorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;

    public IdGeneratorException(ErrorCode code, String detail) {
        super(format(code, detail));
        this.code = code;
    }

    public IdGeneratorException(ErrorCode code, String detail, Throwable cause) {
        super(format(code, detail), cause);
        this.code = code;
    }

    /**
     * Returns the failure kind.
     *
     * @return the error code, never null
     */
    public ErrorCode getCode() {
        return code;
    }

    /**
     * Checks whether this exception carries the given code.
     *
     * @param candidate the code to compare with
     * @return true if the codes match
     */
    public boolean is(ErrorCode candidate) {
        return code == candidate;
    }

    private static String format(ErrorCode code, String detail) {
        if (detail == null || detail.isEmpty()) {
            return code.getDescription();
        }
        return code.getDescription() + ": " + detail;
    }
}
