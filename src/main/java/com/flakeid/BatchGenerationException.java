package com.flakeid;

/**
 * Raised when a batch fails part way through.
 *
 * <p>The IDs produced before the failure are valid and already consumed from
 * the generator's sequence space; they are handed back through
 * {@link #getGeneratedIds()} so the caller decides what to do with them.</p>
 */
public class BatchGenerationException extends IdGeneratorException {

    private static final long serialVersionUID = 1L;

    private final long[] generatedIds;
    private final int requested;

    public BatchGenerationException(IdGeneratorException cause, long[] generatedIds, int requested) {
        super(cause.getCode(),
                "generated " + generatedIds.length + "/" + requested + " IDs before failure", cause);
        this.generatedIds = generatedIds.clone();
        this.requested = requested;
    }

    /** IDs produced before the failure, in generation order. */
    public long[] getGeneratedIds() {
        return generatedIds.clone();
    }

    public int getRequested() {
        return requested;
    }
}
