package io.perfwatch.api.analysis;

/**
 * Thrown when a run has no usable samples, so no average or throughput can be computed.
 */
public class EmptyInputException extends RuntimeException {

    private final int malformedCount;

    public EmptyInputException(String message) {
        this(message, 0);
    }

    public EmptyInputException(String message, int malformedCount) {
        super(message);
        this.malformedCount = malformedCount;
    }

    public int malformedCount() {
        return malformedCount;
    }
}
