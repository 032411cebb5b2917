package com.creditrust.rag.error;

/**
 * An embedding whose length disagrees with the dimension of the index it is
 * used against.
 */
public class DimensionMismatchException extends ConfigurationException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Embedding dimension " + actual + " does not match expected dimension " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
