package com.ac.iisc.plandiff;

/**
 * Structural corruption of the input: a truncated or non-tabular report, a row
 * that cannot be split into the expected columns, an unreadable estimate, a
 * broken tree shape, or a malformed JSON plan.
 */
public class PlanFormatException extends PlanParseException
{
    public PlanFormatException(String message) {
        super(message);
    }

    public PlanFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
