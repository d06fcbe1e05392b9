package com.ac.iisc.plandiff;

/**
 * Base of the checked exceptions raised while turning report text into a
 * {@link Plan}. Parsing is deterministic, so none of these are transient.
 */
public class PlanParseException extends Exception
{
    public PlanParseException(String message) {
        super(message);
    }

    public PlanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
