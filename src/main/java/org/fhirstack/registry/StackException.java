package org.fhirstack.registry;

/**
 * Base class for unchecked failures of the stack definition and of orchestration runs.
 * <p>
 * Subclasses identify the offending service(s) in their message so that the CLI can report
 * them without further context.
 */
public abstract class StackException extends RuntimeException {

    protected StackException(String message) {
        super(message);
    }

    protected StackException(String message, Throwable cause) {
        super(message, cause);
    }
}
