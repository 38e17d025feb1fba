package org.glslregen.compiler.api;

/**
 * Thrown when source regeneration aborts.
 * <p>
 * Regeneration failures are unrecoverable: they indicate a corrupt or inconsistent IR, so any
 * output produced before the failure must be discarded. Concrete causes are reported through the
 * subclasses {@link MissingEntityException} and {@link MalformedIrException}.
 */
public class RegenerationException extends RuntimeException {

    /**
     * Creates a RegenerationException with the specified message.
     *
     * @param message Description of the failure
     */
    public RegenerationException(String message) {
        super(message);
    }

    /**
     * Creates a RegenerationException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    public RegenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
