package org.glslregen.compiler.frontend.io;

/**
 * Thrown when a serialized pack is not well-formed JSON or does not follow the pack layout.
 * <p>
 * This is a checked exception: unlike a corrupt in-memory IR, a bad input file is an expected
 * user error that callers report and recover from.
 */
public class PackFormatException extends Exception {

    /**
     * @param message What is wrong and where, e.g. {@code "rValues[3].args[1]: unknown value kind"}.
     */
    public PackFormatException(String message) {
        super(message);
    }

    /**
     * @param message What is wrong and where.
     * @param cause   The underlying parser failure.
     */
    public PackFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
