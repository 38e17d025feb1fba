package org.glslregen.compiler.api;

/**
 * The IR has a shape the regenerator cannot emit, e.g. an operator applied to the wrong number of
 * operands.
 */
public class MalformedIrException extends RegenerationException {

    public MalformedIrException(String message) {
        super(message);
    }
}
