package org.glslregen.compiler.api;

/**
 * A non-sentinel id did not resolve in the table that owns it.
 */
public class MissingEntityException extends RegenerationException {

    private final String entityKind;
    private final int id;

    /**
     * @param entityKind Human-readable table name, e.g. {@code "type"} or {@code "statement block"}.
     * @param id         The raw id that failed to resolve.
     */
    public MissingEntityException(String entityKind, int id) {
        super("Missing " + entityKind + " definition for id " + id);
        this.entityKind = entityKind;
        this.id = id;
    }

    public String getEntityKind() {
        return entityKind;
    }

    public int getId() {
        return id;
    }
}
