package dev.aparikh.indexschema.schema;

/**
 * What a {@link SchemaBuilder} does when a key is declared a second time.
 */
public enum DuplicateFieldPolicy {

    /** Fail the declaration with a {@link DuplicateFieldException}. Opt-in. */
    REJECT,

    /**
     * Overwrite the earlier field. The replacement keeps the slot of the first declaration, so
     * type-filtered accessors still see it at its original position. This is the default.
     */
    REPLACE
}
