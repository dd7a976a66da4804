package dev.aparikh.indexschema.schema;

/**
 * Thrown when a key is declared twice under {@link DuplicateFieldPolicy#REJECT}.
 */
public class DuplicateFieldException extends IllegalArgumentException {

    private final String key;

    public DuplicateFieldException(String key, Field existing) {
        super("Field '" + key + "' is already declared as " + existing.type());
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
