package dev.aparikh.indexschema.schema;

/**
 * The closed set of field types a schema can declare.
 */
public enum FieldType {

    /** Analyzed full text, split by a tokenizer. */
    TEXT,

    /** Exact-match string, indexed as a single term. */
    STRING,

    INTEGER,

    DOUBLE,

    DATE,

    /** Hierarchical or categorical value used for faceting. */
    FACET
}
