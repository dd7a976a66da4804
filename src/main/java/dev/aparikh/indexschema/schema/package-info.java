/**
 * Declarative document schema.
 *
 * <p>A {@link dev.aparikh.indexschema.schema.Schema} is declared once through a
 * {@link dev.aparikh.indexschema.schema.SchemaBuilder} and is immutable afterwards. It answers
 * which engine field type and storage flag apply to a field, and which tokenizer a text field
 * is written and queried with. Nothing in this package talks to the search engine.
 */
@NullMarked
package dev.aparikh.indexschema.schema;

import org.jspecify.annotations.NullMarked;
