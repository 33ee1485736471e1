/**
 * Schema-driven date normalization.
 *
 * <p>Sample data and client payloads carry timestamps as ISO-8601 strings, while the collection
 * validators require {@code bsonType: "date"}. This package bridges the two:
 *
 * <ul>
 *   <li>{@link com.eduhub.schema.DateFieldExtractor} - walks a {@code $jsonSchema} and collects date paths</li>
 *   <li>{@link com.eduhub.schema.DocumentDateConverter} - rewrites strings at those paths into dates</li>
 *   <li>{@link com.eduhub.schema.SchemaCatalog} - per-collection validators and cached converters</li>
 * </ul>
 *
 * <h2>Paths</h2>
 *
 * <p>Paths are field names joined with {@code '.'}. Elements of an array share the array's path,
 * so {@code lessons.createdAt} matches {@code createdAt} in every document of the
 * {@code lessons} array. Keys that themselves contain {@code '.'} are ambiguous and are only
 * reported, not escaped.
 */
package com.eduhub.schema;
