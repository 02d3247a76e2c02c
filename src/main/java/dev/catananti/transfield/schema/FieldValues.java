package dev.catananti.transfield.schema;

/**
 * Stored values of one record, addressed by concrete field name.
 */
public interface FieldValues {

    ModelSchema getSchema();

    Object getFieldValue(String fieldName);

    void setFieldValue(String fieldName, Object value);
}
