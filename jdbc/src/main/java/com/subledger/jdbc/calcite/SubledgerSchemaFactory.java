package com.subledger.jdbc.calcite;

import java.util.Map;
import java.util.Objects;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

/**
 * Calcite {@link SchemaFactory} entry point, so a subledger run can be mounted from a Calcite
 * model with {@code "operand":{"run":"<id>"}} or {@code "operand":{"feeds":"<directory>"}}.
 */
public final class SubledgerSchemaFactory implements SchemaFactory {

    @Override
    public Schema create(SchemaPlus parentSchema, String name, Map<String, Object> operand) {
        Objects.requireNonNull(parentSchema, "parentSchema");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(operand, "operand");
        return new SubledgerSchema(parentSchema, name, operand);
    }
}
