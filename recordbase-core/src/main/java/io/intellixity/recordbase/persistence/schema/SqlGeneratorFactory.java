package io.intellixity.recordbase.persistence.schema;

import io.intellixity.recordbase.persistence.record.RecordDescriptor;

/** Creates the SQL generator for one record type (one implementation per SQL dialect). */
@FunctionalInterface
public interface SqlGeneratorFactory {
  /** @throws RuntimeException when the descriptor cannot be mapped (invalid names, missing source columns) */
  SqlGenerator create(RecordDescriptor descriptor, GeneratorOptions options);
}
