package io.intellixity.recordbase.persistence.jdbc.postgres;

import io.intellixity.recordbase.persistence.record.RecordDescriptor;
import io.intellixity.recordbase.persistence.schema.GeneratorOptions;
import io.intellixity.recordbase.persistence.schema.SqlGenerator;
import io.intellixity.recordbase.persistence.schema.SqlGeneratorFactory;

public final class PostgresSqlGeneratorFactory implements SqlGeneratorFactory {
  @Override
  public SqlGenerator create(RecordDescriptor descriptor, GeneratorOptions options) {
    return new PostgresSqlGenerator(descriptor, options);
  }
}
