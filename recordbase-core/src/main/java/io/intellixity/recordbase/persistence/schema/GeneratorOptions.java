package io.intellixity.recordbase.persistence.schema;

/**
 * @param tablePrefix prepended to every derived table name (may be empty)\n
 * @param forcedName type name used for the table instead of the record's own type\n
 * @param source generator of a parent type whose table this generator shares; null for own table\n
 */
public record GeneratorOptions(String tablePrefix, String forcedName, SqlGenerator source) {
  public GeneratorOptions {
    tablePrefix = (tablePrefix == null) ? "" : tablePrefix;
  }

  public static GeneratorOptions withPrefix(String tablePrefix) {
    return new GeneratorOptions(tablePrefix, null, null);
  }
}
