package io.intellixity.recordbase.persistence.options;

import java.util.Map;

/**
 * @param filters field predicates selecting the rows to update; empty updates every row\n
 * @param convertValuesFromString coerce string values to field kinds first (unparsable entries are dropped)\n
 */
public record UpdateMultipleOptions(Map<String, Object> filters, boolean convertValuesFromString) {
  public UpdateMultipleOptions {
    filters = (filters == null) ? Map.of() : DeleteMultipleOptions.copy(filters);
  }

  public static UpdateMultipleOptions where(Map<String, Object> filters) {
    return new UpdateMultipleOptions(filters, false);
  }

  public UpdateMultipleOptions withConvertValuesFromString() {
    return new UpdateMultipleOptions(filters, true);
  }
}
