package io.intellixity.recordbase.persistence.options;

import java.util.Map;

public record GetCountOptions(Map<String, Object> filters) {
  public GetCountOptions {
    filters = (filters == null) ? Map.of() : DeleteMultipleOptions.copy(filters);
  }

  public static GetCountOptions all() { return new GetCountOptions(Map.of()); }

  public static GetCountOptions where(Map<String, Object> filters) { return new GetCountOptions(filters); }
}
