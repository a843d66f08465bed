package io.intellixity.recordbase.persistence.options;

import io.intellixity.recordbase.persistence.query.SortField;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Select options.\n
 *
 * @param order sort fields, applied in list order\n
 * @param limit max rows; 0 means no limit\n
 * @param offset rows to skip; 0 means none\n
 * @param filters field predicates (equality, or IN for collection values)\n
 * @param rowTransform optional per-row hook; its result replaces the record in the returned list\n
 */
public record GetOptions<T>(List<SortField> order,
                            int limit,
                            int offset,
                            Map<String, Object> filters,
                            Function<? super T, ?> rowTransform) {
  public GetOptions {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    order = (order == null) ? List.of() : List.copyOf(order);
    filters = (filters == null) ? Map.of() : DeleteMultipleOptions.copy(filters);
  }

  public static <T> GetOptions<T> all() {
    return new GetOptions<>(List.of(), 0, 0, Map.of(), null);
  }

  public static <T> GetOptions<T> where(Map<String, Object> filters) {
    return new GetOptions<>(List.of(), 0, 0, filters, null);
  }

  public GetOptions<T> withOrder(List<SortField> order) {
    return new GetOptions<>(order, limit, offset, filters, rowTransform);
  }

  public GetOptions<T> withPage(int limit, int offset) {
    return new GetOptions<>(order, limit, offset, filters, rowTransform);
  }

  public GetOptions<T> withRowTransform(Function<? super T, ?> rowTransform) {
    return new GetOptions<>(order, limit, offset, filters, rowTransform);
  }
}
