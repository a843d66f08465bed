package io.intellixity.recordbase.persistence.schema;

import io.intellixity.recordbase.persistence.query.SortField;

import java.util.List;
import java.util.Map;

/**
 * Schema handle of one record type: table/column mapping plus the statements the controller runs.\n
 *
 * Statements use positional {@code ?} parameters. Column order is the identity (where selected) followed by
 * data fields in descriptor order. Filter and value maps are rendered in their iteration order; callers
 * pass maps ordered with {@code FieldIntrospector.ordered} and bind values in that same order.\n
 *
 * Filter rendering: a collection value renders {@code IN (...)} (an empty collection matches nothing),
 * any other value renders equality. Multiple filters are AND-joined.
 */
public interface SqlGenerator {
  String table();

  String identityColumn();

  /** Column of a data field or of the identity field; null for unknown names. */
  String columnFor(String field);

  /** Field mapped to a column; null for unknown columns. */
  String fieldForColumn(String column);

  /** Params: data fields. Returns the generated identity. */
  String insert();

  /** Params: identity, then data fields. Conflict on identity updates every data field. */
  String upsert();

  /** Params: data fields, then identity. */
  String updateById();

  /** Params: identity. Selects identity, then data fields. */
  String selectById();

  /** Params: filter values. Selects identity, then data fields. {@code limit}/{@code offset} 0 means unset. */
  String select(List<SortField> order, int limit, int offset, Map<String, ?> filters);

  /** Params: identity. */
  String deleteById();

  /** Params: filter values. Returns the identity of every deleted row. */
  String deleteReturningIds(Map<String, ?> filters);

  /** Params: values, then filter values. */
  String update(Map<String, ?> values, Map<String, ?> filters);

  /** Params: filter values. */
  String selectCount(Map<String, ?> filters);
}
