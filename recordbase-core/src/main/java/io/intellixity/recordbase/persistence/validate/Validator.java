package io.intellixity.recordbase.persistence.validate;

import io.intellixity.recordbase.persistence.query.SortField;
import io.intellixity.recordbase.persistence.record.Persistable;

import java.util.List;
import java.util.Map;

/**
 * Checks records and caller-supplied maps against a record type's declared fields.
 * <p>
 * The controller calls this before building any statement. Implementations report problems through
 * {@link ValidationResult}; they do not throw for invalid input.
 */
public interface Validator {
  /** Every field value of the record: identity non-negative, data fields matching kind and constraints. */
  ValidationResult validateRecord(Persistable record);

  /** Assignment map: keys must be data fields, values must match kind and constraints. */
  ValidationResult validateValues(Persistable record, Map<String, ?> values);

  /** Predicate map: keys must be data fields, values (or each element of a collection) must match kind. */
  ValidationResult validateFilters(Persistable record, Map<String, ?> filters);

  /** Sort fields must name the identity or a data field. */
  ValidationResult validateOrder(Persistable record, List<SortField> order);
}
