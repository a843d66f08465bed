package io.intellixity.recordbase.persistence.record;

/** Creates fresh, zero-valued records of one type. */
@FunctionalInterface
public interface RecordFactory<T extends Persistable> {
  T create();
}
