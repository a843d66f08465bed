package io.intellixity.recordbase.persistence.jdbc;

import io.intellixity.recordbase.persistence.record.Persistable;
import io.intellixity.recordbase.persistence.record.RecordFactory;
import io.intellixity.recordbase.persistence.record.RelationDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Relation traversal for cascading deletes.\n
 *
 * For each relation of the owner type that has a constructor registered, deletes the child rows whose
 * foreign key is one of the parent identities, then recurses from those children one level deeper.
 * Traversal stops at {@link #MAX_DEPTH}, which also bounds relation cycles. Parent identities are sent
 * in chunks of at most {@link #CHUNK_SIZE} to stay under the driver's bind parameter limit. Nothing is
 * rolled back on failure.
 */
final class CascadeDeleter {
  private static final Logger log = LoggerFactory.getLogger(CascadeDeleter.class);

  static final int MAX_DEPTH = 3;
  static final int CHUNK_SIZE = 10_000;

  private final PersistenceController controller;
  private final int chunkSize;

  CascadeDeleter(PersistenceController controller, int chunkSize) {
    if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1");
    this.controller = controller;
    this.chunkSize = chunkSize;
  }

  void run(Persistable owner, List<Long> parentIds, int depth, Map<String, RecordFactory<?>> constructors) {
    if (parentIds == null || parentIds.isEmpty()) return;
    String ownerType = owner.descriptor().type();
    for (RelationDef rel : owner.descriptor().relations()) {
      RecordFactory<?> factory = (constructors == null) ? null : constructors.get(rel.name());
      if (factory == null) {
        log.debug("recordbase.cascade skip type={} relation={} reason=no_constructor", ownerType, rel.name());
        continue;
      }
      Persistable child = factory.create();
      List<Long> childIds = new ArrayList<>();
      for (int from = 0; from < parentIds.size(); from += chunkSize) {
        List<Long> chunk = parentIds.subList(from, Math.min(from + chunkSize, parentIds.size()));
        childIds.addAll(controller.deleteCascading(
            child, Map.of(rel.foreignKeyField(), List.copyOf(chunk)), depth + 1, constructors));
      }
      if (log.isDebugEnabled()) {
        log.debug("recordbase.cascade type={} relation={} childType={} depth={} deleted={}",
            ownerType, rel.name(), child.descriptor().type(), depth + 1, childIds.size());
      }
    }
  }
}
