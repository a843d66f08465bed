package io.intellixity.recordbase.persistence.error;

import java.util.List;

/**
 * Cascading delete failed after the root rows were already removed.\n
 *
 * Nothing is rolled back: rows deleted before the failure stay deleted, and dependent rows below the
 * failing level remain. {@link #rootType()} and {@link #rootIds()} identify what needs reconciling; the
 * underlying failure is the cause.
 */
public final class CascadeDeleteException extends PersistenceException {
  private final String rootType;
  private final List<Long> rootIds;

  public CascadeDeleteException(String rootType, List<Long> rootIds, PersistenceException cause) {
    super("CascadeDelete",
        "Cascade delete incomplete for " + rootType + " ids=" + rootIds + " (failed at " + cause.op() + ")",
        cause);
    this.rootType = rootType;
    this.rootIds = List.copyOf(rootIds);
  }

  public String rootType() { return rootType; }

  public List<Long> rootIds() { return rootIds; }
}
