package io.intellixity.recordbase.persistence.options;

/**
 * @param noInsert when the record already has an identity, update by identity instead of upserting\n
 */
public record SaveOptions(boolean noInsert) {
  private static final SaveOptions DEFAULTS = new SaveOptions(false);

  public static SaveOptions defaults() { return DEFAULTS; }

  public static SaveOptions updateOnly() { return new SaveOptions(true); }
}
