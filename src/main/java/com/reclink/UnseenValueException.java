package com.reclink;

/**
 * Thrown when a value is looked up in an attribute index that never counted
 * it. Usually a sign that the index is stale relative to the records.
 */
public class UnseenValueException extends RecordsIndexException {

  private static final long serialVersionUID = 1L;

  private final String attribute;
  private final String value;
  private final String recordId;

  public UnseenValueException(String attribute, String value) {
    this(attribute, value, null);
  }

  public UnseenValueException(String attribute, String value, String recordId) {
    super(
      recordId == null
        ? String.format("value '%s' was not observed for attribute '%s'", value, attribute)
        : String.format(
          "value '%s' of record '%s' was not observed for attribute '%s'",
          value,
          recordId,
          attribute
        )
    );
    this.attribute = attribute;
    this.value = value;
    this.recordId = recordId;
  }

  private UnseenValueException(String attribute, long count) {
    super(String.format("%d value(s) were not observed for attribute '%s'", count, attribute));
    this.attribute = attribute;
    this.value = null;
    this.recordId = null;
  }

  /** Failure of a distributed transformation that met {@code count} unseen values. */
  public static UnseenValueException unseenInPass(String attribute, long count) {
    return new UnseenValueException(attribute, count);
  }

  public String getAttribute() {
    return attribute;
  }

  /** Unseen value, or null when only a count is known. */
  public String getValue() {
    return value;
  }

  /** Record being transformed, or null for a direct lookup. */
  public String getRecordId() {
    return recordId;
  }
}
