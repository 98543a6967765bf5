package com.reclink;

/**
 * Thrown when a record's number of values differs from the number of
 * attributes.
 */
public class SchemaMismatchException extends RecordsIndexException {

  private static final long serialVersionUID = 1L;

  private final String recordId;
  private final int expected;
  private final int actual;

  public SchemaMismatchException(String recordId, int expected, int actual) {
    super(
      String.format(
        "attribute specifications do not match the records: record '%s' has %d value(s), expected %d",
        recordId,
        actual,
        expected
      )
    );
    this.recordId = recordId;
    this.expected = expected;
    this.actual = actual;
  }

  private SchemaMismatchException(String message, int expected) {
    super(message);
    this.recordId = null;
    this.expected = expected;
    this.actual = -1;
  }

  /** Failure of a distributed pass that rejected {@code rejected} records. */
  public static SchemaMismatchException rejected(long rejected, int expected) {
    return new SchemaMismatchException(
      String.format(
        "attribute specifications do not match the records: %d record(s) do not have %d value(s)",
        rejected,
        expected
      ),
      expected
    );
  }

  /** Offending record, or null when only a count of rejected records is known. */
  public String getRecordId() {
    return recordId;
  }

  public int getExpected() {
    return expected;
  }

  /** Number of values of the offending record, or -1 if unknown. */
  public int getActual() {
    return actual;
  }
}
