package com.reclink;

/**
 * Thrown when an attribute index would be built over zero observed values.
 */
public class EmptyDomainException extends RecordsIndexException {

  private static final long serialVersionUID = 1L;

  public EmptyDomainException(String attribute) {
    super(String.format("no values were observed for attribute '%s'", attribute));
  }
}
