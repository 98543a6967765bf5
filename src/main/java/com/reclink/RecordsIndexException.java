package com.reclink;

/**
 * Base class for data-quality and programming errors raised while indexing or
 * transforming records. These are never retried.
 */
public class RecordsIndexException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public RecordsIndexException(String message) {
    super(message);
  }
}
