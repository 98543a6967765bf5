package com.reclink;

/**
 * Thrown when a counter is registered under a name that is already taken.
 */
public class CounterRegistrationException extends RecordsIndexException {

  private static final long serialVersionUID = 1L;

  public CounterRegistrationException(String name) {
    super(String.format("a counter named '%s' is already registered", name));
  }
}
