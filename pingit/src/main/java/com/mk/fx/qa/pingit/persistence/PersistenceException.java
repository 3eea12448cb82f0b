package com.mk.fx.qa.pingit.persistence;

/** Raised when a batch cannot be written to or a query cannot be read from the store. */
public class PersistenceException extends RuntimeException {

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
