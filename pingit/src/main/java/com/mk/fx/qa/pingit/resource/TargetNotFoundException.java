package com.mk.fx.qa.pingit.resource;

/** Raised when a request names a target that is not configured. */
public class TargetNotFoundException extends RuntimeException {

  public TargetNotFoundException(String targetName) {
    super("Unknown target: " + targetName);
  }
}
