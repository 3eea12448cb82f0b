package com.mk.fx.qa.pingit.model;

/** Reason a probe did not produce a reply. */
public enum ErrorKind {
  TIMEOUT,
  UNREACHABLE,
  HOST_RESOLUTION_FAILED
}
