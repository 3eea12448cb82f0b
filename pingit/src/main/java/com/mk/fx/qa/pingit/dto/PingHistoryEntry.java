package com.mk.fx.qa.pingit.dto;

import com.mk.fx.qa.pingit.model.ErrorKind;
import java.time.Instant;

/** One stored probe result. */
public record PingHistoryEntry(
    String targetName,
    String host,
    Instant timestamp,
    boolean success,
    Double responseTimeMs,
    ErrorKind errorKind) {}
