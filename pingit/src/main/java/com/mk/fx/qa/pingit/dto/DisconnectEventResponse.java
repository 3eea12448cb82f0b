package com.mk.fx.qa.pingit.dto;

import com.mk.fx.qa.pingit.model.ErrorKind;
import java.time.Instant;

/** A disconnect event; {@code endTime} and {@code durationSeconds} are absent while it is open. */
public record DisconnectEventResponse(
    String targetName,
    String host,
    Instant startTime,
    Instant endTime,
    int disconnectCount,
    ErrorKind reason,
    Long durationSeconds) {}
