package com.mk.fx.qa.pingit.dto;

import com.mk.fx.qa.pingit.model.TargetState;
import java.time.Instant;

/**
 * Statistics of one target, either live from its aggregator or the latest persisted snapshot.
 * Response times are in milliseconds and absent until the first successful probe. {@code
 * statusCode} is 1 when up, 0 when down and absent while unknown.
 */
public record TargetStatsResponse(
    String targetName,
    String host,
    long pingCount,
    long successCount,
    long failureCount,
    double successRate,
    Double minRt,
    Double maxRt,
    Double avgRt,
    TargetState currentState,
    Integer statusCode,
    Instant timestamp,
    DisconnectEventResponse openDisconnect) {}
