package com.mk.fx.qa.pingit.persistence;

/** A row waiting in the persistence queue. */
public sealed interface PendingWrite
    permits PingRecord, StatsRecord, DisconnectRecord, DisconnectCloseRecord {

  String targetName();
}
