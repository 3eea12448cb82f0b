package com.mk.fx.qa.pingit.persistence;

import com.mk.fx.qa.pingit.model.DisconnectEvent;
import java.util.Objects;

/** Latest state of a disconnect event, upserted into {@code disconnect_events}. */
public record DisconnectRecord(DisconnectEvent event) implements PendingWrite {

  public DisconnectRecord {
    Objects.requireNonNull(event, "event");
  }

  @Override
  public String targetName() {
    return event.targetName();
  }
}
