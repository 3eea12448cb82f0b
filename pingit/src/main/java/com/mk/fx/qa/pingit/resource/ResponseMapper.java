package com.mk.fx.qa.pingit.resource;

import com.mk.fx.qa.pingit.dto.DisconnectEventResponse;
import com.mk.fx.qa.pingit.dto.PingHistoryEntry;
import com.mk.fx.qa.pingit.dto.TargetStatsResponse;
import com.mk.fx.qa.pingit.model.DisconnectEvent;
import com.mk.fx.qa.pingit.model.TargetStats;
import com.mk.fx.qa.pingit.persistence.PingRecord;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface ResponseMapper {

  @Mapping(target = "targetName", source = "stats.targetName")
  @Mapping(target = "host", source = "stats.host")
  @Mapping(target = "successRate", expression = "java(stats.successRate())")
  @Mapping(target = "statusCode", expression = "java(stats.currentState().toStatusCode())")
  @Mapping(target = "openDisconnect", source = "openDisconnect")
  TargetStatsResponse toResponse(TargetStats stats, DisconnectEvent openDisconnect);

  @Mapping(target = "disconnectCount", source = "consecutiveFailureCount")
  @Mapping(target = "durationSeconds", expression = "java(event.durationSeconds().orElse(null))")
  DisconnectEventResponse toResponse(DisconnectEvent event);

  List<DisconnectEventResponse> toDisconnectResponses(List<DisconnectEvent> events);

  @Mapping(target = "targetName", source = "result.targetName")
  @Mapping(target = "timestamp", source = "result.timestamp")
  @Mapping(target = "success", source = "result.success")
  @Mapping(target = "responseTimeMs", source = "result.responseTimeMs")
  @Mapping(target = "errorKind", source = "result.errorKind")
  PingHistoryEntry toHistoryEntry(PingRecord record);

  List<PingHistoryEntry> toHistoryEntries(List<PingRecord> records);
}
