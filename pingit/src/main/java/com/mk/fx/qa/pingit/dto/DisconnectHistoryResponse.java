package com.mk.fx.qa.pingit.dto;

import java.util.List;

public record DisconnectHistoryResponse(
    String targetName, int count, List<DisconnectEventResponse> events) {}
