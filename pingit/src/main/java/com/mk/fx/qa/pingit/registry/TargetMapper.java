package com.mk.fx.qa.pingit.registry;

import com.mk.fx.qa.pingit.cfg.PingitCfg;
import com.mk.fx.qa.pingit.model.Target;
import java.util.List;
import org.mapstruct.Context;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** Maps configured target entries onto domain targets, filling gaps from the global defaults. */
@Mapper(componentModel = "spring")
public interface TargetMapper {

  @Mapping(
      target = "interval",
      source = "interval",
      defaultExpression = "java(defaults.getInterval())")
  @Mapping(
      target = "timeout",
      source = "timeout",
      defaultExpression = "java(defaults.getTimeout())")
  Target toDomain(PingitCfg.TargetEntry entry, @Context PingitCfg defaults);

  List<Target> toDomain(List<PingitCfg.TargetEntry> entries, @Context PingitCfg defaults);
}
