package com.mk.fx.qa.pingit.echo;

import lombok.Data;

@Data
public class EchoResponse {
  private String host;
  private String address;
  private boolean reachable;
  private double roundTripMs;
}
