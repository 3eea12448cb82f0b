package com.mk.fx.qa.pingit.cfg;

import com.mk.fx.qa.pingit.echo.EchoClient;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ProbeCfg {

  /** Timeouts are per target and passed on every call. */
  @Bean
  public EchoClient echoClient() {
    return new EchoClient();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
