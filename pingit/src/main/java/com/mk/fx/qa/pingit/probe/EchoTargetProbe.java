package com.mk.fx.qa.pingit.probe;

import com.mk.fx.qa.pingit.echo.EchoClient;
import com.mk.fx.qa.pingit.model.ErrorKind;
import com.mk.fx.qa.pingit.model.ProbeResult;
import com.mk.fx.qa.pingit.model.Target;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link TargetProbe} backed by an ICMP echo through {@link EchoClient}. */
@Slf4j
@Component
public class EchoTargetProbe implements TargetProbe {

  private final EchoClient echoClient;

  public EchoTargetProbe(EchoClient echoClient) {
    this.echoClient = echoClient;
  }

  @Override
  public ProbeResult probe(Target target, Instant startedAt) {
    try {
      var response = echoClient.echo(target.host(), target.timeout());
      if (response.isReachable()) {
        return ProbeResult.success(target.name(), startedAt, response.getRoundTripMs());
      }
      log.debug(
          "Target {} ({}) did not reply within {}", target.name(), target.host(), target.timeout());
      return ProbeResult.failure(target.name(), startedAt, ErrorKind.TIMEOUT);
    } catch (Exception ex) {
      var kind = classifyError(ex);
      log.debug(
          "Target {} ({}) probe failed: {} - {}",
          target.name(),
          target.host(),
          kind,
          ex.getMessage());
      return ProbeResult.failure(target.name(), startedAt, kind);
    }
  }

  static ErrorKind classifyError(Throwable t) {
    if (t == null) return ErrorKind.UNREACHABLE;
    Throwable rootCause = t;
    while (rootCause.getCause() != null) {
      rootCause = rootCause.getCause();
    }
    return switch (rootCause.getClass().getSimpleName()) {
      case "UnknownHostException" -> ErrorKind.HOST_RESOLUTION_FAILED;
      case "SocketTimeoutException", "InterruptedIOException" -> ErrorKind.TIMEOUT;
      default -> ErrorKind.UNREACHABLE;
    };
  }
}
