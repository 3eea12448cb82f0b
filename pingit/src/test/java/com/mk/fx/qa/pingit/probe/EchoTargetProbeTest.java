package com.mk.fx.qa.pingit.probe;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.pingit.echo.EchoClient;
import com.mk.fx.qa.pingit.echo.EchoResponse;
import com.mk.fx.qa.pingit.model.ErrorKind;
import com.mk.fx.qa.pingit.model.Target;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class EchoTargetProbeTest {

  private static final Instant AT = Instant.parse("2024-05-01T10:00:00Z");
  private static final Target TARGET =
      new Target("dns", "dns.example", Duration.ofSeconds(10), Duration.ofSeconds(2));

  private static EchoResponse response(boolean reachable, double rtt) {
    var response = new EchoResponse();
    response.setHost("dns.example");
    response.setReachable(reachable);
    response.setRoundTripMs(rtt);
    return response;
  }

  @Test
  void probe_successCarriesRoundTrip() throws Exception {
    var client = mock(EchoClient.class);
    when(client.echo(eq("dns.example"), eq(Duration.ofSeconds(2)))).thenReturn(response(true, 7.5));

    var result = new EchoTargetProbe(client).probe(TARGET, AT);

    assertTrue(result.success());
    assertEquals(7.5, result.responseTimeMs());
    assertEquals(AT, result.timestamp());
  }

  @Test
  void probe_noReplyIsTimeout() throws Exception {
    var client = mock(EchoClient.class);
    when(client.echo(any(), any())).thenReturn(response(false, 0));

    var result = new EchoTargetProbe(client).probe(TARGET, AT);

    assertFalse(result.success());
    assertEquals(ErrorKind.TIMEOUT, result.errorKind());
  }

  @Test
  void probe_unresolvableHost() throws Exception {
    var client = mock(EchoClient.class);
    when(client.echo(any(), any())).thenThrow(new UnknownHostException("dns.example"));

    assertEquals(
        ErrorKind.HOST_RESOLUTION_FAILED,
        new EchoTargetProbe(client).probe(TARGET, AT).errorKind());
  }

  @Test
  void probe_otherIoErrorIsUnreachable() throws Exception {
    var client = mock(EchoClient.class);
    when(client.echo(any(), any())).thenThrow(new NoRouteToHostException("no route"));

    assertEquals(ErrorKind.UNREACHABLE, new EchoTargetProbe(client).probe(TARGET, AT).errorKind());
  }

  @Test
  void classifyError_usesRootCause() {
    var wrapped = new IOException("wrapped", new SocketTimeoutException("slow"));
    assertEquals(ErrorKind.TIMEOUT, EchoTargetProbe.classifyError(wrapped));
    assertEquals(
        ErrorKind.TIMEOUT, EchoTargetProbe.classifyError(new InterruptedIOException("cut")));
    assertEquals(
        ErrorKind.HOST_RESOLUTION_FAILED,
        EchoTargetProbe.classifyError(
            new RuntimeException(new IOException(new UnknownHostException("x")))));
    assertEquals(ErrorKind.UNREACHABLE, EchoTargetProbe.classifyError(null));
  }
}
