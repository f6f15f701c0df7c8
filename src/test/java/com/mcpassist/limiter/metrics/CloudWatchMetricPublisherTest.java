package com.mcpassist.limiter.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.CloudWatchException;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

public class CloudWatchMetricPublisherTest {
  @Test
  public void labelsBecomeSortedDimensions() {
    CloudWatchClient client = mock(CloudWatchClient.class);
    CloudWatchMetricPublisher pub = new CloudWatchMetricPublisher(client, "TestNS");

    pub.incrementCounter("ratelimit_rejected_total", 3, Map.of("tool", "go-doc", "mode", "per-tool"));

    ArgumentCaptor<PutMetricDataRequest> captor = ArgumentCaptor.forClass(PutMetricDataRequest.class);
    verify(client).putMetricData(captor.capture());
    PutMetricDataRequest request = captor.getValue();
    assertEquals("TestNS", request.namespace());
    MetricDatum datum = request.metricData().get(0);
    assertEquals("ratelimit_rejected_total", datum.metricName());
    assertEquals(3.0, datum.value(), 0.0001);
    assertEquals(StandardUnit.COUNT, datum.unit());
    assertEquals(List.of(
        Dimension.builder().name("mode").value("per-tool").build(),
        Dimension.builder().name("tool").value("go-doc").build()), datum.dimensions());
  }

  @Test
  public void secondsObservationsUseSecondsUnit() {
    CloudWatchClient client = mock(CloudWatchClient.class);
    CloudWatchMetricPublisher pub = new CloudWatchMetricPublisher(client, null);

    pub.observe("retry_delay_seconds", 0.5, Map.of("tool", "go-doc"));
    pub.gauge("circuit_breaker_state", 2, Map.of("name", "go-doc"));

    ArgumentCaptor<PutMetricDataRequest> captor = ArgumentCaptor.forClass(PutMetricDataRequest.class);
    verify(client, org.mockito.Mockito.times(2)).putMetricData(captor.capture());
    assertEquals("McpResilience", captor.getAllValues().get(0).namespace());
    assertEquals(StandardUnit.SECONDS, captor.getAllValues().get(0).metricData().get(0).unit());
    assertEquals(StandardUnit.NONE, captor.getAllValues().get(1).metricData().get(0).unit());
  }

  @Test
  public void clientFailuresAreSwallowed() {
    CloudWatchClient client = mock(CloudWatchClient.class);
    when(client.putMetricData(any(PutMetricDataRequest.class)))
        .thenThrow(CloudWatchException.builder().message("throttled").build());
    CloudWatchMetricPublisher pub = new CloudWatchMetricPublisher(client, "TestNS");

    pub.incrementCounter("retries_total", 1);

    verify(client).putMetricData(any(PutMetricDataRequest.class));
  }
}
