package classifier.monitoring;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import classifier.testsupport.Polling;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class WebhookAlertSinkTest {

  private static final String HOOK = "http://alerts.local/hook";
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC);

  private RestClient.Builder builder;
  private MockRestServiceServer server;

  @BeforeEach
  void setUp() {
    builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
  }

  @Test
  void highLatencyIsPostedAsWarningEmbed() {
    server.expect(requestTo(HOOK))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().contentType(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.username").value("Classifier Monitoring"))
        .andExpect(jsonPath("$.embeds[0].title").value("High inference latency"))
        .andExpect(jsonPath("$.embeds[0].timestamp").value("2026-01-02T03:04:05Z"))
        .andExpect(jsonPath("$.embeds[0].fields[0].value").value("high_latency"))
        .andExpect(jsonPath("$.embeds[0].fields[1].value").value("WARNING"))
        .andRespond(withSuccess());

    sink(new SyncTaskExecutor()).alertHighLatency(3200, 2000);

    server.verify();
  }

  @Test
  void databaseDisconnectIsCriticalAndCarriesTheError() {
    server.expect(requestTo(HOOK))
        .andExpect(jsonPath("$.embeds[0].title").value("Database disconnected"))
        .andExpect(jsonPath("$.embeds[0].fields[1].value").value("CRITICAL"))
        .andExpect(jsonPath("$.embeds[0].fields[2].value").value("Connection refused"))
        .andRespond(withSuccess());

    sink(new SyncTaskExecutor()).alertDatabaseDisconnected("Connection refused");

    server.verify();
  }

  @Test
  void webhookErrorIsLoggedNotThrown() {
    server.expect(requestTo(HOOK)).andRespond(withServerError());

    assertThatCode(() -> sink(new SyncTaskExecutor()).alertHighLatency(5000, 2000))
        .doesNotThrowAnyException();
    server.verify();
  }

  @Test
  void fullQueueDropsTheAlert() {
    TaskExecutor rejecting = task -> {
      throw new RejectedExecutionException("queue full");
    };

    assertThatCode(() -> sink(rejecting).alertDatabaseDisconnected("timeout"))
        .doesNotThrowAnyException();
  }

  @Test
  void deliveryHappensOffTheCallingThread() throws Exception {
    server.expect(requestTo(HOOK)).andRespond(withSuccess());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(10);
    executor.setThreadNamePrefix("alert-test-");
    executor.initialize();
    try {
      sink(executor).alertHighLatency(2500, 2000);

      Polling.untilPasses(server::verify);
    } finally {
      executor.shutdown();
    }
  }

  private WebhookAlertSink sink(TaskExecutor executor) {
    return new WebhookAlertSink(builder.build(), HOOK, executor, CLOCK);
  }
}
