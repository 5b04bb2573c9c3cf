package com.example.intake.adapter.accesslog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class HttpAccessLogTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private MockWebServer server;
  private HttpAccessLog accessLog;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    accessLog = new HttpAccessLog(server.url("/").toString(), new OkHttpClient(), objectMapper);
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void shouldPostAccessRequestToLeadBackEnd() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(204));
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("email", "sandbox@stytch.com");
    fields.put("referrer", "https://ads.example");
    fields.put("sessionToken", "must-not-leak");

    accessLog.record(AccessEventKind.ACCESS_REQUESTED, fields);

    RecordedRequest request = server.takeRequest(2, TimeUnit.SECONDS);
    assertNotNull(request);
    assertEquals("/log/access", request.getPath());
    JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
    assertEquals("ACCESS_REQUESTED", body.get("event").asText());
    assertEquals("sandbox@stytch.com", body.get("email").asText());
    assertEquals("***", body.get("sessionToken").asText());
  }

  @Test
  void shouldKeepOtherEventsLocal() throws Exception {
    accessLog.record(AccessEventKind.STEP_UP_COMPLETED, Map.of("subjectId", "user-test-123"));

    assertNull(server.takeRequest(200, TimeUnit.MILLISECONDS));
  }

  @Test
  void shouldNotThrowWhenBackEndFails() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(500));

    assertDoesNotThrow(() -> accessLog.record(AccessEventKind.ACCESS_REQUESTED, Map.of("email", "a@b.co")));
    assertNotNull(server.takeRequest(2, TimeUnit.SECONDS));
  }

  @Test
  void shouldNotThrowWhenBackEndUnreachable() {
    HttpAccessLog unreachable = new HttpAccessLog("http://127.0.0.1:1", new OkHttpClient(), objectMapper);

    assertDoesNotThrow(() -> unreachable.record(AccessEventKind.ACCESS_REQUESTED, Map.of("email", "a@b.co")));
  }
}
