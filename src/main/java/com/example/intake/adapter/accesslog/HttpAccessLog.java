package com.example.intake.adapter.accesslog;

import com.example.intake.util.LogMasking;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts lead events to the lead back end on OkHttp's dispatcher threads.
 * The calling request never waits for delivery and never sees its outcome.
 */
@Slf4j
public class HttpAccessLog implements AccessLog {

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final HttpUrl baseUrl;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;

  public HttpAccessLog(String baseUrl, OkHttpClient httpClient, ObjectMapper objectMapper) {
    this.baseUrl = HttpUrl.get(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  @Override
  public void record(AccessEventKind kind, Map<String, Object> fields) {
    Map<String, Object> safeFields = LogMasking.redact(fields);
    log.info("Access event {}: {}", kind, LogMasking.maskContactDetails(safeFields));

    if (kind.remotePath().isEmpty()) {
      return;
    }

    try {
      Map<String, Object> payload = new LinkedHashMap<>(safeFields);
      payload.put("event", kind.name());

      Request request = new Request.Builder()
          .url(baseUrl.resolve(kind.remotePath().get()))
          .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
          .build();

      httpClient.newCall(request).enqueue(new Callback() {
        @Override
        public void onFailure(Call call, IOException e) {
          log.warn("Access event {} not delivered: {}", kind, e.getMessage());
        }

        @Override
        public void onResponse(Call call, Response response) {
          try (response) {
            if (!response.isSuccessful()) {
              log.warn("Access event {} rejected by lead back end, status: {}", kind, response.code());
            }
          }
        }
      });
    } catch (JsonProcessingException | RuntimeException e) {
      log.warn("Access event {} dropped: {}", kind, e.getMessage());
    }
  }
}
