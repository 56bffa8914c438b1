package com.streamfirst.canvas.sync.adapters.backend.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.canvas.sync.ports.RemoteStoreException;
import com.streamfirst.canvas.sync.ports.RemoteStorePort;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * RemoteStorePort speaking the PostgREST dialect of a hosted Postgres backend: rows live under
 * {@code <baseUrl>/rest/v1/<table>}, upserts are POSTs with {@code on_conflict} and a
 * merge-duplicates preference, selects are GETs with {@code column=eq.value} filters. Every request
 * carries the access key both as {@code apikey} and as a bearer token.
 */
@Slf4j
public final class RestRemoteStoreAdapter implements RemoteStorePort {

  private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {};

  private final String restUrl;
  private final String accessKey;
  private final Duration requestTimeout;
  private final HttpClient client;
  private final ObjectMapper mapper;

  public RestRemoteStoreAdapter(String baseUrl, String accessKey, ObjectMapper mapper) {
    this(baseUrl, accessKey, Duration.ofSeconds(5), Duration.ofSeconds(10), mapper);
  }

  public RestRemoteStoreAdapter(
      String baseUrl,
      String accessKey,
      Duration connectTimeout,
      Duration requestTimeout,
      ObjectMapper mapper) {
    this.restUrl = stripTrailingSlash(baseUrl) + "/rest/v1/";
    this.accessKey = accessKey;
    this.requestTimeout = requestTimeout;
    this.mapper = mapper;
    this.client = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
  }

  @Override
  public void upsert(String table, Map<String, Object> row, Set<String> conflictColumns) {
    String body;
    try {
      body = mapper.writeValueAsString(row);
    } catch (JsonProcessingException e) {
      throw new RemoteStoreException("Cannot encode row for " + table + ": " + e.getOriginalMessage(), e);
    }
    String query = "on_conflict=" + encode(String.join(",", new TreeSet<>(conflictColumns)));
    HttpRequest request =
        request(table, query)
            .header("Content-Type", "application/json")
            .header("Prefer", "resolution=merge-duplicates,return=minimal")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
    send(request, "upsert into " + table);
  }

  @Override
  public Optional<Map<String, Object>> selectOne(String table, Map<String, String> match) {
    List<Map<String, Object>> rows = selectAll(table, match);
    if (rows.size() > 1) {
      throw new RemoteStoreException(
          "Expected at most one row in " + table + " for " + match + " but got " + rows.size());
    }
    return rows.stream().findFirst();
  }

  @Override
  public List<Map<String, Object>> selectAll(String table, Map<String, String> match) {
    StringJoiner query = new StringJoiner("&");
    query.add("select=*");
    new TreeSet<>(match.keySet())
        .forEach(column -> query.add(encode(column) + "=eq." + encode(match.get(column))));
    HttpRequest request =
        request(table, query.toString()).header("Accept", "application/json").GET().build();
    String body = send(request, "select from " + table);
    try {
      return mapper.readValue(body, ROWS);
    } catch (JsonProcessingException e) {
      throw new RemoteStoreException(
          "Unexpected response from " + table + ": " + e.getOriginalMessage(), e);
    }
  }

  private HttpRequest.Builder request(String table, String query) {
    return HttpRequest.newBuilder()
        .uri(URI.create(restUrl + encode(table) + "?" + query))
        .timeout(requestTimeout)
        .header("apikey", accessKey)
        .header("Authorization", "Bearer " + accessKey);
  }

  private String send(HttpRequest request, String operation) {
    HttpResponse<String> response;
    try {
      response = client.send(request, BodyHandlers.ofString());
    } catch (IOException e) {
      throw new RemoteStoreException("Backend unreachable during " + operation + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RemoteStoreException("Interrupted during " + operation, e);
    }
    int status = response.statusCode();
    log.debug("{} {} -> {}", request.method(), request.uri().getPath(), status);
    if (status >= 400) {
      throw new RemoteStoreException(
          operation + " failed with HTTP " + status + ": " + abbreviate(response.body()), status, null);
    }
    return response.body() == null || response.body().isBlank() ? "[]" : response.body();
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() > 200 ? body.substring(0, 200) + "..." : body;
  }
}
