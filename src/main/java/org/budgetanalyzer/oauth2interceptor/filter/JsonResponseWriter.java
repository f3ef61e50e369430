package org.budgetanalyzer.oauth2interceptor.filter;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;

import reactor.core.publisher.Mono;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Writes small JSON bodies straight to the exchange response. */
public class JsonResponseWriter {

  private static final Logger log = LoggerFactory.getLogger(JsonResponseWriter.class);

  static final String JSON_UTF8 = "application/json; charset=utf-8";

  private final ObjectMapper objectMapper;

  public JsonResponseWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Mono<Void> write(ServerWebExchange exchange, HttpStatus status, Map<String, ?> body) {
    var response = exchange.getResponse();
    if (response.isCommitted()) {
      log.warn("Response already committed, dropping {} body", status.value());
      return Mono.empty();
    }

    byte[] json;
    try {
      json = objectMapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      return Mono.error(e);
    }

    response.setStatusCode(status);
    response.getHeaders().set(HttpHeaders.CONTENT_TYPE, JSON_UTF8);
    response.getHeaders().setContentLength(json.length);
    return response.writeWith(Mono.just(response.bufferFactory().wrap(json)));
  }
}
