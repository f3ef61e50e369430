package org.budgetanalyzer.oauth2interceptor.filter;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.exception.AuthorizationServerException;
import org.budgetanalyzer.oauth2interceptor.exception.OAuth2InterceptorException;
import org.budgetanalyzer.oauth2interceptor.exception.OAuth2ProtocolException;
import org.budgetanalyzer.oauth2interceptor.exception.OAuth2StateMismatchException;

/**
 * Renders OAuth2 interceptor failures as JSON.
 *
 * <ul>
 *   <li>{@link OAuth2StateMismatchException}: 403
 *   <li>{@link OAuth2ProtocolException}: 401 with the authorization server's error code
 *   <li>{@link AuthorizationServerException}: 502
 * </ul>
 *
 * <p>Any other error is left to the next handler. Ordered ahead of Boot's default error handler,
 * which sits at {@code -1}.
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public class OAuth2ErrorWebExceptionHandler implements ErrorWebExceptionHandler, Ordered {

  private static final Logger log = LoggerFactory.getLogger(OAuth2ErrorWebExceptionHandler.class);

  private final JsonResponseWriter responseWriter;

  public OAuth2ErrorWebExceptionHandler(JsonResponseWriter responseWriter) {
    this.responseWriter = responseWriter;
  }

  @Override
  public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
    if (!(ex instanceof OAuth2InterceptorException interceptorException)) {
      return Mono.error(ex);
    }
    if (exchange.getResponse().isCommitted()) {
      log.debug("Response already committed, not rendering {}", ex.getClass().getSimpleName());
      return Mono.error(ex);
    }

    var status = statusOf(interceptorException);
    Map<String, Object> body = new LinkedHashMap<>();
    if (interceptorException instanceof OAuth2ProtocolException protocolException) {
      body.put("error", protocolException.getError());
      if (protocolException.getErrorDescription() != null) {
        body.put("error_description", protocolException.getErrorDescription());
      }
    } else {
      body.put("error", errorCodeOf(interceptorException));
      body.put("error_description", interceptorException.getMessage());
    }

    log.warn(
        "OAuth2 failure on {} [{}]: {}",
        exchange.getRequest().getPath().value(),
        status.value(),
        ex.getMessage());
    return responseWriter.write(exchange, status, body);
  }

  @Override
  public int getOrder() {
    return -2;
  }

  static HttpStatus statusOf(OAuth2InterceptorException ex) {
    if (ex instanceof OAuth2StateMismatchException) {
      return HttpStatus.FORBIDDEN;
    }
    if (ex instanceof OAuth2ProtocolException) {
      return HttpStatus.UNAUTHORIZED;
    }
    if (ex instanceof AuthorizationServerException) {
      return HttpStatus.BAD_GATEWAY;
    }
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  private static String errorCodeOf(OAuth2InterceptorException ex) {
    if (ex instanceof OAuth2StateMismatchException) {
      return "state_mismatch";
    }
    if (ex instanceof AuthorizationServerException) {
      return "authorization_server_unavailable";
    }
    return "server_error";
  }
}
