package org.budgetanalyzer.oauth2interceptor.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.filter.OAuth2ExchangeAttributes;

/**
 * User information controller.
 *
 * <p>Lets a frontend check whether the session is logged in (200 or 401) and read the user info
 * returned by the authorization server.
 */
@RestController
public class UserController {

  private static final Logger logger = LoggerFactory.getLogger(UserController.class);

  /**
   * Returns the current user's information.
   *
   * @param exchange the current exchange
   * @return user info plus {@code authenticated: true}, or 401 without OAuth2 data
   */
  @GetMapping("/user")
  public Mono<ResponseEntity<Map<String, Object>>> getCurrentUser(ServerWebExchange exchange) {
    var data = OAuth2ExchangeAttributes.getOAuth2Data(exchange);
    if (data == null) {
      logger.debug("No OAuth2 data for /user request");
      return Mono.just(ResponseEntity.status(HttpStatus.UNAUTHORIZED).build());
    }

    Map<String, Object> userInfo = new LinkedHashMap<>(data.getUserinfo());
    userInfo.put("authenticated", true);
    return Mono.just(ResponseEntity.ok(userInfo));
  }
}
