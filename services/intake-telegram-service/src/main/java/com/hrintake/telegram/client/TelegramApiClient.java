package com.hrintake.telegram.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hrintake.telegram.config.BotProperties;
import com.hrintake.telegram.config.TransportProperties;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Low level Bot API caller: {@code POST {base}/bot{token}/{method}} with a JSON body. */
@Component
@Slf4j
public class TelegramApiClient {

  static final String GET_UPDATES = "getUpdates";

  private static final Set<String> SEND_METHODS =
      Set.of("sendMessage", "sendPhoto", "sendDocument", "editMessageText");

  private final RestClient.Builder builder;
  private final ObjectMapper mapper;
  private final TransportProperties transport;
  private final String baseUrl;
  private final Function<Duration, ClientHttpRequestFactory> requestFactories;
  private final ConcurrentMap<Duration, RestClient> clients = new ConcurrentHashMap<>();

  @Autowired
  public TelegramApiClient(
      RestClient.Builder builder,
      ObjectMapper mapper,
      BotProperties bot,
      TransportProperties transport) {
    this(builder, mapper, bot, transport, jdkFactories(transport));
  }

  TelegramApiClient(
      RestClient.Builder builder,
      ObjectMapper mapper,
      BotProperties bot,
      TransportProperties transport,
      Function<Duration, ClientHttpRequestFactory> requestFactories) {
    this.builder = builder;
    this.mapper = mapper;
    this.transport = transport;
    this.baseUrl = trimTrailingSlash(bot.apiBaseUrl()) + "/bot" + bot.token().trim() + "/";
    this.requestFactories = requestFactories;
  }

  private static Function<Duration, ClientHttpRequestFactory> jdkFactories(
      TransportProperties transport) {
    HttpClient http = HttpClient.newBuilder().connectTimeout(transport.defaultTimeout()).build();
    return timeout -> {
      var factory = new JdkClientHttpRequestFactory(http);
      factory.setReadTimeout(timeout);
      return factory;
    };
  }

  public ApiResult call(String method, Map<String, ?> params) {
    Duration timeout = timeoutFor(method, params);
    int retries = GET_UPDATES.equals(method) ? 0 : transport.maxRetries();
    RestClient rest = clients.computeIfAbsent(timeout, this::newClient);

    ApiResult last = null;
    for (int attempt = 0; attempt <= retries; attempt++) {
      last = attempt(rest, method, params);
      if (!last.isTransient() || attempt == retries) {
        break;
      }
      log.warn(
          "Bot API {} failed ({}: {}), retry {}/{}",
          method,
          last.failure(),
          last.description(),
          attempt + 1,
          retries);
      if (!pause(transport.retryBackoff().multipliedBy(attempt + 1L))) {
        break;
      }
    }
    return last;
  }

  /** Long-poll window plus margin for getUpdates, send timeout for send/edit, else default. */
  Duration timeoutFor(String method, Map<String, ?> params) {
    if (GET_UPDATES.equals(method)) {
      long wait = 0;
      Object raw = params == null ? null : params.get("timeout");
      if (raw instanceof Number n) {
        wait = n.longValue();
      } else if (raw != null) {
        try {
          wait = Long.parseLong(raw.toString().trim());
        } catch (NumberFormatException e) {
          log.warn("Non-numeric getUpdates timeout '{}', using margin only", raw);
        }
      }
      return Duration.ofSeconds(Math.max(0, wait)).plus(transport.longPollMargin());
    }
    if (SEND_METHODS.contains(method)) {
      return transport.sendTimeout();
    }
    return transport.defaultTimeout();
  }

  private RestClient newClient(Duration timeout) {
    return builder.clone().baseUrl(baseUrl).requestFactory(requestFactories.apply(timeout)).build();
  }

  private ApiResult attempt(RestClient rest, String method, Map<String, ?> params) {
    try {
      return rest.post()
          .uri(method)
          .contentType(MediaType.APPLICATION_JSON)
          .body(params == null ? Map.of() : params)
          .exchange((request, response) -> toResult(response.getBody().readAllBytes()));
    } catch (ResourceAccessException e) {
      FailureKind kind = isTimeout(e) ? FailureKind.TIMEOUT : FailureKind.CONNECTION;
      return ApiResult.failure(kind, e.getMessage());
    } catch (RestClientException e) {
      log.warn("Bot API {} failed unexpectedly: {}", method, e.getMessage());
      return ApiResult.failure(FailureKind.UNEXPECTED, e.getMessage());
    }
  }

  private ApiResult toResult(byte[] body) {
    JsonNode json;
    try {
      json = body.length == 0 ? null : mapper.readTree(body);
    } catch (IOException e) {
      return ApiResult.failure(FailureKind.UNEXPECTED, "Malformed response: " + e.getMessage());
    }
    if (json == null || !json.isObject()) {
      return ApiResult.failure(FailureKind.UNEXPECTED, "Empty or non-JSON response");
    }
    if (json.path("ok").asBoolean(false)) {
      return ApiResult.success(json.path("result"));
    }
    Integer errorCode = json.hasNonNull("error_code") ? json.get("error_code").asInt() : null;
    return ApiResult.remote(json.path("description").asText("Unknown error"), errorCode);
  }

  private static boolean isTimeout(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof HttpTimeoutException || t instanceof SocketTimeoutException) {
        return true;
      }
    }
    return false;
  }

  private static boolean pause(Duration d) {
    try {
      Thread.sleep(d.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static String trimTrailingSlash(String url) {
    String out = url.trim();
    while (out.endsWith("/")) {
      out = out.substring(0, out.length() - 1);
    }
    return out;
  }
}
