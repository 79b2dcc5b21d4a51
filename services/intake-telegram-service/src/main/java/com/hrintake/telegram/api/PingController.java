package com.hrintake.telegram.api;

import com.hrintake.telegram.polling.LoopState;
import com.hrintake.telegram.polling.TelegramPollingRunner;
import com.hrintake.telegram.store.DocumentStoreStatus;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class PingController {

  private final ObjectProvider<TelegramPollingRunner> polling;
  private final DocumentStoreStatus store;

  /** Liveness probe for the hosting platform. */
  @GetMapping("/")
  public String root() {
    return "Bot is running!";
  }

  @GetMapping("/ping")
  public Map<String, String> ping() {
    TelegramPollingRunner runner = polling.getIfAvailable();
    String loop = runner == null ? "DISABLED" : runner.state().name();
    return Map.of(
        "service", "intake-telegram-service",
        "status", runner == null || runner.state() != LoopState.TERMINATED ? "ok" : "degraded",
        "polling", loop,
        "store", store.isAvailable() ? "connected" : "unavailable");
  }
}
