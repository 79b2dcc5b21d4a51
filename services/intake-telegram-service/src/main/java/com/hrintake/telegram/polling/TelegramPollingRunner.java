package com.hrintake.telegram.polling;

import com.fasterxml.jackson.databind.JsonNode;
import com.hrintake.telegram.client.ApiResult;
import com.hrintake.telegram.client.TelegramBotClient;
import com.hrintake.telegram.config.PollingProperties;
import com.hrintake.telegram.conversation.ConversationEngine;
import com.hrintake.telegram.i18n.BotTexts;
import com.hrintake.telegram.model.BotCommand;
import com.hrintake.telegram.model.CallbackAction;
import com.hrintake.telegram.model.IncomingMessage;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Длительный опрос Telegram ({@code getUpdates}) в отдельном потоке.
 *
 * <p>Offset сдвигается сразу после передачи апдейта в пул, а не после обработки. Апдейты одного
 * пользователя обрабатываются по очереди. Отключается через bot.polling.enabled=false.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "bot.polling.enabled", havingValue = "true", matchIfMissing = true)
public class TelegramPollingRunner implements SmartLifecycle {

  private static final int UNAUTHORIZED = 401;
  private static final int CONFLICT = 409;

  private final TelegramBotClient bot;
  private final ConversationEngine engine;
  private final BotTexts texts;
  private final PollingProperties properties;
  private final PerUserDispatcher dispatcher;
  private final AtomicLong offset = new AtomicLong(0);

  private volatile LoopState state = LoopState.NEW;
  private volatile Thread loopThread;
  private int consecutiveFailures;

  @Autowired
  public TelegramPollingRunner(
      TelegramBotClient bot,
      ConversationEngine engine,
      BotTexts texts,
      PollingProperties properties) {
    this(
        bot,
        engine,
        texts,
        properties,
        new PerUserDispatcher(
            Executors.newFixedThreadPool(properties.workers(), workerThreads())));
  }

  TelegramPollingRunner(
      TelegramBotClient bot,
      ConversationEngine engine,
      BotTexts texts,
      PollingProperties properties,
      PerUserDispatcher dispatcher) {
    this.bot = bot;
    this.engine = engine;
    this.texts = texts;
    this.properties = properties;
    this.dispatcher = dispatcher;
  }

  @Override
  public void start() {
    state = LoopState.RUNNING;
    Thread thread = new Thread(this::run, "telegram-polling");
    thread.setDaemon(false);
    loopThread = thread;
    thread.start();
  }

  @Override
  public void stop() {
    if (state == LoopState.TERMINATED) {
      return;
    }
    log.info("Stopping Telegram polling, waiting up to {} for workers", properties.shutdownGrace());
    state = LoopState.SHUTTING_DOWN;
    Thread thread = loopThread;
    if (thread != null) {
      thread.interrupt();
      try {
        thread.join(properties.shutdownGrace().toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    terminate();
  }

  @Override
  public boolean isRunning() {
    return state == LoopState.RUNNING;
  }

  public LoopState state() {
    return state;
  }

  long offset() {
    return offset.get();
  }

  void run() {
    prepare();
    log.info("Telegram polling started (timeout={}s)", properties.timeoutSeconds());
    while (state == LoopState.RUNNING) {
      PollOutcome outcome;
      try {
        outcome = pollOnce();
      } catch (RuntimeException e) {
        log.error("Unexpected error in polling loop", e);
        outcome = PollOutcome.retryAfter(properties.errorPause());
      }
      if (outcome.fatal()) {
        break;
      }
      if (!outcome.pause().isZero() && !pause(outcome.pause())) {
        break;
      }
    }
    if (state == LoopState.RUNNING) {
      // fatal stop (bad token): nobody else will drain the workers
      terminate();
    }
  }

  /** Снимает webhook и регистрирует команды; ошибки только логируются. */
  void prepare() {
    ApiResult webhook = bot.deleteWebhook(true);
    if (!webhook.ok()) {
      log.warn("deleteWebhook failed: {}", webhook.description());
    }
    var lang = texts.defaultLanguage();
    ApiResult commands =
        bot.setMyCommands(
            List.of(
                new BotCommand("start", texts.text("command-start", lang)),
                new BotCommand("menu", texts.text("command-menu", lang)),
                new BotCommand("admin", texts.text("command-admin", lang))));
    if (commands.ok()) {
      log.info("Bot commands registered");
    } else {
      log.warn("Bot commands were not registered: {}", commands.description());
    }
  }

  PollOutcome pollOnce() {
    ApiResult result = bot.getUpdates(offset.get(), properties.timeoutSeconds());
    if (result.ok()) {
      consecutiveFailures = 0;
      dispatch(result.result());
      return PollOutcome.proceed();
    }

    if (result.hasErrorCode(UNAUTHORIZED)) {
      log.error("Bot token rejected (401), polling stops: {}", result.description());
      return PollOutcome.stop();
    }
    if (result.hasErrorCode(CONFLICT)) {
      log.warn("getUpdates conflict (409), removing webhook: {}", result.description());
      bot.deleteWebhook(true);
      return PollOutcome.retryAfter(properties.errorPause());
    }
    if (result.isTransient()) {
      consecutiveFailures++;
      Duration wait = properties.backoffStep().multipliedBy(consecutiveFailures);
      if (wait.compareTo(properties.maxBackoff()) > 0) {
        wait = properties.maxBackoff();
      }
      log.warn(
          "getUpdates failed ({}), retry #{} in {}", result.failure(), consecutiveFailures, wait);
      return PollOutcome.retryAfter(wait);
    }

    log.error("getUpdates failed: {} (code={})", result.description(), result.errorCode());
    return PollOutcome.retryAfter(properties.errorPause());
  }

  private void dispatch(JsonNode updates) {
    if (updates == null || !updates.isArray()) {
      return;
    }
    for (JsonNode update : updates) {
      JsonNode id = update.path("update_id");
      if (id.isIntegralNumber()) {
        long next = id.asLong() + 1;
        offset.accumulateAndGet(next, Math::max);
      }
      dispatcher.submit(UpdateKeys.userKey(update), () -> handle(update));
    }
  }

  void handle(JsonNode update) {
    JsonNode callback = update.path("callback_query");
    if (!callback.isMissingNode() && !callback.isNull()) {
      if (callback.path("message").isMissingNode()) {
        return;
      }
      engine.onCallback(CallbackAction.from(callback));
      return;
    }

    JsonNode message = update.path("message");
    if (message.isMissingNode() || message.isNull()) {
      return;
    }
    engine.onMessage(IncomingMessage.from(message));
  }

  private synchronized void terminate() {
    if (state == LoopState.TERMINATED) {
      return;
    }
    if (!dispatcher.shutdown(properties.shutdownGrace())) {
      log.warn("Some updates were still being processed when the grace period ended");
    }
    state = LoopState.TERMINATED;
    log.info("Telegram polling stopped");
  }

  private boolean pause(Duration d) {
    try {
      Thread.sleep(d.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static ThreadFactory workerThreads() {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "update-worker-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
