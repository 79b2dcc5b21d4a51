package com.hrintake.telegram.client;

import com.hrintake.telegram.model.Attachment;
import com.hrintake.telegram.model.BotCommand;
import com.hrintake.telegram.model.ReplyMarkup;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class TelegramBotClient {

  private static final String HTML = "HTML";

  private final TelegramApiClient api;

  public ApiResult sendMessage(String chatId, String text) {
    return sendMessage(chatId, text, null);
  }

  public ApiResult sendMessage(String chatId, String text, ReplyMarkup markup) {
    Map<String, Object> body = new HashMap<>();
    body.put("chat_id", chatId);
    body.put("text", text);
    body.put("parse_mode", HTML);
    if (markup != null) {
      body.put("reply_markup", markup.toPayload());
    }
    ApiResult result = api.call("sendMessage", body);
    if (!result.ok()) {
      log.error("Failed to send message to chatId={}: {}", chatId, result.description());
    }
    return result;
  }

  /** Sends a document or photo with an HTML caption. */
  public ApiResult sendAttachment(
      String chatId, Attachment attachment, String caption, ReplyMarkup markup) {
    Map<String, Object> body = new HashMap<>();
    body.put("chat_id", chatId);
    body.put(attachment.kind().paramName(), attachment.fileId());
    if (caption != null) {
      body.put("caption", caption);
      body.put("parse_mode", HTML);
    }
    if (markup != null) {
      body.put("reply_markup", markup.toPayload());
    }
    ApiResult result = api.call(attachment.kind().sendMethod(), body);
    if (!result.ok()) {
      log.error(
          "Failed to {} to chatId={}: {}",
          attachment.kind().sendMethod(),
          chatId,
          result.description());
    }
    return result;
  }

  public ApiResult editMessageText(
      String chatId, String messageId, String text, ReplyMarkup markup) {
    if (messageId == null || messageId.isBlank()) {
      return ApiResult.failure(FailureKind.UNEXPECTED, "No message to edit");
    }
    Map<String, Object> body = new HashMap<>();
    body.put("chat_id", chatId);
    body.put("message_id", messageId);
    body.put("text", text);
    body.put("parse_mode", HTML);
    if (markup != null) {
      body.put("reply_markup", markup.toPayload());
    }
    ApiResult result = api.call("editMessageText", body);
    if (!result.ok()) {
      log.warn("Failed to edit message {} in chatId={}: {}", messageId, chatId, result.description());
    }
    return result;
  }

  public void deleteMessage(String chatId, String messageId) {
    if (messageId == null || messageId.isBlank()) {
      return;
    }
    ApiResult result = api.call("deleteMessage", Map.of("chat_id", chatId, "message_id", messageId));
    if (!result.ok()) {
      log.warn("Failed to delete message {} in chatId={}: {}", messageId, chatId, result.description());
    }
  }

  public void answerCallbackQuery(String callbackQueryId) {
    if (callbackQueryId == null || callbackQueryId.isBlank()) {
      return;
    }
    ApiResult result = api.call("answerCallbackQuery", Map.of("callback_query_id", callbackQueryId));
    if (!result.ok()) {
      log.warn("Failed to answer callback query: {}", result.description());
    }
  }

  public ApiResult getUpdates(long offset, int timeoutSeconds) {
    return api.call(
        TelegramApiClient.GET_UPDATES,
        Map.of(
            "offset", offset,
            "timeout", timeoutSeconds,
            "allowed_updates", List.of("message", "callback_query")));
  }

  public ApiResult deleteWebhook(boolean dropPendingUpdates) {
    return api.call("deleteWebhook", Map.of("drop_pending_updates", dropPendingUpdates));
  }

  public ApiResult setMyCommands(List<BotCommand> commands) {
    List<Map<String, String>> payload =
        commands.stream()
            .map(c -> Map.of("command", c.command(), "description", c.description()))
            .toList();
    return api.call("setMyCommands", Map.of("commands", payload));
  }
}
