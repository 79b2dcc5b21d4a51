package com.hrintake.telegram.conversation;

import com.hrintake.telegram.client.ApiResult;
import com.hrintake.telegram.client.TelegramBotClient;
import com.hrintake.telegram.config.BotProperties;
import com.hrintake.telegram.render.ApplicationFormatter;
import com.hrintake.telegram.store.ApplicationDraft;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Sends a completed application to the HR chat, with the resume attached when there is one. */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReviewerNotifier {

  private static final int CAPTION_LIMIT = 1024;

  private final TelegramBotClient bot;
  private final BotProperties properties;
  private final ApplicationFormatter formatter;

  /**
   * @param applicationId id in the document store, or null when the application was not saved
   * @return whether the reviewer chat received the application
   */
  public boolean notify(ApplicationDraft draft, String applicationId) {
    String chatId = properties.reviewerChatId();
    String report = formatter.reviewerReport(draft, applicationId);

    ApiResult result;
    if (draft.attachment() == null) {
      result = bot.sendMessage(chatId, report);
    } else if (report.length() <= CAPTION_LIMIT) {
      result = bot.sendAttachment(chatId, draft.attachment(), report, null);
    } else {
      result = bot.sendMessage(chatId, report);
      if (result.ok()) {
        result = bot.sendAttachment(chatId, draft.attachment(), null, null);
      }
    }

    if (!result.ok()) {
      log.error(
          "Failed to notify reviewer about application of user {} (id={}): {}",
          draft.userId(),
          applicationId,
          result.description());
    }
    return result.ok();
  }
}
