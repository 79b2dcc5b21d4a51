package com.hrintake.telegram.admin;

import static com.hrintake.telegram.render.Html.bold;
import static com.hrintake.telegram.render.Html.escape;

import com.hrintake.telegram.client.ApiResult;
import com.hrintake.telegram.client.TelegramBotClient;
import com.hrintake.telegram.config.AdminProperties;
import com.hrintake.telegram.i18n.ActionCatalog;
import com.hrintake.telegram.i18n.BotTexts;
import com.hrintake.telegram.i18n.Language;
import com.hrintake.telegram.i18n.MenuAction;
import com.hrintake.telegram.model.CallbackAction;
import com.hrintake.telegram.model.InlineKeyboard;
import com.hrintake.telegram.model.ReplyMarkup;
import com.hrintake.telegram.render.ApplicationFormatter;
import com.hrintake.telegram.render.Keyboards;
import com.hrintake.telegram.render.MessageChunker;
import com.hrintake.telegram.store.StoredApplication;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Renders the reviewer's admin console: application pages, search, stats and detail cards. */
@Service
@Slf4j
@RequiredArgsConstructor
public class AdminConsole {

  public static final String PAGE_CALLBACK_PREFIX = "page_";

  // Telegram rejects media captions above this length
  private static final int CAPTION_LIMIT = 1024;

  private final AdminQueryService queries;
  private final TelegramBotClient bot;
  private final BotTexts texts;
  private final ActionCatalog actions;
  private final Keyboards keyboards;
  private final ApplicationFormatter formatter;
  private final AdminProperties properties;

  public void showPanel(String chatId, Language lang) {
    bot.sendMessage(chatId, texts.text("admin-panel", lang), keyboards.adminMenu(lang));
  }

  public void askSearchQuery(String chatId, Language lang) {
    bot.sendMessage(chatId, texts.text("admin-search-ask", lang), keyboards.adminMenu(lang));
  }

  public void showRecent(String chatId, int offset, Language lang) {
    int limit = properties.pageSize();
    AdminResult<RecentPage> result = queries.listRecent(limit, offset);
    if (!result.storeAvailable()) {
      sendStoreUnavailable(chatId, lang);
      return;
    }

    RecentPage page = result.value();
    if (page.items().isEmpty()) {
      bot.sendMessage(chatId, texts.text("admin-no-apps", lang), keyboards.adminMenu(lang));
      return;
    }

    if (page.offset() == 0) {
      bot.sendMessage(
          chatId, bold(actions.label(MenuAction.ADMIN_APPS, lang)), keyboards.adminMenu(lang));
    }
    int index = page.offset() + 1;
    for (StoredApplication app : page.items()) {
      sendApplication(chatId, app, formatter.listEntry(app, index++), null);
    }

    List<InlineKeyboard.Button> nav = new ArrayList<>();
    if (page.hasPrevious()) {
      nav.add(
          new InlineKeyboard.Button(
              texts.text("nav-prev", lang), PAGE_CALLBACK_PREFIX + page.previousOffset()));
    }
    if (page.hasMore()) {
      nav.add(
          new InlineKeyboard.Button(
              texts.text("nav-next", lang), PAGE_CALLBACK_PREFIX + page.nextOffset()));
    }
    if (!nav.isEmpty()) {
      bot.sendMessage(
          chatId,
          texts.format("nav-page", lang, page.pageNumber()),
          InlineKeyboard.singleRow(nav));
    }
  }

  /** Handles a press on a page navigation button. Unknown callback data is only acknowledged. */
  public void onCallback(CallbackAction callback, Language lang) {
    bot.answerCallbackQuery(callback.callbackId());
    Optional<Integer> offset = pageOffset(callback.data());
    if (offset.isEmpty()) {
      log.warn("Ignoring callback data '{}' from chatId={}", callback.data(), callback.chatId());
      return;
    }
    bot.deleteMessage(callback.chatId(), callback.messageId());
    showRecent(callback.chatId(), offset.get(), lang);
  }

  public void showSearchResults(String chatId, String query, Language lang) {
    AdminResult<List<StoredApplication>> result =
        queries.searchByPosition(query, properties.searchLimit(), properties.searchScanLimit());
    if (!result.storeAvailable()) {
      sendStoreUnavailable(chatId, lang);
      return;
    }
    if (result.value().isEmpty()) {
      bot.sendMessage(chatId, texts.text("admin-no-results", lang), keyboards.adminMenu(lang));
      return;
    }

    String title = actions.label(MenuAction.ADMIN_SEARCH, lang) + ": " + escape(query.trim());
    bot.sendMessage(chatId, bold(title), keyboards.adminMenu(lang));
    int index = 1;
    for (StoredApplication app : result.value()) {
      sendApplication(chatId, app, formatter.listEntry(app, index++), null);
    }
  }

  public void showStats(String chatId, Language lang) {
    if (!queries.isStoreAvailable()) {
      sendStoreUnavailable(chatId, lang);
      return;
    }
    ApiResult wait = bot.sendMessage(chatId, texts.text("stats-wait", lang));

    AdminResult<PositionStats> result =
        queries.positionStats(properties.statsDays(), properties.statsLimit());
    if (!result.storeAvailable()) {
      sendStoreUnavailable(chatId, lang);
      return;
    }

    PositionStats stats = result.value();
    if (stats.total() == 0) {
      replaceOrSend(chatId, wait.messageId(), texts.text("stats-no-data", lang), lang);
      return;
    }

    List<String> chunks =
        MessageChunker.split(formatter.statsReport(stats, lang), properties.chunkSize());
    replaceOrSend(chatId, wait.messageId(), chunks.get(0), lang);
    for (String chunk : chunks.subList(1, chunks.size())) {
      bot.sendMessage(chatId, chunk, keyboards.adminMenu(lang));
    }
  }

  public void showApplication(String chatId, String id, Language lang) {
    AdminResult<Optional<StoredApplication>> result = queries.getApplication(id);
    if (!result.storeAvailable()) {
      sendStoreUnavailable(chatId, lang);
      return;
    }
    if (result.value().isEmpty()) {
      bot.sendMessage(chatId, texts.text("admin-no-results", lang), keyboards.adminMenu(lang));
      return;
    }
    StoredApplication app = result.value().get();
    sendApplication(chatId, app, formatter.detailCard(app, lang), keyboards.adminMenu(lang));
  }

  static Optional<Integer> pageOffset(String data) {
    if (data == null || !data.startsWith(PAGE_CALLBACK_PREFIX)) {
      return Optional.empty();
    }
    try {
      int offset = Integer.parseInt(data.substring(PAGE_CALLBACK_PREFIX.length()).trim());
      return offset < 0 ? Optional.empty() : Optional.of(offset);
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  private void sendApplication(
      String chatId, StoredApplication app, String text, ReplyMarkup markup) {
    if (app.attachment() == null) {
      bot.sendMessage(chatId, text, markup);
      return;
    }
    if (text.length() <= CAPTION_LIMIT) {
      bot.sendAttachment(chatId, app.attachment(), text, markup);
      return;
    }
    bot.sendAttachment(chatId, app.attachment(), null, null);
    bot.sendMessage(chatId, text, markup);
  }

  // the wait notice is edited in place; if that fails the text goes out as a new message
  private void replaceOrSend(String chatId, String waitMessageId, String text, Language lang) {
    if (waitMessageId != null && bot.editMessageText(chatId, waitMessageId, text, null).ok()) {
      return;
    }
    bot.sendMessage(chatId, text, keyboards.adminMenu(lang));
  }

  private void sendStoreUnavailable(String chatId, Language lang) {
    bot.sendMessage(
        chatId, texts.text("admin-store-unavailable", lang), keyboards.adminMenu(lang));
  }
}
