package com.hrintake.telegram.conversation;

import static com.hrintake.telegram.render.Html.escape;

import com.hrintake.telegram.admin.AdminConsole;
import com.hrintake.telegram.client.TelegramBotClient;
import com.hrintake.telegram.config.BotProperties;
import com.hrintake.telegram.i18n.ActionCatalog;
import com.hrintake.telegram.i18n.BotTexts;
import com.hrintake.telegram.i18n.Language;
import com.hrintake.telegram.i18n.MenuAction;
import com.hrintake.telegram.model.Attachment;
import com.hrintake.telegram.model.CallbackAction;
import com.hrintake.telegram.model.IncomingMessage;
import com.hrintake.telegram.model.KeyboardRemove;
import com.hrintake.telegram.render.Keyboards;
import com.hrintake.telegram.session.Session;
import com.hrintake.telegram.session.SessionStore;
import com.hrintake.telegram.session.Step;
import com.hrintake.telegram.store.ApplicationDraft;
import com.hrintake.telegram.store.ApplicationStore;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Per-user state machine behind the bot.
 *
 * <p>Idle users navigate the main menu. "Job vacancies" starts the application form (name, phone,
 * position category, position detail, experience, resume). The reviewer chat additionally gets
 * the admin console. Commands that restart the conversation win over everything else.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConversationEngine {

  private static final Set<String> RESTART_COMMANDS = Set.of("/start", "/menu", "Menu");
  private static final String ADMIN_COMMAND = "/admin";
  private static final String DETAILS_COMMAND = "/a ";
  private static final String SKIP_COMMAND = "/skip";

  private final SessionStore sessions;
  private final ApplicationStore applications;
  private final ReviewerNotifier notifier;
  private final AdminConsole admin;
  private final TelegramBotClient bot;
  private final BotTexts texts;
  private final ActionCatalog actions;
  private final Keyboards keyboards;
  private final BotProperties properties;

  public void onMessage(IncomingMessage message) {
    String chatId = message.chatId();
    String userId = message.userId();
    String text = message.text().trim();

    Language lang = sessions.getLanguage(userId);
    Session session = sessions.getState(userId).orElse(null);
    MenuAction action = actions.resolve(text, lang).orElse(null);

    if (RESTART_COMMANDS.contains(text)) {
      sessions.clearState(userId);
      sendWelcome(chatId, lang);
      return;
    }

    if (action == MenuAction.CHANGE_LANGUAGE) {
      bot.sendMessage(chatId, texts.text("select-lang", lang), keyboards.languageMenu(lang));
      return;
    }
    if (action != null && action.targetLanguage().isPresent()) {
      switchLanguage(chatId, userId, session, action.targetLanguage().get());
      return;
    }

    if (properties.isReviewer(chatId) && handleAdmin(chatId, userId, text, action, session, lang)) {
      return;
    }

    if (session != null && session.isAdmin()) {
      // admin state outside the reviewer chat is stale; drop it
      log.warn("Clearing admin state of user {} outside the reviewer chat", userId);
      sessions.clearState(userId);
      sendWelcome(chatId, lang);
      return;
    }

    if (action == MenuAction.BACK) {
      bot.sendMessage(chatId, texts.text("menu-title", lang), keyboards.mainMenu(lang, chatId));
      return;
    }

    if (session == null) {
      handleIdle(chatId, userId, action, lang);
      return;
    }

    if (action == MenuAction.CANCEL) {
      sessions.clearState(userId);
      bot.sendMessage(chatId, texts.text("canceled", lang), keyboards.mainMenu(lang, chatId));
      return;
    }

    handleFormStep(message, text, action, session, lang);
  }

  /** Inline button presses. Only the reviewer chat has any (application page navigation). */
  public void onCallback(CallbackAction callback) {
    if (!properties.isReviewer(callback.chatId())) {
      log.warn("Ignoring callback from non-reviewer chatId={}", callback.chatId());
      bot.answerCallbackQuery(callback.callbackId());
      return;
    }
    admin.onCallback(callback, sessions.getLanguage(callback.userId()));
  }

  private void sendWelcome(String chatId, Language lang) {
    bot.sendMessage(chatId, texts.text("welcome", lang), keyboards.mainMenu(lang, chatId));
  }

  private void switchLanguage(String chatId, String userId, Session session, Language next) {
    sessions.setLanguage(userId, next);
    String changed = texts.text("lang-changed", next);
    if (session == null) {
      bot.sendMessage(chatId, changed, keyboards.mainMenu(next, chatId));
    } else if (session.isAdmin()) {
      bot.sendMessage(chatId, changed, keyboards.adminMenu(next));
    } else {
      bot.sendMessage(chatId, changed);
      prompt(chatId, session, next);
    }
  }

  private void handleIdle(String chatId, String userId, MenuAction action, Language lang) {
    if (action == MenuAction.ABOUT) {
      bot.sendMessage(chatId, texts.text("about", lang), keyboards.mainMenu(lang, chatId));
    } else if (action == MenuAction.CONTACT) {
      bot.sendMessage(chatId, texts.text("contact", lang), keyboards.mainMenu(lang, chatId));
    } else if (action == MenuAction.LOCATION) {
      bot.sendMessage(chatId, texts.text("location", lang), keyboards.mainMenu(lang, chatId));
    } else if (action == MenuAction.JOBS) {
      Session started = Session.startJob(userId);
      sessions.setState(userId, started);
      prompt(chatId, started, lang);
    } else {
      bot.sendMessage(chatId, texts.text("choose-menu", lang), keyboards.mainMenu(lang, chatId));
    }
  }

  /**
   * Admin console routing for the reviewer chat.
   *
   * @return false when the input is not admin business and should go through the normal flow
   */
  private boolean handleAdmin(
      String chatId,
      String userId,
      String text,
      MenuAction action,
      Session session,
      Language lang) {
    if (action == MenuAction.ADMIN || text.startsWith(ADMIN_COMMAND)) {
      sessions.setState(userId, Session.admin(userId, Step.MENU));
      admin.showPanel(chatId, lang);
      return true;
    }

    boolean inAdmin = session != null && session.isAdmin();
    boolean entering =
        (action != null && action.isAdminSubMenu()) || text.startsWith(DETAILS_COMMAND);
    if (!inAdmin && !entering) {
      return false;
    }
    if (!inAdmin) {
      session = Session.admin(userId, Step.MENU);
      sessions.setState(userId, session);
    }

    if (action == MenuAction.BACK) {
      sessions.clearState(userId);
      sendWelcome(chatId, lang);
    } else if (action == MenuAction.ADMIN_APPS) {
      sessions.setState(userId, session.withStep(Step.MENU));
      admin.showRecent(chatId, 0, lang);
    } else if (action == MenuAction.ADMIN_SEARCH) {
      sessions.setState(userId, session.withStep(Step.SEARCH_POSITION));
      admin.askSearchQuery(chatId, lang);
    } else if (action == MenuAction.ADMIN_STATS) {
      sessions.setState(userId, session.withStep(Step.MENU));
      admin.showStats(chatId, lang);
    } else if (text.startsWith(DETAILS_COMMAND)) {
      admin.showApplication(chatId, text.substring(DETAILS_COMMAND.length()).trim(), lang);
    } else if (session.step() == Step.SEARCH_POSITION) {
      sessions.setState(userId, session.withStep(Step.MENU));
      admin.showSearchResults(chatId, text, lang);
    } else {
      admin.showPanel(chatId, lang);
    }
    return true;
  }

  private void handleFormStep(
      IncomingMessage message, String text, MenuAction action, Session session, Language lang) {
    String chatId = message.chatId();
    String userId = message.userId();

    switch (session.step()) {
      case NAME -> {
        if (IntakeValidators.isValidName(text)) {
          advance(chatId, session.advance(Session.NAME, text, Step.PHONE), lang);
        } else {
          String cancel = actions.label(MenuAction.CANCEL, lang);
          bot.sendMessage(
              chatId,
              texts.text("invalid-name", lang)
                  + "\n\n"
                  + texts.format("invalid-name-hint", lang, escape(cancel)));
        }
      }
      case PHONE -> {
        String phone =
            message.hasContact()
                ? message.contactPhone()
                : IntakeValidators.isValidPhone(text) ? text : null;
        if (phone != null) {
          advance(chatId, session.advance(Session.PHONE, phone, Step.POSITION), lang);
        } else {
          bot.sendMessage(
              chatId, texts.text("invalid-phone", lang), keyboards.contactRequest(lang));
        }
      }
      case POSITION -> {
        if (!text.isEmpty()) {
          advance(chatId, session.advance(Session.CATEGORY, text, Step.POSITION_MANUAL), lang);
        } else {
          prompt(chatId, session, lang);
        }
      }
      case POSITION_MANUAL -> {
        if (IntakeValidators.isValidPositionDetail(text)) {
          String category = session.field(Session.CATEGORY);
          String position =
              IntakeValidators.composePosition(
                  actions.stripCategoryIcon(category), text, actions.isOtherPosition(category));
          advance(chatId, session.advance(Session.POSITION, position, Step.EXP), lang);
        } else {
          bot.sendMessage(
              chatId, texts.text("ask-position-manual", lang), keyboards.cancelOnly(lang));
        }
      }
      case EXP -> {
        if (IntakeValidators.isValidExperience(text)) {
          advance(chatId, session.advance(Session.EXPERIENCE, text, Step.CV), lang);
        } else {
          bot.sendMessage(chatId, texts.text("invalid-exp", lang), keyboards.cancelOnly(lang));
        }
      }
      case CV -> {
        Attachment attachment = message.attachment();
        if (attachment == null && action != MenuAction.SKIP && !SKIP_COMMAND.equals(text)) {
          bot.sendMessage(chatId, texts.text("invalid-cv", lang), keyboards.skipOrCancel(lang));
          return;
        }
        submit(chatId, userId, session, attachment, lang);
      }
      default -> {
        log.warn("User {} is in unexpected step {}; resetting", userId, session.step());
        sessions.clearState(userId);
        sendWelcome(chatId, lang);
      }
    }
  }

  private void advance(String chatId, Session next, Language lang) {
    sessions.setState(next.userId(), next);
    prompt(chatId, next, lang);
  }

  /** Question (and keyboard) of the step the session is in. */
  private void prompt(String chatId, Session session, Language lang) {
    switch (session.step()) {
      case NAME -> bot.sendMessage(chatId, texts.text("ask-name", lang), KeyboardRemove.INSTANCE);
      case PHONE ->
          bot.sendMessage(chatId, texts.text("ask-phone", lang), keyboards.contactRequest(lang));
      case POSITION ->
          bot.sendMessage(chatId, texts.text("ask-position", lang), keyboards.positions(lang));
      case POSITION_MANUAL -> {
        String category = Optional.ofNullable(session.field(Session.CATEGORY)).orElse("");
        bot.sendMessage(
            chatId,
            texts.format("position-chosen", lang, escape(category)),
            keyboards.cancelOnly(lang));
      }
      case EXP -> bot.sendMessage(chatId, texts.text("ask-exp", lang), keyboards.cancelOnly(lang));
      case CV -> bot.sendMessage(chatId, texts.text("ask-cv", lang), keyboards.skipOrCancel(lang));
      default -> bot.sendMessage(chatId, texts.text("admin-panel", lang), keyboards.adminMenu(lang));
    }
  }

  /**
   * Saves the application and notifies the reviewer; the two are independent. The user is
   * acknowledged when at least one of them worked, otherwise the resume step stays open.
   */
  private void submit(
      String chatId, String userId, Session session, Attachment attachment, Language lang) {
    ApplicationDraft draft =
        new ApplicationDraft(
            userId,
            session.field(Session.NAME),
            session.field(Session.PHONE),
            session.field(Session.POSITION),
            session.field(Session.EXPERIENCE),
            attachment);

    Optional<String> id = applications.save(draft);
    if (id.isEmpty()) {
      log.error("Application of user {} was not saved to the document store", userId);
    }
    boolean notified = notifier.notify(draft, id.orElse(null));

    if (id.isPresent() || notified) {
      sessions.clearState(userId);
      bot.sendMessage(chatId, texts.text("applied", lang), keyboards.mainMenu(lang, chatId));
      log.info(
          "Application of user {} accepted (id={}, reviewerNotified={})",
          userId,
          id.orElse(null),
          notified);
    } else {
      log.error("Application of user {} was neither saved nor delivered", userId);
      bot.sendMessage(chatId, texts.text("submit-failed", lang), keyboards.skipOrCancel(lang));
    }
  }
}
