package com.hrintake.telegram.conversation;

import static com.hrintake.telegram.Fixtures.REVIEWER_CHAT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.hrintake.telegram.Fixtures;
import com.hrintake.telegram.admin.AdminConsole;
import com.hrintake.telegram.client.TelegramBotClient;
import com.hrintake.telegram.config.SessionCacheProperties;
import com.hrintake.telegram.i18n.ActionCatalog;
import com.hrintake.telegram.i18n.BotTexts;
import com.hrintake.telegram.i18n.Language;
import com.hrintake.telegram.i18n.MenuAction;
import com.hrintake.telegram.model.Attachment;
import com.hrintake.telegram.model.AttachmentKind;
import com.hrintake.telegram.model.CallbackAction;
import com.hrintake.telegram.model.IncomingMessage;
import com.hrintake.telegram.model.KeyboardRemove;
import com.hrintake.telegram.render.Keyboards;
import com.hrintake.telegram.session.CachingSessionStore;
import com.hrintake.telegram.session.ConversationMode;
import com.hrintake.telegram.session.Session;
import com.hrintake.telegram.session.SessionMirror;
import com.hrintake.telegram.session.Step;
import com.hrintake.telegram.store.ApplicationDraft;
import com.hrintake.telegram.store.ApplicationStore;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConversationEngineTest {

  private static final String USER = "100";
  private static final String ADMIN_USER = "42";

  // unavailable by default: sessions stay in memory
  @Mock private SessionMirror mirror;
  @Mock private ApplicationStore applications;
  @Mock private ReviewerNotifier notifier;
  @Mock private AdminConsole admin;
  @Mock private TelegramBotClient bot;

  private BotTexts texts;
  private ActionCatalog actions;
  private Keyboards keyboards;
  private CachingSessionStore sessions;
  private ConversationEngine engine;

  @BeforeEach
  void setUp() {
    texts = Fixtures.texts();
    actions = Fixtures.catalog(texts);
    keyboards = new Keyboards(actions, texts, Fixtures.botProperties());
    sessions =
        new CachingSessionStore(mirror, texts, new SessionCacheProperties(1000, Duration.ofDays(1)));
    engine =
        new ConversationEngine(
            sessions,
            applications,
            notifier,
            admin,
            bot,
            texts,
            actions,
            keyboards,
            Fixtures.botProperties());
  }

  @Test
  void completeApplicationIsSavedAndDelivered() {
    sessions.setLanguage(USER, Language.EN);
    Attachment cv = new Attachment("file-1", AttachmentKind.DOCUMENT);
    ApplicationDraft expected =
        new ApplicationDraft(
            USER, "Ali Valiyev", "+998901234567", "Teacher (Math)", "5 years at school", cv);
    when(applications.save(expected)).thenReturn(Optional.of("65f1c0ffee"));
    when(notifier.notify(expected, "65f1c0ffee")).thenReturn(true);

    send("💼 Job vacancies");
    verify(bot).sendMessage(USER, texts.text("ask-name", Language.EN), KeyboardRemove.INSTANCE);
    send("Ali Valiyev");
    verify(bot)
        .sendMessage(USER, texts.text("ask-phone", Language.EN), keyboards.contactRequest(Language.EN));
    engine.onMessage(new IncomingMessage(USER, USER, "3", "", "+998901234567", null));
    verify(bot)
        .sendMessage(USER, texts.text("ask-position", Language.EN), keyboards.positions(Language.EN));
    send("👨‍🏫 Teacher");
    verify(bot)
        .sendMessage(
            USER,
            texts.format("position-chosen", Language.EN, "👨‍🏫 Teacher"),
            keyboards.cancelOnly(Language.EN));
    send("Math");
    send("5 years at school");
    assertThat(step()).isEqualTo(Step.CV);
    engine.onMessage(new IncomingMessage(USER, USER, "7", "", null, cv));

    verify(applications).save(expected);
    verify(notifier).notify(expected, "65f1c0ffee");
    verify(bot)
        .sendMessage(USER, texts.text("applied", Language.EN), keyboards.mainMenu(Language.EN, USER));
    assertThat(sessions.getState(USER)).isEmpty();
  }

  @Test
  void skippingTheResumeSubmitsWithoutAttachment() {
    sessions.setLanguage(USER, Language.EN);
    sessions.setState(USER, atStep(Step.CV));
    when(applications.save(any())).thenReturn(Optional.of("id-1"));
    when(notifier.notify(any(), anyString())).thenReturn(true);

    send("Skip");

    verify(applications)
        .save(
            new ApplicationDraft(
                USER, "Ali Valiyev", "+998901234567", "Teacher (Math)", "5 years at school", null));
  }

  @Test
  void otherPositionKeepsOnlyTheTypedDetail() {
    sessions.setLanguage(USER, Language.EN);
    sessions.setState(
        USER,
        new Session(
            USER,
            ConversationMode.JOB,
            Step.POSITION_MANUAL,
            Map.of(Session.NAME, "Ali Valiyev", Session.CATEGORY, "💡 Other position")));

    send("Bus driver");

    assertThat(sessions.getState(USER).orElseThrow().field(Session.POSITION))
        .isEqualTo("Bus driver");
  }

  @Test
  void typedCategoryKeepsAllItsWords() {
    sessions.setState(
        USER,
        new Session(
            USER,
            ConversationMode.JOB,
            Step.POSITION_MANUAL,
            Map.of(Session.NAME, "Ali Valiyev", Session.CATEGORY, "Senior Developer")));

    send("backend");

    assertThat(sessions.getState(USER).orElseThrow().field(Session.POSITION))
        .isEqualTo("Senior Developer (backend)");
  }

  @Test
  void invalidNameKeepsStepAndShowsCancelHint() {
    sessions.setLanguage(USER, Language.EN);
    sessions.setState(USER, Session.startJob(USER));

    send("Ali");

    assertThat(step()).isEqualTo(Step.NAME);
    assertThat(sessions.getState(USER).orElseThrow().formData()).isEmpty();
    verify(bot)
        .sendMessage(
            USER,
            texts.text("invalid-name", Language.EN)
                + "\n\n"
                + texts.format("invalid-name-hint", Language.EN, "❌ Cancel"));
  }

  @Test
  void invalidPhoneAsksAgainWithContactButton() {
    sessions.setLanguage(USER, Language.EN);
    Session before = Session.startJob(USER).advance(Session.NAME, "Ali Valiyev", Step.PHONE);
    sessions.setState(USER, before);

    send("call me");

    assertThat(sessions.getState(USER)).contains(before);
    verify(bot)
        .sendMessage(
            USER, texts.text("invalid-phone", Language.EN), keyboards.contactRequest(Language.EN));
  }

  @Test
  void typedPhoneIsAccepted() {
    sessions.setState(USER, Session.startJob(USER).advance(Session.NAME, "Ali Valiyev", Step.PHONE));

    send("+998 90 123-45-67");

    assertThat(sessions.getState(USER).orElseThrow().field(Session.PHONE))
        .isEqualTo("+998 90 123-45-67");
    assertThat(step()).isEqualTo(Step.POSITION);
  }

  @Test
  void shortExperienceIsRejected() {
    sessions.setState(USER, atStep(Step.EXP));

    send("none");

    assertThat(sessions.getState(USER)).contains(atStep(Step.EXP));
    verify(bot)
        .sendMessage(USER, texts.text("invalid-exp", Language.UZ), keyboards.cancelOnly(Language.UZ));
  }

  @Test
  void textInsteadOfResumeIsRejected() {
    sessions.setState(USER, atStep(Step.CV));

    send("here is my cv");

    assertThat(sessions.getState(USER)).contains(atStep(Step.CV));
    verifyNoInteractions(applications, notifier);
  }

  @Test
  void tooShortPositionDetailIsRejected() {
    Session before =
        Session.startJob(USER)
            .advance(Session.NAME, "Ali Valiyev", Step.PHONE)
            .advance(Session.PHONE, "+998901234567", Step.POSITION)
            .advance(Session.CATEGORY, "👨‍🏫 Teacher", Step.POSITION_MANUAL);
    sessions.setState(USER, before);

    send("ab");

    assertThat(sessions.getState(USER)).contains(before);
    verify(bot)
        .sendMessage(
            USER, texts.text("ask-position-manual", Language.UZ), keyboards.cancelOnly(Language.UZ));
  }

  @Test
  void cancelClearsTheForm() {
    sessions.setLanguage(USER, Language.RU);
    sessions.setState(USER, atStep(Step.EXP));

    send("❌ Отмена");

    assertThat(sessions.getState(USER)).isEmpty();
    verify(bot)
        .sendMessage(USER, texts.text("canceled", Language.RU), keyboards.mainMenu(Language.RU, USER));
  }

  @ParameterizedTest
  @EnumSource(
      value = Step.class,
      names = {"NAME", "PHONE", "POSITION", "POSITION_MANUAL", "EXP", "CV"})
  void cancelFromAnyFormStepStartsOver(Step step) {
    sessions.setLanguage(USER, Language.EN);
    sessions.setState(USER, atStep(step));

    send("❌ Cancel");

    assertThat(sessions.getState(USER)).isEmpty();
    verify(bot)
        .sendMessage(USER, texts.text("canceled", Language.EN), keyboards.mainMenu(Language.EN, USER));

    send("Ali Valiyev");

    assertThat(sessions.getState(USER)).isEmpty();
    verify(bot)
        .sendMessage(
            USER, texts.text("choose-menu", Language.EN), keyboards.mainMenu(Language.EN, USER));
    verifyNoInteractions(applications, notifier);
  }

  @Test
  void restartCommandWinsOverForm() {
    sessions.setState(USER, atStep(Step.EXP));

    send("/start");

    assertThat(sessions.getState(USER)).isEmpty();
    verify(bot)
        .sendMessage(USER, texts.text("welcome", Language.UZ), keyboards.mainMenu(Language.UZ, USER));
  }

  @Test
  void reviewerIsNotifiedEvenWhenSaveFails() {
    sessions.setState(USER, atStep(Step.CV));
    when(applications.save(any())).thenReturn(Optional.empty());
    when(notifier.notify(any(), isNull())).thenReturn(true);

    send("/skip");

    verify(notifier).notify(any(), isNull());
    assertThat(sessions.getState(USER)).isEmpty();
    verify(bot)
        .sendMessage(USER, texts.text("applied", Language.UZ), keyboards.mainMenu(Language.UZ, USER));
  }

  @Test
  void savedApplicationIsAcknowledgedEvenWhenNotificationFails() {
    sessions.setState(USER, atStep(Step.CV));
    when(applications.save(any())).thenReturn(Optional.of("id-1"));
    when(notifier.notify(any(), anyString())).thenReturn(false);

    send("/skip");

    assertThat(sessions.getState(USER)).isEmpty();
  }

  @Test
  void nothingWorkedKeepsTheResumeStep() {
    sessions.setState(USER, atStep(Step.CV));
    when(applications.save(any())).thenReturn(Optional.empty());
    when(notifier.notify(any(), isNull())).thenReturn(false);

    send("/skip");

    assertThat(step()).isEqualTo(Step.CV);
    verify(bot)
        .sendMessage(
            USER, texts.text("submit-failed", Language.UZ), keyboards.skipOrCancel(Language.UZ));
  }

  @Test
  void languageSwitchMidFormRepeatsTheQuestion() {
    sessions.setState(USER, atStep(Step.EXP));

    send("🇷🇺 RUS");

    assertThat(sessions.getLanguage(USER)).isEqualTo(Language.RU);
    assertThat(sessions.getState(USER)).contains(atStep(Step.EXP));
    verify(bot).sendMessage(USER, texts.text("lang-changed", Language.RU));
    verify(bot)
        .sendMessage(USER, texts.text("ask-exp", Language.RU), keyboards.cancelOnly(Language.RU));
  }

  @Test
  void languageSwitchWhileIdleShowsMainMenu() {
    send(actions.label(MenuAction.LANG_EN, Language.UZ));

    verify(bot)
        .sendMessage(
            USER, texts.text("lang-changed", Language.EN), keyboards.mainMenu(Language.EN, USER));
  }

  @Test
  void idleFreeTextAsksToUseTheMenu() {
    send("hello");

    verify(bot)
        .sendMessage(
            USER, texts.text("choose-menu", Language.UZ), keyboards.mainMenu(Language.UZ, USER));
  }

  @Test
  void reviewerOpensAdminPanel() {
    sendAsReviewer("/admin");

    verify(admin).showPanel(REVIEWER_CHAT, Language.UZ);
    Session session = sessions.getState(ADMIN_USER).orElseThrow();
    assertThat(session.mode()).isEqualTo(ConversationMode.ADMIN);
    assertThat(session.step()).isEqualTo(Step.MENU);
  }

  @Test
  void reviewerSearchesByPosition() {
    sendAsReviewer(actions.label(MenuAction.ADMIN, Language.UZ));
    sendAsReviewer(actions.label(MenuAction.ADMIN_SEARCH, Language.UZ));
    verify(admin).askSearchQuery(REVIEWER_CHAT, Language.UZ);

    sendAsReviewer("teacher");

    verify(admin).showSearchResults(REVIEWER_CHAT, "teacher", Language.UZ);
    assertThat(sessions.getState(ADMIN_USER).orElseThrow().step()).isEqualTo(Step.MENU);
  }

  @Test
  void reviewerListsApplicationsAndStats() {
    sendAsReviewer(actions.label(MenuAction.ADMIN_APPS, Language.UZ));
    sendAsReviewer(actions.label(MenuAction.ADMIN_STATS, Language.UZ));

    verify(admin).showRecent(REVIEWER_CHAT, 0, Language.UZ);
    verify(admin).showStats(REVIEWER_CHAT, Language.UZ);
  }

  @Test
  void reviewerOpensApplicationDetails() {
    sendAsReviewer("/a 65f1c0ffee ");

    verify(admin).showApplication(REVIEWER_CHAT, "65f1c0ffee", Language.UZ);
  }

  @Test
  void reviewerBackLeavesAdmin() {
    sendAsReviewer("/admin");

    sendAsReviewer(actions.label(MenuAction.BACK, Language.UZ));

    assertThat(sessions.getState(ADMIN_USER)).isEmpty();
    verify(bot)
        .sendMessage(
            REVIEWER_CHAT,
            texts.text("welcome", Language.UZ),
            keyboards.mainMenu(Language.UZ, REVIEWER_CHAT));
  }

  @Test
  void otherChatsNeverReachAdmin() {
    send("/admin");
    send(actions.label(MenuAction.ADMIN_APPS, Language.UZ));
    send("/a 65f1c0ffee");

    verifyNoInteractions(admin);
    assertThat(sessions.getState(USER)).isEmpty();
  }

  @Test
  void staleAdminStateOutsideReviewerChatIsDropped() {
    sessions.setState(USER, Session.admin(USER, Step.SEARCH_POSITION));

    send("teacher");

    assertThat(sessions.getState(USER)).isEmpty();
    verifyNoInteractions(admin);
  }

  @Test
  void callbacksFromOtherChatsAreOnlyAcknowledged() {
    engine.onCallback(new CallbackAction("cb", USER, USER, "9", "page_10"));

    verify(bot).answerCallbackQuery("cb");
    verify(admin, never()).onCallback(any(), any());
  }

  @Test
  void reviewerCallbacksGoToAdminConsole() {
    CallbackAction callback = new CallbackAction("cb", REVIEWER_CHAT, ADMIN_USER, "9", "page_10");

    engine.onCallback(callback);

    verify(admin).onCallback(callback, Language.UZ);
  }

  private void send(String text) {
    engine.onMessage(new IncomingMessage(USER, USER, "1", text, null, null));
  }

  private void sendAsReviewer(String text) {
    engine.onMessage(new IncomingMessage(REVIEWER_CHAT, ADMIN_USER, "1", text, null, null));
  }

  private Step step() {
    return sessions.getState(USER).orElseThrow().step();
  }

  private static Session atStep(Step step) {
    return new Session(
        USER,
        ConversationMode.JOB,
        step,
        Map.of(
            Session.NAME, "Ali Valiyev",
            Session.PHONE, "+998901234567",
            Session.CATEGORY, "👨‍🏫 Teacher",
            Session.POSITION, "Teacher (Math)",
            Session.EXPERIENCE, "5 years at school"));
  }
}
