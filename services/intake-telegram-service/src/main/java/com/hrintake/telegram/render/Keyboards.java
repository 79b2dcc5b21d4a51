package com.hrintake.telegram.render;

import com.hrintake.telegram.config.BotProperties;
import com.hrintake.telegram.i18n.ActionCatalog;
import com.hrintake.telegram.i18n.BotTexts;
import com.hrintake.telegram.i18n.Language;
import com.hrintake.telegram.i18n.MenuAction;
import com.hrintake.telegram.model.ReplyKeyboard;
import com.hrintake.telegram.model.ReplyKeyboard.Button;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class Keyboards {

  private final ActionCatalog actions;
  private final BotTexts texts;
  private final BotProperties bot;

  /**
   * Jobs on top, then location and about, contact, and language. The admin button is added only
   * in the reviewer chat.
   */
  public ReplyKeyboard mainMenu(Language lang, String chatId) {
    List<List<Button>> rows = new ArrayList<>();
    rows.add(List.of(button(MenuAction.JOBS, lang)));
    rows.add(List.of(button(MenuAction.LOCATION, lang), button(MenuAction.ABOUT, lang)));
    rows.add(List.of(button(MenuAction.CONTACT, lang)));
    List<Button> last = new ArrayList<>();
    last.add(button(MenuAction.CHANGE_LANGUAGE, lang));
    if (bot.isReviewer(chatId)) {
      last.add(button(MenuAction.ADMIN, lang));
    }
    rows.add(last);
    return ReplyKeyboard.of(rows);
  }

  public ReplyKeyboard languageMenu(Language lang) {
    return ReplyKeyboard.of(
        List.of(
            List.of(button(MenuAction.LANG_UZ, lang), button(MenuAction.LANG_UZ_CYRL, lang)),
            List.of(button(MenuAction.LANG_EN, lang), button(MenuAction.LANG_RU, lang)),
            List.of(button(MenuAction.BACK, lang))));
  }

  public ReplyKeyboard adminMenu(Language lang) {
    return ReplyKeyboard.of(
        List.of(
            List.of(button(MenuAction.ADMIN_APPS, lang)),
            List.of(button(MenuAction.ADMIN_SEARCH, lang)),
            List.of(button(MenuAction.ADMIN_STATS, lang)),
            List.of(button(MenuAction.BACK, lang))));
  }

  public ReplyKeyboard contactRequest(Language lang) {
    return new ReplyKeyboard(
        List.of(
            List.of(new Button(texts.text("send-contact", lang), true)),
            List.of(button(MenuAction.CANCEL, lang))),
        true);
  }

  public ReplyKeyboard positions(Language lang) {
    List<List<Button>> rows = new ArrayList<>();
    for (List<String> row : texts.positions(lang)) {
      rows.add(row.stream().map(Button::of).toList());
    }
    rows.add(List.of(button(MenuAction.CANCEL, lang)));
    return ReplyKeyboard.of(rows);
  }

  public ReplyKeyboard cancelOnly(Language lang) {
    return ReplyKeyboard.of(List.of(List.of(button(MenuAction.CANCEL, lang))));
  }

  public ReplyKeyboard skipOrCancel(Language lang) {
    return new ReplyKeyboard(
        List.of(List.of(button(MenuAction.SKIP, lang)), List.of(button(MenuAction.CANCEL, lang))),
        true);
  }

  private Button button(MenuAction action, Language lang) {
    return Button.of(actions.label(action, lang));
  }
}
