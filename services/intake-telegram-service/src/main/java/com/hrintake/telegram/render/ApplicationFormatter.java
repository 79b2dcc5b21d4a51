package com.hrintake.telegram.render;

import static com.hrintake.telegram.render.Html.bold;
import static com.hrintake.telegram.render.Html.escape;
import static com.hrintake.telegram.render.Html.valueOrDash;

import com.hrintake.telegram.admin.PositionStats;
import com.hrintake.telegram.config.BotProperties;
import com.hrintake.telegram.i18n.ActionCatalog;
import com.hrintake.telegram.i18n.BotTexts;
import com.hrintake.telegram.i18n.Language;
import com.hrintake.telegram.store.ApplicationDraft;
import com.hrintake.telegram.store.StoredApplication;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Text of application cards, the reviewer notification and the stats report. */
@Component
public class ApplicationFormatter {

  static final String RULE = "⎯⎯⎯⎯⎯⎯⎯⎯⎯⎯⎯⎯⎯⎯⎯";
  private static final int BAR_CELLS = 10;
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm", Locale.ROOT);

  private final BotTexts texts;
  private final ActionCatalog actions;
  private final Clock clock;
  private final DateTimeFormatter timestamp;

  public ApplicationFormatter(
      BotTexts texts, ActionCatalog actions, BotProperties bot, Clock clock) {
    this.texts = texts;
    this.actions = actions;
    this.clock = clock;
    this.timestamp = TIMESTAMP.withZone(bot.zoneId());
  }

  /** Numbered entry of a list (recent page, search results). */
  public String listEntry(StoredApplication app, int index) {
    return index
        + ". 👤 "
        + valueOrDash(app.name())
        + "\n   💼 "
        + valueOrDash(displayPosition(app.position()))
        + "\n   📞 "
        + valueOrDash(app.phone())
        + "\n   📝 "
        + valueOrDash(app.experience())
        + "\n   📅 "
        + formatTimestamp(app.createdAt());
  }

  /** Full card for {@code /a <id>}. */
  public String detailCard(StoredApplication app, Language lang) {
    return bold(texts.text("details-header", lang))
        + "\n"
        + RULE
        + "\n\n👤 "
        + field("field-candidate", lang)
        + valueOrDash(app.name())
        + "\n📞 "
        + field("field-phone", lang)
        + valueOrDash(app.phone())
        + "\n💼 "
        + field("field-position", lang)
        + valueOrDash(displayPosition(app.position()))
        + "\n📝 "
        + field("field-experience", lang)
        + valueOrDash(app.experience())
        + "\n🕒 "
        + field("field-date", lang)
        + formatTimestamp(app.createdAt());
  }

  /** Notification for the reviewer chat, in the default language. */
  public String reviewerReport(ApplicationDraft draft, String applicationId) {
    Language lang = texts.defaultLanguage();
    StringBuilder sb = new StringBuilder();
    sb.append(texts.text("hr-title", lang)).append("\n\n");
    sb.append("👤 ").append(texts.text("field-candidate", lang)).append(": ");
    sb.append(valueOrDash(draft.name())).append('\n');
    sb.append("📞 ").append(texts.text("hr-phone", lang)).append(": ");
    sb.append(valueOrDash(draft.phone())).append('\n');
    sb.append("💼 ").append(texts.text("field-position", lang)).append(": ");
    sb.append(valueOrDash(draft.position())).append('\n');
    sb.append("📝 ").append(texts.text("field-experience", lang)).append(": ");
    sb.append(valueOrDash(draft.experience()));
    if (applicationId != null) {
      sb.append("\n\n").append(texts.format("hr-lookup", lang, escape(applicationId)));
    }
    return sb.toString();
  }

  public String statsReport(PositionStats stats, Language lang) {
    List<String> lines = new ArrayList<>();
    lines.add(texts.format("stats-title", lang, stats.days()));
    lines.add(RULE);
    lines.add(bold(texts.text("stats-summary", lang) + ":"));
    lines.add(
        "🔹 "
            + texts.text("stats-total", lang)
            + ": "
            + bold(texts.format("stats-count", lang, stats.total())));
    lines.add(
        "🔹 "
            + texts.text("stats-average", lang)
            + ": "
            + bold(texts.format("stats-per-day", lang, oneDecimal(stats.dailyAverage()))));
    lines.add("");
    lines.add(bold(texts.text("stats-by-position", lang) + ":"));

    for (Map.Entry<String, Long> e : stats.counts().entrySet()) {
      double percent = stats.percentOf(e.getValue());
      String position =
          PositionStats.UNKNOWN.equals(e.getKey())
              ? texts.text("unknown-position", lang)
              : displayPosition(e.getKey());
      lines.add("\n" + bold(escape(position)));
      lines.add(
          progressBar(percent)
              + "  "
              + texts.format("stats-count", lang, e.getValue())
              + " ("
              + oneDecimal(percent)
              + "%)");
    }

    lines.add("\n" + RULE);
    lines.add(
        "<i>" + texts.format("stats-generated-at", lang, timestamp.format(clock.instant())) + "</i>");
    return String.join("\n", lines);
  }

  public String formatTimestamp(Instant instant) {
    return instant == null ? Html.EMPTY : timestamp.format(instant);
  }

  public String displayPosition(String position) {
    return actions.stripCategoryIcon(position);
  }

  static String progressBar(double percent) {
    int filled = (int) (BAR_CELLS * percent / 100);
    filled = Math.max(0, Math.min(BAR_CELLS, filled));
    return "🟢".repeat(filled) + "⚪".repeat(BAR_CELLS - filled);
  }

  private String field(String key, Language lang) {
    return bold(texts.text(key, lang) + ":") + " ";
  }

  private static String oneDecimal(double value) {
    return String.format(Locale.ROOT, "%.1f", value);
  }
}
