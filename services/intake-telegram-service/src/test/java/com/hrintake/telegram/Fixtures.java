package com.hrintake.telegram;

import com.hrintake.telegram.config.AdminProperties;
import com.hrintake.telegram.config.BotProperties;
import com.hrintake.telegram.i18n.ActionCatalog;
import com.hrintake.telegram.i18n.BotTexts;
import com.hrintake.telegram.i18n.Language;
import com.hrintake.telegram.model.Attachment;
import com.hrintake.telegram.model.AttachmentKind;
import com.hrintake.telegram.store.StoredApplication;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.io.ClassPathResource;

/** Shared test data: the real text tables and a reviewer chat. */
public final class Fixtures {

  public static final String REVIEWER_CHAT = "-1001234567890";

  private Fixtures() {}

  public static BotProperties botProperties() {
    return new BotProperties(
        "123456:TEST-TOKEN", REVIEWER_CHAT, "https://api.telegram.org", "Asia/Tashkent", Language.UZ);
  }

  public static AdminProperties adminProperties() {
    return new AdminProperties(10, 50, 300, 30, 1000, 3500);
  }

  /** Binds {@code bot-texts.yml} the same way the application does. */
  public static BotTexts texts() {
    try {
      var sources =
          new YamlPropertySourceLoader()
              .load("bot-texts", new ClassPathResource("bot-texts.yml"));
      Binder binder = new Binder(ConfigurationPropertySources.from(sources));
      return binder.bind("texts", Bindable.ofInstance(new BotTexts())).get();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static ActionCatalog catalog(BotTexts texts) {
    return new ActionCatalog(texts);
  }

  public static StoredApplication application(String id, String position, Instant createdAt) {
    return new StoredApplication(
        id, "u-" + id, "Ali Valiyev", "+998901234567", position, "5 years at school", null, createdAt);
  }

  public static StoredApplication applicationWithPhoto(String id, String position) {
    return new StoredApplication(
        id,
        "u-" + id,
        "Ali Valiyev",
        "+998901234567",
        position,
        "5 years at school",
        new Attachment("photo-file-" + id, AttachmentKind.PHOTO),
        Instant.parse("2024-03-01T07:30:00Z"));
  }
}
