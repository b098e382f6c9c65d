package org.danilorossi.mailchannel.db;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailchannel.helpers.FileSystemUtils;
import org.danilorossi.mailchannel.helpers.LangUtils;
import org.danilorossi.mailchannel.helpers.LogConfigurator;
import org.danilorossi.mailchannel.model.EmailChannelConfig;

/**
 * Lettura della configurazione del canale da JSON. Le chiavi mancanti mantengono i default dei
 * builder (i costruttori senza argomenti di Lombok inizializzano i campi {@code @Builder.Default}).
 *
 * <pre>{@code
 * {
 *   "imap": { "host": "imap.example.com", "port": 993, "username": "bot", "password": "...",
 *             "starttls": false, "inboxFolder": "INBOX" },
 *   "smtp": { "host": "smtp.example.com", "port": 587, "username": "bot", "password": "...",
 *             "starttls": true },
 *   "fromAddress": "bot@example.com",
 *   "pollIntervalSeconds": 60,
 *   "allowedSenders": ["alice@example.com"],
 *   "htmlFallback": "PASS_THROUGH"
 * }
 * }</pre>
 */
@Log
public class ConfigStore {

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().serializeNulls().disableHtmlEscaping().create();

  static {
    LogConfigurator.configLog(log);
  }

  @Getter private final Path file;

  public ConfigStore() {
    this(FileSystemUtils.getConfigJson());
  }

  public ConfigStore(@NonNull final Path file) {
    this.file = file;
  }

  /** @throws IOException se il file manca, non è leggibile o non è JSON valido */
  public EmailChannelConfig load() throws IOException {
    if (!Files.exists(file))
      throw new IOException(LangUtils.s("Email channel configuration not found: {}", file));
    val json = FileSystemUtils.readUtf8(file);
    try {
      val cfg = GSON.fromJson(json, EmailChannelConfig.class);
      if (cfg == null) throw new IOException(LangUtils.s("Empty configuration file: {}", file));
      LangUtils.info(log, "Configurazione del canale email caricata da {}", file);
      return cfg;
    } catch (JsonParseException e) {
      throw new IOException(LangUtils.s("Invalid configuration file {}: {}", file, LangUtils.rootCauseMsg(e)), e);
    }
  }

  /** JSON con i valori di default, utile come modello. */
  public static String template() {
    return GSON.toJson(EmailChannelConfig.builder().build());
  }
}
