package org.danilorossi.mailchannel.helpers;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.Strictness;
import java.util.Optional;
import lombok.NonNull;
import lombok.Value;
import lombok.experimental.UtilityClass;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailchannel.model.ThreadMeta;

/**
 * Codifica del contesto di thread nel campo destinatario del bus, che trasporta solo stringhe.
 *
 * <p>Formati: {@code address}, {@code address<SEP>json} e il vecchio {@code
 * address<SEP>uid<SEP>json}. SEP è U+001F, che non può comparire in un indirizzo valido e che Gson
 * codifica sempre come escape dentro il JSON.
 */
@Log
@UtilityClass
public class ThreadMetaCodec {

  public static final String SEP = "\u001F";

  // STRICT: niente chiavi senza virgolette, apici singoli o altre estensioni lenient
  private static final Gson GSON =
      new GsonBuilder()
          .serializeNulls()
          .disableHtmlEscaping()
          .setStrictness(Strictness.STRICT)
          .create();

  static {
    LogConfigurator.configLog(log);
  }

  /** JSON compatto, oppure empty se non c'è nessun campo valorizzato. */
  public static Optional<String> encode(final ThreadMeta meta) {
    if (meta == null || meta.isEmpty()) return Optional.empty();
    return Optional.of(GSON.toJson(meta));
  }

  /** Mai eccezioni: un JSON malformato equivale a "nessun contesto". */
  public static Optional<ThreadMeta> decode(final String raw) {
    if (raw == null) return Optional.empty();
    try {
      return Optional.ofNullable(GSON.fromJson(raw, ThreadMeta.class));
    } catch (RuntimeException ex) {
      LangUtils.debug(log, "Malformed thread metadata: {}", LangUtils.exMsg(ex));
      return Optional.empty();
    }
  }

  public static Recipient split(@NonNull final String recipient) {
    val first = recipient.indexOf(SEP);
    if (first < 0) return new Recipient(recipient, Optional.empty());

    val address = recipient.substring(0, first);
    val rest = recipient.substring(first + SEP.length());

    val meta = decode(rest);
    if (meta.isPresent()) return new Recipient(address, meta);

    // formato legacy: uid<SEP>json, l'uid si scarta
    val second = rest.indexOf(SEP);
    if (second >= 0) return new Recipient(address, decode(rest.substring(second + SEP.length())));

    return new Recipient(address, Optional.empty());
  }

  /** Destinatario da usare per rispondere nel thread di {@code meta}. */
  public static String compose(@NonNull final String address, final ThreadMeta meta) {
    return encode(meta).map(json -> address + SEP + json).orElse(address);
  }

  /** Chiave di deduplica: uid, oppure uid + SEP + json se c'è contesto di thread. */
  public static String dedupKey(@NonNull final String uid, final ThreadMeta meta) {
    return encode(meta).map(json -> uid + SEP + json).orElse(uid);
  }

  @Value
  public static class Recipient {
    String address;
    Optional<ThreadMeta> thread;
  }
}
