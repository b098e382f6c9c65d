package org.danilorossi.mailchannel.helpers;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import lombok.Cleanup;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.extern.java.Log;
import lombok.val;
import org.jsoup.Jsoup;

@Log
@UtilityClass
public final class MailUtils {

  static {
    LogConfigurator.configLog(log);
  }

  /** Subject delle risposte che non hanno un thread di riferimento. */
  public static final String DEFAULT_REPLY_SUBJECT = "Email channel reply";

  private static final String REPLY_PREFIX = "Re: ";

  /**
   * Forma minima di un indirizzo usato come From/To: non vuoto, con '@' e senza CR/LF (niente
   * header injection).
   */
  public static boolean isValidIdentity(final String value) {
    if (value == null) return false;
    val trimmed = value.trim();
    return !trimmed.isEmpty()
        && trimmed.contains("@")
        && trimmed.indexOf('\r') < 0
        && trimmed.indexOf('\n') < 0;
  }

  /** "Hello" ⇒ "Re: Hello"; "RE: Hello" resta invariato; vuoto ⇒ {@link #DEFAULT_REPLY_SUBJECT}. */
  public static String replySubject(final String subject) {
    if (LangUtils.empty(subject)) return DEFAULT_REPLY_SUBJECT;
    val trimmed = subject.trim();
    if (trimmed.toLowerCase(Locale.ROOT).startsWith("re:")) return trimmed;
    return REPLY_PREFIX + trimmed;
  }

  /** Valore di un header con encoded-word RFC 2047 decodificate e folding rimosso, senza trim. */
  public static String decodeHeaderSafe(final String raw) {
    if (raw == null) return null;
    val unfolded = MimeUtility.unfold(raw);
    try {
      return MimeUtility.decodeText(unfolded);
    } catch (IOException | RuntimeException e) {
      return unfolded;
    }
  }

  /**
   * Testo di una parte. Per le parti non multipart il transfer-encoding è già decodificato da
   * Jakarta Mail; per le multipart si legge il body grezzo.
   */
  public static String getTextPayload(@NonNull final Part part) throws MessagingException, IOException {
    if (part.isMimeType("multipart/*")) {
      @Cleanup val raw = rawInputStream(part);
      if (raw != null) return readAll(raw, detectCharset(part));
    }
    try {
      val content = part.getContent();
      if (content instanceof String s) return s;
    } catch (UnsupportedEncodingException e) {
      // charset sconosciuto a Java: si rilegge lo stream con detectCharset (UTF-8 di fallback)
      LangUtils.debug(log, "Unsupported charset, reading raw stream: {}", LangUtils.exMsg(e));
    }

    @Cleanup val is = part.getInputStream();
    return readAll(is, detectCharset(part));
  }

  private static InputStream rawInputStream(@NonNull final Part part) throws MessagingException {
    if (part instanceof MimeMessage mm) return mm.getRawInputStream();
    if (part instanceof MimeBodyPart bp) return bp.getRawInputStream();
    return null;
  }

  public static Charset detectCharset(@NonNull final Part part) {
    try {
      val ct = part.getContentType();
      if (ct != null) {
        val cs = new ContentType(ct).getParameter("charset");
        if (cs != null) {
          try {
            // etichette strane: utf8, cp_1252, ...
            String norm = cs.trim().toLowerCase(Locale.ROOT).replace("_", "-");
            if ("utf8".equals(norm)) norm = "utf-8";
            return Charset.forName(norm);
          } catch (IllegalCharsetNameException | UnsupportedCharsetException __) {
            LangUtils.debug(log, "Unsupported charset '{}', falling back to UTF-8", cs);
          }
        }
      }
    } catch (MessagingException e) {
      LangUtils.debug(log, "Unparsable Content-Type, falling back to UTF-8: {}", LangUtils.exMsg(e));
    }
    return StandardCharsets.UTF_8;
  }

  public static boolean looksLikeHtml(final String text) {
    if (LangUtils.empty(text)) return false;
    val head = text.stripLeading().toLowerCase(Locale.ROOT);
    return head.startsWith("<!doctype html") || head.startsWith("<html") || head.contains("<body");
  }

  public static String htmlToPlainText(final String html) {
    if (LangUtils.empty(html)) return "";
    val doc = Jsoup.parse(html);
    doc.select("br").append("\\n");
    doc.select("p, li, div, tr, h1, h2, h3, h4, h5, h6").prepend("\\n");
    return doc.text()
        .replace("\\n", "\n")
        .replaceAll("[ \\t]*\n[ \\t]*", "\n")
        .replaceAll("\n{2,}", "\n")
        .trim();
  }

  /** Serializza un messaggio in byte RFC 822 (header + body) con writeTo(). */
  public static byte[] toRfc822Bytes(@NonNull final Message message)
      throws IOException, MessagingException {
    @Cleanup val baos = new ByteArrayOutputStream(64 * 1024);
    message.writeTo(baos);
    return baos.toByteArray();
  }

  private static String readAll(@NonNull final InputStream is, @NonNull final Charset cs)
      throws IOException {
    return new String(is.readAllBytes(), cs);
  }
}
