package org.danilorossi.mailchannel.mail;

import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Optional;
import java.util.Properties;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailchannel.helpers.LangUtils;
import org.danilorossi.mailchannel.helpers.LogConfigurator;
import org.danilorossi.mailchannel.helpers.MailUtils;
import org.danilorossi.mailchannel.model.HtmlFallback;
import org.danilorossi.mailchannel.model.InboundEmail;
import org.danilorossi.mailchannel.model.ThreadMeta;

/**
 * Estrae mittente, testo e header di thread da un messaggio RFC 822 grezzo. Un messaggio che non
 * si riesce a interpretare viene scartato ({@link Optional#empty()}), senza interrompere il ciclo.
 */
@Log
public class MailParser {

  static {
    LogConfigurator.configLog(log);
  }

  // sessione solo per il parsing, nessuna connessione
  private final Session session = Session.getInstance(new Properties());
  private final HtmlFallback htmlFallback;

  public MailParser() {
    this(HtmlFallback.PASS_THROUGH);
  }

  public MailParser(@NonNull final HtmlFallback htmlFallback) {
    this.htmlFallback = htmlFallback;
  }

  public Optional<InboundEmail> parse(@NonNull final String uid, @NonNull final byte[] raw) {
    try {
      val mime = new MimeMessage(session, new ByteArrayInputStream(raw));

      val sender = parseSender(mime);
      if (sender.isEmpty()) {
        LangUtils.debug(log, "UID {}: no usable From address, skipped", uid);
        return Optional.empty();
      }

      val content = parseTextBody(mime);
      if (content.isEmpty()) {
        LangUtils.debug(log, "UID {}: empty body, skipped", uid);
        return Optional.empty();
      }

      return Optional.of(
          InboundEmail.builder()
              .uid(uid)
              .sender(sender.get())
              .content(content.get())
              .thread(parseThread(mime))
              .build());
    } catch (MessagingException | IOException | RuntimeException e) {
      LangUtils.debug(log, "UID {}: unparsable message, skipped: {}", uid, LangUtils.exMsg(e));
      return Optional.empty();
    }
  }

  /** Primo indirizzo del From; per un gruppo, il primo membro. */
  Optional<String> parseSender(@NonNull final MimeMessage mime) throws MessagingException {
    val from = mime.getHeader("From", ",");
    if (LangUtils.empty(from)) return Optional.empty();

    final InternetAddress[] addrs;
    try {
      addrs = InternetAddress.parseHeader(from, false);
    } catch (AddressException e) {
      LangUtils.debug(log, "Unparsable From header '{}': {}", from, LangUtils.exMsg(e));
      return Optional.empty();
    }

    for (val addr : addrs) {
      if (addr.isGroup()) {
        val members = addr.getGroup(false);
        if (members != null && members.length > 0 && !LangUtils.empty(members[0].getAddress()))
          return Optional.of(members[0].getAddress());
      } else if (!LangUtils.empty(addr.getAddress())) {
        return Optional.of(addr.getAddress());
      }
    }
    return Optional.empty();
  }

  /**
   * Primo sotto-part text/plain non vuoto; altrimenti l'intero body. Il fallback può restituire
   * markup HTML se il messaggio non ha parti in testo semplice.
   */
  Optional<String> parseTextBody(@NonNull final MimeMessage mime)
      throws MessagingException, IOException {
    if (mime.isMimeType("multipart/*") && mime.getContent() instanceof Multipart mp) {
      for (int i = 0; i < mp.getCount(); i++) {
        val part = mp.getBodyPart(i);
        if (!part.isMimeType("text/plain")) continue;
        val text = MailUtils.getTextPayload(part).trim();
        if (!text.isEmpty()) return Optional.of(text);
      }
    }

    var body = MailUtils.getTextPayload(mime).trim();
    if (htmlFallback == HtmlFallback.STRIP
        && (mime.isMimeType("text/html") || MailUtils.looksLikeHtml(body))) {
      body = MailUtils.htmlToPlainText(body);
    }
    return body.isEmpty() ? Optional.empty() : Optional.of(body);
  }

  ThreadMeta parseThread(@NonNull final MimeMessage mime) throws MessagingException {
    return ThreadMeta.builder()
        .messageId(MailUtils.decodeHeaderSafe(mime.getHeader("Message-ID", null)))
        .subject(MailUtils.decodeHeaderSafe(mime.getHeader("Subject", null)))
        .build();
  }
}
