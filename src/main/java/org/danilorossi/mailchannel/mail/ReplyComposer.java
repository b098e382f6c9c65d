package org.danilorossi.mailchannel.mail;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import java.util.Date;
import java.util.Optional;
import java.util.Properties;
import lombok.NonNull;
import lombok.val;
import org.danilorossi.mailchannel.channel.ConfigurationException;
import org.danilorossi.mailchannel.helpers.LangUtils;
import org.danilorossi.mailchannel.helpers.MailUtils;
import org.danilorossi.mailchannel.helpers.MarkdownRenderer;
import org.danilorossi.mailchannel.model.ThreadMeta;

/**
 * Costruisce la risposta in uscita: multipart/alternative con il testo originale e il markdown
 * renderizzato in HTML, Subject "Re: ..." e header In-Reply-To/References quando c'è il
 * Message-ID del messaggio a cui si risponde.
 */
public class ReplyComposer {

  // sessione solo per costruire il MIME; l'invio usa quella di SmtpGateway
  private final Session session = Session.getInstance(new Properties());
  private final String fromAddress;

  public ReplyComposer(final String fromAddress) {
    this.fromAddress = fromAddress;
  }

  public MimeMessage compose(
      @NonNull final String markdown,
      @NonNull final String to,
      @NonNull final Optional<ThreadMeta> thread)
      throws ConfigurationException, MessagingException {
    if (!MailUtils.isValidIdentity(fromAddress))
      throw new ConfigurationException("Invalid from address for email channel");
    if (!MailUtils.isValidIdentity(to))
      throw new ConfigurationException(LangUtils.s("Invalid email recipient: {}", to.trim()));

    val msg = new MimeMessage(session);
    msg.setFrom(parseAddress(fromAddress, "from"));
    msg.setRecipient(Message.RecipientType.TO, parseAddress(to, "recipient"));
    msg.setSubject(MailUtils.replySubject(thread.map(ThreadMeta::getSubject).orElse(null)), "UTF-8");
    msg.setSentDate(new Date());

    val inReplyTo =
        thread.map(ThreadMeta::getMessageId).map(String::trim).filter(id -> !id.isEmpty());
    if (inReplyTo.isPresent()) {
      msg.setHeader("In-Reply-To", inReplyTo.get());
      msg.setHeader("References", inReplyTo.get());
    }

    val plain = new MimeBodyPart();
    plain.setText(markdown, "UTF-8", "plain");

    val html = new MimeBodyPart();
    html.setText(MarkdownRenderer.toHtml(markdown), "UTF-8", "html");

    // l'ultima alternativa è quella preferita dai client
    val alternative = new MimeMultipart("alternative");
    alternative.addBodyPart(plain);
    alternative.addBodyPart(html);

    msg.setContent(alternative);
    msg.saveChanges();
    return msg;
  }

  private static InternetAddress parseAddress(final String value, final String role)
      throws ConfigurationException {
    try {
      return new InternetAddress(value.trim(), true);
    } catch (AddressException e) {
      throw new ConfigurationException(LangUtils.s("Invalid {} address: {}", role, e.getMessage()), e);
    }
  }
}
