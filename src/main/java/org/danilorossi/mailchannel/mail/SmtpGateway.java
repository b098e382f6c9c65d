package org.danilorossi.mailchannel.mail;

import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.MimeMessage;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailchannel.helpers.LangUtils;
import org.danilorossi.mailchannel.helpers.LogConfigurator;
import org.danilorossi.mailchannel.model.SmtpConfig;

/**
 * Invio SMTP. Ogni chiamata apre il proprio {@link Transport} e lo chiude: nessun pooling, quindi
 * invii concorrenti non condividono stato di connessione.
 */
@Log
public class SmtpGateway {

  static {
    LogConfigurator.configLog(log);
  }

  private final SmtpConfig config;

  // sessione di trasporto; il Transport si crea a ogni invio
  private final Session session;

  public SmtpGateway(@NonNull final SmtpConfig config) {
    this.config = config;
    this.session = Session.getInstance(config.toProperties());
  }

  /** Trasporto già autenticato; il chiamante deve chiuderlo. */
  Transport connect() throws MessagingException {
    val transport = session.getTransport(config.getTransportProtocol());
    try {
      transport.connect(
          config.getHost(), config.getPort(), config.getUsername(), config.getPassword());
    } catch (MessagingException | RuntimeException e) {
      closeQuietly(transport);
      throw e;
    }
    return transport;
  }

  public void deliver(@NonNull final MimeMessage message) throws MessagingException {
    val transport = connect();
    try {
      transport.sendMessage(message, message.getAllRecipients());
      LangUtils.debug(log, "SMTP: message delivered via {}:{}", config.getHost(), config.getPort());
    } finally {
      closeQuietly(transport);
    }
  }

  /** Connessione + autenticazione + chiusura; false su qualunque errore. */
  public boolean testConnection() {
    try {
      val transport = connect();
      val connected = transport.isConnected();
      closeQuietly(transport);
      return connected;
    } catch (MessagingException | RuntimeException e) {
      LangUtils.debug(log, "SMTP connection test failed: {}", LangUtils.exMsg(e));
      return false;
    }
  }

  private static void closeQuietly(final Transport transport) {
    try {
      transport.close();
    } catch (MessagingException e) {
      LangUtils.debug(log, "SMTP close failed: {}", LangUtils.exMsg(e));
    }
  }
}
