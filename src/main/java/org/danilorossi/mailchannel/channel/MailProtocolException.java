package org.danilorossi.mailchannel.channel;

/** Errore di connessione, autenticazione o comando IMAP/SMTP, o di costruzione MIME. */
public class MailProtocolException extends ChannelException {

  public MailProtocolException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
