package org.danilorossi.mailchannel.channel;

/** Errore di un canale riportato al chiamante. */
public class ChannelException extends Exception {

  public ChannelException(final String message) {
    super(message);
  }

  public ChannelException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
