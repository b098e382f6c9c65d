package org.danilorossi.mailchannel.channel;

/** Configurazione o indirizzo non validi. Mai ritentato. */
public class ConfigurationException extends ChannelException {

  public ConfigurationException(final String message) {
    super(message);
  }

  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
