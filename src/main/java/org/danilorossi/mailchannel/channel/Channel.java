package org.danilorossi.mailchannel.channel;

/**
 * Trasporto pluggable del router multi-canale. Ogni implementazione riceve messaggi in ingresso
 * tramite {@link #listen(MessageSink)} e invia risposte con {@link #send(String, String)}.
 */
public interface Channel {

  /** Identificatore costante del canale. */
  String name();

  /**
   * Invia {@code message} a {@code recipient}. Il formato di {@code recipient} dipende dal canale.
   *
   * @throws ChannelException se l'invio non è possibile; nessun retry automatico
   */
  void send(String message, String recipient) throws ChannelException;

  /**
   * Blocca il thread chiamante consegnando i messaggi ricevuti a {@code sink}. Ritorna solo quando
   * il sink viene chiuso o il thread interrotto.
   *
   * @throws ChannelException per errori di configurazione rilevati prima del primo ciclo
   */
  void listen(MessageSink sink) throws ChannelException;

  /** Verifica superficiale della connettività; nessun dettaglio sull'errore. */
  boolean healthCheck();
}
