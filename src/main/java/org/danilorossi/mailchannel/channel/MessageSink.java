package org.danilorossi.mailchannel.channel;

/** Lato di ricezione del bus. */
@FunctionalInterface
public interface MessageSink {

  /**
   * Consegna un messaggio, bloccando se il ricevente applica backpressure.
   *
   * @return false se il lato ricevente è stato chiuso
   */
  boolean send(ChannelMessage message) throws InterruptedException;
}
