package org.danilorossi.mailchannel.channel;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Messaggio normalizzato consegnato al bus. {@code id} è la chiave di deduplica. */
@Value
@Builder
public class ChannelMessage {
  @NonNull String id;
  @NonNull String sender;
  @NonNull String content;
  @NonNull String channel;
  long timestamp; // secondi unix
}
