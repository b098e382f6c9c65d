package org.danilorossi.mailchannel.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Un messaggio letto dalla casella durante un ciclo di polling.
 *
 * <p>{@code uid} è l'UID IMAP quando la cartella implementa UIDFolder, altrimenti il numero di
 * sequenza. I numeri di sequenza cambiano tra una connessione e l'altra, e anche gli UID restano
 * stabili solo finché l'UIDVALIDITY della cartella non cambia: la chiave di deduplica non è quindi
 * garantita stabile su tutti i server.
 */
@Value
@Builder
public class InboundEmail {
  @NonNull String uid;
  @NonNull String sender;
  @NonNull String content;
  @NonNull @Builder.Default ThreadMeta thread = ThreadMeta.NONE;
}
