package org.danilorossi.mailchannel.model;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Contesto minimo per rispondere nello stesso thread: Message-ID originale e Subject. Entrambi
 * facoltativi; se mancano tutti e due non c'è contesto di threading.
 */
@Value
@Builder
@AllArgsConstructor
public class ThreadMeta {

  public static final ThreadMeta NONE = new ThreadMeta(null, null);

  @SerializedName("message_id")
  String messageId;

  @SerializedName("subject")
  String subject;

  public boolean isEmpty() {
    return messageId == null && subject == null;
  }
}
