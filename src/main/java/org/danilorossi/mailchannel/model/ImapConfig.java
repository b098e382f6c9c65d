package org.danilorossi.mailchannel.model;

import java.util.Properties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.val;
import org.danilorossi.mailchannel.helpers.LangUtils;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Builder
@ToString(onlyExplicitlyIncluded = true)
public class ImapConfig {

  @Builder.Default @ToString.Include private String host = "";

  @Builder.Default @ToString.Include private int port = 993;

  @Builder.Default @ToString.Include private String username = "";

  @Builder.Default private String password = "";

  @Builder.Default @ToString.Include private String inboxFolder = "INBOX";

  /** true: IMAP in chiaro + STARTTLS obbligatorio; false: IMAPS (TLS implicito). */
  @Builder.Default private boolean starttls = false;

  @Builder.Default private int connectionTimeoutMs = 15_000;
  @Builder.Default private int readTimeoutMs = 30_000;
  @Builder.Default private int writeTimeoutMs = 15_000;

  public String getStoreProtocol() {
    return starttls ? "imap" : "imaps";
  }

  /** Proprietà Jakarta Mail per il protocollo scelto. */
  public Properties toProperties() {
    validate();

    val p = new Properties();
    val prefix = "mail." + getStoreProtocol();

    p.put(prefix + ".host", host);
    p.put(prefix + ".port", String.valueOf(port));
    p.put(prefix + ".auth", "true");
    p.put(prefix + ".connectiontimeout", String.valueOf(connectionTimeoutMs));
    p.put(prefix + ".timeout", String.valueOf(readTimeoutMs));
    p.put(prefix + ".writetimeout", String.valueOf(writeTimeoutMs));
    if (starttls) {
      p.put(prefix + ".starttls.enable", "true");
      p.put(prefix + ".starttls.required", "true");
    } else {
      p.put(prefix + ".ssl.enable", "true");
    }
    p.put(prefix + ".ssl.checkserveridentity", "true");
    return p;
  }

  public void validate() throws IllegalArgumentException {
    if (LangUtils.empty(host)) throw new IllegalArgumentException("IMAP host is blank");
    if (LangUtils.empty(username)) throw new IllegalArgumentException("IMAP username is blank");
    if (port <= 0 || port > 65535)
      throw new IllegalArgumentException(LangUtils.s("IMAP port is invalid: {}", port));
    if (LangUtils.empty(inboxFolder))
      throw new IllegalArgumentException("IMAP inboxFolder is blank");
  }
}
