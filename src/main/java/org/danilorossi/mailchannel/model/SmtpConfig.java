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
public class SmtpConfig {

  @Builder.Default @ToString.Include private String host = "";

  @Builder.Default @ToString.Include private int port = 587;

  @Builder.Default @ToString.Include private String username = "";

  @Builder.Default private String password = "";

  /** true: SMTP + STARTTLS obbligatorio (587); false: SMTPS con TLS implicito (465). */
  @Builder.Default private boolean starttls = true;

  @Builder.Default private int connectionTimeoutMs = 15_000;
  @Builder.Default private int readTimeoutMs = 30_000;
  @Builder.Default private int writeTimeoutMs = 15_000;

  public String getTransportProtocol() {
    return starttls ? "smtp" : "smtps";
  }

  public Properties toProperties() {
    validate();

    val p = new Properties();
    val prefix = "mail." + getTransportProtocol();

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
    if (LangUtils.empty(host)) throw new IllegalArgumentException("SMTP host is blank");
    if (port <= 0 || port > 65535)
      throw new IllegalArgumentException(LangUtils.s("SMTP port is invalid: {}", port));
  }
}
