package org.danilorossi.mailchannel.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/** Configurazione completa del canale email, salvata in data/email-channel.json. */
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Builder
@ToString
public class EmailChannelConfig {

  /** Intervallo minimo tra due cicli di polling, qualunque sia il valore configurato. */
  public static final long MIN_POLL_INTERVAL_SECONDS = 5L;

  @Builder.Default private ImapConfig imap = ImapConfig.builder().build();

  @Builder.Default private SmtpConfig smtp = SmtpConfig.builder().build();

  @Builder.Default private String fromAddress = "";

  @Builder.Default private long pollIntervalSeconds = 60L;

  /** Indirizzi ammessi; "*" ammette chiunque, lista vuota nessuno. */
  @Builder.Default private List<String> allowedSenders = new ArrayList<>();

  @Builder.Default private HtmlFallback htmlFallback = HtmlFallback.PASS_THROUGH;

  public Duration effectivePollInterval() {
    return Duration.ofSeconds(Math.max(pollIntervalSeconds, MIN_POLL_INTERVAL_SECONDS));
  }

  /** Un {@code "imap": null} nel JSON equivale alla sezione assente. */
  public ImapConfig getImap() {
    return imap == null ? ImapConfig.builder().build() : imap;
  }

  public SmtpConfig getSmtp() {
    return smtp == null ? SmtpConfig.builder().build() : smtp;
  }

  public String getFromAddress() {
    return fromAddress == null ? "" : fromAddress;
  }

  public List<String> getAllowedSenders() {
    return allowedSenders == null ? List.of() : Collections.unmodifiableList(allowedSenders);
  }

  public HtmlFallback getHtmlFallback() {
    return htmlFallback == null ? HtmlFallback.PASS_THROUGH : htmlFallback;
  }
}
