package org.danilorossi.mailchannel;

import jakarta.mail.MessagingException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailchannel.channel.Channel;
import org.danilorossi.mailchannel.channel.ChannelException;
import org.danilorossi.mailchannel.channel.ChannelMessage;
import org.danilorossi.mailchannel.channel.ConfigurationException;
import org.danilorossi.mailchannel.channel.MailProtocolException;
import org.danilorossi.mailchannel.channel.MessageSink;
import org.danilorossi.mailchannel.helpers.LangUtils;
import org.danilorossi.mailchannel.helpers.LogConfigurator;
import org.danilorossi.mailchannel.helpers.MailUtils;
import org.danilorossi.mailchannel.helpers.SenderAuthorizer;
import org.danilorossi.mailchannel.helpers.ThreadMetaCodec;
import org.danilorossi.mailchannel.mail.ImapPoller;
import org.danilorossi.mailchannel.mail.MailParser;
import org.danilorossi.mailchannel.mail.ReplyComposer;
import org.danilorossi.mailchannel.mail.SmtpGateway;
import org.danilorossi.mailchannel.model.EmailChannelConfig;
import org.danilorossi.mailchannel.model.InboundEmail;

/**
 * Canale email: polling IMAP in ingresso, risposte SMTP nel thread originale in uscita.
 *
 * <p>Le operazioni IMAP bloccanti girano su un worker dedicato; il thread che chiama {@link
 * #listen(MessageSink)} attende il risultato del ciclo e poi dorme fino al successivo. L'insieme
 * degli id già visti vive solo in memoria e non viene mai svuotato: cresce per tutta la vita del
 * processo.
 */
@Log
public class EmailChannel implements Channel {

  static {
    LogConfigurator.configLog(log);
  }

  public static final String NAME = "email";

  /** Pausa tra due cicli di polling. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private final EmailChannelConfig config;
  private final SenderAuthorizer authorizer;
  private final MailParser parser;
  private final ReplyComposer composer;
  private final Sleeper sleeper;

  public EmailChannel(@NonNull final EmailChannelConfig config) {
    this(config, d -> Thread.sleep(d.toMillis()));
  }

  EmailChannel(@NonNull final EmailChannelConfig config, @NonNull final Sleeper sleeper) {
    this.config = config;
    this.authorizer = new SenderAuthorizer(config.getAllowedSenders());
    this.parser = new MailParser(config.getHtmlFallback());
    this.composer = new ReplyComposer(config.getFromAddress());
    this.sleeper = sleeper;
  }

  @Override
  public String name() {
    return NAME;
  }

  // ===================== Uscita =====================

  @Override
  public void send(@NonNull final String message, @NonNull final String recipient)
      throws ChannelException {
    val target = ThreadMetaCodec.split(recipient);

    try {
      val mime = composer.compose(message, target.getAddress(), target.getThread());
      smtpGateway().deliver(mime);
      LangUtils.info(log, "Email inviata a {}", target.getAddress());
    } catch (MessagingException e) {
      throw new MailProtocolException(LangUtils.s("Email send failed: {}", LangUtils.exMsg(e)), e);
    }
  }

  /** Nuovo gateway a ogni invio: nessun transport riusato. */
  SmtpGateway smtpGateway() throws ConfigurationException {
    try {
      return new SmtpGateway(config.getSmtp());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(LangUtils.s("Invalid SMTP configuration: {}", e.getMessage()), e);
    }
  }

  // ===================== Ingresso =====================

  ImapPoller imapPoller() {
    return new ImapPoller(config.getImap(), parser);
  }

  @Override
  public void listen(@NonNull final MessageSink sink) throws ChannelException {
    try {
      config.getImap().validate();
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(LangUtils.s("Invalid IMAP configuration: {}", e.getMessage()), e);
    }

    LangUtils.info(log, "Canale email in ascolto sulla cartella {}...", config.getImap().getInboxFolder());

    val interval = config.effectivePollInterval();
    val seenIds = new HashSet<String>();
    val poller = imapPoller();
    val worker = newImapWorker();
    try {
      while (true) {
        for (val inbound : pollOnce(worker, poller)) {
          if (!dispatch(inbound, seenIds, sink)) {
            LangUtils.info(log, "Canale email: ricevente chiuso, ascolto terminato");
            return;
          }
        }
        sleeper.sleep(interval);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LangUtils.info(log, "Canale email: ascolto interrotto");
    } finally {
      worker.shutdownNow();
    }
  }

  /** Un ciclo sul worker IMAP. In caso di errore nessun messaggio del ciclo viene consegnato. */
  List<InboundEmail> pollOnce(final ExecutorService worker, final ImapPoller poller)
      throws InterruptedException {
    val future = worker.submit(poller::pollUnseen);
    try {
      return future.get();
    } catch (ExecutionException e) {
      LangUtils.warn(log, "Errore nel polling email: {}", LangUtils.rootCauseMsg(e.getCause()));
      return List.of();
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    }
  }

  /**
   * Deduplica, autorizza e consegna.
   *
   * @return false se il sink è chiuso
   */
  boolean dispatch(
      @NonNull final InboundEmail inbound,
      @NonNull final Set<String> seenIds,
      @NonNull final MessageSink sink)
      throws InterruptedException {
    val id = ThreadMetaCodec.dedupKey(inbound.getUid(), inbound.getThread());
    if (!seenIds.add(id)) return true;

    if (!authorizer.isAllowed(inbound.getSender())) {
      LangUtils.warn(log, "Email: messaggio ignorato, mittente non autorizzato: {}", inbound.getSender());
      return true;
    }

    val message =
        ChannelMessage.builder()
            .id(id)
            .sender(inbound.getSender())
            .content(inbound.getContent())
            .channel(NAME)
            .timestamp(Instant.now().getEpochSecond())
            .build();
    return sink.send(message);
  }

  // ===================== Health =====================

  @Override
  public boolean healthCheck() {
    if (!MailUtils.isValidIdentity(config.getFromAddress())) return false;
    if (!checkImap()) return false;
    try {
      return smtpGateway().testConnection();
    } catch (ConfigurationException | RuntimeException e) {
      LangUtils.debug(log, "SMTP health check failed: {}", LangUtils.exMsg(e));
      return false;
    }
  }

  private boolean checkImap() {
    val worker = newImapWorker();
    try {
      val poller = imapPoller();
      worker
          .submit(
              () -> {
                poller.checkConnectivity();
                return null;
              })
          .get();
      return true;
    } catch (ExecutionException | RuntimeException e) {
      LangUtils.debug(log, "IMAP health check failed: {}", LangUtils.exMsg(e));
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } finally {
      worker.shutdownNow();
    }
  }

  private static ExecutorService newImapWorker() {
    return Executors.newSingleThreadExecutor(
        r -> {
          val t = new Thread(r, "email-imap-worker");
          t.setDaemon(true);
          return t;
        });
  }
}
