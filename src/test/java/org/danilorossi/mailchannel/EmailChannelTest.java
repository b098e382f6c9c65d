package org.danilorossi.mailchannel;

import static org.junit.jupiter.api.Assertions.*;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.danilorossi.mailchannel.channel.ChannelMessage;
import org.danilorossi.mailchannel.channel.ConfigurationException;
import org.danilorossi.mailchannel.channel.MailProtocolException;
import org.danilorossi.mailchannel.channel.QueueMessageSink;
import org.danilorossi.mailchannel.helpers.ThreadMetaCodec;
import org.danilorossi.mailchannel.mail.ImapPoller;
import org.danilorossi.mailchannel.mail.MailParser;
import org.danilorossi.mailchannel.mail.SmtpGateway;
import org.danilorossi.mailchannel.model.EmailChannelConfig;
import org.danilorossi.mailchannel.model.ImapConfig;
import org.danilorossi.mailchannel.model.InboundEmail;
import org.danilorossi.mailchannel.model.SmtpConfig;
import org.danilorossi.mailchannel.model.ThreadMeta;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class EmailChannelTest {

  private static final ImapConfig IMAP =
      ImapConfig.builder().host("imap.example.com").username("bot").password("secret").build();
  private static final SmtpConfig SMTP =
      SmtpConfig.builder().host("smtp.example.com").username("bot").password("secret").build();

  /** Ogni elemento è il risultato di un ciclo: una lista oppure un'eccezione. */
  private final Deque<Object> cycles = new ArrayDeque<>();

  private final List<MimeMessage> delivered = new ArrayList<>();
  private final AtomicInteger sleeps = new AtomicInteger();

  private boolean imapReachable = true;
  private boolean smtpReachable = true;

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  private static EmailChannelConfig config(String from, List<String> allowed) {
    return EmailChannelConfig.builder()
        .imap(IMAP)
        .smtp(SMTP)
        .fromAddress(from)
        .pollIntervalSeconds(1)
        .allowedSenders(new ArrayList<>(allowed))
        .build();
  }

  private static InboundEmail inbound(String uid, String sender, ThreadMeta thread) {
    return InboundEmail.builder().uid(uid).sender(sender).content("body " + uid).thread(thread).build();
  }

  /** Canale con IMAP/SMTP finti; si ferma (interrupt) dopo {@code maxCycles} pause. */
  private EmailChannel channel(EmailChannelConfig cfg, int maxCycles) {
    EmailChannel.Sleeper sleeper =
        d -> {
          assertEquals(EmailChannelConfig.MIN_POLL_INTERVAL_SECONDS, d.getSeconds());
          if (sleeps.incrementAndGet() >= maxCycles) throw new InterruptedException("stop");
        };
    return new EmailChannel(cfg, sleeper) {
      @Override
      ImapPoller imapPoller() {
        return new ImapPoller(IMAP, new MailParser()) {
          @Override
          @SuppressWarnings("unchecked")
          public List<InboundEmail> pollUnseen() throws MessagingException, IOException {
            Object next = cycles.isEmpty() ? List.of() : cycles.poll();
            if (next instanceof MessagingException e) throw e;
            return (List<InboundEmail>) next;
          }

          @Override
          public void checkConnectivity() throws MessagingException {
            if (!imapReachable) throw new MessagingException("login failed");
          }
        };
      }

      @Override
      SmtpGateway smtpGateway() {
        return new SmtpGateway(SMTP) {
          @Override
          public void deliver(MimeMessage message) throws MessagingException {
            if (!smtpReachable) throw new MessagingException("relay refused");
            delivered.add(message);
          }

          @Override
          public boolean testConnection() {
            return smtpReachable;
          }
        };
      }
    };
  }

  private static List<ChannelMessage> drain(QueueMessageSink sink) throws InterruptedException {
    // listen() ripristina il flag di interrupt prima di uscire
    Thread.interrupted();
    List<ChannelMessage> out = new ArrayList<>();
    ChannelMessage msg;
    while ((msg = sink.poll(10, TimeUnit.MILLISECONDS)) != null) out.add(msg);
    return out;
  }

  @Test
  void testName() {
    assertEquals("email", new EmailChannel(config("bot@example.com", List.of())).name());
  }

  // ===================== listen =====================

  @Test
  void testSameEmailDeliveredOnce() throws Exception {
    ThreadMeta thread = new ThreadMeta("<id@example.com>", "Question");
    cycles.add(List.of(inbound("7", "alice@example.com", thread)));
    cycles.add(List.of(inbound("7", "alice@example.com", thread)));
    cycles.add(List.of(inbound("7", "alice@example.com", thread)));
    QueueMessageSink sink = new QueueMessageSink(10);

    channel(config("bot@example.com", List.of("*")), 3).listen(sink);

    List<ChannelMessage> received = drain(sink);
    assertEquals(1, received.size());
    ChannelMessage msg = received.get(0);
    assertEquals(ThreadMetaCodec.dedupKey("7", thread), msg.getId());
    assertEquals("alice@example.com", msg.getSender());
    assertEquals("body 7", msg.getContent());
    assertEquals("email", msg.getChannel());
    assertTrue(msg.getTimestamp() > 0);
  }

  @Test
  void testIdWithoutThreadIsUid() throws Exception {
    cycles.add(List.of(inbound("8", "alice@example.com", ThreadMeta.NONE)));
    QueueMessageSink sink = new QueueMessageSink(10);

    channel(config("bot@example.com", List.of("*")), 1).listen(sink);

    assertEquals("8", drain(sink).get(0).getId());
  }

  @Test
  void testUnauthorizedSenderIsDropped() throws Exception {
    cycles.add(
        List.of(
            inbound("1", "mallory@example.com", ThreadMeta.NONE),
            inbound("2", "Alice@Example.com", ThreadMeta.NONE)));
    QueueMessageSink sink = new QueueMessageSink(10);

    channel(config("bot@example.com", List.of("alice@example.com")), 1).listen(sink);

    List<ChannelMessage> received = drain(sink);
    assertEquals(1, received.size());
    assertEquals("2", received.get(0).getId());
  }

  @Test
  void testFailedCycleDeliversNothingAndLoopRetries() throws Exception {
    cycles.add(new MessagingException("connection reset during fetch"));
    cycles.add(List.of(inbound("3", "alice@example.com", ThreadMeta.NONE)));
    QueueMessageSink sink = new QueueMessageSink(10);

    channel(config("bot@example.com", List.of("*")), 2).listen(sink);

    List<ChannelMessage> received = drain(sink);
    assertEquals(1, received.size());
    assertEquals("3", received.get(0).getId());
    assertEquals(2, sleeps.get());
  }

  @Test
  void testListenStopsWhenSinkIsClosed() throws Exception {
    cycles.add(
        List.of(
            inbound("1", "alice@example.com", ThreadMeta.NONE),
            inbound("2", "alice@example.com", ThreadMeta.NONE)));
    QueueMessageSink sink = new QueueMessageSink(10);
    sink.close();

    channel(config("bot@example.com", List.of("*")), 100).listen(sink);

    assertEquals(0, sleeps.get());
    assertFalse(Thread.currentThread().isInterrupted());
    assertEquals(0, sink.size());
  }

  @Test
  void testListenRejectsInvalidImapConfig() {
    EmailChannelConfig cfg =
        EmailChannelConfig.builder().imap(ImapConfig.builder().build()).fromAddress("bot@example.com").build();

    assertThrows(ConfigurationException.class, () -> new EmailChannel(cfg).listen(new QueueMessageSink(1)));
  }

  @Test
  void testListenRejectsNullImapSection() throws Exception {
    EmailChannelConfig cfg =
        new EmailChannelConfig(null, null, "bot@example.com", 60L, new ArrayList<>(), null);

    assertThrows(ConfigurationException.class, () -> new EmailChannel(cfg).listen(new QueueMessageSink(1)));
    assertFalse(new EmailChannel(cfg).healthCheck());
  }

  // ===================== send =====================

  @Test
  void testSendThreadedReply() throws Exception {
    ThreadMeta thread = new ThreadMeta("<id@example.com>", "Question");
    String recipient = ThreadMetaCodec.compose("alice@example.com", thread);

    channel(config("bot@example.com", List.of()), 1).send("**ok**", recipient);

    assertEquals(1, delivered.size());
    MimeMessage msg = delivered.get(0);
    assertEquals("Re: Question", msg.getSubject());
    assertEquals("<id@example.com>", msg.getHeader("In-Reply-To", null));
    assertEquals("alice@example.com", msg.getAllRecipients()[0].toString());
  }

  @Test
  void testSendLegacyRecipient() throws Exception {
    ThreadMeta thread = new ThreadMeta("<id@example.com>", "Re: Old");
    String recipient =
        "alice@example.com" + ThreadMetaCodec.SEP + "12345" + ThreadMetaCodec.SEP
            + ThreadMetaCodec.encode(thread).orElseThrow();

    channel(config("bot@example.com", List.of()), 1).send("hi", recipient);

    assertEquals("Re: Old", delivered.get(0).getSubject());
  }

  @Test
  void testSendRejectsInvalidAddresses() {
    assertThrows(
        ConfigurationException.class,
        () -> channel(config("bot@example.com", List.of()), 1).send("hi", "aliceexample.com"));
    assertThrows(
        ConfigurationException.class,
        () -> channel(config("not-an-address", List.of()), 1).send("hi", "alice@example.com"));
    assertTrue(delivered.isEmpty());
  }

  @Test
  void testSendSurfacesSmtpFailure() {
    smtpReachable = false;

    assertThrows(
        MailProtocolException.class,
        () -> channel(config("bot@example.com", List.of()), 1).send("hi", "alice@example.com"));
  }

  // ===================== healthCheck =====================

  @Test
  void testHealthy() {
    assertTrue(channel(config("bot@example.com", List.of()), 1).healthCheck());
  }

  @Test
  void testUnhealthyFromAddress() {
    assertFalse(channel(config("bot.example.com", List.of()), 1).healthCheck());
  }

  @Test
  void testUnhealthyImap() {
    imapReachable = false;
    assertFalse(channel(config("bot@example.com", List.of()), 1).healthCheck());
  }

  @Test
  void testUnhealthySmtp() {
    smtpReachable = false;
    assertFalse(channel(config("bot@example.com", List.of()), 1).healthCheck());
  }

  @Test
  void testUnhealthyWhenSmtpConfigInvalid() {
    EmailChannelConfig cfg =
        EmailChannelConfig.builder()
            .imap(IMAP)
            .smtp(SmtpConfig.builder().build())
            .fromAddress("bot@example.com")
            .build();

    EmailChannel real =
        new EmailChannel(cfg) {
          @Override
          ImapPoller imapPoller() {
            return new ImapPoller(IMAP, new MailParser()) {
              @Override
              public void checkConnectivity() {}
            };
          }
        };

    assertFalse(real.healthCheck());
  }
}
