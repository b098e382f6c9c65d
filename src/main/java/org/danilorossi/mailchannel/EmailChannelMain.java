package org.danilorossi.mailchannel;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailchannel.channel.ChannelException;
import org.danilorossi.mailchannel.channel.QueueMessageSink;
import org.danilorossi.mailchannel.db.ConfigStore;
import org.danilorossi.mailchannel.helpers.LangUtils;
import org.danilorossi.mailchannel.helpers.LogConfigurator;
import org.danilorossi.mailchannel.helpers.SingleInstanceLock;
import org.danilorossi.mailchannel.helpers.SingleInstanceLock.AlreadyRunningException;

@Log
public class EmailChannelMain {

  static {
    LogConfigurator.configLog(log);
  }

  private static final int SINK_CAPACITY = 100;

  public static void main(String[] args) throws IOException {
    val opts = Arrays.asList(args);
    if (opts.contains("-help") || opts.contains("--help") || opts.contains("-h")) {
      printUsage();
      return;
    }

    int code;
    try (val ignored = SingleInstanceLock.acquire()) {
      LangUtils.info(log, "Lock acquisito su {}", SingleInstanceLock.defaultLockPath());
      code = run(opts);
    } catch (AlreadyRunningException busy) {
      LangUtils.warn(log, "Canale email già in esecuzione: {}", busy.getMessage());
      code = 3;
    }
    System.exit(code);
  }

  static int run(final List<String> opts) {
    final EmailChannel channel;
    try {
      channel = new EmailChannel(new ConfigStore().load());
    } catch (IOException e) {
      LangUtils.err(log, "Impossibile caricare la configurazione: {}", LangUtils.exMsg(e));
      System.err.println("Modello di configurazione:");
      System.err.println(ConfigStore.template());
      return 2;
    }

    if (opts.contains("-check")) {
      val healthy = channel.healthCheck();
      System.out.println(healthy ? "canale email: OK" : "canale email: non raggiungibile");
      return healthy ? 0 : 1;
    }

    val sendAt = opts.indexOf("-send");
    if (sendAt >= 0) {
      if (opts.size() < sendAt + 3) {
        printUsage();
        return 2;
      }
      try {
        channel.send(opts.get(sendAt + 2), opts.get(sendAt + 1));
        return 0;
      } catch (ChannelException e) {
        LangUtils.err(log, "Invio fallito: {}", LangUtils.exMsg(e));
        return 1;
      }
    }

    return listenAndLog(channel);
  }

  /** Ascolta in background e logga ogni messaggio ricevuto finché il processo non termina. */
  private static int listenAndLog(final EmailChannel channel) {
    val sink = new QueueMessageSink(SINK_CAPACITY);
    val listener =
        new Thread(
            () -> {
              try {
                channel.listen(sink);
              } catch (ChannelException e) {
                LangUtils.err(log, "Canale email fermato: {}", LangUtils.exMsg(e));
              } finally {
                sink.close();
              }
            },
            "email-channel-listener");
    listener.start();

    try {
      while (listener.isAlive() || sink.size() > 0) {
        val msg = sink.poll(1, TimeUnit.SECONDS);
        if (msg != null)
          LangUtils.info(
              log, "[{}] {} da {}: {}", msg.getChannel(), msg.getTimestamp(), msg.getSender(), msg.getContent());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      sink.close();
    }
    return 0;
  }

  private static void printUsage() {
    System.out.println("Utilizzo: java -jar mailchannel.jar [opzione]");
    System.out.println("Opzioni:");
    System.out.println("  -help                          Mostra questo messaggio di aiuto");
    System.out.println("  -check                         Verifica la connessione IMAP/SMTP ed esce");
    System.out.println("  -send <destinatario> <testo>   Invia una risposta (testo markdown)");
    System.out.println("  (nessuna)                      Controlla la casella e logga i messaggi in arrivo");
  }
}
