package org.danilorossi.mailchannel.mail;

import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.search.FlagTerm;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailchannel.helpers.LangUtils;
import org.danilorossi.mailchannel.helpers.LogConfigurator;
import org.danilorossi.mailchannel.helpers.MailUtils;
import org.danilorossi.mailchannel.model.ImapConfig;
import org.danilorossi.mailchannel.model.InboundEmail;

/**
 * Un ciclo IMAP completo e bloccante: connessione, login, SELECT, SEARCH UNSEEN, fetch di ogni
 * messaggio, flag \Seen, logout.
 *
 * <p>Tutto o niente: un errore prima della fine del fetch fa fallire l'intero ciclo e i messaggi
 * già scaricati vengono scartati. Un errore nel marcare un messaggio come letto invece si logga e
 * basta.
 */
@Log
public class ImapPoller {

  static {
    LogConfigurator.configLog(log);
  }

  private static final FlagTerm UNSEEN = new FlagTerm(new Flags(Flags.Flag.SEEN), false);

  private final ImapConfig config;
  private final MailParser parser;

  public ImapPoller(@NonNull final ImapConfig config, @NonNull final MailParser parser) {
    this.config = config;
    this.parser = parser;
  }

  /** Store connesso e autenticato. */
  Store connectStore() throws MessagingException {
    val session = Session.getInstance(config.toProperties());
    val store = session.getStore(config.getStoreProtocol());
    store.connect(config.getHost(), config.getPort(), config.getUsername(), config.getPassword());
    return store;
  }

  /** Messaggi non letti nell'ordine restituito dal server. */
  public List<InboundEmail> pollUnseen() throws MessagingException, IOException {
    val store = connectStore();
    try {
      val folder = store.getFolder(config.getInboxFolder());
      folder.open(Folder.READ_WRITE);
      try {
        return fetchUnseen(folder);
      } finally {
        closeFolder(folder);
      }
    } finally {
      closeStore(store);
    }
  }

  private List<InboundEmail> fetchUnseen(@NonNull final Folder folder)
      throws MessagingException, IOException {
    val unseen = folder.search(UNSEEN);
    if (unseen == null || unseen.length == 0) {
      LangUtils.debug(log, "No unseen messages in {}", config.getInboxFolder());
      return List.of();
    }

    // prefetch per ridurre i roundtrip
    val fp = new FetchProfile();
    fp.add(UIDFolder.FetchProfileItem.UID);
    fp.add(FetchProfile.Item.FLAGS);
    folder.fetch(unseen, fp);

    LangUtils.info(log, "Trovati {} messaggi non letti in {}", unseen.length, config.getInboxFolder());

    val out = new ArrayList<InboundEmail>(unseen.length);
    for (val message : unseen) {
      val uid = uidOf(folder, message);
      val raw = MailUtils.toRfc822Bytes(message);
      parser.parse(uid, raw).ifPresent(out::add);
      markSeen(message, uid);
    }
    return out;
  }

  /** SELECT della cartella e logout; eccezione se login o SELECT falliscono. */
  public void checkConnectivity() throws MessagingException {
    val store = connectStore();
    try {
      val folder = store.getFolder(config.getInboxFolder());
      folder.open(Folder.READ_ONLY);
      closeFolder(folder);
    } finally {
      closeStore(store);
    }
  }

  static String uidOf(@NonNull final Folder folder, @NonNull final Message message)
      throws MessagingException {
    if (folder instanceof UIDFolder uidFolder) {
      val uid = uidFolder.getUID(message);
      if (uid > 0) return String.valueOf(uid);
    }
    return String.valueOf(message.getMessageNumber());
  }

  private static void markSeen(final Message message, final String uid) {
    try {
      message.setFlag(Flags.Flag.SEEN, true);
    } catch (MessagingException | RuntimeException e) {
      LangUtils.warn(log, "Impossibile marcare come letto UID {}: {}", uid, LangUtils.exMsg(e));
    }
  }

  private static void closeFolder(final Folder folder) {
    try {
      if (folder.isOpen()) folder.close(false);
    } catch (MessagingException | RuntimeException e) {
      LangUtils.debug(log, "IMAP folder close failed: {}", LangUtils.exMsg(e));
    }
  }

  private static void closeStore(final Store store) {
    try {
      store.close();
    } catch (MessagingException | RuntimeException e) {
      LangUtils.debug(log, "IMAP logout failed: {}", LangUtils.exMsg(e));
    }
  }
}
