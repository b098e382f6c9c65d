package org.danilorossi.mailchannel.channel;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/** Bus in-process: coda limitata, il produttore si blocca quando è piena. */
public class QueueMessageSink implements MessageSink, AutoCloseable {

  private static final long OFFER_SLICE_MS = 200L;

  private final BlockingQueue<ChannelMessage> queue;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public QueueMessageSink(final int capacity) {
    if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
    this.queue = new LinkedBlockingQueue<>(capacity);
  }

  @Override
  public boolean send(final ChannelMessage message) throws InterruptedException {
    // offer a fette: una close() durante l'attesa sblocca il produttore
    while (!closed.get()) {
      if (queue.offer(message, OFFER_SLICE_MS, TimeUnit.MILLISECONDS)) return true;
    }
    return false;
  }

  /** Prossimo messaggio, o null allo scadere del timeout. */
  public ChannelMessage poll(final long timeout, final TimeUnit unit) throws InterruptedException {
    return queue.poll(timeout, unit);
  }

  public int size() {
    return queue.size();
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    closed.set(true);
  }
}
