package org.danilorossi.mailchannel.channel;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class QueueMessageSinkTest {

  private static ChannelMessage msg(String id) {
    return ChannelMessage.builder()
        .id(id)
        .sender("alice@example.com")
        .content("hi")
        .channel("email")
        .timestamp(1L)
        .build();
  }

  @Test
  void testSendAndPollInOrder() throws Exception {
    QueueMessageSink sink = new QueueMessageSink(5);

    assertTrue(sink.send(msg("1")));
    assertTrue(sink.send(msg("2")));

    assertEquals(2, sink.size());
    assertEquals("1", sink.poll(10, TimeUnit.MILLISECONDS).getId());
    assertEquals("2", sink.poll(10, TimeUnit.MILLISECONDS).getId());
    assertNull(sink.poll(10, TimeUnit.MILLISECONDS));
  }

  @Test
  void testSendAfterCloseReturnsFalse() throws Exception {
    QueueMessageSink sink = new QueueMessageSink(5);
    sink.close();

    assertTrue(sink.isClosed());
    assertFalse(sink.send(msg("1")));
    assertEquals(0, sink.size());
  }

  @Test
  void testCloseReleasesBlockedProducer() throws Exception {
    QueueMessageSink sink = new QueueMessageSink(1);
    assertTrue(sink.send(msg("1")));

    AtomicBoolean result = new AtomicBoolean(true);
    CountDownLatch started = new CountDownLatch(1);
    Thread producer =
        new Thread(
            () -> {
              started.countDown();
              try {
                result.set(sink.send(msg("2")));
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
    producer.start();
    assertTrue(started.await(1, TimeUnit.SECONDS));

    sink.close();
    producer.join(2_000);

    assertFalse(producer.isAlive());
    assertFalse(result.get());
  }

  @Test
  void testConsumerMakesRoomForProducer() throws Exception {
    QueueMessageSink sink = new QueueMessageSink(1);
    assertTrue(sink.send(msg("1")));

    AtomicBoolean result = new AtomicBoolean(false);
    Thread producer =
        new Thread(
            () -> {
              try {
                result.set(sink.send(msg("2")));
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
    producer.start();

    assertEquals("1", sink.poll(1, TimeUnit.SECONDS).getId());
    producer.join(2_000);

    assertTrue(result.get());
    assertEquals("2", sink.poll(1, TimeUnit.SECONDS).getId());
  }

  @Test
  void testInvalidCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new QueueMessageSink(0));
  }
}
