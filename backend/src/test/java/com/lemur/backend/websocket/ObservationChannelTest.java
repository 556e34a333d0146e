package com.lemur.backend.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lemur.backend.model.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ObservationChannelTest {

    private ObservationChannel channel;
    private WebSocketSession socket;

    @BeforeEach
    void setUp() {
        channel = new ObservationChannel(new ObjectMapper());
        socket = mock(WebSocketSession.class);
        when(socket.isOpen()).thenReturn(true);
        when(socket.getId()).thenReturn("ws-1");
    }

    @Test
    void shouldSendSerializedEvent() throws Exception {
        channel.connect("s1", socket);

        boolean sent = channel.send("s1", AgentWireMessage.applyEdit("<p>x</p>", "done", 1));

        assertTrue(sent);
        ArgumentCaptor<TextMessage> frame = ArgumentCaptor.forClass(TextMessage.class);
        verify(socket).sendMessage(frame.capture());
        assertEquals("{\"type\":\"apply_edit\",\"html\":\"<p>x</p>\",\"message\":\"done\",\"iteration\":1}",
                frame.getValue().getPayload());
    }

    @Test
    void shouldOmitAbsentFieldsFromTerminalEvents() throws Exception {
        channel.connect("s1", socket);

        channel.send("s1", AgentWireMessage.completed("Task completed"));

        ArgumentCaptor<TextMessage> frame = ArgumentCaptor.forClass(TextMessage.class);
        verify(socket).sendMessage(frame.capture());
        assertEquals("{\"type\":\"completed\",\"message\":\"Task completed\"}", frame.getValue().getPayload());
    }

    @Test
    void shouldReturnFalseWhenNotConnected() {
        assertFalse(channel.send("missing", AgentWireMessage.error("boom")));
    }

    @Test
    void shouldDisconnectWhenSendFails() throws Exception {
        doThrow(new IOException("broken pipe")).when(socket).sendMessage(any());
        channel.connect("s1", socket);

        boolean sent = channel.send("s1", AgentWireMessage.error("boom"));

        assertFalse(sent);
        assertFalse(channel.isConnected("s1"));
        verify(socket).close(CloseStatus.NORMAL);
    }

    @Test
    void shouldDisconnectIdempotently() throws Exception {
        channel.connect("s1", socket);

        channel.disconnect("s1");
        channel.disconnect("s1");

        assertFalse(channel.isConnected("s1"));
        verify(socket, times(1)).close(CloseStatus.NORMAL);
    }

    @Test
    void shouldOnlyDisconnectMatchingSocket() {
        WebSocketSession other = mock(WebSocketSession.class);
        channel.connect("s1", socket);

        assertFalse(channel.disconnectIfCurrent("s1", other));
        assertTrue(channel.isConnected("s1"));
        assertTrue(channel.disconnectIfCurrent("s1", socket));
        assertFalse(channel.isConnected("s1"));
    }

    @Test
    void shouldReceiveDeliveredObservation() throws Exception {
        channel.connect("s1", socket);
        channel.deliver("s1", "{\"type\":\"observation\",\"data\":{\"summary\":\"Looks good\",\"screenshot\":\"aGk=\"}}");

        Optional<Observation> observation = channel.receiveWithTimeout("s1", Duration.ofSeconds(1));

        assertTrue(observation.isPresent());
        assertEquals("Looks good", observation.get().summary());
        assertEquals("aGk=", observation.get().screenshot());
    }

    @Test
    void shouldTimeOutWithoutObservation() throws Exception {
        channel.connect("s1", socket);

        assertTrue(channel.receiveWithTimeout("s1", Duration.ofMillis(50)).isEmpty());
    }

    @Test
    void shouldReturnEmptyWhenNotConnected() throws Exception {
        assertTrue(channel.receiveWithTimeout("missing", Duration.ofSeconds(5)).isEmpty());
    }

    @Test
    void shouldIgnoreOtherMessageTypes() throws Exception {
        channel.connect("s1", socket);
        channel.deliver("s1", "{\"type\":\"ping\"}");
        channel.deliver("s1", "not json");

        assertTrue(channel.receiveWithTimeout("s1", Duration.ofSeconds(1)).isEmpty());
        assertTrue(channel.receiveWithTimeout("s1", Duration.ofSeconds(1)).isEmpty());
    }

    @Test
    void shouldDropFramesBeyondInboxCapacity() throws Exception {
        channel.connect("s1", socket);
        for (int i = 0; i < ObservationChannel.INBOX_CAPACITY + 5; i++) {
            channel.deliver("s1", "{\"type\":\"observation\",\"data\":{\"summary\":\"frame " + i + "\"}}");
        }

        for (int i = 0; i < ObservationChannel.INBOX_CAPACITY; i++) {
            Optional<Observation> observation = channel.receiveWithTimeout("s1", Duration.ofMillis(100));
            assertTrue(observation.isPresent());
            assertEquals("frame " + i, observation.get().summary());
        }
        assertTrue(channel.receiveWithTimeout("s1", Duration.ofMillis(50)).isEmpty());
    }

    @Test
    void shouldNotInterleaveConcurrentSends() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicBoolean overlapped = new AtomicBoolean(false);
        doAnswer(invocation -> {
            if (inFlight.incrementAndGet() > 1) {
                overlapped.set(true);
            }
            Thread.sleep(5);
            inFlight.decrementAndGet();
            return null;
        }).when(socket).sendMessage(any());
        channel.connect("s1", socket);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(20);
        for (int i = 0; i < 20; i++) {
            int iteration = i;
            pool.execute(() -> {
                channel.send("s1", AgentWireMessage.applyEdit("<p>" + iteration + "</p>", "m", iteration));
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();
        assertFalse(overlapped.get());
        verify(socket, times(20)).sendMessage(any());
    }
}
