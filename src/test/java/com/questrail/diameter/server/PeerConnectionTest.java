package com.questrail.diameter.server;

import com.questrail.diameter.codec.DiameterHeader;
import com.questrail.diameter.codec.impl.DefaultHeaderCodec;
import com.questrail.diameter.config.DiameterServerConfig;
import com.questrail.diameter.dict.StaticDictionary;
import com.questrail.diameter.message.Message;
import com.questrail.diameter.message.MessageReadException;
import com.questrail.diameter.message.TestMessages;
import com.questrail.diameter.observability.DiameterErrorEvent;
import com.questrail.diameter.observability.RecordingObservabilitySink;
import com.questrail.diameter.transport.FakePeerChannel;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PeerConnectionTest
 * -----------------------------------------------------------------------------
 * Serving loop behaviour of a single endpoint over a scripted channel.
 *
 * <ul>
 *   <li>sequential dispatch and clean end of stream</li>
 *   <li>read failures routed to an error reporter or to the sink</li>
 *   <li>handler faults contained to the connection</li>
 *   <li>read and write deadlines passed per operation</li>
 * </ul>
 *
 * Most tests run the connection on the test thread: the script ends the
 * stream, so {@link PeerConnection#run()} returns on its own.
 */
final class PeerConnectionTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final AtomicInteger exits = new AtomicInteger();

    private DiameterServerConfig.Builder config(Handler handler) {
        return DiameterServerConfig.builder()
                .withHandler(handler)
                .withObservabilitySink(sink);
    }

    private PeerConnection connection(FakePeerChannel channel, DiameterServerConfig config) {
        return new PeerConnection(channel, config, c -> exits.incrementAndGet());
    }

    private static byte[] cer() {
        return TestMessages.capabilitiesExchangeRequest().toBytes();
    }

    @Test
    void messagesAreDispatchedInOrderAndEofEndsQuietly()
    {
        List<Integer> codes = Collections.synchronizedList(new ArrayList<>());
        FakePeerChannel channel = new FakePeerChannel()
                .thenFrame(cer())
                .thenFrame(TestMessages.request(0, 280, StaticDictionary.baseProtocol(), new byte[8]).toBytes())
                .thenFrame(TestMessages.request(0, 282, StaticDictionary.baseProtocol()).toBytes())
                .thenEnd();

        connection(channel, config((c, m) -> codes.add(m.header().commandCode())).build()).run();

        assertEquals(List.of(257, 280, 282), codes);
        assertTrue(sink.getErrors().isEmpty());
        assertEquals(1, exits.get());
        assertFalse(channel.isOpen());
    }

    @Test
    void handlerAnswerIsWrittenToTheChannel() throws Exception
    {
        Handler echoAnswer = (c, m) -> {
            DiameterHeader h = m.header();
            Message answer = Message.of(
                    h.withCommandFlags(h.commandFlags() & ~DiameterHeader.FLAG_REQUEST), new byte[] { 42 }, m.dictionary());
            try {
                assertEquals(21, c.write(answer));
            }
            catch (IOException e) {
                throw new IllegalStateException(e);
            }
        };
        FakePeerChannel channel = new FakePeerChannel().thenFrame(cer()).thenEnd();

        connection(channel, config(echoAnswer).build()).run();

        byte[] written = channel.writes().get(0);
        DiameterHeader answer = DefaultHeaderCodec.INSTANCE.decode(written);
        assertEquals("CEA", answer.commandName().abbrev());
        assertEquals(21, answer.messageLength());
        assertEquals(42, written[20]);
    }

    @Test
    void malformedMessageIsReportedToErrorReporter() throws Exception
    {
        ServeMux mux = new ServeMux();
        DiameterHeader tooShort = new DiameterHeader(1, 4, 0x80, 257, 0, 1, 2);
        FakePeerChannel channel = new FakePeerChannel()
                .thenFrame(DefaultHeaderCodec.INSTANCE.encode(tooShort));

        connection(channel, config(mux).build()).run();

        ErrorReport report = mux.errorReports().poll(Duration.ofSeconds(5)).orElseThrow();
        assertInstanceOf(MessageReadException.class, report.error());
        assertEquals(257, report.message().header().commandCode());
        assertFalse(channel.isOpen());
        assertTrue(sink.getErrors().isEmpty());
    }

    @Test
    void readFailureGoesToSinkWhenHandlerCannotReport()
    {
        byte[] badVersion = cer();
        badVersion[0] = 2;
        FakePeerChannel channel = new FakePeerChannel().thenFrame(badVersion);

        connection(channel, config((c, m) -> {}).build()).run();

        List<DiameterErrorEvent> errors = sink.getErrors();
        assertEquals(1, errors.size());
        assertEquals("Invalid diameter version 2", errors.get(0).cause().getMessage());
    }

    @Test
    void transportFailureIsReported()
    {
        ServeMux mux = new ServeMux();
        FakePeerChannel channel = new FakePeerChannel()
                .thenFrame(TestMessages.request(0, 280, StaticDictionary.baseProtocol()).toBytes())
                .thenFail(new SocketException("Connection reset"));
        mux.handle("DWR", (c, m) -> {});

        connection(channel, config(mux).build()).run();

        ErrorReport report = mux.errorReports().poll().orElseThrow();
        assertEquals("Connection reset", report.error().getMessage());
        assertNull(report.message());
    }

    @Test
    void everyMessageReadGetsTheFullReadTimeout()
    {
        Duration timeout = Duration.ofMillis(300);
        FakePeerChannel channel = new FakePeerChannel()
                .thenFrame(cer())
                .thenFrame(cer())
                .thenEnd();

        connection(channel, config((c, m) -> {}).withReadTimeout(timeout).build()).run();

        assertEquals(List.of(timeout, timeout, timeout), channel.readTimeouts());
    }

    @Test
    void readTimeoutEndsIdleConnectionWithReport()
    {
        ServeMux mux = new ServeMux();
        FakePeerChannel channel = new FakePeerChannel();

        connection(channel, config(mux).withReadTimeout(Duration.ofMillis(50)).build()).run();

        ErrorReport report = mux.errorReports().poll().orElseThrow();
        assertInstanceOf(SocketTimeoutException.class, report.error());
        assertFalse(channel.isOpen());
    }

    @Test
    void handlerFaultClosesOnlyThisConnection() throws Exception
    {
        CountDownLatch served = new CountDownLatch(1);
        FakePeerChannel faulty = new FakePeerChannel().thenFrame(cer());
        FakePeerChannel healthy = new FakePeerChannel();
        Thread good = new Thread(
                connection(healthy, config((c, m) -> served.countDown()).build()), "test-conn");
        good.start();

        connection(faulty, config((c, m) -> {
            throw new IllegalStateException("boom");
        }).build()).run();
        assertFalse(faulty.isOpen());

        healthy.thenFrame(cer());
        assertTrue(served.await(5, TimeUnit.SECONDS));
        assertTrue(good.isAlive());
        assertTrue(healthy.isOpen());

        List<DiameterErrorEvent> errors = sink.getErrors();
        assertEquals(1, errors.size());
        assertInstanceOf(IllegalStateException.class, errors.get(0).cause());

        healthy.thenEnd();
        good.join(5000);
    }

    @Test
    void errorThrownByHandlerIsAlsoContained()
    {
        FakePeerChannel channel = new FakePeerChannel().thenFrame(cer());

        connection(channel, config((c, m) -> {
            throw new AssertionError("handler bug");
        }).build()).run();

        assertEquals(1, exits.get());
        assertFalse(channel.isOpen());
        assertInstanceOf(AssertionError.class, sink.getErrors().get(0).cause());
    }

    @Test
    void closeFromHandlerEndsConnectionWithoutReport()
    {
        ServeMux mux = new ServeMux();
        mux.handle("DPR", (c, m) -> c.close());
        FakePeerChannel channel = new FakePeerChannel()
                .thenFrame(TestMessages.request(0, 282, StaticDictionary.baseProtocol()).toBytes())
                .thenFail(new SocketException("Socket closed"));

        connection(channel, config(mux).build()).run();

        assertTrue(mux.errorReports().poll().isEmpty());
        assertTrue(sink.getErrors().isEmpty());
    }

    @Test
    void writeTimeoutFailsOnlyTheWrite()
    {
        Duration writeTimeout = Duration.ofMillis(200);
        AtomicReference<IOException> writeFailure = new AtomicReference<>();
        List<Integer> served = Collections.synchronizedList(new ArrayList<>());
        ServeMux mux = new ServeMux();
        mux.handle("CER", (c, m) -> {
            served.add(m.header().commandCode());
            try {
                c.write(m);
            }
            catch (IOException e) {
                writeFailure.set(e);
            }
        });
        mux.handle("DWR", (c, m) -> served.add(m.header().commandCode()));
        FakePeerChannel channel = new FakePeerChannel()
                .failNextWrite(new SocketTimeoutException("write deadline of 200ms exceeded"))
                .thenFrame(cer())
                .thenFrame(TestMessages.request(0, 280, StaticDictionary.baseProtocol()).toBytes())
                .thenEnd();

        connection(channel, config(mux).withWriteTimeout(writeTimeout).build()).run();

        assertInstanceOf(SocketTimeoutException.class, writeFailure.get());
        assertEquals(List.of(257, 280), served, "serving continued after the failed write");
        assertEquals(List.of(writeTimeout), channel.writeTimeouts());
        assertTrue(mux.errorReports().poll().isEmpty());
        assertTrue(sink.getErrors().isEmpty());
    }

    @Test
    void failedHandshakeClosesWithoutDispatching()
    {
        AtomicInteger served = new AtomicInteger();
        FakePeerChannel channel = new FakePeerChannel()
                .failHandshake(new SSLHandshakeException("bad certificate"))
                .thenFrame(cer());

        connection(channel, config((c, m) -> served.incrementAndGet()).build()).run();

        assertEquals(0, served.get());
        assertFalse(channel.isOpen());
        assertTrue(sink.getErrors().isEmpty());
    }

    @Test
    void closeNotifyCompletesOnceWhenTheChannelCloses()
    {
        FakePeerChannel channel = new FakePeerChannel();
        PeerConnection connection = connection(channel, config((c, m) -> {}).build());
        AtomicInteger fired = new AtomicInteger();

        CloseNotifier notifier = (CloseNotifier) connection.conn();
        notifier.closeNotify().thenRun(fired::incrementAndGet);
        assertEquals(0, fired.get());

        channel.close();
        channel.close();
        assertEquals(1, fired.get());

        notifier.closeNotify().thenRun(fired::incrementAndGet);
        assertEquals(2, fired.get(), "a late subscriber sees the completed signal");
    }

    @Test
    void connectionLifecycleIsObserved()
    {
        FakePeerChannel channel = new FakePeerChannel().thenEnd();

        connection(channel, config((c, m) -> {}).build()).run();

        assertEquals(1, sink.eventsOfType(RecordingObservabilitySink.Opened.class).size());
        assertEquals(1, sink.eventsOfType(RecordingObservabilitySink.Closed.class).size());
    }
}
