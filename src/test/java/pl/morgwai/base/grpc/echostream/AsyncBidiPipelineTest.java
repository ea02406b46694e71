// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.google.common.collect.Comparators;
import io.grpc.Status;
import io.grpc.StatusException;
import org.junit.*;

import static org.junit.Assert.*;
import static pl.morgwai.base.grpc.echostream.StreamSession.State.*;



public class AsyncBidiPipelineTest {



	static final long POLL_INTERVAL_MILLIS = 10L;
	static final long JOIN_TIMEOUT_MILLIS = 1000L;
	static final MessageTransformer<String, String> ECHO = (message) -> "Async Echo: " + message;

	StreamSession session;
	FakeDuplexStream<String, String> stream;
	ExecutorService stageExecutor;

	@Before
	public void setup() {
		session = new StreamSession("asyncBidi");
		stream = new FakeDuplexStream<>(session.getCancellationSignal());
		stageExecutor = Executors.newCachedThreadPool();
	}

	@After
	public void shutdownExecutor() {
		stageExecutor.shutdownNow();
	}

	AsyncBidiPipeline<String, String> newPipeline(
		MessageTransformer<String, String> transformer,
		int queueCapacity,
		long processingDelayMillis
	) {
		return new AsyncBidiPipeline<>(session, stream, transformer, stageExecutor, queueCapacity,
				POLL_INTERVAL_MILLIS, processingDelayMillis, JOIN_TIMEOUT_MILLIS);
	}

	static String[] inputData(int count) {
		return IntStream.rangeClosed(1, count)
			.mapToObj((i) -> "msg-" + i)
			.toArray(String[]::new);
	}



	static int ordinalOf(String response) {
		return Integer.parseInt(response.substring(response.lastIndexOf('-') + 1));
	}



	@Test
	public void testOrderPreserved() {
		final var inputData = inputData(20);
		stream.deliver(inputData);
		stream.halfClose();

		newPipeline(ECHO, 3, 0L).run();

		assertEquals(
			List.of(inputData).stream().map((m) -> "Async Echo: " + m).collect(Collectors.toList()),
			stream.outputData
		);
		assertTrue(stream.isCompleted());
		assertEquals(1, stream.getFinalizationCount());
		assertEquals(CLOSED, session.getState());
		assertEquals(20L, session.getRequestCount());
		assertEquals(20L, session.getResponseCount());
	}



	@Test
	public void testQueuesStayBoundedWithSlowPeer() {
		stream.deliver(inputData(30));
		stream.halfClose();
		stream.setSendDelayMillis(3L);
		final var pipeline = newPipeline(ECHO, 2, 0L);

		pipeline.run();

		assertEquals(30, stream.outputData.size());
		assertTrue("responses should be sent in order", Comparators.isInStrictOrder(
				stream.outputData, Comparator.comparingInt(AsyncBidiPipelineTest::ordinalOf)));
		assertTrue("inbound queue should never exceed its capacity",
				pipeline.getInboundQueue().getHighWaterMark() <= 2);
		assertTrue("outbound queue should never exceed its capacity",
				pipeline.getOutboundQueue().getHighWaterMark() <= 2);
		assertEquals(CLOSED, session.getState());
	}



	@Test
	public void testSameOutputAsSyncEcho() {
		final var inputData = inputData(7);
		stream.deliver(inputData);
		stream.halfClose();
		newPipeline(ECHO, 3, 1L).run();

		final var syncSession = new StreamSession("syncBidi");
		final var syncStream = new FakeDuplexStream<String, String>(
				syncSession.getCancellationSignal());
		syncStream.deliver(inputData);
		syncStream.halfClose();
		new SyncBidiEcho<>(syncSession, syncStream, ECHO).run();

		assertEquals(syncStream.outputData, stream.outputData);
	}



	@Test
	public void testEmptyStream() {
		stream.halfClose();
		final var pipeline = newPipeline(ECHO, 3, 0L);

		pipeline.run();

		assertTrue(stream.outputData.isEmpty());
		assertTrue(stream.isCompleted());
		assertTrue(pipeline.getInboundQueue().isEndOfStreamEnqueued());
		assertTrue(pipeline.getOutboundQueue().isEndOfStreamEnqueued());
	}



	@Test
	public void testPeerDisconnectStopsAllActivities() throws InterruptedException {
		stream.deliver(inputData(5));
		final var pipeline = newPipeline(ECHO, 3, 10_000L);
		final var worker = new Thread(pipeline);
		worker.start();
		Thread.sleep(100L);
		final var disconnectMillis = System.currentTimeMillis();
		stream.disconnect();
		worker.join(JOIN_TIMEOUT_MILLIS + 1000L);

		assertFalse("all activities should stop", worker.isAlive());
		assertTrue("activities should stop within a few poll intervals",
				System.currentTimeMillis() - disconnectMillis < 10 * POLL_INTERVAL_MILLIS + 100L);
		assertTrue("nothing should be sent while processing is paused",
				stream.outputData.isEmpty());
		assertEquals(0, stream.getSendsAfterDisconnect());
		assertEquals(0, stream.getFinalizationCount());
		assertEquals(CANCELLED, session.getState());
		assertTrue(pipeline.getInboundQueue().isEndOfStreamEnqueued());
		assertTrue(pipeline.getOutboundQueue().isEndOfStreamEnqueued());
	}



	@Test
	public void testNoSendAfterPeerDisconnects() {
		stream.deliver(inputData(10));
		stream.halfClose();
		stream.disconnectAfterSends(3);

		newPipeline(ECHO, 2, 1L).run();

		assertEquals(3, stream.outputData.size());
		assertEquals(0, stream.getSendsAfterDisconnect());
		assertEquals(CANCELLED, session.getState());
	}



	@Test
	public void testProcessingFailureAbortsWithInternal() {
		stream.deliver("ok", "bad", "never");
		stream.halfClose();

		newPipeline(
			(message) -> {
				if (message.equals("bad")) throw new ProcessingException("simulated failure");
				return message;
			},
			3,
			0L
		).run();

		assertFalse(stream.outputData.contains("never"));
		assertEquals(Status.Code.INTERNAL, stream.getAbortStatus().getCode());
		assertEquals(1, stream.getFinalizationCount());
		assertEquals(ERRORED, session.getState());
	}



	@Test
	public void testRejectedStageResultsInUnavailable() {
		stream.deliver("a");
		stream.halfClose();

		new AsyncBidiPipeline<>(
			session,
			stream,
			ECHO,
			(task) -> { throw new RejectedExecutionException("simulated rejection"); },
			3,
			POLL_INTERVAL_MILLIS,
			0L,
			JOIN_TIMEOUT_MILLIS
		).run();

		assertTrue(stream.outputData.isEmpty());
		assertEquals(Status.Code.UNAVAILABLE, stream.getAbortStatus().getCode());
		assertEquals(ERRORED, session.getState());
	}



	@Test
	public void testRejectedProcessingStageJoinsRunningIngestion() {
		stream.setReceiveDelayMillis(300L);
		final var acceptedCount = new AtomicInteger(0);
		final var pipeline = new AsyncBidiPipeline<>(
			session,
			stream,
			ECHO,
			(task) -> {
				if (acceptedCount.incrementAndGet() > 1) {
					throw new RejectedExecutionException("simulated rejection");
				}
				stageExecutor.execute(task);
			},
			3,
			POLL_INTERVAL_MILLIS,
			0L,
			JOIN_TIMEOUT_MILLIS
		);

		pipeline.run();

		assertTrue("ingestion should finish before the handler returns",
				pipeline.getInboundQueue().isEndOfStreamEnqueued());
		assertEquals(Status.Code.UNAVAILABLE, stream.getAbortStatus().getCode());
		assertEquals(ERRORED, session.getState());
	}



	@Test
	public void testReceiveFaultAbortsWithItsStatus() {
		stream.deliver("a", "b");
		stream.failReceive(Status.DATA_LOSS.withDescription("simulated transport failure"));
		final var pipeline = newPipeline(ECHO, 3, 0L);

		pipeline.run();

		assertTrue(stream.outputData.size() <= 2);
		assertEquals(Status.Code.DATA_LOSS, stream.getAbortStatus().getCode());
		assertEquals(1, stream.getFinalizationCount());
		assertEquals(ERRORED, session.getState());
		assertTrue(session.getCancellationSignal().getCause().get() instanceof StatusException);
		assertTrue(pipeline.getInboundQueue().isEndOfStreamEnqueued());
		assertTrue(pipeline.getOutboundQueue().isEndOfStreamEnqueued());
	}



	static Level LOG_LEVEL = Level.SEVERE;

	@BeforeClass
	public static void setupLogging() {
		try {
			LOG_LEVEL = Level.parse(System.getProperty(
					AsyncBidiPipelineTest.class.getPackageName() + ".level"));
		} catch (Exception ignored) {}
		Logger.getLogger(AsyncBidiPipeline.class.getName()).setLevel(LOG_LEVEL);
		for (final var handler: Logger.getLogger("").getHandlers()) handler.setLevel(LOG_LEVEL);
	}
}
