// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.stub.ClientCallStreamObserver;
import org.easymock.EasyMockSupport;
import org.junit.*;
import pl.morgwai.base.grpc.echostream.BlockingResponseObserver.ErrorReportedException;

import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.isNull;
import static org.junit.Assert.*;



public class BlockingResponseObserverTest extends EasyMockSupport {



	BlockingResponseObserver<String, String> responseObserver;
	List<String> handledResponses;
	ClientCallStreamObserver<String> requestObserver;



	@Before
	@SuppressWarnings("unchecked")
	public void setup() {
		handledResponses = new LinkedList<>();
		responseObserver = new BlockingResponseObserver<>((response) -> {
			if (log.isLoggable(Level.FINER)) log.finer("received " + response);
			handledResponses.add(response);
		});
		requestObserver = mock(ClientCallStreamObserver.class);
	}



	@Test
	public void testResponsesRecordedInOrder() throws InterruptedException, ErrorReportedException {
		final var worker = new Thread(() -> {
			try {
				Thread.sleep(10L);
			} catch (InterruptedException ignored) {}
			for (int i = 0; i < 10; i++) responseObserver.onNext("response-" + i);
			responseObserver.onCompleted();
		});

		worker.start();
		assertTrue("call should complete",
				responseObserver.awaitCompletion(1000L, TimeUnit.MILLISECONDS));
		worker.join(100L);

		assertTrue("response should be marked as completed", responseObserver.isCompleted());
		final var responses = responseObserver.getResponses();
		assertEquals("all responses should be recorded", 10, responses.size());
		for (int i = 0; i < 10; i++) assertEquals("response-" + i, responses.get(i));
		assertEquals("each response should be passed to the handler", responses,
				handledResponses);
	}



	@Test
	public void testOnError() throws InterruptedException {
		final Exception reportedError = new Exception("simulated");
		final var worker = new Thread(() -> {
			try {
				Thread.sleep(10L);
			} catch (InterruptedException ignored) {}
			responseObserver.onError(reportedError);
		});

		worker.start();
		try {
			responseObserver.awaitCompletion(1000L, TimeUnit.MILLISECONDS);
			fail("ErrorReportedException should be thrown");
		} catch (ErrorReportedException e) {
			assertSame("reported error should be the cause", reportedError, e.getCause());
		}
		worker.join(100L);

		assertTrue("response should be marked as completed", responseObserver.isCompleted());
		assertSame(reportedError, responseObserver.getError().get());
	}



	@Test
	public void testTimeout() throws InterruptedException, ErrorReportedException {
		final var startMillis = System.currentTimeMillis();

		assertFalse(responseObserver.awaitCompletion(50L, TimeUnit.MILLISECONDS));

		assertTrue("at least 50ms should pass", System.currentTimeMillis() - startMillis >= 50L);
		assertFalse("response should not be marked as completed", responseObserver.isCompleted());
	}



	@Test
	public void testCompletedBeforeAwait() throws InterruptedException, ErrorReportedException {
		responseObserver.onCompleted();

		assertTrue(responseObserver.awaitCompletion(1L, TimeUnit.MILLISECONDS));
	}



	@Test
	public void testBeforeStart() {
		final var requestObserverHolder = new Object[1];
		responseObserver = new BlockingResponseObserver<>(
			(response) -> {},
			(observer) -> requestObserverHolder[0] = observer
		);
		replayAll();

		responseObserver.beforeStart(requestObserver);

		assertSame("requestObserver passed to beforeStart should be passed to the handler",
				requestObserver, requestObserverHolder[0]);
		assertSame(requestObserver, responseObserver.getRequestObserver().get());
		verifyAll();
	}



	@Test
	public void testCancel() {
		requestObserver.cancel(eq("test cancel"), isNull());
		replayAll();

		responseObserver.beforeStart(requestObserver);
		responseObserver.cancel("test cancel");

		verifyAll();
	}



	@Test
	public void testCancelAfterCompletionHasNoEffect() {
		replayAll();

		responseObserver.beforeStart(requestObserver);
		responseObserver.onCompleted();
		responseObserver.cancel("too late");

		verifyAll();
	}



	// change the below value if you need logging
	// FINER will log every response received
	static Level LOG_LEVEL = Level.SEVERE;

	static final Logger log = Logger.getLogger(BlockingResponseObserverTest.class.getName());

	@BeforeClass
	public static void setupLogging() {
		try {
			LOG_LEVEL = Level.parse(System.getProperty(
					BlockingResponseObserverTest.class.getPackageName() + ".level"));
		} catch (Exception ignored) {}
		log.setLevel(LOG_LEVEL);
		for (final var handler: Logger.getLogger("").getHandlers()) handler.setLevel(LOG_LEVEL);
	}
}
