// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream.server;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import io.grpc.*;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.*;
import pl.morgwai.base.grpc.echostream.BlockingResponseObserver;
import pl.morgwai.base.grpc.echostream.BlockingResponseObserver.ErrorReportedException;
import pl.morgwai.base.grpc.echostream.GrpcTermination;
import pl.morgwai.base.grpc.echostream.api.EchoRequest;
import pl.morgwai.base.grpc.echostream.api.EchoResponse;
import pl.morgwai.base.grpc.echostream.api.EchoServiceGrpc;
import pl.morgwai.base.grpc.echostream.client.EchoStreamClient;
import pl.morgwai.base.grpc.echostream.client.LoggingClientInterceptor;

import static org.junit.Assert.*;



public class EchoStreamServiceTest {



	static final long TIMEOUT_MILLIS = 5000L;

	ExecutorService callExecutor;
	ExecutorService stageExecutor;
	EchoStreamService service;
	Server server;
	ManagedChannel channel;
	EchoStreamClient client;



	void startServer(EchoStreamConfig config) throws Exception {
		callExecutor = Executors.newFixedThreadPool(config.getWorkers());
		stageExecutor = Executors.newCachedThreadPool();
		service = new EchoStreamService(config, callExecutor, stageExecutor);
		final var serverName = InProcessServerBuilder.generateName();
		server = InProcessServerBuilder.forName(serverName)
			.addService(ServerInterceptors.intercept(service, new LoggingServerInterceptor()))
			.build()
			.start();
		channel = InProcessChannelBuilder.forName(serverName)
			.intercept(new LoggingClientInterceptor())
			.build();
		client = new EchoStreamClient(channel, TIMEOUT_MILLIS);
	}

	static EchoStreamConfig.Builder fastConfig() {
		return EchoStreamConfig.newBuilder()
			.pollIntervalMillis(10L)
			.fanOutDelayMillis(1L)
			.processingDelayMillis(1L);
	}

	@After
	public void shutdown() throws InterruptedException {
		if (channel != null) GrpcTermination.enforceTermination(channel, 1L, TimeUnit.SECONDS);
		if (server != null) GrpcTermination.enforceTermination(server, 1L, TimeUnit.SECONDS);
		if (callExecutor != null) callExecutor.shutdownNow();
		if (stageExecutor != null) stageExecutor.shutdownNow();
	}

	static List<String> messagesOf(List<EchoResponse> responses) {
		return responses.stream().map(EchoResponse::getMessage).collect(Collectors.toList());
	}



	@Test
	public void testClientStream() throws Exception {
		startServer(fastConfig().build());

		final var response = client.echoClientStream(List.of("a", "b", "c"));

		assertEquals("Received 3 messages: [a, b, c]", response.getMessage());
	}



	@Test
	public void testClientStreamWithoutMessages() throws Exception {
		startServer(fastConfig().build());

		final var response = client.echoClientStream(List.of());

		assertEquals("Received 0 messages: []", response.getMessage());
	}



	@Test
	public void testServerStream() throws Exception {
		startServer(fastConfig().build());

		final var responses = client.echoServerStream("hello");

		assertEquals(
			List.of(
				"Echo #1: hello",
				"Echo #2: hello",
				"Echo #3: hello",
				"Echo #4: hello",
				"Echo #5: hello"
			),
			messagesOf(responses)
		);
	}



	@Test
	public void testBidirectionalStreamSync() throws Exception {
		startServer(fastConfig().build());

		final var responses = client.echoBidirectionalStreamSync(List.of("a", "b", "c"));

		assertEquals(List.of("Sync Echo: a", "Sync Echo: b", "Sync Echo: c"),
				messagesOf(responses));
	}



	@Test
	public void testBidirectionalStreamAsync() throws Exception {
		startServer(fastConfig().queueCapacity(2).build());
		final var inputData = List.of("a", "b", "c", "d", "e", "f", "g");

		final var responses = client.echoBidirectionalStreamAsync(inputData);

		assertEquals(
			inputData.stream()
				.map((message) -> "Async Echo (processed): " + message)
				.collect(Collectors.toList()),
			messagesOf(responses)
		);
	}



	@Test
	public void testAllPatternsConcurrently() throws Exception {
		startServer(fastConfig().build());
		final var clientExecutor = Executors.newFixedThreadPool(3);
		try {
			final var runs = List.of(
				clientExecutor.submit(() -> client.runAll(1, 3)),
				clientExecutor.submit(() -> client.runAll(2, 3)),
				clientExecutor.submit(() -> client.runAll(3, 3))
			);
			for (var run: runs) {
				assertEquals("no pattern should fail", Integer.valueOf(0),
						run.get(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS));
			}
		} finally {
			clientExecutor.shutdownNow();
		}
	}



	@Test
	public void testExcessCallRejected() throws Exception {
		startServer(fastConfig().workers(2).maxConcurrentCalls(1).build());
		final var stub = EchoServiceGrpc.newStub(channel);
		final var openCall = new BlockingResponseObserver<EchoRequest, EchoResponse>();
		stub.echoBidirectionalStreamSync(openCall);
		final var deadlineMillis = System.currentTimeMillis() + TIMEOUT_MILLIS;
		while (service.getAvailableCallSlots() > 0 && System.currentTimeMillis() < deadlineMillis) {
			Thread.sleep(5L);
		}
		assertEquals("1st call should occupy the only slot", 0, service.getAvailableCallSlots());

		try {
			client.echoServerStream("rejected");
			fail("excess call should be rejected");
		} catch (ErrorReportedException e) {
			assertEquals(Status.Code.RESOURCE_EXHAUSTED,
					Status.fromThrowable(e.getCause()).getCode());
		}

		openCall.cancel("test finished");
		try {
			openCall.awaitCompletion(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
		} catch (ErrorReportedException expected) {}
	}



	@Test
	public void testClientCancelReleasesSlot() throws Exception {
		startServer(fastConfig().build());
		final var stub = EchoServiceGrpc.newStub(channel);
		final var openCall = new BlockingResponseObserver<EchoRequest, EchoResponse>();
		stub.echoBidirectionalStreamAsync(openCall);
		final var deadlineMillis = System.currentTimeMillis() + TIMEOUT_MILLIS;
		while (service.getAvailableCallSlots() == 10 && System.currentTimeMillis() < deadlineMillis) {
			Thread.sleep(5L);
		}

		openCall.cancel("simulated client disappearance");
		try {
			openCall.awaitCompletion(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
		} catch (ErrorReportedException expected) {}
		while (service.getAvailableCallSlots() < 10 && System.currentTimeMillis() < deadlineMillis) {
			Thread.sleep(5L);
		}
		assertEquals("slot should be released after cancellation", 10,
				service.getAvailableCallSlots());
	}



	static Level LOG_LEVEL = Level.SEVERE;

	@BeforeClass
	public static void setupLogging() {
		try {
			LOG_LEVEL = Level.parse(System.getProperty(
					EchoStreamServiceTest.class.getPackageName() + ".level"));
		} catch (Exception ignored) {}
		Logger.getLogger("pl.morgwai.base.grpc.echostream").setLevel(LOG_LEVEL);
		for (final var handler: Logger.getLogger("").getHandlers()) handler.setLevel(LOG_LEVEL);
	}
}
