// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream.client;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import io.grpc.Channel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.StreamObserver;
import pl.morgwai.base.grpc.echostream.BlockingResponseObserver;
import pl.morgwai.base.grpc.echostream.BlockingResponseObserver.ErrorReportedException;
import pl.morgwai.base.grpc.echostream.GrpcTermination;
import pl.morgwai.base.grpc.echostream.api.EchoRequest;
import pl.morgwai.base.grpc.echostream.api.EchoResponse;
import pl.morgwai.base.grpc.echostream.api.EchoServiceGrpc;
import pl.morgwai.base.grpc.echostream.api.EchoServiceGrpc.EchoServiceStub;
import pl.morgwai.base.grpc.echostream.server.EchoStreamConfig;
import pl.morgwai.base.grpc.echostream.server.EchoStreamServer;



/**
 * Calls all 4 methods of {@code EchoService}. Request streams are sent with respect to
 * flow-control.
 */
public class EchoStreamClient {



	final EchoServiceStub connector;
	final long timeoutMillis;



	public EchoStreamClient(Channel channel, long timeoutMillis) {
		connector = EchoServiceGrpc.newStub(channel);
		this.timeoutMillis = timeoutMillis;
	}



	public EchoResponse echoClientStream(List<String> messages)
			throws ErrorReportedException, InterruptedException, TimeoutException {
		final var responses = streamRequests(connector::echoClientStream, messages);
		if (responses.size() != 1) {
			throw new IllegalStateException("expected exactly 1 response, got " + responses.size());
		}
		return responses.get(0);
	}



	public List<EchoResponse> echoServerStream(String message)
			throws ErrorReportedException, InterruptedException, TimeoutException {
		final var responseObserver = new BlockingResponseObserver<EchoRequest, EchoResponse>();
		connector.echoServerStream(newRequest(message), responseObserver);
		return await(responseObserver);
	}



	public List<EchoResponse> echoBidirectionalStreamSync(List<String> messages)
			throws ErrorReportedException, InterruptedException, TimeoutException {
		return streamRequests(connector::echoBidirectionalStreamSync, messages);
	}



	public List<EchoResponse> echoBidirectionalStreamAsync(List<String> messages)
			throws ErrorReportedException, InterruptedException, TimeoutException {
		return streamRequests(connector::echoBidirectionalStreamAsync, messages);
	}



	/**
	 * Issues a call via {@code method}, sends {@code messages} whenever the request stream is ready
	 * and half-closes after the last one.
	 */
	List<EchoResponse> streamRequests(
		Function<StreamObserver<EchoResponse>, StreamObserver<EchoRequest>> method,
		List<String> messages
	) throws ErrorReportedException, InterruptedException, TimeoutException {
		final var sentCount = new AtomicInteger(0);
		final var responseObserver = new BlockingResponseObserver<EchoRequest, EchoResponse>(
			(response) -> {
				if (log.isLoggable(Level.FINE)) log.fine("received " + response.getMessage());
			},
			(ClientCallStreamObserver<EchoRequest> requestObserver) ->
					requestObserver.setOnReadyHandler(() -> {
				synchronized (sentCount) {
					if (sentCount.get() > messages.size()) return;  // already half-closed
					while (sentCount.get() < messages.size() && requestObserver.isReady()) {
						requestObserver.onNext(newRequest(messages.get(sentCount.getAndIncrement())));
					}
					if (sentCount.get() == messages.size()) {
						sentCount.incrementAndGet();
						requestObserver.onCompleted();
					}
				}
			})
		);
		method.apply(responseObserver);
		return await(responseObserver);
	}



	List<EchoResponse> await(BlockingResponseObserver<EchoRequest, EchoResponse> responseObserver)
			throws ErrorReportedException, InterruptedException, TimeoutException {
		if ( !responseObserver.awaitCompletion(timeoutMillis, TimeUnit.MILLISECONDS)) {
			responseObserver.cancel("no completion within " + timeoutMillis + "ms");
			throw new TimeoutException("call did not complete within " + timeoutMillis + "ms");
		}
		return responseObserver.getResponses();
	}



	static EchoRequest newRequest(String message) {
		return EchoRequest.newBuilder().setMessage(message).build();
	}



	/**
	 * Runs all 4 patterns as simulated client {@code clientId}.
	 * @return the number of failed patterns.
	 */
	public int runAll(int clientId, int numberOfMessages) throws InterruptedException {
		final var prefix = "[client-" + clientId + "] ";
		int failures = 0;
		try {
			final var response = echoClientStream(messages(
					"Hello from client-" + clientId + " message-", numberOfMessages));
			log.info(prefix + "client stream: " + response.getMessage());
		} catch (ErrorReportedException | TimeoutException | RuntimeException e) {
			failures++;
			log.warning(prefix + "client stream failed: " + describe(e));
		}
		try {
			final var responses = echoServerStream(
					"Hello from client-" + clientId + " for server stream");
			log.info(prefix + "server stream: " + responses.size() + " responses, last: "
					+ (responses.isEmpty() ? "none" : responses.get(responses.size() - 1)
							.getMessage()));
		} catch (ErrorReportedException | TimeoutException e) {
			failures++;
			log.warning(prefix + "server stream failed: " + describe(e));
		}
		try {
			final var responses = echoBidirectionalStreamSync(messages(
					"Sync message from client-" + clientId + " #", numberOfMessages));
			log.info(prefix + "bi-di sync: " + summarize(responses));
		} catch (ErrorReportedException | TimeoutException e) {
			failures++;
			log.warning(prefix + "bi-di sync failed: " + describe(e));
		}
		try {
			final var responses = echoBidirectionalStreamAsync(messages(
					"Async message from client-" + clientId + " #", numberOfMessages));
			log.info(prefix + "bi-di async: " + summarize(responses));
		} catch (ErrorReportedException | TimeoutException e) {
			failures++;
			log.warning(prefix + "bi-di async failed: " + describe(e));
		}
		return failures;
	}

	static List<String> messages(String prefix, int count) {
		return IntStream.rangeClosed(1, count)
			.mapToObj((i) -> prefix + i)
			.collect(Collectors.toList());
	}

	static String summarize(List<EchoResponse> responses) {
		return responses.stream()
			.map(EchoResponse::getMessage)
			.collect(Collectors.joining(" | ", responses.size() + " responses: ", ""));
	}

	static String describe(Exception e) {
		return e instanceof ErrorReportedException ? e.getCause().toString() : e.toString();
	}



	/**
	 * Arguments: {@code [target] [numberOfClients] [messagesPerClient] [timeoutMillis]}.
	 * {@code target} defaults to {@code localhost:8080}. If it is {@code "new"}, a server is started
	 * on a random local port and shut down at exit.
	 */
	public static void main(String[] args) throws Exception {
		var target = args.length > 0 && !args[0].isEmpty() ? args[0] : "localhost:8080";
		final var numberOfClients = args.length > 1 ? Integer.parseInt(args[1]) : 3;
		final var messagesPerClient = args.length > 2 ? Integer.parseInt(args[2]) : 3;
		final var timeoutMillis = args.length > 3 ? Long.parseLong(args[3]) : 30_000L;
		EchoStreamServer.configureLogging(
				Boolean.getBoolean(EchoStreamConfig.PROPERTY_PREFIX + "verbose"));

		EchoStreamServer embeddedServer = null;
		if (target.equals("new")) {
			embeddedServer = new EchoStreamServer(EchoStreamConfig.newBuilder().port(0).build());
			target = "localhost:" + embeddedServer.getPort();
		}
		final var channel = ManagedChannelBuilder
			.forTarget(target)
			.usePlaintext()
			.maxInboundMessageSize(EchoStreamConfig.DEFAULT_MAX_MESSAGE_BYTES)
			.intercept(new LoggingClientInterceptor())
			.build();
		final var client = new EchoStreamClient(channel, timeoutMillis);
		final var clientExecutor = Executors.newFixedThreadPool(numberOfClients);
		int failures = 0;
		try {
			final var runs = new ArrayList<Future<Integer>>(numberOfClients);
			for (int i = 1; i <= numberOfClients; i++) {
				final var clientId = i;
				runs.add(clientExecutor.submit(() -> client.runAll(clientId, messagesPerClient)));
			}
			for (var run: runs) {
				try {
					failures += run.get();
				} catch (ExecutionException e) {
					failures++;
					log.log(Level.SEVERE, "client run failed", e.getCause());
				}
			}
			log.info(numberOfClients + " clients finished, failed runs: " + failures);
		} finally {
			clientExecutor.shutdown();
			if ( !GrpcTermination.enforceTermination(channel, 5L, TimeUnit.SECONDS)) {
				log.warning("channel hasn't shutdown cleanly");
			}
			if (embeddedServer != null) embeddedServer.shutdownAndEnforceTermination(5000L);
		}
		System.exit(failures == 0 ? 0 : 1);
	}



	static final Logger log = Logger.getLogger(EchoStreamClient.class.getName());
}
