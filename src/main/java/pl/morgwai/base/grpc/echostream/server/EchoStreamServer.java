// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream.server;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.ChannelzService;
import io.grpc.protobuf.services.HealthStatusManager;
import io.grpc.protobuf.services.ProtoReflectionService;
import pl.morgwai.base.grpc.echostream.GrpcTermination;
import pl.morgwai.base.grpc.echostream.api.EchoServiceGrpc;



/**
 * Hosts {@link EchoStreamService} together with health, channelz and reflection services.
 */
public class EchoStreamServer {



	final EchoStreamConfig config;
	final ExecutorService callExecutor;
	final ExecutorService stageExecutor;
	final EchoStreamService echoService;
	final HealthStatusManager health;
	final Server grpcServer;



	public EchoStreamServer(EchoStreamConfig config) throws IOException {
		this.config = config;
		callExecutor = new ThreadPoolExecutor(
			config.getWorkers(),
			config.getWorkers(),
			0L,
			TimeUnit.DAYS,
			new LinkedBlockingQueue<>(),
			new ThreadFactoryBuilder().setNameFormat("echo-call-%d").build()
		);
		stageExecutor = Executors.newCachedThreadPool(
				new ThreadFactoryBuilder().setNameFormat("echo-stage-%d").setDaemon(true).build());
		echoService = new EchoStreamService(config, callExecutor, stageExecutor);
		health = new HealthStatusManager();
		grpcServer = NettyServerBuilder
			.forPort(config.getPort())
			.maxInboundMessageSize(config.getMaxMessageBytes())
			.addService(ServerInterceptors.intercept(echoService, new LoggingServerInterceptor()))
			.addService(health.getHealthService())
			.addService(ChannelzService.newInstance(1024))
			.addService(ProtoReflectionService.newInstance())
			.build();
		grpcServer.start();
		health.setStatus(EchoServiceGrpc.SERVICE_NAME, ServingStatus.SERVING);
		log.info("listening on port " + grpcServer.getPort() + ", " + config);
	}



	public int getPort() {
		return grpcServer.getPort();
	}



	/**
	 * Marks the server as not serving, shuts down the gRPC server and then both executors. Each
	 * component that fails to terminate within what remains of {@code timeoutMillis} is forced to
	 * shut down.
	 * @return {@code true} if all components terminated cleanly.
	 */
	public boolean shutdownAndEnforceTermination(long timeoutMillis) throws InterruptedException {
		final var deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
		health.enterTerminalState();
		final List<String> failedTerminations = new ArrayList<>(3);
		if ( !GrpcTermination.enforceTermination(
				grpcServer, remainingNanos(deadlineNanos), TimeUnit.NANOSECONDS)) {
			failedTerminations.add("grpcServer");
		}
		if ( !MoreExecutors.shutdownAndAwaitTermination(
				callExecutor, remainingNanos(deadlineNanos), TimeUnit.NANOSECONDS)) {
			failedTerminations.add("callExecutor");
		}
		if ( !MoreExecutors.shutdownAndAwaitTermination(
				stageExecutor, remainingNanos(deadlineNanos), TimeUnit.NANOSECONDS)) {
			failedTerminations.add("stageExecutor");
		}
		for (var failedTermination: failedTerminations) {
			log.warning(failedTermination + " hasn't shutdown cleanly");
		}
		return failedTerminations.isEmpty();
	}

	static long remainingNanos(long deadlineNanos) {
		return Math.max(0L, deadlineNanos - System.nanoTime());
	}



	public void awaitTermination() throws InterruptedException {
		grpcServer.awaitTermination();
	}



	/**
	 * Loads {@code logging.properties} from the classpath unless
	 * {@code java.util.logging.config.file} is set, then lowers the root level to
	 * {@link Level#FINE} if {@code verbose}.
	 */
	public static void configureLogging(boolean verbose) {
		if (System.getProperty("java.util.logging.config.file") == null) {
			try (
				final var loggingConfig =
						EchoStreamServer.class.getResourceAsStream("/logging.properties");
			) {
				if (loggingConfig != null) LogManager.getLogManager().readConfiguration(loggingConfig);
			} catch (IOException e) {
				log.log(Level.WARNING, "could not load logging.properties", e);
			}
		}
		if (verbose) {
			final var rootLogger = Logger.getLogger("");
			rootLogger.setLevel(Level.FINE);
			for (final var handler: rootLogger.getHandlers()) handler.setLevel(Level.FINE);
		}
	}



	public static void main(String[] args) throws Exception {
		final var config = EchoStreamConfig.load(args, System.getProperties());
		configureLogging(config.isVerbose());
		final var server = new EchoStreamServer(config);
		Runtime.getRuntime().addShutdownHook(new Thread(
			() -> {
				log.info("shutting down");
				try {
					server.shutdownAndEnforceTermination(config.getShutdownTimeoutMillis());
				} catch (InterruptedException e) {
					log.warning("shutdown interrupted");
				}
			})
		);
		server.awaitTermination();
	}



	static final Logger log = Logger.getLogger(EchoStreamServer.class.getName());
}
