// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream.server;

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.health.v1.HealthCheckRequest;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.health.v1.HealthGrpc;
import org.junit.*;
import pl.morgwai.base.grpc.echostream.GrpcTermination;
import pl.morgwai.base.grpc.echostream.api.EchoServiceGrpc;
import pl.morgwai.base.grpc.echostream.client.EchoStreamClient;

import static org.junit.Assert.*;



public class EchoStreamServerTest {



	EchoStreamServer server;
	ManagedChannel channel;

	@Before
	public void startServer() throws Exception {
		server = new EchoStreamServer(EchoStreamServiceTest.fastConfig().port(0).build());
		channel = ManagedChannelBuilder.forTarget("localhost:" + server.getPort())
			.usePlaintext()
			.build();
	}

	@After
	public void shutdown() throws InterruptedException {
		GrpcTermination.enforceTermination(channel, 1L, TimeUnit.SECONDS);
		server.shutdownAndEnforceTermination(1000L);
	}



	@Test
	public void testServingOverNetwork() throws InterruptedException {
		final var health = HealthGrpc.newBlockingStub(channel)
			.check(HealthCheckRequest.newBuilder()
				.setService(EchoServiceGrpc.SERVICE_NAME)
				.build());
		assertEquals(ServingStatus.SERVING, health.getStatus());

		final var client = new EchoStreamClient(channel, 5000L);
		assertEquals("no pattern should fail", 0, client.runAll(1, 2));
	}



	@Test
	public void testShutdown() throws InterruptedException {
		assertTrue("server should terminate cleanly", server.shutdownAndEnforceTermination(2000L));
	}



	@BeforeClass
	public static void setupLogging() {
		var level = Level.SEVERE;
		try {
			level = Level.parse(System.getProperty(
					EchoStreamServerTest.class.getPackageName() + ".level"));
		} catch (Exception ignored) {}
		Logger.getLogger("pl.morgwai.base.grpc.echostream").setLevel(level);
		for (final var handler: Logger.getLogger("").getHandlers()) handler.setLevel(level);
	}
}
