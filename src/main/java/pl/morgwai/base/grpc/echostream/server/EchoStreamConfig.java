// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream.server;

import java.util.*;



/**
 * Immutable settings of {@link EchoStreamServer} and {@link EchoStreamService}.
 * <p>
 * Values are resolved by {@link #load(String[], Properties)} in the following order of
 * precedence: command line arguments ({@code --name=value}, {@code --name value} or a bare
 * {@code --verbose}), then properties named {@value #PROPERTY_PREFIX}{@code name}, then defaults.
 * Names are the same as the respective {@link Builder} setters, for example {@code port},
 * {@code queueCapacity}, {@code pollIntervalMillis}.</p>
 */
public class EchoStreamConfig {



	public static final String PROPERTY_PREFIX = "pl.morgwai.base.grpc.echostream.";

	public static final int DEFAULT_PORT = 8080;
	public static final int DEFAULT_WORKERS = 10;
	public static final int DEFAULT_MAX_MESSAGE_BYTES = 50 * 1024 * 1024;
	public static final int DEFAULT_QUEUE_CAPACITY = 10;
	public static final long DEFAULT_POLL_INTERVAL_MILLIS = 100L;
	public static final int DEFAULT_FAN_OUT_COUNT = 5;
	public static final long DEFAULT_FAN_OUT_DELAY_MILLIS = 100L;
	public static final long DEFAULT_PROCESSING_DELAY_MILLIS = 200L;
	public static final long DEFAULT_JOIN_TIMEOUT_MILLIS = 1000L;
	public static final long DEFAULT_SHUTDOWN_TIMEOUT_MILLIS = 5000L;



	public int getPort() { return port; }
	final int port;

	/** Size of the worker pool running call handlers. */
	public int getWorkers() { return workers; }
	final int workers;

	/** Calls beyond this limit are rejected with {@code RESOURCE_EXHAUSTED}. */
	public int getMaxConcurrentCalls() { return maxConcurrentCalls; }
	final int maxConcurrentCalls;

	public int getMaxMessageBytes() { return maxMessageBytes; }
	final int maxMessageBytes;

	public int getQueueCapacity() { return queueCapacity; }
	final int queueCapacity;

	public long getPollIntervalMillis() { return pollIntervalMillis; }
	final long pollIntervalMillis;

	public int getFanOutCount() { return fanOutCount; }
	final int fanOutCount;

	public long getFanOutDelayMillis() { return fanOutDelayMillis; }
	final long fanOutDelayMillis;

	public long getProcessingDelayMillis() { return processingDelayMillis; }
	final long processingDelayMillis;

	public long getJoinTimeoutMillis() { return joinTimeoutMillis; }
	final long joinTimeoutMillis;

	public long getShutdownTimeoutMillis() { return shutdownTimeoutMillis; }
	final long shutdownTimeoutMillis;

	public boolean isVerbose() { return verbose; }
	final boolean verbose;



	EchoStreamConfig(Builder builder) {
		port = requireInRange("port", builder.port, 0, 65535);
		workers = requireInRange("workers", builder.workers, 1, Integer.MAX_VALUE);
		maxConcurrentCalls = requireInRange("maxConcurrentCalls",
				builder.maxConcurrentCalls != null ? builder.maxConcurrentCalls : workers,
				1, Integer.MAX_VALUE);
		maxMessageBytes = requireInRange(
				"maxMessageBytes", builder.maxMessageBytes, 1, Integer.MAX_VALUE);
		queueCapacity = requireInRange("queueCapacity", builder.queueCapacity, 1, Integer.MAX_VALUE);
		pollIntervalMillis = requirePositive("pollIntervalMillis", builder.pollIntervalMillis);
		fanOutCount = requireInRange("fanOutCount", builder.fanOutCount, 0, Integer.MAX_VALUE);
		fanOutDelayMillis = requireNonNegative("fanOutDelayMillis", builder.fanOutDelayMillis);
		processingDelayMillis =
				requireNonNegative("processingDelayMillis", builder.processingDelayMillis);
		joinTimeoutMillis = requirePositive("joinTimeoutMillis", builder.joinTimeoutMillis);
		shutdownTimeoutMillis =
				requirePositive("shutdownTimeoutMillis", builder.shutdownTimeoutMillis);
		verbose = builder.verbose;
	}



	public static Builder newBuilder() { return new Builder(); }

	public static EchoStreamConfig defaults() { return newBuilder().build(); }



	public static class Builder {

		int port = DEFAULT_PORT;
		int workers = DEFAULT_WORKERS;
		Integer maxConcurrentCalls;
		int maxMessageBytes = DEFAULT_MAX_MESSAGE_BYTES;
		int queueCapacity = DEFAULT_QUEUE_CAPACITY;
		long pollIntervalMillis = DEFAULT_POLL_INTERVAL_MILLIS;
		int fanOutCount = DEFAULT_FAN_OUT_COUNT;
		long fanOutDelayMillis = DEFAULT_FAN_OUT_DELAY_MILLIS;
		long processingDelayMillis = DEFAULT_PROCESSING_DELAY_MILLIS;
		long joinTimeoutMillis = DEFAULT_JOIN_TIMEOUT_MILLIS;
		long shutdownTimeoutMillis = DEFAULT_SHUTDOWN_TIMEOUT_MILLIS;
		boolean verbose = false;

		public Builder port(int port) { this.port = port; return this; }
		public Builder workers(int workers) { this.workers = workers; return this; }
		/** Defaults to {@link #workers(int) workers}. */
		public Builder maxConcurrentCalls(int maxConcurrentCalls) {
			this.maxConcurrentCalls = maxConcurrentCalls;
			return this;
		}
		public Builder maxMessageBytes(int maxMessageBytes) {
			this.maxMessageBytes = maxMessageBytes;
			return this;
		}
		public Builder queueCapacity(int queueCapacity) {
			this.queueCapacity = queueCapacity;
			return this;
		}
		public Builder pollIntervalMillis(long pollIntervalMillis) {
			this.pollIntervalMillis = pollIntervalMillis;
			return this;
		}
		public Builder fanOutCount(int fanOutCount) {
			this.fanOutCount = fanOutCount;
			return this;
		}
		public Builder fanOutDelayMillis(long fanOutDelayMillis) {
			this.fanOutDelayMillis = fanOutDelayMillis;
			return this;
		}
		public Builder processingDelayMillis(long processingDelayMillis) {
			this.processingDelayMillis = processingDelayMillis;
			return this;
		}
		public Builder joinTimeoutMillis(long joinTimeoutMillis) {
			this.joinTimeoutMillis = joinTimeoutMillis;
			return this;
		}
		public Builder shutdownTimeoutMillis(long shutdownTimeoutMillis) {
			this.shutdownTimeoutMillis = shutdownTimeoutMillis;
			return this;
		}
		public Builder verbose(boolean verbose) { this.verbose = verbose; return this; }

		public EchoStreamConfig build() { return new EchoStreamConfig(this); }



		/**
		 * Applies a single named setting from its textual value.
		 * @throws IllegalArgumentException if {@code name} is unknown or {@code value} is not a
		 *     valid number.
		 */
		public Builder set(String name, String value) {
			try {
				switch (name) {
					case "port": return port(Integer.parseInt(value));
					case "workers": return workers(Integer.parseInt(value));
					case "maxConcurrentCalls": return maxConcurrentCalls(Integer.parseInt(value));
					case "maxMessageBytes": return maxMessageBytes(Integer.parseInt(value));
					case "queueCapacity": return queueCapacity(Integer.parseInt(value));
					case "pollIntervalMillis": return pollIntervalMillis(Long.parseLong(value));
					case "fanOutCount": return fanOutCount(Integer.parseInt(value));
					case "fanOutDelayMillis": return fanOutDelayMillis(Long.parseLong(value));
					case "processingDelayMillis":
						return processingDelayMillis(Long.parseLong(value));
					case "joinTimeoutMillis": return joinTimeoutMillis(Long.parseLong(value));
					case "shutdownTimeoutMillis":
						return shutdownTimeoutMillis(Long.parseLong(value));
					case "verbose": return verbose(Boolean.parseBoolean(value));
					default: throw new IllegalArgumentException("unknown setting: " + name);
				}
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException(
						"invalid value of " + name + ": \"" + value + '"', e);
			}
		}
	}



	/**
	 * Resolves settings from command line {@code args} and {@code properties} (usually
	 * {@link System#getProperties()}).
	 * @throws IllegalArgumentException if any setting is unknown or invalid.
	 */
	public static EchoStreamConfig load(String[] args, Properties properties) {
		final var builder = newBuilder();
		for (var propertyName: properties.stringPropertyNames()) {
			if ( !propertyName.startsWith(PROPERTY_PREFIX)) continue;
			final var name = propertyName.substring(PROPERTY_PREFIX.length());
			if (name.equals("level")) continue;  // test logging level
			builder.set(name, properties.getProperty(propertyName));
		}
		for (int i = 0; i < args.length; i++) {
			final var arg = args[i];
			if ( !arg.startsWith("--") || arg.length() == 2) {
				throw new IllegalArgumentException("unexpected argument: " + arg);
			}
			final var separatorIndex = arg.indexOf('=');
			if (separatorIndex > 0) {
				builder.set(arg.substring(2, separatorIndex), arg.substring(separatorIndex + 1));
			} else if (arg.equals("--verbose")) {
				builder.verbose(true);
			} else if (i + 1 < args.length) {
				builder.set(arg.substring(2), args[++i]);
			} else {
				throw new IllegalArgumentException("missing value of " + arg);
			}
		}
		return builder.build();
	}



	static int requireInRange(String name, int value, int min, int max) {
		if (value < min || value > max) {
			throw new IllegalArgumentException(
					name + " must be within [" + min + ", " + max + "], got " + value);
		}
		return value;
	}

	static long requirePositive(String name, long value) {
		if (value <= 0L) throw new IllegalArgumentException(name + " must be positive");
		return value;
	}

	static long requireNonNegative(String name, long value) {
		if (value < 0L) throw new IllegalArgumentException(name + " must not be negative");
		return value;
	}



	@Override
	public String toString() {
		return "EchoStreamConfig(port=" + port + ", workers=" + workers
				+ ", maxConcurrentCalls=" + maxConcurrentCalls
				+ ", maxMessageBytes=" + maxMessageBytes + ", queueCapacity=" + queueCapacity
				+ ", pollIntervalMillis=" + pollIntervalMillis + ", fanOutCount=" + fanOutCount
				+ ", fanOutDelayMillis=" + fanOutDelayMillis
				+ ", processingDelayMillis=" + processingDelayMillis
				+ ", joinTimeoutMillis=" + joinTimeoutMillis
				+ ", shutdownTimeoutMillis=" + shutdownTimeoutMillis + ", verbose=" + verbose + ')';
	}
}
