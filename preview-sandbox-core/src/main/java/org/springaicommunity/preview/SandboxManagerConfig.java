/*
 * Copyright 2024 Spring AI Community
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.springaicommunity.preview;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Settings for {@link PreviewSandboxManager}.
 *
 * <p>
 * Defaults: sandboxes live 10 minutes ({@code free}), 30 minutes ({@code pro}) or 60
 * minutes ({@code business}); at most 5 are live at once; the preview URL is polled every
 * 3 seconds for up to 60 attempts; expired sandboxes are swept every 30 seconds.
 * </p>
 *
 * @since 0.1.0
 */
public final class SandboxManagerConfig {

	public static final String DEFAULT_TIER = "free";

	private static final Duration DEFAULT_TTL = Duration.ofMinutes(10);

	private static final int DEFAULT_MAX_INSTANCES = 5;

	private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(3);

	private static final int DEFAULT_POLL_MAX_ATTEMPTS = 60;

	private static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(30);

	private static final int DEFAULT_LOG_CAPACITY = 500;

	private static final int DEFAULT_LOG_TAIL = 50;

	private final Duration defaultTtl;

	private final Map<String, Duration> tierTtls;

	private final int maxInstances;

	private final Duration pollInterval;

	private final int pollMaxAttempts;

	private final Duration sweepInterval;

	private final int logCapacity;

	private final int logTail;

	private final String defaultProvider;

	private SandboxManagerConfig(Builder builder) {
		this.defaultTtl = builder.defaultTtl != null ? builder.defaultTtl : DEFAULT_TTL;
		this.tierTtls = Map.copyOf(builder.tierTtls);
		this.maxInstances = requirePositive(builder.maxInstances, "maxInstances");
		this.pollInterval = builder.pollInterval != null ? builder.pollInterval : DEFAULT_POLL_INTERVAL;
		this.pollMaxAttempts = requirePositive(builder.pollMaxAttempts, "pollMaxAttempts");
		this.sweepInterval = builder.sweepInterval != null ? builder.sweepInterval : DEFAULT_SWEEP_INTERVAL;
		this.logCapacity = requirePositive(builder.logCapacity, "logCapacity");
		this.logTail = requirePositive(builder.logTail, "logTail");
		this.defaultProvider = builder.defaultProvider;
	}

	public Duration defaultTtl() {
		return defaultTtl;
	}

	public Map<String, Duration> tierTtls() {
		return tierTtls;
	}

	/**
	 * Get the lifetime for a plan tier, falling back to the default for unknown tiers.
	 * @param tier the tier name, case-insensitive, may be {@code null}
	 * @return the time to live
	 */
	public Duration ttlFor(String tier) {
		if (tier == null) {
			return defaultTtl;
		}
		return tierTtls.getOrDefault(tier.toLowerCase(Locale.ROOT), defaultTtl);
	}

	public int maxInstances() {
		return maxInstances;
	}

	public Duration pollInterval() {
		return pollInterval;
	}

	public int pollMaxAttempts() {
		return pollMaxAttempts;
	}

	public Duration sweepInterval() {
		return sweepInterval;
	}

	public int logCapacity() {
		return logCapacity;
	}

	public int logTail() {
		return logTail;
	}

	/**
	 * Get the name of the provider used when a creation does not name one.
	 * @return the provider name, or {@code null} to use the first registered provider
	 */
	public String defaultProvider() {
		return defaultProvider;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Create a builder seeded from the process environment.
	 * @return a new builder
	 * @see #fromEnvironment(Map)
	 */
	public static Builder fromEnvironment() {
		return fromEnvironment(System.getenv());
	}

	/**
	 * Create a builder seeded from environment variables.
	 * <p>
	 * Recognized variables: {@code SANDBOX_PROVIDER}, {@code PREVIEW_SANDBOX_TTL_MINUTES},
	 * {@code PREVIEW_SANDBOX_TTL_<TIER>_MINUTES}, {@code PREVIEW_SANDBOX_MAX_INSTANCES},
	 * {@code PREVIEW_SANDBOX_POLL_INTERVAL_SECONDS},
	 * {@code PREVIEW_SANDBOX_POLL_MAX_ATTEMPTS},
	 * {@code PREVIEW_SANDBOX_SWEEP_INTERVAL_SECONDS} and
	 * {@code PREVIEW_SANDBOX_LOG_CAPACITY}.
	 * </p>
	 * @param env the environment
	 * @return a new builder
	 * @throws IllegalArgumentException if a numeric variable cannot be parsed
	 */
	public static Builder fromEnvironment(Map<String, String> env) {
		Builder builder = new Builder();
		String provider = env.get("SANDBOX_PROVIDER");
		if (provider != null && !provider.isBlank()) {
			builder.defaultProvider(provider.trim().toLowerCase(Locale.ROOT));
		}
		Long ttl = longValue(env, "PREVIEW_SANDBOX_TTL_MINUTES");
		if (ttl != null) {
			builder.defaultTtl(Duration.ofMinutes(ttl));
		}
		String prefix = "PREVIEW_SANDBOX_TTL_";
		String suffix = "_MINUTES";
		for (String key : env.keySet()) {
			if (key.startsWith(prefix) && key.endsWith(suffix) && key.length() > prefix.length() + suffix.length()) {
				String tier = key.substring(prefix.length(), key.length() - suffix.length());
				Long tierTtl = longValue(env, key);
				if (tierTtl != null) {
					builder.tierTtl(tier, Duration.ofMinutes(tierTtl));
				}
			}
		}
		Integer maxInstances = intValue(env, "PREVIEW_SANDBOX_MAX_INSTANCES");
		if (maxInstances != null) {
			builder.maxInstances(maxInstances);
		}
		Long pollInterval = longValue(env, "PREVIEW_SANDBOX_POLL_INTERVAL_SECONDS");
		if (pollInterval != null) {
			builder.pollInterval(Duration.ofSeconds(pollInterval));
		}
		Integer attempts = intValue(env, "PREVIEW_SANDBOX_POLL_MAX_ATTEMPTS");
		if (attempts != null) {
			builder.pollMaxAttempts(attempts);
		}
		Long sweep = longValue(env, "PREVIEW_SANDBOX_SWEEP_INTERVAL_SECONDS");
		if (sweep != null) {
			builder.sweepInterval(Duration.ofSeconds(sweep));
		}
		Integer logCapacity = intValue(env, "PREVIEW_SANDBOX_LOG_CAPACITY");
		if (logCapacity != null) {
			builder.logCapacity(logCapacity);
		}
		return builder;
	}

	private static Long longValue(Map<String, String> env, String key) {
		String value = env.get(key);
		if (value == null || value.isBlank()) {
			return null;
		}
		try {
			return Long.parseLong(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
		}
	}

	private static Integer intValue(Map<String, String> env, String key) {
		Long value = longValue(env, key);
		if (value == null) {
			return null;
		}
		try {
			return Math.toIntExact(value);
		}
		catch (ArithmeticException e) {
			throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
		}
	}

	private static int requirePositive(int value, String name) {
		if (value <= 0) {
			throw new IllegalArgumentException(name + " must be positive: " + value);
		}
		return value;
	}

	public static class Builder {

		private Duration defaultTtl;

		private final Map<String, Duration> tierTtls = new LinkedHashMap<>();

		private int maxInstances = DEFAULT_MAX_INSTANCES;

		private Duration pollInterval;

		private int pollMaxAttempts = DEFAULT_POLL_MAX_ATTEMPTS;

		private Duration sweepInterval;

		private int logCapacity = DEFAULT_LOG_CAPACITY;

		private int logTail = DEFAULT_LOG_TAIL;

		private String defaultProvider;

		Builder() {
			tierTtls.put("free", Duration.ofMinutes(10));
			tierTtls.put("pro", Duration.ofMinutes(30));
			tierTtls.put("business", Duration.ofMinutes(60));
		}

		public Builder defaultTtl(Duration defaultTtl) {
			this.defaultTtl = defaultTtl;
			return this;
		}

		public Builder tierTtl(String tier, Duration ttl) {
			this.tierTtls.put(tier.toLowerCase(Locale.ROOT), ttl);
			return this;
		}

		public Builder maxInstances(int maxInstances) {
			this.maxInstances = maxInstances;
			return this;
		}

		public Builder pollInterval(Duration pollInterval) {
			this.pollInterval = pollInterval;
			return this;
		}

		public Builder pollMaxAttempts(int pollMaxAttempts) {
			this.pollMaxAttempts = pollMaxAttempts;
			return this;
		}

		public Builder sweepInterval(Duration sweepInterval) {
			this.sweepInterval = sweepInterval;
			return this;
		}

		public Builder logCapacity(int logCapacity) {
			this.logCapacity = logCapacity;
			return this;
		}

		public Builder logTail(int logTail) {
			this.logTail = logTail;
			return this;
		}

		public Builder defaultProvider(String defaultProvider) {
			this.defaultProvider = defaultProvider;
			return this;
		}

		public SandboxManagerConfig build() {
			return new SandboxManagerConfig(this);
		}

	}

}
