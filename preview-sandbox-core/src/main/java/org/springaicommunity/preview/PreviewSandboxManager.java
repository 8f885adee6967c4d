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

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for creating, inspecting and tearing down preview sandboxes.
 *
 * <p>
 * One manager is built at application startup and shared by reference. It keeps at most
 * one sandbox per project, caps the number of live sandboxes across all providers,
 * expires sandboxes after their tier's lifetime, and polls each new sandbox for its
 * preview URL in the background. State lives in memory only: {@link #close()} destroys
 * every live sandbox.
 * </p>
 *
 * <pre>{@code
 * PreviewSandboxManager manager = PreviewSandboxManager.builder()
 *     .config(SandboxManagerConfig.fromEnvironment().build())
 *     .provider(LocalProviderAdapter.builder().build())
 *     .build();
 *
 * manager.create(SandboxConfig.of("project-1", "user-1", files), "pro").join();
 * manager.getStatus("project-1").map(SandboxStatusView::previewUrl);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class PreviewSandboxManager implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(PreviewSandboxManager.class);

	private final SandboxManagerConfig config;

	private final Map<String, ProviderAdapter> providers;

	private final String defaultProvider;

	private final Clock clock;

	private final SandboxRegistry registry;

	private final LifecycleScheduler lifecycle;

	private final CreationCoordinator coordinator;

	private final ExecutorService creationExecutor;

	private final ScheduledExecutorService scheduler;

	private volatile boolean closed = false;

	private PreviewSandboxManager(Builder builder) {
		if (builder.providers.isEmpty()) {
			throw new IllegalArgumentException("At least one provider must be registered");
		}
		this.config = builder.config != null ? builder.config : SandboxManagerConfig.builder().build();
		this.providers = Map.copyOf(builder.providers);
		this.defaultProvider = resolveDefaultProvider(config.defaultProvider(), builder.providers);
		this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
		this.creationExecutor = Executors.newCachedThreadPool(daemonThreads("preview-create"));
		this.scheduler = Executors.newScheduledThreadPool(2, daemonThreads("preview-scheduler"));
		this.registry = new SandboxRegistry();
		this.lifecycle = new LifecycleScheduler(registry, clock, config.maxInstances(), config.defaultTtl());
		ReadinessPoller poller = new ReadinessPoller(scheduler, registry, config.pollInterval(),
				config.pollMaxAttempts());
		this.coordinator = new CreationCoordinator(registry, lifecycle, poller, creationExecutor, clock,
				config.logCapacity(), config.logTail());
		this.lifecycle.start(scheduler, config.sweepInterval());
		logger.info("Preview sandbox manager started with providers {} (default {}), max {} sandboxes",
				providers.keySet(), defaultProvider, config.maxInstances());
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Create a sandbox on the default provider with the default tier.
	 * @param config the project to preview
	 * @return a future completing once the dev server has been started
	 */
	public CompletableFuture<SandboxStatusView> create(SandboxConfig config) {
		return create(config, SandboxManagerConfig.DEFAULT_TIER);
	}

	/**
	 * Create a sandbox on the default provider.
	 * @param config the project to preview
	 * @param tier the plan tier that decides the sandbox lifetime
	 * @return a future completing once the dev server has been started
	 */
	public CompletableFuture<SandboxStatusView> create(SandboxConfig config, String tier) {
		return create(config, tier, defaultProvider);
	}

	/**
	 * Create a sandbox for the project, replacing any sandbox it already has.
	 * <p>
	 * Concurrent calls for the same project while a creation is in flight join that
	 * creation. The returned future completes when the dev server has been started; the
	 * preview URL appears later through {@link #getStatus(String)}. A failed creation
	 * completes the future with a {@link SandboxProvisioningException}.
	 * </p>
	 * @param config the project to preview
	 * @param tier the plan tier that decides the sandbox lifetime
	 * @param providerName the provider to use
	 * @return a future completing with the status right after the server started
	 * @throws IllegalArgumentException if no provider with that name is registered
	 * @throws IllegalStateException if the manager is closed
	 */
	public CompletableFuture<SandboxStatusView> create(SandboxConfig config, String tier, String providerName) {
		assertOpen();
		ProviderAdapter provider = providers.get(providerName);
		if (provider == null) {
			throw new IllegalArgumentException(
					"Unknown provider '" + providerName + "', registered: " + providers.keySet());
		}
		Duration ttl = this.config.ttlFor(tier);
		return coordinator.acquireAndCreate(config, tier, ttl, provider)
			.thenApply(instance -> instance.view(this.config.logTail()));
	}

	/**
	 * Get the current status of a project's sandbox and mark it as recently used.
	 * <p>
	 * An expired sandbox is destroyed and reported as absent. If the last creation for
	 * the project failed, its final status is returned.
	 * </p>
	 * @param projectId the project
	 * @return the status, or empty if the project has no sandbox
	 */
	public Optional<SandboxStatusView> getStatus(String projectId) {
		Optional<SandboxInstance> live = liveInstance(projectId);
		if (live.isPresent()) {
			SandboxInstance instance = live.get();
			instance.touch();
			return Optional.of(instance.view(config.logTail()));
		}
		return registry.failure(projectId);
	}

	/**
	 * Get up to {@code limit} of the most recent log lines of a project's sandbox.
	 * @param projectId the project
	 * @param limit the maximum number of lines
	 * @return the log lines, oldest first, or an empty list if there is no sandbox
	 */
	public List<LogEntry> getLogs(String projectId, int limit) {
		Optional<SandboxInstance> live = liveInstance(projectId);
		if (live.isPresent()) {
			return live.get().logs().tail(limit);
		}
		return registry.failure(projectId)
			.map(view -> {
				List<LogEntry> tail = view.logTail();
				return tail.subList(Math.max(0, tail.size() - limit), tail.size());
			})
			.orElse(List.of());
	}

	/**
	 * List all live sandboxes without touching their access time.
	 * @return the status of every registered sandbox
	 */
	public List<SandboxStatusView> activeSandboxes() {
		List<SandboxStatusView> views = new ArrayList<>();
		for (SandboxInstance instance : registry.snapshot()) {
			views.add(instance.view(config.logTail()));
		}
		return views;
	}

	/**
	 * Destroy the project's sandbox. Does nothing if there is none.
	 * @param projectId the project
	 * @return true if a sandbox was destroyed by this call
	 * @throws SandboxException if the provider fails to release the environment; the
	 * sandbox is no longer tracked either way
	 */
	public boolean destroy(String projectId) {
		registry.clearFailure(projectId);
		Optional<SandboxInstance> instance = registry.get(projectId);
		if (instance.isEmpty()) {
			logger.debug("No sandbox to destroy for project {}", projectId);
			return false;
		}
		return lifecycle.destroy(instance.get(), "destroyed on request");
	}

	/**
	 * Extend the lifetime of the project's sandbox.
	 * @param projectId the project
	 * @param minutes the number of minutes to add, must be positive
	 * @return the updated status
	 * @throws SandboxNotFoundException if the project has no live sandbox
	 */
	public SandboxStatusView extendTimeout(String projectId, int minutes) {
		return lifecycle.extendTimeout(projectId, minutes).view(config.logTail());
	}

	/**
	 * Get the lifetime a sandbox created for the given tier would have.
	 * @param tier the plan tier
	 * @return the time to live
	 */
	public Duration ttlFor(String tier) {
		return config.ttlFor(tier);
	}

	/**
	 * Whether a creation is currently in flight for the project.
	 * @param projectId the project
	 * @return true while a creation flow runs
	 */
	public boolean isCreating(String projectId) {
		return coordinator.isCreating(projectId);
	}

	/**
	 * Run one expiry sweep now instead of waiting for the scheduled one.
	 * @return the number of sandboxes destroyed
	 */
	public int sweepExpired() {
		return lifecycle.sweepExpired();
	}

	public String defaultProvider() {
		return defaultProvider;
	}

	private Optional<SandboxInstance> liveInstance(String projectId) {
		Optional<SandboxInstance> instance = registry.get(projectId);
		if (instance.isPresent() && instance.get().isExpired(clock.instant())) {
			try {
				lifecycle.destroy(instance.get(), "ttl expired");
			}
			catch (SandboxException e) {
				logger.warn("Failed to release expired sandbox for project {}: {}", projectId, e.getMessage());
			}
			return Optional.empty();
		}
		return instance;
	}

	@Override
	public void close() {
		if (closed) {
			return;
		}
		closed = true;
		lifecycle.stop();
		creationExecutor.shutdown();
		for (SandboxInstance instance : registry.snapshot()) {
			try {
				lifecycle.destroy(instance, "manager closed");
			}
			catch (SandboxException e) {
				logger.warn("Failed to release sandbox for project {} on shutdown: {}", instance.projectId(),
						e.getMessage());
			}
		}
		scheduler.shutdownNow();
		try {
			if (!creationExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
				creationExecutor.shutdownNow();
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			creationExecutor.shutdownNow();
		}
		for (ProviderAdapter provider : providers.values()) {
			if (provider instanceof AutoCloseable closeable) {
				try {
					closeable.close();
				}
				catch (Exception e) {
					logger.warn("Failed to close provider {}", provider.name(), e);
				}
			}
		}
		logger.info("Preview sandbox manager closed");
	}

	public boolean isClosed() {
		return closed;
	}

	private void assertOpen() {
		if (closed) {
			throw new IllegalStateException("Sandbox manager is closed");
		}
	}

	private static String resolveDefaultProvider(String requested, Map<String, ProviderAdapter> providers) {
		if (requested == null) {
			return providers.keySet().iterator().next();
		}
		if (!providers.containsKey(requested)) {
			throw new IllegalArgumentException(
					"Default provider '" + requested + "' is not registered, registered: " + providers.keySet());
		}
		return requested;
	}

	private static ThreadFactory daemonThreads(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	public static class Builder {

		private SandboxManagerConfig config;

		private final Map<String, ProviderAdapter> providers = new LinkedHashMap<>();

		private Clock clock;

		public Builder config(SandboxManagerConfig config) {
			this.config = config;
			return this;
		}

		/**
		 * Register a provider under its {@link ProviderAdapter#name()}. The first one
		 * registered is the default unless the config names another.
		 * @param provider the provider
		 * @return this builder
		 */
		public Builder provider(ProviderAdapter provider) {
			this.providers.put(provider.name(), provider);
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public PreviewSandboxManager build() {
			return new PreviewSandboxManager(this);
		}

	}

}
