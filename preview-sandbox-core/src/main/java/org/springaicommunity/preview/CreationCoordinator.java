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
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs sandbox creation flows with at most one flow in flight per project.
 *
 * <p>
 * A call for a project whose creation is still running joins that creation and gets
 * the same future. Otherwise a new flow starts: any existing sandbox for the project is
 * destroyed, capacity is made, a {@link SandboxStatus#CREATING} instance is registered,
 * and the provider is driven through create, write files, install and start. The
 * in-flight entry is released before the future completes, so a caller that waits for
 * one creation and then asks again always starts a fresh flow.
 * </p>
 *
 * <p>
 * Any failure unregisters the instance, releases whatever the provider allocated,
 * records the failure for status queries, and completes the future with a
 * {@link SandboxProvisioningException}. Nothing is retried.
 * </p>
 *
 * @since 0.1.0
 */
final class CreationCoordinator {

	private static final Logger logger = LoggerFactory.getLogger(CreationCoordinator.class);

	private final Map<String, CompletableFuture<SandboxInstance>> inFlight = new ConcurrentHashMap<>();

	private final SandboxRegistry registry;

	private final LifecycleScheduler lifecycle;

	private final ReadinessPoller readinessPoller;

	private final Executor executor;

	private final Clock clock;

	private final int logCapacity;

	private final int logTail;

	CreationCoordinator(SandboxRegistry registry, LifecycleScheduler lifecycle, ReadinessPoller readinessPoller,
			Executor executor, Clock clock, int logCapacity, int logTail) {
		this.registry = registry;
		this.lifecycle = lifecycle;
		this.readinessPoller = readinessPoller;
		this.executor = executor;
		this.clock = clock;
		this.logCapacity = logCapacity;
		this.logTail = logTail;
	}

	/**
	 * Create a sandbox for the project, or join the creation already in flight.
	 * @param config the project to preview
	 * @param tier the plan tier recorded on the instance
	 * @param ttl how long the sandbox lives unless extended
	 * @param provider the provider to create it on
	 * @return a future completing with the running instance
	 */
	CompletableFuture<SandboxInstance> acquireAndCreate(SandboxConfig config, String tier, Duration ttl,
			ProviderAdapter provider) {
		String projectId = config.projectId();
		CompletableFuture<SandboxInstance> created = new CompletableFuture<>();
		CompletableFuture<SandboxInstance> existing = inFlight.putIfAbsent(projectId, created);
		if (existing != null) {
			logger.debug("Creation already in progress for project {}, joining it", projectId);
			return existing;
		}
		try {
			executor.execute(() -> runFlow(config, tier, ttl, provider, created));
		}
		catch (RejectedExecutionException e) {
			inFlight.remove(projectId, created);
			created.completeExceptionally(new SandboxException("Sandbox manager is shut down", e));
		}
		return created;
	}

	boolean isCreating(String projectId) {
		return inFlight.containsKey(projectId);
	}

	private void runFlow(SandboxConfig config, String tier, Duration ttl, ProviderAdapter provider,
			CompletableFuture<SandboxInstance> created) {
		String projectId = config.projectId();
		SandboxInstance instance;
		try {
			instance = provision(config, tier, ttl, provider);
		}
		catch (Throwable ex) {
			inFlight.remove(projectId, created);
			created.completeExceptionally(ex);
			return;
		}
		inFlight.remove(projectId, created);
		created.complete(instance);
	}

	private SandboxInstance provision(SandboxConfig config, String tier, Duration ttl, ProviderAdapter provider) {
		String projectId = config.projectId();
		registry.get(projectId).ifPresent(previous -> {
			logger.info("Replacing sandbox {} for project {}", previous.id(), projectId);
			try {
				lifecycle.destroy(previous, "replaced by a new sandbox");
			}
			catch (SandboxException e) {
				logger.warn("Failed to release replaced sandbox {}: {}", previous.id(), e.getMessage());
			}
		});

		SandboxInstance instance = new SandboxInstance(newInstanceId(), config, tier, provider, clock, ttl,
				logCapacity);
		try {
			lifecycle.admit(instance);
		}
		catch (SandboxException e) {
			instance.info("Could not make room for sandbox: " + e.getMessage());
			instance.fail();
			throw new SandboxProvisioningException("Failed to create sandbox for project " + projectId + ": "
					+ e.getMessage(), instance.view(logTail), e);
		}
		logger.info("Creating sandbox {} for project {} on provider {}", instance.id(), projectId, provider.name());
		instance.info("Creating sandbox on provider " + provider.name());

		SandboxHandle handle = null;
		boolean attached = false;
		try {
			handle = provider.create(config, instance::output);
			attached = instance.attachHandle(handle);
			ensureCurrent(instance);
			instance.info("Environment " + handle.id() + " allocated");

			provider.writeFiles(handle, config.files());
			ensureCurrent(instance);
			instance.info("Wrote " + config.files().size() + " file(s)");

			InstallOutcome outcome = provider.installDependencies(handle);
			ensureCurrent(instance);
			instance.info("Dependencies: " + describe(outcome));

			String endpoint = provider.startServer(handle);
			if (!instance.markRunning(endpoint)) {
				ensureCurrent(instance);
			}
			instance.info("Dev server started at " + endpoint);
			ensureCurrent(instance);
			readinessPoller.start(instance);
			logger.info("Sandbox {} for project {} is running", instance.id(), projectId);
			return instance;
		}
		catch (RuntimeException e) {
			boolean wasCurrent = registry.remove(instance);
			instance.info("Creation failed: " + e.getMessage());
			SandboxHandle owned = instance.fail();
			if (owned == null && handle != null && !attached) {
				owned = handle;
			}
			releaseQuietly(provider, owned);
			SandboxStatusView view = instance.view(logTail);
			if (wasCurrent) {
				registry.recordFailure(view, clock.instant());
			}
			logger.warn("Failed to create sandbox for project {}: {}", projectId, e.getMessage());
			throw new SandboxProvisioningException(
					"Failed to create sandbox for project " + projectId + ": " + e.getMessage(), view, e);
		}
	}

	private void ensureCurrent(SandboxInstance instance) {
		if (!registry.isCurrent(instance) || instance.status() == SandboxStatus.STOPPED) {
			throw new SandboxException("Sandbox " + instance.id() + " was destroyed during creation");
		}
	}

	private void releaseQuietly(ProviderAdapter provider, SandboxHandle handle) {
		if (handle == null) {
			return;
		}
		try {
			provider.destroy(handle);
		}
		catch (SandboxException e) {
			logger.warn("Failed to release environment {} after failed creation: {}", handle.id(), e.getMessage());
		}
	}

	private static String describe(InstallOutcome outcome) {
		return switch (outcome) {
			case CACHE_HIT -> "copied from warm cache";
			case INSTALLED -> "installed";
			case DEFERRED -> "deferred to server start";
		};
	}

	private static String newInstanceId() {
		return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
	}

}
