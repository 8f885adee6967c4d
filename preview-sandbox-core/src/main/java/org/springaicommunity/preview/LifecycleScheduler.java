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
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the end of a sandbox's life: TTL expiry, capacity eviction, lease extension and
 * the single destroy path every other component goes through.
 *
 * @since 0.1.0
 */
final class LifecycleScheduler {

	private static final Logger logger = LoggerFactory.getLogger(LifecycleScheduler.class);

	private final SandboxRegistry registry;

	private final Clock clock;

	private final int maxInstances;

	private final Duration failureRetention;

	private final Object capacityLock = new Object();

	private ScheduledFuture<?> sweepTask;

	/**
	 * @param failureRetention how long a failed creation stays visible to status queries
	 */
	LifecycleScheduler(SandboxRegistry registry, Clock clock, int maxInstances, Duration failureRetention) {
		if (maxInstances <= 0) {
			throw new IllegalArgumentException("maxInstances must be positive: " + maxInstances);
		}
		this.registry = registry;
		this.clock = clock;
		this.maxInstances = maxInstances;
		this.failureRetention = failureRetention;
	}

	/**
	 * Start the periodic expiry sweep.
	 */
	synchronized void start(ScheduledExecutorService scheduler, Duration sweepInterval) {
		if (sweepTask != null) {
			return;
		}
		long millis = sweepInterval.toMillis();
		sweepTask = scheduler.scheduleWithFixedDelay(this::sweepQuietly, millis, millis, TimeUnit.MILLISECONDS);
		logger.debug("Expiry sweep scheduled every {}", sweepInterval);
	}

	synchronized void stop() {
		if (sweepTask != null) {
			sweepTask.cancel(false);
			sweepTask = null;
		}
	}

	/**
	 * Destroy every instance whose expiry has passed.
	 * @return the number of instances destroyed by this sweep
	 */
	int sweepExpired() {
		Instant now = clock.instant();
		int destroyed = 0;
		for (SandboxInstance instance : registry.snapshot()) {
			if (instance.isExpired(now)) {
				try {
					if (destroy(instance, "ttl expired")) {
						destroyed++;
					}
				}
				catch (SandboxException e) {
					logger.warn("Failed to release expired sandbox {} for project {}: {}", instance.sandboxId(),
							instance.projectId(), e.getMessage());
				}
			}
		}
		if (destroyed > 0) {
			logger.info("Expiry sweep destroyed {} sandbox(es)", destroyed);
		}
		int pruned = registry.pruneFailures(now.minus(failureRetention));
		if (pruned > 0) {
			logger.debug("Expiry sweep dropped {} stale creation failure(s)", pruned);
		}
		return destroyed;
	}

	private void sweepQuietly() {
		try {
			sweepExpired();
		}
		catch (RuntimeException e) {
			// an escaping exception would cancel the periodic task
			logger.error("Expiry sweep failed", e);
		}
	}

	/**
	 * Push the expiry of the project's sandbox forward and extend any provider-side lease.
	 * @throws SandboxNotFoundException if the project has no live sandbox
	 */
	SandboxInstance extendTimeout(String projectId, int minutes) {
		if (minutes <= 0) {
			throw new IllegalArgumentException("Extension must be a positive number of minutes: " + minutes);
		}
		SandboxInstance instance = registry.get(projectId)
			.filter(candidate -> !candidate.isExpired(clock.instant()))
			.orElseThrow(() -> new SandboxNotFoundException(projectId));
		instance.extendExpiry(Duration.ofMinutes(minutes));
		instance.info("Timeout extended by " + minutes + " minute(s), now expires at " + instance.expiresAt());
		SandboxHandle handle = instance.handle();
		if (handle != null) {
			Duration remaining = Duration.between(clock.instant(), instance.expiresAt());
			try {
				instance.provider().extendLease(handle, remaining);
			}
			catch (SandboxException e) {
				logger.warn("Provider {} did not extend lease for sandbox {}: {}", instance.provider().name(),
						handle.id(), e.getMessage());
				instance.info("Provider lease extension failed: " + e.getMessage());
			}
		}
		logger.info("Extended sandbox for project {} until {}", projectId, instance.expiresAt());
		return instance;
	}

	/**
	 * Register a new instance, first making room by destroying least-recently-accessed
	 * instances of other projects. Capacity check and registration happen under one
	 * lock so concurrent creations for different projects cannot overshoot the cap.
	 * @throws SandboxException if an eviction fails or nothing can be evicted
	 */
	void admit(SandboxInstance newInstance) {
		String projectId = newInstance.projectId();
		synchronized (capacityLock) {
			while (registry.size() >= maxInstances) {
				Optional<SandboxInstance> victim = registry.leastRecentlyAccessed(projectId);
				if (victim.isEmpty()) {
					throw new SandboxException("No sandbox can be evicted to make room for project " + projectId);
				}
				SandboxInstance instance = victim.get();
				logger.info("At capacity ({}), evicting sandbox for project {} (last accessed {})", maxInstances,
						instance.projectId(), instance.lastAccessedAt());
				destroy(instance, "evicted to make room for project " + projectId);
			}
			registry.register(newInstance);
		}
	}

	/**
	 * Remove the instance from the registry and release its provider resources. Only the
	 * first caller for a given instance does anything.
	 * @param instance the instance to destroy
	 * @param reason recorded in the instance log
	 * @return true if this call destroyed the instance, false if it was already gone
	 * @throws SandboxException if the provider fails to release the environment; the
	 * instance is unregistered regardless
	 */
	boolean destroy(SandboxInstance instance, String reason) {
		if (!registry.remove(instance)) {
			return false;
		}
		instance.info("Destroying sandbox: " + reason);
		SandboxHandle handle = instance.stop();
		logger.info("Destroying sandbox {} for project {} ({})", instance.id(), instance.projectId(), reason);
		if (handle != null) {
			instance.provider().destroy(handle);
		}
		return true;
	}

}
