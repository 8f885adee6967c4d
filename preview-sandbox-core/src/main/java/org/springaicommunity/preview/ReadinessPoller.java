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
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background loop that asks a running sandbox's provider for its preview URL until a
 * usable one appears or the attempt budget runs out.
 *
 * <p>
 * Each attempt is a single non-blocking {@link ProviderAdapter#getPreviewUrl} call.
 * Probe exceptions count as a not-ready attempt. A {@link PreviewFailedException} ends
 * polling with {@link ReadinessState#FAILED}; running out of attempts ends it with
 * {@link ReadinessState#TIMED_OUT}. Either way the sandbox moves to
 * {@link SandboxStatus#ERROR} but is left in place for the caller to inspect or destroy.
 * </p>
 *
 * <p>
 * Before acting on a result the loop re-checks that its instance is still the current
 * one for the project, so a late answer for a destroyed or replaced sandbox is dropped.
 * </p>
 *
 * @since 0.1.0
 */
final class ReadinessPoller {

	private static final Logger logger = LoggerFactory.getLogger(ReadinessPoller.class);

	private final ScheduledExecutorService scheduler;

	private final SandboxRegistry registry;

	private final Duration interval;

	private final int maxAttempts;

	ReadinessPoller(ScheduledExecutorService scheduler, SandboxRegistry registry, Duration interval,
			int maxAttempts) {
		if (maxAttempts <= 0) {
			throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
		}
		this.scheduler = scheduler;
		this.registry = registry;
		this.interval = interval;
		this.maxAttempts = maxAttempts;
	}

	/**
	 * Start polling for the instance. The first attempt runs immediately.
	 */
	void start(SandboxInstance instance) {
		AtomicInteger attempts = new AtomicInteger();
		instance.info("Waiting for preview URL (" + maxAttempts + " attempts, every " + interval.toMillis() + " ms)");
		ScheduledFuture<?> task = scheduler.scheduleWithFixedDelay(() -> poll(instance, attempts), 0,
				interval.toMillis(), TimeUnit.MILLISECONDS);
		instance.setReadinessTask(task);
	}

	void poll(SandboxInstance instance, AtomicInteger attempts) {
		if (!registry.isCurrent(instance) || instance.readiness() != ReadinessState.PENDING) {
			instance.cancelReadinessTask();
			return;
		}
		SandboxHandle handle = instance.handle();
		if (handle == null) {
			instance.cancelReadinessTask();
			return;
		}
		int attempt = attempts.incrementAndGet();
		ProviderAdapter provider = instance.provider();
		try {
			Optional<String> candidate = provider.getPreviewUrl(handle);
			if (!registry.isCurrent(instance)) {
				logger.debug("Discarding preview result for replaced sandbox {}", instance.id());
				instance.cancelReadinessTask();
				return;
			}
			if (candidate.isPresent() && PreviewUrls.isUsable(candidate.get(), provider.requiresPublicUrl())) {
				if (instance.markReady(candidate.get())) {
					instance.info("Attempt " + attempt + "/" + maxAttempts + ": preview ready at " + candidate.get());
					logger.info("Preview ready for project {}: {}", instance.projectId(), candidate.get());
				}
				instance.cancelReadinessTask();
				return;
			}
			instance.info("Attempt " + attempt + "/" + maxAttempts + ": preview not ready"
					+ candidate.map(url -> " (got '" + url + "')").orElse(""));
		}
		catch (PreviewFailedException e) {
			if (registry.isCurrent(instance) && instance.markReadinessEnded(ReadinessState.FAILED)) {
				instance.info("Attempt " + attempt + "/" + maxAttempts + ": preview failed: " + e.getMessage());
				logger.warn("Preview failed for project {}: {}", instance.projectId(), e.getMessage());
			}
			instance.cancelReadinessTask();
			return;
		}
		catch (RuntimeException e) {
			instance.info("Attempt " + attempt + "/" + maxAttempts + ": probe error: " + e.getMessage());
			logger.debug("Preview probe for project {} failed", instance.projectId(), e);
		}
		if (attempt >= maxAttempts) {
			if (registry.isCurrent(instance) && instance.markReadinessEnded(ReadinessState.TIMED_OUT)) {
				instance.info("Preview readiness timed out after " + maxAttempts + " attempts");
				logger.warn("Preview for project {} not ready after {} attempts", instance.projectId(), maxAttempts);
			}
			instance.cancelReadinessTask();
		}
	}

}
