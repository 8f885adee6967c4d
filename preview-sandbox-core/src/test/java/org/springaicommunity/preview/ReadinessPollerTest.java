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
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link ReadinessPoller}.
 */
class ReadinessPollerTest {

	private final SandboxRegistry registry = new SandboxRegistry();

	private final MutableClock clock = new MutableClock();

	private ScheduledExecutorService scheduler;

	private StubProviderAdapter provider;

	@BeforeEach
	void setUp() {
		scheduler = Executors.newSingleThreadScheduledExecutor();
		provider = new StubProviderAdapter();
	}

	@AfterEach
	void tearDown() {
		scheduler.shutdownNow();
	}

	@Test
	void placeholderUrlsAreNeverReportedReady() {
		provider.answerPreview("", "initializing", "pending", "http://localhost:8081", "https://p1.preview.example");
		ReadinessPoller poller = new ReadinessPoller(scheduler, registry, Duration.ofSeconds(3), 10);
		SandboxInstance instance = runningInstance("p1");
		AtomicInteger attempts = new AtomicInteger();

		for (int i = 0; i < 4; i++) {
			poller.poll(instance, attempts);
			assertThat(instance.readiness()).isEqualTo(ReadinessState.PENDING);
			assertThat(instance.previewUrl()).isNull();
		}
		poller.poll(instance, attempts);

		assertThat(instance.readiness()).isEqualTo(ReadinessState.READY);
		assertThat(instance.previewUrl()).isEqualTo("https://p1.preview.example");
		assertThat(instance.status()).isEqualTo(SandboxStatus.RUNNING);
	}

	@Test
	void localhostAcceptedWhenProviderServesLocally() {
		provider.requiresPublicUrl(false).answerPreview("http://localhost:8082");
		ReadinessPoller poller = new ReadinessPoller(scheduler, registry, Duration.ofSeconds(3), 10);
		SandboxInstance instance = runningInstance("p1");

		poller.poll(instance, new AtomicInteger());

		assertThat(instance.previewUrl()).isEqualTo("http://localhost:8082");
	}

	@Test
	void exhaustedBudgetMovesToErrorWithoutDestroying() {
		ReadinessPoller poller = new ReadinessPoller(scheduler, registry, Duration.ofSeconds(3), 3);
		SandboxInstance instance = runningInstance("p1");
		AtomicInteger attempts = new AtomicInteger();

		for (int i = 0; i < 5; i++) {
			poller.poll(instance, attempts);
		}

		assertThat(provider.previewCalls).hasValue(3);
		assertThat(instance.readiness()).isEqualTo(ReadinessState.TIMED_OUT);
		assertThat(instance.status()).isEqualTo(SandboxStatus.ERROR);
		assertThat(messages(instance)).anyMatch(message -> message.contains("timed out after 3 attempts"));
		assertThat(provider.destroyed).isEmpty();
		assertThat(registry.isCurrent(instance)).isTrue();
	}

	@Test
	void terminalFailureEndsPolling() {
		provider.failPreview(new PreviewFailedException("Dev server exited with code 1"));
		ReadinessPoller poller = new ReadinessPoller(scheduler, registry, Duration.ofSeconds(3), 10);
		SandboxInstance instance = runningInstance("p1");
		AtomicInteger attempts = new AtomicInteger();

		poller.poll(instance, attempts);
		poller.poll(instance, attempts);

		assertThat(provider.previewCalls).hasValue(1);
		assertThat(instance.readiness()).isEqualTo(ReadinessState.FAILED);
		assertThat(instance.status()).isEqualTo(SandboxStatus.ERROR);
		assertThat(messages(instance)).anyMatch(message -> message.contains("exited with code 1"));
	}

	@Test
	void probeErrorCountsAsNotReadyAttempt() {
		provider.failPreview(new SandboxException("connection refused"));
		ReadinessPoller poller = new ReadinessPoller(scheduler, registry, Duration.ofSeconds(3), 10);
		SandboxInstance instance = runningInstance("p1");

		poller.poll(instance, new AtomicInteger());

		assertThat(instance.readiness()).isEqualTo(ReadinessState.PENDING);
		assertThat(instance.status()).isEqualTo(SandboxStatus.RUNNING);
		assertThat(messages(instance)).anyMatch(message -> message.contains("probe error: connection refused"));
	}

	@Test
	void unregisteredInstanceIsNotPolled() {
		provider.alwaysAnswerPreview("https://p1.preview.example");
		ReadinessPoller poller = new ReadinessPoller(scheduler, registry, Duration.ofSeconds(3), 10);
		SandboxInstance instance = runningInstance("p1");
		registry.remove(instance);

		poller.poll(instance, new AtomicInteger());

		assertThat(provider.previewCalls).hasValue(0);
		assertThat(instance.previewUrl()).isNull();
	}

	@Test
	void scheduledPollingStopsOnceReady() {
		provider.answerPreview(null, null).alwaysAnswerPreview("https://p1.preview.example");
		ReadinessPoller poller = new ReadinessPoller(scheduler, registry, Duration.ofMillis(10), 100);
		SandboxInstance instance = runningInstance("p1");

		poller.start(instance);

		await().atMost(Duration.ofSeconds(5)).until(() -> instance.readiness() == ReadinessState.READY);
		int callsWhenReady = provider.previewCalls.get();
		assertThat(callsWhenReady).isGreaterThanOrEqualTo(3);
		await().during(Duration.ofMillis(100))
			.atMost(Duration.ofSeconds(1))
			.until(() -> provider.previewCalls.get() == callsWhenReady);
	}

	private SandboxInstance runningInstance(String projectId) {
		SandboxInstance instance = new SandboxInstance("i-" + projectId,
				SandboxConfig.of(projectId, "owner", List.of()), "free", provider, clock, Duration.ofMinutes(10),
				100);
		registry.register(instance);
		instance.attachHandle(provider.create(SandboxConfig.of(projectId, "owner", List.of()), OutputListener.NONE));
		instance.markRunning("http://localhost:8081");
		return instance;
	}

	private static List<String> messages(SandboxInstance instance) {
		return instance.logs().snapshot().stream().map(LogEntry::message).toList();
	}

}
