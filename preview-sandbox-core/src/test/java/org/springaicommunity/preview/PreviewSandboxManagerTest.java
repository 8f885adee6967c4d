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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link PreviewSandboxManager} driven through {@link StubProviderAdapter}.
 */
class PreviewSandboxManagerTest {

	private final MutableClock clock = new MutableClock();

	private StubProviderAdapter provider;

	private PreviewSandboxManager manager;

	@BeforeEach
	void setUp() {
		provider = new StubProviderAdapter();
		manager = manager(5);
	}

	@AfterEach
	void tearDown() {
		manager.close();
	}

	@Test
	void createdSandboxBecomesReadyOnceProviderReportsPublicUrl() {
		provider.answerPreview(null, "initializing").alwaysAnswerPreview("https://8081-stub-1.preview.example.com");

		SandboxStatusView started = manager.create(config("p1")).join();

		assertThat(started.status()).isEqualTo(SandboxStatus.RUNNING);
		assertThat(started.provider()).isEqualTo("stub");
		assertThat(started.sandboxId()).isEqualTo("stub-1");
		await().atMost(Duration.ofSeconds(5)).until(() -> manager.getStatus("p1").orElseThrow().isReady());
		SandboxStatusView ready = manager.getStatus("p1").orElseThrow();
		assertThat(ready.previewUrl()).isEqualTo("https://8081-stub-1.preview.example.com");
		assertThat(ready.instanceId()).isEqualTo(started.instanceId());
		assertThat(ready.readiness()).isEqualTo(ReadinessState.READY);
	}

	@Test
	void loopbackUrlIsNeverReportedForPublicProvider() {
		provider.alwaysAnswerPreview("http://localhost:8081");

		manager.create(config("p1")).join();

		await().atMost(Duration.ofSeconds(5))
			.until(() -> manager.getStatus("p1").orElseThrow().readiness() == ReadinessState.TIMED_OUT);
		SandboxStatusView status = manager.getStatus("p1").orElseThrow();
		assertThat(status.previewUrl()).isNull();
		assertThat(status.status()).isEqualTo(SandboxStatus.ERROR);
		assertThat(provider.destroyed).isEmpty();
	}

	@Test
	void concurrentCreatesForSameProjectYieldSameSandbox() throws Exception {
		CountDownLatch gate = new CountDownLatch(1);
		provider.blockCreateUntil(gate);

		CompletableFuture<SandboxStatusView> first = manager.create(config("p1"));
		assertThat(provider.awaitCreateEntered()).isTrue();
		assertThat(manager.isCreating("p1")).isTrue();
		CompletableFuture<SandboxStatusView> second = manager.create(config("p1"));
		gate.countDown();

		assertThat(first.join().instanceId()).isEqualTo(second.join().instanceId());
		assertThat(provider.createCalls).hasValue(1);
		assertThat(manager.activeSandboxes()).hasSize(1);
	}

	@Test
	void creatingAgainReplacesExistingSandbox() {
		SandboxStatusView first = manager.create(config("p1")).join();

		SandboxStatusView second = manager.create(config("p1")).join();

		assertThat(second.instanceId()).isNotEqualTo(first.instanceId());
		assertThat(provider.destroyed).containsExactly(first.sandboxId());
		assertThat(manager.activeSandboxes()).extracting(SandboxStatusView::instanceId)
			.containsExactly(second.instanceId());
	}

	@Test
	void leastRecentlyAccessedSandboxIsEvictedAtCapacity() {
		manager.close();
		manager = manager(2);
		SandboxStatusView p1 = manager.create(config("p1")).join();
		clock.advance(Duration.ofSeconds(1));
		SandboxStatusView p2 = manager.create(config("p2")).join();
		clock.advance(Duration.ofSeconds(1));
		manager.getStatus("p1");
		clock.advance(Duration.ofSeconds(1));

		SandboxStatusView p3 = manager.create(config("p3")).join();

		assertThat(provider.destroyed).containsExactly(p2.sandboxId());
		assertThat(manager.getStatus("p2")).isEmpty();
		assertThat(manager.getStatus("p1")).map(SandboxStatusView::instanceId).contains(p1.instanceId());
		assertThat(manager.getStatus("p3")).map(SandboxStatusView::instanceId).contains(p3.instanceId());
		assertThat(manager.activeSandboxes()).hasSize(2);
	}

	@Test
	void expiredSandboxIsReportedAbsentAndDestroyedOnce() {
		SandboxStatusView created = manager.create(config("p1")).join();
		clock.advance(Duration.ofMinutes(11));

		assertThat(manager.getStatus("p1")).isEmpty();
		assertThat(manager.getStatus("p1")).isEmpty();
		assertThat(manager.getLogs("p1", 10)).isEmpty();
		assertThat(provider.destroyed).containsExactly(created.sandboxId());
	}

	@Test
	void sweepDestroysExpiredSandboxes() {
		manager.create(config("p1")).join();
		manager.create(config("p2"), "pro").join();
		clock.advance(Duration.ofMinutes(15));

		assertThat(manager.sweepExpired()).isEqualTo(1);

		assertThat(manager.activeSandboxes()).extracting(SandboxStatusView::projectId).containsExactly("p2");
	}

	@Test
	void tierDecidesLifetime() {
		SandboxStatusView pro = manager.create(config("p1"), "pro").join();
		SandboxStatusView unknown = manager.create(config("p2"), "enterprise").join();

		assertThat(Duration.between(pro.createdAt(), pro.expiresAt())).isEqualTo(Duration.ofMinutes(30));
		assertThat(Duration.between(unknown.createdAt(), unknown.expiresAt())).isEqualTo(Duration.ofMinutes(10));
		assertThat(manager.ttlFor("business")).isEqualTo(Duration.ofMinutes(60));
	}

	@Test
	void extendTimeoutPushesExpiryAndExtendsProviderLease() {
		SandboxStatusView created = manager.create(config("p1")).join();

		SandboxStatusView extended = manager.extendTimeout("p1", 5);

		assertThat(extended.expiresAt()).isEqualTo(created.expiresAt().plus(Duration.ofMinutes(5)));
		assertThat(provider.leaseExtensions).containsExactly(Duration.ofMinutes(15));
		clock.advance(Duration.ofMinutes(12));
		assertThat(manager.getStatus("p1")).isPresent();
	}

	@Test
	void extendTimeoutForUnknownProjectFails() {
		assertThatThrownBy(() -> manager.extendTimeout("missing", 5)).isInstanceOf(SandboxNotFoundException.class)
			.hasMessageContaining("missing");
	}

	@Test
	void destroyIsIdempotent() {
		SandboxStatusView created = manager.create(config("p1")).join();

		assertThat(manager.destroy("p1")).isTrue();
		assertThat(manager.destroy("p1")).isFalse();

		assertThat(provider.destroyed).containsExactly(created.sandboxId());
		assertThat(manager.getStatus("p1")).isEmpty();
	}

	@Test
	void failedCreationIsReportedThroughStatusAndLogs() {
		provider.failCreate(new SandboxException("quota exceeded"));

		assertThatThrownBy(() -> manager.create(config("p1")).join()).isInstanceOf(CompletionException.class)
			.hasCauseInstanceOf(SandboxProvisioningException.class)
			.hasMessageContaining("quota exceeded");

		SandboxStatusView failed = manager.getStatus("p1").orElseThrow();
		assertThat(failed.status()).isEqualTo(SandboxStatus.ERROR);
		assertThat(manager.getLogs("p1", 50)).extracting(LogEntry::message)
			.anyMatch(message -> message.contains("quota exceeded"));
		assertThat(manager.activeSandboxes()).isEmpty();

		manager.destroy("p1");
		assertThat(manager.getStatus("p1")).isEmpty();
	}

	@Test
	void logsAreReturnedOldestFirstUpToLimit() {
		manager.create(SandboxConfig.of("p1", "owner", List.of(FileSpec.of("App.tsx", "app")))).join();

		List<LogEntry> lastTwo = manager.getLogs("p1", 2);
		List<String> all = manager.getLogs("p1", 100).stream().map(LogEntry::message).toList();

		assertThat(all).contains("allocated", "Wrote 1 file(s)");
		assertThat(all.indexOf("allocated")).isLessThan(all.indexOf("Wrote 1 file(s)"));
		assertThat(lastTwo).hasSize(2);
		assertThat(all).containsAll(lastTwo.stream().map(LogEntry::message).toList());
	}

	@Test
	void unknownProviderIsRejected() {
		assertThatThrownBy(() -> manager.create(config("p1"), "free", "e2b"))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("e2b");
	}

	@Test
	void closeDestroysEverySandboxAndRejectsNewWork() {
		SandboxStatusView p1 = manager.create(config("p1")).join();
		SandboxStatusView p2 = manager.create(config("p2")).join();

		manager.close();

		assertThat(manager.isClosed()).isTrue();
		assertThat(provider.destroyed).containsExactlyInAnyOrder(p1.sandboxId(), p2.sandboxId());
		assertThat(manager.activeSandboxes()).isEmpty();
		assertThatThrownBy(() -> manager.create(config("p3"))).isInstanceOf(IllegalStateException.class);
	}

	private PreviewSandboxManager manager(int maxInstances) {
		SandboxManagerConfig config = SandboxManagerConfig.builder()
			.maxInstances(maxInstances)
			.pollInterval(Duration.ofMillis(20))
			.pollMaxAttempts(20)
			.sweepInterval(Duration.ofHours(1))
			.build();
		return PreviewSandboxManager.builder().config(config).provider(provider).clock(clock).build();
	}

	private static SandboxConfig config(String projectId) {
		return SandboxConfig.of(projectId, "owner", List.of(FileSpec.of("package.json", "{}")));
	}

}
