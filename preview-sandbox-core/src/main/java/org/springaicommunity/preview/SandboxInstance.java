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
import java.util.List;
import java.util.concurrent.Future;

/**
 * A live (or just finished) sandbox for one project.
 *
 * <p>
 * All state transitions are guarded by the instance monitor and only ever move
 * forward (see {@link SandboxStatus#canTransitionTo}). The provider handle is attached
 * once the provider has allocated the environment and detached exactly once when the
 * instance stops, so whoever detaches it owns the provider-side teardown.
 * </p>
 *
 * @since 0.1.0
 */
public final class SandboxInstance {

	private final String id;

	private final String projectId;

	private final String ownerId;

	private final String tier;

	private final ProviderAdapter provider;

	private final Clock clock;

	private final Instant createdAt;

	private final LogBuffer logs;

	private SandboxStatus status = SandboxStatus.CREATING;

	private ReadinessState readiness = ReadinessState.PENDING;

	private SandboxHandle handle;

	private String sandboxId;

	private String previewUrl;

	private String localEndpoint;

	private Instant expiresAt;

	private volatile Instant lastAccessedAt;

	private Future<?> readinessTask;

	SandboxInstance(String id, SandboxConfig config, String tier, ProviderAdapter provider, Clock clock, Duration ttl,
			int logCapacity) {
		this.id = id;
		this.projectId = config.projectId();
		this.ownerId = config.ownerId();
		this.tier = tier;
		this.provider = provider;
		this.clock = clock;
		this.createdAt = clock.instant();
		this.expiresAt = createdAt.plus(ttl);
		this.lastAccessedAt = createdAt;
		this.logs = new LogBuffer(logCapacity);
	}

	public String id() {
		return id;
	}

	public String projectId() {
		return projectId;
	}

	public String ownerId() {
		return ownerId;
	}

	public String tier() {
		return tier;
	}

	public ProviderAdapter provider() {
		return provider;
	}

	public Instant createdAt() {
		return createdAt;
	}

	public Instant lastAccessedAt() {
		return lastAccessedAt;
	}

	public LogBuffer logs() {
		return logs;
	}

	public synchronized SandboxStatus status() {
		return status;
	}

	public synchronized ReadinessState readiness() {
		return readiness;
	}

	public synchronized String previewUrl() {
		return previewUrl;
	}

	public synchronized String localEndpoint() {
		return localEndpoint;
	}

	public synchronized String sandboxId() {
		return sandboxId;
	}

	public synchronized Instant expiresAt() {
		return expiresAt;
	}

	synchronized SandboxHandle handle() {
		return handle;
	}

	public synchronized boolean isExpired(Instant now) {
		return !expiresAt.isAfter(now);
	}

	void touch() {
		this.lastAccessedAt = clock.instant();
	}

	/**
	 * Append an informational line to the instance log.
	 * @param message the message
	 */
	public void info(String message) {
		logs.append(new LogEntry(clock.instant(), LogStream.INFO, message));
	}

	/**
	 * Append a line of environment output to the instance log.
	 * @param stream the stream the line came from
	 * @param line the line
	 */
	public void output(LogStream stream, String line) {
		logs.append(new LogEntry(clock.instant(), stream, line));
	}

	/**
	 * Attach the provider handle. Fails if the instance was stopped in the meantime, in
	 * which case the caller still owns the handle and must release it.
	 */
	synchronized boolean attachHandle(SandboxHandle handle) {
		if (status == SandboxStatus.STOPPED) {
			return false;
		}
		this.handle = handle;
		this.sandboxId = handle.id();
		return true;
	}

	synchronized boolean markRunning(String endpoint) {
		if (!transition(SandboxStatus.RUNNING)) {
			return false;
		}
		this.localEndpoint = endpoint;
		return true;
	}

	synchronized boolean markReady(String url) {
		if (status != SandboxStatus.RUNNING || readiness != ReadinessState.PENDING) {
			return false;
		}
		this.readiness = ReadinessState.READY;
		this.previewUrl = url;
		return true;
	}

	synchronized boolean markReadinessEnded(ReadinessState outcome) {
		if (readiness != ReadinessState.PENDING) {
			return false;
		}
		this.readiness = outcome;
		transition(SandboxStatus.ERROR);
		return true;
	}

	/**
	 * Move to {@link SandboxStatus#ERROR} after a failed creation step and detach the
	 * handle so the caller can release it.
	 * @return the detached handle, or {@code null} if none was attached or the instance
	 * was already stopped
	 */
	synchronized SandboxHandle fail() {
		transition(SandboxStatus.ERROR);
		SandboxHandle detached = this.handle;
		this.handle = null;
		return detached;
	}

	/**
	 * Stop the instance: cancel background readiness polling and detach the handle.
	 * @return the detached handle, or {@code null} if it was already released
	 */
	synchronized SandboxHandle stop() {
		transition(SandboxStatus.STOPPED);
		cancelReadinessTask();
		SandboxHandle detached = this.handle;
		this.handle = null;
		return detached;
	}

	synchronized void extendExpiry(Duration extension) {
		this.expiresAt = expiresAt.plus(extension);
	}

	synchronized void setReadinessTask(Future<?> task) {
		if (status == SandboxStatus.STOPPED || readiness != ReadinessState.PENDING) {
			task.cancel(false);
			return;
		}
		this.readinessTask = task;
	}

	synchronized void cancelReadinessTask() {
		if (readinessTask != null) {
			readinessTask.cancel(false);
			readinessTask = null;
		}
	}

	private boolean transition(SandboxStatus next) {
		if (!status.canTransitionTo(next)) {
			return false;
		}
		this.status = next;
		return true;
	}

	/**
	 * Take an immutable snapshot of this instance.
	 * @param logTail the number of most recent log lines to include
	 * @return the status view
	 */
	public synchronized SandboxStatusView view(int logTail) {
		List<LogEntry> tail = logs.tail(logTail);
		return new SandboxStatusView(projectId, id, sandboxId, provider.name(), status, readiness, previewUrl,
				createdAt, expiresAt, tail);
	}

	@Override
	public String toString() {
		return "SandboxInstance{id=" + id + ", projectId=" + projectId + ", provider=" + provider.name() + "}";
	}

}
