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

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of live sandboxes, at most one per project, plus the last creation
 * failure per project.
 *
 * <p>
 * Removal is compare-and-remove on the exact instance, so when explicit destroy, TTL
 * expiry, eviction and replacement race for the same instance exactly one of them wins.
 * </p>
 *
 * @since 0.1.0
 */
final class SandboxRegistry {

	private final Map<String, SandboxInstance> instances = new ConcurrentHashMap<>();

	private final Map<String, RecordedFailure> failures = new ConcurrentHashMap<>();

	/**
	 * Register an instance as the current one for its project.
	 * @return the instance previously registered for the project, if any
	 */
	Optional<SandboxInstance> register(SandboxInstance instance) {
		failures.remove(instance.projectId());
		return Optional.ofNullable(instances.put(instance.projectId(), instance));
	}

	Optional<SandboxInstance> get(String projectId) {
		return Optional.ofNullable(instances.get(projectId));
	}

	/**
	 * Remove the instance if it is still the current one for its project.
	 * @return true if this call removed it
	 */
	boolean remove(SandboxInstance instance) {
		return instances.remove(instance.projectId(), instance);
	}

	boolean isCurrent(SandboxInstance instance) {
		return instances.get(instance.projectId()) == instance;
	}

	List<SandboxInstance> snapshot() {
		return List.copyOf(instances.values());
	}

	int size() {
		return instances.size();
	}

	/**
	 * Find the instance with the oldest access time, ignoring the given project.
	 */
	Optional<SandboxInstance> leastRecentlyAccessed(String excludedProjectId) {
		return instances.values()
			.stream()
			.filter(instance -> !instance.projectId().equals(excludedProjectId))
			.min(Comparator.comparing(SandboxInstance::lastAccessedAt));
	}

	void recordFailure(SandboxStatusView view, Instant recordedAt) {
		failures.put(view.projectId(), new RecordedFailure(view, recordedAt));
	}

	Optional<SandboxStatusView> failure(String projectId) {
		return Optional.ofNullable(failures.get(projectId)).map(RecordedFailure::view);
	}

	/**
	 * Forget failures recorded before the cutoff.
	 * @return the number of failures dropped
	 */
	int pruneFailures(Instant cutoff) {
		int pruned = 0;
		for (Map.Entry<String, RecordedFailure> entry : failures.entrySet()) {
			if (entry.getValue().recordedAt().isBefore(cutoff) && failures.remove(entry.getKey(), entry.getValue())) {
				pruned++;
			}
		}
		return pruned;
	}

	boolean clearFailure(String projectId) {
		return failures.remove(projectId) != null;
	}

	private record RecordedFailure(SandboxStatusView view, Instant recordedAt) {
	}

}
