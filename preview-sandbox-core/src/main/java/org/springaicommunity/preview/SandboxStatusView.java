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
import java.util.List;

/**
 * Immutable snapshot of a sandbox as reported to callers.
 *
 * @param projectId the project the sandbox belongs to
 * @param instanceId the locally generated instance id
 * @param sandboxId the provider-assigned environment id, {@code null} if the provider
 * never allocated one
 * @param provider the provider name
 * @param status the lifecycle status
 * @param readiness the preview readiness
 * @param previewUrl the confirmed preview URL, {@code null} until ready
 * @param createdAt when creation started
 * @param expiresAt when the sandbox will be destroyed unless extended
 * @param logTail the most recent log lines, oldest first
 * @since 0.1.0
 */
public record SandboxStatusView(String projectId, String instanceId, String sandboxId, String provider,
		SandboxStatus status, ReadinessState readiness, String previewUrl, Instant createdAt, Instant expiresAt,
		List<LogEntry> logTail) {

	public SandboxStatusView {
		logTail = List.copyOf(logTail);
	}

	public boolean isReady() {
		return readiness == ReadinessState.READY && previewUrl != null;
	}

}
