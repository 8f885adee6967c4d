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

import java.util.List;
import java.util.Objects;

/**
 * Input describing the project to preview: who owns it and the files that make it up.
 *
 * @param projectId the project identifier, the key under which at most one sandbox is
 * live
 * @param ownerId the owning user, recorded on the sandbox and passed to cloud providers
 * as metadata
 * @param files the project files in write order; duplicate paths are allowed and the
 * last one wins
 * @since 0.1.0
 */
public record SandboxConfig(String projectId, String ownerId, List<FileSpec> files) {

	public SandboxConfig {
		if (projectId == null || projectId.isBlank()) {
			throw new IllegalArgumentException("Project id cannot be empty");
		}
		Objects.requireNonNull(files, "files cannot be null");
		files = List.copyOf(files);
	}

	/**
	 * Create a config for the given project.
	 * @param projectId the project identifier
	 * @param ownerId the owning user
	 * @param files the project files
	 * @return a new SandboxConfig
	 */
	public static SandboxConfig of(String projectId, String ownerId, List<FileSpec> files) {
		return new SandboxConfig(projectId, ownerId, files);
	}

}
