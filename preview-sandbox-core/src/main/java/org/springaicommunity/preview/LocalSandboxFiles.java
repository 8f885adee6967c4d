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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Local filesystem implementation of {@link SandboxFiles}, rooted at a workspace
 * directory.
 *
 * <p>
 * Every path is resolved against the workspace and rejected if it would land outside of
 * it.
 * </p>
 *
 * @since 0.1.0
 */
class LocalSandboxFiles implements SandboxFiles {

	private final Path workDir;

	LocalSandboxFiles(Path workDir) {
		this.workDir = workDir.toAbsolutePath().normalize();
	}

	@Override
	public SandboxFiles create(String relativePath, String content) {
		try {
			Path filePath = resolve(relativePath);
			Path parent = filePath.getParent();
			if (parent != null && !Files.exists(parent)) {
				Files.createDirectories(parent);
			}
			Files.writeString(filePath, content, StandardCharsets.UTF_8);
			return this;
		}
		catch (IOException e) {
			throw new SandboxException("Failed to create file: " + relativePath, e);
		}
	}

	@Override
	public SandboxFiles createDirectory(String relativePath) {
		try {
			Files.createDirectories(resolve(relativePath));
			return this;
		}
		catch (IOException e) {
			throw new SandboxException("Failed to create directory: " + relativePath, e);
		}
	}

	@Override
	public String read(String relativePath) {
		try {
			return Files.readString(resolve(relativePath), StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new SandboxException("Failed to read file: " + relativePath, e);
		}
	}

	@Override
	public boolean exists(String relativePath) {
		return Files.exists(resolve(relativePath));
	}

	Path workDir() {
		return workDir;
	}

	private Path resolve(String relativePath) {
		Path resolved = workDir.resolve(relativePath).normalize();
		if (!resolved.startsWith(workDir)) {
			throw new SandboxException("Path escapes the workspace: " + relativePath);
		}
		return resolved;
	}

}
