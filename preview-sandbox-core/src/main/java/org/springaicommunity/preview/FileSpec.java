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

import java.util.Objects;

/**
 * A project file to be written into a sandbox workspace.
 *
 * <p>
 * Paths are relative to the sandbox working directory and use {@code /} as the
 * separator. Absolute paths, {@code ..} segments, backslashes and empty segments are
 * rejected. The content is opaque and never inspected.
 * </p>
 *
 * @param path relative path within the sandbox working directory
 * @param content file content as a string
 * @since 0.1.0
 */
public record FileSpec(String path, String content) {

	public FileSpec {
		Objects.requireNonNull(content, "content cannot be null");
		validatePath(path);
	}

	/**
	 * Create a file specification.
	 * @param path relative path within the sandbox
	 * @param content file content
	 * @return a new FileSpec
	 * @throws IllegalArgumentException if the path is not a well-formed relative path
	 */
	public static FileSpec of(String path, String content) {
		return new FileSpec(path, content);
	}

	/**
	 * Get the parent directory of this file, or {@code null} for files at the root.
	 * @return the parent directory path
	 */
	public String parentPath() {
		int slash = path.lastIndexOf('/');
		return slash > 0 ? path.substring(0, slash) : null;
	}

	private static void validatePath(String path) {
		if (path == null || path.isBlank()) {
			throw new IllegalArgumentException("File path cannot be empty");
		}
		if (path.startsWith("/") || path.contains("\\") || path.matches("^[A-Za-z]:.*")) {
			throw new IllegalArgumentException("File path must be relative: " + path);
		}
		for (String segment : path.split("/", -1)) {
			if (segment.isEmpty()) {
				throw new IllegalArgumentException("File path has an empty segment: " + path);
			}
			if ("..".equals(segment)) {
				throw new IllegalArgumentException("File path escapes the workspace: " + path);
			}
		}
	}

}
