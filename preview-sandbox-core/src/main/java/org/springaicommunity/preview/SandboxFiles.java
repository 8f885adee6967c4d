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

/**
 * Accessor for file operations within a sandbox working directory.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * handle.files()
 *     .create("App.tsx", appSource)
 *     .create("package.json", manifest)
 *     .createDirectory("assets");
 *
 * assertTrue(handle.files().exists("package.json"));
 * }</pre>
 *
 * @since 0.1.0
 * @see SandboxHandle#files()
 */
public interface SandboxFiles {

	/**
	 * Create a file in the sandbox working directory.
	 * <p>
	 * Parent directories are created automatically if they don't exist.
	 * </p>
	 * @param relativePath path relative to the sandbox working directory
	 * @param content file content
	 * @return this SandboxFiles for method chaining
	 * @throws SandboxException if the file cannot be created
	 */
	SandboxFiles create(String relativePath, String content);

	/**
	 * Create a directory in the sandbox working directory, including parents.
	 * @param relativePath path relative to the sandbox working directory
	 * @return this SandboxFiles for method chaining
	 * @throws SandboxException if the directory cannot be created
	 */
	SandboxFiles createDirectory(String relativePath);

	/**
	 * Write multiple files in order, creating parent directories as needed.
	 * @param files list of file specifications
	 * @return this SandboxFiles for method chaining
	 * @throws SandboxException if any file cannot be created
	 */
	default SandboxFiles setup(List<FileSpec> files) {
		for (FileSpec file : files) {
			create(file.path(), file.content());
		}
		return this;
	}

	/**
	 * Read a file from the sandbox working directory.
	 * @param relativePath path relative to the sandbox working directory
	 * @return file content as a string
	 * @throws SandboxException if the file cannot be read
	 */
	String read(String relativePath);

	/**
	 * Check if a file or directory exists in the sandbox.
	 * @param relativePath path relative to the sandbox working directory
	 * @return true if the path exists, false otherwise
	 */
	boolean exists(String relativePath);

}
