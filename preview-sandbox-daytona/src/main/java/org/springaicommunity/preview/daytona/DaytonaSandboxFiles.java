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
package org.springaicommunity.preview.daytona;

import java.time.Duration;

import org.springaicommunity.preview.FileSpec;
import org.springaicommunity.preview.SandboxException;
import org.springaicommunity.preview.SandboxFiles;

/**
 * {@link SandboxFiles} backed by the Daytona toolbox API.
 *
 * @since 0.1.0
 */
class DaytonaSandboxFiles implements SandboxFiles {

	private static final Duration MKDIR_TIMEOUT = Duration.ofSeconds(30);

	private final DaytonaApiClient apiClient;

	private final String sandboxId;

	private final String workDir;

	DaytonaSandboxFiles(DaytonaApiClient apiClient, String sandboxId, String workDir) {
		this.apiClient = apiClient;
		this.sandboxId = sandboxId;
		this.workDir = workDir;
	}

	@Override
	public SandboxFiles create(String relativePath, String content) {
		FileSpec file = FileSpec.of(relativePath, content);
		String parent = file.parentPath();
		if (parent != null) {
			makeDirectories(resolvePath(parent));
		}
		apiClient.uploadFile(sandboxId, resolvePath(file.path()), file.content());
		return this;
	}

	@Override
	public SandboxFiles createDirectory(String relativePath) {
		makeDirectories(resolvePath(relativePath));
		return this;
	}

	@Override
	public String read(String relativePath) {
		return apiClient.downloadFile(sandboxId, resolvePath(relativePath));
	}

	@Override
	public boolean exists(String relativePath) {
		return apiClient.fileExists(sandboxId, resolvePath(relativePath));
	}

	void makeDirectories(String absolutePath) {
		DaytonaApiClient.ExecuteResponse response = apiClient.executeCommand(sandboxId,
				"mkdir -p " + shellQuote(absolutePath), null, MKDIR_TIMEOUT);
		if (response.exitCode() != 0) {
			throw new SandboxException(
					"Failed to create directory " + absolutePath + ": exit " + response.exitCode() + " - "
							+ response.result());
		}
	}

	String resolvePath(String relativePath) {
		if (".".equals(relativePath)) {
			return workDir;
		}
		return workDir + "/" + FileSpec.of(relativePath, "").path();
	}

	static String shellQuote(String value) {
		return "'" + value.replace("'", "'\\''") + "'";
	}

}
