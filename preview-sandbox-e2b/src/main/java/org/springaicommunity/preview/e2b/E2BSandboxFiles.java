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
package org.springaicommunity.preview.e2b;

import org.springaicommunity.preview.FileSpec;
import org.springaicommunity.preview.SandboxFiles;

/**
 * {@link SandboxFiles} backed by the envd agent of an E2B sandbox.
 *
 * @since 0.1.0
 */
class E2BSandboxFiles implements SandboxFiles {

	private final E2BEnvdClient envdClient;

	private final String workDir;

	E2BSandboxFiles(E2BEnvdClient envdClient, String workDir) {
		this.envdClient = envdClient;
		this.workDir = workDir;
	}

	@Override
	public SandboxFiles create(String relativePath, String content) {
		FileSpec file = FileSpec.of(relativePath, content);
		String parent = file.parentPath();
		if (parent != null) {
			envdClient.makeDir(resolvePath(parent));
		}
		envdClient.writeFile(resolvePath(file.path()), file.content());
		return this;
	}

	@Override
	public SandboxFiles createDirectory(String relativePath) {
		envdClient.makeDir(resolvePath(relativePath));
		return this;
	}

	@Override
	public String read(String relativePath) {
		return envdClient.readFile(resolvePath(relativePath));
	}

	@Override
	public boolean exists(String relativePath) {
		return envdClient.exists(resolvePath(relativePath));
	}

	String resolvePath(String relativePath) {
		if (".".equals(relativePath)) {
			return workDir;
		}
		return workDir + "/" + FileSpec.of(relativePath, "").path();
	}

}
