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

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Installs a project's dependencies into a directory that already contains its
 * manifest.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface DependencyInstaller {

	/**
	 * Install dependencies in the directory.
	 * @param directory the project directory
	 * @throws SandboxException if installation fails
	 */
	void install(Path directory);

	/**
	 * Installer running {@code npm install --legacy-peer-deps}.
	 * @param runner the process runner
	 * @param timeout the install timeout
	 * @param env extra environment variables
	 * @return the installer
	 */
	static DependencyInstaller npm(ProcessRunner runner, Duration timeout, Map<String, String> env) {
		return directory -> {
			ExecSpec spec = ExecSpec.builder()
				.command("npm", "install", "--legacy-peer-deps")
				.env(env)
				.timeout(timeout)
				.build();
			ExecResult result = runner.run(spec, directory);
			if (result.failed()) {
				throw new SandboxException("npm install failed with exit code " + result.exitCode() + ": "
						+ result.outputTail(2000));
			}
		};
	}

}
