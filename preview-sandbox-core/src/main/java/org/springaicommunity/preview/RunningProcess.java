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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A process started by {@link ProcessRunner#start}. Destroying it also kills every
 * descendant, since dev server launchers such as {@code npx} fork the real server.
 *
 * @since 0.1.0
 */
public final class RunningProcess {

	private static final Logger logger = LoggerFactory.getLogger(RunningProcess.class);

	private static final long GRACE_PERIOD_SECONDS = 5;

	private final Process process;

	RunningProcess(Process process) {
		this.process = process;
	}

	public long pid() {
		return process.pid();
	}

	public boolean isAlive() {
		return process.isAlive();
	}

	/**
	 * Get the exit code if the process has finished.
	 * @return the exit code, or empty while running
	 */
	public Optional<Integer> exitCode() {
		return process.isAlive() ? Optional.empty() : Optional.of(process.exitValue());
	}

	/**
	 * Get a future completing with the exit code when the process ends.
	 * @return the exit future
	 */
	public CompletableFuture<Integer> onExit() {
		return process.onExit().thenApply(Process::exitValue);
	}

	/**
	 * Terminate the process and its descendants, escalating to a forced kill after a
	 * grace period.
	 */
	public void destroy() {
		process.descendants().forEach(ProcessHandle::destroy);
		process.destroy();
		try {
			if (!process.waitFor(GRACE_PERIOD_SECONDS, TimeUnit.SECONDS)) {
				logger.debug("Process {} did not exit in {}s, killing", process.pid(), GRACE_PERIOD_SECONDS);
				process.descendants().forEach(ProcessHandle::destroyForcibly);
				process.destroyForcibly();
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			process.descendants().forEach(ProcessHandle::destroyForcibly);
			process.destroyForcibly();
		}
	}

}
