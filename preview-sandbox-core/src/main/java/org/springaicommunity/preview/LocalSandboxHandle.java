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
import java.util.concurrent.Future;

/**
 * Handle for a local sandbox: a workspace directory, a claimed port and, once started,
 * the dev server process.
 *
 * @since 0.1.0
 */
final class LocalSandboxHandle implements SandboxHandle {

	private final String id;

	private final String projectId;

	private final int port;

	private final LocalSandboxFiles files;

	private final OutputListener output;

	private volatile boolean destroyed;

	private volatile RunningProcess process;

	private volatile boolean serverReady;

	private volatile boolean readinessAssumed;

	private volatile Future<?> readinessFallback;

	LocalSandboxHandle(String id, String projectId, Path workspace, int port, OutputListener output) {
		this.id = id;
		this.projectId = projectId;
		this.port = port;
		this.files = new LocalSandboxFiles(workspace);
		this.output = output;
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public String projectId() {
		return projectId;
	}

	@Override
	public LocalSandboxFiles files() {
		return files;
	}

	Path workspace() {
		return files.workDir();
	}

	int port() {
		return port;
	}

	OutputListener output() {
		return output;
	}

	RunningProcess process() {
		return process;
	}

	/**
	 * Attach the dev server process unless the sandbox was destroyed first.
	 * @param process the started process
	 * @return false if the sandbox is already destroyed and the caller still owns the
	 * process
	 */
	synchronized boolean attachProcess(RunningProcess process) {
		if (destroyed) {
			return false;
		}
		this.process = process;
		return true;
	}

	boolean isServerReady() {
		return serverReady;
	}

	boolean isReadinessAssumed() {
		return readinessAssumed;
	}

	/**
	 * Mark the server ready.
	 * @param assumed whether readiness was assumed after the fallback delay rather than
	 * observed in the output
	 * @return true if this call changed the state
	 */
	synchronized boolean markServerReady(boolean assumed) {
		if (serverReady) {
			return false;
		}
		serverReady = true;
		readinessAssumed = assumed;
		Future<?> fallback = readinessFallback;
		if (fallback != null && !assumed) {
			fallback.cancel(false);
		}
		return true;
	}

	synchronized void readinessFallback(Future<?> fallback) {
		this.readinessFallback = fallback;
	}

	synchronized void cancelReadinessFallback() {
		if (readinessFallback != null) {
			readinessFallback.cancel(false);
		}
	}

	synchronized boolean markDestroyed() {
		if (destroyed) {
			return false;
		}
		destroyed = true;
		return true;
	}

	boolean isDestroyed() {
		return destroyed;
	}

	@Override
	public String toString() {
		return "LocalSandboxHandle{id=" + id + ", port=" + port + ", workspace=" + workspace() + "}";
	}

}
