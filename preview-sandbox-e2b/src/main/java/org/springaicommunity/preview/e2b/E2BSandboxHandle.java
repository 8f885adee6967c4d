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

import java.util.concurrent.atomic.AtomicBoolean;

import org.springaicommunity.preview.OutputListener;
import org.springaicommunity.preview.SandboxHandle;

/**
 * Handle for an E2B sandbox.
 *
 * @since 0.1.0
 */
final class E2BSandboxHandle implements SandboxHandle {

	private final String id;

	private final String projectId;

	private final String domain;

	private final E2BEnvdClient envdClient;

	private final E2BSandboxFiles files;

	private final OutputListener output;

	private final AtomicBoolean destroyed = new AtomicBoolean();

	private volatile boolean serverStarted;

	private int forwardedLogChars;

	E2BSandboxHandle(String id, String projectId, String domain, E2BEnvdClient envdClient, String workDir,
			OutputListener output) {
		this.id = id;
		this.projectId = projectId;
		this.domain = domain;
		this.envdClient = envdClient;
		this.files = new E2BSandboxFiles(envdClient, workDir);
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
	public E2BSandboxFiles files() {
		return files;
	}

	String domain() {
		return domain;
	}

	E2BEnvdClient envdClient() {
		return envdClient;
	}

	OutputListener output() {
		return output;
	}

	boolean isServerStarted() {
		return serverStarted;
	}

	void markServerStarted() {
		this.serverStarted = true;
	}

	boolean markDestroyed() {
		return destroyed.compareAndSet(false, true);
	}

	boolean isDestroyed() {
		return destroyed.get();
	}

	/**
	 * Return the part of the server log not forwarded yet and remember it as forwarded.
	 * @param log the whole log read from the sandbox
	 * @return the new text, possibly empty
	 */
	synchronized String unforwardedLog(String log) {
		if (log.length() < forwardedLogChars) {
			forwardedLogChars = 0;
		}
		String fresh = log.substring(forwardedLogChars);
		forwardedLogChars = log.length();
		return fresh;
	}

	@Override
	public String toString() {
		return "E2BSandboxHandle[" + id + ", project=" + projectId + "]";
	}

}
