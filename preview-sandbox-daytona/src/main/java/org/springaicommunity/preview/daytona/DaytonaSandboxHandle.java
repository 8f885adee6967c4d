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

import java.util.concurrent.atomic.AtomicBoolean;

import org.springaicommunity.preview.OutputListener;
import org.springaicommunity.preview.SandboxHandle;

/**
 * Handle for a Daytona sandbox.
 *
 * @since 0.1.0
 */
final class DaytonaSandboxHandle implements SandboxHandle {

	private final String id;

	private final String projectId;

	private final DaytonaSandboxFiles files;

	private final OutputListener output;

	private final AtomicBoolean destroyed = new AtomicBoolean();

	private volatile String sessionId;

	private int forwardedLogChars;

	DaytonaSandboxHandle(String id, String projectId, DaytonaSandboxFiles files, OutputListener output) {
		this.id = id;
		this.projectId = projectId;
		this.files = files;
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
	public DaytonaSandboxFiles files() {
		return files;
	}

	OutputListener output() {
		return output;
	}

	/**
	 * The process session the dev server runs in, or {@code null} before it is started.
	 */
	String sessionId() {
		return sessionId;
	}

	void sessionId(String sessionId) {
		this.sessionId = sessionId;
	}

	void markDestroyed() {
		destroyed.set(true);
	}

	boolean isDestroyed() {
		return destroyed.get();
	}

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
		return "DaytonaSandboxHandle[" + id + ", project=" + projectId + "]";
	}

}
