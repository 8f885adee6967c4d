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

/**
 * Thrown when a sandbox creation flow fails. Carries the status the failed instance
 * ended in so callers can show the reason and the log lines leading up to it.
 *
 * @since 0.1.0
 */
public class SandboxProvisioningException extends SandboxException {

	private final SandboxStatusView status;

	public SandboxProvisioningException(String message, SandboxStatusView status, Throwable cause) {
		super(message, cause);
		this.status = status;
	}

	/**
	 * Get the final status of the instance whose creation failed.
	 * @return the failure status, never {@code null}
	 */
	public SandboxStatusView getStatus() {
		return status;
	}

}
