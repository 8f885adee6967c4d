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
 * Lifecycle status of a sandbox. Transitions only move forward in declaration order,
 * skipping allowed, so a stopped sandbox can never report running again.
 *
 * @since 0.1.0
 */
public enum SandboxStatus {

	CREATING, RUNNING, ERROR, STOPPED;

	/**
	 * Whether moving from this status to {@code next} is a legal transition.
	 * @param next the target status
	 * @return true if {@code next} comes strictly after this status
	 */
	public boolean canTransitionTo(SandboxStatus next) {
		return next.ordinal() > ordinal();
	}

	public boolean isTerminal() {
		return this == ERROR || this == STOPPED;
	}

}
