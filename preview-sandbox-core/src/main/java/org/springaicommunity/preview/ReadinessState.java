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
 * Outcome of the background wait for a usable preview URL.
 *
 * @since 0.1.0
 */
public enum ReadinessState {

	/** Still polling, or not started yet. */
	PENDING,

	/** A usable preview URL was found. */
	READY,

	/** The provider reported that the preview can never become ready. */
	FAILED,

	/** The attempt budget ran out before a usable URL appeared. */
	TIMED_OUT

}
