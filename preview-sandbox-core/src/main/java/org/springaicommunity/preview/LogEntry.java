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

import java.time.Instant;

/**
 * One line of sandbox output or lifecycle information.
 *
 * @param timestamp when the line was recorded
 * @param stream where the line came from
 * @param message the line, without trailing newline
 * @since 0.1.0
 */
public record LogEntry(Instant timestamp, LogStream stream, String message) {

	@Override
	public String toString() {
		return "[" + timestamp + "] [" + stream + "] " + message;
	}

}
