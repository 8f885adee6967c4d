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

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a blocking command run through {@link ProcessRunner} or a provider's remote
 * command API.
 *
 * @param exitCode the process exit code (0 typically indicates success)
 * @param stdout the standard output stream content
 * @param stderr the standard error stream content
 * @param duration the wall-clock time taken to execute the command
 */
public record ExecResult(int exitCode, String stdout, String stderr, Duration duration) {

	public ExecResult {
		Objects.requireNonNull(stdout, "stdout cannot be null");
		Objects.requireNonNull(stderr, "stderr cannot be null");
		Objects.requireNonNull(duration, "duration cannot be null");
	}

	/**
	 * Gets the merged output of stdout and stderr. This is a simple concatenation, not
	 * temporally interleaved.
	 * @return combined stdout and stderr content
	 */
	public String mergedLog() {
		return stdout + stderr;
	}

	/**
	 * Indicates whether the command executed successfully.
	 * @return true if exit code is 0, false otherwise
	 */
	public boolean success() {
		return exitCode == 0;
	}

	/**
	 * Indicates whether the command failed.
	 * @return true if exit code is non-zero, false otherwise
	 */
	public boolean failed() {
		return !success();
	}

	/**
	 * Returns the last {@code maxChars} characters of the merged output, for error
	 * messages that should not carry an entire install log.
	 * @param maxChars maximum number of characters to keep
	 * @return the output tail
	 */
	public String outputTail(int maxChars) {
		String merged = mergedLog().strip();
		return merged.length() <= maxChars ? merged : "..." + merged.substring(merged.length() - maxChars);
	}

	/**
	 * Creates a summary string suitable for logging. Does not include the output.
	 * @return concise summary of the execution result
	 */
	public String summary() {
		return String.format("ExecResult{exitCode=%d, success=%s, duration=%s, stdoutLen=%d, stderrLen=%d}", exitCode,
				success(), duration, stdout.length(), stderr.length());
	}

}
