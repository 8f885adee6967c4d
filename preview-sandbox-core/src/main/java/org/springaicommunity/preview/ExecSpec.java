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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Description of a command to run: arguments, extra environment and an optional
 * timeout.
 *
 * @param command the command and its arguments
 * @param env environment variables added to the inherited environment
 * @param timeout the timeout, or {@code null} to wait indefinitely
 * @since 0.1.0
 */
public record ExecSpec(List<String> command, Map<String, String> env, Duration timeout) {

	public ExecSpec {
		if (command == null || command.isEmpty()) {
			throw new IllegalArgumentException("Command cannot be null or empty");
		}
		command = List.copyOf(command);
		env = env != null ? Map.copyOf(env) : Map.of();
	}

	/**
	 * Create a spec for a command without extra environment or timeout.
	 * @param command the command and its arguments
	 * @return a new ExecSpec
	 */
	public static ExecSpec of(String... command) {
		return new ExecSpec(List.of(command), Map.of(), null);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private final List<String> command = new ArrayList<>();

		private final Map<String, String> env = new HashMap<>();

		private Duration timeout;

		public Builder command(String... command) {
			this.command.clear();
			this.command.addAll(List.of(command));
			return this;
		}

		public Builder command(List<String> command) {
			this.command.clear();
			this.command.addAll(command);
			return this;
		}

		/**
		 * Run the given script through {@code sh -c}.
		 * @param script the shell script
		 * @return this builder
		 */
		public Builder shellCommand(String script) {
			return command("sh", "-c", script);
		}

		public Builder env(String key, String value) {
			this.env.put(key, value);
			return this;
		}

		public Builder env(Map<String, String> env) {
			this.env.putAll(env);
			return this;
		}

		public Builder timeout(Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		public ExecSpec build() {
			return new ExecSpec(command, env, timeout);
		}

	}

}
