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

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for E2B preview sandboxes.
 *
 * @since 0.1.0
 */
public final class E2BConfig {

	public static final String PORT_PLACEHOLDER = "{port}";

	private static final String DEFAULT_API_URL = "https://api.e2b.dev";

	private static final String DEFAULT_DOMAIN = "e2b.dev";

	private static final Duration DEFAULT_SANDBOX_TIMEOUT = Duration.ofMinutes(15);

	private static final String DEFAULT_TEMPLATE = "base";

	private static final String DEFAULT_WORK_DIR = "/home/user";

	private static final int DEFAULT_PORT = 8081;

	private static final String DEFAULT_INSTALL_COMMAND = "npm install --legacy-peer-deps";

	private static final String DEFAULT_SERVER_COMMAND = "npx expo start --web --port " + PORT_PLACEHOLDER;

	private static final String DEFAULT_LOG_FILE = ".preview.log";

	private final String apiKey;

	private final String apiUrl;

	private final String domain;

	private final Duration sandboxTimeout;

	private final String template;

	private final String workDir;

	private final int port;

	private final String installCommand;

	private final String serverCommand;

	private final String logFile;

	private final Map<String, String> environment;

	private E2BConfig(Builder builder) {
		this.apiKey = Objects.requireNonNull(builder.apiKey, "API key cannot be null");
		this.apiUrl = builder.apiUrl != null ? builder.apiUrl : DEFAULT_API_URL;
		this.domain = builder.domain != null ? builder.domain : DEFAULT_DOMAIN;
		this.sandboxTimeout = builder.sandboxTimeout != null ? builder.sandboxTimeout : DEFAULT_SANDBOX_TIMEOUT;
		this.template = builder.template != null ? builder.template : DEFAULT_TEMPLATE;
		this.workDir = builder.workDir != null ? builder.workDir : DEFAULT_WORK_DIR;
		this.port = builder.port;
		this.installCommand = builder.installCommand != null ? builder.installCommand : DEFAULT_INSTALL_COMMAND;
		this.serverCommand = builder.serverCommand != null ? builder.serverCommand : DEFAULT_SERVER_COMMAND;
		this.logFile = builder.logFile != null ? builder.logFile : DEFAULT_LOG_FILE;
		this.environment = Map.copyOf(builder.environment);
	}

	public String apiKey() {
		return apiKey;
	}

	public String apiUrl() {
		return apiUrl;
	}

	public String domain() {
		return domain;
	}

	/**
	 * Lifetime E2B gives a new sandbox before it kills it. Extended whenever the preview's
	 * own lifetime is extended.
	 * @return the initial sandbox timeout
	 */
	public Duration sandboxTimeout() {
		return sandboxTimeout;
	}

	public String template() {
		return template;
	}

	public String workDir() {
		return workDir;
	}

	public int port() {
		return port;
	}

	public String installCommand() {
		return installCommand;
	}

	public String serverCommand() {
		return serverCommand;
	}

	/**
	 * Dev server log file, relative to {@link #workDir()}.
	 * @return the log file name
	 */
	public String logFile() {
		return logFile;
	}

	public Map<String, String> environment() {
		return environment;
	}

	String serverCommandForPort() {
		return serverCommand.replace(PORT_PLACEHOLDER, Integer.toString(port));
	}

	/**
	 * Creates a new builder with the API key from the E2B_API_KEY environment variable.
	 * @return a new builder
	 * @throws IllegalStateException if E2B_API_KEY is not set
	 */
	public static Builder builder() {
		String apiKey = System.getenv("E2B_API_KEY");
		if (apiKey == null || apiKey.isBlank()) {
			throw new IllegalStateException("E2B_API_KEY environment variable is not set");
		}
		return new Builder().apiKey(apiKey);
	}

	/**
	 * Creates a new builder with the specified API key.
	 * @param apiKey the E2B API key
	 * @return a new builder
	 */
	public static Builder builder(String apiKey) {
		return new Builder().apiKey(apiKey);
	}

	public static class Builder {

		private String apiKey;

		private String apiUrl;

		private String domain;

		private Duration sandboxTimeout;

		private String template;

		private String workDir;

		private int port = DEFAULT_PORT;

		private String installCommand;

		private String serverCommand;

		private String logFile;

		private final Map<String, String> environment = new LinkedHashMap<>();

		Builder() {
			environment.put("CI", "1");
			environment.put("EXPO_NO_TELEMETRY", "1");
			environment.put("EXPO_NO_UPDATE_CHECK", "1");
		}

		public Builder apiKey(String apiKey) {
			this.apiKey = apiKey;
			return this;
		}

		public Builder apiUrl(String apiUrl) {
			this.apiUrl = apiUrl;
			return this;
		}

		public Builder domain(String domain) {
			this.domain = domain;
			return this;
		}

		public Builder sandboxTimeout(Duration sandboxTimeout) {
			this.sandboxTimeout = sandboxTimeout;
			return this;
		}

		public Builder template(String template) {
			this.template = template;
			return this;
		}

		public Builder workDir(String workDir) {
			this.workDir = workDir;
			return this;
		}

		public Builder port(int port) {
			this.port = port;
			return this;
		}

		public Builder installCommand(String installCommand) {
			this.installCommand = installCommand;
			return this;
		}

		/**
		 * Dev server command. {@value E2BConfig#PORT_PLACEHOLDER} is replaced with the
		 * configured port.
		 * @param serverCommand the command line
		 * @return this builder
		 */
		public Builder serverCommand(String serverCommand) {
			this.serverCommand = serverCommand;
			return this;
		}

		public Builder logFile(String logFile) {
			this.logFile = logFile;
			return this;
		}

		public Builder environment(String key, String value) {
			this.environment.put(key, value);
			return this;
		}

		public E2BConfig build() {
			return new E2BConfig(this);
		}

	}

}
