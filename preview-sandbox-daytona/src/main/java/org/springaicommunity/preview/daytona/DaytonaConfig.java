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

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for Daytona preview sandboxes.
 *
 * @since 0.1.0
 */
public final class DaytonaConfig {

	public static final String PORT_PLACEHOLDER = "{port}";

	private static final String DEFAULT_API_URL = "https://app.daytona.io/api";

	private static final String DEFAULT_IMAGE = "node:20";

	private static final String DEFAULT_WORK_DIR = "/home/daytona/workspace";

	private static final int DEFAULT_PORT = 8081;

	private static final String DEFAULT_INSTALL_COMMAND = "npm install --legacy-peer-deps";

	private static final String DEFAULT_SERVER_COMMAND = "npx expo start --web --port " + PORT_PLACEHOLDER;

	private static final String DEFAULT_LOG_FILE = "expo-web.log";

	private static final Duration DEFAULT_START_TIMEOUT = Duration.ofMinutes(2);

	private static final Duration DEFAULT_START_POLL_INTERVAL = Duration.ofSeconds(1);

	private final String apiKey;

	private final String apiUrl;

	private final String image;

	private final String workDir;

	private final int port;

	private final String installCommand;

	private final String serverCommand;

	private final String logFile;

	private final Duration startTimeout;

	private final Duration startPollInterval;

	private final Map<String, String> environment;

	private DaytonaConfig(Builder builder) {
		this.apiKey = Objects.requireNonNull(builder.apiKey, "API key cannot be null");
		this.apiUrl = builder.apiUrl != null ? builder.apiUrl : DEFAULT_API_URL;
		this.image = builder.image != null ? builder.image : DEFAULT_IMAGE;
		this.workDir = builder.workDir != null ? builder.workDir : DEFAULT_WORK_DIR;
		this.port = builder.port;
		this.installCommand = builder.installCommand != null ? builder.installCommand : DEFAULT_INSTALL_COMMAND;
		this.serverCommand = builder.serverCommand != null ? builder.serverCommand : DEFAULT_SERVER_COMMAND;
		this.logFile = builder.logFile != null ? builder.logFile : DEFAULT_LOG_FILE;
		this.startTimeout = builder.startTimeout != null ? builder.startTimeout : DEFAULT_START_TIMEOUT;
		this.startPollInterval = builder.startPollInterval != null ? builder.startPollInterval
				: DEFAULT_START_POLL_INTERVAL;
		this.environment = Map.copyOf(builder.environment);
	}

	public String apiKey() {
		return apiKey;
	}

	public String apiUrl() {
		return apiUrl;
	}

	public String image() {
		return image;
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

	/**
	 * How long to wait for a new sandbox to reach the {@code started} state.
	 * @return the start timeout
	 */
	public Duration startTimeout() {
		return startTimeout;
	}

	public Duration startPollInterval() {
		return startPollInterval;
	}

	public Map<String, String> environment() {
		return environment;
	}

	String serverCommandForPort() {
		return serverCommand.replace(PORT_PLACEHOLDER, Integer.toString(port));
	}

	/**
	 * Creates a new builder with the API key from the DAYTONA_API_KEY environment
	 * variable.
	 * @return a new builder
	 * @throws IllegalStateException if DAYTONA_API_KEY is not set
	 */
	public static Builder builder() {
		String apiKey = System.getenv("DAYTONA_API_KEY");
		if (apiKey == null || apiKey.isBlank()) {
			throw new IllegalStateException("DAYTONA_API_KEY environment variable is not set");
		}
		Builder builder = new Builder().apiKey(apiKey);
		String apiUrl = System.getenv("DAYTONA_API_URL");
		if (apiUrl != null && !apiUrl.isBlank()) {
			builder.apiUrl(apiUrl);
		}
		return builder;
	}

	/**
	 * Creates a new builder with the specified API key.
	 * @param apiKey the Daytona API key
	 * @return a new builder
	 */
	public static Builder builder(String apiKey) {
		return new Builder().apiKey(apiKey);
	}

	public static class Builder {

		private String apiKey;

		private String apiUrl;

		private String image;

		private String workDir;

		private int port = DEFAULT_PORT;

		private String installCommand;

		private String serverCommand;

		private String logFile;

		private Duration startTimeout;

		private Duration startPollInterval;

		private final Map<String, String> environment = new LinkedHashMap<>();

		Builder() {
			environment.put("CI", "1");
			environment.put("EXPO_NO_TELEMETRY", "1");
		}

		public Builder apiKey(String apiKey) {
			this.apiKey = apiKey;
			return this;
		}

		public Builder apiUrl(String apiUrl) {
			this.apiUrl = apiUrl;
			return this;
		}

		public Builder image(String image) {
			this.image = image;
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
		 * Dev server command. {@value DaytonaConfig#PORT_PLACEHOLDER} is replaced with the
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

		public Builder startTimeout(Duration startTimeout) {
			this.startTimeout = startTimeout;
			return this;
		}

		public Builder startPollInterval(Duration startPollInterval) {
			this.startPollInterval = startPollInterval;
			return this;
		}

		public Builder environment(String key, String value) {
			this.environment.put(key, value);
			return this;
		}

		public DaytonaConfig build() {
			return new DaytonaConfig(this);
		}

	}

}
