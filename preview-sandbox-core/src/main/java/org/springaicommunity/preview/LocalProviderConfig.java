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

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for {@link LocalProviderAdapter}.
 *
 * @since 0.1.0
 */
public final class LocalProviderConfig {

	/** Placeholder replaced by the claimed port in {@link #serverCommand()}. */
	public static final String PORT_PLACEHOLDER = "{port}";

	private static final int DEFAULT_BASE_PORT = 8081;

	private static final int DEFAULT_PORT_RANGE = 100;

	private static final List<String> DEFAULT_SERVER_COMMAND = List.of("npx", "expo", "start", "--web", "--port",
			PORT_PLACEHOLDER);

	private static final List<String> DEFAULT_READINESS_MARKERS = List.of("Metro waiting on", "Logs for your project",
			"Starting Metro Bundler", "Web is waiting", "Webpack compiled");

	private static final Duration DEFAULT_READINESS_FALLBACK = Duration.ofSeconds(60);

	private static final Duration DEFAULT_INSTALL_TIMEOUT = Duration.ofMinutes(3);

	private static final Duration DEFAULT_PORT_PROBE_TIMEOUT = Duration.ofSeconds(3);

	private final Path baseDirectory;

	private final int basePort;

	private final int portRange;

	private final String publicHost;

	private final List<String> serverCommand;

	private final Map<String, String> environment;

	private final List<String> readinessMarkers;

	private final Duration readinessFallback;

	private final Duration installTimeout;

	private final Duration portProbeTimeout;

	private final boolean killStrayProcesses;

	private LocalProviderConfig(Builder builder) {
		this.baseDirectory = builder.baseDirectory != null ? builder.baseDirectory
				: Path.of(System.getProperty("user.dir"), ".preview-workspaces");
		this.basePort = builder.basePort;
		this.portRange = builder.portRange;
		this.publicHost = builder.publicHost != null ? builder.publicHost : "localhost";
		this.serverCommand = builder.serverCommand != null ? List.copyOf(builder.serverCommand)
				: DEFAULT_SERVER_COMMAND;
		this.environment = Map.copyOf(builder.environment);
		this.readinessMarkers = builder.readinessMarkers != null ? List.copyOf(builder.readinessMarkers)
				: DEFAULT_READINESS_MARKERS;
		this.readinessFallback = builder.readinessFallback != null ? builder.readinessFallback
				: DEFAULT_READINESS_FALLBACK;
		this.installTimeout = builder.installTimeout != null ? builder.installTimeout : DEFAULT_INSTALL_TIMEOUT;
		this.portProbeTimeout = builder.portProbeTimeout != null ? builder.portProbeTimeout
				: DEFAULT_PORT_PROBE_TIMEOUT;
		this.killStrayProcesses = builder.killStrayProcesses;
	}

	public Path baseDirectory() {
		return baseDirectory;
	}

	public int basePort() {
		return basePort;
	}

	public int portRange() {
		return portRange;
	}

	/**
	 * Get the host name put into preview URLs. Set it to a LAN address to open previews
	 * from devices on the same network.
	 * @return the host, {@code localhost} by default
	 */
	public String publicHost() {
		return publicHost;
	}

	public List<String> serverCommand() {
		return serverCommand;
	}

	/**
	 * Get the environment added to dev server and install processes. Defaults disable
	 * telemetry, update checks and interactive prompts.
	 * @return the extra environment
	 */
	public Map<String, String> environment() {
		return environment;
	}

	public List<String> readinessMarkers() {
		return readinessMarkers;
	}

	/**
	 * Get how long to wait for a readiness marker before assuming the server is up.
	 * @return the fallback delay
	 */
	public Duration readinessFallback() {
		return readinessFallback;
	}

	public Duration installTimeout() {
		return installTimeout;
	}

	public Duration portProbeTimeout() {
		return portProbeTimeout;
	}

	public boolean killStrayProcesses() {
		return killStrayProcesses;
	}

	/**
	 * Build the dev server command for a port.
	 * @param port the claimed port
	 * @return the command with the port substituted
	 */
	List<String> serverCommandFor(int port) {
		return serverCommand.stream().map(arg -> arg.replace(PORT_PLACEHOLDER, Integer.toString(port))).toList();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private Path baseDirectory;

		private int basePort = DEFAULT_BASE_PORT;

		private int portRange = DEFAULT_PORT_RANGE;

		private String publicHost;

		private List<String> serverCommand;

		private final Map<String, String> environment = new LinkedHashMap<>();

		private List<String> readinessMarkers;

		private Duration readinessFallback;

		private Duration installTimeout;

		private Duration portProbeTimeout;

		private boolean killStrayProcesses = true;

		Builder() {
			environment.put("CI", "1");
			environment.put("EXPO_NO_TELEMETRY", "1");
			environment.put("EXPO_NO_UPDATE_CHECK", "1");
			environment.put("EXPO_USE_FAST_RESOLVER", "1");
			environment.put("RCT_NO_LAUNCH_PACKAGER", "1");
		}

		public Builder baseDirectory(Path baseDirectory) {
			this.baseDirectory = baseDirectory;
			return this;
		}

		public Builder basePort(int basePort) {
			this.basePort = basePort;
			return this;
		}

		public Builder portRange(int portRange) {
			this.portRange = portRange;
			return this;
		}

		public Builder publicHost(String publicHost) {
			this.publicHost = publicHost;
			return this;
		}

		/**
		 * Set the dev server command. {@link LocalProviderConfig#PORT_PLACEHOLDER} in any
		 * argument is replaced by the claimed port.
		 * @param serverCommand the command
		 * @return this builder
		 */
		public Builder serverCommand(List<String> serverCommand) {
			this.serverCommand = serverCommand;
			return this;
		}

		public Builder environment(String key, String value) {
			this.environment.put(key, value);
			return this;
		}

		public Builder readinessMarkers(List<String> readinessMarkers) {
			this.readinessMarkers = readinessMarkers;
			return this;
		}

		public Builder readinessFallback(Duration readinessFallback) {
			this.readinessFallback = readinessFallback;
			return this;
		}

		public Builder installTimeout(Duration installTimeout) {
			this.installTimeout = installTimeout;
			return this;
		}

		public Builder portProbeTimeout(Duration portProbeTimeout) {
			this.portProbeTimeout = portProbeTimeout;
			return this;
		}

		public Builder killStrayProcesses(boolean killStrayProcesses) {
			this.killStrayProcesses = killStrayProcesses;
			return this;
		}

		public LocalProviderConfig build() {
			return new LocalProviderConfig(this);
		}

	}

}
