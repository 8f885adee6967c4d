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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProviderAdapter} that runs each dev server as a child process of this JVM.
 *
 * <p>
 * Every sandbox gets its own workspace directory under
 * {@link LocalProviderConfig#baseDirectory()} and a port claimed from the configured
 * range. Dependencies come from the {@link DependencyCache} when one is configured and
 * warm, otherwise from a full install. Readiness is detected from the dev server's
 * output; if no known marker shows up within
 * {@link LocalProviderConfig#readinessFallback()} the server is assumed to be ready,
 * which is a heuristic and is logged as such.
 * </p>
 *
 * <p>
 * <b>No isolation:</b> the generated project runs on the host with the privileges of
 * this JVM. Use a cloud provider for untrusted code.
 * </p>
 *
 * @since 0.1.0
 */
public final class LocalProviderAdapter implements ProviderAdapter, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(LocalProviderAdapter.class);

	public static final String NAME = "local";

	private final LocalProviderConfig config;

	private final ProcessRunner processRunner;

	private final PortAllocator ports;

	private final DependencyCache dependencyCache;

	private final DependencyInstaller installer;

	private final ScheduledExecutorService timers;

	private LocalProviderAdapter(Builder builder) {
		this.config = builder.config != null ? builder.config : LocalProviderConfig.builder().build();
		this.processRunner = builder.processRunner != null ? builder.processRunner : new ProcessRunner();
		this.ports = new PortAllocator(config.basePort(), config.portRange());
		this.dependencyCache = builder.dependencyCache;
		this.installer = builder.installer != null ? builder.installer
				: DependencyInstaller.npm(processRunner, config.installTimeout(), config.environment());
		this.timers = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "local-preview-timer");
			thread.setDaemon(true);
			return thread;
		});
		logger.warn("LocalProviderAdapter created - NO ISOLATION PROVIDED. Dev servers run directly on the host.");
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public boolean requiresPublicUrl() {
		return false;
	}

	PortAllocator ports() {
		return ports;
	}

	@Override
	public SandboxHandle create(SandboxConfig sandboxConfig, OutputListener output) {
		String id = sanitize(sandboxConfig.projectId()) + "-" + UUID.randomUUID().toString().substring(0, 8);
		Path workspace = config.baseDirectory().resolve(id);
		int port = ports.claim();
		try {
			Files.createDirectories(workspace);
		}
		catch (IOException e) {
			ports.release(port);
			throw new SandboxException("Failed to create workspace: " + workspace, e);
		}
		logger.debug("Created local workspace {} on port {} for project {}", workspace, port,
				sandboxConfig.projectId());
		return new LocalSandboxHandle(id, sandboxConfig.projectId(), workspace, port, output);
	}

	@Override
	public void writeFiles(SandboxHandle handle, List<FileSpec> files) {
		LocalSandboxHandle local = ProviderAdapter.unwrap(handle, LocalSandboxHandle.class);
		try {
			local.files().setup(files);
		}
		catch (SandboxException e) {
			discardIfDestroyed(local);
			throw e;
		}
		discardIfDestroyed(local);
	}

	@Override
	public InstallOutcome installDependencies(SandboxHandle handle) {
		LocalSandboxHandle local = ProviderAdapter.unwrap(handle, LocalSandboxHandle.class);
		if (dependencyCache != null && dependencyCache.materialize(local.workspace())) {
			discardIfDestroyed(local);
			logger.debug("Dependency cache hit for {}", local.id());
			return InstallOutcome.CACHE_HIT;
		}
		local.output().onOutput(LogStream.INFO, "Installing dependencies");
		try {
			installer.install(local.workspace());
		}
		catch (SandboxException e) {
			discardIfDestroyed(local);
			throw e;
		}
		discardIfDestroyed(local);
		return InstallOutcome.INSTALLED;
	}

	@Override
	public String startServer(SandboxHandle handle) {
		LocalSandboxHandle local = ProviderAdapter.unwrap(handle, LocalSandboxHandle.class);
		if (local.isDestroyed()) {
			throw new SandboxException("Sandbox " + local.id() + " is already destroyed");
		}
		int port = local.port();
		if (config.killStrayProcesses()) {
			freePort(port);
		}
		ExecSpec spec = ExecSpec.builder().command(config.serverCommandFor(port)).env(config.environment()).build();
		RunningProcess process = processRunner.start(spec, local.workspace(), (stream, line) -> {
			local.output().onOutput(stream, line);
			if (!local.isServerReady() && containsMarker(line) && local.markServerReady(false)) {
				logger.info("Dev server for {} is ready on port {}", local.id(), port);
				announceExpoGo(local);
			}
		});
		if (!local.attachProcess(process)) {
			process.destroy();
			discardIfDestroyed(local);
		}
		process.onExit().thenAccept(code -> {
			if (!local.isDestroyed()) {
				local.output().onOutput(LogStream.INFO, "Dev server exited with code " + code);
				logger.info("Dev server for {} exited with code {}", local.id(), code);
			}
		});
		local.readinessFallback(timers.schedule(() -> assumeReady(local), config.readinessFallback().toMillis(),
				TimeUnit.MILLISECONDS));
		return "http://localhost:" + port;
	}

	private void assumeReady(LocalSandboxHandle local) {
		RunningProcess process = local.process();
		if (local.isDestroyed() || process == null || !process.isAlive()) {
			return;
		}
		if (local.markServerReady(true)) {
			logger.warn("No readiness marker from dev server {} after {}, assuming it is ready", local.id(),
					config.readinessFallback());
			local.output()
				.onOutput(LogStream.INFO, "No readiness signal after " + config.readinessFallback().toSeconds()
						+ "s, assuming the dev server is ready");
			announceExpoGo(local);
		}
	}

	private void announceExpoGo(LocalSandboxHandle local) {
		local.output().onOutput(LogStream.INFO, "Open in Expo Go: " + expoGoUrl(local.port()));
	}

	/**
	 * The {@code exp://} URL that Expo Go on the same network opens, once the dev server
	 * is ready.
	 * @param handle the sandbox
	 * @return the URL, or empty while the server is not ready or after destroy
	 */
	public Optional<String> expoGoUrl(SandboxHandle handle) {
		LocalSandboxHandle local = ProviderAdapter.unwrap(handle, LocalSandboxHandle.class);
		if (local.isDestroyed() || !local.isServerReady()) {
			return Optional.empty();
		}
		return Optional.of(expoGoUrl(local.port()));
	}

	private String expoGoUrl(int port) {
		return "exp://" + config.publicHost() + ":" + port;
	}

	@Override
	public Optional<String> getPreviewUrl(SandboxHandle handle) {
		LocalSandboxHandle local = ProviderAdapter.unwrap(handle, LocalSandboxHandle.class);
		if (local.isDestroyed()) {
			throw new PreviewFailedException("Sandbox " + local.id() + " was destroyed");
		}
		RunningProcess process = local.process();
		if (process == null) {
			return Optional.empty();
		}
		Optional<Integer> exitCode = process.exitCode();
		if (exitCode.isPresent()) {
			throw new PreviewFailedException("Dev server exited with code " + exitCode.get()
					+ (local.isServerReady() ? "" : " before becoming ready"));
		}
		if (!local.isServerReady()) {
			return Optional.empty();
		}
		return Optional.of("http://" + config.publicHost() + ":" + local.port());
	}

	@Override
	public void destroy(SandboxHandle handle) {
		LocalSandboxHandle local = ProviderAdapter.unwrap(handle, LocalSandboxHandle.class);
		if (!local.markDestroyed()) {
			return;
		}
		local.cancelReadinessFallback();
		RunningProcess process = local.process();
		if (process != null) {
			process.destroy();
		}
		ports.release(local.port());
		deleteWorkspace(local);
		logger.debug("Destroyed local sandbox {}", local.id());
	}

	/**
	 * Throw if the sandbox was destroyed while a step was running, removing whatever the
	 * step recreated in the workspace after destroy had already cleaned it up.
	 */
	private void discardIfDestroyed(LocalSandboxHandle local) {
		if (!local.isDestroyed()) {
			return;
		}
		deleteWorkspace(local);
		throw new SandboxException("Sandbox " + local.id() + " was destroyed");
	}

	private void deleteWorkspace(LocalSandboxHandle local) {
		try {
			DependencyCache.deleteRecursively(local.workspace());
		}
		catch (IOException e) {
			logger.warn("Failed to delete workspace {}", local.workspace(), e);
		}
	}

	private boolean containsMarker(String line) {
		for (String marker : config.readinessMarkers()) {
			if (line.contains(marker)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Kill whatever still listens on the port, typically a dev server orphaned by a
	 * previous run. Best effort: hosts without {@code lsof} are skipped.
	 */
	private void freePort(int port) {
		ExecSpec lsof = ExecSpec.builder()
			.command("lsof", "-ti", ":" + port)
			.timeout(config.portProbeTimeout())
			.build();
		ExecResult result;
		try {
			result = processRunner.run(lsof, config.baseDirectory());
		}
		catch (SandboxException e) {
			logger.debug("Could not check port {} for stray processes: {}", port, e.getMessage());
			return;
		}
		long self = ProcessHandle.current().pid();
		for (String line : result.stdout().split("\\R")) {
			String pid = line.trim();
			if (pid.isEmpty()) {
				continue;
			}
			try {
				long value = Long.parseLong(pid);
				if (value != self) {
					ProcessHandle.of(value).ifPresent(stray -> {
						logger.info("Killing stray process {} on port {}", value, port);
						stray.destroyForcibly();
					});
				}
			}
			catch (NumberFormatException e) {
				logger.debug("Ignoring unexpected lsof output: {}", pid);
			}
		}
	}

	private static String sanitize(String projectId) {
		return projectId.replaceAll("[^A-Za-z0-9._-]", "_");
	}

	@Override
	public void close() {
		timers.shutdownNow();
	}

	public static class Builder {

		private LocalProviderConfig config;

		private ProcessRunner processRunner;

		private DependencyCache dependencyCache;

		private DependencyInstaller installer;

		public Builder config(LocalProviderConfig config) {
			this.config = config;
			return this;
		}

		public Builder processRunner(ProcessRunner processRunner) {
			this.processRunner = processRunner;
			return this;
		}

		/**
		 * Use a warm dependency cache instead of installing from scratch.
		 * @param dependencyCache the cache, or {@code null} to always install
		 * @return this builder
		 */
		public Builder dependencyCache(DependencyCache dependencyCache) {
			this.dependencyCache = dependencyCache;
			return this;
		}

		public Builder installer(DependencyInstaller installer) {
			this.installer = installer;
			return this;
		}

		public LocalProviderAdapter build() {
			return new LocalProviderAdapter(this);
		}

	}

}
