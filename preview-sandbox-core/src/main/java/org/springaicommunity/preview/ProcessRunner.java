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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeroturnaround.exec.ProcessExecutor;
import org.zeroturnaround.exec.ProcessResult;
import org.zeroturnaround.exec.StartedProcess;
import org.zeroturnaround.exec.stream.LogOutputStream;

/**
 * Runs host processes for the local provider and the dependency cache.
 *
 * <p>
 * {@link #run} blocks until the command finishes and captures its output;
 * {@link #start} launches a long-running process and streams its output line by line
 * to an {@link OutputListener}. Extra environment variables are added on top of the
 * inherited environment so {@code PATH} and friends stay intact.
 * </p>
 *
 * <p>
 * <b>No isolation:</b> commands execute directly on the host with the privileges of
 * this JVM.
 * </p>
 *
 * @since 0.1.0
 */
public class ProcessRunner {

	private static final Logger logger = LoggerFactory.getLogger(ProcessRunner.class);

	/**
	 * Run a command to completion.
	 * @param spec the command, environment and timeout
	 * @param workingDirectory the directory to run in, created if missing
	 * @return the exit code and captured output; a non-zero exit is not an exception
	 * @throws SandboxException if the command cannot be started, or with a
	 * {@link SandboxTimeoutException} cause if it exceeds its timeout
	 */
	public ExecResult run(ExecSpec spec, Path workingDirectory) {
		ensureDirectory(workingDirectory);
		Instant startTime = Instant.now();
		ByteArrayOutputStream stderr = new ByteArrayOutputStream();
		ProcessExecutor executor = new ProcessExecutor().command(spec.command())
			.directory(workingDirectory.toFile())
			.environment(spec.env())
			.readOutput(true)
			.redirectError(stderr)
			.exitValueAny()
			.destroyOnExit();
		if (spec.timeout() != null) {
			executor.timeout(spec.timeout().toMillis(), TimeUnit.MILLISECONDS);
		}
		logger.debug("Running {} in {}", spec.command(), workingDirectory);
		try {
			ProcessResult result = executor.execute();
			Duration duration = Duration.between(startTime, Instant.now());
			logger.debug("Command {} exited with {} after {}", spec.command().get(0), result.getExitValue(),
					duration);
			return new ExecResult(result.getExitValue(), result.outputUTF8(), stderr.toString(StandardCharsets.UTF_8),
					duration);
		}
		catch (TimeoutException e) {
			throw new SandboxException("Command timed out: " + String.join(" ", spec.command()),
					new SandboxTimeoutException("Command timed out after " + spec.timeout(), spec.timeout()));
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new SandboxException("Failed to execute command: " + String.join(" ", spec.command()), e);
		}
	}

	/**
	 * Start a long-running command without waiting for it.
	 * @param spec the command and environment; the timeout is ignored
	 * @param workingDirectory the directory to run in, created if missing
	 * @param output receives each stdout and stderr line
	 * @return the running process
	 * @throws SandboxException if the command cannot be started
	 */
	public RunningProcess start(ExecSpec spec, Path workingDirectory, OutputListener output) {
		ensureDirectory(workingDirectory);
		ProcessExecutor executor = new ProcessExecutor().command(spec.command())
			.directory(workingDirectory.toFile())
			.environment(spec.env())
			.redirectOutput(lines(LogStream.STDOUT, output))
			.redirectError(lines(LogStream.STDERR, output))
			.exitValueAny()
			.destroyOnExit();
		logger.debug("Starting {} in {}", spec.command(), workingDirectory);
		try {
			StartedProcess started = executor.start();
			RunningProcess process = new RunningProcess(started.getProcess());
			logger.debug("Started {} with pid {}", spec.command().get(0), process.pid());
			return process;
		}
		catch (IOException e) {
			throw new SandboxException("Failed to start command: " + String.join(" ", spec.command()), e);
		}
	}

	private static LogOutputStream lines(LogStream stream, OutputListener output) {
		return new LogOutputStream() {
			@Override
			protected void processLine(String line) {
				output.onOutput(stream, line);
			}
		};
	}

	private static void ensureDirectory(Path directory) {
		try {
			Files.createDirectories(directory);
		}
		catch (IOException e) {
			throw new SandboxException("Failed to create working directory: " + directory, e);
		}
	}

}
