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
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link ProcessRunner} and {@link RunningProcess}.
 */
@DisabledOnOs(OS.WINDOWS)
class ProcessRunnerTest {

	@TempDir
	Path workDir;

	private final ProcessRunner runner = new ProcessRunner();

	@Test
	void runCapturesStdoutAndStderrSeparately() {
		ExecResult result = runner.run(ExecSpec.builder().shellCommand("echo out; echo err >&2").build(), workDir);

		assertThat(result.success()).isTrue();
		assertThat(result.stdout().trim()).isEqualTo("out");
		assertThat(result.stderr().trim()).isEqualTo("err");
		assertThat(result.duration()).isPositive();
	}

	@Test
	void runAddsEnvironmentToInheritedOne() {
		ExecResult result = runner.run(
				ExecSpec.builder()
					.shellCommand("echo \"$PREVIEW_TEST:${PATH:+has-path}\"")
					.env("PREVIEW_TEST", "42")
					.build(),
				workDir);

		assertThat(result.stdout().trim()).isEqualTo("42:has-path");
	}

	@Test
	void runRunsInWorkingDirectory() {
		ExecResult result = runner.run(ExecSpec.of("pwd"), workDir);

		assertThat(result.stdout().trim()).endsWith(workDir.getFileName().toString());
	}

	@Test
	void nonZeroExitIsAResultNotAnException() {
		ExecResult result = runner.run(ExecSpec.builder().shellCommand("exit 3").build(), workDir);

		assertThat(result.failed()).isTrue();
		assertThat(result.exitCode()).isEqualTo(3);
	}

	@Test
	void timeoutIsReportedWithCause() {
		ExecSpec spec = ExecSpec.builder().command("sleep", "10").timeout(Duration.ofMillis(300)).build();

		assertThatThrownBy(() -> runner.run(spec, workDir)).isInstanceOf(SandboxException.class)
			.hasCauseInstanceOf(SandboxTimeoutException.class)
			.satisfies(thrown -> assertThat(((SandboxTimeoutException) thrown.getCause()).getTimeout())
				.isEqualTo(Duration.ofMillis(300)));
	}

	@Test
	void missingExecutableIsASandboxException() {
		assertThatThrownBy(() -> runner.run(ExecSpec.of("definitely-not-a-command-4711"), workDir))
			.isInstanceOf(SandboxException.class)
			.hasMessageContaining("definitely-not-a-command-4711");
	}

	@Test
	void startStreamsOutputLinesAndReportsExit() throws Exception {
		List<String> lines = new CopyOnWriteArrayList<>();
		RunningProcess process = runner.start(
				ExecSpec.builder().shellCommand("echo first; echo second >&2; exit 2").build(), workDir,
				(stream, line) -> lines.add(stream + ":" + line));

		assertThat(process.onExit().get(5, TimeUnit.SECONDS)).isEqualTo(2);
		await().atMost(Duration.ofSeconds(5)).until(() -> lines.size() == 2);
		assertThat(lines).containsExactlyInAnyOrder("STDOUT:first", "STDERR:second");
		assertThat(process.exitCode()).contains(2);
	}

	@Test
	void destroyStopsProcessTree() {
		RunningProcess process = runner.start(ExecSpec.builder().shellCommand("sleep 30 & sleep 30; wait").build(),
				workDir, OutputListener.NONE);
		await().atMost(Duration.ofSeconds(5)).until(process::isAlive);

		process.destroy();

		assertThat(process.isAlive()).isFalse();
	}

}
