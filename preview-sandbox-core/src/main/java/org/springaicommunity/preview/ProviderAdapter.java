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
import java.util.List;
import java.util.Optional;

/**
 * Uniform contract over a backend that can host a project's dev server.
 *
 * <p>
 * The orchestration layer drives every adapter through the same sequence:
 * {@link #create}, {@link #writeFiles}, {@link #installDependencies},
 * {@link #startServer}, then repeated {@link #getPreviewUrl} calls until a usable URL
 * appears, and finally {@link #destroy}. Adapters never track instances themselves;
 * everything they need travels in the {@link SandboxHandle} they return from
 * {@code create}.
 * </p>
 *
 * <p>
 * Implementations must be safe to call from several threads for different handles.
 * </p>
 *
 * @since 0.1.0
 */
public interface ProviderAdapter {

	/**
	 * Get the provider name used for selection and in status reports.
	 * @return the provider name, for example {@code "local"}
	 */
	String name();

	/**
	 * Allocate an execution environment.
	 * @param config the project being previewed
	 * @param output receives output lines produced by the environment
	 * @return a handle to the new environment
	 * @throws SandboxException if the environment cannot be allocated
	 */
	SandboxHandle create(SandboxConfig config, OutputListener output);

	/**
	 * Write the project files, creating parent directories as needed.
	 * @param handle the environment
	 * @param files the files in write order
	 * @throws SandboxException if any file cannot be written
	 */
	void writeFiles(SandboxHandle handle, List<FileSpec> files);

	/**
	 * Install the project's dependencies, or arrange for them to be installed when the
	 * server starts.
	 * @param handle the environment
	 * @return how the dependencies were provided
	 * @throws SandboxException if installation fails
	 */
	InstallOutcome installDependencies(SandboxHandle handle);

	/**
	 * Start the dev server without waiting for it to become reachable.
	 * @param handle the environment
	 * @return the raw endpoint the server listens on inside the environment
	 * @throws SandboxException if the server cannot be started
	 */
	String startServer(SandboxHandle handle);

	/**
	 * Check once, without blocking on readiness, whether a preview URL is available.
	 * @param handle the environment
	 * @return the candidate URL, or empty if none is available yet
	 * @throws PreviewFailedException if the preview can never become ready
	 */
	Optional<String> getPreviewUrl(SandboxHandle handle);

	/**
	 * Release the environment. Calling this for an environment that is already gone is
	 * not an error.
	 * @param handle the environment
	 * @throws SandboxException if the provider rejects the request for another reason
	 */
	void destroy(SandboxHandle handle);

	/**
	 * Whether preview URLs from this provider must be publicly reachable. Localhost URLs
	 * are rejected for providers that return {@code true}.
	 * @return true unless the provider serves previews from this host
	 */
	default boolean requiresPublicUrl() {
		return true;
	}

	/**
	 * Extend any provider-side lease so the environment outlives the new expiry.
	 * @param handle the environment
	 * @param remaining time from now until the sandbox expires
	 */
	default void extendLease(SandboxHandle handle, Duration remaining) {
	}

	/**
	 * Cast a handle back to the adapter's own type.
	 * @param handle the handle passed to the adapter
	 * @param type the adapter's handle type
	 * @param <H> the handle type
	 * @return the typed handle
	 * @throws IllegalArgumentException if the handle was created by another adapter
	 */
	static <H extends SandboxHandle> H unwrap(SandboxHandle handle, Class<H> type) {
		if (!type.isInstance(handle)) {
			throw new IllegalArgumentException("Handle " + handle + " was not created by this provider (expected "
					+ type.getSimpleName() + ")");
		}
		return type.cast(handle);
	}

}
