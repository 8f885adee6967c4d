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

/**
 * Provider-specific reference to an allocated execution environment.
 *
 * <p>
 * Handles are created by {@link ProviderAdapter#create(SandboxConfig, OutputListener)}
 * and passed back to the same adapter for every later step. Each adapter defines its own
 * implementation carrying whatever it needs to reach the environment.
 * </p>
 *
 * @since 0.1.0
 */
public interface SandboxHandle {

	/**
	 * Get the provider-assigned environment id.
	 * @return the environment id
	 */
	String id();

	/**
	 * Get the project this environment was created for.
	 * @return the project id
	 */
	String projectId();

	/**
	 * Access the environment's working directory.
	 * @return the file accessor
	 */
	SandboxFiles files();

}
