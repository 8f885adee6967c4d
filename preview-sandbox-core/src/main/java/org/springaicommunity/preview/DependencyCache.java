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
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A pre-installed base {@code node_modules} tree that new local workspaces copy instead
 * of running a full install.
 *
 * <p>
 * The cache is valid only when {@code node_modules} is a real directory (a symlink is
 * treated as corrupt) containing the base package's {@code package.json}. An invalid or
 * missing cache is rebuilt by writing the base manifest and running the installer.
 * Rebuilds are single-flight: concurrent callers wait for the same rebuild. A failed
 * rebuild leaves the cache invalid and the next caller tries again.
 * </p>
 *
 * <p>
 * Workspaces always receive a copy. Sharing the directory through a symlink lets one
 * project's install scripts corrupt every other project.
 * </p>
 *
 * @since 0.1.0
 */
public class DependencyCache {

	private static final Logger logger = LoggerFactory.getLogger(DependencyCache.class);

	private static final String NODE_MODULES = "node_modules";

	private final Path cacheDirectory;

	private final String baseManifest;

	private final String basePackage;

	private final DependencyInstaller installer;

	private CompletableFuture<Boolean> warming;

	/**
	 * Create a cache.
	 * @param cacheDirectory where the base install lives
	 * @param baseManifest the {@code package.json} content the base install is built from
	 * @param basePackage the package whose presence marks a complete install, for example
	 * {@code expo}
	 * @param installer runs the install in the cache directory
	 */
	public DependencyCache(Path cacheDirectory, String baseManifest, String basePackage,
			DependencyInstaller installer) {
		this.cacheDirectory = cacheDirectory;
		this.baseManifest = baseManifest;
		this.basePackage = basePackage;
		this.installer = installer;
	}

	public Path cacheDirectory() {
		return cacheDirectory;
	}

	/**
	 * Check whether the cache currently holds a complete install.
	 * @return true if the cache can be copied
	 */
	public boolean isValid() {
		Path nodeModules = cacheDirectory.resolve(NODE_MODULES);
		if (Files.isSymbolicLink(nodeModules) || !Files.isDirectory(nodeModules, LinkOption.NOFOLLOW_LINKS)) {
			return false;
		}
		return Files.isRegularFile(nodeModules.resolve(basePackage).resolve("package.json"));
	}

	/**
	 * Make sure the cache is valid, rebuilding it if needed. Blocks while a rebuild runs.
	 * @return true if the cache is valid afterwards
	 */
	public boolean ensureWarm() {
		CompletableFuture<Boolean> pending;
		boolean owner = false;
		synchronized (this) {
			if (warming == null || (warming.isDone() && !isValid())) {
				warming = new CompletableFuture<>();
				owner = true;
			}
			pending = warming;
		}
		if (owner) {
			pending.complete(warmNow());
		}
		return pending.join();
	}

	private boolean warmNow() {
		if (isValid()) {
			logger.debug("Dependency cache at {} is valid", cacheDirectory);
			return true;
		}
		logger.info("Building dependency cache at {}", cacheDirectory);
		try {
			Files.createDirectories(cacheDirectory);
			deleteRecursively(cacheDirectory.resolve(NODE_MODULES));
			Files.writeString(cacheDirectory.resolve("package.json"), baseManifest, StandardCharsets.UTF_8);
			installer.install(cacheDirectory);
		}
		catch (IOException | SandboxException e) {
			logger.warn("Failed to build dependency cache at {}: {}", cacheDirectory, e.getMessage());
			return false;
		}
		boolean valid = isValid();
		if (!valid) {
			logger.warn("Dependency cache at {} is still incomplete after install (missing {})", cacheDirectory,
					basePackage);
		}
		else {
			logger.info("Dependency cache at {} is ready", cacheDirectory);
		}
		return valid;
	}

	/**
	 * Copy the cached {@code node_modules} into the target directory.
	 * @param target the workspace directory
	 * @return true if the copy succeeded, false if the caller must install from scratch
	 */
	public boolean materialize(Path target) {
		if (!ensureWarm()) {
			return false;
		}
		Path source = cacheDirectory.resolve(NODE_MODULES);
		Path destination = target.resolve(NODE_MODULES);
		try {
			deleteRecursively(destination);
			copyTree(source, destination);
			logger.debug("Copied cached dependencies into {}", target);
			return true;
		}
		catch (IOException e) {
			logger.warn("Failed to copy cached dependencies into {}: {}", target, e.getMessage());
			try {
				deleteRecursively(destination);
			}
			catch (IOException cleanup) {
				logger.debug("Failed to remove partial copy {}", destination, cleanup);
			}
			return false;
		}
	}

	private static void copyTree(Path source, Path destination) throws IOException {
		Files.walkFileTree(source, new SimpleFileVisitor<>() {

			@Override
			public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
				Files.createDirectories(destination.resolve(source.relativize(dir).toString()));
				return FileVisitResult.CONTINUE;
			}

			@Override
			public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
				Files.copy(file, destination.resolve(source.relativize(file).toString()), LinkOption.NOFOLLOW_LINKS,
						StandardCopyOption.COPY_ATTRIBUTES, StandardCopyOption.REPLACE_EXISTING);
				return FileVisitResult.CONTINUE;
			}

		});
	}

	static void deleteRecursively(Path path) throws IOException {
		if (Files.isSymbolicLink(path)) {
			Files.delete(path);
			return;
		}
		if (!Files.exists(path)) {
			return;
		}
		try (Stream<Path> stream = Files.walk(path)) {
			for (Path p : (Iterable<Path>) stream.sorted(Comparator.reverseOrder())::iterator) {
				Files.delete(p);
			}
		}
	}

}
