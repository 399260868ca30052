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
package org.springaicommunity.nicepath;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filesystem operations on {@link PathValue}s.
 *
 * <p>
 * All path arithmetic is done on {@link PathValue}; a path is rendered to a string only
 * when it is handed to the underlying {@link PathFileSystem}. Every operation that touches
 * the filesystem requires an absolute path and fails with {@link RelativePathException}
 * otherwise.
 * </p>
 *
 * <pre>{@code
 * PathFiles files = PathFiles.builder().build();
 *
 * PathValue work = files.createTempDirectory("build");
 * files.createFile(work.combine("src/Main.java"));
 * files.copy(work.combine("src"), work.combine("backup/src"));
 * files.delete(work, DeleteMode.SOFT);
 * }</pre>
 *
 * <p>
 * Operations are blocking and make no guarantee when they overlap on the same tree. A copy
 * or delete that fails part way leaves whatever the completed steps produced.
 * </p>
 */
public final class PathFiles {

	private static final Logger logger = LoggerFactory.getLogger(PathFiles.class);

	private final PathFileSystem fileSystem;

	private final PathFilesConfig config;

	/**
	 * Creates PathFiles on the host filesystem with default configuration.
	 */
	public PathFiles() {
		this(new LocalPathFileSystem(), PathFilesConfig.defaults());
	}

	/**
	 * Creates PathFiles on the given filesystem.
	 * @param fileSystem the filesystem to operate on
	 * @param config temp directory settings
	 */
	public PathFiles(PathFileSystem fileSystem, PathFilesConfig config) {
		this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem cannot be null");
		this.config = Objects.requireNonNull(config, "config cannot be null");
	}

	public static Builder builder() {
		return new Builder();
	}

	public PathFileSystem fileSystem() {
		return fileSystem;
	}

	public PathFilesConfig config() {
		return config;
	}

	// inspection

	public boolean exists(PathValue path) {
		return fileSystem.exists(path.toString());
	}

	public boolean fileExists(PathValue path) {
		return fileSystem.isFile(path.toString());
	}

	public boolean directoryExists(PathValue path) {
		return fileSystem.isDirectory(path.toString());
	}

	// enumeration

	public List<PathValue> files(PathValue directory) {
		return files(directory, false);
	}

	/**
	 * List the files in a directory.
	 * @param directory an absolute directory path
	 * @param recursive whether to include files in subdirectories
	 * @return the files found
	 * @throws RelativePathException if {@code directory} is relative
	 * @throws PathFilesException if the directory cannot be read
	 */
	public List<PathValue> files(PathValue directory, boolean recursive) {
		throwIfRelative(directory);
		try {
			return wrap(fileSystem.listFiles(directory.toString(), recursive));
		}
		catch (IOException e) {
			throw new PathFilesException("Failed to list files: " + directory, e);
		}
	}

	/**
	 * List the files directly inside a directory that match a filter.
	 * @param directory an absolute directory path
	 * @param filter which files to keep
	 * @return the matching files
	 */
	public List<PathValue> files(PathValue directory, Predicate<PathValue> filter) {
		return files(directory).stream().filter(filter).collect(Collectors.toList());
	}

	public List<PathValue> directories(PathValue directory) {
		return directories(directory, false);
	}

	/**
	 * List the subdirectories of a directory.
	 * @param directory an absolute directory path
	 * @param recursive whether to include nested subdirectories
	 * @return the directories found
	 * @throws RelativePathException if {@code directory} is relative
	 * @throws PathFilesException if the directory cannot be read
	 */
	public List<PathValue> directories(PathValue directory, boolean recursive) {
		throwIfRelative(directory);
		try {
			return wrap(fileSystem.listDirectories(directory.toString(), recursive));
		}
		catch (IOException e) {
			throw new PathFilesException("Failed to list directories: " + directory, e);
		}
	}

	public List<PathValue> contents(PathValue directory) {
		return contents(directory, false);
	}

	/**
	 * List files followed by directories.
	 * @param directory an absolute directory path
	 * @param recursive whether to descend into subdirectories
	 * @return {@link #files(PathValue, boolean)} followed by
	 * {@link #directories(PathValue, boolean)}
	 */
	public List<PathValue> contents(PathValue directory, boolean recursive) {
		List<PathValue> contents = new ArrayList<>(files(directory, recursive));
		contents.addAll(directories(directory, recursive));
		return contents;
	}

	private static List<PathValue> wrap(List<String> paths) {
		return paths.stream().map(PathValue::parse).collect(Collectors.toList());
	}

	// creation

	/**
	 * Create an empty file, creating any missing parent directories first.
	 * @param file an absolute file path
	 * @return {@code file}
	 * @throws RelativePathException if {@code file} is relative
	 * @throws EmptyPathException if {@code file} has no segments, or no ancestor of it
	 * exists as a directory
	 * @throws PathFilesException if a directory or the file cannot be written
	 */
	public PathValue createFile(PathValue file) {
		throwIfRelative(file);
		ensureDirectoryExists(file.up());
		try {
			fileSystem.writeBytes(file.toString(), new byte[0]);
		}
		catch (IOException e) {
			throw new PathFilesException("Failed to create file: " + file, e);
		}
		logger.debug("Created file {}", file);
		return file;
	}

	/**
	 * Create a directory. Its parent must already exist.
	 * @param directory an absolute directory path
	 * @return {@code directory}
	 * @throws RelativePathException if {@code directory} is relative
	 * @throws PathFilesException if the directory cannot be created
	 */
	public PathValue createDirectory(PathValue directory) {
		throwIfRelative(directory);
		try {
			fileSystem.createDirectory(directory.toString());
		}
		catch (IOException e) {
			throw new PathFilesException("Failed to create directory: " + directory, e);
		}
		logger.debug("Created directory {}", directory);
		return directory;
	}

	/**
	 * Create a new, uniquely named directory under the configured temp root.
	 * <p>
	 * Candidate names are {@code prefix + "_" + n} with {@code n} drawn from
	 * {@link PathFilesConfig#tempSuffixSource()}; the first one that does not exist yet is
	 * created. Another process may claim the same name between the check and the creation.
	 * </p>
	 * @param prefix the directory name prefix
	 * @return the created directory
	 */
	public PathValue createTempDirectory(String prefix) {
		while (true) {
			PathValue candidate = config.tempRoot().combine(prefix + "_" + config.tempSuffixSource().getAsInt());
			if (!exists(candidate)) {
				logger.debug("Allocating temp directory {}", candidate);
				return createDirectory(candidate);
			}
			logger.trace("Temp directory candidate {} already exists", candidate);
		}
	}

	// copy

	public void copy(PathValue source, PathValue destination) {
		copy(source, destination, p -> true);
	}

	/**
	 * Copy a file or a directory tree.
	 * <p>
	 * A file is copied over any existing destination, creating the destination's parent
	 * directories as needed. A directory is copied child by child, each child going to the
	 * same relative location beneath {@code destination}; empty directories are reproduced.
	 * </p>
	 * @param source an absolute path to an existing file or directory
	 * @param destination an absolute target path
	 * @param filter called with every destination before it is written; returning false
	 * skips that file, or that whole subtree for a directory
	 * @throws RelativePathException if either path is relative
	 * @throws SourceNotFoundException if {@code source} exists as neither file nor
	 * directory
	 * @throws PathFilesException if the filesystem fails
	 */
	public void copy(PathValue source, PathValue destination, Predicate<PathValue> filter) {
		throwIfRelative(source);
		if (destination.isRelative()) {
			throw new RelativePathException("Cannot copy to a relative path: " + destination);
		}

		if (!filter.test(destination)) {
			logger.trace("Skipping {}", destination);
			return;
		}

		if (fileExists(source)) {
			ensureDirectoryExists(destination.up());
			try {
				fileSystem.copyFile(source.toString(), destination.toString(), true);
			}
			catch (IOException e) {
				throw new PathFilesException("Failed to copy " + source + " to " + destination, e);
			}
			logger.debug("Copied {} to {}", source, destination);
		}
		else if (directoryExists(source)) {
			ensureDirectoryExists(destination);
			for (PathValue child : contents(source)) {
				copy(child, destination.combine(child.relativeTo(source)), filter);
			}
		}
		else {
			throw new SourceNotFoundException("copy() called on path that does not exist: " + source);
		}
	}

	// delete

	public void delete(PathValue path) {
		delete(path, DeleteMode.NORMAL);
	}

	/**
	 * Delete a file, or a directory with everything in it.
	 * @param path an absolute path to an existing file or directory
	 * @param deleteMode whether a failure to remove a directory tree is reported
	 * @throws RelativePathException if {@code path} is relative
	 * @throws PathNotFoundException if nothing exists at {@code path}
	 * @throws PathFilesException if removal fails; for a directory only in
	 * {@link DeleteMode#NORMAL}
	 */
	public void delete(PathValue path, DeleteMode deleteMode) {
		throwIfRelative(path);

		if (fileExists(path)) {
			try {
				fileSystem.removeFile(path.toString());
			}
			catch (IOException e) {
				throw new PathFilesException("Failed to delete: " + path, e);
			}
			logger.debug("Deleted file {}", path);
		}
		else if (directoryExists(path)) {
			try {
				fileSystem.removeDirectoryRecursive(path.toString());
				logger.debug("Deleted directory {}", path);
			}
			catch (IOException e) {
				if (deleteMode == DeleteMode.NORMAL) {
					throw new PathFilesException("Failed to delete: " + path, e);
				}
				logger.debug("Ignoring failure to delete {}", path, e);
			}
		}
		else {
			throw new PathNotFoundException("Trying to delete a path that does not exist: " + path);
		}
	}

	private static void throwIfRelative(PathValue path) {
		if (path.isRelative()) {
			throw new RelativePathException(
					"You are attempting an operation on a path that requires an absolute path, but the path is relative: "
							+ path);
		}
	}

	/**
	 * Create {@code directory} and any missing ancestors, outermost first.
	 * @throws EmptyPathException if no ancestor exists, not even the root
	 */
	private void ensureDirectoryExists(PathValue directory) {
		Deque<PathValue> missing = new ArrayDeque<>();
		PathValue current = directory;
		while (!directoryExists(current)) {
			missing.push(current);
			current = current.up();
		}
		while (!missing.isEmpty()) {
			createDirectory(missing.pop());
		}
	}

	@Override
	public String toString() {
		return String.format("PathFiles{fileSystem=%s, config=%s}", fileSystem, config);
	}

	/**
	 * Builder for creating PathFiles instances with fluent configuration.
	 */
	public static class Builder {

		private PathFileSystem fileSystem;

		private PathFilesConfig config;

		/**
		 * Set the filesystem to operate on. Defaults to {@link LocalPathFileSystem}.
		 * @param fileSystem the filesystem
		 * @return this builder
		 */
		public Builder fileSystem(PathFileSystem fileSystem) {
			this.fileSystem = fileSystem;
			return this;
		}

		/**
		 * Set the configuration. Defaults to {@link PathFilesConfig#defaults()}.
		 * @param config the configuration
		 * @return this builder
		 */
		public Builder config(PathFilesConfig config) {
			this.config = config;
			return this;
		}

		public PathFiles build() {
			return new PathFiles(fileSystem != null ? fileSystem : new LocalPathFileSystem(),
					config != null ? config : PathFilesConfig.defaults());
		}

	}

}
