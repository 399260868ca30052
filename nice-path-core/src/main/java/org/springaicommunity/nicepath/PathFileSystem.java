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
import java.util.List;

/**
 * The filesystem primitives that {@link PathFiles} builds its operations on.
 *
 * <p>
 * Implementations work on plain path strings as rendered by {@link PathValue#toString()}
 * and know nothing about segments or anchors. {@link PathFiles} does all path arithmetic
 * before calling in, so an implementation only has to perform the side effect.
 * </p>
 *
 * <p>
 * Supported implementations: {@link LocalPathFileSystem} (host filesystem via
 * {@link java.nio.file.Files}).
 * </p>
 *
 * @see PathFiles
 */
public interface PathFileSystem {

	/**
	 * Check if a file or directory exists.
	 * @param path the path to check
	 * @return true if anything exists at the path
	 */
	boolean exists(String path);

	/**
	 * Check if a regular file exists.
	 * @param path the path to check
	 * @return true if the path is a file
	 */
	boolean isFile(String path);

	/**
	 * Check if a directory exists.
	 * @param path the path to check
	 * @return true if the path is a directory
	 */
	boolean isDirectory(String path);

	/**
	 * Create a single directory.
	 * <p>
	 * The parent directory is assumed to exist already. Creating a directory that already
	 * exists is not an error.
	 * </p>
	 * @param path the directory to create
	 * @throws IOException if the directory cannot be created
	 */
	void createDirectory(String path) throws IOException;

	/**
	 * Remove a single file.
	 * @param path the file to remove
	 * @throws IOException if the file cannot be removed
	 */
	void removeFile(String path) throws IOException;

	/**
	 * Remove a directory together with everything beneath it.
	 * @param path the directory to remove
	 * @throws IOException if any part of the tree cannot be removed, for example because a
	 * file is in use
	 */
	void removeDirectoryRecursive(String path) throws IOException;

	/**
	 * List the files in a directory.
	 * @param path the directory to list
	 * @param recursive whether to descend into subdirectories
	 * @return the paths of the files found
	 * @throws IOException if the directory cannot be read
	 */
	List<String> listFiles(String path, boolean recursive) throws IOException;

	/**
	 * List the subdirectories of a directory.
	 * @param path the directory to list
	 * @param recursive whether to descend into subdirectories
	 * @return the paths of the directories found, not including {@code path} itself
	 * @throws IOException if the directory cannot be read
	 */
	List<String> listDirectories(String path, boolean recursive) throws IOException;

	/**
	 * Copy a file byte for byte.
	 * @param source the file to copy
	 * @param destination the file to write; its directory must exist
	 * @param overwrite whether an existing destination may be replaced
	 * @throws IOException if the copy fails
	 */
	void copyFile(String source, String destination, boolean overwrite) throws IOException;

	/**
	 * Create or overwrite a file with the given content.
	 * @param path the file to write
	 * @param bytes the content
	 * @throws IOException if the file cannot be written
	 */
	void writeBytes(String path, byte[] bytes) throws IOException;

}
