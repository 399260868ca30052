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
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host filesystem implementation of {@link PathFileSystem}.
 *
 * <p>
 * Uses {@link java.nio.file.Files}. Path strings are handed to {@link Path#of} unchanged,
 * so a relative string resolves against the JVM working directory; {@link PathFiles}
 * never passes one in.
 * </p>
 */
public class LocalPathFileSystem implements PathFileSystem {

	private static final Logger logger = LoggerFactory.getLogger(LocalPathFileSystem.class);

	@Override
	public boolean exists(String path) {
		return Files.exists(Path.of(path));
	}

	@Override
	public boolean isFile(String path) {
		return Files.isRegularFile(Path.of(path));
	}

	@Override
	public boolean isDirectory(String path) {
		return Files.isDirectory(Path.of(path));
	}

	@Override
	public void createDirectory(String path) throws IOException {
		Path dirPath = Path.of(path);
		try {
			Files.createDirectory(dirPath);
		}
		catch (FileAlreadyExistsException e) {
			if (!Files.isDirectory(dirPath)) {
				throw e;
			}
		}
	}

	@Override
	public void removeFile(String path) throws IOException {
		Files.delete(Path.of(path));
	}

	@Override
	public void removeDirectoryRecursive(String path) throws IOException {
		// Deepest first so every directory is empty by the time it is deleted
		try (Stream<Path> stream = Files.walk(Path.of(path))) {
			Iterator<Path> it = stream.sorted(Comparator.reverseOrder()).iterator();
			while (it.hasNext()) {
				Path p = it.next();
				logger.trace("Deleting {}", p);
				Files.delete(p);
			}
		}
		catch (UncheckedIOException e) {
			throw e.getCause();
		}
	}

	@Override
	public List<String> listFiles(String path, boolean recursive) throws IOException {
		return list(path, recursive, Files::isRegularFile);
	}

	@Override
	public List<String> listDirectories(String path, boolean recursive) throws IOException {
		return list(path, recursive, Files::isDirectory);
	}

	private List<String> list(String path, boolean recursive, Predicate<Path> filter) throws IOException {
		Path dirPath = Path.of(path);
		int maxDepth = recursive ? Integer.MAX_VALUE : 1;
		try (Stream<Path> stream = Files.walk(dirPath, maxDepth)) {
			return stream.filter(p -> !p.equals(dirPath))
				.filter(filter)
				.map(Path::toString)
				.sorted()
				.collect(Collectors.toList());
		}
		catch (UncheckedIOException e) {
			throw e.getCause();
		}
	}

	@Override
	public void copyFile(String source, String destination, boolean overwrite) throws IOException {
		if (overwrite) {
			Files.copy(Path.of(source), Path.of(destination), StandardCopyOption.REPLACE_EXISTING);
		}
		else {
			Files.copy(Path.of(source), Path.of(destination));
		}
	}

	@Override
	public void writeBytes(String path, byte[] bytes) throws IOException {
		Files.write(Path.of(path), bytes);
	}

	@Override
	public String toString() {
		return "LocalPathFileSystem";
	}

}
