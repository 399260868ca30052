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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Test Compatibility Kit (TCK) for testing any {@link PathFileSystem} implementation.
 *
 * <p>
 * Concrete test classes set {@link #fileSystem} and {@link #root} in a
 * {@code @BeforeEach} method. {@link #root} must be an existing, empty directory given as
 * an absolute path string with forward slashes, so that the paths the filesystem reports
 * back can be compared with the strings built here.
 * </p>
 */
public abstract class AbstractPathFileSystemTCK {

	/**
	 * The filesystem implementation under test. Must be set by concrete test classes.
	 */
	protected PathFileSystem fileSystem;

	/**
	 * An existing, empty directory to work in. Must be set by concrete test classes.
	 */
	protected String root;

	/**
	 * Read a file back through a side channel, to check what the filesystem wrote.
	 */
	protected abstract byte[] read(String path) throws IOException;

	private String at(String relative) {
		return root + "/" + relative;
	}

	private void write(String relative, String content) throws IOException {
		fileSystem.writeBytes(at(relative), content.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	void rootShouldBeAnExistingDirectory() {
		assertThat(fileSystem.exists(root)).isTrue();
		assertThat(fileSystem.isDirectory(root)).isTrue();
		assertThat(fileSystem.isFile(root)).isFalse();
	}

	@Test
	void predicatesShouldBeFalseForMissingPath() {
		assertThat(fileSystem.exists(at("missing"))).isFalse();
		assertThat(fileSystem.isFile(at("missing"))).isFalse();
		assertThat(fileSystem.isDirectory(at("missing"))).isFalse();
	}

	@Test
	void writeBytesShouldCreateFileWithContent() throws Exception {
		write("a.txt", "Hello, World!");

		assertThat(fileSystem.isFile(at("a.txt"))).isTrue();
		assertThat(fileSystem.isDirectory(at("a.txt"))).isFalse();
		assertThat(new String(read(at("a.txt")), StandardCharsets.UTF_8)).isEqualTo("Hello, World!");
	}

	@Test
	void writeBytesShouldOverwriteExistingFile() throws Exception {
		write("a.txt", "first");
		write("a.txt", "second");

		assertThat(new String(read(at("a.txt")), StandardCharsets.UTF_8)).isEqualTo("second");
	}

	@Test
	void writeBytesShouldFailWhenParentIsMissing() {
		assertThatThrownBy(() -> write("missing/a.txt", "content")).isInstanceOf(IOException.class);
	}

	@Test
	void createDirectoryShouldCreateSingleLevel() throws Exception {
		fileSystem.createDirectory(at("dir"));

		assertThat(fileSystem.isDirectory(at("dir"))).isTrue();
		assertThat(fileSystem.isFile(at("dir"))).isFalse();
	}

	@Test
	void createDirectoryShouldBeIdempotent() throws Exception {
		fileSystem.createDirectory(at("dir"));
		fileSystem.createDirectory(at("dir"));

		assertThat(fileSystem.isDirectory(at("dir"))).isTrue();
	}

	@Test
	void createDirectoryShouldFailWhenParentIsMissing() {
		assertThatThrownBy(() -> fileSystem.createDirectory(at("missing/dir"))).isInstanceOf(IOException.class);
	}

	@Test
	void createDirectoryShouldRefuseExistingFile() throws Exception {
		write("taken", "content");

		assertThatThrownBy(() -> fileSystem.createDirectory(at("taken")))
			.isInstanceOf(FileAlreadyExistsException.class);
		assertThat(fileSystem.isFile(at("taken"))).isTrue();
	}

	@Test
	void removeFileShouldDeleteFile() throws Exception {
		write("a.txt", "content");

		fileSystem.removeFile(at("a.txt"));

		assertThat(fileSystem.exists(at("a.txt"))).isFalse();
	}

	@Test
	void removeDirectoryRecursiveShouldDeleteWholeTree() throws Exception {
		fileSystem.createDirectory(at("dir"));
		fileSystem.createDirectory(at("dir/nested"));
		fileSystem.createDirectory(at("dir/empty"));
		write("dir/a.txt", "A");
		write("dir/nested/b.txt", "B");

		fileSystem.removeDirectoryRecursive(at("dir"));

		assertThat(fileSystem.exists(at("dir"))).isFalse();
		assertThat(fileSystem.exists(at("dir/nested/b.txt"))).isFalse();
		assertThat(fileSystem.isDirectory(root)).isTrue();
	}

	@Test
	void listFilesShouldReturnDirectChildrenOnly() throws Exception {
		fileSystem.createDirectory(at("nested"));
		write("a.txt", "A");
		write("b.txt", "B");
		write("nested/c.txt", "C");

		assertThat(fileSystem.listFiles(root, false)).containsExactlyInAnyOrder(at("a.txt"), at("b.txt"));
	}

	@Test
	void listFilesRecursiveShouldDescend() throws Exception {
		fileSystem.createDirectory(at("nested"));
		fileSystem.createDirectory(at("nested/deeper"));
		write("a.txt", "A");
		write("nested/deeper/c.txt", "C");

		assertThat(fileSystem.listFiles(root, true)).containsExactlyInAnyOrder(at("a.txt"),
				at("nested/deeper/c.txt"));
	}

	@Test
	void listDirectoriesShouldExcludeListedDirectory() throws Exception {
		fileSystem.createDirectory(at("one"));
		fileSystem.createDirectory(at("one/inner"));
		fileSystem.createDirectory(at("two"));
		write("a.txt", "A");

		assertThat(fileSystem.listDirectories(root, false)).containsExactlyInAnyOrder(at("one"), at("two"));
		assertThat(fileSystem.listDirectories(root, true)).containsExactlyInAnyOrder(at("one"), at("one/inner"),
				at("two"));
	}

	@Test
	void listingMissingDirectoryShouldFail() {
		assertThatThrownBy(() -> fileSystem.listFiles(at("missing"), false)).isInstanceOf(IOException.class);
	}

	@Test
	void copyFileShouldCopyContent() throws Exception {
		write("a.txt", "content");

		fileSystem.copyFile(at("a.txt"), at("b.txt"), false);

		assertThat(new String(read(at("b.txt")), StandardCharsets.UTF_8)).isEqualTo("content");
		assertThat(fileSystem.isFile(at("a.txt"))).isTrue();
	}

	@Test
	void copyFileShouldReplaceDestinationWhenOverwriting() throws Exception {
		write("a.txt", "new");
		write("b.txt", "old");

		fileSystem.copyFile(at("a.txt"), at("b.txt"), true);

		assertThat(new String(read(at("b.txt")), StandardCharsets.UTF_8)).isEqualTo("new");
	}

	@Test
	void copyFileShouldRefuseExistingDestinationWithoutOverwrite() throws Exception {
		write("a.txt", "new");
		write("b.txt", "old");

		assertThatThrownBy(() -> fileSystem.copyFile(at("a.txt"), at("b.txt"), false))
			.isInstanceOf(IOException.class);
		assertThat(new String(read(at("b.txt")), StandardCharsets.UTF_8)).isEqualTo("old");
	}

}
