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

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntSupplier;

/**
 * Configuration for {@link PathFiles}.
 *
 * <p>
 * The temp root is where {@link PathFiles#createTempDirectory(String)} allocates
 * directories. Unless set explicitly it is taken from the {@code NICE_PATH_TMPDIR}
 * environment variable, falling back to the {@code java.io.tmpdir} system property.
 * </p>
 */
public final class PathFilesConfig {

	static final String TMPDIR_ENV = "NICE_PATH_TMPDIR";

	private final PathValue tempRoot;

	private final IntSupplier tempSuffixSource;

	private PathFilesConfig(Builder builder) {
		this.tempRoot = builder.tempRoot != null ? builder.tempRoot : defaultTempRoot();
		this.tempSuffixSource = builder.tempSuffixSource != null ? builder.tempSuffixSource
				: () -> ThreadLocalRandom.current().nextInt(Integer.MAX_VALUE);
		if (tempRoot.isRelative()) {
			throw new RelativePathException("Temp root must be an absolute path: " + tempRoot);
		}
	}

	public PathValue tempRoot() {
		return tempRoot;
	}

	public IntSupplier tempSuffixSource() {
		return tempSuffixSource;
	}

	private static PathValue defaultTempRoot() {
		String fromEnv = System.getenv(TMPDIR_ENV);
		if (fromEnv != null && !fromEnv.isBlank()) {
			return PathValue.parse(fromEnv);
		}
		return PathValue.parse(System.getProperty("java.io.tmpdir"));
	}

	/**
	 * Creates a config with every setting at its default.
	 * @return the default config
	 */
	public static PathFilesConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String toString() {
		return String.format("PathFilesConfig{tempRoot=%s}", tempRoot);
	}

	public static class Builder {

		private PathValue tempRoot;

		private IntSupplier tempSuffixSource;

		public Builder tempRoot(PathValue tempRoot) {
			this.tempRoot = tempRoot;
			return this;
		}

		public Builder tempRoot(String tempRoot) {
			this.tempRoot = PathValue.parse(tempRoot);
			return this;
		}

		/**
		 * Set the source of the numbers appended to temp directory names.
		 * @param tempSuffixSource supplies a fresh number for every candidate name
		 * @return this builder
		 */
		public Builder tempSuffixSource(IntSupplier tempSuffixSource) {
			this.tempSuffixSource = Objects.requireNonNull(tempSuffixSource, "tempSuffixSource cannot be null");
			return this;
		}

		public PathFilesConfig build() {
			return new PathFilesConfig(this);
		}

	}

}
