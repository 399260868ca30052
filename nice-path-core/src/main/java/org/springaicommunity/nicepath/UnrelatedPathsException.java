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

/**
 * Thrown by {@link PathValue#relativeTo(PathValue)} when the base is not an ancestor of
 * (or equal to) the path being relativized.
 */
public class UnrelatedPathsException extends PathException {

	private final String path;

	private final String base;

	public UnrelatedPathsException(String path, String base) {
		super("relativeTo() was invoked with two paths that are unrelated. invoked on: " + path
				+ " asked to be made relative to: " + base);
		this.path = path;
		this.base = base;
	}

	/**
	 * The path that was being relativized.
	 * @return the path string
	 */
	public String path() {
		return path;
	}

	/**
	 * The base it was supposed to be relative to.
	 * @return the base path string
	 */
	public String base() {
		return base;
	}

}
