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
 * Base class for the unchecked exceptions raised by {@link PathValue} and
 * {@link PathFiles}.
 *
 * <p>
 * Every failure is local and synchronous: it is raised by the call that detected it and
 * nothing is retried or rolled back.
 * </p>
 */
public class PathException extends RuntimeException {

	public PathException(String message) {
		super(message);
	}

	public PathException(String message, Throwable cause) {
		super(message, cause);
	}

}
