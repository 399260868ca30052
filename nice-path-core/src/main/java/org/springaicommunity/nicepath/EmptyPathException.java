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
 * Thrown when an operation needs at least one segment but the path has none, such as
 * {@link PathValue#up()} or {@link PathValue#fileName()}.
 */
public class EmptyPathException extends PathException {

	public EmptyPathException(String message) {
		super(message);
	}

}
