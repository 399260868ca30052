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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable value representing a filesystem path as an anchor plus a sequence of
 * segments.
 *
 * <p>
 * A path string is decomposed into an optional drive letter, an absolute/relative flag and
 * the ordered list of its non-empty segments. Both {@code /} and {@code \} are accepted as
 * separators; redundant separators collapse. Dot segments are kept literally, so
 * {@code ..} is just another segment and never means "go up".
 * </p>
 *
 * <pre>{@code
 * PathValue base = PathValue.parse("/work/project");
 * PathValue source = base.combine("src/Main.java");    // /work/project/src/Main.java
 * PathValue relative = source.relativeTo(base);         // src/Main.java
 * PathValue dir = source.up();                          // /work/project/src
 * }</pre>
 *
 * <p>
 * Instances are created by {@link #parse(String)} and never change; every transformation
 * returns a new instance, so values may be shared freely between threads and used as map
 * keys.
 * </p>
 *
 * @see PathFiles
 */
public final class PathValue {

	private final Character driveLetter;

	private final boolean relative;

	private final List<String> segments;

	private PathValue(List<String> segments, boolean relative, Character driveLetter) {
		this.segments = Collections.unmodifiableList(segments);
		this.relative = relative;
		this.driveLetter = driveLetter;
	}

	/**
	 * Parse a path string.
	 * <p>
	 * A leading {@code X:} is taken as a drive letter. The path is absolute only when a
	 * separator follows the (optional) drive letter, so {@code "C:"} on its own is a
	 * relative path with no segments.
	 * </p>
	 * @param path the path string, may be empty
	 * @return the parsed path
	 */
	public static PathValue parse(String path) {
		Objects.requireNonNull(path, "path cannot be null");
		DriveSplit split = DriveSplit.of(path);
		String remainder = split.remainder();

		String[] parts = remainder.split("[/\\\\]", -1);
		boolean relative = remainder.isEmpty() || !parts[0].isEmpty();

		List<String> segments = new ArrayList<>(parts.length);
		for (String part : parts) {
			if (!part.isEmpty()) {
				segments.add(part);
			}
		}
		return new PathValue(segments, relative, split.driveLetter());
	}

	/**
	 * Alias of {@link #parse(String)}.
	 * @param path the path string
	 * @return the parsed path
	 */
	public static PathValue of(String path) {
		return parse(path);
	}

	public boolean isRelative() {
		return relative;
	}

	public Optional<Character> driveLetter() {
		return Optional.ofNullable(driveLetter);
	}

	/**
	 * The non-empty segments of this path, in order.
	 * @return an unmodifiable list
	 */
	public List<String> segments() {
		return segments;
	}

	public boolean isEmpty() {
		return segments.isEmpty();
	}

	/**
	 * Get the last segment of this path.
	 * @return the file (or directory) name
	 * @throws EmptyPathException if the path has no segments
	 */
	public String fileName() {
		if (segments.isEmpty()) {
			throw new EmptyPathException("fileName() called on an empty path: " + this);
		}
		return segments.get(segments.size() - 1);
	}

	/**
	 * Get the extension of the last segment, including the leading dot.
	 * @return the extension such as {@code ".txt"}, or an empty string if the file name
	 * has no dot
	 * @throws EmptyPathException if the path has no segments
	 */
	public String extensionWithDot() {
		String name = fileName();
		int index = name.lastIndexOf('.');
		return index < 0 ? "" : name.substring(index);
	}

	/**
	 * Check the extension of the last segment.
	 * @param extension the extension, with or without its leading dot
	 * @return true if the file name ends in the given extension
	 */
	public boolean hasExtension(String extension) {
		String withDot = extension.startsWith(".") ? extension : "." + extension;
		return withDot.equals(extensionWithDot());
	}

	/**
	 * Append a relative path string to this path.
	 * @param append the path to append, parsed first
	 * @return a new path with the same anchor as this one
	 * @throws InvalidCombinationException if {@code append} is not relative
	 */
	public PathValue combine(String append) {
		return combine(parse(append));
	}

	/**
	 * Append several relative path strings, in order.
	 * @param appends the paths to append
	 * @return a new path with the same anchor as this one
	 * @throws InvalidCombinationException if any of the paths is not relative
	 */
	public PathValue combine(String... appends) {
		PathValue result = this;
		for (String append : appends) {
			result = result.combine(append);
		}
		return result;
	}

	/**
	 * Append a relative path to this path.
	 * <p>
	 * The appended path contributes only its segments; drive letter and absolute flag are
	 * taken from this path.
	 * </p>
	 * @param append the path to append
	 * @return a new path with the same anchor as this one
	 * @throws InvalidCombinationException if {@code append} is not relative
	 */
	public PathValue combine(PathValue append) {
		Objects.requireNonNull(append, "append cannot be null");
		if (!append.relative) {
			throw new InvalidCombinationException(
					"You cannot combine a non-relative path: " + this + " + " + append);
		}
		List<String> combined = new ArrayList<>(segments.size() + append.segments.size());
		combined.addAll(segments);
		combined.addAll(append.segments);
		return new PathValue(combined, relative, driveLetter);
	}

	/**
	 * Remove the last segment.
	 * @return the parent path
	 * @throws EmptyPathException if the path has no segments
	 */
	public PathValue up() {
		if (segments.isEmpty()) {
			throw new EmptyPathException("up() called on an empty path: " + this);
		}
		return new PathValue(new ArrayList<>(segments.subList(0, segments.size() - 1)), relative, driveLetter);
	}

	/**
	 * Alias of {@link #up()}.
	 * @return the parent path
	 * @throws EmptyPathException if the path has no segments
	 */
	public PathValue parent() {
		return up();
	}

	/**
	 * Express this path relative to one of its ancestors.
	 * @param base an ancestor of this path, or this path itself
	 * @return a relative path without drive letter; empty if {@code base} equals this path
	 * @throws UnrelatedPathsException if {@code base} is not an ancestor-or-equal of this
	 * path
	 */
	public PathValue relativeTo(PathValue base) {
		Objects.requireNonNull(base, "base cannot be null");
		if (!isBelowOrEqual(base)) {
			throw new UnrelatedPathsException(toString(), base.toString());
		}
		return new PathValue(new ArrayList<>(segments.subList(base.segments.size(), segments.size())), true, null);
	}

	/**
	 * Check whether {@code base} is this path or one of its ancestors.
	 * <p>
	 * Equivalent to walking {@link #up()} from this path until it equals {@code base} or
	 * runs out of segments. An empty path is never below anything, so a base without
	 * segments (such as {@code "/"}) never matches.
	 * </p>
	 * @param base the candidate ancestor
	 * @return true if this path equals {@code base} or lies beneath it
	 */
	public boolean isBelowOrEqual(PathValue base) {
		Objects.requireNonNull(base, "base cannot be null");
		int depth = base.segments.size();
		if (depth == 0 || depth > segments.size()) {
			return false;
		}
		if (relative != base.relative || !Objects.equals(driveLetter, base.driveLetter)) {
			return false;
		}
		for (int i = 0; i < depth; i++) {
			if (!segments.get(i).equals(base.segments.get(i))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PathValue)) {
			return false;
		}
		PathValue other = (PathValue) o;
		return relative == other.relative && Objects.equals(driveLetter, other.driveLetter)
				&& segments.equals(other.segments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(relative, driveLetter, segments);
	}

	/**
	 * Render the canonical form: {@code [drive ":"] ["/"] segment ("/" segment)*}.
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		if (driveLetter != null) {
			sb.append(driveLetter).append(':');
		}
		if (!relative) {
			sb.append('/');
		}
		sb.append(String.join("/", segments));
		return sb.toString();
	}

	/**
	 * Result of stripping a leading drive letter off a path string.
	 */
	private record DriveSplit(Character driveLetter, String remainder) {

		static DriveSplit of(String path) {
			if (path.length() >= 2 && path.charAt(1) == ':') {
				return new DriveSplit(path.charAt(0), path.substring(2));
			}
			return new DriveSplit(null, path);
		}

	}

}
