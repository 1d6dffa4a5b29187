////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.trillls.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Finds the identifier or path token that ends at a cursor position.
 *
 * <p>The scan runs backward from the cursor over letters, digits,
 * {@code '_'} and whole occurrences of the path separator, and never past the
 * cursor. A cursor with no such character directly before it yields no token.</p>
 */
public final class TokenExtractor {
	private final PositionMapper positionMapper;
	private final String separator;

	public TokenExtractor(PositionMapper positionMapper, String separator) {
		this.positionMapper = Objects.requireNonNull(positionMapper, "positionMapper");
		if (separator == null || separator.isEmpty()) {
			throw new IllegalArgumentException("Path separator must not be empty");
		}
		this.separator = separator;
	}

	public Optional<Token> extract(String text, SourcePosition position) {
		int offset = positionMapper.toOffset(text, position);
		if (offset <= 0) {
			return Optional.empty();
		}
		return extractAt(text, offset);
	}

	/**
	 * Same as {@link #extract(String, SourcePosition)} for an already
	 * resolved offset.
	 */
	public Optional<Token> extractAt(String text, int offset) {
		if (text == null || offset <= 0 || offset > text.length()) {
			return Optional.empty();
		}
		int start = offset;
		while (start > 0) {
			if (start >= separator.length() && text.startsWith(separator, start - separator.length())) {
				start -= separator.length();
			} else if (isIdentifierChar(text.charAt(start - 1))) {
				start--;
			} else {
				break;
			}
		}
		if (start == offset) {
			return Optional.empty();
		}
		String raw = text.substring(start, offset);
		int split = raw.lastIndexOf(separator);
		if (split < 0) {
			return Optional.of(new Token(raw, start, offset, null, raw));
		}
		String namespace = raw.substring(0, split);
		String member = raw.substring(split + separator.length());
		return Optional.of(new Token(raw, start, offset, namespace, member));
	}

	private static boolean isIdentifierChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}
}
