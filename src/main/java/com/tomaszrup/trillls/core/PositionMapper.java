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

/**
 * Converts between {@link SourcePosition}s and absolute {@code char} offsets
 * into a document's text.
 *
 * <p>Lines are terminated by {@code '\n'} only; a {@code '\r'} preceding it is
 * an ordinary column character. Columns are counted in the configured
 * {@link ColumnEncoding}. For every position inside the text,
 * {@code toPosition(text, toOffset(text, p))} returns {@code p}.</p>
 */
public final class PositionMapper {
	private final ColumnEncoding encoding;

	public PositionMapper(ColumnEncoding encoding) {
		this.encoding = Objects.requireNonNull(encoding, "encoding");
	}

	public ColumnEncoding getEncoding() {
		return encoding;
	}

	/**
	 * Returns the offset of {@code position} in {@code text}. A line past the
	 * end of the text maps to {@code text.length()}; a column past the end of
	 * its line maps to the line end.
	 *
	 * @return the offset, or -1 if the text or position is null or negative
	 */
	public int toOffset(String text, SourcePosition position) {
		if (text == null || position == null || !position.isValid()) {
			return -1;
		}
		int lineStartOffset = findLineStartOffset(text, position.getLine());
		if (lineStartOffset < 0) {
			return text.length();
		}
		int lineEndOffset = findLineEndOffset(text, lineStartOffset);
		if (encoding == ColumnEncoding.UTF16) {
			return Math.min(lineStartOffset + position.getColumn(), lineEndOffset);
		}
		int offset = lineStartOffset;
		int remaining = position.getColumn();
		while (remaining > 0 && offset < lineEndOffset) {
			offset += Character.charCount(text.codePointAt(offset));
			remaining--;
		}
		return Math.min(offset, lineEndOffset);
	}

	/**
	 * Returns the position of {@code offset} in {@code text}. Offsets outside
	 * {@code [0, text.length()]} are clamped into that range.
	 */
	public SourcePosition toPosition(String text, int offset) {
		if (text == null || text.isEmpty()) {
			return SourcePosition.ORIGIN;
		}
		int clamped = Math.max(0, Math.min(offset, text.length()));
		int line = 0;
		int lineStartOffset = 0;
		for (int i = 0; i < clamped; i++) {
			if (text.charAt(i) == '\n') {
				line++;
				lineStartOffset = i + 1;
			}
		}
		int column = encoding == ColumnEncoding.UTF16
				? clamped - lineStartOffset
				: text.codePointCount(lineStartOffset, clamped);
		return new SourcePosition(line, column);
	}

	/**
	 * Maps a one-based line and UTF-16 column, as compilers usually report
	 * them, to a position in this mapper's encoding. The column is clamped to
	 * its line. A line below 1 or past the end of the text maps to
	 * {@link SourcePosition#ORIGIN}.
	 */
	public SourcePosition fromOneBased(String text, int line, int column) {
		if (text == null || line < 1) {
			return SourcePosition.ORIGIN;
		}
		int lineStartOffset = findLineStartOffset(text, line - 1);
		if (lineStartOffset < 0) {
			return SourcePosition.ORIGIN;
		}
		int lineEndOffset = findLineEndOffset(text, lineStartOffset);
		int offset = lineStartOffset + Math.max(0, column - 1);
		return toPosition(text, Math.min(offset, lineEndOffset));
	}

	/**
	 * Offset of the first character of {@code line}, or -1 when the text has
	 * fewer lines.
	 */
	static int findLineStartOffset(String text, int line) {
		if (line == 0) {
			return 0;
		}
		int currentLine = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				currentLine++;
				if (currentLine == line) {
					return i + 1;
				}
			}
		}
		return -1;
	}

	static int findLineEndOffset(String text, int lineStartOffset) {
		int newline = text.indexOf('\n', lineStartOffset);
		return newline < 0 ? text.length() : newline;
	}
}
