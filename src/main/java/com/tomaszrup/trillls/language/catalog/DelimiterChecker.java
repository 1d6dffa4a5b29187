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
package com.tomaszrup.trillls.language.catalog;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.tomaszrup.trillls.core.Severity;
import com.tomaszrup.trillls.language.RawError;

/**
 * Lexical check for catalog-described scripts: brackets must balance and
 * string literals must be terminated on the line they start on. Text after
 * {@code #} up to the end of the line is a comment.
 *
 * <p>Positions are one-based, columns in UTF-16 code units.</p>
 */
public class DelimiterChecker {

	private static final String OPENERS = "([{";
	private static final String CLOSERS = ")]}";

	private static final class Opener {
		final char symbol;
		final int line;
		final int column;

		Opener(char symbol, int line, int column) {
			this.symbol = symbol;
			this.line = line;
			this.column = column;
		}

		char closer() {
			return CLOSERS.charAt(OPENERS.indexOf(symbol));
		}
	}

	public List<RawError> check(String text) {
		List<RawError> errors = new ArrayList<>();
		Deque<Opener> open = new ArrayDeque<>();
		int line = 1;
		int column = 1;
		int i = 0;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '\n') {
				line++;
				column = 1;
				i++;
				continue;
			}
			if (c == '#') {
				int end = text.indexOf('\n', i);
				int stop = end < 0 ? text.length() : end;
				column += stop - i;
				i = stop;
				continue;
			}
			if (c == '"') {
				int consumed = scanString(text, i);
				if (consumed < 0) {
					int stop = lineEnd(text, i);
					errors.add(new RawError(line, column, line, column + (stop - i),
							"unterminated string literal", Severity.ERROR,
							"add a closing `\"` before the end of the line"));
					column += stop - i;
					i = stop;
				} else {
					column += consumed;
					i += consumed;
				}
				continue;
			}
			if (OPENERS.indexOf(c) >= 0) {
				open.push(new Opener(c, line, column));
			} else if (CLOSERS.indexOf(c) >= 0) {
				Opener top = open.peek();
				if (top == null) {
					errors.add(new RawError(line, column, line, column + 1,
							"unexpected closing delimiter `" + c + "`", Severity.ERROR,
							"there is no open delimiter for it to close"));
				} else {
					open.pop();
					if (top.closer() != c) {
						errors.add(new RawError(line, column, line, column + 1,
								"mismatched closing delimiter `" + c + "`", Severity.ERROR,
								"expected `" + top.closer() + "` to close the `" + top.symbol
										+ "` opened at line " + top.line + ", column " + top.column));
					}
				}
			}
			column++;
			i++;
		}
		// oldest opener first
		List<Opener> unclosed = new ArrayList<>(open);
		for (int k = unclosed.size() - 1; k >= 0; k--) {
			Opener opener = unclosed.get(k);
			errors.add(new RawError(opener.line, opener.column, opener.line, opener.column + 1,
					"unclosed delimiter `" + opener.symbol + "`", Severity.ERROR,
					"expected `" + opener.closer() + "` before the end of the document"));
		}
		return errors;
	}

	/**
	 * @return the length of the string literal starting at {@code start},
	 *         quotes included, or -1 if it is not closed on its line
	 */
	private static int scanString(String text, int start) {
		int i = start + 1;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '\n') {
				return -1;
			}
			if (c == '\\') {
				if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
					return -1;
				}
				i += 2;
				continue;
			}
			if (c == '"') {
				return i + 1 - start;
			}
			i++;
		}
		return -1;
	}

	private static int lineEnd(String text, int from) {
		int end = text.indexOf('\n', from);
		return end < 0 ? text.length() : end;
	}
}
