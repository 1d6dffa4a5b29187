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

import java.util.Locale;

/**
 * Unit in which {@link SourcePosition#getColumn()} is counted.
 */
public enum ColumnEncoding {
	/** One column per UTF-16 code unit (Java {@code char}). The LSP default. */
	UTF16,
	/** One column per Unicode code point; a surrogate pair is a single column. */
	CODE_POINT;

	/**
	 * Parses {@code utf16}, {@code utf-16}, {@code codepoint} or {@code code_point}
	 * (case-insensitive).
	 *
	 * @throws IllegalArgumentException for any other value
	 */
	public static ColumnEncoding fromString(String value) {
		String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
		switch (normalized) {
			case "utf16":
				return UTF16;
			case "codepoint":
			case "utf32":
				return CODE_POINT;
			default:
				throw new IllegalArgumentException("Unknown column encoding: " + value);
		}
	}
}
