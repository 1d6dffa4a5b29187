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
package com.tomaszrup.trillls.language;

import java.util.Objects;
import java.util.Optional;

import com.tomaszrup.trillls.core.Severity;

/**
 * An error as the language reports it. Lines and columns are one-based and
 * columns count UTF-16 code units, the way compilers such as Groovy's report
 * them. A line below 1 means the position is unknown.
 */
public final class RawError {
	private final int startLine;
	private final int startColumn;
	private final int endLine;
	private final int endColumn;
	private final String callout;
	private final Severity level;
	private final String hint;

	public RawError(int startLine, int startColumn, int endLine, int endColumn,
			String callout, Severity level, String hint) {
		this.startLine = startLine;
		this.startColumn = startColumn;
		this.endLine = endLine;
		this.endColumn = endColumn;
		this.callout = Objects.requireNonNull(callout, "callout");
		this.level = level != null ? level : Severity.ERROR;
		this.hint = hint;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getEndColumn() {
		return endColumn;
	}

	public String getCallout() {
		return callout;
	}

	public Severity getLevel() {
		return level;
	}

	public Optional<String> getHint() {
		return Optional.ofNullable(hint);
	}

	@Override
	public String toString() {
		return "RawError{" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn
				+ " " + level + " '" + callout + "'" + (hint != null ? " hint='" + hint + "'" : "") + "}";
	}
}
