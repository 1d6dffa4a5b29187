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
 * A positioned, severity-tagged message about a document. The message already
 * carries the hint as a trailing note; {@link #getHint()} exposes the raw hint
 * for callers that render it separately.
 */
public final class DiagnosticRecord {
	private final SourceRange range;
	private final String message;
	private final Severity severity;
	private final String hint;
	private final String source;

	public DiagnosticRecord(SourceRange range, String message, Severity severity, String hint, String source) {
		this.range = Objects.requireNonNull(range, "range cannot be null");
		this.message = Objects.requireNonNull(message, "message cannot be null");
		this.severity = severity != null ? severity : Severity.ERROR;
		this.hint = hint;
		this.source = source;
	}

	public SourceRange getRange() {
		return range;
	}

	public String getMessage() {
		return message;
	}

	public Severity getSeverity() {
		return severity;
	}

	public Optional<String> getHint() {
		return Optional.ofNullable(hint);
	}

	public String getSource() {
		return source;
	}

	@Override
	public String toString() {
		return "DiagnosticRecord{" +
				"range=" + range +
				", message='" + message + '\'' +
				", severity=" + severity +
				", source='" + source + '\'' +
				'}';
	}
}
