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

public final class CompletionCandidate {
	private final String label;
	private final String detail;         // rendered signature
	private final String documentation;  // markdown
	private final String insertText;     // snippet syntax

	public CompletionCandidate(String label) {
		this(label, null, null, null);
	}

	public CompletionCandidate(String label, String detail, String documentation, String insertText) {
		this.label = Objects.requireNonNull(label, "label");
		this.detail = detail;
		this.documentation = documentation;
		this.insertText = insertText;
	}

	public String getLabel() {
		return label;
	}

	public Optional<String> getDetail() {
		return Optional.ofNullable(detail);
	}

	public Optional<String> getDocumentation() {
		return Optional.ofNullable(documentation);
	}

	public Optional<String> getInsertText() {
		return Optional.ofNullable(insertText);
	}

	@Override
	public String toString() {
		return "CompletionCandidate{" + label + (insertText != null ? " -> " + insertText : "") + "}";
	}
}
