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

public final class FunctionDoc {
	private final FunctionSignature signature;
	private final String description;

	public FunctionDoc(FunctionSignature signature, String description) {
		this.signature = Objects.requireNonNull(signature, "signature");
		this.description = description == null ? "" : description;
	}

	public FunctionSignature getSignature() {
		return signature;
	}

	/** Markdown. */
	public String getDescription() {
		return description;
	}

	/**
	 * Renders the signature as a fenced code block, followed by the
	 * description when there is one.
	 */
	public String toMarkdown(String fenceLanguage) {
		StringBuilder builder = new StringBuilder();
		builder.append("```").append(fenceLanguage == null ? "" : fenceLanguage).append('\n');
		builder.append(signature);
		builder.append("\n```");
		if (!description.isBlank()) {
			builder.append("\n\n---\n\n");
			builder.append(description);
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return toMarkdown(null);
	}
}
