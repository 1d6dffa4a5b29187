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
 * Identifier or path slice of a document that ends at the cursor, split on the
 * last path separator into an optional namespace and a member.
 */
public final class Token {
	private final String text;
	private final int startOffset;
	private final int endOffset;
	private final String namespace;
	private final String member;

	public Token(String text, int startOffset, int endOffset, String namespace, String member) {
		this.text = Objects.requireNonNull(text, "text");
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.namespace = namespace;
		this.member = Objects.requireNonNull(member, "member");
	}

	/** The raw token text, separators included. */
	public String getText() {
		return text;
	}

	public int getStartOffset() {
		return startOffset;
	}

	/** Exclusive end offset; always the cursor offset. */
	public int getEndOffset() {
		return endOffset;
	}

	/** Everything before the last separator; empty when the token has no separator. */
	public Optional<String> getNamespace() {
		return Optional.ofNullable(namespace);
	}

	/** Everything after the last separator, or the whole token. May be empty. */
	public String getMember() {
		return member;
	}

	public boolean isQualified() {
		return namespace != null;
	}

	@Override
	public String toString() {
		return "Token{" + text + " @" + startOffset + ".." + endOffset + "}";
	}
}
