////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.trillls.providers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.trillls.core.CompletionCandidate;
import com.tomaszrup.trillls.core.SourcePosition;
import com.tomaszrup.trillls.core.Token;
import com.tomaszrup.trillls.core.TokenExtractor;
import com.tomaszrup.trillls.language.FunctionDoc;
import com.tomaszrup.trillls.language.LanguageCapability;

/**
 * Completes the members of the namespace before the cursor. Nothing is
 * offered unless the token under the cursor is qualified
 * ({@code namespace::partial}); candidates are not filtered by the partial
 * member, the client does that.
 */
public class CompletionProvider {
	private static final Logger logger = LoggerFactory.getLogger(CompletionProvider.class);

	private final LanguageCapability language;
	private final TokenExtractor tokenExtractor;

	public CompletionProvider(LanguageCapability language, TokenExtractor tokenExtractor) {
		this.language = language;
		this.tokenExtractor = tokenExtractor;
	}

	public List<CompletionCandidate> provideCompletion(String text, SourcePosition position) {
		Optional<Token> token = tokenExtractor.extract(text, position);
		if (token.isEmpty()) {
			return Collections.emptyList();
		}
		Optional<String> namespace = token.get().getNamespace();
		if (namespace.isEmpty() || namespace.get().isEmpty()) {
			return Collections.emptyList();
		}
		List<String> members = language.functions(namespace.get());
		List<CompletionCandidate> items = new ArrayList<>(members.size());
		for (String member : members) {
			Optional<FunctionDoc> doc = language.functionDoc(namespace.get() + language.pathSeparator() + member);
			if (doc.isPresent()) {
				FunctionDoc functionDoc = doc.get();
				items.add(new CompletionCandidate(member,
						functionDoc.getSignature().toString(),
						functionDoc.getDescription().isEmpty() ? null : functionDoc.getDescription(),
						toSnippet(member, functionDoc.getSignature().getArgs())));
			} else {
				items.add(new CompletionCandidate(member));
			}
		}
		logger.debug("{} completion candidates for namespace {}", items.size(), namespace.get());
		return items;
	}

	/**
	 * Builds {@code name(${1:a}, ${2:b})}. Placeholders are numbered from 1
	 * in declaration order.
	 */
	static String toSnippet(String name, List<String> args) {
		StringBuilder builder = new StringBuilder();
		builder.append(escapeSnippet(name)).append('(');
		for (int i = 0; i < args.size(); i++) {
			if (i > 0) {
				builder.append(", ");
			}
			builder.append("${").append(i + 1).append(':').append(escapeSnippet(args.get(i))).append('}');
		}
		builder.append(')');
		return builder.toString();
	}

	static String escapeSnippet(String value) {
		StringBuilder builder = new StringBuilder(value.length());
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c == '\\' || c == '$' || c == '}') {
				builder.append('\\');
			}
			builder.append(c);
		}
		return builder.toString();
	}
}
