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

import java.util.Optional;

import com.tomaszrup.trillls.core.RenderedDoc;
import com.tomaszrup.trillls.core.SourcePosition;
import com.tomaszrup.trillls.core.Token;
import com.tomaszrup.trillls.core.TokenExtractor;
import com.tomaszrup.trillls.language.LanguageCapability;

public class HoverProvider {
	private final LanguageCapability language;
	private final TokenExtractor tokenExtractor;

	public HoverProvider(LanguageCapability language, TokenExtractor tokenExtractor) {
		this.language = language;
		this.tokenExtractor = tokenExtractor;
	}

	/**
	 * Documents the fully-qualified name ending at the cursor. Unqualified
	 * names never get a hover, even if the language documents them.
	 */
	public Optional<RenderedDoc> provideHover(String text, SourcePosition position) {
		Optional<Token> token = tokenExtractor.extract(text, position);
		if (token.isEmpty() || !token.get().getText().contains(language.pathSeparator())) {
			return Optional.empty();
		}
		return language.functionDoc(token.get().getText())
				.map(doc -> new RenderedDoc(doc.toMarkdown(language.id())));
	}
}
