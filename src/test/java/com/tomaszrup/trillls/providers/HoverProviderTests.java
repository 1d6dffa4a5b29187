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
package com.tomaszrup.trillls.providers;

import java.util.List;
import java.util.Optional;

import com.tomaszrup.trillls.core.ColumnEncoding;
import com.tomaszrup.trillls.core.PositionMapper;
import com.tomaszrup.trillls.core.RenderedDoc;
import com.tomaszrup.trillls.core.SourcePosition;
import com.tomaszrup.trillls.core.TokenExtractor;
import com.tomaszrup.trillls.language.FunctionDoc;
import com.tomaszrup.trillls.language.FunctionSignature;
import com.tomaszrup.trillls.language.TestLanguageCapability;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HoverProviderTests {
	private HoverProvider provider;

	@BeforeEach
	void setup() {
		TestLanguageCapability language = new TestLanguageCapability()
				.withFunction("str", "len", "Length of `s`.", "s")
				.withFunction("str", "bare", "")
				.withDoc("len", new FunctionDoc(new FunctionSignature("len", List.of("s")), "Top level."));
		provider = new HoverProvider(language,
				new TokenExtractor(new PositionMapper(ColumnEncoding.UTF16), language.pathSeparator()));
	}

	private Optional<RenderedDoc> hover(String text) {
		return provider.provideHover(text, new SourcePosition(0, text.length()));
	}

	@Test
	void testHoverOnQualifiedName() {
		RenderedDoc doc = hover("let n = str::len").orElseThrow();
		Assertions.assertEquals("```test\nlen(s)\n```\n\n---\n\nLength of `s`.", doc.getMarkdown());
	}

	@Test
	void testHoverInsideName() {
		// the token ends at the cursor, so the name must be complete up to there
		String text = "str::len(x)";
		Assertions.assertTrue(provider.provideHover(text, new SourcePosition(0, 8)).isPresent());
		Assertions.assertTrue(provider.provideHover(text, new SourcePosition(0, 7)).isEmpty());
	}

	@Test
	void testHoverWithoutDescription() {
		Assertions.assertEquals("```test\nbare()\n```", hover("str::bare").orElseThrow().getMarkdown());
	}

	@Test
	void testUnqualifiedNameHasNoHover() {
		Assertions.assertTrue(hover("len").isEmpty());
	}

	@Test
	void testUnknownNameHasNoHover() {
		Assertions.assertTrue(hover("str::nope").isEmpty());
		Assertions.assertTrue(hover("nope::len").isEmpty());
	}

	@Test
	void testNoTokenHasNoHover() {
		Assertions.assertTrue(hover("str::len ").isEmpty());
		Assertions.assertTrue(hover("").isEmpty());
	}
}
