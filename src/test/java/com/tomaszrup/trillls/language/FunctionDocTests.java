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

import java.util.Arrays;
import java.util.List;

import com.tomaszrup.trillls.core.Severity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class FunctionDocTests {

	@Test
	void testSignatureToString() {
		Assertions.assertEquals("len(s)", new FunctionSignature("len", List.of("s")).toString());
		Assertions.assertEquals("now()", new FunctionSignature("now", null).toString());
		Assertions.assertEquals("zip(left, right)", new FunctionSignature("zip", List.of("left", "right")).toString());
	}

	@Test
	void testSignatureArgsAreCopied() {
		List<String> args = Arrays.asList("a", "b");
		FunctionSignature signature = new FunctionSignature("f", args);
		args.set(0, "changed");
		Assertions.assertEquals(List.of("a", "b"), signature.getArgs());
		Assertions.assertThrows(UnsupportedOperationException.class, () -> signature.getArgs().add("c"));
	}

	@Test
	void testMarkdownWithDescription() {
		FunctionDoc doc = new FunctionDoc(new FunctionSignature("len", List.of("s")), "Length of `s`.");
		Assertions.assertEquals("```tremor\nlen(s)\n```\n\n---\n\nLength of `s`.", doc.toMarkdown("tremor"));
	}

	@Test
	void testMarkdownWithoutDescription() {
		FunctionDoc doc = new FunctionDoc(new FunctionSignature("len", List.of("s")), null);
		Assertions.assertEquals("", doc.getDescription());
		Assertions.assertEquals("```tremor\nlen(s)\n```", doc.toMarkdown("tremor"));
	}

	@Test
	void testMarkdownBlankDescriptionHasNoRule() {
		FunctionDoc doc = new FunctionDoc(new FunctionSignature("f", List.of()), "  ");
		Assertions.assertFalse(doc.toMarkdown("x").contains("---"));
	}

	@Test
	void testRawErrorDefaultsToErrorLevel() {
		RawError error = new RawError(1, 1, 1, 2, "bad", null, null);
		Assertions.assertEquals(Severity.ERROR, error.getLevel());
		Assertions.assertTrue(error.getHint().isEmpty());
	}

	@Test
	void testLanguageKindFromString() {
		Assertions.assertEquals(LanguageKind.GROOVY, LanguageKind.fromString("groovy"));
		Assertions.assertEquals(LanguageKind.CATALOG, LanguageKind.fromString("Catalog"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> LanguageKind.fromString("rust"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> LanguageKind.fromString(null));
	}

	@Test
	void testDefaultTriggerCharacterIsLastSeparatorChar() {
		Assertions.assertEquals(List.of(":"), new TestLanguageCapability("::").completionTriggerCharacters());
		Assertions.assertEquals(List.of("."), new TestLanguageCapability(".").completionTriggerCharacters());
	}
}
