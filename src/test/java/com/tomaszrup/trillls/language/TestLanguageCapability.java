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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scriptable {@link LanguageCapability} for tests. Errors are returned as
 * configured regardless of the text, except that blank text yields none.
 */
public class TestLanguageCapability implements LanguageCapability {
	private final String separator;
	private final Map<String, List<String>> functions = new LinkedHashMap<>();
	private final Map<String, FunctionDoc> docs = new LinkedHashMap<>();
	private volatile List<RawError> errors = Collections.emptyList();
	private volatile RuntimeException failure;

	public TestLanguageCapability() {
		this("::");
	}

	public TestLanguageCapability(String separator) {
		this.separator = separator;
	}

	public TestLanguageCapability withErrors(RawError... errors) {
		this.errors = List.of(errors);
		return this;
	}

	/** Adds a member to {@code namespace}, documented unless {@code description} is null. */
	public TestLanguageCapability withFunction(String namespace, String name, String description, String... args) {
		functions.computeIfAbsent(namespace, key -> new ArrayList<>()).add(name);
		if (description != null) {
			docs.put(namespace + separator + name,
					new FunctionDoc(new FunctionSignature(name, List.of(args)), description));
		}
		return this;
	}

	/** Documents a name that is not listed under any namespace. */
	public TestLanguageCapability withDoc(String qualifiedName, FunctionDoc doc) {
		docs.put(qualifiedName, doc);
		return this;
	}

	/** Makes every lookup throw {@code failure}. */
	public TestLanguageCapability failingWith(RuntimeException failure) {
		this.failure = failure;
		return this;
	}

	@Override
	public String id() {
		return "test";
	}

	@Override
	public String pathSeparator() {
		return separator;
	}

	@Override
	public Optional<List<RawError>> parseErrors(String text) {
		throwIfFailing();
		if (text == null || text.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(errors);
	}

	@Override
	public List<String> functions(String namespace) {
		throwIfFailing();
		return functions.getOrDefault(namespace, Collections.emptyList());
	}

	@Override
	public Optional<FunctionDoc> functionDoc(String qualifiedName) {
		throwIfFailing();
		return Optional.ofNullable(docs.get(qualifiedName));
	}

	private void throwIfFailing() {
		RuntimeException current = failure;
		if (current != null) {
			throw current;
		}
	}
}
