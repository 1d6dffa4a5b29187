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

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Language-specific parsing and lookup used by the otherwise
 * language-agnostic providers. One implementation per {@link LanguageKind};
 * the server picks one at startup.
 *
 * <p>Implementations must be safe for concurrent use.</p>
 */
public interface LanguageCapability {

	/** Stable identifier, e.g. "groovy". Used as diagnostic source and code fence language. */
	String id();

	/** Separator between a namespace and its members, e.g. {@code "::"}. */
	String pathSeparator();

	/**
	 * Characters that should make the client ask for completions. Defaults to
	 * the last character of {@link #pathSeparator()}.
	 */
	default List<String> completionTriggerCharacters() {
		String separator = pathSeparator();
		return Collections.singletonList(separator.substring(separator.length() - 1));
	}

	/**
	 * Parses and checks {@code text}. Malformed input is reported as
	 * {@link RawError}s, never by throwing.
	 *
	 * @return the errors in document order, or empty if the text is blank
	 */
	Optional<List<RawError>> parseErrors(String text);

	/**
	 * Names of the members declared in {@code namespace}; an empty list for an
	 * unknown namespace.
	 */
	List<String> functions(String namespace);

	/**
	 * Documentation for an exact fully-qualified name
	 * ({@code namespace + pathSeparator() + member}).
	 */
	Optional<FunctionDoc> functionDoc(String qualifiedName);
}
