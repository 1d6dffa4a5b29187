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
package com.tomaszrup.trillls.language.groovy;

import java.lang.reflect.Method;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.tomaszrup.trillls.language.FunctionDoc;
import com.tomaszrup.trillls.language.FunctionSignature;
import com.tomaszrup.trillls.language.LanguageCapability;
import com.tomaszrup.trillls.language.RawError;

/**
 * Groovy support. Namespaces are class names and members are their public
 * static methods, written with Groovy's method-reference operator
 * ({@code Math::max}). Diagnostics come from the Groovy parser.
 */
public class GroovyLanguage implements LanguageCapability {
	public static final String ID = "groovy";
	public static final String SEPARATOR = "::";

	private final GroovySyntaxChecker syntaxChecker;
	private final StaticMemberResolver memberResolver;

	public GroovyLanguage() {
		this(new GroovySyntaxChecker(), new StaticMemberResolver());
	}

	public GroovyLanguage(GroovySyntaxChecker syntaxChecker, StaticMemberResolver memberResolver) {
		this.syntaxChecker = syntaxChecker;
		this.memberResolver = memberResolver;
	}

	@Override
	public String id() {
		return ID;
	}

	@Override
	public String pathSeparator() {
		return SEPARATOR;
	}

	@Override
	public Optional<List<RawError>> parseErrors(String text) {
		if (text == null || text.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(syntaxChecker.check(text));
	}

	@Override
	public List<String> functions(String namespace) {
		if (namespace == null || namespace.contains(SEPARATOR)) {
			return Collections.emptyList();
		}
		return memberResolver.staticMethodNames(namespace);
	}

	@Override
	public Optional<FunctionDoc> functionDoc(String qualifiedName) {
		if (qualifiedName == null) {
			return Optional.empty();
		}
		int split = qualifiedName.lastIndexOf(SEPARATOR);
		if (split <= 0) {
			return Optional.empty();
		}
		String className = qualifiedName.substring(0, split);
		String methodName = qualifiedName.substring(split + SEPARATOR.length());
		List<Method> overloads = memberResolver.overloads(className, methodName);
		if (overloads.isEmpty()) {
			return Optional.empty();
		}
		Method primary = overloads.get(0);
		FunctionSignature signature = new FunctionSignature(methodName,
				StaticMemberResolver.argumentNames(primary));
		return Optional.of(new FunctionDoc(signature, describe(primary.getDeclaringClass(), overloads)));
	}

	private static String describe(Class<?> declaringClass, List<Method> overloads) {
		StringBuilder builder = new StringBuilder();
		Method primary = overloads.get(0);
		builder.append("Returns `").append(primary.getReturnType().getSimpleName())
				.append("`. Declared in `").append(declaringClass.getName()).append("`.");
		if (overloads.size() > 1) {
			builder.append("\n\nOverloads:\n");
			for (Method overload : overloads) {
				builder.append("\n- `").append(overload.getName())
						.append('(').append(StaticMemberResolver.describeParameters(overload)).append(")`: `")
						.append(overload.getReturnType().getSimpleName()).append('`');
			}
		}
		return builder.toString();
	}
}
