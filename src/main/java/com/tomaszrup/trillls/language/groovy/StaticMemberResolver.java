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
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up public static methods of classes visible to the server, so that
 * {@code Math::max} style method references can be completed and documented.
 *
 * <p>Class names are resolved as written first, then against the packages
 * Groovy imports by default. Resolved classes are cached; misses are not.</p>
 */
public class StaticMemberResolver {
	private static final Logger logger = LoggerFactory.getLogger(StaticMemberResolver.class);

	static final List<String> DEFAULT_IMPORT_PACKAGES = List.of(
			"java.lang.", "java.util.", "java.io.", "java.net.",
			"groovy.lang.", "groovy.util.", "java.math.");

	private static final Comparator<Method> OVERLOAD_ORDER = Comparator
			.comparingInt(Method::getParameterCount)
			.thenComparing(StaticMemberResolver::describeParameters);

	private final ClassLoader classLoader;
	// hits only; a miss is whatever prefix the user happens to be typing
	private final ConcurrentHashMap<String, Class<?>> classCache = new ConcurrentHashMap<>();

	public StaticMemberResolver() {
		this(StaticMemberResolver.class.getClassLoader());
	}

	public StaticMemberResolver(ClassLoader classLoader) {
		this.classLoader = classLoader;
	}

	public Optional<Class<?>> resolveClass(String name) {
		if (name == null || name.isEmpty()) {
			return Optional.empty();
		}
		Class<?> cached = classCache.get(name);
		if (cached != null) {
			return Optional.of(cached);
		}
		Optional<Class<?>> loaded = loadClass(name);
		loaded.ifPresent(type -> classCache.putIfAbsent(name, type));
		return loaded;
	}

	int cachedClassCount() {
		return classCache.size();
	}

	private Optional<Class<?>> loadClass(String name) {
		List<String> candidates = new ArrayList<>();
		candidates.add(name);
		if (name.indexOf('.') < 0) {
			for (String pkg : DEFAULT_IMPORT_PACKAGES) {
				candidates.add(pkg + name);
			}
		}
		for (String candidate : candidates) {
			try {
				return Optional.of(Class.forName(candidate, false, classLoader));
			} catch (ClassNotFoundException e) {
				logger.trace("Class {} not found", candidate);
			} catch (LinkageError e) {
				logger.debug("Cannot load class {}: {}", candidate, e.toString());
			}
		}
		logger.debug("No class found for namespace '{}'", name);
		return Optional.empty();
	}

	/**
	 * Distinct names of the public static methods of {@code className}, sorted.
	 */
	public List<String> staticMethodNames(String className) {
		Optional<Class<?>> type = resolveClass(className);
		if (type.isEmpty()) {
			return Collections.emptyList();
		}
		TreeSet<String> names = new TreeSet<>();
		for (Method method : publicStaticMethods(type.get())) {
			names.add(method.getName());
		}
		return new ArrayList<>(names);
	}

	/**
	 * The public static overloads of {@code className.methodName}, fewest
	 * parameters first.
	 */
	public List<Method> overloads(String className, String methodName) {
		return resolveClass(className)
				.map(type -> publicStaticMethods(type).stream()
						.filter(method -> method.getName().equals(methodName))
						.sorted(OVERLOAD_ORDER)
						.collect(Collectors.toList()))
				.orElse(Collections.emptyList());
	}

	private static List<Method> publicStaticMethods(Class<?> type) {
		try {
			return Arrays.stream(type.getMethods())
					.filter(method -> Modifier.isStatic(method.getModifiers()))
					.filter(method -> !method.isSynthetic() && method.getName().indexOf('$') < 0)
					.collect(Collectors.toList());
		} catch (LinkageError e) {
			logger.debug("Cannot inspect methods of {}: {}", type.getName(), e.toString());
			return Collections.emptyList();
		}
	}

	/**
	 * Argument names for a method: the compiled parameter names when the
	 * class was built with {@code -parameters}, the parameter type names
	 * otherwise.
	 */
	static List<String> argumentNames(Method method) {
		List<String> names = new ArrayList<>();
		for (Parameter parameter : method.getParameters()) {
			if (parameter.isNamePresent()) {
				names.add(parameter.getName());
			} else {
				names.add(parameter.getType().getSimpleName());
			}
		}
		return names;
	}

	static String describeParameters(Method method) {
		return Arrays.stream(method.getParameterTypes())
				.map(Class::getSimpleName)
				.collect(Collectors.joining(", "));
	}
}
