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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.codehaus.groovy.GroovyBugError;
import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.control.CompilerConfiguration;
import org.codehaus.groovy.control.ErrorCollector;
import org.codehaus.groovy.control.Phases;
import org.codehaus.groovy.control.messages.ExceptionMessage;
import org.codehaus.groovy.control.messages.Message;
import org.codehaus.groovy.control.messages.SimpleMessage;
import org.codehaus.groovy.control.messages.SyntaxErrorMessage;
import org.codehaus.groovy.syntax.SyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.trillls.core.Severity;
import com.tomaszrup.trillls.language.RawError;

/**
 * Runs the Groovy compiler up to {@link Phases#CONVERSION} on a single
 * document and turns the collected messages into {@link RawError}s.
 *
 * <p>Stopping at conversion means only the parser and AST builder run.
 * Unresolved classes are a semantic-analysis concern and are not reported,
 * since a single document has no classpath.</p>
 */
public class GroovySyntaxChecker {
	private static final Logger logger = LoggerFactory.getLogger(GroovySyntaxChecker.class);

	static final String SOURCE_NAME = "Document.groovy";

	private final CompilerConfiguration configuration = new CompilerConfiguration();

	public List<RawError> check(String text) {
		SyntaxCheckCompilationUnit unit = new SyntaxCheckCompilationUnit(configuration);
		unit.addSource(SOURCE_NAME, text);
		try {
			unit.compile(Phases.CONVERSION);
		} catch (CompilationFailedException e) {
			logger.debug("Compilation failed (expected for incomplete code): {}", e.getMessage());
		} catch (GroovyBugError e) {
			logger.debug("Groovy compiler bug during syntax check (usually harmless): {}", e.getMessage());
		}
		return collect(unit.getErrorCollector());
	}

	List<RawError> collect(ErrorCollector collector) {
		List<RawError> result = new ArrayList<>();
		// the parser can report the same error more than once because
		// failIfErrors() never stops compilation
		Set<String> seen = new HashSet<>();
		List<? extends Message> errors = collector.getErrors();
		if (errors != null) {
			boolean hasSyntaxError = errors.stream().anyMatch(SyntaxErrorMessage.class::isInstance);
			for (Message message : errors) {
				// the parser also records the recognizer exception behind each
				// syntax error; it carries no position of its own
				if (hasSyntaxError && message instanceof ExceptionMessage) {
					continue;
				}
				RawError error = toRawError(message);
				if (error != null && seen.add(error.toString())) {
					result.add(error);
				}
			}
		}
		List<? extends Message> warnings = collector.getWarnings();
		if (warnings != null) {
			for (Message warning : warnings) {
				if (warning instanceof SimpleMessage) {
					RawError error = new RawError(1, 1, 1, 1,
							((SimpleMessage) warning).getMessage(), Severity.WARNING, null);
					if (seen.add(error.toString())) {
						result.add(error);
					}
				}
			}
		}
		return result;
	}

	private RawError toRawError(Message message) {
		if (message instanceof SyntaxErrorMessage) {
			SyntaxException cause = ((SyntaxErrorMessage) message).getCause();
			int startLine = cause.getStartLine();
			int startColumn = cause.getStartColumn();
			int endLine = cause.getEndLine();
			int endColumn = cause.getEndColumn();
			if (endLine < startLine || (endLine == startLine && endColumn < startColumn)) {
				endLine = startLine;
				endColumn = startColumn;
			}
			return new RawError(startLine, startColumn, endLine, endColumn,
					cause.getOriginalMessage(), Severity.ERROR, null);
		}
		if (message instanceof ExceptionMessage) {
			Exception cause = ((ExceptionMessage) message).getCause();
			String text = cause.getMessage() != null ? cause.getMessage() : "Syntax error";
			return new RawError(1, 1, 1, 1, text, Severity.ERROR, null);
		}
		if (message instanceof SimpleMessage) {
			return new RawError(1, 1, 1, 1, ((SimpleMessage) message).getMessage(), Severity.ERROR, null);
		}
		logger.debug("Ignoring unsupported compiler message type {}", message.getClass().getName());
		return null;
	}
}
