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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.trillls.core.DiagnosticRecord;
import com.tomaszrup.trillls.core.PositionMapper;
import com.tomaszrup.trillls.core.SourcePosition;
import com.tomaszrup.trillls.core.SourceRange;
import com.tomaszrup.trillls.language.LanguageCapability;
import com.tomaszrup.trillls.language.RawError;

/**
 * Turns the errors a {@link LanguageCapability} reports for a document into
 * {@link DiagnosticRecord}s positioned in the caller's coordinates.
 */
public class DiagnosticsProvider {
	private static final Logger logger = LoggerFactory.getLogger(DiagnosticsProvider.class);

	static final String NOTE_SEPARATOR = ", Note: ";

	private final LanguageCapability language;
	private final PositionMapper mapper;

	public DiagnosticsProvider(LanguageCapability language, PositionMapper mapper) {
		this.language = language;
		this.mapper = mapper;
	}

	/**
	 * @return one record per reported error, in the order the language
	 *         reported them; empty for blank or valid text
	 */
	public List<DiagnosticRecord> provideDiagnostics(String text) {
		Optional<List<RawError>> errors = language.parseErrors(text);
		if (errors.isEmpty() || errors.get().isEmpty()) {
			return Collections.emptyList();
		}
		List<DiagnosticRecord> records = new ArrayList<>(errors.get().size());
		for (RawError error : errors.get()) {
			records.add(toRecord(text, error));
		}
		logger.debug("{} diagnostics", records.size());
		return records;
	}

	private DiagnosticRecord toRecord(String text, RawError error) {
		SourcePosition start = mapper.fromOneBased(text, error.getStartLine(), error.getStartColumn());
		SourcePosition end = mapper.fromOneBased(text, error.getEndLine(), error.getEndColumn());
		if (SourcePosition.COMPARATOR.compare(end, start) < 0) {
			end = start;
		}
		String message = error.getHint()
				.map(hint -> error.getCallout() + NOTE_SEPARATOR + hint)
				.orElse(error.getCallout());
		return new DiagnosticRecord(new SourceRange(start, end), message, error.getLevel(),
				error.getHint().orElse(null), language.id());
	}
}
