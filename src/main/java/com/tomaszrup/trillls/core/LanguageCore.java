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
package com.tomaszrup.trillls.core;

import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.trillls.language.LanguageCapability;
import com.tomaszrup.trillls.providers.CompletionProvider;
import com.tomaszrup.trillls.providers.DiagnosticsProvider;
import com.tomaszrup.trillls.providers.HoverProvider;

/**
 * Binds the {@link DocumentStore} to the diagnostics, completion and hover
 * pipelines of one {@link LanguageCapability}. Has no knowledge of the
 * protocol used to reach it.
 *
 * <p>Lifecycle operations return the diagnostics the caller should publish.
 * Query operations throw {@link DocumentNotFoundException} for documents
 * the store does not hold.</p>
 */
public class LanguageCore {
	private static final Logger logger = LoggerFactory.getLogger(LanguageCore.class);

	private final DocumentStore store;
	private final LanguageCapability language;
	private volatile Pipelines pipelines;

	private static final class Pipelines {
		final PositionMapper mapper;
		final DiagnosticsProvider diagnostics;
		final CompletionProvider completion;
		final HoverProvider hover;

		Pipelines(LanguageCapability language, ColumnEncoding encoding) {
			mapper = new PositionMapper(encoding);
			TokenExtractor tokenExtractor = new TokenExtractor(mapper, language.pathSeparator());
			diagnostics = new DiagnosticsProvider(language, mapper);
			completion = new CompletionProvider(language, tokenExtractor);
			hover = new HoverProvider(language, tokenExtractor);
		}
	}

	public LanguageCore(LanguageCapability language) {
		this(language, new DocumentStore(), ColumnEncoding.UTF16);
	}

	public LanguageCore(LanguageCapability language, DocumentStore store, ColumnEncoding encoding) {
		this.language = Objects.requireNonNull(language, "language");
		this.store = Objects.requireNonNull(store, "store");
		this.pipelines = new Pipelines(language, encoding);
	}

	public LanguageCapability getLanguage() {
		return language;
	}

	public DocumentStore getStore() {
		return store;
	}

	public ColumnEncoding getColumnEncoding() {
		return pipelines.mapper.getEncoding();
	}

	public void setColumnEncoding(ColumnEncoding encoding) {
		if (encoding != getColumnEncoding()) {
			pipelines = new Pipelines(language, encoding);
			logger.info("Column encoding set to {}", encoding);
		}
	}

	public ClosePolicy getClosePolicy() {
		return store.getClosePolicy();
	}

	public void setClosePolicy(ClosePolicy closePolicy) {
		store.setClosePolicy(closePolicy);
	}

	// --- lifecycle

	public List<DiagnosticRecord> openDocument(URI uri, String text) {
		store.open(uri, text);
		return pipelines.diagnostics.provideDiagnostics(text);
	}

	/**
	 * Opens a document whose text the client did not send, reading it from
	 * disk first.
	 *
	 * @throws IOException if the file cannot be read; the store is unchanged
	 */
	public List<DiagnosticRecord> openDocument(URI uri) throws IOException {
		String text = DocumentStore.load(uri);
		return openDocument(uri, text);
	}

	public List<DiagnosticRecord> changeDocument(URI uri, String text) {
		store.update(uri, text);
		return pipelines.diagnostics.provideDiagnostics(text);
	}

	/**
	 * @return always an empty list, which clears the document's diagnostics
	 */
	public List<DiagnosticRecord> closeDocument(URI uri) {
		store.close(uri);
		return Collections.emptyList();
	}

	// --- queries

	public List<DiagnosticRecord> diagnostics(URI uri) {
		return pipelines.diagnostics.provideDiagnostics(store.get(uri));
	}

	public List<CompletionCandidate> completions(URI uri, SourcePosition position) {
		return pipelines.completion.provideCompletion(store.get(uri), position);
	}

	public Optional<RenderedDoc> hover(URI uri, SourcePosition position) {
		return pipelines.hover.provideHover(store.get(uri), position);
	}
}
