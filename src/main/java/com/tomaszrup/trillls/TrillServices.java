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
package com.tomaszrup.trillls;

import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.trillls.core.DiagnosticRecord;
import com.tomaszrup.trillls.core.LanguageCore;
import com.tomaszrup.trillls.util.MdcDocumentContext;

/**
 * LSP text document and workspace services backed by a {@link LanguageCore}.
 *
 * <p>Lifecycle notifications (open, change, close) update the document store
 * and publish diagnostics synchronously on the protocol listener thread, so
 * diagnostics are published in the order the edits arrived. Completion and
 * hover run on the shared request pool and fail soft: an unknown document or
 * an unexpected failure yields an empty result, never an error response.</p>
 */
public class TrillServices implements TextDocumentService, WorkspaceService, LanguageClientAware {
	private static final Logger logger = LoggerFactory.getLogger(TrillServices.class);

	private final LanguageCore core;
	private final ExecutorService requestPool;
	private final LspRequestGuard requestGuard = new LspRequestGuard();
	private final AtomicReference<LanguageClient> languageClient = new AtomicReference<>();

	public TrillServices(LanguageCore core, ExecutorPools executorPools) {
		this.core = core;
		this.requestPool = executorPools.getRequestPool();
	}

	/**
	 * Convenience constructor that creates its own {@link ExecutorPools}.
	 * Used by tests.
	 */
	public TrillServices(LanguageCore core) {
		this(core, new ExecutorPools());
	}

	public LanguageCore getCore() {
		return core;
	}

	// --- Lifecycle / wiring ---

	@Override
	public void connect(LanguageClient client) {
		this.languageClient.set(client);
	}

	// --- TextDocumentService notifications ---

	@Override
	public void didOpen(DidOpenTextDocumentParams params) {
		URI uri = null;
		try {
			uri = URI.create(params.getTextDocument().getUri());
			MdcDocumentContext.setDocument(uri);
			String text = params.getTextDocument().getText();
			List<DiagnosticRecord> diagnostics;
			if (text != null) {
				diagnostics = core.openDocument(uri, text);
			} else {
				diagnostics = core.openDocument(uri);
			}
			publishDiagnostics(uri, diagnostics);
		} catch (IOException e) {
			logger.warn("Cannot read {} from disk: {}", uri, e.getMessage());
		} catch (LinkageError e) {
			logger.warn("Linkage error during didOpen for {}: {}", uri, e.toString());
			logger.debug("didOpen LinkageError details", e);
		} catch (VirtualMachineError e) {
			logger.error("VirtualMachineError during didOpen for {}: {}", uri, e.toString());
			// Swallow to keep the LSP connection alive
		} catch (Exception e) {
			logger.warn("Unexpected exception during didOpen for {}: {}", uri, e.getMessage());
			logger.debug("didOpen exception details", e);
		} finally {
			MdcDocumentContext.clear();
		}
	}

	@Override
	public void didChange(DidChangeTextDocumentParams params) {
		URI uri = null;
		try {
			uri = URI.create(params.getTextDocument().getUri());
			MdcDocumentContext.setDocument(uri);
			List<TextDocumentContentChangeEvent> changes = params.getContentChanges();
			if (changes == null || changes.isEmpty()) {
				logger.debug("didChange without content changes for {}", uri);
				return;
			}
			// full sync: the last event carries the whole new text
			String text = changes.get(changes.size() - 1).getText();
			publishDiagnostics(uri, core.changeDocument(uri, text));
		} catch (LinkageError e) {
			logger.warn("Linkage error during didChange for {}: {}", uri, e.toString());
			logger.debug("didChange LinkageError details", e);
		} catch (VirtualMachineError e) {
			logger.error("VirtualMachineError during didChange for {}: {}", uri, e.toString());
		} catch (Exception e) {
			logger.warn("Unexpected exception during didChange for {}: {}", uri, e.getMessage());
			logger.debug("didChange exception details", e);
		} finally {
			MdcDocumentContext.clear();
		}
	}

	@Override
	public void didClose(DidCloseTextDocumentParams params) {
		URI uri = null;
		try {
			uri = URI.create(params.getTextDocument().getUri());
			MdcDocumentContext.setDocument(uri);
			publishDiagnostics(uri, core.closeDocument(uri));
		} catch (Exception e) {
			logger.warn("Unexpected exception during didClose for {}: {}", uri, e.getMessage());
			logger.debug("didClose exception details", e);
		} finally {
			MdcDocumentContext.clear();
		}
	}

	@Override
	public void didSave(DidSaveTextDocumentParams params) {
		// full sync already delivered the saved text through didChange
	}

	// --- WorkspaceService notifications ---

	@Override
	public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		logger.debug("Ignoring {} watched file changes", params.getChanges() != null ? params.getChanges().size() : 0);
	}

	@Override
	public void didChangeConfiguration(DidChangeConfigurationParams params) {
		InitializationOptionsParser.applySettings(params.getSettings());
	}

	// --- TextDocumentService requests ---

	@Override
	public CompletableFuture<Hover> hover(HoverParams params) {
		return failSoftRequest("hover", params.getTextDocument().getUri(), params.getPosition(),
				uri -> CompletableFuture.supplyAsync(() -> {
					MdcDocumentContext.setDocument(uri);
					try {
						return core.hover(uri, Positions.toSourcePosition(params.getPosition()))
								.map(LspConverters::toHover)
								.orElse(null);
					} finally {
						MdcDocumentContext.clear();
					}
				}, requestPool), null);
	}

	@Override
	public CompletableFuture<Either<List<CompletionItem>, CompletionList>> completion(CompletionParams params) {
		return failSoftRequest("completion", params.getTextDocument().getUri(), params.getPosition(),
				uri -> CompletableFuture.supplyAsync(() -> {
					MdcDocumentContext.setDocument(uri);
					try {
						List<CompletionItem> items = LspConverters.toCompletionItems(
								core.completions(uri, Positions.toSourcePosition(params.getPosition())));
						return Either.<List<CompletionItem>, CompletionList>forLeft(items);
					} finally {
						MdcDocumentContext.clear();
					}
				}, requestPool), Either.<List<CompletionItem>, CompletionList>forLeft(Collections.emptyList()));
	}

	// --- Helpers ---

	private <T> CompletableFuture<T> failSoftRequest(String requestName, String documentUri, Position position,
			Function<URI, CompletableFuture<T>> requestCall, T fallbackValue) {
		URI uri;
		try {
			uri = URI.create(documentUri);
		} catch (IllegalArgumentException e) {
			logger.debug("{} request with malformed URI {}: {}", requestName, documentUri, e.getMessage());
			return CompletableFuture.completedFuture(fallbackValue);
		}
		if (!Positions.valid(position)) {
			logger.debug("{} request with invalid position {} for {}", requestName, position, uri);
			return CompletableFuture.completedFuture(fallbackValue);
		}
		return requestGuard.failSoftRequest(requestName, uri, () -> requestCall.apply(uri), fallbackValue);
	}

	private void publishDiagnostics(URI uri, List<DiagnosticRecord> records) {
		LanguageClient client = languageClient.get();
		if (client == null) {
			logger.debug("No client connected, dropping {} diagnostics", records.size());
			return;
		}
		client.publishDiagnostics(new PublishDiagnosticsParams(uri.toString(), LspConverters.toDiagnostics(records)));
	}
}
