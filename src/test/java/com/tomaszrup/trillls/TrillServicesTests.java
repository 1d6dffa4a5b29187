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
package com.tomaszrup.trillls;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.InsertTextFormat;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;
import com.tomaszrup.trillls.core.ClosePolicy;
import com.tomaszrup.trillls.core.LanguageCore;
import com.tomaszrup.trillls.core.Severity;
import com.tomaszrup.trillls.language.RawError;
import com.tomaszrup.trillls.language.TestLanguageCapability;

/**
 * Tests for {@link TrillServices}: document lifecycle notifications,
 * diagnostics publishing, and the completion and hover requests.
 */
class TrillServicesTests {
	private static final String LANGUAGE_ID = "trill";
	private static final String URI = "file:///workspace/script.trill";

	private TestLanguageCapability language;
	private ExecutorPools pools;
	private TrillServices services;
	private List<PublishDiagnosticsParams> published;

	@BeforeEach
	void setup() {
		language = new TestLanguageCapability()
				.withFunction("str", "len", "Length of `s`.", "s")
				.withFunction("str", "concat", "Joins `a` and `b`.", "a", "b")
				.withFunction("str", "raw", null);
		pools = new ExecutorPools(2);
		services = new TrillServices(new LanguageCore(language), pools);
		published = Collections.synchronizedList(new ArrayList<>());
		services.connect(new TestLanguageClient(published::add));
	}

	@AfterEach
	void tearDown() {
		pools.shutdownAll();
		services = null;
	}

	private void open(String text) {
		services.didOpen(new DidOpenTextDocumentParams(new TextDocumentItem(URI, LANGUAGE_ID, 1, text)));
	}

	private static TextDocumentItem itemWithoutText(String uri) {
		TextDocumentItem item = new TextDocumentItem();
		item.setUri(uri);
		item.setLanguageId(LANGUAGE_ID);
		item.setVersion(1);
		return item;
	}

	private void change(int version, String text) {
		TextDocumentContentChangeEvent event = new TextDocumentContentChangeEvent(text);
		services.didChange(new DidChangeTextDocumentParams(
				new VersionedTextDocumentIdentifier(URI, version), Collections.singletonList(event)));
	}

	private List<CompletionItem> complete(int line, int character) throws Exception {
		CompletionParams params = new CompletionParams(new TextDocumentIdentifier(URI), new Position(line, character));
		Either<List<CompletionItem>, CompletionList> result = services.completion(params).get(10, TimeUnit.SECONDS);
		Assertions.assertTrue(result.isLeft());
		return result.getLeft();
	}

	private Hover hover(int line, int character) throws Exception {
		HoverParams params = new HoverParams(new TextDocumentIdentifier(URI), new Position(line, character));
		return services.hover(params).get(10, TimeUnit.SECONDS);
	}

	// ------------------------------------------------------------------
	// Diagnostics
	// ------------------------------------------------------------------

	@Test
	void testDidOpenPublishesEmptyDiagnosticsForValidText() {
		open("let x = 1;");
		Assertions.assertEquals(1, published.size());
		Assertions.assertEquals(URI, published.get(0).getUri());
		Assertions.assertTrue(published.get(0).getDiagnostics().isEmpty());
	}

	@Test
	void testDidOpenPublishesDiagnostics() {
		language.withErrors(new RawError(1, 9, 1, 10, "unclosed delimiter `(`", Severity.ERROR,
				"expected `)` before the end of the document"));
		open("let x = (1;");

		List<Diagnostic> diagnostics = published.get(0).getDiagnostics();
		Assertions.assertEquals(1, diagnostics.size());
		Diagnostic diagnostic = diagnostics.get(0);
		Assertions.assertEquals("unclosed delimiter `(`, Note: expected `)` before the end of the document",
				diagnostic.getMessage());
		Assertions.assertEquals(DiagnosticSeverity.Error, diagnostic.getSeverity());
		Assertions.assertEquals("test", diagnostic.getSource());
		Assertions.assertEquals(new Position(0, 8), diagnostic.getRange().getStart());
		Assertions.assertEquals(new Position(0, 9), diagnostic.getRange().getEnd());
	}

	@Test
	void testDidChangePublishesForNewText() {
		open("let x = 1;");
		language.withErrors(new RawError(1, 1, 1, 2, "broken", Severity.WARNING, null));
		change(2, "let x = (;");

		Assertions.assertEquals(2, published.size());
		Diagnostic diagnostic = published.get(1).getDiagnostics().get(0);
		Assertions.assertEquals("broken", diagnostic.getMessage());
		Assertions.assertEquals(DiagnosticSeverity.Warning, diagnostic.getSeverity());
	}

	@Test
	void testDidChangeUsesLastContentChange() throws Exception {
		open("");
		List<TextDocumentContentChangeEvent> events = List.of(
				new TextDocumentContentChangeEvent("first"),
				new TextDocumentContentChangeEvent("str::"));
		services.didChange(new DidChangeTextDocumentParams(new VersionedTextDocumentIdentifier(URI, 2), events));

		Assertions.assertEquals(3, complete(0, 5).size());
	}

	@Test
	void testDidChangeWithoutChangesIsIgnored() {
		open("x");
		services.didChange(new DidChangeTextDocumentParams(
				new VersionedTextDocumentIdentifier(URI, 2), Collections.emptyList()));
		Assertions.assertEquals(1, published.size());
	}

	@Test
	void testDidCloseClearsDiagnostics() {
		language.withErrors(new RawError(1, 1, 1, 2, "bad", Severity.ERROR, null));
		open("x");
		services.didClose(new DidCloseTextDocumentParams(new TextDocumentIdentifier(URI)));

		Assertions.assertEquals(2, published.size());
		Assertions.assertEquals(URI, published.get(1).getUri());
		Assertions.assertTrue(published.get(1).getDiagnostics().isEmpty());
	}

	@Test
	void testDidOpenWithoutTextReadsFromDisk(@TempDir Path tempDir) throws IOException {
		Path file = tempDir.resolve("disk.trill");
		Files.writeString(file, "from disk");
		String uri = file.toUri().toString();

		services.didOpen(new DidOpenTextDocumentParams(itemWithoutText(uri)));

		Assertions.assertEquals(1, published.size());
		Assertions.assertEquals("from disk", services.getCore().getStore().get(file.toUri()));
	}

	@Test
	void testDidOpenWithoutTextAndMissingFileDoesNotThrow(@TempDir Path tempDir) {
		String uri = tempDir.resolve("missing.trill").toUri().toString();
		Assertions.assertDoesNotThrow(() -> services.didOpen(new DidOpenTextDocumentParams(itemWithoutText(uri))));
		Assertions.assertTrue(published.isEmpty());
	}

	@Test
	void testDiagnosticsAreDroppedWithoutClient() {
		TrillServices unconnected = new TrillServices(new LanguageCore(language), pools);
		Assertions.assertDoesNotThrow(() -> unconnected.didOpen(
				new DidOpenTextDocumentParams(new TextDocumentItem(URI, LANGUAGE_ID, 1, "x"))));
	}

	@Test
	void testNotificationFailureDoesNotThrow() {
		language.failingWith(new IllegalStateException("parser crashed"));
		Assertions.assertDoesNotThrow(() -> open("x"));
		Assertions.assertTrue(published.isEmpty());
	}

	@Test
	void testDidSaveAndConfigurationChangeAreAccepted() {
		open("x");
		Assertions.assertDoesNotThrow(() -> services.didSave(
				new DidSaveTextDocumentParams(new TextDocumentIdentifier(URI))));
		Assertions.assertDoesNotThrow(() -> services.didChangeConfiguration(
				new DidChangeConfigurationParams(new JsonObject())));
		Assertions.assertEquals(1, published.size());
	}

	// ------------------------------------------------------------------
	// Completion
	// ------------------------------------------------------------------

	@Test
	void testCompletionAfterSeparator() throws Exception {
		open("let n = str::");
		List<CompletionItem> items = complete(0, 13);

		Assertions.assertEquals(3, items.size());
		CompletionItem concat = items.get(1);
		Assertions.assertEquals("concat", concat.getLabel());
		Assertions.assertEquals(CompletionItemKind.Function, concat.getKind());
		Assertions.assertEquals("concat(a, b)", concat.getDetail());
		Assertions.assertEquals("concat(${1:a}, ${2:b})", concat.getInsertText());
		Assertions.assertEquals(InsertTextFormat.Snippet, concat.getInsertTextFormat());
		Assertions.assertEquals(MarkupKind.MARKDOWN, concat.getDocumentation().getRight().getKind());
		Assertions.assertEquals("Joins `a` and `b`.", concat.getDocumentation().getRight().getValue());

		CompletionItem raw = items.get(2);
		Assertions.assertNull(raw.getInsertText());
		Assertions.assertNull(raw.getDocumentation());
	}

	@Test
	void testCompletionForUnqualifiedTokenIsEmpty() throws Exception {
		open("let n = st");
		Assertions.assertTrue(complete(0, 10).isEmpty());
	}

	@Test
	void testCompletionForUnknownDocumentIsEmpty() throws Exception {
		Assertions.assertTrue(complete(0, 0).isEmpty());
	}

	@Test
	void testCompletionWithInvalidPositionIsEmpty() throws Exception {
		open("str::");
		Assertions.assertTrue(complete(-1, 5).isEmpty());
		Assertions.assertTrue(complete(0, -5).isEmpty());
	}

	@Test
	void testRequestsWithUnescapedUriDegrade() throws Exception {
		TextDocumentIdentifier unescaped = new TextDocumentIdentifier("file:///a b.trill");

		Hover hover = services.hover(new HoverParams(unescaped, new Position(0, 0))).get(5, TimeUnit.SECONDS);
		Either<List<CompletionItem>, CompletionList> completion = services
				.completion(new CompletionParams(unescaped, new Position(0, 0))).get(5, TimeUnit.SECONDS);

		Assertions.assertNull(hover);
		Assertions.assertTrue(completion.getLeft().isEmpty());
	}

	@Test
	void testCompletionFailureIsEmpty() throws Exception {
		open("str::");
		language.failingWith(new IllegalStateException("lookup crashed"));
		Assertions.assertTrue(complete(0, 5).isEmpty());
	}

	@Test
	void testCompletionAfterCloseWithRetainPolicy() throws Exception {
		services.getCore().setClosePolicy(ClosePolicy.RETAIN);
		open("str::");
		services.didClose(new DidCloseTextDocumentParams(new TextDocumentIdentifier(URI)));
		Assertions.assertEquals(3, complete(0, 5).size());
	}

	@Test
	void testCompletionAfterCloseIsEmpty() throws Exception {
		open("str::");
		services.didClose(new DidCloseTextDocumentParams(new TextDocumentIdentifier(URI)));
		Assertions.assertTrue(complete(0, 5).isEmpty());
	}

	// ------------------------------------------------------------------
	// Hover
	// ------------------------------------------------------------------

	@Test
	void testHoverOnQualifiedName() throws Exception {
		open("let n = str::len(x);");
		Hover hover = hover(0, 16);

		Assertions.assertNotNull(hover);
		Assertions.assertEquals(MarkupKind.MARKDOWN, hover.getContents().getRight().getKind());
		Assertions.assertEquals("```test\nlen(s)\n```\n\n---\n\nLength of `s`.", hover.getContents().getRight().getValue());
	}

	@Test
	void testHoverOnUnknownNameIsNull() throws Exception {
		open("let n = str::nope;");
		Assertions.assertNull(hover(0, 17));
	}

	@Test
	void testHoverForUnknownDocumentIsNull() throws Exception {
		Assertions.assertNull(hover(0, 0));
	}

	@Test
	void testHoverFailureIsNull() throws Exception {
		open("str::len");
		language.failingWith(new IllegalStateException("lookup crashed"));
		Assertions.assertNull(hover(0, 8));
	}
}
