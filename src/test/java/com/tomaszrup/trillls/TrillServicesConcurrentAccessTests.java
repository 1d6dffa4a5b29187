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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.trillls.core.LanguageCore;
import com.tomaszrup.trillls.language.TestLanguageCapability;

/**
 * Tests for concurrent access to TrillServices: requests racing with edits
 * must never fail and must see one whole version of the document.
 */
class TrillServicesConcurrentAccessTests {
	private static final String LANGUAGE_ID = "trill";
	private static final String URI = "file:///workspace/concurrent.trill";

	private ExecutorPools pools;
	private TrillServices services;

	@BeforeEach
	void setup() {
		TestLanguageCapability language = new TestLanguageCapability()
				.withFunction("str", "len", "Length.", "s")
				.withFunction("str", "concat", "Joins.", "a", "b")
				.withFunction("arr", "push", "Appends.", "array", "value");
		pools = new ExecutorPools(4);
		services = new TrillServices(new LanguageCore(language), pools);
		services.connect(new TestLanguageClient());
	}

	@AfterEach
	void tearDown() {
		pools.shutdownAll();
		services = null;
	}

	// ------------------------------------------------------------------
	// Concurrent reads should not throw
	// ------------------------------------------------------------------

	@Test
	void testConcurrentHoverRequests() throws Exception {
		services.didOpen(new DidOpenTextDocumentParams(new TextDocumentItem(URI, LANGUAGE_ID, 1, "str::len(x)\n")));

		int threadCount = 8;
		ExecutorService executor = Executors.newFixedThreadPool(threadCount);
		CountDownLatch startLatch = new CountDownLatch(1);
		AtomicInteger errors = new AtomicInteger(0);
		List<Future<?>> futures = new ArrayList<>();

		for (int i = 0; i < threadCount; i++) {
			futures.add(executor.submit(() -> {
				try {
					startLatch.await();
					Hover result = services.hover(new HoverParams(new TextDocumentIdentifier(URI), new Position(0, 8)))
							.get(10, TimeUnit.SECONDS);
					if (result == null) {
						errors.incrementAndGet();
					}
				} catch (Exception e) {
					errors.incrementAndGet();
				}
			}));
		}

		startLatch.countDown();
		for (Future<?> f : futures) {
			f.get(30, TimeUnit.SECONDS);
		}
		executor.shutdown();

		Assertions.assertEquals(0, errors.get(), "Every concurrent hover should find the documentation");
	}

	// ------------------------------------------------------------------
	// Reads racing with writes
	// ------------------------------------------------------------------

	@Test
	void testCompletionsRacingWithChangesSeeWholeDocuments() throws Exception {
		// both versions end with a qualified token at the same column
		String strVersion = "str::";
		String arrVersion = "arr::";
		services.didOpen(new DidOpenTextDocumentParams(new TextDocumentItem(URI, LANGUAGE_ID, 1, strVersion)));

		int threadCount = 8;
		ExecutorService executor = Executors.newFixedThreadPool(threadCount);
		CountDownLatch startLatch = new CountDownLatch(1);
		AtomicInteger errors = new AtomicInteger(0);
		List<Future<?>> futures = new ArrayList<>();

		for (int i = 0; i < threadCount; i++) {
			final boolean writer = i == 0;
			futures.add(executor.submit(() -> {
				try {
					startLatch.await();
					for (int j = 0; j < 100; j++) {
						if (writer) {
							String text = j % 2 == 0 ? arrVersion : strVersion;
							services.didChange(new DidChangeTextDocumentParams(
									new VersionedTextDocumentIdentifier(URI, j + 2),
									Collections.singletonList(new TextDocumentContentChangeEvent(text))));
						} else {
							Either<List<CompletionItem>, CompletionList> result = services.completion(
									new CompletionParams(new TextDocumentIdentifier(URI), new Position(0, 5)))
									.get(10, TimeUnit.SECONDS);
							int size = result.getLeft().size();
							// 2 members of str, 1 of arr
							if (size != 2 && size != 1) {
								errors.incrementAndGet();
							}
						}
					}
				} catch (Exception e) {
					errors.incrementAndGet();
				}
			}));
		}

		startLatch.countDown();
		for (Future<?> f : futures) {
			f.get(60, TimeUnit.SECONDS);
		}
		executor.shutdown();

		Assertions.assertEquals(0, errors.get(),
				"Completions should always reflect exactly one version of the document");
	}

	@Test
	void testConcurrentOpensOfDifferentDocuments() throws Exception {
		int threadCount = 8;
		ExecutorService executor = Executors.newFixedThreadPool(threadCount);
		CountDownLatch startLatch = new CountDownLatch(1);
		AtomicInteger errors = new AtomicInteger(0);
		List<Future<?>> futures = new ArrayList<>();

		for (int i = 0; i < threadCount; i++) {
			final String uri = "file:///workspace/doc" + i + ".trill";
			futures.add(executor.submit(() -> {
				try {
					startLatch.await();
					services.didOpen(new DidOpenTextDocumentParams(new TextDocumentItem(uri, LANGUAGE_ID, 1, "str::")));
					int size = services.completion(new CompletionParams(new TextDocumentIdentifier(uri), new Position(0, 5)))
							.get(10, TimeUnit.SECONDS).getLeft().size();
					if (size != 2) {
						errors.incrementAndGet();
					}
				} catch (Exception e) {
					errors.incrementAndGet();
				}
			}));
		}

		startLatch.countDown();
		for (Future<?> f : futures) {
			f.get(30, TimeUnit.SECONDS);
		}
		executor.shutdown();

		Assertions.assertEquals(0, errors.get());
		Assertions.assertEquals(threadCount, services.getCore().getStore().size());
	}
}
