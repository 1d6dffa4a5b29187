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
package com.tomaszrup.trillls.core;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe store of the full current text of every open document.
 *
 * <p>Uses {@link ConcurrentHashMap} internally: every write is an atomic
 * per-key replacement, so writes to the same document are serialized while
 * writes to different documents proceed in parallel. Readers observe either
 * the text before or after a write, never a mix of both.</p>
 *
 * <p>A change is always a whole-text replacement. There is no partial edit
 * merging.</p>
 */
public class DocumentStore {
	private static final Logger logger = LoggerFactory.getLogger(DocumentStore.class);

	private final ConcurrentHashMap<URI, DocumentState> documents = new ConcurrentHashMap<>();
	private volatile ClosePolicy closePolicy;

	public DocumentStore() {
		this(ClosePolicy.REMOVE);
	}

	public DocumentStore(ClosePolicy closePolicy) {
		this.closePolicy = Objects.requireNonNull(closePolicy, "closePolicy");
	}

	public ClosePolicy getClosePolicy() {
		return closePolicy;
	}

	public void setClosePolicy(ClosePolicy closePolicy) {
		this.closePolicy = Objects.requireNonNull(closePolicy, "closePolicy");
	}

	/**
	 * Inserts or overwrites the text for {@code uri}.
	 */
	public void open(URI uri, String text) {
		replace(uri, text);
	}

	/**
	 * Overwrites the text for {@code uri}. Behaves exactly like
	 * {@link #open(URI, String)}; an update of an unknown document creates it.
	 */
	public void update(URI uri, String text) {
		replace(uri, text);
	}

	private void replace(URI uri, String text) {
		Objects.requireNonNull(uri, "uri");
		DocumentState next = new DocumentState(Objects.requireNonNull(text, "text"));
		documents.compute(uri, (key, previous) -> next);
	}

	/**
	 * Returns the current text for {@code uri}.
	 *
	 * @throws DocumentNotFoundException if the store holds no entry for it
	 */
	public String get(URI uri) {
		return find(uri).orElseThrow(() -> new DocumentNotFoundException(uri));
	}

	public Optional<String> find(URI uri) {
		if (uri == null) {
			return Optional.empty();
		}
		DocumentState state = documents.get(uri);
		return state == null ? Optional.empty() : Optional.of(state.getText());
	}

	public boolean contains(URI uri) {
		return uri != null && documents.containsKey(uri);
	}

	/**
	 * Applies the current {@link ClosePolicy} to {@code uri}.
	 *
	 * @return {@code true} if the entry was removed
	 */
	public boolean close(URI uri) {
		if (closePolicy == ClosePolicy.RETAIN) {
			logger.debug("Retaining document state for closed {}", uri);
			return false;
		}
		return documents.remove(uri) != null;
	}

	public Set<URI> getOpenURIs() {
		return Collections.unmodifiableSet(documents.keySet());
	}

	public int size() {
		return documents.size();
	}

	/**
	 * Reads a document's text from the file system. Does not touch the store,
	 * so the read never happens while a store entry is being written.
	 *
	 * @throws IOException if the URI is not a readable file
	 */
	public static String load(URI uri) throws IOException {
		try {
			return Files.readString(Paths.get(uri));
		} catch (IllegalArgumentException | java.nio.file.FileSystemNotFoundException e) {
			throw new IOException("Cannot read document from " + uri, e);
		}
	}
}
