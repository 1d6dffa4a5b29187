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

import java.util.Locale;

/**
 * What {@link DocumentStore#close(java.net.URI)} does with the closed
 * document's text.
 */
public enum ClosePolicy {
	/** Drop the entry; later queries for the document fail with not-found. */
	REMOVE,
	/** Keep the last known text; queries keep working after close. */
	RETAIN;

	public static ClosePolicy fromString(String value) {
		if (value == null) {
			throw new IllegalArgumentException("Close policy must not be null");
		}
		try {
			return valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown close policy: " + value, e);
		}
	}
}
