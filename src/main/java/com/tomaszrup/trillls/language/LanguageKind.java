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
package com.tomaszrup.trillls.language;

import java.nio.file.Path;
import java.util.Locale;

import com.tomaszrup.trillls.language.catalog.CatalogLanguage;
import com.tomaszrup.trillls.language.catalog.FunctionCatalog;
import com.tomaszrup.trillls.language.groovy.GroovyLanguage;

/**
 * The languages the server can be started for.
 */
public enum LanguageKind {
	GROOVY {
		@Override
		public LanguageCapability create(Path catalogFile) {
			return new GroovyLanguage();
		}
	},
	CATALOG {
		@Override
		public LanguageCapability create(Path catalogFile) {
			FunctionCatalog catalog = catalogFile != null
					? FunctionCatalog.load(catalogFile)
					: FunctionCatalog.loadBundled();
			return new CatalogLanguage(catalog);
		}
	};

	/**
	 * Creates the capability for this language.
	 *
	 * @param catalogFile function catalog to use instead of the bundled one,
	 *                    or {@code null}; ignored by languages without a catalog
	 * @throws java.io.UncheckedIOException if a catalog cannot be loaded
	 */
	public abstract LanguageCapability create(Path catalogFile);

	public static LanguageKind fromString(String value) {
		if (value == null) {
			throw new IllegalArgumentException("Language must not be null");
		}
		try {
			return valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown language '" + value + "', expected groovy or catalog", e);
		}
	}
}
