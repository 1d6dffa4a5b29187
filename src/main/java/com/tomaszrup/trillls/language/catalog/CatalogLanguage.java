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
package com.tomaszrup.trillls.language.catalog;

import java.util.List;
import java.util.Optional;

import com.tomaszrup.trillls.language.FunctionDoc;
import com.tomaszrup.trillls.language.LanguageCapability;
import com.tomaszrup.trillls.language.RawError;

/**
 * A language described entirely by a {@link FunctionCatalog}: completion and
 * hover come from the catalog, diagnostics from the {@link DelimiterChecker}.
 */
public class CatalogLanguage implements LanguageCapability {
	public static final String ID = "catalog";

	private final FunctionCatalog catalog;
	private final DelimiterChecker checker;

	public CatalogLanguage(FunctionCatalog catalog) {
		this(catalog, new DelimiterChecker());
	}

	public CatalogLanguage(FunctionCatalog catalog, DelimiterChecker checker) {
		this.catalog = catalog;
		this.checker = checker;
	}

	/** The catalog's own language name, e.g. "tremor". */
	@Override
	public String id() {
		return catalog.getLanguage();
	}

	@Override
	public String pathSeparator() {
		return catalog.getSeparator();
	}

	@Override
	public Optional<List<RawError>> parseErrors(String text) {
		if (text == null || text.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(checker.check(text));
	}

	@Override
	public List<String> functions(String namespace) {
		return catalog.functionNames(namespace);
	}

	@Override
	public Optional<FunctionDoc> functionDoc(String qualifiedName) {
		return catalog.find(qualifiedName);
	}
}
