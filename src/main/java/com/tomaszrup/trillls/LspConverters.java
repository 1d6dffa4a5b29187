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
import java.util.List;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.InsertTextFormat;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;

import com.tomaszrup.lsp.utils.Ranges;
import com.tomaszrup.trillls.core.CompletionCandidate;
import com.tomaszrup.trillls.core.DiagnosticRecord;
import com.tomaszrup.trillls.core.RenderedDoc;
import com.tomaszrup.trillls.core.Severity;

/**
 * Conversions from core results to lsp4j protocol types. The only place
 * where both meet.
 */
public class LspConverters {
	private LspConverters() {
	}

	public static List<Diagnostic> toDiagnostics(List<DiagnosticRecord> records) {
		List<Diagnostic> diagnostics = new ArrayList<>(records.size());
		for (DiagnosticRecord record : records) {
			diagnostics.add(toDiagnostic(record));
		}
		return diagnostics;
	}

	public static Diagnostic toDiagnostic(DiagnosticRecord record) {
		Diagnostic diagnostic = new Diagnostic();
		diagnostic.setRange(Ranges.toRange(record.getRange()));
		diagnostic.setMessage(record.getMessage());
		diagnostic.setSeverity(toDiagnosticSeverity(record.getSeverity()));
		diagnostic.setSource(record.getSource());
		return diagnostic;
	}

	public static DiagnosticSeverity toDiagnosticSeverity(Severity severity) {
		switch (severity) {
			case WARNING:
				return DiagnosticSeverity.Warning;
			case INFORMATION:
				return DiagnosticSeverity.Information;
			case HINT:
				return DiagnosticSeverity.Hint;
			case ERROR:
			default:
				return DiagnosticSeverity.Error;
		}
	}

	public static List<CompletionItem> toCompletionItems(List<CompletionCandidate> candidates) {
		List<CompletionItem> items = new ArrayList<>(candidates.size());
		for (CompletionCandidate candidate : candidates) {
			items.add(toCompletionItem(candidate));
		}
		return items;
	}

	public static CompletionItem toCompletionItem(CompletionCandidate candidate) {
		CompletionItem item = new CompletionItem();
		item.setLabel(candidate.getLabel());
		item.setKind(CompletionItemKind.Function);
		candidate.getDetail().ifPresent(item::setDetail);
		candidate.getDocumentation().ifPresent(markdown -> {
			MarkupContent documentation = new MarkupContent();
			documentation.setKind(MarkupKind.MARKDOWN);
			documentation.setValue(markdown);
			item.setDocumentation(documentation);
		});
		candidate.getInsertText().ifPresent(snippet -> {
			item.setInsertText(snippet);
			item.setInsertTextFormat(InsertTextFormat.Snippet);
		});
		return item;
	}

	public static Hover toHover(RenderedDoc doc) {
		MarkupContent contents = new MarkupContent();
		contents.setKind(MarkupKind.MARKDOWN);
		contents.setValue(doc.getMarkdown());
		Hover hover = new Hover();
		hover.setContents(contents);
		return hover;
	}
}
