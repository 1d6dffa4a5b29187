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

import java.util.Comparator;

/**
 * Zero-based line and column inside a document. The unit of {@link #getColumn()}
 * is decided by the {@link ColumnEncoding} of the {@link PositionMapper} that
 * produced or consumes the position.
 */
public final class SourcePosition {

	public static final Comparator<SourcePosition> COMPARATOR = (SourcePosition p1, SourcePosition p2) -> {
		if (p1.line != p2.line) {
			return Integer.compare(p1.line, p2.line);
		}
		return Integer.compare(p1.column, p2.column);
	};

	public static final SourcePosition ORIGIN = new SourcePosition(0, 0);

	private final int line;
	private final int column;

	public SourcePosition(int line, int column) {
		this.line = line;
		this.column = column;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public boolean isValid() {
		return line >= 0 && column >= 0;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SourcePosition)) {
			return false;
		}
		SourcePosition that = (SourcePosition) o;
		return line == that.line && column == that.column;
	}

	@Override
	public int hashCode() {
		return 31 * line + column;
	}

	@Override
	public String toString() {
		return line + ":" + column;
	}
}
