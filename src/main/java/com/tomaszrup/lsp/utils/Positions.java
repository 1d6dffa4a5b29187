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
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;

import com.tomaszrup.trillls.core.SourcePosition;

public class Positions {
	private Positions() {
	}

	public static boolean valid(Position p) {
		return p != null && p.getLine() >= 0 && p.getCharacter() >= 0;
	}

	/**
	 * Converts an LSP position. The column keeps its unit; interpreting it is
	 * up to the {@link com.tomaszrup.trillls.core.PositionMapper} in use.
	 */
	public static SourcePosition toSourcePosition(Position position) {
		if (position == null) {
			return null;
		}
		return new SourcePosition(position.getLine(), position.getCharacter());
	}

	public static Position toPosition(SourcePosition position) {
		if (position == null) {
			return null;
		}
		return new Position(position.getLine(), position.getColumn());
	}
}
