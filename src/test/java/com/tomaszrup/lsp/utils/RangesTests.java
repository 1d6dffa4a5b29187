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
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.trillls.core.SourcePosition;
import com.tomaszrup.trillls.core.SourceRange;

class RangesTests {

	@Test
	void testToRange() {
		SourceRange range = new SourceRange(new SourcePosition(1, 4), new SourcePosition(2, 0));
		Assertions.assertEquals(new Range(new Position(1, 4), new Position(2, 0)), Ranges.toRange(range));
	}

	@Test
	void testToRangeEmpty() {
		SourceRange range = new SourceRange(SourcePosition.ORIGIN, SourcePosition.ORIGIN);
		Range converted = Ranges.toRange(range);
		Assertions.assertEquals(converted.getStart(), converted.getEnd());
	}

	@Test
	void testToRangeNull() {
		Assertions.assertNull(Ranges.toRange(null));
	}
}
