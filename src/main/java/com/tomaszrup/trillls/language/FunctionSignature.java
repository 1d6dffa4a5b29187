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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class FunctionSignature {
	private final String name;
	private final List<String> args;

	public FunctionSignature(String name, List<String> args) {
		this.name = Objects.requireNonNull(name, "name");
		this.args = args == null ? Collections.emptyList() : List.copyOf(args);
	}

	public String getName() {
		return name;
	}

	/** Argument names in declaration order. */
	public List<String> getArgs() {
		return args;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FunctionSignature)) {
			return false;
		}
		FunctionSignature that = (FunctionSignature) o;
		return name.equals(that.name) && args.equals(that.args);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, args);
	}

	/** Renders as {@code name(a, b)}. */
	@Override
	public String toString() {
		return name + "(" + String.join(", ", args) + ")";
	}
}
