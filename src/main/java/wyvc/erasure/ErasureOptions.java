// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wyvc.erasure;

/**
 * Options controlling how types are erased. These are read by the axiom
 * builders when they are constructed; changing an options object afterwards
 * does not affect builders already constructed from it.
 *
 * @author David J. Pearce
 *
 */
public class ErasureOptions {

	public enum TypeEncoding {
		/**
		 * Erase types without generating any type information.
		 */
		NONE,
		/**
		 * Encode types as premises <code>type(x) == T</code> on quantified
		 * variables, plus typing axioms for functions.
		 */
		PREDICATES,
		/**
		 * Encode types as explicit arguments to functions.
		 */
		ARGUMENTS
	}

	/**
	 * The encoding of type information.
	 */
	private TypeEncoding typeEncoding = TypeEncoding.PREDICATES;
	/**
	 * Specify whether the prover supports maps natively, in which case map
	 * types are not erased.
	 */
	private boolean useArrayTheory = false;
	/**
	 * Specify whether types supported natively by the prover are kept inside
	 * map types and function signatures.
	 */
	private boolean monomorphize = false;

	public ErasureOptions() {
	}

	public ErasureOptions(ErasureOptions options) {
		this.typeEncoding = options.typeEncoding;
		this.useArrayTheory = options.useArrayTheory;
		this.monomorphize = options.monomorphize;
	}

	public ErasureOptions setTypeEncoding(TypeEncoding encoding) {
		this.typeEncoding = encoding;
		return this;
	}

	public ErasureOptions setUseArrayTheory(boolean flag) {
		this.useArrayTheory = flag;
		return this;
	}

	public ErasureOptions setMonomorphize(boolean flag) {
		this.monomorphize = flag;
		return this;
	}

	public TypeEncoding getTypeEncoding() {
		return typeEncoding;
	}

	public boolean getUseArrayTheory() {
		return useArrayTheory;
	}

	public boolean getMonomorphize() {
		return monomorphize;
	}

	@Override
	public String toString() {
		return "{typeEncoding=" + typeEncoding + ", useArrayTheory=" + useArrayTheory + ", monomorphize="
				+ monomorphize + "}";
	}
}
