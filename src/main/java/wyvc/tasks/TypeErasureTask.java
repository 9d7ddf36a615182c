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
package wyvc.tasks;

import java.util.List;

import org.apache.log4j.Logger;

import wyvc.core.VCExpr;
import wyvc.core.VCExpressionGenerator;
import wyvc.erasure.ErasureOptions;
import wyvc.erasure.TypeAxiomBuilderPremisses;
import wyvc.erasure.TypeEraserPremisses;

/**
 * A type erasure session. This bundles an axiom builder with an eraser over
 * it, such that a sequence of expressions can be erased against the same set
 * of type representations and untyped functions. The axioms generated while
 * erasing must be given to the prover alongside the erased expressions, and
 * can be retrieved incrementally via {@link #drainNewAxioms()}.
 *
 * @author David J. Pearce
 *
 */
public class TypeErasureTask {
	private static final Logger LOGGER = Logger.getLogger(TypeErasureTask.class);

	private final VCExpressionGenerator gen;
	private final TypeAxiomBuilderPremisses axBuilder;
	private final TypeEraserPremisses eraser;

	public TypeErasureTask(VCExpressionGenerator gen, ErasureOptions options) {
		if (options.getTypeEncoding() == ErasureOptions.TypeEncoding.ARGUMENTS) {
			throw new IllegalArgumentException("unsupported type encoding encountered (" + options.getTypeEncoding() + ")");
		}
		this.gen = gen;
		this.axBuilder = new TypeAxiomBuilderPremisses(gen, options);
		this.axBuilder.setup();
		this.eraser = new TypeEraserPremisses(axBuilder, gen);
	}

	private TypeErasureTask(TypeErasureTask task) {
		this.gen = task.gen;
		this.axBuilder = task.axBuilder.copy();
		this.eraser = new TypeEraserPremisses(axBuilder, gen);
	}

	/**
	 * Erase the types in a given expression. The polarity is <code>1</code> if
	 * the expression occurs positively (e.g. as an assumption), <code>-1</code>
	 * if it occurs negatively (e.g. as a goal) and <code>0</code> if unknown.
	 *
	 * @param expr
	 * @param polarity
	 * @return
	 */
	public VCExpr erase(VCExpr expr, int polarity) {
		VCExpr result = eraser.erase(expr, polarity);
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("erased " + expr + " to " + result);
		}
		return result;
	}

	/**
	 * Return the conjunction of all axioms generated since this method was last
	 * called (or since the session began).
	 *
	 * @return
	 */
	public VCExpr drainNewAxioms() {
		int drained = axBuilder.getNewAxiomCount();
		int count = axBuilder.getAllTypeAxioms().size();
		VCExpr axioms = axBuilder.getNewAxioms();
		LOGGER.info("drained " + drained + " axioms (" + count + " in total)");
		return axioms;
	}

	public List<VCExpr> getAllAxioms() {
		return axBuilder.getAllTypeAxioms();
	}

	/**
	 * Create an independent session which starts from the state of this one.
	 * Symbols created so far are shared, but anything subsequently registered
	 * in either session is not visible in the other.
	 *
	 * @return
	 */
	public TypeErasureTask fork() {
		return new TypeErasureTask(this);
	}

	public TypeAxiomBuilderPremisses getAxiomBuilder() {
		return axBuilder;
	}

	public VCExpressionGenerator getGenerator() {
		return gen;
	}
}
