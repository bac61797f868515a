package org.javai.srilang.ast.folding;

import java.util.List;

/**
 * Summary of one run of {@link ConstantFolder#fold(org.javai.srilang.ast.ModuleNode)}.
 *
 * @param builtinConstantSubstitutions references to builtin constants replaced before the first round
 * @param roundSubstitutions substitutions made in each fixed-point round; the last entry is always zero
 */
public record FoldingReport(int builtinConstantSubstitutions, List<Integer> roundSubstitutions) {

	public FoldingReport {
		roundSubstitutions = List.copyOf(roundSubstitutions);
	}

	public int rounds() {
		return roundSubstitutions.size();
	}

	public int totalSubstitutions() {
		int total = builtinConstantSubstitutions;
		for (int count : roundSubstitutions) {
			total += count;
		}
		return total;
	}

	/**
	 * True if the run made no changes at all.
	 */
	public boolean isUnchanged() {
		return totalSubstitutions() == 0;
	}
}
