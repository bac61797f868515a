package org.javai.srilang.ast.folding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FoldingReport")
class FoldingReportTest {

	@Test
	@DisplayName("totals builtin and per-round substitutions")
	void totals() {
		FoldingReport report = new FoldingReport(2, List.of(3, 1, 0));

		assertThat(report.rounds()).isEqualTo(3);
		assertThat(report.totalSubstitutions()).isEqualTo(6);
		assertThat(report.isUnchanged()).isFalse();
		assertThat(new FoldingReport(0, List.of(0)).isUnchanged()).isTrue();
	}

	@Test
	@DisplayName("does not share the caller's list")
	void defensiveCopy() {
		List<Integer> rounds = new ArrayList<>(List.of(1, 0));
		FoldingReport report = new FoldingReport(0, rounds);

		rounds.add(5);

		assertThat(report.roundSubstitutions()).containsExactly(1, 0);
		assertThatThrownBy(() -> report.roundSubstitutions().add(1))
				.isInstanceOf(UnsupportedOperationException.class);
	}
}
