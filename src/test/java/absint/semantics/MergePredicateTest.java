package absint.semantics;

import absint.ConfigurationException;
import absint.TestPrograms;
import absint.cfg.CfgBuilder;
import absint.cfg.ControlFlowGraph;
import absint.dataflow.Domains;
import absint.ir.Ir;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

public class MergePredicateTest {
	private final ControlFlowGraph cfg = CfgBuilder.build(TestPrograms.split());
	private final Trace left = Trace.of(this.cfg.node("start0"), this.cfg.node("assume0"));
	private final Trace right = Trace.of(this.cfg.node("start0"), this.cfg.node("assume1"));
	private final Env yes = Env.of(Map.of(Ir.ident("b", TestPrograms.BOOL), Domains.TRUE));
	private final Env no = Env.of(Map.of(Ir.ident("b", TestPrograms.BOOL), Domains.FALSE));

	private boolean merges(MergePredicate pred, Trace a, Env envA, Trace b, Env envB) {
		return pred.shouldMerge(this.cfg.node("split_join0"), a, envA, b, envB);
	}

	@Test
	public void builtins() {
		assertTrue(merges(MergePredicate.always(), this.left, this.yes, this.right, this.no));
		assertFalse(merges(MergePredicate.never(), this.left, this.yes, this.right, this.yes));

		assertTrue(merges(MergePredicate.equalEnvironments(), this.left, this.yes, this.right, this.yes));
		assertFalse(merges(MergePredicate.equalEnvironments(), this.left, this.yes, this.right, this.no));

		assertFalse(merges(MergePredicate.subsumedTraces(), this.left, this.yes, this.right, this.yes));
		var longer = this.left.append(this.cfg.node("assume1"));
		assertTrue(merges(MergePredicate.subsumedTraces(), this.left, this.yes, longer, this.no));

		assertTrue(merges(MergePredicate.longerThan(1), this.left, this.yes, this.right, this.no));
		assertFalse(merges(MergePredicate.longerThan(2), this.left, this.yes, this.right, this.no));
	}

	@Test
	public void combinators() {
		var pred = MergePredicate.equalEnvironments().or(MergePredicate.longerThan(2));
		assertFalse(merges(pred, this.left, this.yes, this.right, this.no));
		assertTrue(merges(pred, this.left.append(this.cfg.node("assign1")), this.yes, this.right, this.no));

		var both = MergePredicate.always().and(MergePredicate.never());
		assertFalse(merges(both, this.left, this.yes, this.right, this.yes));
	}

	@Test
	public void byName() {
		assertTrue(merges(MergePredicate.named("always"), this.left, this.yes, this.right, this.no));
		assertFalse(merges(MergePredicate.named("never"), this.left, this.yes, this.right, this.yes));
		assertThrows(ConfigurationException.class, () -> MergePredicate.named("sometimes"));
	}
}
