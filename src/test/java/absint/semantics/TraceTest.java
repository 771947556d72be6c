package absint.semantics;

import absint.TestPrograms;
import absint.cfg.CfgBuilder;
import absint.cfg.ControlFlowGraph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TraceTest {
	private final ControlFlowGraph cfg = CfgBuilder.build(TestPrograms.split());

	@Test
	public void appendKeepsFirstVisitOrder() {
		var start = this.cfg.node("start0");
		var assign = this.cfg.node("assign0");
		var trace = Trace.of(start).append(assign);

		assertEquals("[start0, assign0]", trace.toString());
		assertSame(trace, trace.append(start));
		assertSame(assign, trace.last());
	}

	@Test
	public void orderMatters() {
		var a = this.cfg.node("assume0");
		var b = this.cfg.node("assume1");
		assertNotEquals(Trace.of(a, b), Trace.of(b, a));
		assertEquals(Trace.of(a, b), Trace.empty().append(a).append(b));
		assertTrue(Trace.of(a, b).isSubsetOf(Trace.of(b, a)));
	}

	@Test
	public void union() {
		var start = this.cfg.node("start0");
		var a = this.cfg.node("assume0");
		var b = this.cfg.node("assume1");
		var union = Trace.of(start, a).union(Trace.of(start, b));

		assertEquals(Trace.of(start, a, b), union);
		assertTrue(Trace.of(start, a).isSubsetOf(union));
		assertFalse(union.isSubsetOf(Trace.of(start, a)));
	}
}
