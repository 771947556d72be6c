package absint.dataflow;

import absint.ir.Operator;

import com.google.common.collect.ImmutableSet;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

public class OperationsTest {
	private final IntervalDomain ints = new IntervalDomain(-5, 5);
	private final IntervalOperations intOps = new IntervalOperations(this.ints);
	private final FiniteSetDomain<Nullness> ptrs = Domains.access("ptr");
	private final AccessOperations ptrOps = new AccessOperations(this.ptrs);

	private Operation intOp(Operator op, Domain<?> result) {
		return this.intOps.lookup(op, Signature.binary(this.ints, this.ints, result)).get();
	}

	@Test
	public void addition() {
		var plus = intOp(Operator.PLUS, this.ints);
		var sum = plus.definition().apply(Arrays.asList(this.ints.of(1, 2), this.ints.of(3, 4)));
		assertEquals(this.ints.of(4, 5), sum);

		var pre = plus.inverse()
			.apply(this.ints.constant(3), Arrays.asList(this.ints.top(), this.ints.constant(1)))
			.get();
		assertEquals(this.ints.constant(2), pre.get(0));
		assertEquals(this.ints.constant(1), pre.get(1));
	}

	@Test
	public void comparisons() {
		var lt = intOp(Operator.LT, Domains.BOOLEAN);
		assertEquals(Domains.TRUE, lt.definition().apply(Arrays.asList(this.ints.of(0, 1), this.ints.of(2, 3))));
		assertEquals(Domains.BOTH, lt.definition().apply(Arrays.asList(this.ints.of(0, 2), this.ints.of(2, 3))));
		assertEquals(Domains.FALSE, lt.definition().apply(Arrays.asList(this.ints.of(3, 3), this.ints.of(2, 3))));

		var pre = lt.inverse()
			.apply(Domains.TRUE, Arrays.asList(this.ints.top(), this.ints.constant(2)))
			.get();
		assertEquals(this.ints.of(-5, 1), pre.get(0));
	}

	@Test
	public void impossibleComparison() {
		var gt = intOp(Operator.GT, Domains.BOOLEAN);
		var pre = gt.inverse().apply(Domains.TRUE, Arrays.asList(this.ints.constant(-1), this.ints.constant(0)));
		assertFalse(pre.isPresent());
	}

	@Test
	public void unsupportedSignature() {
		assertFalse(this.intOps.lookup(Operator.PLUS, Signature.binary(this.ints, this.ints, Domains.BOOLEAN)).isPresent());
		assertFalse(this.intOps.lookup(Operator.AND, Signature.binary(this.ints, this.ints, this.ints)).isPresent());
	}

	@Test
	public void booleanConnectives() {
		var bools = new SetOperations<>(Domains.BOOLEAN);
		var and = bools.lookup(Operator.AND, Signature.binary(Domains.BOOLEAN, Domains.BOOLEAN, Domains.BOOLEAN)).get();
		assertEquals(Domains.FALSE, and.definition().apply(Arrays.asList(Domains.TRUE, Domains.FALSE)));

		var pre = and.inverse().apply(Domains.TRUE, Arrays.asList(Domains.BOTH, Domains.BOTH)).get();
		assertEquals(Arrays.asList(Domains.TRUE, Domains.TRUE), pre);

		var not = bools.lookup(Operator.NOT, Signature.unary(Domains.BOOLEAN, Domains.BOOLEAN)).get();
		assertEquals(Domains.FALSE, not.definition().apply(List.of(Domains.TRUE)));
		assertFalse(not.inverse().apply(Domains.TRUE, List.of(Domains.TRUE)).isPresent());
	}

	@Test
	public void pointerEquality() {
		var eq = this.ptrOps.lookup(Operator.EQ, Signature.binary(this.ptrs, this.ptrs, Domains.BOOLEAN)).get();
		var isNull = this.ptrs.valueOf(Nullness.NULL);
		var nonNull = this.ptrs.valueOf(Nullness.NON_NULL);

		assertEquals(Domains.TRUE, eq.definition().apply(Arrays.asList(isNull, isNull)));
		assertEquals(Domains.FALSE, eq.definition().apply(Arrays.asList(nonNull, isNull)));
		assertEquals(Domains.BOTH, eq.definition().apply(Arrays.asList(nonNull, nonNull)));

		var neq = this.ptrOps.lookup(Operator.NEQ, Signature.binary(this.ptrs, this.ptrs, Domains.BOOLEAN)).get();
		var pre = neq.inverse().apply(Domains.TRUE, Arrays.asList(this.ptrs.top(), isNull)).get();
		assertEquals(nonNull, pre.get(0));
	}

	@Test
	public void dereference() {
		var deref = this.ptrOps.lookup(Operator.DEREF, Signature.unary(this.ptrs, this.ints)).get();
		assertEquals(this.ints.top(), deref.definition().apply(List.of(this.ptrs.top())));
		assertTrue(this.ints.isEmpty((Interval) deref.definition().apply(List.of(this.ptrs.valueOf(Nullness.NULL)))));

		var pre = deref.inverse().apply(this.ints.constant(1), List.of(this.ptrs.top())).get();
		assertEquals(ImmutableSet.of(Nullness.NON_NULL), pre.get(0));
	}

	@Test
	public void addressOf() {
		var address = this.ptrOps.lookup(Operator.ADDRESS, Signature.unary(this.ints, this.ptrs)).get();
		assertEquals(this.ptrs.valueOf(Nullness.NON_NULL), address.definition().apply(List.of(this.ints.constant(1))));
		assertFalse(address.inverse().apply(this.ptrs.valueOf(Nullness.NULL), List.of(this.ints.constant(1))).isPresent());
	}
}
