package absint.dataflow;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

public class IntervalDomainTest {
	private final IntervalDomain domain = new IntervalDomain(-5, 5);

	private final List<Interval> samples = List.of(
		Interval.empty(),
		this.domain.constant(0),
		this.domain.of(-2, 3),
		this.domain.of(1, 5),
		this.domain.top());

	@Test
	public void joinIsAnUpperBound() {
		for (var a : this.samples) {
			for (var b : this.samples) {
				var join = this.domain.join(a, b);
				assertTrue(this.domain.le(a, join), a + " ⊔ " + b);
				assertTrue(this.domain.le(b, join), a + " ⊔ " + b);
			}
		}
	}

	@Test
	public void widenIsAboveJoin() {
		for (var a : this.samples) {
			for (var b : this.samples) {
				assertTrue(this.domain.le(this.domain.join(a, b), this.domain.widen(a, b)), a + " ∇ " + b);
			}
		}
	}

	@Test
	public void meetIsIdempotentAndCommutative() {
		for (var a : this.samples) {
			assertEquals(a, this.domain.meet(a, a));
			for (var b : this.samples) {
				assertEquals(this.domain.meet(a, b), this.domain.meet(b, a));
			}
		}
	}

	@Test
	public void wideningStabilizes() {
		var value = this.domain.constant(0);
		var steps = 0;
		for (long i = 1; i <= 5; ++i) {
			var next = this.domain.widen(value, this.domain.join(value, this.domain.constant(i)));
			if (next.equals(value)) {
				break;
			}
			value = next;
			++steps;
		}
		assertEquals(1, steps);
		assertEquals(this.domain.of(0, 5), value);
	}

	@Test
	public void constantsOutsideTheRangeAreEmpty() {
		assertTrue(this.domain.isEmpty(this.domain.constant(6)));
		assertEquals(this.domain.of(4, 5), this.domain.of(4, 9));
	}

	@Test
	public void parseLiterals() {
		assertEquals(this.domain.constant(3), this.domain.parse(3L).get());
		assertEquals(this.domain.constant(-2), this.domain.parse("-2").get());
		assertFalse(this.domain.parse("two").isPresent());
	}

	@Test
	public void singletons() {
		assertTrue(this.domain.isSingleton(this.domain.constant(2)));
		assertFalse(this.domain.isSingleton(this.domain.of(2, 3)));
		assertFalse(this.domain.isSingleton(this.domain.bottom()));
	}
}
