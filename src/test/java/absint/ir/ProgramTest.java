package absint.ir;

import absint.TestPrograms;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;

public class ProgramTest {
	@Test
	public void variablesInOrderOfFirstOccurrence() {
		var names = TestPrograms.nullDeref()
			.variables()
			.stream()
			.map(Ident::getName)
			.collect(Collectors.toList());
		assertEquals(List.of("p", "x"), names);
	}

	@Test
	public void purposes() {
		var program = TestPrograms.nullDeref();
		var checks = program.nodes()
			.filter(n -> Purpose.isPurposeOf(Purpose.Kind.DEREF_CHECK, n))
			.collect(Collectors.toList());
		assertEquals(1, checks.size());
		assertTrue(checks.get(0) instanceof Assume);
		assertFalse(program.nodes().anyMatch(n -> Purpose.isPurposeOf(Purpose.Kind.EXIST_CHECK, n)));
	}

	@Test
	public void ifThenElseAssumesTheCondition() {
		var split = (Split) TestPrograms.split().getStmts().get(1);
		var first = (Assume) split.getFirst().get(0);
		var second = (Assume) split.getSecond().get(0);
		var negation = (UnExpr) second.getExpr();
		assertEquals(Operator.NOT, negation.getOperator());
		assertTrue(negation.getOperand() == first.getExpr());
		assertEquals(TestPrograms.BOOL, negation.getData().getTypeHint().get());
	}
}
