package absint.checkers;

import absint.TestPrograms;
import absint.ir.Purpose;
import absint.semantics.MergePredicate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InvalidDiscriminantCheckerTest {
	private static CheckerResults check(MergePredicate merge) {
		var program = TestPrograms.discriminant();
		return InvalidDiscriminantChecker.INSTANCE.check(program, TestPrograms.models().of(program), merge);
	}

	@Test
	public void sites() {
		var results = check(MergePredicate.never());
		var cfg = results.getAnalysis().getCfg();
		var sites = results.getAnalysis().findAssumes(Purpose.Kind.EXIST_CHECK);

		assertEquals(2, sites.size());
		assertEquals(cfg.node("assume1"), sites.get(0).node());
		assertEquals(cfg.node("assume3"), sites.get(1).node());
	}

	@Test
	public void wrongVariant() {
		var results = check(MergePredicate.equalEnvironments());
		assertEquals("invalid_discriminant", results.getChecker());
		assertEquals(1, results.getDiagnostics().size());

		var diag = results.getDiagnostics().get(0);
		var cfg = results.getAnalysis().getCfg();
		assertTrue(diag.isPrecise());
		assertEquals("invalid field 'a'", diag.getMessage());
		assertEquals("path to infeasible access r.a due to invalid condition on discriminant r.tag",
			diag.getPathDescription());
		assertEquals(cfg.node("assume3"), diag.getSite().node());
		assertTrue(diag.getTrace().contains(cfg.node("assume2")));
		assertFalse(diag.getTrace().contains(cfg.node("assume0")));
	}

	@Test
	public void description() {
		assertFalse(InvalidDiscriminantChecker.INSTANCE.getDescription().isEmpty());
	}
}
