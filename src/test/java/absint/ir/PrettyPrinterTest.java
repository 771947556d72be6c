package absint.ir;

import absint.TestPrograms;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class PrettyPrinterTest {
	@Test
	public void expressions() {
		var x = Ir.ident("x", TestPrograms.INT);
		var sum = Ir.bin(x, Operator.PLUS, Ir.lit(1L, TestPrograms.INT), TestPrograms.INT);
		var cmp = Ir.bin(sum, Operator.LT, x, TestPrograms.BOOL);
		assertEquals("(x + 1) < x", PrettyPrinter.print(cmp));
		assertEquals("!((x + 1) < x)", PrettyPrinter.print(Ir.un(Operator.NOT, cmp, TestPrograms.BOOL)));
	}

	@Test
	public void program() {
		var expected = "split:\n"
			+ "  x = 3\n"
			+ "  split:\n"
			+ "    assume(x > 0)\n"
			+ "    y = x - 1\n"
			+ "  |:\n"
			+ "    assume(!(x > 0))\n"
			+ "    y = 0\n";
		assertEquals(expected, PrettyPrinter.print(TestPrograms.split()));
	}

	@Test
	public void loops() {
		var text = TestPrograms.counter(10).toString();
		assertEquals("counter:\n"
			+ "  x = 0\n"
			+ "  loop:\n"
			+ "    assume(x < 10)\n"
			+ "    x = x + 1\n"
			+ "  assume(!(x < 10))\n", text);
	}
}
