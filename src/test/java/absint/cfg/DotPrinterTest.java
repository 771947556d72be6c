package absint.cfg;

import absint.TestPrograms;
import absint.ir.Ir;
import absint.ir.Operator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class DotPrinterTest {
	@Test
	public void nodesAndEdges() {
		var cfg = CfgBuilder.build(TestPrograms.split());
		var dot = DotPrinter.of(cfg).print();

		assertTrue(dot.startsWith("digraph \"split\" {\n"), dot);
		assertTrue(dot.endsWith("}\n"), dot);
		assertTrue(dot.contains("\"start0\" -> \"assign0\";"), dot);
		assertTrue(dot.contains("\"assign2\" -> \"split_join0\";"), dot);
		assertTrue(dot.contains("<b>assign0</b><br/><i>x = 3</i>"), dot);
	}

	@Test
	public void labelsAreEscaped() {
		var x = Ir.ident("x", TestPrograms.INT);
		var program = Ir.program("lt", Ir.assume(Ir.bin(x, Operator.LT, Ir.lit(0L, TestPrograms.INT), TestPrograms.BOOL)));
		var dot = DotPrinter.of(CfgBuilder.build(program)).print();

		assertTrue(dot.contains("<i>assume(x &lt; 0)</i>"), dot);
		assertFalse(dot.contains("x < 0"), dot);
	}

	@Test
	public void annotations() {
		var cfg = CfgBuilder.build(TestPrograms.split());
		var printer = DotPrinter.of(cfg)
			.annotate(cfg.node("assume0"), "path to <danger>")
			.annotate(cfg.node("assume0"), "path to <danger>");
		var dot = printer.print();

		assertTrue(dot.contains("<font color=\"red\">path to &lt;danger&gt;</font>"), dot);
		assertEquals(dot.indexOf("&lt;danger&gt;"), dot.lastIndexOf("&lt;danger&gt;"));
	}

	@Test
	public void writeToFile(@TempDir Path dir) throws IOException {
		var cfg = CfgBuilder.build(TestPrograms.counter(3));
		var path = dir.resolve("counter.dot");
		DotPrinter.of(cfg).write(path);
		assertEquals(DotPrinter.of(cfg).print(), Files.readString(path));
	}
}
