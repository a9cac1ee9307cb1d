package cfg;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {

	private static class Run {
		final int status;
		final List<String> out;
		final String err;

		Run(String input) {
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			ByteArrayOutputStream err = new ByteArrayOutputStream();
			this.status = Main.run(new BufferedReader(new StringReader(input)),
					new PrintStream(out, true), new PrintStream(err, true));
			String output = new String(out.toByteArray(), StandardCharsets.UTF_8);
			this.out = output.isEmpty() ? Collections.<String>emptyList() : Arrays.asList(output.split("\\R"));
			this.err = new String(err.toByteArray(), StandardCharsets.UTF_8);
		}
	}

	@Test
	public void testBothParsers(){
		Run run = new Run("1\nS -> aSb e\nT\nab\naabb\na\n\nb\nab\nba\n\nq\n");
		assertEquals(0, run.status);
		assertEquals(Arrays.asList(Main.SELECT_PROMPT, "yes", "yes", "no", Main.SELECT_PROMPT, "yes", "no",
				Main.SELECT_PROMPT), run.out);
	}

	@Test
	public void testBothParsersEndOfInput(){
		Run run = new Run("1\nS -> aSb e\nB\nab\n");
		assertEquals(0, run.status);
		assertEquals(Arrays.asList(Main.SELECT_PROMPT, "yes", Main.SELECT_PROMPT), run.out);
	}

	@Test
	public void testOnlyLL(){
		Run run = new Run("3\nS -> AaAb BbBa\nA -> e\nB -> e\nab\nba\naa\n");
		assertEquals(0, run.status);
		assertEquals(Arrays.asList("Grammar is LL(1).", "yes", "yes", "no"), run.out);
	}

	@Test
	public void testOnlySLR(){
		Run run = new Run("1\nS -> Sa b\nbaa\na\n\nb\n");
		assertEquals(0, run.status);
		assertEquals(Arrays.asList("Grammar is SLR(1).", "yes", "no"), run.out);
	}

	@Test
	public void testNeither(){
		Run run = new Run("3\nS -> L=R R\nL -> *R i\nR -> L\ni=i\n");
		assertEquals(0, run.status);
		assertEquals(Arrays.asList("Grammar is neither LL(1) nor SLR(1)."), run.out);
	}

	@Test
	public void testFormatErrors(){
		for (String input : new String[]{"", "x\n", "2\nS -> a\n", "1\nS a\n", "1\nA -> a\n"}){
			Run run = new Run(input);
			assertEquals(1, run.status, input);
			assertTrue(run.err.startsWith("Error: "), run.err);
			assertTrue(run.out.isEmpty());
		}
	}

	@Test
	public void testInvalidConfiguration(){
		System.setProperty("cfg.maxIterations", "many");
		try {
			Run run = new Run("1\nS -> aSb e\nab\n");
			assertEquals(1, run.status);
			assertTrue(run.err.startsWith("Error: Invalid value for maxIterations"), run.err);
			assertTrue(run.out.isEmpty());
		} finally {
			System.clearProperty("cfg.maxIterations");
		}
	}

	@Test
	public void testDebugOutput(){
		System.setProperty("cfg.debug", "yes");
		try {
			Run run = new Run("1\nS -> Sa b\n");
			assertTrue(run.out.contains("FOLLOW(S) = { a $ }"), run.out.toString());
			assertTrue(run.out.get(run.out.size() - 1).equals("Grammar is SLR(1)."));
		} finally {
			System.clearProperty("cfg.debug");
		}
	}
}
