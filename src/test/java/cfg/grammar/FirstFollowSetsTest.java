package cfg.grammar;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import cfg.CFGException;
import cfg.Grammars;

import static cfg.Grammars.grammar;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FirstFollowSetsTest {

	private static Set<Symbol> set(String symbols){
		return new HashSet<>(Symbol.listOf(symbols));
	}

	private static NonTerminal nt(char name){
		return new NonTerminal(name);
	}

	@Test
	public void testFirstSetsOfExpressions(){
		FirstSets first = grammar(Grammars.EXPRESSIONS_LL).calculateFirstSets();
		assertEquals(set("(i"), first.get(nt('S')));
		assertEquals(set("(i"), first.get(nt('T')));
		assertEquals(set("(i"), first.get(nt('F')));
		assertEquals(set("+e"), first.get(nt('X')));
		assertEquals(set("*e"), first.get(nt('Y')));
		assertTrue(first.isEpsilonable(nt('X')));
		assertFalse(first.isEpsilonable(nt('S')));
	}

	@Test
	public void testFollowSetsOfExpressions(){
		FollowSets follow = grammar(Grammars.EXPRESSIONS_LL).calculateFollowSets();
		assertEquals(set(")$"), follow.get(nt('S')));
		assertEquals(set(")$"), follow.get(nt('X')));
		assertEquals(set("+)$"), follow.get(nt('T')));
		assertEquals(set("+)$"), follow.get(nt('Y')));
		assertEquals(set("*+)$"), follow.get(nt('F')));
	}

	@Test
	public void testFirstOfString(){
		FirstSets first = grammar(Grammars.EXPRESSIONS_LL).calculateFirstSets();
		assertEquals(set("e"), first.firstOfString(Collections.emptyList()));
		assertEquals(set("+*e"), first.firstOfString(Symbol.listOf("XY")));
		assertEquals(set("+*)"), first.firstOfString(Symbol.listOf("XY)")));
		assertEquals(set("+*$"), first.firstOfString(Arrays.asList(nt('X'), nt('Y'), EndMarker.INSTANCE)));
	}

	@Test
	public void testSymbolsOutsideOfTheGrammar(){
		FirstSets first = grammar("S -> a").calculateFirstSets();
		assertEquals(set("z"), first.get(new Terminal('z')));
		assertEquals(set("e"), first.get(Epsilon.INSTANCE));
		assertEquals(set("$"), first.get(EndMarker.INSTANCE));
		assertTrue(first.get(nt('Q')).isEmpty());
	}

	@Test
	public void testEpsilonFollowedByTerminal(){
		Grammar g = grammar("S -> AB", "A -> a e", "B -> b");
		assertEquals(set("b"), g.calculateFollowSets().get(nt('A')));
		assertEquals(set("$"), g.calculateFollowSets().get(nt('B')));
		assertEquals(set("ab"), g.calculateFirstSets().get(nt('S')));
	}

	@Test
	public void testNonTerminalWithoutProductions(){
		Grammar g = grammar("S -> aBc");
		assertTrue(g.calculateFirstSets().get(nt('B')).isEmpty());
		assertEquals(set("a"), g.calculateFirstSets().get(nt('S')));
		assertEquals(set("c"), g.calculateFollowSets().get(nt('B')));
	}

	@Test
	public void testStartFollowedByEndMarker(){
		FollowSets follow = grammar(Grammars.BALANCED).calculateFollowSets();
		assertEquals(set("b$"), follow.get(nt('S')));
		assertTrue(follow.get(nt('Q')).isEmpty());
	}

	@Test
	public void testLeftRecursion(){
		Grammar g = grammar(Grammars.EXPRESSIONS_LR);
		assertEquals(set("(i"), g.calculateFirstSets().get(nt('S')));
		assertEquals(set("+)$"), g.calculateFollowSets().get(nt('S')));
		assertEquals(set("+*)$"), g.calculateFollowSets().get(nt('F')));
	}

	@Test
	public void testToStringIsSorted(){
		FollowSets follow = grammar(Grammars.EXPRESSIONS_LL).calculateFollowSets();
		assertTrue(follow.toString().contains("FOLLOW(F) = { ) * + $ }"));
	}

	@Test
	public void testIterationLimit(){
		System.setProperty("cfg.maxIterations", "1");
		try {
			assertThrows(CFGException.class, () -> FirstSets.calculate(grammar("S -> A", "A -> a")));
		} finally {
			System.clearProperty("cfg.maxIterations");
		}
	}
}
