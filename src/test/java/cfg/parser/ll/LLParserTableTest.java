package cfg.parser.ll;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import cfg.CFGException;
import cfg.Grammars;
import cfg.grammar.EndMarker;
import cfg.grammar.Grammar;
import cfg.grammar.NonTerminal;
import cfg.grammar.Production;
import cfg.grammar.Symbol;
import cfg.grammar.Terminal;
import cfg.util.BuildResult;

import static cfg.Grammars.grammar;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LLParserTableTest {

	private static LLParserTable table(String... lines){
		BuildResult<LLParserTable, LLConflict> result = LLParserTable.fromGrammar(grammar(lines));
		assertTrue(result.isSuccess(), () -> result.toString());
		return result.get();
	}

	private static LLConflict conflict(String... lines){
		BuildResult<LLParserTable, LLConflict> result = LLParserTable.fromGrammar(grammar(lines));
		assertFalse(result.isSuccess());
		return result.conflict();
	}

	private static Production production(int id, String text){
		String[] parts = text.split(" -> ");
		return new Production(id, new NonTerminal(parts[0].charAt(0)), Symbol.listOf(parts[1]));
	}

	@Nested
	class Building {

		@Test
		public void testExpressionTable(){
			LLParserTable table = table(Grammars.EXPRESSIONS_LL);
			assertEquals(13, table.size());
			NonTerminal x = new NonTerminal('X');
			assertEquals(production(1, "X -> +TX"), table.get(x, new Terminal('+')));
			assertEquals(production(2, "X -> e"), table.get(x, new Terminal(')')));
			assertEquals(production(2, "X -> e"), table.get(x, EndMarker.INSTANCE));
			assertNull(table.get(x, new Terminal('i')));
			assertNull(table.get(new NonTerminal('Q'), new Terminal('i')));
		}

		@Test
		public void testEpsilonViaFollow(){
			LLParserTable table = table("S -> AB", "A -> a e", "B -> b");
			NonTerminal a = new NonTerminal('A');
			assertEquals(production(1, "A -> a"), table.get(a, new Terminal('a')));
			assertEquals(production(2, "A -> e"), table.get(a, new Terminal('b')));
			assertNull(table.get(a, EndMarker.INSTANCE));
		}

		@Test
		public void testLeftRecursionConflicts(){
			LLConflict conflict = conflict(Grammars.EXPRESSIONS_LR);
			assertEquals(new NonTerminal('S'), conflict.nonTerminal);
			assertEquals(new Terminal('('), conflict.lookahead);
			assertEquals(production(0, "S -> S+T"), conflict.existing);
			assertEquals(production(1, "S -> T"), conflict.conflicting);
			assertFalse(conflict.viaFollow);
		}

		@Test
		public void testConflictViaFollow(){
			LLConflict conflict = conflict("S -> Ab", "A -> b e");
			assertEquals(new Terminal('b'), conflict.lookahead);
			assertEquals(production(1, "A -> b"), conflict.existing);
			assertEquals(production(2, "A -> e"), conflict.conflicting);
			assertTrue(conflict.viaFollow);
			assertEquals("Not LL(1): conflict at M[A, b] (via FOLLOW) between A → b and A → ε", conflict.toString());
		}

		@Test
		public void testConflictIsDeterministic(){
			assertEquals(conflict(Grammars.ASSIGNMENTS), conflict(Grammars.ASSIGNMENTS));
			assertEquals(table(Grammars.EXPRESSIONS_LL), table(Grammars.EXPRESSIONS_LL));
		}

		@Test
		public void testFailFastAccess(){
			BuildResult<LLParserTable, LLConflict> result = LLParserTable.fromGrammar(grammar(Grammars.LEFT_RECURSIVE));
			CFGException ex = assertThrows(CFGException.class, result::get);
			assertEquals(result.conflict().toString(), ex.getMessage());
		}

		@Test
		public void testToString(){
			LLParserTable table = table(Grammars.BALANCED);
			assertEquals("M[S, a] = S → aSb\nM[S, b] = S → ε\nM[S, $] = S → ε", table.toString());
		}
	}

	@Nested
	class Parsing {

		private final LLParserTable expressions = table(Grammars.EXPRESSIONS_LL);
		private final LLParserTable balanced = table(Grammars.BALANCED);

		@ParameterizedTest
		@ValueSource(strings = {"i", "i+i", "i+i*i", "(i)", "((i+i)*i)+i"})
		public void testAcceptedExpressions(String input){
			assertTrue(expressions.parse(input));
		}

		@ParameterizedTest
		@ValueSource(strings = {"", "i+", "+i", "(i", "i)", "ii", "I", "i$", "i e"})
		public void testRejectedExpressions(String input){
			assertFalse(expressions.parse(input));
		}

		@Test
		public void testBalanced(){
			assertTrue(balanced.parse(""));
			assertTrue(balanced.parse("ab"));
			assertTrue(balanced.parse("aabb"));
			assertFalse(balanced.parse("abab"));
			assertFalse(balanced.parse("a"));
			assertFalse(balanced.parse("b"));
		}

		@Test
		public void testEpsilonAlternatives(){
			LLParserTable table = table(Grammars.EMPTY_PREFIXES);
			assertTrue(table.parse("ab"));
			assertTrue(table.parse("ba"));
			assertFalse(table.parse("aa"));
			assertFalse(table.parse(""));
		}

		@Test
		public void testNonTerminalWithoutProductions(){
			Grammar g = grammar("S -> a aB");
			BuildResult<LLParserTable, LLConflict> result = LLParserTable.fromGrammar(g);
			assertFalse(result.isSuccess());
			LLParserTable table = table("S -> aB b", "B -> Cc e");
			assertTrue(table.parse("a"));
			assertTrue(table.parse("b"));
			assertFalse(table.parse("ac"));
		}
	}
}
