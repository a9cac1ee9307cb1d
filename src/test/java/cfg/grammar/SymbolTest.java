package cfg.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SymbolTest {

	@ParameterizedTest
	@ValueSource(chars = {'A', 'S', 'Z'})
	public void testUppercaseIsNonTerminal(char c){
		Symbol symbol = Symbol.of(c);
		assertTrue(symbol.isNonTerminal());
		assertEquals(new NonTerminal(c), symbol);
	}

	@ParameterizedTest
	@ValueSource(chars = {'a', 'z', '(', '+', '0'})
	public void testEverythingElseIsTerminal(char c){
		assertTrue(Symbol.of(c).isTerminal());
	}

	@Test
	public void testSpecialCharacters(){
		assertSame(Epsilon.INSTANCE, Symbol.of('e'));
		assertSame(EndMarker.INSTANCE, Symbol.of('$'));
		assertEquals("ε", Symbol.of('e').toString());
		assertTrue(Symbol.of('$').isLookahead());
		assertTrue(Symbol.of('a').isLookahead());
	}

	@Test
	public void testTerminalAndNonTerminalWithSameCharDiffer(){
		assertNotEquals(new Terminal('S'), new NonTerminal('S'));
	}

	@Test
	public void testAugmentedStart(){
		NonTerminal start = new NonTerminal('S');
		NonTerminal augmented = NonTerminal.augmentedStart(start);
		assertNotEquals(start, augmented);
		assertEquals("S'", augmented.toString());
	}

	@Test
	public void testTotalOrder(){
		List<Symbol> symbols = new ArrayList<>(Arrays.asList(EndMarker.INSTANCE, new NonTerminal('B'),
				new Terminal('b'), new NonTerminal('A'), Epsilon.INSTANCE, new Terminal('a')));
		Collections.sort(symbols);
		assertEquals(Arrays.asList(Epsilon.INSTANCE, new Terminal('a'), new Terminal('b'), new NonTerminal('A'),
				new NonTerminal('B'), EndMarker.INSTANCE), symbols);
	}
}
