package cfg.parser.ll;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import cfg.grammar.EndMarker;
import cfg.grammar.NonTerminal;
import cfg.grammar.Production;
import cfg.grammar.Symbol;

import static cfg.util.Utils.tokenize;

/**
 * Implements a table driven LL(1) recognizer.
 *
 * The stack starts as <code>[$, S]</code> (end marker at the bottom), the input is followed by the end
 * marker. A word is accepted iff the stack becomes empty exactly when the end marker is consumed.
 */
public class LLParser {

	private static final Logger LOG = Logger.getLogger(LLParser.class.getName());

	private final LLParserTable table;

	public LLParser(LLParserTable table){
		this.table = table;
	}

	/**
	 * Every character of the input is a terminal, characters that aren't in the grammar's alphabet lead
	 * to a rejection.
	 *
	 * @return is the input a word of the grammar?
	 */
	public boolean parse(String input){
		List<Symbol> tokens = tokenize(input);
		ArrayList<Symbol> stack = new ArrayList<>();
		stack.add(EndMarker.INSTANCE);
		stack.add(table.grammar.getStart());
		int currentTokenNum = 0;
		while (!stack.isEmpty()){
			if (currentTokenNum >= tokens.size()){
				return reject("input exhausted with non empty stack " + stack);
			}
			Symbol current = tokens.get(currentTokenNum);
			Symbol top = stack.get(stack.size() - 1);
			if (top.equals(current)){
				pop(stack);
				currentTokenNum++;
				continue;
			}
			switch (top.kind()){
				case NONTERMINAL:
					Production production = table.get((NonTerminal)top, current);
					if (production == null){
						return reject(String.format("no production for M[%s, %s]", top, current));
					}
					pop(stack);
					if (!production.isEpsilonProduction()){
						for (int i = production.right.size() - 1; i >= 0; i--){
							stack.add(production.right.get(i));
						}
					}
					break;
				case TERMINAL:
				case END_MARKER:
				case EPSILON:
					return reject(String.format("expected %s but got %s", top, current));
				default:
					throw new AssertionError(top.kind());
			}
		}
		return currentTokenNum == tokens.size();
	}

	private static Symbol pop(ArrayList<Symbol> stack){
		return stack.remove(stack.size() - 1);
	}

	private static boolean reject(String reason){
		if (LOG.isLoggable(Level.FINER)){
			LOG.finer("Rejected: " + reason);
		}
		return false;
	}
}
