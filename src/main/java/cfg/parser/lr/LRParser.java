package cfg.parser.lr;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import cfg.grammar.Production;
import cfg.grammar.Symbol;

import static cfg.util.Utils.tokenize;

/**
 * Implements a table driven SLR(1) recognizer.
 *
 * The stack holds (state, symbol) frames and starts with state 0. A word is accepted iff the accept
 * action is reached, every missing ACTION or GOTO entry rejects.
 */
public class LRParser {

	private static final Logger LOG = Logger.getLogger(LRParser.class.getName());

	private final LRParserTable table;

	public LRParser(LRParserTable table){
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
		ArrayList<StackFrame> stack = new ArrayList<>();
		stack.add(new StackFrame(0, null));
		int currentTokenNum = 0;
		while (true){
			Symbol current = tokens.get(currentTokenNum);
			int state = stack.get(stack.size() - 1).state;
			LRParserTable.Action action = table.getAction(state, current);
			if (action == null){
				return reject(String.format("no action for state %d at %s", state, current));
			}
			switch (action.name()){
				case "shift":
					stack.add(new StackFrame(((LRParserTable.ShiftAction)action).stateToBeShifted, current));
					currentTokenNum++;
					break;
				case "reduce":
					Production production = ((LRParserTable.ReduceAction)action).production;
					if (stack.size() <= production.rightSize()){
						return reject("stack underflow while reducing " + production);
					}
					for (int i = 0; i < production.rightSize(); i++){
						stack.remove(stack.size() - 1);
					}
					int newState = table.getGoto(stack.get(stack.size() - 1).state, production.left);
					if (newState == -1){
						return reject(String.format("no goto for state %d and %s",
								stack.get(stack.size() - 1).state, production.left));
					}
					stack.add(new StackFrame(newState, production.left));
					break;
				case "accept":
					return true;
				default:
					throw new AssertionError(action.name());
			}
		}
	}

	private static boolean reject(String reason){
		if (LOG.isLoggable(Level.FINER)){
			LOG.finer("Rejected: " + reason);
		}
		return false;
	}

	static class StackFrame {
		final int state;
		/**
		 * Symbol the state was entered with, null for the bottom frame
		 */
		final Symbol symbol;

		StackFrame(int state, Symbol symbol){
			this.state = state;
			this.symbol = symbol;
		}

		@Override
		public String toString() {
			return symbol == null ? Integer.toString(state) : symbol + "" + state;
		}
	}
}
