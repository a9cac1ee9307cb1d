package cfg.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

import cfg.grammar.EndMarker;
import cfg.grammar.Symbol;
import cfg.grammar.Terminal;

/**
 * Class with utility methods...
 */
public class Utils {

	/**
	 * Joins the string representations of several objects passed via a list.
	 *
	 * @param strs passed list of objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(List<T> strs, String separator){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < strs.size(); i++){
			if (i != 0){
				builder.append(separator);
			}
			builder.append(strs.get(i));
		}
		return builder.toString();
	}

	/**
	 * Copy of the passed collection in its natural order
	 */
	public static <T extends Comparable<? super T>> List<T> sorted(Collection<T> elements){
		List<T> ret = new ArrayList<>(elements);
		Collections.sort(ret);
		return ret;
	}

	/**
	 * Format a set of symbols in the total symbol order, like <code>{ a b $ }</code>
	 */
	public static String formatSymbolSet(Collection<? extends Symbol> symbols){
		List<Symbol> list = new ArrayList<>(symbols);
		Collections.sort(list);
		StringBuilder builder = new StringBuilder("{");
		for (Symbol symbol : list){
			builder.append(" ").append(symbol);
		}
		return builder.append(" }").toString();
	}

	/**
	 * Input symbols of the passed string: every character becomes a terminal (whatever its class in
	 * grammar text), followed by the end marker.
	 */
	public static List<Symbol> tokenize(String input){
		List<Symbol> tokens = new ArrayList<>(input.length() + 1);
		for (int i = 0; i < input.length(); i++){
			tokens.add(new Terminal(input.charAt(i)));
		}
		tokens.add(EndMarker.INSTANCE);
		return tokens;
	}

	/**
	 * Creates a REPL for a recognizer and prints <code>yes</code> or <code>no</code> for every entered string.
	 *
	 * The user can end the REPL by entering an empty line (or by closing the input).
	 *
	 * @param input source of the entered strings, surrounding whitespace is ignored
	 * @param output destination of the answers
	 * @param accepts recognizer
	 */
	public static void parserRepl(BufferedReader input, PrintStream output, Predicate<String> accepts) throws IOException {
		String line;
		while ((line = input.readLine()) != null && !line.trim().isEmpty()){
			output.println(accepts.test(line.trim()) ? "yes" : "no");
		}
	}
}
