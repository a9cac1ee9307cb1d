package cfg.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for terminal symbols, non terminal symbols, epsilon and the end marker.
 *
 * The set of sub classes is closed (package private constructor), every symbol reports its {@link Kind}
 * and code that has to distinguish symbols switches over it.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	/**
	 * Kinds of symbols, declared in the order used by {@link #compareTo(Symbol)}
	 */
	public enum Kind {
		EPSILON, TERMINAL, NONTERMINAL, END_MARKER
	}

	public static final char EPSILON_CHAR = 'e';
	public static final char END_MARKER_CHAR = '$';

	/**
	 * Character that represents this symbol in grammar text
	 */
	public final char value;

	Symbol(char value) {
		this.value = value;
	}

	public abstract Kind kind();

	/**
	 * Classify a character of grammar text: uppercase ASCII letters are non terminals, <code>e</code> is
	 * epsilon, <code>$</code> is the end marker and everything else is a terminal.
	 */
	public static Symbol of(char c){
		if (c == EPSILON_CHAR){
			return Epsilon.INSTANCE;
		}
		if (c == END_MARKER_CHAR){
			return EndMarker.INSTANCE;
		}
		if (c >= 'A' && c <= 'Z'){
			return new NonTerminal(c);
		}
		return new Terminal(c);
	}

	public static List<Symbol> listOf(String text){
		List<Symbol> symbols = new ArrayList<>(text.length());
		for (int i = 0; i < text.length(); i++){
			symbols.add(of(text.charAt(i)));
		}
		return symbols;
	}

	public boolean isTerminal(){
		return kind() == Kind.TERMINAL;
	}

	public boolean isNonTerminal(){
		return kind() == Kind.NONTERMINAL;
	}

	public boolean isEpsilon(){
		return kind() == Kind.EPSILON;
	}

	public boolean isEndMarker(){
		return kind() == Kind.END_MARKER;
	}

	/**
	 * Can this symbol be a column of a parser table (terminal or end marker)?
	 */
	public boolean isLookahead(){
		return isTerminal() || isEndMarker();
	}

	@Override
	public int hashCode() {
		return kind().ordinal() * 65536 + value;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Symbol)){
			return false;
		}
		Symbol other = (Symbol)obj;
		return other.kind() == kind() && other.value == value;
	}

	@Override
	public int compareTo(Symbol o) {
		int cmp = kind().compareTo(o.kind());
		if (cmp != 0){
			return cmp;
		}
		return Character.compare(value, o.value);
	}

	@Override
	public String toString() {
		return String.valueOf(value);
	}
}
