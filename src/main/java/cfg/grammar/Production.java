package cfg.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A grammar production with a left and a right hand side.
 */
public class Production implements Serializable {

	/**
	 * Id of the production, its index in the grammar (the augmented start production comes last).
	 * Not part of the production's identity.
	 */
	public final int id;
	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production (doesn't include any epsilon if the right hand side consists of more than
	 * epsilons, is <code>[ε]</code> otherwise).
	 */
	public final List<Symbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final List<NonTerminal> nonTerminals;

	/**
	 * Terminals used in the right hand side
	 */
	public final List<Terminal> terminals;

	public Production(int id, NonTerminal left, List<Symbol> right) {
		this.id = id;
		this.left = left;
		List<Symbol> r = new ArrayList<>();
		for (Symbol sym : right){
			if (!sym.isEpsilon()){
				r.add(sym);
			}
		}
		if (r.isEmpty()){
			r.add(Epsilon.INSTANCE);
		}
		this.right = Collections.unmodifiableList(r);
		List<NonTerminal> nonTerminals = new ArrayList<>();
		List<Terminal> terminals = new ArrayList<>();
		for (Symbol symbol : r) {
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal)symbol);
			} else if (symbol instanceof Terminal){
				terminals.add((Terminal) symbol);
			}
		}
		this.nonTerminals = Collections.unmodifiableList(nonTerminals);
		this.terminals = Collections.unmodifiableList(terminals);
	}

	public String formatRightSide(){
		if (isEpsilonProduction()){
			return Epsilon.INSTANCE.toString();
		}
		StringBuilder builder = new StringBuilder();
		for (Symbol symbol : right) {
			builder.append(symbol);
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return left.toString() + " → " + formatRightSide();
	}

	/**
	 * Is the right hand side the empty word?
	 */
	public boolean isEpsilonProduction(){
		return right.get(0).isEpsilon();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, right);
	}

	/**
	 * Size of the right hand side, 0 for epsilon productions.
	 */
	public int rightSize(){
		return isEpsilonProduction() ? 0 : this.right.size();
	}
}
