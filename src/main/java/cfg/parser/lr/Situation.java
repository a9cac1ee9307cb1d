package cfg.parser.lr;

import java.io.Serializable;
import java.util.Objects;

import cfg.grammar.Production;
import cfg.grammar.Symbol;

/**
 * An LR(0) item: a production with a dot marking how much of its right hand side has been recognized.
 * The dot of an epsilon production is always at the end.
 */
public class Situation implements Serializable, Comparable<Situation> {

	public final Production production;

	/**
	 * Position of the dot, in [0, production.rightSize()]
	 */
	public final int position;

	public Situation(Production production, int position) {
		if (position < 0 || position > production.rightSize()){
			throw new IllegalArgumentException("Dot position " + position + " out of range for " + production);
		}
		this.production = production;
		this.position = position;
	}

	public Situation(Production production){
		this(production, 0);
	}

	public boolean canAdvance(){
		return position < production.rightSize();
	}

	public Situation advance(){
		if (!canAdvance()){
			throw new IllegalStateException("Can't advance " + this);
		}
		return new Situation(production, position + 1);
	}

	/**
	 * @return symbol right after the dot or null if the dot is at the end
	 */
	public Symbol nextSymbol(){
		if (canAdvance()){
			return production.right.get(position);
		}
		return null;
	}

	public boolean inFrontOfNonTerminal(){
		return canAdvance() && nextSymbol().isNonTerminal();
	}

	public boolean inFrontOfTerminal(){
		return canAdvance() && nextSymbol().isTerminal();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Situation)){
			return false;
		}
		Situation other = (Situation)obj;
		return position == other.position && production.equals(other.production);
	}

	@Override
	public int hashCode() {
		return Objects.hash(production, position);
	}

	/**
	 * Orders by production id, then by dot position
	 */
	@Override
	public int compareTo(Situation o) {
		int cmp = Integer.compare(production.id, o.production.id);
		if (cmp != 0){
			return cmp;
		}
		return Integer.compare(position, o.position);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append(production.left).append(" → ");
		for (int i = 0; i < production.rightSize(); i++) {
			if (i == position){
				builder.append("•");
			}
			builder.append(production.right.get(i));
		}
		if (!canAdvance()){
			builder.append("•");
		}
		return builder.toString();
	}
}
