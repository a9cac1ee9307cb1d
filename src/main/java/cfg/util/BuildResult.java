package cfg.util;

import java.util.Objects;

import cfg.CFGException;

/**
 * Outcome of building a parser table: either the table or the conflict that prevented it.
 *
 * Both outcomes are expected, a grammar that isn't LL(1) might still be SLR(1) and vice versa.
 *
 * @param <T> type of the table
 * @param <C> type of the conflict
 */
public final class BuildResult<T, C> {

	private final T table;
	private final C conflict;

	private BuildResult(T table, C conflict) {
		this.table = table;
		this.conflict = conflict;
	}

	public static <T, C> BuildResult<T, C> success(T table){
		return new BuildResult<>(Objects.requireNonNull(table), null);
	}

	public static <T, C> BuildResult<T, C> failure(C conflict){
		return new BuildResult<>(null, Objects.requireNonNull(conflict));
	}

	public boolean isSuccess(){
		return table != null;
	}

	/**
	 * @throws CFGException describing the conflict if building the table failed
	 */
	public T get(){
		if (table == null){
			throw new CFGException(conflict.toString());
		}
		return table;
	}

	/**
	 * @throws IllegalStateException if building the table succeeded
	 */
	public C conflict(){
		if (conflict == null){
			throw new IllegalStateException("No conflict, the table was built");
		}
		return conflict;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof BuildResult)){
			return false;
		}
		BuildResult<?, ?> other = (BuildResult<?, ?>)obj;
		return Objects.equals(table, other.table) && Objects.equals(conflict, other.conflict);
	}

	@Override
	public int hashCode() {
		return Objects.hash(table, conflict);
	}

	@Override
	public String toString() {
		return isSuccess() ? "success(" + table + ")" : "failure(" + conflict + ")";
	}
}
