package hexgame.internal;

/**
 * Disjoint-set forest with path compression.
 *
 * <p>Instead of union by rank or size, {@link #merge} always makes the <em>larger</em> root the
 * parent. Board edges live at the top of the index space, so they stay roots.
 *
 * <p>Implementors only decide where parents are kept. {@link #findRoot} rewrites parents even
 * though it is a query, so callers must treat every operation as mutating.
 *
 * @param <T> item type; ordering decides which root survives a merge
 */
public interface UnionFind<T extends Comparable<T>> {

  /** @return the parent of {@code item}, or {@code null} if {@code item} is a root. */
  T getParent(T item);

  void setParent(T item, T parent);

  default T findRoot(T item) {
    T root = item;
    for (T next = getParent(root); next != null; next = getParent(root)) {
      root = next;
    }

    // compress: point every visited item straight at the root
    T current = item;
    while (!current.equals(root)) {
      T next = getParent(current);
      setParent(current, root);
      current = next;
    }
    return root;
  }

  default void merge(T a, T b) {
    T rootA = findRoot(a);
    T rootB = findRoot(b);
    int cmp = rootA.compareTo(rootB);
    if (cmp > 0) {
      setParent(rootB, rootA);
    } else if (cmp < 0) {
      setParent(rootA, rootB);
    }
  }

  default boolean isInSameSet(T a, T b) {
    return findRoot(a).equals(findRoot(b));
  }
}
