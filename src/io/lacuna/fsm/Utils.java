package io.lacuna.fsm;

import io.lacuna.bifurcan.*;

import java.util.function.Function;
import java.util.stream.Stream;

public class Utils {

  private Utils() {
  }

  public static <V> LinearSet<V> toSet(Stream<V> s) {
    return s.collect(Sets.linearCollector());
  }

  public static <K, V> LinearMap<K, LinearList<V>> groupBy(Iterable<V> vals, Function<V, K> f) {
    LinearMap<K, LinearList<V>> m = new LinearMap<>();
    vals.forEach(v -> m.getOrCreate(f.apply(v), LinearList::new).addLast(v));
    return m;
  }

  /**
   * @return true if both sets have the same members, irrespective of iteration order
   */
  public static <V> boolean sameMembers(ISet<V> a, ISet<V> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (V v : a) {
      if (!b.contains(v)) {
        return false;
      }
    }
    return true;
  }

  public static <V> IList<V> append(IList<V> list, V value) {
    LinearList<V> result = new LinearList<>();
    list.forEach(result::addLast);
    result.addLast(value);
    return result.forked();
  }
}
