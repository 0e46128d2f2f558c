package dumb.deduce.util;

import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.UnaryOperator;

public enum Lists {
    ;

    /**
     * Pairwise comparison of two lists with a custom equivalence.
     */
    public static <T> boolean equals(List<? extends T> a, List<? extends T> b, BiPredicate<? super T, ? super T> eq) {
        var s = a.size();
        if (s != b.size()) return false;
        for (var i = 0; i < s; i++)
            if (!eq.test(a.get(i), b.get(i))) return false;
        return true;
    }

    /**
     * Maps every element, returning {@code list} itself when each mapped element is the same instance as the original.
     */
    public static <T> List<T> mapShared(List<T> list, UnaryOperator<T> f) {
        Object[] mapped = null;
        var s = list.size();
        for (var i = 0; i < s; i++) {
            var x = list.get(i);
            var y = f.apply(x);
            if (y != x && mapped == null) {
                mapped = list.toArray();
            }
            if (mapped != null) mapped[i] = y;
        }
        if (mapped == null) return list;
        @SuppressWarnings("unchecked") var result = (List<T>) List.of(mapped);
        return result;
    }

    /**
     * Adds {@code x} unless an element equivalent under {@code eq} is already present.
     */
    public static <T> boolean addIfAbsent(List<T> list, T x, BiPredicate<? super T, ? super T> eq) {
        for (var y : list)
            if (eq.test(y, x)) return false;
        return list.add(x);
    }
}
