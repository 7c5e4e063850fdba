package pl.marcinmilkowski.rank_similarity.model;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable ranking of distinct items.
 *
 * The position of an item is its rank: rank 0 is the most relevant item.
 * Construction fails if any item occurs twice.
 *
 * @param <T> item type; must have consistent equals/hashCode
 */
public final class RankedList<T> {

    private final List<T> items;
    private final Map<T, Integer> ranks;

    private RankedList(List<T> source) {
        List<T> copy = new ArrayList<>(source.size());
        Map<T, Integer> index = new HashMap<>();
        for (int rank = 0; rank < source.size(); rank++) {
            T item = source.get(rank);
            if (item == null) {
                throw new IllegalArgumentException("Ranked list item at rank " + rank + " must not be null");
            }
            Integer previous = index.putIfAbsent(item, rank);
            if (previous != null) {
                throw new DuplicateItemException(item, previous, rank);
            }
            copy.add(item);
        }
        this.items = Collections.unmodifiableList(copy);
        this.ranks = index;
    }

    public static <T> RankedList<T> of(List<T> items) {
        if (items == null) {
            throw new IllegalArgumentException("items must not be null");
        }
        return new RankedList<>(items);
    }

    @SafeVarargs
    public static <T> RankedList<T> of(T... items) {
        if (items == null) {
            throw new IllegalArgumentException("items must not be null");
        }
        return new RankedList<>(Arrays.asList(items));
    }

    /**
     * Build a ranking from an untyped sequence: a {@link List}, an object array
     * or a primitive array. Primitive elements are boxed.
     *
     * @throws UnsupportedRankingTypeException for any other input, including sets and null
     */
    public static RankedList<Object> from(Object input) {
        if (input instanceof List<?> list) {
            return new RankedList<>(new ArrayList<Object>(list));
        }
        if (input != null && input.getClass().isArray()) {
            int length = Array.getLength(input);
            List<Object> boxed = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                boxed.add(Array.get(input, i));
            }
            return new RankedList<>(boxed);
        }
        throw new UnsupportedRankingTypeException(input);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Item at the given rank.
     *
     * @throws IndexOutOfBoundsException if rank is outside [0, size)
     */
    public T get(int rank) {
        return items.get(rank);
    }

    /**
     * Rank of the item, or -1 when the item is not ranked.
     */
    public int rankOf(T item) {
        Integer rank = ranks.get(item);
        return rank == null ? -1 : rank;
    }

    public boolean contains(Object item) {
        return ranks.containsKey(item);
    }

    public List<T> items() {
        return items;
    }

    /**
     * Ranks of the items of this list that belong to the subset, in list order.
     */
    public Map<T, Integer> ranksWithin(Set<T> subset) {
        Map<T, Integer> result = new LinkedHashMap<>();
        for (int rank = 0; rank < items.size(); rank++) {
            T item = items.get(rank);
            if (subset.contains(item)) {
                result.put(item, rank);
            }
        }
        return result;
    }

    /**
     * Items present in both lists, in the order of this list.
     */
    public Set<T> commonItems(RankedList<T> other) {
        Set<T> common = new LinkedHashSet<>();
        for (T item : items) {
            if (other.contains(item)) {
                common.add(item);
            }
        }
        return common;
    }

    @Override
    public String toString() {
        return "RankedList" + items;
    }
}
