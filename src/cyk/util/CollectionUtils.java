package cyk.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @author Dan Klein
 */
public class CollectionUtils
{
    public static <E extends Comparable<E>> List<E> sort(Collection<E> c)
    {
        List<E> list = new ArrayList<E>(c);
        Collections.sort(list);
        return list;
    }

    public static <E> List<E> sort(Collection<E> c, Comparator<E> r)
    {
        List<E> list = new ArrayList<E>(c);
        Collections.sort(list, r);
        return list;
    }

    /** Adds to an insertion-ordered value set, creating it on first use. */
    public static <K, V> boolean addToValueSet(Map<K, Set<V>> map, K key, V value)
    {
        Set<V> values = map.get(key);
        if (values == null)
        {
            values = new LinkedHashSet<V>();
            map.put(key, values);
        }
        return values.add(value);
    }

    public static <K, V> Set<V> getValueSet(Map<K, Set<V>> map, K key)
    {
        Set<V> valueSet = map.get(key);
        if (valueSet == null) return Collections.emptySet();
        return valueSet;
    }

    /**
     * Lexicographic order over lists, shorter lists first. Used to print
     * production bodies in a stable order.
     */
    public static <E extends Comparable<E>> Comparator<List<E>> lengthFirstComparator()
    {
        return new Comparator<List<E>>()
        {
            public int compare(List<E> o1, List<E> o2)
            {
                if (o1.size() != o2.size()) return o1.size() - o2.size();
                for (int i = 0; i < o1.size(); i++)
                {
                    int c = o1.get(i).compareTo(o2.get(i));
                    if (c != 0) return c;
                }
                return 0;
            }
        };
    }
}
