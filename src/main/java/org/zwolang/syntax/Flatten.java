package org.zwolang.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Collects typed entries out of arbitrarily nested visit results.
 */
public final class Flatten {
    private Flatten() {}

    /**
     * Return every entry payload of the given type, in document order.
     * Groups are descended into; entries are never descended into, whatever their type.
     */
    public static <T> List<T> flatten(Visited root, Class<T> kind) {
        var found = new ArrayList<T>();
        var iterators = new ArrayDeque<Iterator<Visited>>();
        iterators.push(List.of(root).iterator());

        while (!iterators.isEmpty()) {
            var top = iterators.peek();
            if (!top.hasNext()) {
                iterators.pop();
                continue;
            }
            var item = top.next();
            if (item instanceof Visited.Group group) {
                iterators.push(group.items().iterator());
            } else if (item instanceof Visited.Entry entry && kind.isInstance(entry.payload())) {
                found.add(kind.cast(entry.payload()));
            }
        }
        return found;
    }
}
