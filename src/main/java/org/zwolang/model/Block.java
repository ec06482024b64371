package org.zwolang.model;

import io.vavr.control.Option;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One {@code KIND { params }} unit. Parameters keep their source order.
 */
public record Block(Tag kind, Map<Tag, Value> params, List<Message> messages) {

    public Block {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        messages = List.copyOf(messages);
    }

    public static Block block(Tag kind, Map<Tag, Value> params) {
        return new Block(kind, params, List.of());
    }

    public Option<Value> param(Tag key) {
        return Option.of(params.get(key));
    }

    public boolean has(Tag key) {
        return params.containsKey(key);
    }
}
