package dev.modelkit.reflect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.EqualsAndHashCode;

/**
 * The arguments of one call: an ordered list of positional values followed by ordered keyword
 * values. Instances are immutable; the {@code with*} methods return copies.
 */
@EqualsAndHashCode
public final class Arguments {
    private static final Arguments EMPTY = new Arguments(List.of(), Map.of());

    private final List<Object> positional;
    private final Map<String, Object> keywords;

    private Arguments(List<Object> positional, Map<String, Object> keywords) {
        this.positional = Collections.unmodifiableList(new ArrayList<>(positional));
        this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    public static Arguments empty() {
        return EMPTY;
    }

    public static Arguments of(Object... positional) {
        return new Arguments(Arrays.asList(positional), Map.of());
    }

    public static Arguments of(List<?> positional, Map<String, ?> keywords) {
        return new Arguments(
                new ArrayList<Object>(positional), new LinkedHashMap<String, Object>(keywords));
    }

    public static Arguments ofKeywords(Map<String, ?> keywords) {
        return new Arguments(List.of(), new LinkedHashMap<String, Object>(keywords));
    }

    public List<Object> positional() {
        return positional;
    }

    public Map<String, Object> keywords() {
        return keywords;
    }

    @Nullable
    public Object keyword(String name) {
        return keywords.get(name);
    }

    public boolean hasKeyword(String name) {
        return keywords.containsKey(name);
    }

    /** Adds or replaces one keyword argument. */
    public Arguments with(String name, @Nullable Object value) {
        var copy = new LinkedHashMap<>(keywords);
        copy.put(name, value);
        return new Arguments(positional, copy);
    }

    /** Inserts {@code first} ahead of the positional arguments, the way a receiver is bound. */
    public Arguments prepend(@Nullable Object first) {
        var copy = new ArrayList<>(positional.size() + 1);
        copy.add(first);
        copy.addAll(positional);
        return new Arguments(copy, keywords);
    }

    /** Drops the named keyword arguments. Names that are not present are ignored. */
    public Arguments withoutKeywords(Collection<String> names) {
        if (names.stream().noneMatch(keywords::containsKey)) {
            return this;
        }
        var copy = new LinkedHashMap<>(keywords);
        copy.keySet().removeAll(names);
        return new Arguments(positional, copy);
    }

    @Override
    public String toString() {
        return "Arguments" + positional + keywords;
    }
}
