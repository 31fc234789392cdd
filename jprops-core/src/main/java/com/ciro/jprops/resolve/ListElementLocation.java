package com.ciro.jprops.resolve;

import java.util.List;

public record ListElementLocation(List<Object> list, int index) implements Location {

    @Override
    public Object get() {
        return list.get(index);
    }

    @Override
    public void set(Object value) {
        list.set(index, value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ListElementLocation l && l.list == list && l.index == index;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(list) + index;
    }
}
