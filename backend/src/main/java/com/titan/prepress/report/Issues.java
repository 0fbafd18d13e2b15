package com.titan.prepress.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Append-only sequence of issues threaded through the pipeline stages.
 * Every {@code plus} returns a new instance; existing instances never change.
 */
public final class Issues implements Iterable<Issue> {

    private static final Issues EMPTY = new Issues(List.of());

    private final List<Issue> items;

    private Issues(List<Issue> items) {
        this.items = items;
    }

    public static Issues empty() {
        return EMPTY;
    }

    public Issues plus(Issue issue) {
        List<Issue> next = new ArrayList<>(items.size() + 1);
        next.addAll(items);
        next.add(issue);
        return new Issues(Collections.unmodifiableList(next));
    }

    public Issues plus(Issues other) {
        if (other.items.isEmpty()) {
            return this;
        }
        List<Issue> next = new ArrayList<>(items.size() + other.items.size());
        next.addAll(items);
        next.addAll(other.items);
        return new Issues(Collections.unmodifiableList(next));
    }

    public List<Issue> asList() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean containsCode(String code) {
        return items.stream().anyMatch(i -> i.getCode().equals(code));
    }

    public IssueCounts counts() {
        return IssueCounts.of(items);
    }

    @Override
    public Iterator<Issue> iterator() {
        return items.iterator();
    }
}
