package io.apiversioner.core.strategy;

import io.apiversioner.core.model.RequestView;
import io.apiversioner.core.model.StrategyKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Groups several strategies under one priority slot. Children are evaluated by ascending priority
 * (declaration order on ties) and the first token wins.
 */
public final class CompositeStrategy implements VersionStrategy {

    private final int priority;
    private final List<VersionStrategy> children;

    public CompositeStrategy(int priority, List<VersionStrategy> children) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("composite strategy requires at least one child");
        }
        this.priority = priority;
        List<VersionStrategy> sorted = new ArrayList<>(children);
        // List.sort is stable, which keeps declaration order for equal priorities
        sorted.sort(Comparator.comparingInt(VersionStrategy::priority));
        this.children = List.copyOf(sorted);
    }

    @Override
    public String name() {
        return "composite";
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.COMPOSITE;
    }

    @Override
    public int priority() {
        return priority;
    }

    /** Children in evaluation order. */
    public List<VersionStrategy> children() {
        return children;
    }

    @Override
    public Optional<String> extract(RequestView request) {
        for (VersionStrategy child : children) {
            Optional<String> token = child.extract(request);
            if (token.isPresent()) {
                return token;
            }
        }
        return Optional.empty();
    }

    @Override
    public String routePath(String path) {
        String result = path;
        for (VersionStrategy child : children) {
            result = child.routePath(result);
        }
        return result;
    }
}
