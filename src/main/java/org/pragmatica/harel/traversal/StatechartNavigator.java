package org.pragmatica.harel.traversal;

import org.pragmatica.harel.model.QualifiedName;
import org.pragmatica.harel.model.Region;
import org.pragmatica.harel.model.State;
import org.pragmatica.harel.model.Statechart;
import org.pragmatica.harel.model.Transition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only queries over a built statechart.
 *
 * <p>Creating a navigator walks the tree once to record each state's parent, owning region and qualified
 * name. After that every query only visits the part of the tree it needs. States are tracked by identity,
 * so two equal declarations (e.g. duplicated siblings) stay distinct. Instances are immutable and may be
 * shared between threads.
 */
public final class StatechartNavigator {
    private final Statechart statechart;
    private final Map<State, Placement> placements;
    private final List<State> preOrder;

    private StatechartNavigator(Statechart statechart) {
        this.statechart = statechart;
        var placements = new IdentityHashMap<State, Placement>();
        var preOrder = new ArrayList<State>();
        index(statechart.region(), null, QualifiedName.ROOT, placements, preOrder);
        this.placements = Collections.unmodifiableMap(placements);
        this.preOrder = List.copyOf(preOrder);
    }

    public static StatechartNavigator of(Statechart statechart) {
        return new StatechartNavigator(statechart);
    }

    private record Placement(State parent, Region region, int regionIndex, QualifiedName name) {}

    private static void index(Region region, State parent, QualifiedName prefix,
                              Map<State, Placement> placements, List<State> preOrder) {
        int regionIndex = parent == null ? 0 : indexOfRegion(parent, region);
        for (var state : region.states()) {
            var name = prefix.child(state.name());
            placements.put(state, new Placement(parent, region, regionIndex, name));
            preOrder.add(state);
            for (var child : state.regions()) {
                index(child, state, name, placements, preOrder);
            }
        }
    }

    private static int indexOfRegion(State parent, Region region) {
        var regions = parent.regions();
        for (int i = 0; i < regions.size(); i++) {
            if (regions.get(i) == region) {
                return i;
            }
        }
        return 0;
    }

    public Statechart statechart() {
        return statechart;
    }

    /**
     * Find a state by its path from the root. Empty when no state or more than one state matches.
     */
    public Optional<State> findState(QualifiedName path) {
        return findIn(statechart.region(), path);
    }

    public Optional<State> findState(String path) {
        if (path.isEmpty()) {
            return Optional.empty();
        }
        try {
            return findState(QualifiedName.parse(path));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * The single state the path names from the given region, or empty when none or several match.
     */
    public static Optional<State> findIn(Region region, QualifiedName path) {
        return single(findAllIn(region, path));
    }

    /**
     * Every state the path names when walked from the given region. Each segment is matched against all
     * regions of the states found for the previous segment, so a path through an orthogonal state, or
     * through duplicated siblings, may match more than once.
     */
    public static List<State> findAllIn(Region region, QualifiedName path) {
        if (path.isRoot()) {
            return List.of();
        }
        List<Region> scope = List.of(region);
        List<State> found = List.of();
        for (var segment : path.segments()) {
            var matches = new ArrayList<State>();
            for (var candidates : scope) {
                for (var state : candidates.states()) {
                    if (state.name().equals(segment)) {
                        matches.add(state);
                    }
                }
            }
            if (matches.isEmpty()) {
                return List.of();
            }
            found = matches;
            scope = matches.stream()
                           .flatMap(state -> state.regions().stream())
                           .toList();
        }
        return List.copyOf(found);
    }

    /**
     * Resolve a transition target as seen from {@code source}: first relative to the source's own region,
     * then to each enclosing region outwards, up to the top-level region. Returns every match of the
     * innermost scope where the path matches at all.
     */
    public List<State> resolveAll(State source, QualifiedName path) {
        var placement = placementOf(source);
        Region region = placement.region();
        State owner = placement.parent();
        while (true) {
            var found = findAllIn(region, path);
            if (!found.isEmpty()) {
                return found;
            }
            if (owner == null) {
                return List.of();
            }
            var ownerPlacement = placementOf(owner);
            region = ownerPlacement.region();
            owner = ownerPlacement.parent();
        }
    }

    /**
     * Like {@link #resolveAll(State, QualifiedName)}, but empty unless exactly one state matches.
     */
    public Optional<State> resolve(State source, QualifiedName path) {
        return single(resolveAll(source, path));
    }

    private static Optional<State> single(List<State> states) {
        return states.size() == 1
               ? Optional.of(states.get(0))
               : Optional.empty();
    }

    /**
     * Direct children flattened across regions in declaration order.
     */
    public List<Child> children(State state) {
        var children = new ArrayList<Child>();
        var regions = state.regions();
        for (int i = 0; i < regions.size(); i++) {
            for (var child : regions.get(i).states()) {
                children.add(new Child(child, i));
            }
        }
        return children;
    }

    public List<Transition> outgoingTransitions(State state) {
        return state.transitions();
    }

    /**
     * States from the top level down to and including {@code state}.
     */
    public List<State> ancestorChain(State state) {
        var chain = new ArrayList<State>();
        State cursor = state;
        while (cursor != null) {
            chain.add(cursor);
            cursor = placementOf(cursor).parent();
        }
        Collections.reverse(chain);
        return chain;
    }

    public Optional<State> parent(State state) {
        return Optional.ofNullable(placementOf(state).parent());
    }

    /**
     * Region directly containing the state.
     */
    public Region regionOf(State state) {
        return placementOf(state).region();
    }

    /**
     * Index of the containing region within the parent's regions; 0 for top-level states.
     */
    public int regionIndexOf(State state) {
        return placementOf(state).regionIndex();
    }

    public QualifiedName qualifiedName(State state) {
        return placementOf(state).name();
    }

    public boolean contains(State state) {
        return placements.containsKey(state);
    }

    /**
     * True when {@code candidate} is {@code ancestor} itself or nested anywhere below it.
     */
    public boolean isWithin(State candidate, State ancestor) {
        State cursor = candidate;
        while (cursor != null) {
            if (cursor == ancestor) {
                return true;
            }
            cursor = placementOf(cursor).parent();
        }
        return false;
    }

    /**
     * All states in pre-order (parents before children, siblings in declaration order).
     */
    public List<State> states() {
        return preOrder;
    }

    private Placement placementOf(State state) {
        var placement = placements.get(state);
        if (placement == null) {
            throw new IllegalArgumentException("State '" + state.name() + "' does not belong to statechart '"
                                               + statechart.name() + "'");
        }
        return placement;
    }
}
