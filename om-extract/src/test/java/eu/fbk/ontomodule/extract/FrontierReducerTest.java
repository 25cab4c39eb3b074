package eu.fbk.ontomodule.extract;

import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Sets;

import org.junit.Assert;
import org.junit.Test;

public class FrontierReducerTest {

    private static final String ROOT = HierarchyResolver.ROOT;

    // a -> b -> c -> ROOT, a -> d (top level), e -> ROOT
    private static final Hierarchy UP = Hierarchy.create(ImmutableSetMultimap
            .<String, String>builder().put("a", "b").put("b", "c").put("c", ROOT).put("a", "d")
            .put("e", ROOT).build());

    // p -> c1 -> g, p -> c2
    private static final Hierarchy DOWN = Hierarchy.create(ImmutableSetMultimap.of("p", "c1",
            "p", "c2", "c1", "g"));

    private static final Hierarchy CYCLE = Hierarchy.create(ImmutableSetMultimap.of("x", "y",
            "y", "x"));

    // top -> l -> bottom, top -> r -> bottom, r -> side
    private static final Hierarchy DIAMOND = Hierarchy.create(ImmutableSetMultimap
            .<String, String>builder().put("top", "l").put("top", "r").put("l", "bottom")
            .put("r", "bottom").put("r", "side").build());

    // s -> u -> v -> u, v -> w
    private static final Hierarchy CYCLE_WITH_EXIT = Hierarchy.create(ImmutableSetMultimap.of(
            "s", "u", "u", "v", "v", "u", "v", "w"));

    @Test
    public void testNearestStopsAtFrontier() {
        Assert.assertEquals(ImmutableSet.of("b", "d"),
                FrontierReducer.nearestFrontierAncestors(UP, "a", ImmutableSet.of("a", "b")));
        Assert.assertEquals(ImmutableSet.of("c", "d"),
                FrontierReducer.nearestFrontierAncestors(UP, "a", ImmutableSet.of("a")));
    }

    @Test
    public void testNearestOfTopLevelTerm() {
        Assert.assertEquals(ImmutableSet.of("e"),
                FrontierReducer.nearestFrontierAncestors(UP, "e", ImmutableSet.of("a")));
        Assert.assertEquals(ImmutableSet.of("unknown"), FrontierReducer
                .nearestFrontierAncestors(UP, "unknown", ImmutableSet.<String>of()));
    }

    @Test
    public void testCappedAncestors() {
        Assert.assertEquals(ImmutableSet.of("b", "c", "d"),
                FrontierReducer.cappedAncestors(UP, ImmutableSet.of("a"), "a"));
        Assert.assertEquals(ImmutableSet.of("b", "d"),
                FrontierReducer.cappedAncestors(UP, ImmutableSet.of("a", "b"), "a"));
        Assert.assertTrue(FrontierReducer.cappedAncestors(UP, ImmutableSet.of("e"), "e")
                .isEmpty());
    }

    @Test
    public void testCappedIncludesNearest() {
        for (final Set<String> frontier : ImmutableSet.<Set<String>>of(ImmutableSet.of("a"),
                ImmutableSet.of("a", "b"), ImmutableSet.of("a", "c"), ImmutableSet.of("e"))) {
            for (final String term : ImmutableSet.of("a", "b", "c", "d", "e")) {
                final Set<String> capped = Sets.union(
                        FrontierReducer.cappedAncestors(UP, frontier, term),
                        ImmutableSet.of(term));
                Assert.assertTrue(capped.containsAll(FrontierReducer.nearestFrontierAncestors(
                        UP, term, frontier)));
            }
        }
    }

    @Test
    public void testDescendants() {
        Assert.assertEquals(ImmutableSet.of("c2", "g"),
                FrontierReducer.bottomDescendants(DOWN, "p"));
        Assert.assertEquals(ImmutableSet.of("c1", "c2", "g"),
                FrontierReducer.allDescendants(DOWN, "p"));
    }

    @Test
    public void testLeavesOfChildrenAreLeavesOfParent() {
        for (final Hierarchy hierarchy : ImmutableList.of(DOWN, DIAMOND, CYCLE,
                CYCLE_WITH_EXIT)) {
            final Set<String> terms = Sets.newHashSet(hierarchy.asMultimap().keySet());
            terms.addAll(hierarchy.asMultimap().values());
            for (final String term : terms) {
                final Set<String> union = Sets.newHashSet();
                for (final String child : hierarchy.get(term)) {
                    union.addAll(FrontierReducer.bottomDescendants(hierarchy, child));
                }
                Assert.assertEquals("leaves of " + term, Sets.difference(
                        FrontierReducer.bottomDescendants(hierarchy, term),
                        ImmutableSet.of(term)), union);
            }
        }
    }

    @Test
    public void testLeafIsItsOwnBottom() {
        Assert.assertEquals(ImmutableSet.of("g"), FrontierReducer.bottomDescendants(DOWN, "g"));
        Assert.assertTrue(FrontierReducer.allDescendants(DOWN, "g").isEmpty());
    }

    @Test
    public void testCyclesTerminate() {
        final Set<String> frontier = ImmutableSet.of("x");
        Assert.assertEquals(ImmutableSet.of("x"),
                FrontierReducer.nearestFrontierAncestors(CYCLE, "x", frontier));
        Assert.assertEquals(ImmutableSet.of("x", "y"),
                FrontierReducer.cappedAncestors(CYCLE, frontier, "x"));
        Assert.assertEquals(ImmutableSet.of("x", "y"), FrontierReducer.allDescendants(CYCLE,
                "x"));
        Assert.assertTrue(FrontierReducer.bottomDescendants(CYCLE, "x").isEmpty());
    }

}
