package com.hcltech.toposcc.idgraph;

import com.hcltech.toposcc.graph.SortResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hcltech.toposcc.idgraph.TestArenaFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class IdGraphTest {

    @Test
    void sortedIdsCarryTheArenaTag() {
        Arena arena = new Arena(7);
        ArenaId compile = arena.add("compile");
        ArenaId test = arena.add("test", compile);
        ArenaId fetch = arena.add("fetch");
        // compile needs fetch, added after the fact
        IdGraph<ArenaId> g = graphOf(arena);
        g.graph().addEdge(fetch.index(), compile.index());

        assertEquals(7, g.tag());
        assertEquals(List.of(fetch, compile, test), g.toposortOrScc().sortedOrThrow());
    }

    @Test
    void cyclesAreReportedAsIds() {
        Arena arena = new Arena(2);
        ArenaId a = arena.add("a");
        ArenaId b = arena.add("b", a);
        arena.add("c", b);
        IdGraph<ArenaId> g = graphOf(arena);
        g.graph().addEdge(b.index(), a.index());

        var cycles = g.toposortOrScc().cyclesOrThrow();
        assertEquals(1, cycles.size());
        assertEquals(2, cycles.get(0).size());
        assertTrue(cycles.get(0).containsAll(List.of(a, b)));
    }

    @Test
    void builderAddsEdgesInBothDirections() {
        Arena arena = new Arena(1);
        ArenaId first = arena.add("first");
        ArenaId second = arena.add("second");
        ArenaId third = arena.add("third");

        IdGraph<ArenaId> g = IdGraph.fromItems(arena.tasks(), Task::id, arenaTc, (builder, task) -> {
            if (builder.id().equals(second)) {
                builder.addInEdge(third);
                builder.addOutEdge(first);
            }
        });

        assertEquals(List.of(third, second, first), g.toposortOrScc().sortedOrThrow());
    }

    @Test
    void emptyItems_sortToNothing() {
        IdGraph<ArenaId> g = graphOf(new Arena(9));
        assertEquals(0, g.tag());
        assertEquals(SortResult.sorted(List.of()), g.toposortOrScc());
    }

    @Test
    void packedIds() {
        long tag = 5L << 32;
        List<Long> items = List.of(tag, tag | 1, tag | 2);
        IdGraph<Long> g = IdGraph.fromItems(items, id -> id, packedTc, (builder, id) -> {
            if (id != tag) builder.addOutEdge(tag);
        });
        assertEquals(List.of(tag | 1, tag | 2, tag), g.toposortOrScc().sortedOrThrow());
    }

    @Test
    void idThatDoesNotMatchItsPosition_isRejected() {
        List<ArenaId> items = List.of(new ArenaId(1, 0), new ArenaId(1, 5));
        var e = assertThrows(IllegalArgumentException.class,
                () -> IdGraph.fromItems(items, id -> id, arenaTc, (builder, id) -> {}));
        assertTrue(e.getMessage().contains("index 5"), e.getMessage());
    }

    @Test
    void idsFromAnotherArena_areRejected() {
        List<ArenaId> items = List.of(new ArenaId(1, 0), new ArenaId(2, 1));
        var e = assertThrows(IllegalArgumentException.class,
                () -> IdGraph.fromItems(items, id -> id, arenaTc, (builder, id) -> {}));
        assertTrue(e.getMessage().contains("tag 2"), e.getMessage());
    }

    @Test
    void edgeToIdOutsideTheArena_isAnIndexFault() {
        Arena arena = new Arena(1);
        arena.add("only", new ArenaId(1, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> graphOf(arena));
    }
}
