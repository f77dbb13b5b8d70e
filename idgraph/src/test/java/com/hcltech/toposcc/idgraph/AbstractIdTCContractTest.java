package com.hcltech.toposcc.idgraph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public abstract class AbstractIdTCContractTest<Id> {

    protected abstract IdTC<Id> tc();

    @Test
    public void newId_roundTripsTagAndIndex() {
        for (int tag : new int[]{0, 1, 7, 1000}) {
            for (int index : new int[]{0, 1, 42, 65_536}) {
                Id id = tc().newId(tag, index);
                assertEquals(index, tc().index(id));
                assertEquals(tag, tc().tag(id));
            }
        }
    }

    @Test
    public void newId_isStable() {
        assertEquals(tc().newId(3, 5), tc().newId(3, 5));
    }

    @Test
    public void differentIndexOrTag_givesDifferentIds() {
        assertNotEquals(tc().newId(3, 5), tc().newId(3, 6));
        assertNotEquals(tc().newId(3, 5), tc().newId(4, 5));
    }
}
