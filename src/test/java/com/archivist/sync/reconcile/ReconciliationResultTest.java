package com.archivist.sync.reconcile;

import com.archivist.sync.remote.RemoteEntity;
import com.archivist.sync.remote.RemoteSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationResultTest {

    private ReconciliationResult result;

    @BeforeEach
    void setUp() {
        RemoteSnapshot remote = new RemoteSnapshot("c-1",
                List.of(RemoteEntity.character("r-a", "Aria", "PC"), RemoteEntity.character("r-b", "Bran", "PC")),
                null, null, null, null, null);
        LocalSnapshot local = new LocalSnapshot(List.of(
                new ReconciliationCandidate("actor-a", "Aria", "character", null),
                new ReconciliationCandidate("actor-b", "Bran", "character", null),
                new ReconciliationCandidate("actor-c", "Cato", "character", null)), null, null);
        result = new ReconciliationEngine().reconcile(remote, local);
    }

    private ReconciliationRow row(Side side, String id) {
        return result.find(Category.CHARACTERS, side, id).orElseThrow();
    }

    @Test
    @DisplayName("Rows should start selected")
    void testDefaultSelection() {
        assertTrue(result.rows(Category.CHARACTERS, Side.REMOTE).stream().allMatch(ReconciliationRow::isSelected));
        assertTrue(result.rows(Category.CHARACTERS, Side.LOCAL).stream().allMatch(ReconciliationRow::isSelected));
    }

    @Test
    @DisplayName("Toggling a matched row should toggle its partner")
    void testTogglePropagates() {
        result.toggleSelected(Category.CHARACTERS, Side.REMOTE, "r-a", false);

        assertFalse(row(Side.REMOTE, "r-a").isSelected());
        assertFalse(row(Side.LOCAL, "actor-a").isSelected());
        assertTrue(row(Side.LOCAL, "actor-c").isSelected());
    }

    @Test
    @DisplayName("Re-pointing a match should clear both displaced partners")
    void testChangeMatchDisplaces() {
        result.changeMatch(Category.CHARACTERS, Side.REMOTE, "r-a", "actor-b");

        assertEquals("actor-b", row(Side.REMOTE, "r-a").getMatch());
        assertEquals("r-a", row(Side.LOCAL, "actor-b").getMatch());
        assertNull(row(Side.LOCAL, "actor-a").getMatch());
        assertNull(row(Side.REMOTE, "r-b").getMatch());
        result.verifySymmetry();
    }

    @Test
    @DisplayName("Changing a match from the local side should work the same way")
    void testChangeMatchFromLocal() {
        result.changeMatch(Category.CHARACTERS, Side.LOCAL, "actor-c", "r-a");

        assertEquals("r-a", row(Side.LOCAL, "actor-c").getMatch());
        assertEquals("actor-c", row(Side.REMOTE, "r-a").getMatch());
        assertFalse(row(Side.LOCAL, "actor-a").isMatched());
        result.verifySymmetry();
    }

    @Test
    @DisplayName("A null match should unmatch both rows")
    void testUnmatch() {
        result.changeMatch(Category.CHARACTERS, Side.LOCAL, "actor-a", null);

        assertNull(row(Side.LOCAL, "actor-a").getMatch());
        assertNull(row(Side.REMOTE, "r-a").getMatch());
        assertEquals(1, result.get(Category.CHARACTERS).matchedCount());
    }

    @Test
    @DisplayName("Unknown ids should be rejected without side effects")
    void testUnknownIds() {
        assertThrows(IllegalArgumentException.class,
                () -> result.changeMatch(Category.CHARACTERS, Side.REMOTE, "r-a", "actor-zzz"));
        assertThrows(IllegalArgumentException.class,
                () -> result.toggleSelected(Category.CHARACTERS, Side.LOCAL, "nope", false));

        assertEquals("actor-a", row(Side.REMOTE, "r-a").getMatch());
    }

    @Test
    @DisplayName("selectNone and selectAll should cover a whole side")
    void testSelectAllNone() {
        result.selectNone(Category.CHARACTERS, Side.LOCAL);

        assertTrue(result.rows(Category.CHARACTERS, Side.LOCAL).stream().noneMatch(ReconciliationRow::isSelected));
        assertFalse(row(Side.REMOTE, "r-a").isSelected());

        result.selectAll(Category.CHARACTERS, Side.LOCAL);

        assertTrue(result.rows(Category.CHARACTERS, Side.REMOTE).stream().allMatch(ReconciliationRow::isSelected));
    }
}
