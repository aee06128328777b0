package com.archivist.sync.reconcile;

import java.util.Objects;

/**
 * One side of a potential pairing. Selection and match are edited in place through
 * {@link ReconciliationResult}, which keeps matches symmetric.
 */
public final class ReconciliationRow {
    private final String id;
    private final String name;
    private final String type;
    private final String image;
    private boolean selected = true;
    private String match;

    ReconciliationRow(String id, String name, String type, String image) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.name = name != null ? name : "";
        this.type = type != null ? type : "";
        this.image = image;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getImage() {
        return image;
    }

    public boolean isSelected() {
        return selected;
    }

    /**
     * Id of the matched row on the opposite side, or null.
     */
    public String getMatch() {
        return match;
    }

    public boolean isMatched() {
        return match != null;
    }

    void setSelected(boolean selected) {
        this.selected = selected;
    }

    void setMatch(String match) {
        this.match = match;
    }

    @Override
    public String toString() {
        return "ReconciliationRow{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", selected=" + selected +
                ", match='" + match + '\'' +
                '}';
    }
}
