package com.archivist.sync.reset;

public record ResetResult(int recordsCleared, int sheetsRemoved) {

    public boolean isNoOp() {
        return recordsCleared == 0 && sheetsRemoved == 0;
    }
}
