package com.vidnyan.storygraph.domain.model;

/**
 * A jump or call found in script text.
 * Columns are 0-based offsets into the line, end exclusive.
 */
public record Transfer(
    String unitId,
    String target,
    TransferKind kind,
    boolean dynamic,
    int line,
    int columnStart,
    int columnEnd
) {

    public enum TransferKind {
        JUMP,
        CALL;

        public static TransferKind fromKeyword(String keyword) {
            return "call".equals(keyword) ? CALL : JUMP;
        }
    }
}
