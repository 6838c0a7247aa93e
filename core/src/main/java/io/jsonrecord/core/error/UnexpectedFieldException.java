package io.jsonrecord.core.error;

import java.util.List;

/** Thrown when input carries keys the record type does not declare and its policy is to reject them. */
public final class UnexpectedFieldException extends RecordInputException {

    private static final long serialVersionUID = 1L;

    public UnexpectedFieldException(String typeName, List<String> keys) {
        super("Unexpected field" + (keys.size() > 1 ? "s" : "") + " " + keys + " not allowed in " + typeName + ".",
                typeName,
                keys);
    }
}
