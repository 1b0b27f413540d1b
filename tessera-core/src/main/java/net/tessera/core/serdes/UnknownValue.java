package net.tessera.core.serdes;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Stand-in for a tagged value whose tag this process does not know. Re-encodes to the payload it was read from.
 */
public record UnknownValue(String tag, ObjectNode raw) {
    public UnknownValue {
        raw = raw.deepCopy();
    }
}
