package com.dpp.audit.crypto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

/**
 * One level of an inclusion proof: the sibling hash and which side of the
 * running hash it sits on.
 */
@Value
public class ProofStep {

    String sibling;
    Side side;

    public static ProofStep left(String sibling) {
        return new ProofStep(sibling, Side.LEFT);
    }

    public static ProofStep right(String sibling) {
        return new ProofStep(sibling, Side.RIGHT);
    }

    public enum Side {
        LEFT("left"),
        RIGHT("right");

        private final String wireName;

        Side(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }

        @JsonCreator
        public static Side fromWireName(String name) {
            for (Side side : values()) {
                if (side.wireName.equalsIgnoreCase(name)) {
                    return side;
                }
            }
            throw new IllegalArgumentException("Unknown proof side: " + name);
        }
    }
}
