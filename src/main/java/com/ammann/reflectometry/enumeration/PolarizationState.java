/* (C)2026 */
package com.ammann.reflectometry.enumeration;

import java.util.Arrays;

/**
 * Spin-manipulation configuration of the beam for one reduced channel.
 *
 * <p>The two-letter code names the polariser flipper state first and the analyser
 * flipper state second: {@code p} flipper off (spin up), {@code m} flipper on
 * (spin down), {@code o} device not present. {@link #UNPOLARIZED} is used when no
 * spin device takes part in the scan.
 */
public enum PolarizationState {
    UNPOLARIZED("unpolarized"),
    PO("po"),
    MO("mo"),
    OP("op"),
    OM("om"),
    MM("mm"),
    MP("mp"),
    PM("pm"),
    PP("pp");

    private final String code;

    PolarizationState(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isUnpolarized() {
        return this == UNPOLARIZED;
    }

    /**
     * Resolves a channel from its code.
     *
     * @param code channel code such as {@code "pm"} or {@code "unpolarized"}
     * @return the matching state
     * @throws IllegalArgumentException if no channel carries the code
     */
    public static PolarizationState fromCode(String code) {
        return Arrays.stream(values())
                .filter(state -> state.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown polarization code: " + code));
    }
}
