/* (C)2026 */
package com.ammann.reflectometry.properties;

import java.util.List;
import java.util.Map;

/**
 * Device and column names used by the reflectometer's data acquisition.
 *
 * <p>Both metadata providers resolve scan columns and instrument entries through these
 * names, so a renamed device only needs to be changed here.
 */
public final class InstrumentProperties {

    private InstrumentProperties() {}

    /** Name of the position-sensitive detector channel delivering 2D frames. */
    public static final String AREA_DETECTOR = "2Ddata";

    /** Scan axis holding the incident angle. */
    public static final String INCIDENT_ANGLE_AXIS = "theta";

    /** Monitor counter column. */
    public static final String MONITOR_DETECTOR = "mon1";

    /** Exposure time column. */
    public static final String TIME_DETECTOR = "timer";

    /** Metadata entry holding the monochromator wavelength. */
    public static final String WAVELENGTH_DEVICE = "wavelength";

    /** Default facility written into the experiment header. */
    public static final String FACILITY = "Helmholtz-Zentrum Berlin";

    /** Default affiliation of the data owner. */
    public static final String DEFAULT_AFFILIATION = "Helmholtz-Zentrum Berlin";

    /**
     * Collimation slits, ordered from the source towards the sample.
     */
    public static final class Slits {
        private Slits() {}

        public static final String FIRST = "slit1";
        public static final String SECOND = "slit2";
    }

    /**
     * Spin-manipulating devices and the device states encoding each spin symbol.
     */
    public static final class Polarisation {
        private Polarisation() {}

        /** Polariser flipper first, analyser flipper second. */
        public static final List<String> DEVICES = List.of("pflipper", "aflipper");

        /** Symbol used in channel codes for a device that takes no part in the scan. */
        public static final char ABSENT = 'o';

        public static final Map<Character, String> STATES = Map.of('p', "off", 'm', "on");
    }
}
