/* (C)2026 */
package com.ammann.reflectometry.provider;

import com.ammann.reflectometry.enumeration.PolarizationState;
import com.ammann.reflectometry.properties.InstrumentProperties;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives polarization channels from the scan devices and selects the scan rows
 * belonging to a channel.
 */
public final class PolarisationChannels {

    private static final char[] SPIN_SYMBOLS = {'m', 'p'};

    private PolarisationChannels() {}

    /**
     * Returns the channels measurable with the given scan devices.
     *
     * <p>Every spin device present contributes the symbols {@code m} and {@code p}, an
     * absent device the symbol {@code o}; the code {@code oo} is not a channel. Without
     * any spin device the scan has the single channel {@link PolarizationState#UNPOLARIZED}.
     *
     * @param scanDevices devices of the scan
     * @return channels in declaration order of {@link PolarizationState}, never empty
     */
    public static List<PolarizationState> channels(List<String> scanDevices) {
        List<String> codes = new ArrayList<>();
        codes.add("");
        for (String device : InstrumentProperties.Polarisation.DEVICES) {
            boolean present = scanDevices.contains(device);
            List<String> extended = new ArrayList<>();
            for (String prefix : codes) {
                if (present) {
                    for (char symbol : SPIN_SYMBOLS) {
                        extended.add(prefix + symbol);
                    }
                } else {
                    extended.add(prefix + InstrumentProperties.Polarisation.ABSENT);
                }
            }
            codes = extended;
        }

        Set<PolarizationState> states = EnumSet.noneOf(PolarizationState.class);
        String allAbsent = String.valueOf(InstrumentProperties.Polarisation.ABSENT).repeat(
                InstrumentProperties.Polarisation.DEVICES.size());
        for (String code : codes) {
            if (!code.equals(allAbsent)) {
                states.add(PolarizationState.fromCode(code));
            }
        }
        return states.isEmpty() ? List.of(PolarizationState.UNPOLARIZED) : List.copyOf(states);
    }

    /**
     * Spin devices of {@link InstrumentProperties.Polarisation#DEVICES} present in the scan,
     * in device order.
     */
    public static List<String> presentDevices(List<String> scanDevices) {
        return InstrumentProperties.Polarisation.DEVICES.stream()
                .filter(scanDevices::contains)
                .toList();
    }

    /**
     * Marks the rows that belong to a channel.
     *
     * <p>Each non-{@code o} symbol of the channel code is compared, in order, with the
     * state of the corresponding present spin device. The unpolarized channel selects
     * every row.
     *
     * @param deviceStates states of the present spin devices, one list per device in
     *                     device order, each holding one entry per scan row
     * @param rows         number of scan rows
     * @param state        channel to select
     * @return row mask
     */
    public static boolean[] rowMask(List<List<String>> deviceStates, int rows, PolarizationState state) {
        boolean[] mask = new boolean[rows];
        Arrays.fill(mask, true);
        if (state.isUnpolarized()) {
            return mask;
        }

        Map<Character, String> symbolStates = InstrumentProperties.Polarisation.STATES;
        List<String> expected = new ArrayList<>();
        for (char symbol : state.getCode().toCharArray()) {
            if (symbol != InstrumentProperties.Polarisation.ABSENT) {
                expected.add(symbolStates.get(symbol));
            }
        }

        for (int device = 0; device < expected.size() && device < deviceStates.size(); device++) {
            List<String> column = deviceStates.get(device);
            String wanted = expected.get(device);
            for (int row = 0; row < rows; row++) {
                mask[row] &= wanted.equals(column.get(row).trim());
            }
        }
        return mask;
    }

    /** Keeps the values of the selected rows. */
    public static double[] filter(double[] values, boolean[] mask) {
        int selected = count(mask);
        double[] result = new double[selected];
        int target = 0;
        for (int i = 0; i < values.length; i++) {
            if (mask[i]) {
                result[target++] = values[i];
            }
        }
        return result;
    }

    /** Keeps the frames of the selected rows. */
    public static double[][][] filter(double[][][] frames, boolean[] mask) {
        double[][][] result = new double[count(mask)][][];
        int target = 0;
        for (int i = 0; i < frames.length; i++) {
            if (mask[i]) {
                result[target++] = frames[i];
            }
        }
        return result;
    }

    private static int count(boolean[] mask) {
        int selected = 0;
        for (boolean row : mask) {
            if (row) {
                selected++;
            }
        }
        return selected;
    }
}
