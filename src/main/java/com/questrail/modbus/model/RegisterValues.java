package com.questrail.modbus.model;

import java.util.Arrays;

/**
 * RegisterValues
 * -----------------------------------------------------------------------------
 * Typed register data decoded from a successful read response.
 *
 * <p>Coils and discrete inputs decode to {@link BitRegisters}; holding and
 * input registers decode to {@link WordRegisters}. Either way the value count
 * equals the quantity of the originating request, and index {@code 0} is the
 * register at the request's starting address.</p>
 */
public sealed interface RegisterValues
        permits RegisterValues.BitRegisters, RegisterValues.WordRegisters
{
    /** Number of decoded registers. */
    int size();

    /** Ordered single-bit register values. */
    final class BitRegisters implements RegisterValues {
        private final boolean[] values;

        public BitRegisters(boolean[] values) {
            this.values = values.clone();
        }

        @Override
        public int size() {
            return values.length;
        }

        public boolean get(int index) {
            return values[index];
        }

        public boolean[] toArray() {
            return values.clone();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BitRegisters that)) return false;
            return Arrays.equals(values, that.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "BitRegisters" + Arrays.toString(values);
        }
    }

    /** Ordered unsigned 16-bit register values (0–65535). */
    final class WordRegisters implements RegisterValues {
        private final int[] values;

        public WordRegisters(int[] values) {
            this.values = values.clone();
        }

        @Override
        public int size() {
            return values.length;
        }

        public int get(int index) {
            return values[index];
        }

        public int[] toArray() {
            return values.clone();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof WordRegisters that)) return false;
            return Arrays.equals(values, that.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "WordRegisters" + Arrays.toString(values);
        }
    }
}
