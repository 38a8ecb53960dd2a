package com.hubbridge.protocol.local;

import com.hubbridge.protocol.PairingCodes;

import java.security.SecureRandom;
import java.util.Set;

/**
 * Builds the QR payload ({@code MT:} + base-38) and the 11-digit manual pairing code with its Verhoeff check digit.
 */
public final class PairingCodeGenerator {

    private static final String BASE38 = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ-.";
    private static final int RENDEZVOUS_ON_NETWORK = 4;
    private static final int MAX_PASSCODE = 99_999_998;
    private static final Set<Integer> INVALID_PASSCODES = Set.of(
            0, 11111111, 22222222, 33333333, 44444444, 55555555, 66666666, 77777777, 88888888, 99999999,
            12345678, 87654321);

    private static final int[][] VERHOEFF_D = {
            {0, 1, 2, 3, 4, 5, 6, 7, 8, 9},
            {1, 2, 3, 4, 0, 6, 7, 8, 9, 5},
            {2, 3, 4, 0, 1, 7, 8, 9, 5, 6},
            {3, 4, 0, 1, 2, 8, 9, 5, 6, 7},
            {4, 0, 1, 2, 3, 9, 5, 6, 7, 8},
            {5, 9, 8, 7, 6, 0, 4, 3, 2, 1},
            {6, 5, 9, 8, 7, 1, 0, 4, 3, 2},
            {7, 6, 5, 9, 8, 2, 1, 0, 4, 3},
            {8, 7, 6, 5, 9, 3, 2, 1, 0, 4},
            {9, 8, 7, 6, 5, 4, 3, 2, 1, 0}};
    private static final int[][] VERHOEFF_P = {
            {0, 1, 2, 3, 4, 5, 6, 7, 8, 9},
            {1, 5, 7, 6, 2, 8, 3, 0, 9, 4},
            {5, 8, 0, 3, 7, 9, 6, 1, 4, 2},
            {8, 9, 1, 6, 0, 4, 3, 5, 2, 7},
            {9, 4, 5, 3, 1, 2, 6, 8, 7, 0},
            {4, 2, 8, 6, 5, 7, 3, 9, 0, 1},
            {2, 7, 9, 3, 8, 0, 6, 4, 1, 5},
            {7, 0, 4, 6, 9, 1, 3, 2, 5, 8}};
    private static final int[] VERHOEFF_INV = {0, 4, 3, 2, 1, 5, 6, 7, 8, 9};

    private final SecureRandom random = new SecureRandom();

    public PairingCodes generate(int vendorId, int productId, Integer passcode, Integer discriminator) {
        int pin = passcode != null ? passcode : randomPasscode();
        if (!isValidPasscode(pin)) {
            throw new IllegalArgumentException("Invalid passcode: " + pin);
        }
        int disc = discriminator != null ? discriminator : random.nextInt(0x1000);
        if (disc < 0 || disc > 0xfff) {
            throw new IllegalArgumentException("Discriminator out of range: " + disc);
        }
        return new PairingCodes(qrCode(vendorId, productId, pin, disc), manualCode(pin, disc), pin, disc);
    }

    public static boolean isValidPasscode(int passcode) {
        return passcode >= 1 && passcode <= MAX_PASSCODE && !INVALID_PASSCODES.contains(passcode);
    }

    private int randomPasscode() {
        int pin;
        do {
            pin = 1 + random.nextInt(MAX_PASSCODE);
        } while (!isValidPasscode(pin));
        return pin;
    }

    static String manualCode(int passcode, int discriminator) {
        int shortDiscriminator = discriminator >> 8;
        int chunk1 = shortDiscriminator >> 2;
        int chunk2 = ((shortDiscriminator & 0x3) << 14) | (passcode & 0x3fff);
        int chunk3 = passcode >> 14;
        String digits = String.format("%01d%05d%04d", chunk1, chunk2, chunk3);
        return digits + verhoeff(digits);
    }

    static int verhoeff(String digits) {
        int c = 0;
        for (int i = 0; i < digits.length(); i++) {
            int digit = digits.charAt(digits.length() - 1 - i) - '0';
            c = VERHOEFF_D[c][VERHOEFF_P[(i + 1) % 8][digit]];
        }
        return VERHOEFF_INV[c];
    }

    static String qrCode(int vendorId, int productId, int passcode, int discriminator) {
        byte[] payload = new byte[11];
        int offset = 0;
        offset = pack(payload, offset, 0, 3);
        offset = pack(payload, offset, vendorId, 16);
        offset = pack(payload, offset, productId, 16);
        offset = pack(payload, offset, 0, 2);
        offset = pack(payload, offset, RENDEZVOUS_ON_NETWORK, 8);
        offset = pack(payload, offset, discriminator, 12);
        offset = pack(payload, offset, passcode, 27);
        pack(payload, offset, 0, 4);
        return "MT:" + base38(payload);
    }

    private static int pack(byte[] buffer, int offset, long value, int bits) {
        for (int i = 0; i < bits; i++) {
            if (((value >> i) & 1) == 1) {
                int bit = offset + i;
                buffer[bit / 8] |= (byte) (1 << (bit % 8));
            }
        }
        return offset + bits;
    }

    static String base38(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < bytes.length; i += 3) {
            int remaining = Math.min(3, bytes.length - i);
            long value = 0;
            for (int j = 0; j < remaining; j++) {
                value |= (long) (bytes[i + j] & 0xff) << (8 * j);
            }
            int chars = remaining == 3 ? 5 : remaining == 2 ? 4 : 2;
            for (int k = 0; k < chars; k++) {
                sb.append(BASE38.charAt((int) (value % 38)));
                value /= 38;
            }
        }
        return sb.toString();
    }
}
