package com.deepansh.trader.solana;

import java.math.BigInteger;
import java.util.Arrays;

/** Bitcoin-alphabet base58, used for Solana keys and signatures. */
public final class Base58 {

    private static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
    private static final BigInteger BASE = BigInteger.valueOf(58);
    private static final int[] INDEXES = new int[128];

    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET.length(); i++) {
            INDEXES[ALPHABET.charAt(i)] = i;
        }
    }

    private Base58() {}

    public static String encode(byte[] input) {
        int leadingZeros = 0;
        while (leadingZeros < input.length && input[leadingZeros] == 0) leadingZeros++;

        StringBuilder sb = new StringBuilder();
        BigInteger value = new BigInteger(1, input);
        while (value.signum() > 0) {
            BigInteger[] divRem = value.divideAndRemainder(BASE);
            sb.append(ALPHABET.charAt(divRem[1].intValue()));
            value = divRem[0];
        }
        for (int i = 0; i < leadingZeros; i++) sb.append('1');
        return sb.reverse().toString();
    }

    /**
     * @throws IllegalArgumentException on a character outside the alphabet
     */
    public static byte[] decode(String input) {
        if (input.isEmpty()) return new byte[0];

        BigInteger value = BigInteger.ZERO;
        for (char c : input.toCharArray()) {
            int digit = c < 128 ? INDEXES[c] : -1;
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid base58 character '" + c + "'");
            }
            value = value.multiply(BASE).add(BigInteger.valueOf(digit));
        }

        int leadingOnes = 0;
        while (leadingOnes < input.length() && input.charAt(leadingOnes) == '1') leadingOnes++;

        byte[] magnitude = value.toByteArray();
        // BigInteger may prepend a sign byte
        int strip = magnitude.length > 1 && magnitude[0] == 0 ? 1 : 0;
        if (value.signum() == 0) strip = magnitude.length;

        byte[] out = new byte[leadingOnes + magnitude.length - strip];
        System.arraycopy(magnitude, strip, out, leadingOnes, magnitude.length - strip);
        return out;
    }
}
