package org.peerdisco.util;

public class ArrayOps {

    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    public static String bytesToHex(byte[] data) {
        char[] res = new char[data.length * 2];
        for (int i=0; i < data.length; i++) {
            res[2*i] = HEX_DIGITS[(data[i] >> 4) & 0xF];
            res[2*i + 1] = HEX_DIGITS[data[i] & 0xF];
        }
        return new String(res);
    }

    /**
     * @throws NumberFormatException if {@code hex} has an odd length or a character that isn't a hex digit
     */
    public static byte[] hexToBytes(String hex) {
        if (hex.length() % 2 != 0)
            throw new NumberFormatException("Odd length hex string: " + hex);
        byte[] res = new byte[hex.length()/2];
        for (int i=0; i < res.length; i++)
            res[i] = (byte) ((digit(hex, 2*i) << 4) | digit(hex, 2*i + 1));
        return res;
    }

    private static int digit(String hex, int index) {
        int d = Character.digit(hex.charAt(index), 16);
        if (d < 0)
            throw new NumberFormatException("Invalid hex character '" + hex.charAt(index) + "' at " + index);
        return d;
    }
}
