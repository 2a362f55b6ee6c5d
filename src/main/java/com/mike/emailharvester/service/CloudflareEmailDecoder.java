package com.mike.emailharvester.service;

public class CloudflareEmailDecoder {

    /**
     * First byte is the XOR key, the rest are the XORed characters. Null for malformed payloads.
     */
    public static String decode(String cfemail) {
        if (cfemail == null) return null;

        String hex = cfemail.trim();
        if (hex.length() < 4 || hex.length() % 2 != 0) return null;

        try {
            int r = Integer.parseInt(hex.substring(0, 2), 16);
            StringBuilder email = new StringBuilder();

            for (int n = 2; n < hex.length(); n += 2) {
                int c = Integer.parseInt(hex.substring(n, n + 2), 16) ^ r;
                email.append((char) c);
            }
            return email.toString();
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
