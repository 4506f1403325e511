package com.salesagent.leads.service;

/**
 * E.164 normalisation for outbound dialling.
 *
 * Only applied at call time; stored phone numbers keep the producer's formatting.
 */
public final class PhoneNumbers {

    private PhoneNumbers() {
    }

    /**
     * @throws IllegalArgumentException when the number cannot be dialled
     */
    public static String toE164(String phone) {
        if (phone == null || phone.isBlank()) {
            throw new IllegalArgumentException("phone number is missing");
        }
        String digits = phone.replaceAll("\\D", "");
        if (digits.startsWith("00")) {
            // international access prefix
            digits = digits.substring(2);
        }

        if (digits.length() < 10) {
            throw new IllegalArgumentException(
                    "Invalid phone number length: " + digits.length() + " digits, at least 10 required");
        }
        if (digits.length() == 12 && digits.startsWith("91")) {
            return "+" + digits;
        }
        if (digits.length() == 11 && digits.startsWith("1")) {
            return northAmerican(digits.substring(1));
        }
        if (digits.length() == 10) {
            return northAmerican(digits);
        }
        if (digits.length() <= 15) {
            if (digits.charAt(0) == '0') {
                throw new IllegalArgumentException(
                        "Phone number " + phone.trim() + " has a trunk prefix and no country code");
            }
            return "+" + digits;
        }
        throw new IllegalArgumentException(
                "Invalid phone number length: " + digits.length() + " digits, expected 10-15");
    }

    private static String northAmerican(String tenDigits) {
        char areaStart = tenDigits.charAt(0);
        if (areaStart == '0' || areaStart == '1') {
            throw new IllegalArgumentException(
                    "Invalid US area code " + tenDigits.substring(0, 3) + ": cannot start with 0 or 1");
        }
        return "+1" + tenDigits;
    }
}
