package com.dataPlatform.platformFacade.util;

/**
 * Reads prize money out of competition reward strings.
 */
public final class PrizeAmounts {

    private PrizeAmounts() {
    }

    /**
     * Parses rewards like "$25,000 Usd"; anything else (e.g. "Knowledge", "Swag") is worth 0.
     *
     * @param reward Reward text, may be null
     * @return Amount in dollars
     */
    public static long parse(String reward) {
        if (reward == null || !reward.contains("Usd")) {
            return 0;
        }
        String digits = reward.replace("$", "").replace(",", "").replace(" Usd", "").trim();
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            return 0;
        }
        return Long.parseLong(digits);
    }
}
