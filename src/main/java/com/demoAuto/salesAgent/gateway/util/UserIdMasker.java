package com.demoAuto.salesAgent.gateway.util;

/**
 * Utility class for masking user IDs in logs.
 */
public class UserIdMasker {

    private UserIdMasker() {}

    /**
     * Shows first 2 and last 2 characters, masks the middle.
     *
     * @param userId The user ID to mask
     * @return Masked user ID (e.g., "wa****91")
     */
    public static String mask(String userId) {
        if (userId == null || userId.length() <= 4) {
            return "****";
        }
        return userId.substring(0, 2) + "****" + userId.substring(userId.length() - 2);
    }
}
