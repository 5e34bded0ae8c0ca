package com.governorHq.llmGateway.gateway.util;

/**
 * Utility class for masking client identities (origin addresses) in logs.
 */
public class ClientIdMasker {

    private ClientIdMasker() {
    }

    /**
     * Masks a client identity for logging.
     * Shows first 2 and last 2 characters, masks the middle.
     *
     * @param clientId The identity to mask
     * @return Masked identity (e.g., "10****42")
     */
    public static String mask(String clientId) {
        if (clientId == null || clientId.length() <= 4) {
            return "****";
        }
        return clientId.substring(0, 2) + "****" + clientId.substring(clientId.length() - 2);
    }
}
