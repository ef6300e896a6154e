package com.helia.error;

/**
 * Upstream model failure. {@code contentFiltered} is set when the provider refused the
 * request on content-policy grounds rather than failing technically.
 */
public class ProviderException extends ChatException {

    private final boolean contentFiltered;

    public ProviderException(String message, Throwable cause, boolean contentFiltered) {
        super(ErrorCode.PROVIDER_ERROR, message, cause);
        this.contentFiltered = contentFiltered;
    }

    public ProviderException(String message) {
        this(message, null, false);
    }

    public static ProviderException contentFiltered(String message) {
        return new ProviderException(message, null, true);
    }

    public boolean isContentFiltered() {
        return contentFiltered;
    }
}
