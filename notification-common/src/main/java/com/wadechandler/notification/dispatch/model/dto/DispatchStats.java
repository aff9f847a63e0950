package com.wadechandler.notification.dispatch.model.dto;

/**
 * Outcome counts of one dispatch batch. {@code skipped} counts rows this dispatcher did not finish.
 */
public record DispatchStats(int attempted, int sent, int failed, int skipped) {

    public static DispatchStats empty() {
        return new DispatchStats(0, 0, 0, 0);
    }
}
