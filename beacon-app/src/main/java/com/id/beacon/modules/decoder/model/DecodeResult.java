package com.id.beacon.modules.decoder.model;

import com.id.beacon.model.BeaconTelemetryBatch;
import com.id.beacon.model.BeaconTelemetryDialect;

/**
 * Outcome of one dialect decoder: either a batch or the reason the dialect does not apply.
 */
public sealed interface DecodeResult permits DecodeResult.Success, DecodeResult.Failure {

    boolean isSuccess();

    static DecodeResult success(BeaconTelemetryBatch batch) {
        return new Success(batch);
    }

    static DecodeResult failure(BeaconTelemetryDialect dialect, String reason) {
        return new Failure(dialect, reason);
    }

    record Success(BeaconTelemetryBatch batch) implements DecodeResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(BeaconTelemetryDialect dialect, String reason) implements DecodeResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        public String describe() {
            return "%s: %s".formatted(dialect, reason);
        }
    }
}
