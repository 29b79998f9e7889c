package com.id.beacon.modules.decoder.logic;

import com.id.beacon.model.BeaconTelemetryDialect;
import com.id.beacon.modules.decoder.model.DecodeResult;
import com.id.beacon.modules.decoder.model.TelemetrySignal;

/**
 * A pure transform from an (already decompressed) payload to canonical records. Implementations must
 * not throw on malformed input; they report it as a {@link DecodeResult.Failure}.
 */
public interface TelemetryDialectDecoder {

    BeaconTelemetryDialect dialect();

    DecodeResult decode(byte[] payload, TelemetrySignal signal);

}
