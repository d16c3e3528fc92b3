package com.livepipe.realtime.api.dto;

import com.livepipe.realtime.model.RecoveryOption;

public record RecoveryOptionResponse(String strategy, String risk, String label, String description) {

    public static RecoveryOptionResponse from(RecoveryOption o) {
        return new RecoveryOptionResponse(
                o.strategy().wireName(),
                o.risk().wireName(),
                o.label(),
                o.description()
        );
    }
}
