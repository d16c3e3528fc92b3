package com.livepipe.realtime.api.dto;

/** Request body for POST /api/demo/elt/recovery: {"strategy": "retry" | "skip" | "restart"}. */
public record RecoveryRequest(String strategy) {}
