package com.marketscan.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Body of POST /api/engine/start. A missing or blank userId starts in simulation mode.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class EngineStartRequest {

    private String userId;
}
