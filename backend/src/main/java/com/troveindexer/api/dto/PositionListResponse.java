package com.troveindexer.api.dto;

import java.util.List;

public record PositionListResponse(List<PositionResponse> items, int count) {
}
