package com.chatgames.arena.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

/** 盤外の座標はエンジン側で INVALID_POSITION として拒否する。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MemoryMoveRequest(
    @NotNull Integer firstRow,
    @NotNull Integer firstCol,
    @NotNull Integer secondRow,
    @NotNull Integer secondCol) {}
