package com.portfoliosync.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * The broker's position response: {@code net} is the consolidated view (overnight plus
 * today), {@code day} holds today's intraday activity only.
 */
@Getter
@Builder
public class PositionBook {

    @Builder.Default
    private final List<Position> net = List.of();

    @Builder.Default
    private final List<Position> day = List.of();
}
