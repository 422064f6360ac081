package com.portfoliosync.mapper;

import com.portfoliosync.api.dto.response.HoldingResponse;
import com.portfoliosync.api.dto.response.MarginResponse;
import com.portfoliosync.api.dto.response.PositionResponse;
import com.portfoliosync.entity.HoldingEntity;
import com.portfoliosync.entity.MarginEntity;
import com.portfoliosync.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** MapStruct mapper from stored snapshot rows to API responses. */
@Mapper
public interface SnapshotResponseMapper {

    @Mapping(source = "createdAt", target = "syncedAt")
    HoldingResponse toHoldingResponse(HoldingEntity entity);

    List<HoldingResponse> toHoldingResponses(List<HoldingEntity> entities);

    @Mapping(source = "createdAt", target = "syncedAt")
    PositionResponse toPositionResponse(PositionEntity entity);

    List<PositionResponse> toPositionResponses(List<PositionEntity> entities);

    MarginResponse toMarginResponse(MarginEntity entity);
}
