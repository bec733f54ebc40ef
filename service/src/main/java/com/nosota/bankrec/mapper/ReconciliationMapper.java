package com.nosota.bankrec.mapper;

import com.nosota.bankrec.api.dto.ReconciliationHistoryDTO;
import com.nosota.bankrec.api.response.ReconciliationResponse;
import com.nosota.bankrec.api.response.ReconciliationSummaryResponse;
import com.nosota.bankrec.dto.ReconciliationSummary;
import com.nosota.bankrec.model.Reconciliation;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for Reconciliation entity and summary conversions.
 */
@Mapper
public interface ReconciliationMapper {

    ReconciliationMapper INSTANCE = Mappers.getMapper(ReconciliationMapper.class);

    ReconciliationResponse toResponse(Reconciliation reconciliation);

    ReconciliationHistoryDTO toHistoryDTO(Reconciliation reconciliation);

    List<ReconciliationHistoryDTO> toHistoryDTOList(List<Reconciliation> reconciliations);

    ReconciliationSummaryResponse toSummaryResponse(ReconciliationSummary summary);
}
