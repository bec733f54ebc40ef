package com.nosota.bankrec.mapper;

import com.nosota.bankrec.api.dto.BankTransactionDTO;
import com.nosota.bankrec.api.response.ReconciliationItemsResponse;
import com.nosota.bankrec.dto.TransactionPartition;
import com.nosota.bankrec.model.BankTransaction;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for BankTransaction entity to BankTransactionDTO conversion.
 */
@Mapper
public interface BankTransactionMapper {

    BankTransactionMapper INSTANCE = Mappers.getMapper(BankTransactionMapper.class);

    BankTransactionDTO toDTO(BankTransaction transaction);

    List<BankTransactionDTO> toDTOList(List<BankTransaction> transactions);

    /**
     * Maps a statement/system partition to the items response, element by element.
     *
     * @param partition Partitioned transactions
     * @return Items response
     */
    ReconciliationItemsResponse toItemsResponse(TransactionPartition partition);
}
